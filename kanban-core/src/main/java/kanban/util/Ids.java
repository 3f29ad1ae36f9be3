package kanban.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Entity id generation. Ids are monotonic ULIDs, so ids created by one process sort by
 * creation time.
 */
public final class Ids {

  private Ids() {}

  public static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
