package kanban.order;

import java.util.Objects;

/**
 * Where to place an item in its target collection.
 *
 * <p>Anchored positions name an existing sibling; the anchor must belong to the target
 * collection at the time the mutation runs, otherwise the mutation fails with
 * {@link kanban.InvalidPositionException} instead of falling back to the end.
 */
public sealed interface Position
    permits Position.AtStart, Position.AtEnd, Position.Before, Position.After {

  static Position atStart() {
    return AtStart.INSTANCE;
  }

  static Position atEnd() {
    return AtEnd.INSTANCE;
  }

  static Position before(String anchorId) {
    return new Before(anchorId);
  }

  static Position after(String anchorId) {
    return new After(anchorId);
  }

  /** First in the collection. */
  final class AtStart implements Position {
    private static final AtStart INSTANCE = new AtStart();

    private AtStart() {}

    @Override
    public String toString() {
      return "AtStart";
    }
  }

  /** Last in the collection. */
  final class AtEnd implements Position {
    private static final AtEnd INSTANCE = new AtEnd();

    private AtEnd() {}

    @Override
    public String toString() {
      return "AtEnd";
    }
  }

  /** Immediately before {@code anchorId}. */
  record Before(String anchorId) implements Position {
    public Before {
      Objects.requireNonNull(anchorId, "anchorId");
    }
  }

  /** Immediately after {@code anchorId}. */
  record After(String anchorId) implements Position {
    public After {
      Objects.requireNonNull(anchorId, "anchorId");
    }
  }
}
