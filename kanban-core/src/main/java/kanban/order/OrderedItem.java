package kanban.order;

import java.util.Objects;

/**
 * An item's id and its current order key, as read from the store.
 */
public record OrderedItem(String id, long orderKey) {
  public OrderedItem {
    Objects.requireNonNull(id, "id");
  }
}
