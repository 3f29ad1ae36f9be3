package kanban.order;

/**
 * The items immediately before and after a slot in a collection. Either side is
 * {@code null} at the collection's edges.
 */
public record Neighbors(OrderedItem previous, OrderedItem next) {

  public static final Neighbors NONE = new Neighbors(null, null);

  public Long previousKey() {
    return previous == null ? null : previous.orderKey();
  }

  public Long nextKey() {
    return next == null ? null : next.orderKey();
  }

  /**
   * Returns {@code true} if {@code key} already sorts strictly between the two neighbors.
   */
  public boolean admits(long key) {
    return (previous == null || previous.orderKey() < key)
        && (next == null || key < next.orderKey());
  }
}
