package kanban.order;

import kanban.ErrorKind;
import kanban.KanbanException;

/**
 * Signals that no order key is free between two neighbors. The mutation engine catches
 * it, rebalances the collection and retries; it never reaches a client.
 */
public final class NeedsRebalanceException extends KanbanException {
  private final Long previousKey;
  private final Long nextKey;

  public NeedsRebalanceException(Long previousKey, Long nextKey) {
    super(ErrorKind.NEEDS_REBALANCE,
        "No order key available between " + previousKey + " and " + nextKey);
    this.previousKey = previousKey;
    this.nextKey = nextKey;
  }

  public Long previousKey() {
    return previousKey;
  }

  public Long nextKey() {
    return nextKey;
  }
}
