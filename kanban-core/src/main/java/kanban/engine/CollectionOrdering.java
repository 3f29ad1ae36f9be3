package kanban.engine;

import kanban.ConflictException;
import kanban.InvalidPositionException;
import kanban.order.Neighbors;
import kanban.order.NeedsRebalanceException;
import kanban.order.OrderKeyAllocator;
import kanban.order.OrderedCollection;
import kanban.order.OrderedItem;
import kanban.order.Position;
import kanban.spi.BoardStore;
import kanban.spi.MetricsExporter;
import kanban.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a {@link Position} into neighbor keys and a new order key, reading the
 * collection through the current transaction's connection every time.
 */
final class CollectionOrdering {
  private static final Logger logger = Logger.getLogger(CollectionOrdering.class.getName());

  private final BoardStore store;
  private final OrderKeyAllocator allocator;
  private final MetricsExporter metrics;

  CollectionOrdering(BoardStore store, OrderKeyAllocator allocator, MetricsExporter metrics) {
    this.store = store;
    this.allocator = allocator;
    this.metrics = metrics;
  }

  /**
   * Reads the neighbors of the slot named by {@code position}.
   *
   * @param movingId the item being moved, ignored as a neighbor; {@code null} for inserts
   * @throws InvalidPositionException if the anchor is not in {@code collection} or is the moved item
   */
  Neighbors resolve(Connection conn, OrderedCollection collection, Position position, String movingId) {
    if (position instanceof Position.AtStart) {
      return new Neighbors(null, store.readEdges(conn, collection, movingId).previous());
    }
    if (position instanceof Position.AtEnd) {
      return new Neighbors(store.readEdges(conn, collection, movingId).next(), null);
    }
    if (position instanceof Position.Before before) {
      OrderedItem anchor = anchor(conn, collection, before.anchorId(), movingId);
      Neighbors around = store.readNeighbors(conn, collection, anchor.orderKey(), movingId);
      return new Neighbors(around.previous(), anchor);
    }
    Position.After after = (Position.After) position;
    OrderedItem anchor = anchor(conn, collection, after.anchorId(), movingId);
    Neighbors around = store.readNeighbors(conn, collection, anchor.orderKey(), movingId);
    return new Neighbors(anchor, around.next());
  }

  long allocate(TxContext tx, OrderedCollection collection, Position position, String movingId) {
    Connection conn = tx.currentConnection();
    return allocate(tx, collection, position, movingId, resolve(conn, collection, position, movingId));
  }

  /**
   * Allocates a key for a slot whose neighbors were already resolved in this transaction.
   * On exhaustion the collection is rebalanced and the slot resolved again, once.
   *
   * @throws ConflictException if the slot is still exhausted after the rebalance
   */
  long allocate(TxContext tx, OrderedCollection collection, Position position, String movingId,
      Neighbors neighbors) {
    try {
      return allocator.allocate(neighbors.previousKey(), neighbors.nextKey());
    } catch (NeedsRebalanceException first) {
      rebalance(tx, collection);
      Neighbors retry = resolve(tx.currentConnection(), collection, position, movingId);
      try {
        return allocator.allocate(retry.previousKey(), retry.nextKey());
      } catch (NeedsRebalanceException second) {
        throw new ConflictException("Order keys exhausted in " + describe(collection)
            + " after rebalance", second);
      }
    }
  }

  /**
   * Spreads the keys of the whole collection evenly, keeping their relative order.
   */
  void rebalance(TxContext tx, OrderedCollection collection) {
    Connection conn = tx.currentConnection();
    List<OrderedItem> current = store.readOrder(conn, collection);
    List<Long> keys = new ArrayList<>(current.size());
    for (OrderedItem item : current) {
      keys.add(item.orderKey());
    }
    List<Long> rebalanced = allocator.rebalance(keys);
    List<OrderedItem> rewritten = new ArrayList<>(current.size());
    for (int i = 0; i < current.size(); i++) {
      rewritten.add(new OrderedItem(current.get(i).id(), rebalanced.get(i)));
    }
    store.rewriteOrder(conn, collection, rewritten);
    logger.log(Level.INFO, "Rebalanced {0} items in {1}",
        new Object[] {rewritten.size(), describe(collection)});
    tx.afterCommit(metrics::incrementRebalance);
  }

  private OrderedItem anchor(Connection conn, OrderedCollection collection, String anchorId, String movingId) {
    if (anchorId.equals(movingId)) {
      throw new InvalidPositionException("Item " + anchorId + " cannot be positioned relative to itself");
    }
    return store.findItem(conn, collection, anchorId)
        .orElseThrow(() -> new InvalidPositionException(
            "Anchor " + anchorId + " is not in " + describe(collection)));
  }

  static String describe(OrderedCollection collection) {
    return collection.kind() == OrderedCollection.Kind.BOARD_LISTS
        ? "lists of board " + collection.parentId()
        : "cards of list " + collection.parentId();
  }
}
