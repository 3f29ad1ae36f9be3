/**
 * Order-key allocation for lists and cards.
 *
 * <p>Items carry persisted integer keys ({@link kanban.order.OrderKeys}); display order is
 * ascending key order. {@link kanban.order.SpacedOrderKeyAllocator} computes keys for new
 * slots and redistributes a collection when a gap runs out.
 */
package kanban.order;
