package kanban.order;

import java.util.List;

/**
 * Strategy for computing order keys within one ordered collection.
 *
 * <p>Implementations are pure functions of their arguments. Callers must read the
 * neighbor keys inside the same transaction that writes the result.
 *
 * @see SpacedOrderKeyAllocator
 */
public interface OrderKeyAllocator {

  /**
   * Computes a key that sorts strictly between the given neighbors.
   *
   * @param previousKey key of the item that will precede the new one, or {@code null} at the start
   * @param nextKey     key of the item that will follow the new one, or {@code null} at the end
   * @return the new key
   * @throws NeedsRebalanceException  if no key is free in the requested gap
   * @throws IllegalArgumentException if {@code previousKey >= nextKey} or a key is outside the domain
   */
  long allocate(Long previousKey, Long nextKey);

  /**
   * Redistributes the keys of a whole collection.
   *
   * @param sortedKeys current keys, strictly ascending
   * @return new keys, strictly ascending, same size; element {@code i} replaces input {@code i}
   * @throws IllegalArgumentException if the input is not strictly ascending
   */
  List<Long> rebalance(List<Long> sortedKeys);
}
