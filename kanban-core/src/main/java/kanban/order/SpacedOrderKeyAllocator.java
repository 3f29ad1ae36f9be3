package kanban.order;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Integer order keys with fixed spacing, as documented in {@link OrderKeys}.
 *
 * <p>Appending steps {@link OrderKeys#SPACING} past the last key; inserting between two
 * items bisects the gap. When a gap is exhausted the allocator throws
 * {@link NeedsRebalanceException} and {@link #rebalance} spreads the collection evenly
 * around {@link OrderKeys#INITIAL_KEY}.
 */
public final class SpacedOrderKeyAllocator implements OrderKeyAllocator {

  @Override
  public long allocate(Long previousKey, Long nextKey) {
    if (previousKey == null && nextKey == null) {
      return OrderKeys.INITIAL_KEY;
    }
    if (nextKey == null) {
      long previous = OrderKeys.requireInDomain(previousKey, "previousKey");
      if (previous == OrderKeys.MAX_KEY) {
        throw new NeedsRebalanceException(previousKey, null);
      }
      if (OrderKeys.MAX_KEY - previous >= OrderKeys.SPACING) {
        return previous + OrderKeys.SPACING;
      }
      return previous + (OrderKeys.MAX_KEY - previous + 1) / 2;
    }
    if (previousKey == null) {
      long next = OrderKeys.requireInDomain(nextKey, "nextKey");
      if (next == OrderKeys.MIN_KEY) {
        throw new NeedsRebalanceException(null, nextKey);
      }
      if (next - OrderKeys.MIN_KEY >= OrderKeys.SPACING) {
        return next - OrderKeys.SPACING;
      }
      return next - (next - OrderKeys.MIN_KEY + 1) / 2;
    }
    long previous = OrderKeys.requireInDomain(previousKey, "previousKey");
    long next = OrderKeys.requireInDomain(nextKey, "nextKey");
    if (previous >= next) {
      throw new IllegalArgumentException(
          "previousKey must be below nextKey, got: " + previous + " >= " + next);
    }
    if (next - previous <= 1) {
      throw new NeedsRebalanceException(previousKey, nextKey);
    }
    return previous + (next - previous) / 2;
  }

  @Override
  public List<Long> rebalance(List<Long> sortedKeys) {
    Objects.requireNonNull(sortedKeys, "sortedKeys");
    int n = sortedKeys.size();
    Long last = null;
    for (Long key : sortedKeys) {
      Objects.requireNonNull(key, "sortedKeys cannot contain null");
      if (last != null && key <= last) {
        throw new IllegalArgumentException("sortedKeys must be strictly ascending: " + last + ", " + key);
      }
      last = key;
    }
    if (n == 0) {
      return List.of();
    }
    long spacing = Math.min(OrderKeys.SPACING, (OrderKeys.MAX_KEY - OrderKeys.MIN_KEY) / (n + 1L));
    // Centre the block on INITIAL_KEY: key(i) = first + i * spacing
    long first = OrderKeys.INITIAL_KEY - ((n - 1L) * spacing) / 2;
    List<Long> result = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      result.add(first + i * spacing);
    }
    return List.copyOf(result);
  }
}
