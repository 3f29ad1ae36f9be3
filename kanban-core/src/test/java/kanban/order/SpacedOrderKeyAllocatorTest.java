package kanban.order;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpacedOrderKeyAllocatorTest {

  private final SpacedOrderKeyAllocator allocator = new SpacedOrderKeyAllocator();

  @Test
  void emptyCollectionGetsInitialKey() {
    assertEquals(OrderKeys.INITIAL_KEY, allocator.allocate(null, null));
  }

  @Test
  void appendStepsBySpacing() {
    assertEquals(OrderKeys.INITIAL_KEY + OrderKeys.SPACING, allocator.allocate(OrderKeys.INITIAL_KEY, null));
  }

  @Test
  void prependStepsBySpacing() {
    assertEquals(OrderKeys.INITIAL_KEY - OrderKeys.SPACING, allocator.allocate(null, OrderKeys.INITIAL_KEY));
  }

  @Test
  void insertBetweenBisectsGap() {
    assertEquals(150L, allocator.allocate(100L, 200L));
    long key = allocator.allocate(100L, 103L);
    assertTrue(key > 100L && key < 103L, "got " + key);
  }

  @Test
  void adjacentKeysNeedRebalance() {
    NeedsRebalanceException e = assertThrows(NeedsRebalanceException.class,
        () -> allocator.allocate(100L, 101L));
    assertEquals(100L, e.previousKey());
    assertEquals(101L, e.nextKey());
  }

  @Test
  void appendNearUpperBoundBisectsRemainingRoom() {
    long previous = OrderKeys.MAX_KEY - 10;
    long key = allocator.allocate(previous, null);
    assertTrue(key > previous && key <= OrderKeys.MAX_KEY, "got " + key);
  }

  @Test
  void appendAtUpperBoundNeedsRebalance() {
    assertThrows(NeedsRebalanceException.class, () -> allocator.allocate(OrderKeys.MAX_KEY, null));
  }

  @Test
  void prependNearLowerBoundBisectsRemainingRoom() {
    long key = allocator.allocate(null, 5L);
    assertTrue(key >= OrderKeys.MIN_KEY && key < 5L, "got " + key);
  }

  @Test
  void prependAtLowerBoundNeedsRebalance() {
    assertThrows(NeedsRebalanceException.class, () -> allocator.allocate(null, OrderKeys.MIN_KEY));
  }

  @Test
  void invertedNeighborsRejected() {
    assertThrows(IllegalArgumentException.class, () -> allocator.allocate(200L, 100L));
    assertThrows(IllegalArgumentException.class, () -> allocator.allocate(100L, 100L));
  }

  @Test
  void keysOutsideDomainRejected() {
    assertThrows(IllegalArgumentException.class, () -> allocator.allocate(0L, null));
    assertThrows(IllegalArgumentException.class, () -> allocator.allocate(null, OrderKeys.MAX_KEY + 1));
  }

  @Test
  void sixteenBisectionsFitBetweenSpacedNeighbors() {
    long previous = OrderKeys.INITIAL_KEY;
    long next = OrderKeys.INITIAL_KEY + OrderKeys.SPACING;
    int inserts = 0;
    while (true) {
      try {
        next = allocator.allocate(previous, next);
        inserts++;
      } catch (NeedsRebalanceException e) {
        break;
      }
    }
    assertEquals(16, inserts);
  }

  @Test
  void rebalanceCentresEvenlySpacedBlock() {
    List<Long> keys = allocator.rebalance(List.of(5L, 6L, 7L));

    assertEquals(List.of(
        OrderKeys.INITIAL_KEY - OrderKeys.SPACING,
        OrderKeys.INITIAL_KEY,
        OrderKeys.INITIAL_KEY + OrderKeys.SPACING), keys);
  }

  @Test
  void rebalanceRestoresRoomBetweenEveryPair() {
    List<Long> keys = allocator.rebalance(List.of(100L, 101L, 102L, 103L));

    assertEquals(4, keys.size());
    for (int i = 1; i < keys.size(); i++) {
      assertEquals(OrderKeys.SPACING, keys.get(i) - keys.get(i - 1));
      long between = allocator.allocate(keys.get(i - 1), keys.get(i));
      assertTrue(between > keys.get(i - 1) && between < keys.get(i));
    }
  }

  @Test
  void rebalanceOfEmptyCollectionIsEmpty() {
    assertTrue(allocator.rebalance(List.of()).isEmpty());
  }

  @Test
  void rebalanceRejectsUnsortedInput() {
    assertThrows(IllegalArgumentException.class, () -> allocator.rebalance(List.of(3L, 2L)));
    assertThrows(IllegalArgumentException.class, () -> allocator.rebalance(List.of(2L, 2L)));
  }
}
