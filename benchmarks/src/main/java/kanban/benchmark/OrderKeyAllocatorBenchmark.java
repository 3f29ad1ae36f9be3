package kanban.benchmark;

import kanban.order.NeedsRebalanceException;
import kanban.order.OrderKeyAllocator;
import kanban.order.OrderKeys;
import kanban.order.SpacedOrderKeyAllocator;

import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Measures key allocation and rebalancing in isolation, without a store.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar OrderKeyAllocatorBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class OrderKeyAllocatorBenchmark {

  private final OrderKeyAllocator allocator = new SpacedOrderKeyAllocator();

  @Param({"10", "1000", "100000"})
  private int collectionSize;

  private List<Long> crowded;

  @Setup(Level.Trial)
  public void setup() {
    crowded = new ArrayList<>(collectionSize);
    for (int i = 0; i < collectionSize; i++) {
      crowded.add(100L + i);
    }
  }

  @Benchmark
  public long append() {
    return allocator.allocate(OrderKeys.INITIAL_KEY, null);
  }

  @Benchmark
  public long bisect() {
    return allocator.allocate(OrderKeys.INITIAL_KEY, OrderKeys.INITIAL_KEY + OrderKeys.SPACING);
  }

  /** Keeps inserting at the front of the same gap until it runs out. */
  @Benchmark
  public int bisectUntilExhausted() {
    long previous = OrderKeys.INITIAL_KEY;
    long next = OrderKeys.INITIAL_KEY + OrderKeys.SPACING;
    int inserts = 0;
    try {
      while (true) {
        next = allocator.allocate(previous, next);
        inserts++;
      }
    } catch (NeedsRebalanceException e) {
      return inserts;
    }
  }

  @Benchmark
  public List<Long> rebalance() {
    return allocator.rebalance(crowded);
  }
}
