package kanban.order;

/**
 * The persisted order-key domain. These values are part of the stored data format and
 * must not change: any process reading or writing the same tables relies on them.
 *
 * <ul>
 *   <li>Keys are integers in {@code [MIN_KEY, MAX_KEY]}, a 53-bit range that JavaScript
 *       clients can hold in a double without loss.</li>
 *   <li>Adjacent items are normally {@link #SPACING} apart, so roughly 16 bisections fit
 *       between two neighbors before a rebalance is required.</li>
 *   <li>The first item of an empty collection gets {@link #INITIAL_KEY}, the domain midpoint,
 *       leaving equal room for inserts at either end.</li>
 * </ul>
 */
public final class OrderKeys {
  public static final long MIN_KEY = 1L;
  public static final long MAX_KEY = (1L << 53) - 1;
  public static final long SPACING = 1L << 16;
  public static final long INITIAL_KEY = 1L << 52;

  private OrderKeys() {}

  public static boolean inDomain(long key) {
    return key >= MIN_KEY && key <= MAX_KEY;
  }

  static long requireInDomain(long key, String name) {
    if (!inDomain(key)) {
      throw new IllegalArgumentException(name + " outside order key domain: " + key);
    }
    return key;
  }
}
