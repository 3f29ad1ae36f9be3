package kanban.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstAttemptReturnsBaseDelayWithJitter() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    long delay = policy.computeDelayMs(1);

    assertTrue(delay >= 50 && delay < 150, "Expected delay between 50-150, got: " + delay);
  }

  @Test
  void delayDoublesPerAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100000);

    long delay2 = policy.computeDelayMs(2);
    long delay3 = policy.computeDelayMs(3);

    assertTrue(delay2 >= 100 && delay2 < 300, "delay2 range: got " + delay2);
    assertTrue(delay3 >= 200 && delay3 < 600, "delay3 range: got " + delay3);
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    for (int attempt = 1; attempt < 100; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay > 0 && delay <= 500, "attempt " + attempt + ": " + delay);
    }
  }

  @Test
  void nonPositiveAttemptsReturnZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(200, 100));
  }
}
