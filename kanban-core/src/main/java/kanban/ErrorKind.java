package kanban;

/**
 * Failure categories surfaced by the mutation engine.
 *
 * <p>Every rejected mutation carries exactly one kind. Only {@link #STORE_UNAVAILABLE}
 * is worth retrying blindly; all other kinds are terminal for the request.
 */
public enum ErrorKind {
  /** Entity or referenced entity does not exist. */
  NOT_FOUND,
  /** The caller's role does not permit the action. */
  FORBIDDEN,
  /** Position anchor is not part of the target collection. */
  INVALID_POSITION,
  /** The change would leave a board without an owner. */
  LAST_OWNER_VIOLATION,
  /** No free order key between two neighbors. Resolved inside the engine, never surfaced. */
  NEEDS_REBALANCE,
  /** Transaction contention outlasted the retry budget. */
  CONFLICT,
  /** Transport or store failure; transient. */
  STORE_UNAVAILABLE,
  /** Malformed input such as a blank title. */
  INVALID_ARGUMENT,
  /** No server response arrived in time. Only produced on the client side. */
  TIMEOUT;

  /**
   * Returns {@code true} if a caller may resend the same request after a backoff.
   */
  public boolean isRetryable() {
    return this == STORE_UNAVAILABLE;
  }
}
