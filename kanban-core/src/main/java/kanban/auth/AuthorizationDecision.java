package kanban.auth;

import java.util.Objects;

/**
 * Outcome of an authorization check.
 */
public sealed interface AuthorizationDecision
    permits AuthorizationDecision.Allowed, AuthorizationDecision.Denied {

  Allowed ALLOWED = new Allowed();

  static Allowed allowed() {
    return ALLOWED;
  }

  static Denied denied(String reason) {
    return new Denied(reason);
  }

  default boolean isAllowed() {
    return this instanceof Allowed;
  }

  record Allowed() implements AuthorizationDecision {
  }

  /**
   * @param reason why the action was refused, suitable for display
   */
  record Denied(String reason) implements AuthorizationDecision {
    public Denied {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
