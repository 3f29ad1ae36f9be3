package kanban.auth;

import kanban.ForbiddenException;
import kanban.Principal;
import kanban.model.Board;
import kanban.model.Membership;
import kanban.model.Role;
import kanban.model.Visibility;
import kanban.spi.BoardStore;

import java.sql.Connection;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves a caller's role on a board and decides whether an action is permitted.
 *
 * <p>The role is read from the store on every call, through the connection of the
 * caller's transaction. Mutations call the guard after locking the board row, so a
 * concurrent role change is either fully visible to the check or ordered after the
 * write; a revoked role is never honored.
 *
 * <p>The decision itself ({@link #decide}) is a pure function of role, board and action.
 */
public final class AuthorizationGuard {
  private static final Logger logger = Logger.getLogger(AuthorizationGuard.class.getName());

  private final BoardStore store;

  public AuthorizationGuard(BoardStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Returns the user's role on the board, or empty if the user is not a member.
   */
  public Optional<Role> resolveRole(Connection conn, String userId, String boardId) {
    return store.findMembership(conn, boardId, userId).map(Membership::role);
  }

  public AuthorizationDecision authorize(Connection conn, Principal principal, Board board, Action action) {
    Objects.requireNonNull(principal, "principal");
    Objects.requireNonNull(board, "board");
    Objects.requireNonNull(action, "action");
    Role role = resolveRole(conn, principal.userId(), board.id()).orElse(null);
    AuthorizationDecision decision = decide(role, principal, board, action);
    if (decision instanceof AuthorizationDecision.Denied denied && logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "Denied {0} on board {1} for user {2}: {3}",
          new Object[] {action, board.id(), principal.userId(), denied.reason()});
    }
    return decision;
  }

  /**
   * Like {@link #authorize} but throws on denial.
   *
   * @throws ForbiddenException if the action is denied
   */
  public void require(Connection conn, Principal principal, Board board, Action action) {
    AuthorizationDecision decision = authorize(conn, principal, board, action);
    if (decision instanceof AuthorizationDecision.Denied denied) {
      throw new ForbiddenException(denied.reason());
    }
  }

  /**
   * Pure authorization decision.
   *
   * @param role      the caller's role, or {@code null} for a non-member
   * @param principal the caller
   * @param board     the board acted on
   * @param action    the requested action
   */
  public static AuthorizationDecision decide(Role role, Principal principal, Board board, Action action) {
    if (role == null) {
      if (action.isReadOnly() && board.visibility() == Visibility.PUBLIC) {
        return AuthorizationDecision.allowed();
      }
      if (action.isReadOnly() && board.visibility() == Visibility.ORG
          && board.orgId() != null && board.orgId().equals(principal.orgId())) {
        return AuthorizationDecision.allowed();
      }
      return AuthorizationDecision.denied("Not a member of board " + board.id());
    }
    if (!role.atLeast(action.minimumRole())) {
      return AuthorizationDecision.denied(
          action + " requires role " + action.minimumRole().code() + ", caller is " + role.code());
    }
    return AuthorizationDecision.allowed();
  }
}
