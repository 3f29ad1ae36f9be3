package kanban.auth;

import kanban.ForbiddenException;
import kanban.Principal;
import kanban.engine.InMemoryBoardStore;
import kanban.model.Board;
import kanban.model.Membership;
import kanban.model.Role;
import kanban.model.Visibility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizationGuardTest {

  private static final Principal ALICE = new Principal("alice", "acme");

  @ParameterizedTest
  @EnumSource(Action.class)
  void ownerMayDoEverything(Action action) {
    assertInstanceOf(AuthorizationDecision.Allowed.class,
        AuthorizationGuard.decide(Role.OWNER, ALICE, board(Visibility.PRIVATE), action));
  }

  @ParameterizedTest
  @EnumSource(value = Action.class, names = {"DELETE_BOARD", "TRANSFER_OWNERSHIP", "GRANT_OWNER"})
  void adminMayNotDoOwnerActions(Action action) {
    assertInstanceOf(AuthorizationDecision.Denied.class,
        AuthorizationGuard.decide(Role.ADMIN, ALICE, board(Visibility.PRIVATE), action));
  }

  @Test
  void memberMayMoveCardsButNotManageBoard() {
    Board board = board(Visibility.PRIVATE);

    assertInstanceOf(AuthorizationDecision.Allowed.class,
        AuthorizationGuard.decide(Role.MEMBER, ALICE, board, Action.MOVE_CARD));
    assertInstanceOf(AuthorizationDecision.Allowed.class,
        AuthorizationGuard.decide(Role.MEMBER, ALICE, board, Action.CREATE_LIST));
    assertInstanceOf(AuthorizationDecision.Denied.class,
        AuthorizationGuard.decide(Role.MEMBER, ALICE, board, Action.DELETE_LIST));
    assertInstanceOf(AuthorizationDecision.Denied.class,
        AuthorizationGuard.decide(Role.MEMBER, ALICE, board, Action.MANAGE_MEMBERS));
    assertInstanceOf(AuthorizationDecision.Denied.class,
        AuthorizationGuard.decide(Role.MEMBER, ALICE, board, Action.DELETE_BOARD));
  }

  @Test
  void deniedDecisionNamesRequiredRole() {
    AuthorizationDecision decision =
        AuthorizationGuard.decide(Role.MEMBER, ALICE, board(Visibility.PRIVATE), Action.DELETE_BOARD);

    AuthorizationDecision.Denied denied = assertInstanceOf(AuthorizationDecision.Denied.class, decision);
    assertTrue(denied.reason().contains("owner"), denied.reason());
  }

  @Test
  void nonMemberDeniedOnPrivateBoard() {
    assertInstanceOf(AuthorizationDecision.Denied.class,
        AuthorizationGuard.decide(null, ALICE, board(Visibility.PRIVATE), Action.READ_BOARD));
  }

  @Test
  void nonMemberMayReadPublicBoardOnly() {
    Board board = board(Visibility.PUBLIC);

    assertInstanceOf(AuthorizationDecision.Allowed.class,
        AuthorizationGuard.decide(null, Principal.of("anyone"), board, Action.READ_BOARD));
    assertInstanceOf(AuthorizationDecision.Denied.class,
        AuthorizationGuard.decide(null, Principal.of("anyone"), board, Action.MOVE_CARD));
  }

  @Test
  void orgBoardReadableWithinOrganization() {
    Board board = board(Visibility.ORG);

    assertInstanceOf(AuthorizationDecision.Allowed.class,
        AuthorizationGuard.decide(null, new Principal("bob", "acme"), board, Action.READ_BOARD));
    assertInstanceOf(AuthorizationDecision.Denied.class,
        AuthorizationGuard.decide(null, new Principal("eve", "globex"), board, Action.READ_BOARD));
    assertInstanceOf(AuthorizationDecision.Denied.class,
        AuthorizationGuard.decide(null, Principal.of("carol"), board, Action.READ_BOARD));
    assertInstanceOf(AuthorizationDecision.Denied.class,
        AuthorizationGuard.decide(null, new Principal("bob", "acme"), board, Action.CREATE_CARD));
  }

  @Test
  void authorizeReadsRoleFromStore() {
    InMemoryBoardStore store = new InMemoryBoardStore();
    Board board = board(Visibility.PRIVATE);
    store.insertBoard(null, board);
    store.saveMembership(null, new Membership(board.id(), "bob", Role.MEMBER));
    AuthorizationGuard guard = new AuthorizationGuard(store);
    Principal bob = Principal.of("bob");

    assertEquals(AuthorizationDecision.allowed(), guard.authorize(null, bob, board, Action.MOVE_CARD));
    AuthorizationDecision.Denied denied = assertInstanceOf(AuthorizationDecision.Denied.class,
        guard.authorize(null, bob, board, Action.RENAME_BOARD));
    assertTrue(denied.reason().contains("admin"), denied.reason());

    store.deleteMembership(null, board.id(), "bob");
    assertInstanceOf(AuthorizationDecision.Denied.class, guard.authorize(null, bob, board, Action.MOVE_CARD));
  }

  @Test
  void requireThrowsWithDenialReason() {
    InMemoryBoardStore store = new InMemoryBoardStore();
    Board board = board(Visibility.PUBLIC);
    store.insertBoard(null, board);
    AuthorizationGuard guard = new AuthorizationGuard(store);

    assertDoesNotThrow(() -> guard.require(null, Principal.of("visitor"), board, Action.READ_BOARD));
    ForbiddenException e = assertThrows(ForbiddenException.class,
        () -> guard.require(null, Principal.of("visitor"), board, Action.COMMENT));
    assertTrue(e.getMessage().contains("Not a member"), e.getMessage());
  }

  @ParameterizedTest
  @EnumSource(Action.class)
  void onlyReadOnlyActionsAreOpenToPublicVisitors(Action action) {
    AuthorizationDecision decision =
        AuthorizationGuard.decide(null, Principal.of("visitor"), board(Visibility.PUBLIC), action);

    assertEquals(action.isReadOnly(), decision instanceof AuthorizationDecision.Allowed, action.name());
  }

  @Test
  void rolesAreOrdered() {
    assertTrue(Role.OWNER.atLeast(Role.ADMIN));
    assertTrue(Role.ADMIN.atLeast(Role.MEMBER));
    assertFalse(Role.MEMBER.atLeast(Role.ADMIN));
    assertEquals(Role.ADMIN, Role.fromCode("admin"));
  }

  private static Board board(Visibility visibility) {
    return new Board("b1", "Roadmap", visibility, "alice", "acme", false,
        Instant.parse("2024-01-01T00:00:00Z"));
  }
}
