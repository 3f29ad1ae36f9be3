package kanban.engine;

import kanban.ForbiddenException;
import kanban.InvalidPositionException;
import kanban.LastOwnerViolationException;
import kanban.NotFoundException;
import kanban.Principal;
import kanban.auth.Action;
import kanban.auth.AuthorizationGuard;
import kanban.model.Board;
import kanban.model.BoardList;
import kanban.model.Card;
import kanban.model.Comment;
import kanban.model.Label;
import kanban.model.Membership;
import kanban.model.Role;
import kanban.model.Visibility;
import kanban.order.Neighbors;
import kanban.order.OrderKeyAllocator;
import kanban.order.OrderedCollection;
import kanban.order.Position;
import kanban.order.SpacedOrderKeyAllocator;
import kanban.spi.BoardStore;
import kanban.spi.MetricsExporter;
import kanban.spi.TransactionRunner;
import kanban.util.Ids;

import java.sql.Connection;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes board mutations as single store transactions.
 *
 * <p>Every mutation follows the same sequence inside one transaction: lock the board
 * row, re-read the target entity, authorize against the role stored right now, validate
 * the position, allocate an order key (rebalancing once if the slot is exhausted) and
 * write. Any failure rolls the whole transaction back, so a rejected mutation leaves no
 * trace.
 *
 * <p>Failures are thrown as {@link kanban.KanbanException} subclasses. Use
 * {@link kanban.KanbanClient} to receive them as {@link kanban.MutationResult} values.
 *
 * <p>Mutations on an archived board fail with {@link ForbiddenException}, except
 * {@link #restoreBoard} and {@link #deleteBoard}.
 *
 * @see MutationEngine.Builder
 */
public final class MutationEngine {
  private static final Logger logger = Logger.getLogger(MutationEngine.class.getName());

  private final BoardStore store;
  private final TransactionRunner transactions;
  private final AuthorizationGuard guard;
  private final CollectionOrdering ordering;
  private final MetricsExporter metrics;
  private final Clock clock;

  private MutationEngine(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.transactions = Objects.requireNonNull(builder.transactionRunner, "transactionRunner");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    OrderKeyAllocator allocator = builder.allocator != null
        ? builder.allocator : new SpacedOrderKeyAllocator();
    this.guard = new AuthorizationGuard(store);
    this.ordering = new CollectionOrdering(store, allocator, metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Boards ──────────────────────────────────────────────────────

  /**
   * Creates a board owned by the caller. The caller becomes its first OWNER member.
   */
  public Board createBoard(Principal principal, String title, Visibility visibility) {
    Objects.requireNonNull(principal, "principal");
    Objects.requireNonNull(visibility, "visibility");
    String validTitle = Validation.title(title);
    return mutate("createBoard", tx -> {
      Connection conn = tx.currentConnection();
      Board board = new Board(Ids.newId(), validTitle, visibility, principal.userId(),
          principal.orgId(), false, clock.instant());
      store.insertBoard(conn, board);
      store.saveMembership(conn, new Membership(board.id(), principal.userId(), Role.OWNER));
      logger.log(Level.FINE, "Created board {0} for {1}", new Object[] {board.id(), principal.userId()});
      return board;
    });
  }

  public Board renameBoard(Principal principal, String boardId, String title) {
    String validTitle = Validation.title(title);
    return mutate("renameBoard", tx -> {
      Connection conn = tx.currentConnection();
      Board board = writableBoard(conn, boardId);
      guard.require(conn, principal, board, Action.RENAME_BOARD);
      if (board.title().equals(validTitle)) {
        return board;
      }
      Board renamed = board.withTitle(validTitle);
      store.updateBoard(conn, renamed);
      return renamed;
    });
  }

  /**
   * Archives a board. Its lists and cards keep their order keys.
   */
  public Board archiveBoard(Principal principal, String boardId) {
    return mutate("archiveBoard", tx -> setBoardArchived(tx.currentConnection(), principal, boardId, true));
  }

  public Board restoreBoard(Principal principal, String boardId) {
    return mutate("restoreBoard", tx -> setBoardArchived(tx.currentConnection(), principal, boardId, false));
  }

  /**
   * Deletes a board and everything it owns. Allowed on archived boards.
   */
  public void deleteBoard(Principal principal, String boardId) {
    mutate("deleteBoard", tx -> {
      Connection conn = tx.currentConnection();
      Board board = lockBoard(conn, boardId);
      guard.require(conn, principal, board, Action.DELETE_BOARD);
      store.deleteBoardCascade(conn, boardId);
      logger.log(Level.FINE, "Deleted board {0}", boardId);
      return null;
    });
  }

  private Board setBoardArchived(Connection conn, Principal principal, String boardId, boolean archived) {
    Board board = lockBoard(conn, boardId);
    guard.require(conn, principal, board, Action.ARCHIVE_BOARD);
    if (board.archived() == archived) {
      return board;
    }
    Board updated = board.withArchived(archived);
    store.updateBoard(conn, updated);
    return updated;
  }

  // ── Lists ───────────────────────────────────────────────────────

  public BoardList createList(Principal principal, String boardId, String title, Position position) {
    Objects.requireNonNull(position, "position");
    String validTitle = Validation.title(title);
    return mutate("createList", tx -> {
      Connection conn = tx.currentConnection();
      Board board = writableBoard(conn, boardId);
      guard.require(conn, principal, board, Action.CREATE_LIST);
      long key = ordering.allocate(tx, OrderedCollection.listsOf(boardId), position, null);
      BoardList list = new BoardList(Ids.newId(), boardId, validTitle, key, false);
      store.insertList(conn, list);
      return list;
    });
  }

  public BoardList renameList(Principal principal, String listId, String title) {
    String validTitle = Validation.title(title);
    return mutate("renameList", tx -> {
      Connection conn = tx.currentConnection();
      Locked<BoardList> locked = lockList(conn, listId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.RENAME_LIST);
      BoardList list = locked.entity();
      if (list.title().equals(validTitle)) {
        return list;
      }
      BoardList renamed = list.withTitle(validTitle);
      store.updateList(conn, renamed);
      return renamed;
    });
  }

  /**
   * Moves a list within its board. A move to the slot the list already occupies
   * changes nothing.
   */
  public BoardList moveList(Principal principal, String listId, Position position) {
    Objects.requireNonNull(position, "position");
    return mutate("moveList", tx -> {
      Connection conn = tx.currentConnection();
      Locked<BoardList> locked = lockList(conn, listId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.MOVE_LIST);
      BoardList list = locked.entity();
      OrderedCollection lists = OrderedCollection.listsOf(list.boardId());
      Neighbors neighbors = ordering.resolve(conn, lists, position, listId);
      if (neighbors.admits(list.orderKey())) {
        return list;
      }
      long key = ordering.allocate(tx, lists, position, listId, neighbors);
      BoardList moved = list.withOrderKey(key);
      store.updateList(conn, moved);
      return moved;
    });
  }

  public BoardList archiveList(Principal principal, String listId) {
    return mutate("archiveList", tx -> setListArchived(tx.currentConnection(), principal, listId, true));
  }

  public BoardList restoreList(Principal principal, String listId) {
    return mutate("restoreList", tx -> setListArchived(tx.currentConnection(), principal, listId, false));
  }

  /**
   * Deletes a list with all of its cards.
   */
  public void deleteList(Principal principal, String listId) {
    mutate("deleteList", tx -> {
      Connection conn = tx.currentConnection();
      Locked<BoardList> locked = lockList(conn, listId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.DELETE_LIST);
      store.deleteListCascade(conn, listId);
      return null;
    });
  }

  private BoardList setListArchived(Connection conn, Principal principal, String listId, boolean archived) {
    Locked<BoardList> locked = lockList(conn, listId);
    requireWritable(locked.board());
    guard.require(conn, principal, locked.board(), Action.ARCHIVE_LIST);
    BoardList list = locked.entity();
    if (list.archived() == archived) {
      return list;
    }
    BoardList updated = list.withArchived(archived);
    store.updateList(conn, updated);
    return updated;
  }

  // ── Cards ───────────────────────────────────────────────────────

  public Card createCard(Principal principal, String listId, String title, Position position) {
    Objects.requireNonNull(position, "position");
    String validTitle = Validation.title(title);
    return mutate("createCard", tx -> {
      Connection conn = tx.currentConnection();
      Locked<BoardList> locked = lockList(conn, listId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.CREATE_CARD);
      long key = ordering.allocate(tx, OrderedCollection.cardsOf(listId), position, null);
      Card card = new Card(Ids.newId(), listId, locked.board().id(), validTitle, null, key,
          null, Set.of(), false);
      store.insertCard(conn, card);
      return card;
    });
  }

  /**
   * Moves a card to {@code position} in {@code targetListId}, which may be its current
   * list. The target list must belong to the card's board.
   *
   * @return the card as committed, carrying its new list id and order key
   * @throws InvalidPositionException if the target list is on another board or the anchor
   *     is not in the target list
   */
  public Card moveCard(Principal principal, String cardId, String targetListId, Position position) {
    Objects.requireNonNull(targetListId, "targetListId");
    Objects.requireNonNull(position, "position");
    return mutate("moveCard", tx -> {
      Connection conn = tx.currentConnection();
      Locked<Card> locked = lockCard(conn, cardId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.MOVE_CARD);
      Card card = locked.entity();
      BoardList target = store.findList(conn, targetListId)
          .orElseThrow(() -> NotFoundException.list(targetListId));
      if (!target.boardId().equals(card.boardId())) {
        throw new InvalidPositionException(
            "List " + targetListId + " is not on board " + card.boardId());
      }
      OrderedCollection cards = OrderedCollection.cardsOf(targetListId);
      Neighbors neighbors = ordering.resolve(conn, cards, position, cardId);
      if (card.listId().equals(targetListId) && neighbors.admits(card.orderKey())) {
        return card;
      }
      long key = ordering.allocate(tx, cards, position, cardId, neighbors);
      Card moved = card.withPlacement(targetListId, key);
      store.updateCard(conn, moved);
      logger.log(Level.FINE, "Moved card {0} to list {1} at key {2}",
          new Object[] {cardId, targetListId, key});
      return moved;
    });
  }

  public Card renameCard(Principal principal, String cardId, String title) {
    String validTitle = Validation.title(title);
    return mutate("renameCard", tx -> {
      Connection conn = tx.currentConnection();
      Locked<Card> locked = lockCard(conn, cardId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.RENAME_CARD);
      Card card = locked.entity();
      if (card.title().equals(validTitle)) {
        return card;
      }
      Card renamed = card.withTitle(validTitle);
      store.updateCard(conn, renamed);
      return renamed;
    });
  }

  /**
   * Replaces description and due date. {@code null} clears a field.
   */
  public Card updateCardDetails(Principal principal, String cardId, String description, LocalDate dueDate) {
    String validDescription = Validation.description(description);
    return mutate("updateCardDetails", tx -> {
      Connection conn = tx.currentConnection();
      Locked<Card> locked = lockCard(conn, cardId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.EDIT_CARD);
      Card updated = locked.entity().withDetails(validDescription, dueDate);
      store.updateCard(conn, updated);
      return updated;
    });
  }

  public Card archiveCard(Principal principal, String cardId) {
    return mutate("archiveCard", tx -> setCardArchived(tx.currentConnection(), principal, cardId, true));
  }

  public Card restoreCard(Principal principal, String cardId) {
    return mutate("restoreCard", tx -> setCardArchived(tx.currentConnection(), principal, cardId, false));
  }

  public void deleteCard(Principal principal, String cardId) {
    mutate("deleteCard", tx -> {
      Connection conn = tx.currentConnection();
      Locked<Card> locked = lockCard(conn, cardId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.DELETE_CARD);
      store.deleteCardCascade(conn, cardId);
      return null;
    });
  }

  private Card setCardArchived(Connection conn, Principal principal, String cardId, boolean archived) {
    Locked<Card> locked = lockCard(conn, cardId);
    requireWritable(locked.board());
    guard.require(conn, principal, locked.board(), Action.ARCHIVE_CARD);
    Card card = locked.entity();
    if (card.archived() == archived) {
      return card;
    }
    Card updated = card.withArchived(archived);
    store.updateCard(conn, updated);
    return updated;
  }

  // ── Membership ──────────────────────────────────────────────────

  /**
   * Adds a member or changes a member's role.
   *
   * <p>ADMIN may grant MEMBER and ADMIN. Granting OWNER, or changing the role of an
   * existing owner, requires OWNER. Demoting the last owner fails with
   * {@link LastOwnerViolationException}.
   */
  public Membership setMemberRole(Principal principal, String boardId, String userId, Role role) {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(role, "role");
    return mutate("setMemberRole", tx -> {
      Connection conn = tx.currentConnection();
      Board board = writableBoard(conn, boardId);
      guard.require(conn, principal, board, Action.MANAGE_MEMBERS);
      Optional<Membership> current = store.findMembership(conn, boardId, userId);
      boolean wasOwner = current.map(m -> m.role() == Role.OWNER).orElse(false);
      if (role == Role.OWNER || wasOwner) {
        guard.require(conn, principal, board, Action.GRANT_OWNER);
      }
      if (current.isPresent() && current.get().role() == role) {
        return current.get();
      }
      if (wasOwner && store.countOwners(conn, boardId) <= 1) {
        throw new LastOwnerViolationException(boardId);
      }
      Membership updated = new Membership(boardId, userId, role);
      store.saveMembership(conn, updated);
      if (wasOwner) {
        reassignRecordedOwner(conn, board, userId);
      }
      return updated;
    });
  }

  /**
   * Removes a member. Members may always remove themselves; removing anyone else requires
   * ADMIN, and removing an owner requires OWNER. The last owner cannot be removed.
   */
  public void removeMember(Principal principal, String boardId, String userId) {
    Objects.requireNonNull(userId, "userId");
    mutate("removeMember", tx -> {
      Connection conn = tx.currentConnection();
      Board board = writableBoard(conn, boardId);
      boolean self = principal.userId().equals(userId);
      if (!self) {
        guard.require(conn, principal, board, Action.MANAGE_MEMBERS);
      }
      Membership current = store.findMembership(conn, boardId, userId)
          .orElseThrow(() -> NotFoundException.member(boardId, userId));
      if (current.role() == Role.OWNER) {
        if (!self) {
          guard.require(conn, principal, board, Action.GRANT_OWNER);
        }
        if (store.countOwners(conn, boardId) <= 1) {
          throw new LastOwnerViolationException(boardId);
        }
      }
      store.deleteMembership(conn, boardId, userId);
      if (current.role() == Role.OWNER) {
        reassignRecordedOwner(conn, board, userId);
      }
      return null;
    });
  }

  /**
   * Makes {@code newOwnerId}, an existing member, the recorded owner. The caller stays on
   * the board as ADMIN.
   */
  public Board transferOwnership(Principal principal, String boardId, String newOwnerId) {
    Objects.requireNonNull(newOwnerId, "newOwnerId");
    return mutate("transferOwnership", tx -> {
      Connection conn = tx.currentConnection();
      Board board = writableBoard(conn, boardId);
      guard.require(conn, principal, board, Action.TRANSFER_OWNERSHIP);
      if (principal.userId().equals(newOwnerId)) {
        return board;
      }
      Membership target = store.findMembership(conn, boardId, newOwnerId)
          .orElseThrow(() -> NotFoundException.member(boardId, newOwnerId));
      store.saveMembership(conn, target.withRole(Role.OWNER));
      store.saveMembership(conn, new Membership(boardId, principal.userId(), Role.ADMIN));
      Board transferred = board.withOwnerId(newOwnerId);
      store.updateBoard(conn, transferred);
      logger.log(Level.INFO, "Transferred ownership of board {0} from {1} to {2}",
          new Object[] {boardId, principal.userId(), newOwnerId});
      return transferred;
    });
  }

  /**
   * If {@code formerOwnerId} was the recorded owner, records another remaining owner.
   */
  private void reassignRecordedOwner(Connection conn, Board board, String formerOwnerId) {
    if (!board.ownerId().equals(formerOwnerId)) {
      return;
    }
    store.listMemberships(conn, board.id()).stream()
        .filter(m -> m.role() == Role.OWNER)
        .map(Membership::userId)
        .findFirst()
        .ifPresent(next -> store.updateBoard(conn, board.withOwnerId(next)));
  }

  // ── Labels and comments ─────────────────────────────────────────

  public Label createLabel(Principal principal, String boardId, String name, String color) {
    String validName = Validation.labelName(name);
    String validColor = Validation.color(color);
    return mutate("createLabel", tx -> {
      Connection conn = tx.currentConnection();
      Board board = writableBoard(conn, boardId);
      guard.require(conn, principal, board, Action.MANAGE_LABELS);
      Label label = new Label(Ids.newId(), boardId, validName, validColor);
      store.insertLabel(conn, label);
      return label;
    });
  }

  /**
   * Deletes a label and detaches it from every card of the board.
   */
  public void deleteLabel(Principal principal, String labelId) {
    mutate("deleteLabel", tx -> {
      Connection conn = tx.currentConnection();
      Label unlocked = store.findLabel(conn, labelId).orElseThrow(() -> NotFoundException.label(labelId));
      Board board = writableBoard(conn, unlocked.boardId());
      Label label = store.findLabel(conn, labelId).orElseThrow(() -> NotFoundException.label(labelId));
      guard.require(conn, principal, board, Action.MANAGE_LABELS);
      store.deleteLabel(conn, label.id());
      return null;
    });
  }

  /**
   * Attaches a label of the card's own board. Attaching an attached label changes nothing.
   *
   * @throws NotFoundException if the label does not exist on the card's board
   */
  public Card attachLabel(Principal principal, String cardId, String labelId) {
    return mutate("attachLabel", tx -> {
      Connection conn = tx.currentConnection();
      Locked<Card> locked = lockCard(conn, cardId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.ATTACH_LABEL);
      Card card = locked.entity();
      boardLabel(conn, locked.board(), labelId);
      if (!store.attachLabel(conn, cardId, labelId)) {
        return card;
      }
      Set<String> labelIds = new LinkedHashSet<>(card.labelIds());
      labelIds.add(labelId);
      return card.withLabelIds(labelIds);
    });
  }

  public Card detachLabel(Principal principal, String cardId, String labelId) {
    return mutate("detachLabel", tx -> {
      Connection conn = tx.currentConnection();
      Locked<Card> locked = lockCard(conn, cardId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.ATTACH_LABEL);
      Card card = locked.entity();
      boardLabel(conn, locked.board(), labelId);
      if (!store.detachLabel(conn, cardId, labelId)) {
        return card;
      }
      Set<String> labelIds = new LinkedHashSet<>(card.labelIds());
      labelIds.remove(labelId);
      return card.withLabelIds(labelIds);
    });
  }

  public Comment addComment(Principal principal, String cardId, String body) {
    String validBody = Validation.commentBody(body);
    return mutate("addComment", tx -> {
      Connection conn = tx.currentConnection();
      Locked<Card> locked = lockCard(conn, cardId);
      requireWritable(locked.board());
      guard.require(conn, principal, locked.board(), Action.COMMENT);
      Comment comment = new Comment(Ids.newId(), cardId, principal.userId(), validBody, clock.instant());
      store.insertComment(conn, comment);
      return comment;
    });
  }

  private Label boardLabel(Connection conn, Board board, String labelId) {
    return store.findLabel(conn, labelId)
        .filter(label -> label.boardId().equals(board.id()))
        .orElseThrow(() -> NotFoundException.label(labelId));
  }

  // ── Reads ───────────────────────────────────────────────────────

  public Board getBoard(Principal principal, String boardId) {
    return read(tx -> readableBoard(tx.currentConnection(), principal, boardId));
  }

  /**
   * Returns the board's lists in display order, archived ones included.
   */
  public List<BoardList> listLists(Principal principal, String boardId) {
    return read(tx -> {
      Connection conn = tx.currentConnection();
      readableBoard(conn, principal, boardId);
      return store.listLists(conn, boardId);
    });
  }

  /**
   * Returns the list's cards in display order, archived ones included.
   */
  public List<Card> listCards(Principal principal, String listId) {
    return read(tx -> {
      Connection conn = tx.currentConnection();
      BoardList list = store.findList(conn, listId).orElseThrow(() -> NotFoundException.list(listId));
      readableBoard(conn, principal, list.boardId());
      return store.listCards(conn, listId);
    });
  }

  public List<Comment> listComments(Principal principal, String cardId) {
    return read(tx -> {
      Connection conn = tx.currentConnection();
      Card card = store.findCard(conn, cardId).orElseThrow(() -> NotFoundException.card(cardId));
      readableBoard(conn, principal, card.boardId());
      return store.listComments(conn, cardId);
    });
  }

  public List<Membership> listMembers(Principal principal, String boardId) {
    return read(tx -> {
      Connection conn = tx.currentConnection();
      readableBoard(conn, principal, boardId);
      return store.listMemberships(conn, boardId);
    });
  }

  public List<Label> listLabels(Principal principal, String boardId) {
    return read(tx -> {
      Connection conn = tx.currentConnection();
      readableBoard(conn, principal, boardId);
      return store.listLabels(conn, boardId);
    });
  }

  private Board readableBoard(Connection conn, Principal principal, String boardId) {
    Objects.requireNonNull(principal, "principal");
    Board board = store.findBoard(conn, boardId).orElseThrow(() -> NotFoundException.board(boardId));
    guard.require(conn, principal, board, Action.READ_BOARD);
    return board;
  }

  // ── Plumbing ────────────────────────────────────────────────────

  private <T> T mutate(String operation, TransactionRunner.TransactionalWork<T> work) {
    long start = System.nanoTime();
    try {
      return transactions.inTransaction(tx -> {
        T result = work.execute(tx);
        tx.afterCommit(() -> metrics.incrementCommitted(operation));
        return result;
      });
    } finally {
      metrics.recordMutationLatencyMs(operation, (System.nanoTime() - start) / 1_000_000);
    }
  }

  private <T> T read(TransactionRunner.TransactionalWork<T> work) {
    return transactions.inTransaction(work);
  }

  private Board lockBoard(Connection conn, String boardId) {
    Objects.requireNonNull(boardId, "boardId");
    return store.lockBoard(conn, boardId).orElseThrow(() -> NotFoundException.board(boardId));
  }

  private Board writableBoard(Connection conn, String boardId) {
    Board board = lockBoard(conn, boardId);
    requireWritable(board);
    return board;
  }

  private static void requireWritable(Board board) {
    if (board.archived()) {
      throw new ForbiddenException("Board " + board.id() + " is archived");
    }
  }

  /**
   * Finds the list's board, locks it, then re-reads the list under the lock.
   */
  private Locked<BoardList> lockList(Connection conn, String listId) {
    Objects.requireNonNull(listId, "listId");
    BoardList unlocked = store.findList(conn, listId).orElseThrow(() -> NotFoundException.list(listId));
    Board board = lockBoard(conn, unlocked.boardId());
    BoardList list = store.findList(conn, listId).orElseThrow(() -> NotFoundException.list(listId));
    return new Locked<>(board, list);
  }

  private Locked<Card> lockCard(Connection conn, String cardId) {
    Objects.requireNonNull(cardId, "cardId");
    Card unlocked = store.findCard(conn, cardId).orElseThrow(() -> NotFoundException.card(cardId));
    Board board = lockBoard(conn, unlocked.boardId());
    Card card = store.findCard(conn, cardId).orElseThrow(() -> NotFoundException.card(cardId));
    return new Locked<>(board, card);
  }

  /** An entity re-read after its board row was locked. */
  private record Locked<T>(Board board, T entity) {
  }

  /** Builder for {@link MutationEngine}. */
  public static final class Builder {
    private BoardStore store;
    private TransactionRunner transactionRunner;
    private OrderKeyAllocator allocator;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the persistence backend.
     *
     * <p><b>Required.</b>
     *
     * @param store the board store
     * @return this builder
     */
    public Builder store(BoardStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the runner that opens one transaction per operation.
     *
     * <p><b>Required.</b>
     *
     * @param transactionRunner the transaction runner
     * @return this builder
     */
    public Builder transactionRunner(TransactionRunner transactionRunner) {
      this.transactionRunner = transactionRunner;
      return this;
    }

    /**
     * Sets the order key allocator.
     *
     * <p>Optional. Defaults to {@link SpacedOrderKeyAllocator}. Every process writing the
     * same tables must use the same key scheme.
     *
     * @param allocator the allocator
     * @return this builder
     */
    public Builder allocator(OrderKeyAllocator allocator) {
      this.allocator = allocator;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock for creation timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException if {@code store} or {@code transactionRunner} is null
     */
    public MutationEngine build() {
      return new MutationEngine(this);
    }
  }
}
