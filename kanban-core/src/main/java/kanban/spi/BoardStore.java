package kanban.spi;

import kanban.model.Board;
import kanban.model.BoardList;
import kanban.model.Card;
import kanban.model.Comment;
import kanban.model.Label;
import kanban.model.Membership;
import kanban.order.Neighbors;
import kanban.order.OrderedCollection;
import kanban.order.OrderedItem;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for boards and everything they own.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations hold no state between calls; in particular
 * they never cache order keys. Implementations live in the {@code kanban-jdbc} module.
 */
public interface BoardStore {

  // ── Boards ──────────────────────────────────────────────────────

  void insertBoard(Connection conn, Board board);

  Optional<Board> findBoard(Connection conn, String boardId);

  /**
   * Reads a board and locks its row until the transaction ends.
   *
   * <p>The board row is the serialization point for every mutation in the board:
   * membership changes, authorization checks and neighbor reads of any of its lists all
   * happen after this lock is held.
   */
  Optional<Board> lockBoard(Connection conn, String boardId);

  /**
   * Writes title, archived flag and owner id.
   *
   * @return rows updated (0 or 1)
   */
  int updateBoard(Connection conn, Board board);

  /**
   * Deletes a board with its memberships, labels, lists, cards, card labels and comments.
   *
   * @return rows deleted from the board table (0 or 1)
   */
  int deleteBoardCascade(Connection conn, String boardId);

  // ── Memberships ────────────────────────────────────────────────

  Optional<Membership> findMembership(Connection conn, String boardId, String userId);

  /**
   * Inserts the membership, or updates the role if the pair already exists.
   */
  void saveMembership(Connection conn, Membership membership);

  int deleteMembership(Connection conn, String boardId, String userId);

  int countOwners(Connection conn, String boardId);

  /**
   * Returns memberships ordered by user id.
   */
  List<Membership> listMemberships(Connection conn, String boardId);

  // ── Lists ───────────────────────────────────────────────────────

  void insertList(Connection conn, BoardList list);

  Optional<BoardList> findList(Connection conn, String listId);

  /**
   * Writes title, order key and archived flag.
   */
  int updateList(Connection conn, BoardList list);

  /**
   * Returns the lists of a board in ascending order key.
   */
  List<BoardList> listLists(Connection conn, String boardId);

  /**
   * Deletes a list with its cards, their comments and label links.
   */
  int deleteListCascade(Connection conn, String listId);

  // ── Cards ───────────────────────────────────────────────────────

  void insertCard(Connection conn, Card card);

  /**
   * Reads a card including its label ids.
   */
  Optional<Card> findCard(Connection conn, String cardId);

  /**
   * Writes list id, title, description, order key, due date and archived flag.
   * Label links are managed separately.
   */
  int updateCard(Connection conn, Card card);

  /**
   * Returns the cards of a list in ascending order key, including label ids.
   */
  List<Card> listCards(Connection conn, String listId);

  /**
   * Deletes a card with its comments and label links.
   */
  int deleteCardCascade(Connection conn, String cardId);

  // ── Labels and comments ─────────────────────────────────────────

  void insertLabel(Connection conn, Label label);

  Optional<Label> findLabel(Connection conn, String labelId);

  List<Label> listLabels(Connection conn, String boardId);

  /**
   * Deletes a label and unlinks it from every card.
   */
  int deleteLabel(Connection conn, String labelId);

  /**
   * @return {@code true} if a link was created, {@code false} if it already existed
   */
  boolean attachLabel(Connection conn, String cardId, String labelId);

  /**
   * @return {@code true} if a link was removed
   */
  boolean detachLabel(Connection conn, String cardId, String labelId);

  void insertComment(Connection conn, Comment comment);

  /**
   * Returns comments of a card, oldest first.
   */
  List<Comment> listComments(Connection conn, String cardId);

  // ── Ordering ────────────────────────────────────────────────────

  /**
   * Looks up an item by id, but only if it belongs to {@code collection}.
   */
  Optional<OrderedItem> findItem(Connection conn, OrderedCollection collection, String itemId);

  /**
   * Returns the nearest items strictly below and strictly above {@code key}.
   *
   * @param excludeId item to ignore (the item being moved), or {@code null}
   */
  Neighbors readNeighbors(Connection conn, OrderedCollection collection, long key, String excludeId);

  /**
   * Returns the first item (as {@code previous}) and the last item (as {@code next}).
   *
   * @param excludeId item to ignore (the item being moved), or {@code null}
   */
  Neighbors readEdges(Connection conn, OrderedCollection collection, String excludeId);

  /**
   * Returns every item of the collection in ascending key order.
   */
  List<OrderedItem> readOrder(Connection conn, OrderedCollection collection);

  /**
   * Replaces the keys of the given items. Implementations must tolerate new keys that
   * collide with old keys of other items in the same collection.
   */
  void rewriteOrder(Connection conn, OrderedCollection collection, List<OrderedItem> items);
}
