package kanban.jdbc.store;

import kanban.jdbc.JdbcTemplate;
import kanban.jdbc.TableNames;
import kanban.model.Board;
import kanban.model.BoardList;
import kanban.model.Card;
import kanban.model.Comment;
import kanban.model.Label;
import kanban.model.Membership;
import kanban.model.Role;
import kanban.model.Visibility;
import kanban.order.Neighbors;
import kanban.order.OrderedCollection;
import kanban.order.OrderedItem;
import kanban.spi.BoardStore;

import java.sql.Connection;
import java.sql.Date;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base JDBC board store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #saveMembership} and {@link #attachLabel} with native
 * upserts where the database has them. Register custom implementations via
 * {@code META-INF/services/kanban.jdbc.store.AbstractJdbcBoardStore}.
 *
 * <p>Cascade deletes are issued as explicit statements in child-to-parent order, so the
 * schema needs no {@code ON DELETE CASCADE}.
 *
 * @see JdbcBoardStores
 */
public abstract class AbstractJdbcBoardStore implements BoardStore {

  private static final String BOARD_COLUMNS =
      "id, title, visibility, owner_id, org_id, archived, created_at";
  private static final String LIST_COLUMNS = "id, board_id, title, order_key, archived";
  private static final String CARD_COLUMNS =
      "id, list_id, board_id, title, description, order_key, due_date, archived";

  protected static final JdbcTemplate.RowMapper<Board> BOARD_ROW_MAPPER = rs -> new Board(
      rs.getString("id"),
      rs.getString("title"),
      Visibility.fromCode(rs.getString("visibility")),
      rs.getString("owner_id"),
      rs.getString("org_id"),
      rs.getBoolean("archived"),
      rs.getTimestamp("created_at").toInstant());

  protected static final JdbcTemplate.RowMapper<Membership> MEMBERSHIP_ROW_MAPPER = rs -> new Membership(
      rs.getString("board_id"),
      rs.getString("user_id"),
      Role.fromCode(rs.getString("role")));

  protected static final JdbcTemplate.RowMapper<BoardList> LIST_ROW_MAPPER = rs -> new BoardList(
      rs.getString("id"),
      rs.getString("board_id"),
      rs.getString("title"),
      rs.getLong("order_key"),
      rs.getBoolean("archived"));

  // Label ids are loaded separately
  protected static final JdbcTemplate.RowMapper<Card> CARD_ROW_MAPPER = rs -> {
    Date dueDate = rs.getDate("due_date");
    return new Card(
        rs.getString("id"),
        rs.getString("list_id"),
        rs.getString("board_id"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getLong("order_key"),
        dueDate == null ? null : dueDate.toLocalDate(),
        Set.of(),
        rs.getBoolean("archived"));
  };

  protected static final JdbcTemplate.RowMapper<Label> LABEL_ROW_MAPPER = rs -> new Label(
      rs.getString("id"),
      rs.getString("board_id"),
      rs.getString("name"),
      rs.getString("color"));

  protected static final JdbcTemplate.RowMapper<Comment> COMMENT_ROW_MAPPER = rs -> new Comment(
      rs.getString("id"),
      rs.getString("card_id"),
      rs.getString("author_id"),
      rs.getString("body"),
      rs.getTimestamp("created_at").toInstant());

  protected static final JdbcTemplate.RowMapper<OrderedItem> ITEM_ROW_MAPPER = rs -> new OrderedItem(
      rs.getString("id"),
      rs.getLong("order_key"));

  private final TableNames tables;

  protected AbstractJdbcBoardStore() {
    this(TableNames.defaults());
  }

  protected AbstractJdbcBoardStore(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  /**
   * Unique identifier for this board store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this board store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same type whose tables use {@code tablePrefix}.
   */
  public abstract AbstractJdbcBoardStore withTablePrefix(String tablePrefix);

  protected TableNames tables() {
    return tables;
  }

  // ── Boards ──────────────────────────────────────────────────────

  @Override
  public void insertBoard(Connection conn, Board board) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + tables.board() + " (" + BOARD_COLUMNS + ") VALUES (?,?,?,?,?,?,?)",
        board.id(), board.title(), board.visibility().code(), board.ownerId(), board.orgId(),
        board.archived(), board.createdAt());
  }

  @Override
  public Optional<Board> findBoard(Connection conn, String boardId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + BOARD_COLUMNS + " FROM " + tables.board() + " WHERE id=?",
        BOARD_ROW_MAPPER, boardId);
  }

  @Override
  public Optional<Board> lockBoard(Connection conn, String boardId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + BOARD_COLUMNS + " FROM " + tables.board() + " WHERE id=? FOR UPDATE",
        BOARD_ROW_MAPPER, boardId);
  }

  @Override
  public int updateBoard(Connection conn, Board board) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tables.board() + " SET title=?, archived=?, owner_id=? WHERE id=?",
        board.title(), board.archived(), board.ownerId(), board.id());
  }

  @Override
  public int deleteBoardCascade(Connection conn, String boardId) {
    String boardCards = "SELECT id FROM " + tables.card() + " WHERE board_id=?";
    JdbcTemplate.update(conn,
        "DELETE FROM " + tables.comment() + " WHERE card_id IN (" + boardCards + ")", boardId);
    JdbcTemplate.update(conn,
        "DELETE FROM " + tables.cardLabel() + " WHERE card_id IN (" + boardCards + ")", boardId);
    JdbcTemplate.update(conn, "DELETE FROM " + tables.card() + " WHERE board_id=?", boardId);
    JdbcTemplate.update(conn, "DELETE FROM " + tables.list() + " WHERE board_id=?", boardId);
    JdbcTemplate.update(conn, "DELETE FROM " + tables.label() + " WHERE board_id=?", boardId);
    JdbcTemplate.update(conn, "DELETE FROM " + tables.membership() + " WHERE board_id=?", boardId);
    return JdbcTemplate.update(conn, "DELETE FROM " + tables.board() + " WHERE id=?", boardId);
  }

  // ── Memberships ────────────────────────────────────────────────

  @Override
  public Optional<Membership> findMembership(Connection conn, String boardId, String userId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT board_id, user_id, role FROM " + tables.membership() + " WHERE board_id=? AND user_id=?",
        MEMBERSHIP_ROW_MAPPER, boardId, userId);
  }

  /**
   * Update-then-insert. Callers hold the board lock, so no concurrent insert can race it.
   */
  @Override
  public void saveMembership(Connection conn, Membership membership) {
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + tables.membership() + " SET role=? WHERE board_id=? AND user_id=?",
        membership.role().code(), membership.boardId(), membership.userId());
    if (updated == 0) {
      JdbcTemplate.update(conn,
          "INSERT INTO " + tables.membership() + " (board_id, user_id, role) VALUES (?,?,?)",
          membership.boardId(), membership.userId(), membership.role().code());
    }
  }

  @Override
  public int deleteMembership(Connection conn, String boardId, String userId) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tables.membership() + " WHERE board_id=? AND user_id=?", boardId, userId);
  }

  @Override
  public int countOwners(Connection conn, String boardId) {
    return JdbcTemplate.query(conn,
        "SELECT COUNT(*) FROM " + tables.membership() + " WHERE board_id=? AND role=?",
        rs -> rs.getInt(1), boardId, Role.OWNER.code()).get(0);
  }

  @Override
  public List<Membership> listMemberships(Connection conn, String boardId) {
    return JdbcTemplate.query(conn,
        "SELECT board_id, user_id, role FROM " + tables.membership() + " WHERE board_id=? ORDER BY user_id",
        MEMBERSHIP_ROW_MAPPER, boardId);
  }

  // ── Lists ───────────────────────────────────────────────────────

  @Override
  public void insertList(Connection conn, BoardList list) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + tables.list() + " (" + LIST_COLUMNS + ") VALUES (?,?,?,?,?)",
        list.id(), list.boardId(), list.title(), list.orderKey(), list.archived());
  }

  @Override
  public Optional<BoardList> findList(Connection conn, String listId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + LIST_COLUMNS + " FROM " + tables.list() + " WHERE id=?",
        LIST_ROW_MAPPER, listId);
  }

  @Override
  public int updateList(Connection conn, BoardList list) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tables.list() + " SET title=?, order_key=?, archived=? WHERE id=?",
        list.title(), list.orderKey(), list.archived(), list.id());
  }

  @Override
  public List<BoardList> listLists(Connection conn, String boardId) {
    return JdbcTemplate.query(conn,
        "SELECT " + LIST_COLUMNS + " FROM " + tables.list() + " WHERE board_id=? ORDER BY order_key",
        LIST_ROW_MAPPER, boardId);
  }

  @Override
  public int deleteListCascade(Connection conn, String listId) {
    String listCards = "SELECT id FROM " + tables.card() + " WHERE list_id=?";
    JdbcTemplate.update(conn,
        "DELETE FROM " + tables.comment() + " WHERE card_id IN (" + listCards + ")", listId);
    JdbcTemplate.update(conn,
        "DELETE FROM " + tables.cardLabel() + " WHERE card_id IN (" + listCards + ")", listId);
    JdbcTemplate.update(conn, "DELETE FROM " + tables.card() + " WHERE list_id=?", listId);
    return JdbcTemplate.update(conn, "DELETE FROM " + tables.list() + " WHERE id=?", listId);
  }

  // ── Cards ───────────────────────────────────────────────────────

  @Override
  public void insertCard(Connection conn, Card card) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + tables.card() + " (" + CARD_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)",
        card.id(), card.listId(), card.boardId(), card.title(), card.description(),
        card.orderKey(), card.dueDate(), card.archived());
    for (String labelId : card.labelIds()) {
      attachLabel(conn, card.id(), labelId);
    }
  }

  @Override
  public Optional<Card> findCard(Connection conn, String cardId) {
    Optional<Card> card = JdbcTemplate.queryOne(conn,
        "SELECT " + CARD_COLUMNS + " FROM " + tables.card() + " WHERE id=?",
        CARD_ROW_MAPPER, cardId);
    if (card.isEmpty()) {
      return card;
    }
    List<String> labelIds = JdbcTemplate.query(conn,
        "SELECT label_id FROM " + tables.cardLabel() + " WHERE card_id=? ORDER BY label_id",
        rs -> rs.getString(1), cardId);
    return Optional.of(card.get().withLabelIds(new LinkedHashSet<>(labelIds)));
  }

  @Override
  public int updateCard(Connection conn, Card card) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tables.card()
            + " SET list_id=?, title=?, description=?, order_key=?, due_date=?, archived=? WHERE id=?",
        card.listId(), card.title(), card.description(), card.orderKey(), card.dueDate(),
        card.archived(), card.id());
  }

  @Override
  public List<Card> listCards(Connection conn, String listId) {
    List<Card> cards = JdbcTemplate.query(conn,
        "SELECT " + CARD_COLUMNS + " FROM " + tables.card() + " WHERE list_id=? ORDER BY order_key",
        CARD_ROW_MAPPER, listId);
    if (cards.isEmpty()) {
      return cards;
    }
    Map<String, Set<String>> labelsByCard = new HashMap<>();
    JdbcTemplate.query(conn,
        "SELECT cl.card_id, cl.label_id FROM " + tables.cardLabel() + " cl"
            + " JOIN " + tables.card() + " c ON c.id = cl.card_id"
            + " WHERE c.list_id=? ORDER BY cl.label_id",
        rs -> labelsByCard.computeIfAbsent(rs.getString(1), id -> new LinkedHashSet<>())
            .add(rs.getString(2)),
        listId);
    List<Card> result = new ArrayList<>(cards.size());
    for (Card card : cards) {
      Set<String> labelIds = labelsByCard.get(card.id());
      result.add(labelIds == null ? card : card.withLabelIds(labelIds));
    }
    return result;
  }

  @Override
  public int deleteCardCascade(Connection conn, String cardId) {
    JdbcTemplate.update(conn, "DELETE FROM " + tables.comment() + " WHERE card_id=?", cardId);
    JdbcTemplate.update(conn, "DELETE FROM " + tables.cardLabel() + " WHERE card_id=?", cardId);
    return JdbcTemplate.update(conn, "DELETE FROM " + tables.card() + " WHERE id=?", cardId);
  }

  // ── Labels and comments ─────────────────────────────────────────

  @Override
  public void insertLabel(Connection conn, Label label) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + tables.label() + " (id, board_id, name, color) VALUES (?,?,?,?)",
        label.id(), label.boardId(), label.name(), label.color());
  }

  @Override
  public Optional<Label> findLabel(Connection conn, String labelId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT id, board_id, name, color FROM " + tables.label() + " WHERE id=?",
        LABEL_ROW_MAPPER, labelId);
  }

  @Override
  public List<Label> listLabels(Connection conn, String boardId) {
    return JdbcTemplate.query(conn,
        "SELECT id, board_id, name, color FROM " + tables.label() + " WHERE board_id=? ORDER BY name, id",
        LABEL_ROW_MAPPER, boardId);
  }

  @Override
  public int deleteLabel(Connection conn, String labelId) {
    JdbcTemplate.update(conn, "DELETE FROM " + tables.cardLabel() + " WHERE label_id=?", labelId);
    return JdbcTemplate.update(conn, "DELETE FROM " + tables.label() + " WHERE id=?", labelId);
  }

  @Override
  public boolean attachLabel(Connection conn, String cardId, String labelId) {
    List<Integer> existing = JdbcTemplate.query(conn,
        "SELECT 1 FROM " + tables.cardLabel() + " WHERE card_id=? AND label_id=?",
        rs -> rs.getInt(1), cardId, labelId);
    if (!existing.isEmpty()) {
      return false;
    }
    return JdbcTemplate.update(conn,
        "INSERT INTO " + tables.cardLabel() + " (card_id, label_id) VALUES (?,?)", cardId, labelId) > 0;
  }

  @Override
  public boolean detachLabel(Connection conn, String cardId, String labelId) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tables.cardLabel() + " WHERE card_id=? AND label_id=?", cardId, labelId) > 0;
  }

  @Override
  public void insertComment(Connection conn, Comment comment) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + tables.comment() + " (id, card_id, author_id, body, created_at) VALUES (?,?,?,?,?)",
        comment.id(), comment.cardId(), comment.authorId(), comment.body(), comment.createdAt());
  }

  @Override
  public List<Comment> listComments(Connection conn, String cardId) {
    return JdbcTemplate.query(conn,
        "SELECT id, card_id, author_id, body, created_at FROM " + tables.comment()
            + " WHERE card_id=? ORDER BY created_at, id",
        COMMENT_ROW_MAPPER, cardId);
  }

  // ── Ordering ────────────────────────────────────────────────────

  @Override
  public Optional<OrderedItem> findItem(Connection conn, OrderedCollection collection, String itemId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT id, order_key FROM " + itemTable(collection)
            + " WHERE id=? AND " + parentColumn(collection) + "=?",
        ITEM_ROW_MAPPER, itemId, collection.parentId());
  }

  @Override
  public Neighbors readNeighbors(Connection conn, OrderedCollection collection, long key, String excludeId) {
    OrderedItem previous = nearest(conn, collection, "order_key<?", "DESC", key, excludeId);
    OrderedItem next = nearest(conn, collection, "order_key>?", "ASC", key, excludeId);
    return new Neighbors(previous, next);
  }

  @Override
  public Neighbors readEdges(Connection conn, OrderedCollection collection, String excludeId) {
    OrderedItem first = nearest(conn, collection, null, "ASC", null, excludeId);
    OrderedItem last = nearest(conn, collection, null, "DESC", null, excludeId);
    return new Neighbors(first, last);
  }

  @Override
  public List<OrderedItem> readOrder(Connection conn, OrderedCollection collection) {
    return JdbcTemplate.query(conn,
        "SELECT id, order_key FROM " + itemTable(collection)
            + " WHERE " + parentColumn(collection) + "=? ORDER BY order_key",
        ITEM_ROW_MAPPER, collection.parentId());
  }

  /**
   * Two passes: every item first gets a distinct negative key, then its final key. Keys
   * stay unique after each statement, which the {@code UNIQUE(parent, order_key)}
   * constraint requires.
   */
  @Override
  public void rewriteOrder(Connection conn, OrderedCollection collection, List<OrderedItem> items) {
    String sql = "UPDATE " + itemTable(collection) + " SET order_key=? WHERE id=? AND "
        + parentColumn(collection) + "=?";
    List<Object[]> parking = new ArrayList<>(items.size());
    List<Object[]> placing = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      OrderedItem item = items.get(i);
      parking.add(new Object[] {-(i + 1L), item.id(), collection.parentId()});
      placing.add(new Object[] {item.orderKey(), item.id(), collection.parentId()});
    }
    JdbcTemplate.batchUpdate(conn, sql, parking);
    JdbcTemplate.batchUpdate(conn, sql, placing);
  }

  private OrderedItem nearest(Connection conn, OrderedCollection collection, String keyCondition,
      String direction, Long key, String excludeId) {
    StringBuilder sql = new StringBuilder("SELECT id, order_key FROM ")
        .append(itemTable(collection))
        .append(" WHERE ").append(parentColumn(collection)).append("=?");
    List<Object> params = new ArrayList<>(3);
    params.add(collection.parentId());
    if (keyCondition != null) {
      sql.append(" AND ").append(keyCondition);
      params.add(key);
    }
    if (excludeId != null) {
      sql.append(" AND id<>?");
      params.add(excludeId);
    }
    sql.append(" ORDER BY order_key ").append(direction).append(" LIMIT 1");
    return JdbcTemplate.queryOne(conn, sql.toString(), ITEM_ROW_MAPPER, params.toArray())
        .orElse(null);
  }

  protected String itemTable(OrderedCollection collection) {
    return collection.kind() == OrderedCollection.Kind.BOARD_LISTS ? tables.list() : tables.card();
  }

  protected static String parentColumn(OrderedCollection collection) {
    return collection.kind() == OrderedCollection.Kind.BOARD_LISTS ? "board_id" : "list_id";
  }
}
