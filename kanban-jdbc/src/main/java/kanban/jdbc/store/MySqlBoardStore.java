package kanban.jdbc.store;

import kanban.jdbc.JdbcTemplate;
import kanban.jdbc.TableNames;
import kanban.model.Membership;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL board store. Also compatible with TiDB.
 *
 * <p>Uses {@code ON DUPLICATE KEY UPDATE} for membership upserts and
 * {@code INSERT IGNORE} for label links.
 */
public final class MySqlBoardStore extends AbstractJdbcBoardStore {

  public MySqlBoardStore() {
    super();
  }

  public MySqlBoardStore(TableNames tables) {
    super(tables);
  }

  @Override
  public AbstractJdbcBoardStore withTablePrefix(String tablePrefix) {
    return new MySqlBoardStore(TableNames.withPrefix(tablePrefix));
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public void saveMembership(Connection conn, Membership membership) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + tables().membership() + " (board_id, user_id, role) VALUES (?,?,?)"
            + " ON DUPLICATE KEY UPDATE role=VALUES(role)",
        membership.boardId(), membership.userId(), membership.role().code());
  }

  @Override
  public boolean attachLabel(Connection conn, String cardId, String labelId) {
    return JdbcTemplate.update(conn,
        "INSERT IGNORE INTO " + tables().cardLabel() + " (card_id, label_id) VALUES (?,?)",
        cardId, labelId) > 0;
  }
}
