package kanban.jdbc.store;

import kanban.jdbc.JdbcTemplate;
import kanban.jdbc.TableNames;
import kanban.model.Membership;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL board store.
 *
 * <p>Uses {@code ON CONFLICT} for membership upserts and label links.
 */
public final class PostgresBoardStore extends AbstractJdbcBoardStore {

  public PostgresBoardStore() {
    super();
  }

  public PostgresBoardStore(TableNames tables) {
    super(tables);
  }

  @Override
  public AbstractJdbcBoardStore withTablePrefix(String tablePrefix) {
    return new PostgresBoardStore(TableNames.withPrefix(tablePrefix));
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void saveMembership(Connection conn, Membership membership) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + tables().membership() + " (board_id, user_id, role) VALUES (?,?,?)"
            + " ON CONFLICT (board_id, user_id) DO UPDATE SET role=EXCLUDED.role",
        membership.boardId(), membership.userId(), membership.role().code());
  }

  @Override
  public boolean attachLabel(Connection conn, String cardId, String labelId) {
    return JdbcTemplate.update(conn,
        "INSERT INTO " + tables().cardLabel() + " (card_id, label_id) VALUES (?,?)"
            + " ON CONFLICT (card_id, label_id) DO NOTHING",
        cardId, labelId) > 0;
  }
}
