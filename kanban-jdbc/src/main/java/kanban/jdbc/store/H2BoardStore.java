package kanban.jdbc.store;

import kanban.jdbc.JdbcTemplate;
import kanban.jdbc.TableNames;
import kanban.model.Membership;

import java.sql.Connection;
import java.util.List;

/**
 * H2 board store. Primarily for testing.
 *
 * <p>Uses {@code MERGE INTO ... KEY} for membership upserts.
 */
public final class H2BoardStore extends AbstractJdbcBoardStore {

  public H2BoardStore() {
    super();
  }

  public H2BoardStore(TableNames tables) {
    super(tables);
  }

  @Override
  public AbstractJdbcBoardStore withTablePrefix(String tablePrefix) {
    return new H2BoardStore(TableNames.withPrefix(tablePrefix));
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public void saveMembership(Connection conn, Membership membership) {
    JdbcTemplate.update(conn,
        "MERGE INTO " + tables().membership() + " (board_id, user_id, role) KEY (board_id, user_id) VALUES (?,?,?)",
        membership.boardId(), membership.userId(), membership.role().code());
  }
}
