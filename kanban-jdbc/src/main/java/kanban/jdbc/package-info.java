/**
 * Shared JDBC plumbing for the board stores: {@link kanban.jdbc.JdbcTemplate},
 * {@link kanban.jdbc.TableNames} and {@link kanban.jdbc.KanbanStoreException}.
 */
package kanban.jdbc;
