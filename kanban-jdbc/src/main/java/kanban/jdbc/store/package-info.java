/**
 * JDBC-based {@link kanban.spi.BoardStore} implementations.
 *
 * <p>{@link kanban.jdbc.store.AbstractJdbcBoardStore} provides shared SQL, row mapping,
 * explicit cascade deletes and the two-pass order rewrite; subclasses supply native
 * upserts: H2 ({@code MERGE INTO ... KEY}), MySQL ({@code ON DUPLICATE KEY UPDATE}) and
 * PostgreSQL ({@code ON CONFLICT}).
 *
 * @see kanban.jdbc.store.AbstractJdbcBoardStore
 * @see kanban.jdbc.store.JdbcBoardStores
 */
package kanban.jdbc.store;
