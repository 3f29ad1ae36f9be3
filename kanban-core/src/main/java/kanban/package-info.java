/**
 * Root API of the Kanban engine: ordered lists and cards on shared boards, mutated
 * concurrently by users with board-scoped roles.
 *
 * <h2>Core Design</h2>
 * <p>Lists of a board and cards of a list carry persisted integer order keys
 * ({@linkplain kanban.order.OrderKeys key domain}); display order is ascending key order.
 * Every mutation runs in one store transaction that first locks the board row, then
 * re-reads its target, {@linkplain kanban.auth.AuthorizationGuard authorizes} against the
 * role stored at that moment, reads fresh neighbor keys and
 * {@linkplain kanban.order.OrderKeyAllocator allocates} a key between them. When two
 * neighbors leave no room, the collection is rebalanced inside the same transaction.
 *
 * <p>{@link kanban.KanbanClient} returns every outcome as a {@link kanban.MutationResult}.
 * Clients that render changes before the server answers feed those results into a
 * {@link kanban.reconcile.SpeculativeView}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>kanban-core</b>: model, allocator, guard, engine, SPIs</li>
 *   <li><b>kanban-jdbc</b>: JDBC board stores (H2, MySQL, PostgreSQL) and transactions</li>
 *   <li><b>kanban-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>kanban-spring-adapter</b>: Spring-managed transactions</li>
 *   <li><b>kanban-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var store   = JdbcBoardStores.detect(dataSource);
 * var runner  = JdbcTransactionRunner.builder()
 *     .dataSource(dataSource)
 *     .build();
 * var engine  = MutationEngine.builder().store(store).transactionRunner(runner).build();
 * var client  = KanbanClient.builder().engine(engine).build();
 *
 * Principal alice = Principal.of("alice");
 * Board board = client.createBoard(alice, "Roadmap", Visibility.PRIVATE).orElseThrow();
 * BoardList todo = client.createList(alice, board.id(), "To Do", Position.atEnd()).orElseThrow();
 * MutationResult<Card> card = client.createCard(alice, todo.id(), "Write docs", Position.atStart());
 * }</pre>
 */
package kanban;
