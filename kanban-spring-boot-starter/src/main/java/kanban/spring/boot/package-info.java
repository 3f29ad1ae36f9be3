/**
 * Spring Boot auto-configuration for the Kanban engine.
 *
 * <p>{@link kanban.spring.boot.KanbanAutoConfiguration} wires a
 * {@link kanban.engine.MutationEngine} and a {@link kanban.KanbanClient} from
 * {@code kanban.*} application properties and the application's {@code DataSource}.
 * {@link kanban.spring.boot.KanbanMicrometerAutoConfiguration} adds metrics when
 * Micrometer is present.
 *
 * @see kanban.spring.boot.KanbanProperties
 */
package kanban.spring.boot;
