/**
 * Role-based authorization for board actions.
 *
 * <p>{@link kanban.auth.Action} maps each action to a minimum {@link kanban.model.Role};
 * {@link kanban.auth.AuthorizationGuard} resolves memberships and applies that table.
 */
package kanban.auth;
