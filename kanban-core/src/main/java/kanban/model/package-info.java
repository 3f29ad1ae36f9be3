/**
 * Persisted board structure: boards, ordered lists, ordered cards, labels, comments
 * and memberships.
 *
 * <p>All types are immutable records. Changes go through {@link kanban.engine.MutationEngine},
 * which produces new instances via the {@code with*} copy methods.
 *
 * @see kanban.model.Board
 * @see kanban.model.BoardList
 * @see kanban.model.Card
 * @see kanban.model.Membership
 */
package kanban.model;
