/**
 * The mutation engine: one store transaction per board operation, with the board row
 * as the serialization point for authorization, position validation and order key
 * allocation.
 *
 * @see kanban.engine.MutationEngine
 */
package kanban.engine;
