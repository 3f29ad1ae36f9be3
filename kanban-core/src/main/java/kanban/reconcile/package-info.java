/**
 * Client-side reconciliation of speculative state with server results.
 *
 * @see kanban.reconcile.SpeculativeView
 */
package kanban.reconcile;
