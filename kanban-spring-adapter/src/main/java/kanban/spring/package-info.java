/**
 * Spring transaction integration.
 *
 * <p>{@link kanban.spring.SpringTransactionRunner} runs engine operations in Spring-managed
 * transactions; {@link kanban.spring.SpringTxContext} hands the board store the
 * transaction's connection and maps commit callbacks onto transaction synchronizations.
 *
 * @see kanban.spring.SpringTransactionRunner
 * @see kanban.spring.SpringTxContext
 */
package kanban.spring;
