/**
 * The shared rule store.
 *
 * <p>
 * {@link com.carillon.core.store.RuleStore} is the only mutable state shared
 * between the editor thread and the playout thread.
 * </p>
 *
 * @since 1.0.0
 */
package com.carillon.core.store;
