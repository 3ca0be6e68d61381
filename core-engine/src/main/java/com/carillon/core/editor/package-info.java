/**
 * Operator-facing boundary: parsing of rule text, rendering of the schedule,
 * and application of edits to the rule store.
 *
 * <p>
 * Nothing malformed gets past {@link com.carillon.core.editor.RuleParser}
 * and {@link com.carillon.core.editor.ScheduleEditor}; the store and the
 * playout loop only ever see valid rules.
 * </p>
 *
 * @since 1.0.0
 */
package com.carillon.core.editor;
