/**
 * Loading of the startup rule set.
 *
 * <p>
 * The schedule the process starts with is defined in YAML and loaded by
 * {@link com.carillon.core.config.RulesLoader}. Entries use the operator's
 * rule notation and are validated on load.
 * </p>
 *
 * @since 1.0.0
 */
package com.carillon.core.config;
