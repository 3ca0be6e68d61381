/**
 * Rule due-time decision. Pure functions, no state.
 *
 * @since 1.0.0
 */
package com.carillon.core.matching;
