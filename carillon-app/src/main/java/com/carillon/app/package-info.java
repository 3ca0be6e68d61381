/**
 * Carillon process: environment configuration, console, audio output, and
 * thread wiring.
 *
 * @since 1.0.0
 */
package com.carillon.app;
