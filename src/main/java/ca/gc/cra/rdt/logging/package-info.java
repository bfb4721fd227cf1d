/**
 * Logging helpers: bounded payload previews and runtime verbosity control.
 */
package ca.gc.cra.rdt.logging;
