/**
 * Stateless validation helpers for configuration values.
 */
package ca.gc.cra.rdt.validation;
