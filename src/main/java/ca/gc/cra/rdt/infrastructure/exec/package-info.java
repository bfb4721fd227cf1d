/**
 * Thread and scheduler factories for transport endpoints.
 */
package ca.gc.cra.rdt.infrastructure.exec;
