/**
 * Timer adapters running keyed countdowns on a shared scheduler thread.
 */
package ca.gc.cra.rdt.infrastructure.timer;
