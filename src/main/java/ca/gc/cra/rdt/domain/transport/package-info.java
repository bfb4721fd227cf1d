/**
 * Transport outcomes, failures and statistics shared by the packet engine and the connection layer.
 */
package ca.gc.cra.rdt.domain.transport;
