/**
 * Transport configuration: defaults, YAML profiles and precedence merging.
 * <p><strong>Role:</strong> Consumed by {@code TransportFactory} and by endpoints through {@link ca.gc.cra.rdt.config.TransportConfig}.</p>
 */
package ca.gc.cra.rdt.config;
