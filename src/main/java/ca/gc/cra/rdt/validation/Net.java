package ca.gc.cra.rdt.validation;

import java.net.InetSocketAddress;
import java.util.regex.Pattern;

/**
 * Parses {@code host:port} strings from configuration into socket addresses.
 *
 * <p>Accepts hostnames, IPv4 literals and bracketed IPv6 literals. Port {@code 0} is accepted for
 * bind addresses and means "any free port".</p>
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern LABEL_PATTERN = Pattern.compile("\\A[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?\\z");

  private Net() {
    // Utility
  }

  /**
   * Parses a {@code host:port} string.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate such as {@code 127.0.0.1:9000} or {@code [::1]:0}
   * @return unresolved-if-necessary socket address
   * @throws IllegalArgumentException when the host or port is invalid
   */
  public static InetSocketAddress parseHostPort(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0 || idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException(name + " must use [IPV6]:PORT format (was " + value + ")");
      }
      host = sanitized.substring(1, idx);
      portPart = sanitized.substring(idx + 2);
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException(name + " must use HOST:PORT format (was " + value + ")");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException(name + ": IPv6 host must be wrapped in [ ]");
      }
      validateHost(name, host);
    }
    int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange(name + " port", port, 0, 65_535);
    return new InetSocketAddress(host, port);
  }

  private static void validateHost(String name, String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      for (String octet : host.split("\\.")) {
        Numbers.requireRange(name + " IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return;
    }
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(name + ": hostname longer than " + MAX_HOSTNAME_LENGTH);
    }
    for (String label : host.split("\\.", -1)) {
      if (!LABEL_PATTERN.matcher(label).matches()) {
        throw new IllegalArgumentException(name + ": invalid hostname label '" + label + "'");
      }
    }
  }
}
