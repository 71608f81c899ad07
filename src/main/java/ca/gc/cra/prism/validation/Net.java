package ca.gc.cra.prism.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Checks the {@code ip=} bind address before the server tries to listen on it.
 *
 * <p>Accepted forms: dotted IPv4, DNS hostname, IPv6 literal with or without brackets. Hostnames are
 * not resolved here; resolution happens when the socket is bound.</p>
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int HOSTNAME_MAX = 253;
  private static final Pattern DOTTED_QUAD = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
  private static final Pattern LABEL = Pattern.compile("[A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?");

  private Net() {
    // Utility
  }

  /**
   * Validates and normalizes a bind address.
   *
   * @param value address such as {@code 0.0.0.0}, {@code localhost} or {@code [::1]}
   * @return trimmed address; IPv6 brackets are removed
   * @throws IllegalArgumentException if the address is malformed
   */
  public static String validateBindAddress(String value) {
    String address = Strings.requireNonBlank("ip", value);
    if (address.startsWith("[") || address.endsWith("]")) {
      if (!address.startsWith("[") || !address.endsWith("]")) {
        throw new IllegalArgumentException("ip has unbalanced IPv6 brackets: " + address);
      }
      return requireIpv6(address.substring(1, address.length() - 1));
    }
    if (address.contains(":")) {
      return requireIpv6(address);
    }
    if (DOTTED_QUAD.matcher(address).matches()) {
      for (String octet : address.split("\\.")) {
        Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return address;
    }
    return requireHostname(address);
  }

  private static String requireHostname(String host) {
    if (host.length() > HOSTNAME_MAX) {
      throw new IllegalArgumentException("hostname longer than " + HOSTNAME_MAX + " characters");
    }
    // split drops trailing empty strings, so check the dot explicitly
    if (host.startsWith(".") || host.endsWith(".") || host.contains("..")) {
      throw new IllegalArgumentException("hostname has an empty label: " + host);
    }
    for (String label : host.split("\\.")) {
      if (!LABEL.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname label '" + label + "' in " + host);
      }
    }
    return host;
  }

  private static String requireIpv6(String literal) {
    if (literal.isEmpty() || !literal.contains(":")) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + literal);
    }
    try {
      if (InetAddress.getByName(literal) instanceof Inet6Address) {
        return literal;
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + literal, ex);
    }
    throw new IllegalArgumentException("invalid IPv6 literal: " + literal);
  }
}
