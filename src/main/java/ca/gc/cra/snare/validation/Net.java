package ca.gc.cra.snare.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for listener bind addresses and ports.
 *
 * <p>Accepts hostnames, IPv4 dotted quads, and bare IPv6 literals (with or without brackets). No name
 * resolution happens for hostnames; the listener reports resolution failures when it binds.</p>
 *
 * @since 0.1.0
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final int MAX_PORT = 65_535;

  // IPv4 dotted-quad shape (fast pre-check); octets are range-checked separately.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a bind host and returns its normalized form (brackets stripped from IPv6 literals).
   *
   * @param host candidate host such as {@code 0.0.0.0}, {@code localhost}, or {@code [::1]}
   * @return normalized host string
   * @throws IllegalArgumentException when the host is blank or malformed
   */
  public static String validateBindHost(String host) {
    String sanitized = Strings.requireNonBlank("host", host);
    if (sanitized.startsWith("[")) {
      if (!sanitized.endsWith("]")) {
        throw new IllegalArgumentException("host must close IPv6 literal with ']'");
      }
      sanitized = sanitized.substring(1, sanitized.length() - 1);
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(sanitized);
      return sanitized;
    }
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      validateIpv4Octets(sanitized);
      return sanitized;
    }
    validateHostname(sanitized);
    return sanitized;
  }

  /**
   * Validates a listener port.
   *
   * @param name diagnostic label (e.g. {@code sshPort})
   * @param port candidate port
   * @param allowEphemeral whether {@code 0} (kernel-assigned port) is acceptable
   * @return the validated port
   * @throws IllegalArgumentException when the port is out of range
   */
  public static int validatePort(String name, int port, boolean allowEphemeral) {
    return (int) Numbers.requireRange(name, port, allowEphemeral ? 0 : 1, MAX_PORT);
  }

  private static void validateHostname(String host) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  /** Validates a raw IPv6 literal (without brackets) using JDK parsing; literals never hit DNS. */
  private static void validateIpv6(String host) {
    try {
      final InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
