package ca.gc.cra.rigging.config;

import ca.gc.cra.rigging.validation.Numbers;
import ca.gc.cra.rigging.validation.ValidationException;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * Structured form of the {@code bind} setting.
 *
 * <p>Recognized forms are {@code HOST}, {@code HOST:PORT}, {@code [IPV6]}, {@code [IPV6]:PORT} and
 * {@code unix:PATH}. A host without a port binds {@link #DEFAULT_PORT}.</p>
 *
 * @param kind classification of the bind string
 * @param host lower-cased host, {@code null} for unix sockets
 * @param port TCP port, {@code -1} for unix sockets
 * @param path socket path, {@code null} for TCP endpoints
 * @since 0.1.0
 */
public record BindAddress(Kind kind, String host, int port, String path) {
  /** Port used when the bind string names a host only. */
  public static final int DEFAULT_PORT = 8000;

  private static final String UNIX_PREFIX = "unix:";
  private static final String ANY_HOST = "0.0.0.0";

  /** Classification of a bind string. */
  public enum Kind {
    /** {@code HOST}: port defaults to {@link #DEFAULT_PORT}. */
    HOST_ONLY,
    /** {@code HOST:PORT}. */
    HOST_PORT,
    /** {@code unix:PATH}. */
    UNIX
  }

  /**
   * Parses a bind string.
   *
   * @param bind raw bind setting value
   * @return structured address
   * @throws ValidationException if the string is blank, the port is not numeric or out of range,
   *     or an IPv6 literal is malformed
   */
  public static BindAddress parse(String bind) {
    if (bind == null || bind.isBlank()) {
      throw new ValidationException("bind address must not be blank");
    }
    String value = bind.strip();
    if (value.regionMatches(true, 0, UNIX_PREFIX, 0, UNIX_PREFIX.length())) {
      String path = value.substring(UNIX_PREFIX.length());
      if (path.isBlank()) {
        throw new ValidationException("unix socket path must not be blank");
      }
      return new BindAddress(Kind.UNIX, null, -1, path);
    }
    if (value.startsWith("[")) {
      return parseBracketed(value);
    }

    int colon = value.indexOf(':');
    if (colon < 0) {
      return new BindAddress(Kind.HOST_ONLY, value.toLowerCase(Locale.ROOT), DEFAULT_PORT, null);
    }
    if (value.indexOf(':', colon + 1) >= 0) {
      throw new ValidationException("IPv6 host must be wrapped in [ ]: " + value);
    }
    String host = value.substring(0, colon);
    return new BindAddress(Kind.HOST_PORT,
        host.isEmpty() ? ANY_HOST : host.toLowerCase(Locale.ROOT),
        parsePort(value.substring(colon + 1)), null);
  }

  /**
   * Renders the address back into bind string form.
   *
   * @return {@code unix:PATH} or {@code HOST:PORT}, with IPv6 hosts bracketed
   */
  public String toBindString() {
    if (kind == Kind.UNIX) {
      return UNIX_PREFIX + path;
    }
    String renderedHost = host.indexOf(':') >= 0 ? '[' + host + ']' : host;
    return renderedHost + ':' + port;
  }

  private static BindAddress parseBracketed(String value) {
    int close = value.indexOf(']');
    if (close < 0) {
      throw new ValidationException("bind address must close IPv6 literal with ']'");
    }
    String host = value.substring(1, close);
    validateIpv6(host);
    String rest = value.substring(close + 1);
    if (rest.isEmpty()) {
      return new BindAddress(Kind.HOST_ONLY, host.toLowerCase(Locale.ROOT), DEFAULT_PORT, null);
    }
    if (rest.charAt(0) != ':') {
      throw new ValidationException("bind address must use [IPV6]:PORT format");
    }
    return new BindAddress(Kind.HOST_PORT, host.toLowerCase(Locale.ROOT),
        parsePort(rest.substring(1)), null);
  }

  private static int parsePort(String text) {
    final int port;
    try {
      port = Integer.parseInt(text.strip());
    } catch (NumberFormatException ex) {
      throw new ValidationException("port must be numeric (was " + text + ")", ex);
    }
    return (int) Numbers.requireRange("port", port, 0, 65535);
  }

  private static void validateIpv6(String host) {
    if (host.isEmpty() || host.indexOf(':') < 0) {
      throw new ValidationException("invalid IPv6 literal: " + host);
    }
    try {
      InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new ValidationException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new ValidationException("invalid IPv6 literal: " + host, ex);
    }
  }
}
