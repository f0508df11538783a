package ca.gc.cra.midscan.infrastructure.imap;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection parameters for {@link JakartaMailSessionAdapter}.
 *
 * @param host server host name
 * @param port server port
 * @param ssl {@code true} for implicit TLS ({@code imaps})
 * @param timeout socket connect and read timeout
 * @since 0.1.0
 */
public record ImapConnectionSettings(String host, int port, boolean ssl, Duration timeout) {

  public ImapConnectionSettings {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(timeout, "timeout");
    if (host.isBlank()) {
      throw new IllegalArgumentException("host must not be blank");
    }
    if (port < 1 || port > 65_535) {
      throw new IllegalArgumentException("port must be in range 1..65535");
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  /**
   * Returns the Jakarta Mail store protocol name.
   *
   * @return {@code imaps} or {@code imap}
   */
  public String protocol() {
    return ssl ? "imaps" : "imap";
  }

  /**
   * Builds the Jakarta Mail session properties for these settings.
   *
   * @return fresh properties
   */
  public Properties toMailProperties() {
    String prefix = "mail." + protocol() + ".";
    String millis = Long.toString(timeout.toMillis());
    Properties props = new Properties();
    props.setProperty("mail.store.protocol", protocol());
    props.setProperty(prefix + "host", host);
    props.setProperty(prefix + "port", Integer.toString(port));
    props.setProperty(prefix + "connectiontimeout", millis);
    props.setProperty(prefix + "timeout", millis);
    props.setProperty(prefix + "writetimeout", millis);
    props.setProperty(prefix + "partialfetch", "false");
    return props;
  }
}
