package ca.gc.cra.midscan.config;

import java.util.Locale;
import java.util.Objects;

/**
 * Named IMAP endpoint from the provider directory.
 *
 * @param name lower-case provider key
 * @param host server host
 * @param port server port
 * @param ssl whether implicit TLS is used
 * @since 0.1.0
 */
public record ProviderEndpoint(String name, String host, int port, boolean ssl) {

  public ProviderEndpoint {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(host, "host");
    name = name.trim().toLowerCase(Locale.ROOT);
    host = host.trim();
    if (name.isEmpty() || host.isEmpty()) {
      throw new IllegalArgumentException("provider name and host must not be blank");
    }
    if (port < 1 || port > 65_535) {
      throw new IllegalArgumentException("provider " + name + " port must be in range 1..65535");
    }
  }
}
