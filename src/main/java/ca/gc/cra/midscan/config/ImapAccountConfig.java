package ca.gc.cra.midscan.config;

import ca.gc.cra.midscan.validation.Net;
import ca.gc.cra.midscan.validation.Numbers;
import ca.gc.cra.midscan.validation.Strings;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Server and account settings shared by every command that connects.
 *
 * @param host server host
 * @param port server port
 * @param ssl implicit TLS
 * @param user login name
 * @param timeout socket timeout
 * @param provider provider name the endpoint came from, if any
 * @since 0.1.0
 */
public record ImapAccountConfig(
    String host, int port, boolean ssl, String user, Duration timeout, Optional<String> provider) {
  /** Default IMAPS port. */
  public static final int DEFAULT_PORT = 993;
  /** Default socket timeout. */
  public static final int DEFAULT_TIMEOUT_SECONDS = 60;

  public ImapAccountConfig {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(user, "user");
    Objects.requireNonNull(timeout, "timeout");
    provider = Objects.requireNonNullElse(provider, Optional.empty());
  }

  /**
   * Builds account settings from a flat map. {@code provider=NAME} supplies host, port and TLS unless they are
   * given explicitly.
   *
   * @param args merged configuration
   * @param providers provider directory
   * @return validated settings
   * @throws IllegalArgumentException when required values are missing or invalid
   */
  public static ImapAccountConfig fromMap(Map<String, String> args, ProviderDirectory providers) {
    Objects.requireNonNull(args, "args");
    Objects.requireNonNull(providers, "providers");
    Optional<String> providerName = optional(args.get("provider"));
    Optional<ProviderEndpoint> endpoint = providerName.map(name -> providers.find(name)
        .orElseThrow(() -> new IllegalArgumentException("unknown provider: " + name)));

    String host = Net.validateHost(optional(args.get("host"))
        .or(() -> endpoint.map(ProviderEndpoint::host))
        .orElseThrow(() -> new IllegalArgumentException("host is required (or provider=NAME)")));

    int port = optional(args.get("port"))
        .map(raw -> Numbers.parseInt("port", raw, 1, 65_535))
        .orElseGet(() -> endpoint.map(ProviderEndpoint::port).orElse(DEFAULT_PORT));

    boolean ssl = optional(args.get("ssl"))
        .map(ImapAccountConfig::parseBoolean)
        .orElseGet(() -> endpoint.map(ProviderEndpoint::ssl).orElse(true));

    String user = optional(args.get("user"))
        .map(value -> Strings.requirePrintableAscii("user", value, 320))
        .orElseThrow(() -> new IllegalArgumentException("user is required"));

    int timeoutSeconds = optional(args.get("timeoutSeconds"))
        .map(raw -> Numbers.parseInt("timeoutSeconds", raw, 1, 3_600))
        .orElse(DEFAULT_TIMEOUT_SECONDS);

    return new ImapAccountConfig(host, port, ssl, user, Duration.ofSeconds(timeoutSeconds),
        endpoint.map(ProviderEndpoint::name));
  }

  static Optional<String> optional(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  static boolean parseBoolean(String raw) {
    String value = raw.trim();
    if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes") || value.equals("1")) {
      return true;
    }
    if (value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no") || value.equals("0")) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false (was " + raw + ")");
  }
}
