package ca.gc.cra.midscan.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each MIDSCAN command.
 *
 * <p>Connection defaults come from the {@code IMAP_HOST}, {@code IMAP_PORT} and {@code IMAP_USER} environment
 * variables so that YAML and CLI values still take precedence over them.</p>
 */
public final class DefaultsForMode {
  /** Environment variable holding the default server host. */
  public static final String ENV_HOST = "IMAP_HOST";
  /** Environment variable holding the default server port. */
  public static final String ENV_PORT = "IMAP_PORT";
  /** Environment variable holding the default login name. */
  public static final String ENV_USER = "IMAP_USER";

  private DefaultsForMode() {}

  /**
   * Returns defaults for {@code mode} using the process environment.
   *
   * @param mode target command (resolve, mailboxes)
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap(String mode) {
    return asFlatMap(mode, System.getenv());
  }

  /**
   * Returns defaults for {@code mode} using the supplied environment.
   *
   * @param mode target command (resolve, mailboxes)
   * @param env environment variables
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap(String mode, Map<String, String> env) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> environment = env == null ? Map.of() : env;
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(commonDefaults(environment));
    defaults.putAll(switch (normalized) {
      case "resolve" -> resolveDefaults();
      case "mailboxes" -> Map.of();
      case "search" -> searchDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> commonDefaults(Map<String, String> env) {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("host", env.getOrDefault(ENV_HOST, ""));
    map.put("port", env.getOrDefault(ENV_PORT, ""));
    map.put("user", env.getOrDefault(ENV_USER, ""));
    map.put("ssl", "");
    map.put("provider", "");
    map.put("providersFile", "");
    map.put("timeoutSeconds", Integer.toString(ImapAccountConfig.DEFAULT_TIMEOUT_SECONDS));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return map;
  }

  private static Map<String, String> searchDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("from", "");
    map.put("subject", "");
    map.put("mailbox", HeaderSearchConfig.DEFAULT_MAILBOX);
    map.put("limit", Integer.toString(HeaderSearchConfig.DEFAULT_LIMIT));
    return map;
  }

  private static Map<String, String> resolveDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("ids", "");
    map.put("idsFile", "");
    map.put("mailboxes", "DEFAULT");
    map.put("startMailbox", "");
    map.put("hintDomains", "");
    map.put("out", ResolveConfig.DEFAULT_OUT);
    map.put("format", "csv");
    map.put("preview", "false");
    map.put("allowOverwrite", "true");
    map.put("dryRun", "false");
    return map;
  }
}
