package ca.gc.cra.midscan.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // an explicit provider replaces connection defaults that only came from the environment
    if (!trim(cliCopy.get("provider")).isEmpty() || !trim(yamlCopy.get("provider")).isEmpty()) {
      if (!cliCopy.containsKey("host") && !yamlCopy.containsKey("host")) {
        merged.remove("host");
      }
      if (!cliCopy.containsKey("port") && !yamlCopy.containsKey("port")) {
        merged.remove("port");
      }
    }

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (trim(effective.get("host")).isEmpty() && trim(effective.get("provider")).isEmpty()) {
      throw new IllegalArgumentException(
          "host is required for " + mode + " (set host=, provider= or " + DefaultsForMode.ENV_HOST + ")");
    }
    if (trim(effective.get("user")).isEmpty()) {
      throw new IllegalArgumentException(
          "user is required for " + mode + " (set user= or " + DefaultsForMode.ENV_USER + ")");
    }
    if ("resolve".equals(mode.trim().toLowerCase(Locale.ROOT))
        && trim(effective.get("ids")).isEmpty()
        && trim(effective.get("idsFile")).isEmpty()) {
      throw new IllegalArgumentException("no Message-IDs given; use ids=ID[,ID...] or idsFile=PATH");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
