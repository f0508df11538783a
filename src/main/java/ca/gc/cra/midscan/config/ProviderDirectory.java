package ca.gc.cra.midscan.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable map of provider names to IMAP endpoints.
 * <p><strong>Why:</strong> Operators address common providers by name and keep customer-specific hosts in a local
 * JSON file rather than in code.</p>
 * <p><strong>Role:</strong> Configuration value built once per run and passed to config parsing.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Override files map names to objects with {@code server} (or {@code host}), optional {@code port} (default
 * 993) and optional {@code ssl} (default {@code true}):</p>
 * <pre>{@code {"mycorp": {"server": "mail.mycorp.example.com", "port": 993}}}</pre>
 *
 * @since 0.1.0
 */
public final class ProviderDirectory {
  private static final Logger log = LoggerFactory.getLogger(ProviderDirectory.class);
  private static final int DEFAULT_PORT = 993;
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Map<String, ProviderEndpoint> endpoints;

  private ProviderDirectory(Map<String, ProviderEndpoint> endpoints) {
    this.endpoints = Map.copyOf(endpoints);
  }

  /**
   * Returns the built-in directory.
   *
   * @return directory with {@code gmail}, {@code outlook} and {@code yahoo}
   */
  public static ProviderDirectory builtIn() {
    Map<String, ProviderEndpoint> map = new LinkedHashMap<>();
    put(map, new ProviderEndpoint("gmail", "imap.gmail.com", DEFAULT_PORT, true));
    put(map, new ProviderEndpoint("outlook", "outlook.office365.com", DEFAULT_PORT, true));
    put(map, new ProviderEndpoint("yahoo", "imap.mail.yahoo.com", DEFAULT_PORT, true));
    return new ProviderDirectory(map);
  }

  /**
   * Returns a directory extended and overridden by entries from a JSON file. A missing or malformed file is
   * logged and leaves this directory unchanged.
   *
   * @param file JSON override file; {@code null} returns this directory
   * @return merged directory
   */
  public ProviderDirectory withOverrides(Path file) {
    if (file == null) {
      return this;
    }
    if (!Files.isRegularFile(file)) {
      log.warn("Providers file {} not found; using built-in providers", file);
      return this;
    }
    try {
      return withOverrides(MAPPER.readTree(file.toFile()));
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      log.warn("Ignoring malformed providers file {}: {}", file, ex.getMessage());
      return this;
    } catch (IOException ex) {
      log.warn("Unable to read providers file {}: {}", file, ex.getMessage());
      return this;
    }
  }

  ProviderDirectory withOverrides(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("providers document must be a JSON object");
    }
    Map<String, ProviderEndpoint> merged = new LinkedHashMap<>(endpoints);
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode node = field.getValue();
      if (!node.isObject()) {
        throw new IllegalArgumentException("provider " + field.getKey() + " must be an object");
      }
      String host = node.path("server").asText(node.path("host").asText(""));
      int port = node.path("port").asInt(DEFAULT_PORT);
      boolean ssl = node.path("ssl").asBoolean(true);
      put(merged, new ProviderEndpoint(field.getKey(), host, port, ssl));
    }
    log.info("Loaded {} provider override(s)", root.size());
    return new ProviderDirectory(merged);
  }

  /**
   * Looks up a provider case-insensitively.
   *
   * @param name provider name
   * @return endpoint when known
   */
  public Optional<ProviderEndpoint> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(endpoints.get(name.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns every endpoint.
   *
   * @return endpoints (unordered)
   */
  public Collection<ProviderEndpoint> endpoints() {
    return endpoints.values();
  }

  private static void put(Map<String, ProviderEndpoint> map, ProviderEndpoint endpoint) {
    map.put(Objects.requireNonNull(endpoint.name()), endpoint);
  }
}
