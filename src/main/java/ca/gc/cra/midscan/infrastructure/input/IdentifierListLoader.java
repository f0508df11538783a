package ca.gc.cra.midscan.infrastructure.input;

import ca.gc.cra.midscan.domain.message.MessageIdentifier;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects identifiers from inline values and identifier files, normalizing each and keeping the first occurrence
 * of every bare form.
 *
 * @since 0.1.0
 */
public final class IdentifierListLoader {
  private static final Logger log = LoggerFactory.getLogger(IdentifierListLoader.class);

  private IdentifierListLoader() {
    // Utility
  }

  /**
   * Loads identifiers.
   *
   * @param inline values from {@code ids=}; each may itself hold comma-separated identifiers
   * @param file optional UTF-8 file with one identifier per line; blank lines and {@code #} comments are ignored
   * @return de-duplicated identifiers in input order, inline values first
   * @throws IOException if the file cannot be read
   */
  public static List<MessageIdentifier> load(Collection<String> inline, Path file) throws IOException {
    List<String> raw = new ArrayList<>();
    if (inline != null) {
      for (String value : inline) {
        if (value != null) {
          raw.addAll(List.of(value.split(",")));
        }
      }
    }
    if (file != null) {
      for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
        String trimmed = line.strip();
        if (!trimmed.startsWith("#")) {
          raw.add(trimmed);
        }
      }
    }
    return normalize(raw);
  }

  /**
   * Normalizes and de-duplicates raw identifier strings.
   *
   * @param raw raw values
   * @return de-duplicated, non-empty identifiers in first-seen order
   */
  public static List<MessageIdentifier> normalize(Collection<String> raw) {
    Set<MessageIdentifier> unique = new LinkedHashSet<>();
    int duplicates = 0;
    for (String value : raw) {
      MessageIdentifier identifier = MessageIdentifier.parse(value);
      if (identifier.isEmpty()) {
        continue;
      }
      if (!unique.add(identifier)) {
        duplicates++;
      }
    }
    if (duplicates > 0) {
      log.info("Ignored {} duplicate identifier(s)", duplicates);
    }
    return List.copyOf(unique);
  }
}
