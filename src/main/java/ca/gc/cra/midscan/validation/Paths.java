package ca.gc.cra.midscan.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Validation for operator-supplied input and output file paths.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an output file location.
   *
   * @param path target file
   * @param allowOverwrite whether an existing regular file may be replaced
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the path is unusable
   */
  public static Path validateOutputFile(Path path, boolean allowOverwrite) {
    Path normalized = checkText(path).toAbsolutePath().normalize();
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!Files.isRegularFile(normalized, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("output path is not a regular file: " + normalized);
      }
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            "output file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException("output file is not writable: " + normalized);
      }
      return normalized;
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException("output directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("output directory is not writable: " + parent);
    }
    return normalized;
  }

  /**
   * Validates a readable input file.
   *
   * @param path file to read
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the file does not exist or cannot be read
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = checkText(path).toAbsolutePath().normalize();
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path checkText(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.isBlank()) {
      throw new IllegalArgumentException("path must not be blank");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path;
  }
}
