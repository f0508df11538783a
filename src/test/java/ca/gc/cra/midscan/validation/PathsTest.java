package ca.gc.cra.midscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void newOutputFileInExistingDirectoryIsAccepted() {
    Path target = tempDir.resolve("matches.csv");
    assertEquals(target.toAbsolutePath().normalize(), Paths.validateOutputFile(target, false));
  }

  @Test
  void existingOutputFileNeedsOverwritePermission() throws IOException {
    Path target = Files.createFile(tempDir.resolve("matches.csv"));

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(target, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(target.toAbsolutePath().normalize(), Paths.validateOutputFile(target, true));
  }

  @Test
  void outputRejectsDirectoriesAndMissingParents() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(tempDir, true));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile(tempDir.resolve("missing").resolve("out.csv"), true));
  }

  @Test
  void readableFileMustExist() throws IOException {
    Path ids = Files.writeString(tempDir.resolve("ids.txt"), "a@example.com\n");

    assertEquals(ids.toAbsolutePath().normalize(), Paths.validateReadableFile(ids));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir.resolve("absent.txt")));
  }
}
