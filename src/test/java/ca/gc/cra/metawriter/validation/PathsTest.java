package ca.gc.cra.metawriter.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
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
  void validateWritableDirCreatesWhenRequested() {
    Path dir = tempDir.resolve("a/b");

    Path validated = Paths.validateWritableDir(dir, true);

    assertTrue(Files.isDirectory(validated));
    assertEquals(dir.toAbsolutePath().normalize(), validated);
  }

  @Test
  void validateWritableDirAllowsFutureCreationDuringDryRun() {
    Path dir = tempDir.resolve("later");

    Paths.validateWritableDir(dir, false);

    assertFalse(Files.exists(dir));
  }

  @Test
  void validateWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("file.txt"));

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true));
  }

  @Test
  void validateReadableFileRequiresExistingRegularFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("in.ndjson"), "{}");

    assertEquals(file.toAbsolutePath().normalize(), Paths.validateReadableFile(file));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir.resolve("missing")));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(null));
  }
}
