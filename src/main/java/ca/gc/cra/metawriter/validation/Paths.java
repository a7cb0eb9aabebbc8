package ca.gc.cra.metawriter.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks run before a writer or reader touches disk.
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between a check and its use.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an output directory, creating it when asked.
   *
   * @param path candidate directory
   * @param createIfMissing whether to create the directory and its parents; when {@code false} a missing directory
   *     is accepted as one to be created later
   * @return absolute, normalized directory
   * @throws IllegalArgumentException if the path contains control characters, is not a writable directory, or
   *     cannot be created
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    if (!Files.exists(normalized)) {
      if (!createIfMissing) {
        return normalized;
      }
      try {
        Files.createDirectories(normalized);
      } catch (IOException ex) {
        throw new IllegalArgumentException("unable to create directory " + normalized + ": " + ex.getMessage(), ex);
      }
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException("directory is not writable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an input file.
   *
   * @param path candidate file
   * @return absolute, normalized file path
   * @throws IllegalArgumentException if the file is missing, not a regular file, or unreadable
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
