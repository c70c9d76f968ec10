package org.astro.doppler.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the Doppler CLI.
 * <p><strong>Why:</strong> Ensures the configured output directory can receive fit results before the first
 * (possibly long) engine call is made.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject paths carrying null bytes or control characters.</li>
 *   <li>Create a missing output directory on request.</li>
 *   <li>Verify the directory is writable.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a dangling symlink is reported rather
 * than silently created through.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable directory, optionally creating it (and parents) when absent.
   *
   * @param path candidate output directory; must not be {@code null}
   * @param createIfMissing whether to create the directory when it does not exist
   * @return absolute normalized directory path
   * @throws IllegalArgumentException if the path is malformed, not a directory, not writable, or cannot be created
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }

    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
      if (!Files.isDirectory(normalized)) {
        throw new IllegalArgumentException("path is not a directory: " + normalized);
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException("directory is not writable: " + normalized);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }
}
