package org.astro.doppler.util;

import java.nio.file.Path;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the file name with its last extension removed ({@code spec.fits} becomes {@code spec};
   * {@code spec.fits.gz} becomes {@code spec.fits}). Leading-dot names such as {@code .hidden} are kept whole.
   *
   * @param path source path; must have a file name component
   * @return base name without the final extension
   * @throws IllegalArgumentException if the path has no file name
   */
  public static String baseName(Path path) {
    String name = fileName(path)
        .orElseThrow(() -> new IllegalArgumentException("path has no file name: " + path));
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
