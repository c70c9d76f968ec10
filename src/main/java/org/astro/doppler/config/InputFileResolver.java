package org.astro.doppler.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns positional file arguments or a list file into the ordered set of spectra to process.
 *
 * <p>An explicit list wins over a list file. A list file holds one path per line; surrounding whitespace is
 * trimmed and blank lines are skipped. Order is preserved in both cases.</p>
 *
 * @since 0.1.0
 */
public final class InputFileResolver {
  private InputFileResolver() {}

  /**
   * Resolves the input files.
   *
   * @param explicit paths given on the command line, in order
   * @param listFile optional file listing one path per line
   * @return ordered input paths; empty when neither source is given
   * @throws NoSuchFileException when the list file does not exist
   * @throws IOException when the list file cannot be read
   */
  public static List<Path> resolve(List<String> explicit, Optional<Path> listFile) throws IOException {
    Objects.requireNonNull(explicit, "explicit");
    Objects.requireNonNull(listFile, "listFile");
    if (!explicit.isEmpty()) {
      return toPaths(explicit);
    }
    if (listFile.isEmpty()) {
      return List.of();
    }
    Path list = listFile.get();
    if (!Files.exists(list)) {
      throw new NoSuchFileException(list.toString(), null, "list file does not exist");
    }
    return toPaths(Files.readAllLines(list, StandardCharsets.UTF_8));
  }

  private static List<Path> toPaths(List<String> raw) {
    List<Path> paths = new ArrayList<>(raw.size());
    for (String line : raw) {
      if (line == null) {
        continue;
      }
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      try {
        paths.add(Path.of(trimmed));
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("invalid spectrum path: " + trimmed, ex);
      }
    }
    return List.copyOf(paths);
  }
}
