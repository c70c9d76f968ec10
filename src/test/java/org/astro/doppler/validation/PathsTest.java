package org.astro.doppler.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void createsMissingDirectoryWhenAllowed() {
    Path target = tempDir.resolve("rv").resolve("out");

    Path validated = Paths.validateWritableDir(target, true);

    assertTrue(Files.isDirectory(target));
    assertEquals(target.toAbsolutePath().normalize(), validated);
  }

  @Test
  void missingDirectoryRejectedWhenCreationDisabled() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Paths.validateWritableDir(tempDir.resolve("absent"), false));
  }

  @Test
  void regularFileIsNotADirectory() throws Exception {
    Path file = Files.writeString(tempDir.resolve("spec.fits"), "x");
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true));
  }
}
