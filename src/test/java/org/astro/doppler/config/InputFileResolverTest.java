package org.astro.doppler.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InputFileResolverTest {
  @TempDir Path tempDir;

  @Test
  void readsListFileInOrderSkippingBlankLines() throws IOException {
    Path list = tempDir.resolve("spectra.txt");
    Files.writeString(list, "  c.fits\n\na.fits  \n   \nsub/b.fits\n");

    List<Path> inputs = InputFileResolver.resolve(List.of(), Optional.of(list));

    assertEquals(List.of(Path.of("c.fits"), Path.of("a.fits"), Path.of("sub/b.fits")), inputs);
  }

  @Test
  void explicitFilesWinOverListFile() throws IOException {
    Path list = tempDir.resolve("missing.txt");

    List<Path> inputs = InputFileResolver.resolve(List.of("x.fits", "y.fits"), Optional.of(list));

    assertEquals(List.of(Path.of("x.fits"), Path.of("y.fits")), inputs);
  }

  @Test
  void missingListFileIsReported() {
    Path list = tempDir.resolve("missing.txt");
    assertThrows(NoSuchFileException.class, () -> InputFileResolver.resolve(List.of(), Optional.of(list)));
  }

  @Test
  void nothingSuppliedYieldsEmptyList() throws IOException {
    assertTrue(InputFileResolver.resolve(List.of(), Optional.empty()).isEmpty());
  }
}
