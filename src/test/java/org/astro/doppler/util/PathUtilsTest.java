package org.astro.doppler.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PathUtilsTest {

  @Test
  void fileNameOfNestedPath() {
    assertEquals(Optional.of("spec.fits"), PathUtils.fileName(Path.of("a", "b", "spec.fits")));
    assertTrue(PathUtils.fileName(null).isEmpty());
  }

  @Test
  void baseNameStripsLastExtensionOnly() {
    assertEquals("apStar-r12", PathUtils.baseName(Path.of("data", "apStar-r12.fits")));
    assertEquals("spec.v2", PathUtils.baseName(Path.of("spec.v2.fits")));
    assertEquals("README", PathUtils.baseName(Path.of("README")));
    assertEquals(".hidden", PathUtils.baseName(Path.of(".hidden")));
  }

  @Test
  void baseNameRequiresFileName() {
    assertThrows(IllegalArgumentException.class, () -> PathUtils.baseName(Path.of("/")));
  }
}
