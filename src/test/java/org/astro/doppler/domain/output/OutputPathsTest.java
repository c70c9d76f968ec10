package org.astro.doppler.domain.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OutputPathsTest {
  private final OutputPaths inPlace = new OutputPaths(Optional.empty());
  private final OutputPaths redirected = new OutputPaths(Optional.of(Path.of("out")));

  @Test
  void outputDirectoryTakesPrecedence() {
    Path derived = redirected.derive(Path.of("a", "b", "spec.fits"), ArtifactKind.INDIVIDUAL_OUTPUT);
    assertEquals(Path.of("out", "spec_doppler.fits"), derived);
  }

  @Test
  void fallsBackToInputDirectory() {
    Path derived = inPlace.derive(Path.of("a", "b", "spec.fits"), ArtifactKind.INDIVIDUAL_FIGURE);
    assertEquals(Path.of("a", "b", "spec_dopfit.png"), derived);
  }

  @Test
  void bareNameStaysInWorkingDirectory() {
    assertEquals(Path.of("spec_doppler.fits"), inPlace.derive(Path.of("spec.fits"), ArtifactKind.JOINT_OUTPUT));
  }

  @Test
  void onlyLastExtensionIsStripped() {
    assertEquals(
        Path.of("spec.v2_dopjointfit.pdf"),
        inPlace.derive(Path.of("spec.v2.fits"), ArtifactKind.JOINT_FIGURE_VECTOR));
  }

  @Test
  void explicitPathsAreUsedUnchanged() {
    Path explicit = Path.of("custom.fits");
    assertEquals(explicit, redirected.individualOutput(Path.of("spec.fits"), Optional.of(explicit)));
    assertEquals(
        Optional.of(Path.of("fig.png")),
        redirected.individualFigure(Path.of("spec.fits"), Optional.of(Path.of("fig.png")), false));
  }

  @Test
  void figureOnlyDerivedWhenPlotting() {
    assertTrue(inPlace.individualFigure(Path.of("spec.fits"), Optional.empty(), false).isEmpty());
    assertEquals(
        Optional.of(Path.of("spec_dopfit.png")),
        inPlace.individualFigure(Path.of("spec.fits"), Optional.empty(), true));
  }

  @Test
  void jointArtifactsDeriveFromFirstInput() {
    List<Path> inputs = List.of(Path.of("d", "first.fits"), Path.of("e", "second.fits"));

    assertEquals(Path.of("d", "first_doppler.fits"), inPlace.jointOutput(inputs, Optional.empty()));
    assertEquals(Path.of("d", "first_dopjointfit_all.pdf"), inPlace.combinedDocument(inputs, Optional.empty()));
    assertThrows(IllegalArgumentException.class, () -> inPlace.jointOutput(List.of(), Optional.empty()));
  }
}
