package org.astro.doppler.domain.output;

/**
 * Files derived from an input spectrum name, each with its own suffix.
 *
 * @since 0.1.0
 */
public enum ArtifactKind {
  INDIVIDUAL_OUTPUT("_doppler.fits"),
  INDIVIDUAL_FIGURE("_dopfit.png"),
  JOINT_OUTPUT("_doppler.fits"),
  JOINT_FIGURE_IMAGE("_dopjointfit.png"),
  JOINT_FIGURE_VECTOR("_dopjointfit.pdf"),
  COMBINED_DOCUMENT("_dopjointfit_all.pdf");

  private final String suffix;

  ArtifactKind(String suffix) {
    this.suffix = suffix;
  }

  public String suffix() {
    return suffix;
  }
}
