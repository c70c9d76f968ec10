package org.astro.doppler.application.pipeline;

/**
 * Fitting strategy for a run.
 *
 * @since 0.1.0
 */
public enum FitMode {
  /** Each spectrum is fitted, written and reported on its own. */
  INDIVIDUAL,
  /** All spectra are fitted together in one engine call. */
  JOINT;

  /**
   * Chooses the mode once per run. A joint fit needs at least two spectra, so a joint request over a single
   * file runs individually.
   *
   * @param jointRequested whether the joint flag was set
   * @param fileCount number of input files
   * @return {@link #JOINT} only when requested and more than one file is present
   */
  public static FitMode select(boolean jointRequested, int fileCount) {
    return jointRequested && fileCount > 1 ? JOINT : INDIVIDUAL;
  }
}
