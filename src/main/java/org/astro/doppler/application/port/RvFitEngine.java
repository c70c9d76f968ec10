package org.astro.doppler.application.port;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.astro.doppler.domain.fit.FitResult;
import org.astro.doppler.domain.fit.JointFitResult;
import org.astro.doppler.domain.spectrum.Spectrum;

/**
 * <strong>What:</strong> Port to the radial-velocity fitting engine.
 * <p><strong>Why:</strong> The cross-correlation and MCMC machinery is an opaque collaborator; the driver only
 * orders calls and persists the results.</p>
 * <p><strong>Thread-safety:</strong> Called from a single thread. Implementations may parallelize internally,
 * and each call blocks until the fit is complete.</p>
 *
 * @since 0.1.0
 */
public interface RvFitEngine {
  /**
   * Fits one spectrum.
   *
   * @param spectrum prepared spectrum
   * @param mcmc whether to refine the fit with MCMC sampling
   * @param figure where the engine should draw its diagnostic figure; empty for none
   * @param verbose whether to emit engine diagnostics
   * @return parameters, best-fit model and model-matched spectrum
   * @throws Exception on any numerical failure
   */
  FitResult fit(Spectrum spectrum, boolean mcmc, Optional<Path> figure, boolean verbose) throws Exception;

  /**
   * Fits all spectra jointly.
   *
   * @param spectra prepared spectra in input order
   * @param mcmc whether to refine the fit with MCMC sampling
   * @param plot whether the engine should produce its own plots
   * @param snrCutoff S/N threshold steering the fitting strategy
   * @param verbose whether to emit engine diagnostics
   * @param outputDirectory directory for engine-side artefacts; empty for the default
   * @return joint result with per-spectrum sequences aligned to {@code spectra}
   * @throws Exception on any numerical failure
   */
  JointFitResult jointFit(
      List<Spectrum> spectra,
      boolean mcmc,
      boolean plot,
      double snrCutoff,
      boolean verbose,
      Optional<Path> outputDirectory)
      throws Exception;
}
