package org.astro.doppler.application.pipeline;

import java.util.Objects;
import org.astro.doppler.config.FitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the fit mode for a configuration and runs the matching driver.
 *
 * @since 0.1.0
 */
public final class FitRunner {
  private static final Logger log = LoggerFactory.getLogger(FitRunner.class);

  private final FitConfig config;
  private final IndividualFitUseCase individual;
  private final JointFitUseCase joint;

  public FitRunner(FitConfig config, IndividualFitUseCase individual, JointFitUseCase joint) {
    this.config = Objects.requireNonNull(config, "config");
    this.individual = Objects.requireNonNull(individual, "individual");
    this.joint = Objects.requireNonNull(joint, "joint");
  }

  /**
   * Runs the driver selected by {@link FitMode#select(boolean, int)}.
   *
   * @return the mode that ran
   * @throws Exception propagated from the selected driver
   */
  public FitMode run() throws Exception {
    FitMode mode = FitMode.select(config.joint(), config.inputs().size());
    if (config.joint() && mode == FitMode.INDIVIDUAL) {
      log.info("Joint fit requested with a single spectrum; fitting individually");
    }
    log.info("Fitting {} spectra in {} mode", config.inputs().size(), mode);
    switch (mode) {
      case JOINT -> joint.run();
      case INDIVIDUAL -> individual.run();
      default -> throw new IllegalStateException("Unhandled fit mode " + mode);
    }
    return mode;
  }
}
