package org.astro.doppler.application.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of processing one input file in individual mode.
 *
 * @since 0.1.0
 */
public sealed interface SpectrumOutcome
    permits SpectrumOutcome.Fitted, SpectrumOutcome.Missing, SpectrumOutcome.LoadFailed, SpectrumOutcome.FitFailed {

  /** Outcome category. */
  enum Status {
    FITTED,
    MISSING,
    LOAD_FAILED,
    FIT_FAILED
  }

  Path input();

  Status status();

  /**
   * Spectrum fitted and written.
   *
   * @param input spectrum path
   * @param output container written for it
   */
  record Fitted(Path input, Path output) implements SpectrumOutcome {
    public Fitted {
      Objects.requireNonNull(input, "input");
      Objects.requireNonNull(output, "output");
    }

    @Override
    public Status status() {
      return Status.FITTED;
    }
  }

  /** Input file did not exist. */
  record Missing(Path input) implements SpectrumOutcome {
    public Missing {
      Objects.requireNonNull(input, "input");
    }

    @Override
    public Status status() {
      return Status.MISSING;
    }
  }

  /** Reader or preprocessor failed. */
  record LoadFailed(Path input, Exception cause) implements SpectrumOutcome {
    public LoadFailed {
      Objects.requireNonNull(input, "input");
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public Status status() {
      return Status.LOAD_FAILED;
    }
  }

  /** Fitting engine failed. */
  record FitFailed(Path input, Exception cause) implements SpectrumOutcome {
    public FitFailed {
      Objects.requireNonNull(input, "input");
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public Status status() {
      return Status.FIT_FAILED;
    }
  }
}
