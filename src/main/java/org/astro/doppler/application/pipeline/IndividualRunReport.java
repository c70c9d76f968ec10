package org.astro.doppler.application.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Ordered outcomes of an individual-mode run, one per input file.
 *
 * @param outcomes outcomes in input order
 * @since 0.1.0
 */
public record IndividualRunReport(List<SpectrumOutcome> outcomes) {
  public IndividualRunReport {
    outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
  }

  public long count(SpectrumOutcome.Status status) {
    return outcomes.stream().filter(outcome -> outcome.status() == status).count();
  }

  public long fitted() {
    return count(SpectrumOutcome.Status.FITTED);
  }

  public long skipped() {
    return outcomes.size() - fitted();
  }
}
