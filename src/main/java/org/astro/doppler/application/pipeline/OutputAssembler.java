package org.astro.doppler.application.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.astro.doppler.application.port.ContainerWriter;
import org.astro.doppler.domain.fit.FitResult;
import org.astro.doppler.domain.fit.JointFitResult;
import org.astro.doppler.domain.fit.ModelSpectrum;
import org.astro.doppler.domain.fit.ParameterTable;
import org.astro.doppler.domain.output.BundlePart;
import org.astro.doppler.domain.output.OutputBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds and writes the multi-part output container for either fit mode.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Individual mode: parameter table, then model flux array.</li>
 *   <li>Joint mode: summary table, final-parameter table, then one model flux array per spectrum in input
 *   order.</li>
 *   <li>Write discipline: remove any existing file, create it with the first table, then append the rest.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected writer.</p>
 *
 * @since 0.1.0
 */
public final class OutputAssembler {
  private static final Logger log = LoggerFactory.getLogger(OutputAssembler.class);

  private final ContainerWriter writer;

  public OutputAssembler(ContainerWriter writer) {
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  /**
   * Two-part bundle for one individually fitted spectrum.
   *
   * @param result engine output
   * @return bundle with the parameter table first and the model flux second
   */
  public OutputBundle individual(FitResult result) {
    Objects.requireNonNull(result, "result");
    return OutputBundle.startingWith(ParameterTable.single(result.parameters()))
        .appendArray(result.model().flux());
  }

  /**
   * Bundle of {@code 2 + N} parts for a joint fit over N spectra.
   *
   * @param result engine output
   * @return bundle with summary, final parameters and per-spectrum model fluxes
   */
  public OutputBundle joint(JointFitResult result) {
    Objects.requireNonNull(result, "result");
    OutputBundle bundle = OutputBundle.startingWith(result.summary())
        .appendTable(result.finalParameters());
    for (ModelSpectrum model : result.models()) {
      bundle.appendArray(model.flux());
    }
    return bundle;
  }

  /**
   * Writes {@code bundle} to {@code path}, replacing any existing file.
   *
   * @param path output container path
   * @param bundle parts to write
   * @throws IOException when removal or writing fails
   */
  public void write(Path path, OutputBundle bundle) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(bundle, "bundle");
    if (Files.deleteIfExists(path)) {
      log.debug("Removed existing output {}", path);
    }
    writer.writeTable(path, bundle.primary());
    List<BundlePart> remainder = bundle.remainder();
    if (!remainder.isEmpty()) {
      writer.appendParts(path, remainder);
    }
    log.info("Wrote {} ({} parts)", path, bundle.size());
  }
}
