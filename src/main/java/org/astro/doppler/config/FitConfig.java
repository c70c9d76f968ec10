package org.astro.doppler.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.astro.doppler.validation.Numbers;
import org.astro.doppler.validation.Strings;

/**
 * <strong>What:</strong> Resolved run parameters for one Doppler driver invocation.
 * <p><strong>Why:</strong> Built once at startup and read-only afterwards, so every component sees the same
 * resolved paths and flags.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize a blank output directory to "no override".</li>
 *   <li>Reject an explicit output or figure path combined with several inputs outside joint mode, before
 *   any file is touched.</li>
 *   <li>Require a finite, non-negative S/N cutoff.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputs spectrum paths in processing order
 * @param outfile explicit output path
 * @param figfile explicit figure (individual) or combined document (joint) path
 * @param outdir directory overriding every derived output location
 * @param joint whether a joint fit was requested
 * @param snrCutoff S/N threshold handed to the joint engine
 * @param plot whether diagnostic figures are saved
 * @param mcmc whether fits are refined with MCMC
 * @param reader reader format override; empty means auto-detect
 * @param verbose whether collaborators should emit diagnostics
 * @param dryRun whether to print the plan and stop
 * @param backend name of the spectral backend to use; empty accepts the only one installed
 * @param combiner executable used to merge vector documents
 * @since 0.1.0
 * @see InputFileResolver
 */
public record FitConfig(
    List<Path> inputs,
    Optional<Path> outfile,
    Optional<Path> figfile,
    Optional<Path> outdir,
    boolean joint,
    double snrCutoff,
    boolean plot,
    boolean mcmc,
    Optional<String> reader,
    boolean verbose,
    boolean dryRun,
    Optional<String> backend,
    String combiner) {

  public static final double DEFAULT_SNR_CUTOFF = 10.0;
  public static final String DEFAULT_COMBINER = "gs";

  /**
   * Normalizes values and enforces the explicit-path invariant.
   *
   * @throws IllegalArgumentException if an explicit output or figure path is combined with more than one
   *     input outside joint mode, or a value is malformed
   */
  public FitConfig {
    inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
    outfile = sanitize("outfile", outfile);
    figfile = sanitize("figfile", figfile);
    outdir = sanitize("outdir", outdir);
    reader = reader == null ? Optional.empty() : reader.filter(value -> !value.isBlank()).map(String::trim);
    backend = backend == null ? Optional.empty() : backend.filter(value -> !value.isBlank()).map(String::trim);
    combiner = Strings.requireNonBlank("combiner", combiner == null ? DEFAULT_COMBINER : combiner).trim();
    Numbers.requireFiniteAtLeast("snrcut", snrCutoff, 0.0);

    if (inputs.size() > 1 && !joint) {
      if (outfile.isPresent()) {
        throw new IllegalArgumentException(
            "outfile can only be used with a single input file or with --joint (got " + inputs.size() + " files)");
      }
      if (figfile.isPresent()) {
        throw new IllegalArgumentException(
            "figfile can only be used with a single input file or with --joint (got " + inputs.size() + " files)");
      }
    }
  }

  /**
   * Creates a configuration from merged key/value settings and the resolved input files.
   *
   * @param options effective settings (CLI &gt; YAML &gt; defaults)
   * @param inputs resolved input paths, see {@link InputFileResolver}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid or the explicit-path invariant is violated
   */
  public static FitConfig fromMap(Map<String, String> options, List<Path> inputs) {
    Objects.requireNonNull(options, "options");
    String snrRaw = optionalString(options.get("snrcut")).orElse(Double.toString(DEFAULT_SNR_CUTOFF));
    return new FitConfig(
        inputs,
        optionalPath("outfile", options.get("outfile")),
        optionalPath("figfile", options.get("figfile")),
        optionalPath("outdir", options.get("outdir")),
        parseBoolean(options.get("joint"), false),
        Numbers.parseFiniteAtLeast("snrcut", snrRaw, 0.0),
        parseBoolean(options.get("plot"), false),
        parseBoolean(options.get("mcmc"), false),
        optionalString(options.get("reader")),
        parseBoolean(options.get("verbose"), false),
        parseBoolean(options.get("dryRun"), false),
        optionalString(options.get("backend")),
        optionalString(options.get("combiner")).orElse(DEFAULT_COMBINER));
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
      throw new IllegalArgumentException("expected true or false but was '" + trimmed + "'");
    }
    return Boolean.parseBoolean(trimmed);
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static Optional<Path> optionalPath(String name, String value) {
    return optionalString(value).map(raw -> parsePath(name, raw));
  }

  private static Path parsePath(String name, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Optional<Path> sanitize(String name, Optional<Path> candidate) {
    if (candidate == null) {
      return Optional.empty();
    }
    return candidate.filter(path -> !path.toString().isBlank()).map(path -> parsePath(name, path.toString()));
  }
}
