package org.astro.doppler.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.astro.doppler.application.pipeline.FitMode;
import org.astro.doppler.application.pipeline.FitRunner;
import org.astro.doppler.application.port.MetricsPort;
import org.astro.doppler.config.CompositionRoot;
import org.astro.doppler.config.ConfigMerger;
import org.astro.doppler.config.DefaultsForMode;
import org.astro.doppler.config.FitConfig;
import org.astro.doppler.config.InputFileResolver;
import org.astro.doppler.config.YamlConfigLoader;
import org.astro.doppler.domain.output.ArtifactKind;
import org.astro.doppler.domain.output.OutputPaths;
import org.astro.doppler.infrastructure.combine.CombinerFailureException;
import org.astro.doppler.logging.LoggingConfigurator;
import org.astro.doppler.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the Doppler RV fitting driver.
 *
 * @since 0.1.0
 */
public final class DopplerCli {
  private static final Logger log = LoggerFactory.getLogger(DopplerCli.class);
  private static final String MODE = "fit";
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--joint", "joint",
      "--plot", "plot",
      "--mcmc", "mcmc",
      "--dry-run", "dryRun",
      "--verbose", "verbose");
  private static final Set<String> IGNORED_FLAGS = Set.of("--help");
  private static final String SUMMARY_USAGE =
      "usage: doppler [SPECTRUM...] [list=PATH] [outfile=PATH] [figfile=PATH] [outdir=PATH] "
          + "[snrcut=NUM] [reader=NAME] [backend=NAME] [combiner=EXE] [config=YAML] "
          + "[--joint] [--plot] [--mcmc] [--verbose] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      Doppler RV fitting driver

      Usage:
        doppler spec1.fits spec2.fits [options]
        doppler list=spectra.txt [options]

      Inputs:
        SPECTRUM...              Spectrum files to fit, in order
        list=PATH                File listing one spectrum path per line (used when no files are given)
        --                       Treat every following argument as a spectrum path

      Outputs:
        outfile=PATH             Output file (one input file, or --joint)
        figfile=PATH             Figure file (one input file), combined document with --joint
        outdir=PATH              Directory for every derived output (default: next to each input)

      Fitting:
        --joint, -j              Fit all spectra jointly (needs two or more files)
        snrcut=NUM               S/N cutoff for the joint fit (default 10.0)
        --plot, -p               Save diagnostic figures
        --mcmc, -m               Refine fits with MCMC
        reader=NAME              Force a spectrum reader format
        backend=NAME             Spectral backend to use when several are installed
        combiner=EXE             Ghostscript executable used to merge figures (default gs)

      General:
        config=YAML              YAML file with common: and fit: sections
        --dry-run                Resolve inputs and outputs, print the plan, write nothing
        --verbose, -v            Enable DEBUG logging and verbose collaborators
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --help, -h               Show this message

      Notes:
        Missing files are skipped when fitting individually; with --joint they abort the run.
      """;

  private DopplerCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the driver and reports the outcome as an exit code.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for doppler CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      applyFlags(input, kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> settings;
    String metricsExporter;
    try {
      settings = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn));
      metricsExporter = TelemetryConfigurator.configureMetrics(settings);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!input.verbose() && ConfigCliUtils.parseBoolean(settings, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }

    List<Path> files;
    FitConfig config;
    try {
      String list = settings.getOrDefault("list", "").trim();
      files = InputFileResolver.resolve(
          input.positional(), list.isEmpty() ? Optional.empty() : Optional.of(Path.of(list)));
      config = FitConfig.fromMap(settings, files);
    } catch (NoSuchFileException ex) {
      log.error("List file {} does not exist", ex.getFile());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read list file", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (files.isEmpty()) {
      log.error("No spectra to fit; pass spectrum files or list=PATH");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (config.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try {
      config.outdir().ifPresent(dir -> Paths.validateWritableDir(dir, true));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid output directory: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MetricsPort metrics = CompositionRoot.metricsFor(metricsExporter);
    try {
      return execute(config, metrics);
    } finally {
      closeMetrics(metrics);
    }
  }

  private static ExitCode execute(FitConfig config, MetricsPort metrics) {
    FitRunner runner;
    try {
      CompositionRoot root = new CompositionRoot(config, metrics);
      log.info("Configured doppler run: backend={}, files={}, joint={}, plot={}, mcmc={}, outdir={}",
          root.backend().name(),
          config.inputs().size(),
          config.joint(),
          config.plot(),
          config.mcmc(),
          config.outdir().map(Path::toString).orElse("<input directory>"));
      runner = root.fitRunner();
    } catch (IllegalStateException ex) {
      log.error("Spectral backend unavailable: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try {
      FitMode mode = runner.run();
      log.info("Doppler {} run completed", mode);
      return ExitCode.SUCCESS;
    } catch (CombinerFailureException ex) {
      log.error("Document combiner failed (exit status {})", ex.exitCode(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (NoSuchFileException ex) {
      log.error("{} NOT FOUND; joint fitting needs every input", ex.getFile());
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Doppler run I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Doppler run interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (Exception ex) {
      log.error("Doppler run failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void applyFlags(CliInput input, Map<String, String> kv) {
    for (String flag : input.flags()) {
      if (IGNORED_FLAGS.contains(flag)) {
        continue;
      }
      String key = FLAG_KEYS.get(flag);
      if (key == null) {
        throw new IllegalArgumentException("unknown flag: " + flag);
      }
      kv.put(key, "true");
    }
  }

  private static void printDryRunPlan(FitConfig config) {
    OutputPaths paths = new OutputPaths(config.outdir());
    FitMode mode = FitMode.select(config.joint(), config.inputs().size());
    List<String> lines = new ArrayList<>();
    lines.add("Doppler dry-run: no files will be produced.");
    lines.add(" Mode              : " + mode);
    lines.add(" Spectra           : " + config.inputs().size());
    lines.add(" S/N cutoff        : " + config.snrCutoff());
    lines.add(" MCMC              : " + config.mcmc());
    lines.add(" Plots             : " + config.plot());
    lines.add(" Reader            : " + config.reader().orElse("<auto>"));
    if (mode == FitMode.JOINT) {
      lines.add(" Output            : " + paths.jointOutput(config.inputs(), config.outfile()));
      if (config.plot()) {
        for (Path input : config.inputs()) {
          lines.add("  " + input + " -> " + paths.derive(input, ArtifactKind.JOINT_FIGURE_IMAGE));
        }
        lines.add(" Combined figures  : " + paths.combinedDocument(config.inputs(), config.figfile()));
      }
    } else {
      for (Path input : config.inputs()) {
        String figure = paths.individualFigure(input, config.figfile(), config.plot())
            .map(path -> " (figure " + path + ")")
            .orElse("");
        lines.add("  " + input + " -> " + paths.individualOutput(input, config.outfile()) + figure);
      }
    }
    lines.add(" Re-run without --dry-run to fit.");
    CliPrinter.printLines(lines.toArray(String[]::new));
  }

  private static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
