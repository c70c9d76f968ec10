package org.astro.doppler.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.astro.doppler.config.FitConfig;
import org.astro.doppler.domain.output.OutputPaths;
import org.astro.doppler.testing.FakeDocumentCombiner;
import org.astro.doppler.testing.RecordingContainerWriter;
import org.astro.doppler.testing.RecordingMetricsPort;
import org.astro.doppler.testing.RecordingPlotRenderer;
import org.astro.doppler.testing.ScriptedFitEngine;
import org.astro.doppler.testing.StubSpectralBackend;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FitRunnerTest {
  @TempDir Path tempDir;

  private final ScriptedFitEngine engine = new ScriptedFitEngine();
  private final RecordingContainerWriter writer = new RecordingContainerWriter();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void singleFileWithJointFallsBackToIndividual() throws Exception {
    Path input = Files.writeString(tempDir.resolve("a.fits"), "spectrum");

    FitMode mode = runner(PipelineFixtures.config(List.of(input), true, false)).run();

    assertEquals(FitMode.INDIVIDUAL, mode);
    assertEquals(List.of(input), engine.fitted());
    assertEquals(0, engine.jointCalls());
  }

  @Test
  void multipleFilesWithJointRunJointFit() throws Exception {
    Path a = Files.writeString(tempDir.resolve("a.fits"), "spectrum");
    Path b = Files.writeString(tempDir.resolve("b.fits"), "spectrum");

    FitMode mode = runner(PipelineFixtures.config(List.of(a, b), true, false)).run();

    assertEquals(FitMode.JOINT, mode);
    assertEquals(1, engine.jointCalls());
    assertEquals(1, writer.written().size());
  }

  private FitRunner runner(FitConfig config) {
    StubSpectralBackend backend = new StubSpectralBackend();
    SpectrumLoader loader = PipelineFixtures.loader(backend);
    OutputAssembler assembler = new OutputAssembler(writer);
    OutputPaths paths = new OutputPaths(config.outdir());
    JointPlotPipeline plots =
        new JointPlotPipeline(new RecordingPlotRenderer(), new FakeDocumentCombiner(), paths, metrics, false);
    return new FitRunner(
        config,
        new IndividualFitUseCase(config, loader, engine, assembler, paths, metrics),
        new JointFitUseCase(config, loader, engine, assembler, paths, plots, metrics));
  }
}
