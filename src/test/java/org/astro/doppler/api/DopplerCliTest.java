package org.astro.doppler.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class DopplerCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(DopplerCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = DopplerCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Doppler RV fitting driver"));
    assertTrue(buffer.toString().contains("--joint"));
  }

  @Test
  void outfileWithSeveralFilesNeedsJoint() throws Exception {
    Path a = touch("a.fits");
    Path b = touch("b.fits");
    Path c = touch("c.fits");

    ExitCode code = DopplerCli.run(new String[] {
        a.toString(), b.toString(), c.toString(), "outfile=" + tempDir.resolve("out.fits")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: doppler"));
    assertFalse(Files.exists(tempDir.resolve("out.fits")));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains("outfile")));
  }

  @Test
  void missingListFileIsConfigError() {
    ExitCode code = DopplerCli.run(new String[] {"list=" + tempDir.resolve("nothing.txt")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void noInputsIsInvalid() {
    ExitCode code = DopplerCli.run(new String[0]);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("No spectra to fit")));
  }

  @Test
  void unknownFlagIsInvalid() throws Exception {
    ExitCode code = DopplerCli.run(new String[] {touch("a.fits").toString(), "--jiont"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void unrecognisedKeyIsTreatedAsSpectrumPath() throws Exception {
    ExitCode code = DopplerCli.run(new String[] {touch("a.fits").toString(), "snrcutoff=5", "--joint"});

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("snrcutoff=5 NOT FOUND")));
  }

  @Test
  void spectrumNamesWithEqualsOrLeadingDashAreFitted() throws Exception {
    Path withEquals = touch("obs=3.fits");
    Path dashed = touch("-spec.fits");

    ExitCode code = DopplerCli.run(new String[] {withEquals.toString(), "--", dashed.toString()});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(tempDir.resolve("obs=3_doppler.fits")));
    assertTrue(Files.exists(tempDir.resolve("-spec_doppler.fits")));
  }

  @Test
  void missingYamlIsInvalid() throws Exception {
    ExitCode code = DopplerCli.run(new String[] {
        touch("a.fits").toString(), "config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void dryRunPrintsPlanAndWritesNothing() throws Exception {
    Path a = touch("a.fits");
    Path b = touch("b.fits");

    ExitCode code = DopplerCli.run(new String[] {a.toString(), b.toString(), "--dry-run", "--plot"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Doppler dry-run: no files will be produced."));
    assertTrue(output.contains(a + " -> " + tempDir.resolve("a_doppler.fits")));
    assertTrue(output.contains(tempDir.resolve("b_dopfit.png").toString()));
    try (Stream<Path> files = Files.list(tempDir)) {
      assertEquals(2, files.count());
    }
  }

  @Test
  void listFileDrivesIndividualFits() throws Exception {
    Path a = touch("a.fits");
    Path b = touch("b.fits");
    Path c = touch("c.fits");
    Path list = Files.writeString(tempDir.resolve("spectra.txt"), a + "\n\n" + b + "\n" + c + "\n");

    ExitCode code = DopplerCli.run(new String[] {"list=" + list});

    assertEquals(ExitCode.SUCCESS, code);
    for (String name : new String[] {"a", "b", "c"}) {
      Path output = tempDir.resolve(name + "_doppler.fits");
      assertTrue(Files.exists(output), "expected " + output);
      assertEquals(0L, Files.size(output) % 2880L);
    }
  }

  @Test
  void missingSpectrumIsSkippedInIndividualMode() throws Exception {
    Path a = touch("a.fits");
    Path missing = tempDir.resolve("missing.fits");

    ExitCode code = DopplerCli.run(new String[] {a.toString(), missing.toString()});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(tempDir.resolve("a_doppler.fits")));
    assertFalse(Files.exists(tempDir.resolve("missing_doppler.fits")));
  }

  @Test
  void outdirCollectsOutputs() throws Exception {
    Path a = touch("a.fits");
    Path outdir = tempDir.resolve("results");

    ExitCode code = DopplerCli.run(new String[] {a.toString(), "outdir=" + outdir});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(outdir.resolve("a_doppler.fits")));
    assertFalse(Files.exists(tempDir.resolve("a_doppler.fits")));
  }

  @Test
  void jointFitWritesOneOutput() throws Exception {
    Path a = touch("a.fits");
    Path b = touch("b.fits");

    ExitCode code = DopplerCli.run(new String[] {a.toString(), b.toString(), "-j"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(tempDir.resolve("a_doppler.fits")));
    assertFalse(Files.exists(tempDir.resolve("b_doppler.fits")));
  }

  @Test
  void jointFitWithMissingSpectrumFails() throws Exception {
    Path a = touch("a.fits");
    Path missing = tempDir.resolve("gone.fits");

    ExitCode code = DopplerCli.run(new String[] {a.toString(), missing.toString(), "--joint"});

    assertEquals(ExitCode.IO_ERROR, code);
    assertFalse(Files.exists(tempDir.resolve("a_doppler.fits")));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains(missing + " NOT FOUND")));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void jointPlotRunWritesFiguresAndRemovesMergedPdfs() throws Exception {
    Path a = touch("a.fits");
    Path b = touch("b.fits");

    ExitCode code = DopplerCli.run(new String[] {a.toString(), b.toString(), "--joint", "--plot", "combiner=true"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(5, readHdus(tempDir.resolve("a_doppler.fits")).length);
    assertTrue(Files.exists(tempDir.resolve("a_dopjointfit.png")));
    assertTrue(Files.exists(tempDir.resolve("b_dopjointfit.png")));
    assertFalse(Files.exists(tempDir.resolve("a_dopjointfit.pdf")));
    assertFalse(Files.exists(tempDir.resolve("b_dopjointfit.pdf")));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void combinerFailureIsRuntimeFailureAndKeepsPdfs() throws Exception {
    Path a = touch("a.fits");
    Path b = touch("b.fits");

    ExitCode code = DopplerCli.run(new String[] {a.toString(), b.toString(), "-j", "-p", "combiner=false"});

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
    assertEquals(5, readHdus(tempDir.resolve("a_doppler.fits")).length);
    assertTrue(Files.exists(tempDir.resolve("a_dopjointfit.pdf")));
    assertTrue(Files.exists(tempDir.resolve("b_dopjointfit.pdf")));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Document combiner failed")));
  }

  @Test
  void unknownBackendIsConfigError() throws Exception {
    ExitCode code = DopplerCli.run(new String[] {touch("a.fits").toString(), "backend=cannon"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void yamlSuppliesOptions() throws Exception {
    Path a = touch("a.fits");
    Path outdir = tempDir.resolve("from-yaml");
    Path yaml = Files.writeString(tempDir.resolve("doppler.yaml"), """
        fit:
          outdir: %s
          snrcut: 12
        """.formatted(outdir));

    ExitCode code = DopplerCli.run(new String[] {a.toString(), "config=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(outdir.resolve("a_doppler.fits")));
  }

  private static BasicHDU<?>[] readHdus(Path path) throws Exception {
    try (InputStream in = Files.newInputStream(path);
        Fits fits = new Fits(in)) {
      return fits.read();
    }
  }

  private Path touch(String name) throws Exception {
    return Files.writeString(tempDir.resolve(name), "spectrum");
  }
}
