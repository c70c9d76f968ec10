package org.astro.doppler.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void fitDefaultsMatchConfigDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("fit");
    FitConfig config = FitConfig.fromMap(defaults, List.of());

    assertEquals(FitConfig.DEFAULT_SNR_CUTOFF, config.snrCutoff());
    assertEquals(FitConfig.DEFAULT_COMBINER, config.combiner());
    assertEquals("false", defaults.get("joint"));
    assertEquals("false", defaults.get("plot"));
    assertEquals("false", defaults.get("mcmc"));
    assertEquals("false", defaults.get("dryRun"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("", defaults.get("list"));
    assertTrue(config.outdir().isEmpty());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
