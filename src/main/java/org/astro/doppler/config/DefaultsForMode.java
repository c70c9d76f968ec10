package org.astro.doppler.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each Doppler CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code fit})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "fit" -> buildFitDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildFitDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("list", "");
    map.put("outfile", "");
    map.put("figfile", "");
    map.put("outdir", "");
    map.put("joint", "false");
    map.put("snrcut", Double.toString(FitConfig.DEFAULT_SNR_CUTOFF));
    map.put("plot", "false");
    map.put("mcmc", "false");
    map.put("reader", "");
    map.put("backend", "");
    map.put("combiner", FitConfig.DEFAULT_COMBINER);
    map.put("dryRun", "false");
    return map;
  }
}
