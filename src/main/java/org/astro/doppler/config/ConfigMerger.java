package org.astro.doppler.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and key validity.
 */
public final class ConfigMerger {
  private static final Set<String> KNOWN_KEYS = Set.of(
      "list", "outfile", "figfile", "outdir", "joint", "snrcut", "plot", "mcmc", "reader", "backend",
      "combiner", "dryRun", "verbose", "metricsExporter", "otelEndpoint", "otelResourceAttributes");

  private ConfigMerger() {}

  /**
   * Checks whether {@code key} is a configuration key accepted from YAML or the command line.
   *
   * @param key candidate key (may be {@code null})
   * @return {@code true} when the key is recognised
   */
  public static boolean isKnownKey(String key) {
    return key != null && KNOWN_KEYS.contains(key);
  }

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when an unknown key is supplied
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    requireKnown(mode, "YAML", yamlCopy);
    merged.putAll(yamlCopy);

    requireKnown(mode, "argument", cliCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }

  private static void requireKnown(String mode, String source, Map<String, String> values) {
    for (String key : values.keySet()) {
      if (!isKnownKey(key)) {
        throw new IllegalArgumentException("Unknown " + source + " key for " + mode + ": " + key);
      }
    }
  }
}
