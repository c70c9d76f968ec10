package org.astro.doppler.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.astro.doppler.config.ConfigMerger;

/**
 * Parsed representation of CLI arguments split into flags, {@code key=value} options and positional spectrum
 * paths.
 *
 * <p>Short flags are normalized to their long form ({@code -j} becomes {@code --joint}). An argument is an option
 * only when the text before its first {@code '='} is a recognised configuration key, so a file such as
 * {@code obs=3.fits} stays a spectrum path. Everything after a bare {@code --} is a spectrum path, which is how
 * names starting with {@code '-'} are passed.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final String END_OF_OPTIONS = "--";
  private static final String CONFIG_KEY = "config";
  private static final Map<String, String> SHORT_FLAGS =
      Map.of("-j", "--joint", "-p", "--plot", "-m", "--mcmc");

  private final String[] keyValueArgs;
  private final List<String> positional;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(
      String[] keyValueArgs, List<String> positional, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.positional = positional;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments into flag, option and positional partitions.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], List.of(), Set.of(), false, false);
    }

    List<String> kv = new ArrayList<>();
    List<String> positional = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    boolean optionsEnded = false;
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      if (optionsEnded) {
        positional.add(arg);
        continue;
      }
      if (arg.equals(END_OF_OPTIONS)) {
        optionsEnded = true;
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
        continue;
      }
      if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
        continue;
      }
      if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(SHORT_FLAGS.getOrDefault(lower, lower));
        continue;
      }
      if (isOption(arg)) {
        kv.add(arg);
      } else {
        positional.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), List.copyOf(positional), Set.copyOf(flags), help, verbose);
  }

  private static boolean isOption(String arg) {
    int idx = arg.indexOf('=');
    if (idx <= 0) {
      return false;
    }
    String key = arg.substring(0, idx).trim();
    return key.equals(CONFIG_KEY) || ConfigMerger.isKnownKey(key);
  }

  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /** Spectrum paths given directly on the command line, in order. */
  public List<String> positional() {
    return positional;
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /** All normalized flags supplied on the command line (lowercase, long form). */
  public Set<String> flags() {
    return flags;
  }
}
