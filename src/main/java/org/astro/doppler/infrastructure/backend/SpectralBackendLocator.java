package org.astro.doppler.infrastructure.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import org.astro.doppler.application.port.SpectralBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the {@link SpectralBackend} to use for a run through {@link ServiceLoader}.
 *
 * <p>A requested name must match exactly one installed backend (case-insensitive). Without a name, exactly one
 * backend must be installed.</p>
 *
 * @since 0.1.0
 */
public final class SpectralBackendLocator {
  private static final Logger log = LoggerFactory.getLogger(SpectralBackendLocator.class);

  private SpectralBackendLocator() {}

  /**
   * Locates a backend on the context class path.
   *
   * @param name requested backend name; empty to accept the only installed backend
   * @return selected backend
   * @throws IllegalStateException when no backend matches or the choice is ambiguous
   */
  public static SpectralBackend locate(Optional<String> name) {
    return select(name, ServiceLoader.load(SpectralBackend.class));
  }

  static SpectralBackend select(Optional<String> name, Iterable<SpectralBackend> candidates) {
    Objects.requireNonNull(name, "name");
    List<SpectralBackend> installed = new ArrayList<>();
    candidates.forEach(installed::add);
    if (installed.isEmpty()) {
      throw new IllegalStateException("No spectral backend installed; add a SpectralBackend provider to the classpath");
    }
    String names = installed.stream().map(SpectralBackend::name).collect(Collectors.joining(", "));
    if (name.isPresent()) {
      String wanted = name.get();
      SpectralBackend match = installed.stream()
          .filter(backend -> backend.name().equalsIgnoreCase(wanted))
          .findFirst()
          .orElseThrow(() -> new IllegalStateException(
              "Unknown spectral backend '" + wanted + "'; installed: " + names));
      log.debug("Using spectral backend {}", match.name());
      return match;
    }
    if (installed.size() > 1) {
      throw new IllegalStateException("Several spectral backends installed (" + names + "); choose one with backend=NAME");
    }
    log.debug("Using spectral backend {}", installed.get(0).name());
    return installed.get(0);
  }
}
