package org.astro.doppler.application.port;

/**
 * <strong>What:</strong> Service-provider bundle of the numerical collaborators.
 * <p><strong>Why:</strong> Reader, preprocessor, engine and renderer come from the same fitting package and are
 * discovered together through {@link java.util.ServiceLoader}.</p>
 * <p>Implementations need a public no-argument constructor and a
 * {@code META-INF/services/org.astro.doppler.application.port.SpectralBackend} registration.</p>
 *
 * @since 0.1.0
 */
public interface SpectralBackend {
  /** Name matched against the {@code backend=} option. */
  String name();

  SpectrumReader reader();

  SpectrumPreprocessor preprocessor();

  RvFitEngine engine();

  PlotRenderer renderer();
}
