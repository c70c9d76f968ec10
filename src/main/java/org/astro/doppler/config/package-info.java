/**
 * Configuration: defaults, YAML loading, precedence merging, the validated {@link org.astro.doppler.config.FitConfig}
 * and the composition root.
 *
 * @since 0.1.0
 */
package org.astro.doppler.config;
