/**
 * Spectrum value types: raw reader output, the preprocessed record handed to the fitting engine, and the
 * small amount of arithmetic the driver performs itself (S/N confirmation, continuum back-correction).
 *
 * @since 0.1.0
 */
package org.astro.doppler.domain.spectrum;
