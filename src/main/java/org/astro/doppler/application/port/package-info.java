/**
 * Ports between the fit drivers and their collaborators: spectral backend, container writer, document
 * combiner and metrics.
 *
 * @since 0.1.0
 */
package org.astro.doppler.application.port;
