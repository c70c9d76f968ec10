/**
 * Fit drivers: mode selection, individual and joint fitting, output assembly and the joint plot pipeline.
 *
 * @since 0.1.0
 */
package org.astro.doppler.application.pipeline;
