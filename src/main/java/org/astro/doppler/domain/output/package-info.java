/**
 * Output bundle model and the naming rules for every file the driver writes.
 *
 * @since 0.1.0
 */
package org.astro.doppler.domain.output;
