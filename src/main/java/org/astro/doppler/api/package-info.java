/**
 * Command-line surface of the Doppler driver: argument parsing, usage text, dry-run plans and exit codes.
 *
 * @since 0.1.0
 */
package org.astro.doppler.api;
