/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Ensures invalid inputs are rejected before the fitting pipeline touches
 * spectrum files, output directories or external tools.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package org.astro.doppler.validation;
