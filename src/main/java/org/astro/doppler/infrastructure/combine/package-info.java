/** External document combiner adapter. */
package org.astro.doppler.infrastructure.combine;
