/** FITS container adapter built on nom-tam-fits. */
package org.astro.doppler.infrastructure.container;
