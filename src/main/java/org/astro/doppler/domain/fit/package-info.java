/** Fit products returned by the RV engine: parameter rows and tables, model spectra and result records. */
package org.astro.doppler.domain.fit;
