/** Service-provider lookup for the numerical collaborators. */
package org.astro.doppler.infrastructure.backend;
