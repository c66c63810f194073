/**
 * Geostationary navigation: pixel to geodetic conversion for a fixed scan geometry.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.</p>
 * <p><strong>Performance:</strong> Pure double-precision math; no caching.</p>
 */
package org.osp.xrit.domain.geo;
