/**
 * Geo reference catalog adapters.
 *
 * @since 0.1.0
 */
package org.osp.xrit.infrastructure.geo;
