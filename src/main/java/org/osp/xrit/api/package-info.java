/**
 * Command-line entry points.
 * <p><strong>Role:</strong> Driving-side adapter; parses arguments, configures logging and invokes the geo
 * converter.</p>
 *
 * @since 0.1.0
 */
package org.osp.xrit.api;
