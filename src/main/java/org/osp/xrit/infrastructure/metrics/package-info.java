/**
 * Metrics adapters: OpenTelemetry export and a no-op sink.
 *
 * @since 0.1.0
 */
package org.osp.xrit.infrastructure.metrics;
