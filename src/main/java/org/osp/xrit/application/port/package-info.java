/**
 * <strong>Purpose:</strong> Ports defining the segment ingest -> reassembly -> export contracts.
 * <p><strong>Pipeline role:</strong> Adapters implement these interfaces to integrate clocks, metrics,
 * navigation catalogs and frame consumers.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package org.osp.xrit.application.port;
