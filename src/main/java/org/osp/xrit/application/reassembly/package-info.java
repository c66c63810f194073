/**
 * <strong>Purpose:</strong> Frame reassembly services: the group registry, its settings and sweep reports.
 * <p><strong>Pipeline role:</strong> Sits between segment sources and frame consumers; owns every
 * partially received frame until it completes, times out or is discarded.</p>
 * <p><strong>Concurrency:</strong> {@link org.osp.xrit.application.reassembly.GroupRegistry} is safe for
 * concurrent producers plus one sweeper.</p>
 *
 * @since 0.1.0
 */
package org.osp.xrit.application.reassembly;
