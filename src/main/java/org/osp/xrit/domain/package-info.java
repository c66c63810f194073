/**
 * Core domain model for the segment ingest -> frame reassembly -> export pipeline.
 * <p><strong>Role:</strong> Domain layer aggregates describing frames, channels and navigation without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; mutable aggregates document their lock.</p>
 * <p><strong>Metrics:</strong> Domain outcomes feed tagging on {@code reassembly.*} metrics.</p>
 */
package org.osp.xrit.domain;
