/**
 * Frame reassembly domain model: frame identity, per-channel segment tracking and frame groups.
 * <p><strong>Role:</strong> Domain layer aggregates with no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> {@link org.osp.xrit.domain.frame.FrameGroup} guards itself and its
 * channels with its own monitor; values are immutable.</p>
 * <p><strong>Metrics:</strong> Outcomes feed {@code reassembly.segment.*} counters in the registry.</p>
 */
package org.osp.xrit.domain.frame;
