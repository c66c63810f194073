/**
 * Outbound frame lifecycle notifications: completion, eviction and retry.
 * <p><strong>Concurrency:</strong> Records are immutable; referenced groups are owned by the consumer
 * once published.</p>
 */
package org.osp.xrit.domain.events;
