/**
 * Frame listener adapters: structured logging and in-memory capture.
 *
 * @since 0.1.0
 */
package org.osp.xrit.infrastructure.events;
