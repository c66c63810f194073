/**
 * Session wiring that drives the reassembly registry: producer entry point and the timeout sweep loop.
 *
 * @since 0.1.0
 */
package org.osp.xrit.application.pipeline;
