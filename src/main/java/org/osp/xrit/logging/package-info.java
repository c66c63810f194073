/**
 * Runtime logging controls for the command line.
 *
 * @since 0.1.0
 */
package org.osp.xrit.logging;
