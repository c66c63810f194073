/**
 * <strong>Purpose:</strong> Configuration loading and object-graph wiring for the reassembler.
 * <p>YAML files are flattened by {@link org.osp.xrit.config.YamlConfigLoader}, parsed into
 * {@link org.osp.xrit.config.ReassemblyConfig} and turned into a running session by
 * {@link org.osp.xrit.config.CompositionRoot}.</p>
 *
 * @since 0.1.0
 */
package org.osp.xrit.config;
