/**
 * YAML configuration loading.
 *
 * <p>The file is looked up on the filesystem first, then on the classpath. Missing
 * sections keep their defaults.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - Description shown by the root index</li>
 *   <li>{@code http} - HTTP transport (enabled, host, port, backlog, stop delay)</li>
 *   <li>{@code p2p} - P2P transport (enabled, host, port, storage path, forced new identity, startup timeout)</li>
 *   <li>{@code dispatch} - Affinity ring size, wait strategy and handler timeout</li>
 *   <li>{@code metrics} - Prometheus metrics settings</li>
 * </ul>
 *
 * @see fr.lapetina.xplorer.infrastructure.config.XplorerConfig
 * @see fr.lapetina.xplorer.infrastructure.config.ConfigLoader
 */
package fr.lapetina.xplorer.infrastructure.config;
