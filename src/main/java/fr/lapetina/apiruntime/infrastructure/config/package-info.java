/**
 * Configuration loading and validation.
 *
 * <p>This package parses the YAML configuration, applies environment overrides
 * and checks the result before anything else sees it.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig} - Immutable configuration snapshot</li>
 *   <li>{@link fr.lapetina.apiruntime.infrastructure.config.ConfigLoader} - YAML loading and {@code APIRT_*} overrides</li>
 *   <li>{@link fr.lapetina.apiruntime.infrastructure.config.StandardConfigValidator} - Semantic checks</li>
 *   <li>{@link fr.lapetina.apiruntime.infrastructure.config.ConfigChangeListener} - Callback for applied changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP listener settings (host, port, backlog)</li>
 *   <li>{@code logging} - Log level directives and audit directory</li>
 *   <li>{@code rateLimit} - Token bucket limits, exempt paths, idle sweeping</li>
 *   <li>{@code auth} - JWT key material (inline PEM, PEM path or shared secret)</li>
 *   <li>{@code reload} - Periodic reload switch and interval</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.apiruntime.infrastructure.reload.ConfigReloadLoop
 */
package fr.lapetina.apiruntime.infrastructure.config;
