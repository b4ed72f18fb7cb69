/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing and environment overrides.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tr064.infrastructure.config.RouterConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.tr064.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 *   <li>{@link fr.lapetina.tr064.infrastructure.config.BooleanValues} - Lenient on/off token parsing</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code router} - Address, port, TLS and credentials</li>
 *   <li>{@code timeouts} - Connect and request timeouts</li>
 *   <li>{@code discovery} - Primary and secondary descriptor documents</li>
 *   <li>{@code cache} - Local schema cache</li>
 *   <li>{@code monitor} - Call monitor socket, queue and reconnect policy</li>
 *   <li>{@code metrics} - Micrometer settings</li>
 * </ul>
 *
 * <h2>Environment</h2>
 * <p>{@code FRITZ_USERNAME}, {@code FRITZ_PASSWORD}, {@code FRITZ_USECACHE} and
 * {@code FRITZ_CACHEDIRECTORY} override the YAML values.
 *
 * @see fr.lapetina.tr064.infrastructure.config.RouterConfig
 * @see fr.lapetina.tr064.infrastructure.config.ConfigLoader
 */
package fr.lapetina.tr064.infrastructure.config;
