/**
 * Service discovery.
 *
 * <p>{@link fr.lapetina.tr064.infrastructure.discovery.SchemaBuilder} reads the device
 * descriptors and the action schema of every service they list, producing a
 * {@link fr.lapetina.tr064.infrastructure.discovery.RouterSchema}. Documents come from a
 * {@link fr.lapetina.tr064.infrastructure.discovery.DocumentFetcher}: the router itself
 * over HTTP, or a local folder.
 */
package fr.lapetina.tr064.infrastructure.discovery;
