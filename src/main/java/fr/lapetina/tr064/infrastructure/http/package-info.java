/**
 * HTTP transport to the router.
 *
 * <p>{@link fr.lapetina.tr064.infrastructure.http.RouterHttpClient} performs descriptor
 * downloads and action posts over {@code java.net.http}, answering digest
 * challenges through {@link fr.lapetina.tr064.infrastructure.http.DigestAuthenticator}.
 */
package fr.lapetina.tr064.infrastructure.http;
