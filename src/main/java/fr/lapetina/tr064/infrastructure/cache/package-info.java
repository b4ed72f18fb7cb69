/**
 * Optional local cache of discovered schemas, stored as JSON.
 */
package fr.lapetina.tr064.infrastructure.cache;
