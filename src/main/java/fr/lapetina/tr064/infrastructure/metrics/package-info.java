/**
 * Micrometer metrics with Prometheus exposition.
 */
package fr.lapetina.tr064.infrastructure.metrics;
