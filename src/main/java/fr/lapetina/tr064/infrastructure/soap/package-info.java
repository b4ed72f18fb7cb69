/**
 * SOAP action invocation: envelope building, response conversion and fault mapping.
 */
package fr.lapetina.tr064.infrastructure.soap;
