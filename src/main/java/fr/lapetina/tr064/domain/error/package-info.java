/**
 * Exception hierarchy and protocol error taxonomy.
 *
 * <pre>
 * RouterException
 *   |-- RouterConnectionException
 *   |     |-- RouterAuthorizationException
 *   |     `-- ResourceUnavailableException
 *   |-- MalformedDescriptorException
 *   |-- ServiceNotFoundException
 *   |-- ActionNotFoundException
 *   `-- ProtocolException (carries an {@link fr.lapetina.tr064.domain.error.ErrorKind})
 * </pre>
 */
package fr.lapetina.tr064.domain.error;
