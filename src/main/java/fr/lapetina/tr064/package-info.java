/**
 * TR-064 router client.
 *
 * <p>This library discovers the services a TR-064 router (such as an AVM FRITZ!Box)
 * advertises and calls their SOAP actions by name. It also listens to the router's
 * call monitor port.
 *
 * <h2>Architecture Overview</h2>
 * <pre>
 *   RouterConnection --&gt; SchemaBuilder --&gt; DocumentFetcher (RouterHttpClient | LocalDocumentFetcher)
 *          |                  |
 *          |                  +--&gt; DescriptionParser, ScpdParser --&gt; RouterSchema / ServiceRegistry
 *          |
 *          +--&gt; SoapActionInvoker --&gt; RouterHttpClient (digest auth) --&gt; ErrorMapper
 *
 *   CallMonitor --&gt; SocketConnector --&gt; LineReassembler --&gt; BlockingQueue&lt;String&gt;
 * </pre>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tr064.RouterConnection} - Entry point for action calls</li>
 *   <li>{@link fr.lapetina.tr064.infrastructure.discovery.SchemaBuilder} - Service discovery</li>
 *   <li>{@link fr.lapetina.tr064.infrastructure.soap.SoapActionInvoker} - SOAP request execution</li>
 *   <li>{@link fr.lapetina.tr064.domain.error.ErrorKind} - Protocol error taxonomy</li>
 *   <li>{@link fr.lapetina.tr064.monitor.CallMonitor} - Call monitor client</li>
 * </ul>
 *
 * <h2>Logging</h2>
 * <p>All components log through SLF4J. Without a binding on the classpath nothing is written.
 */
package fr.lapetina.tr064;
