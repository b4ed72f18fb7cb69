/**
 * Call monitor client.
 *
 * <p>The router reports telephony events on TCP port 1012 as text lines such as
 * {@code 31.10.20 12:34:56;RING;0;0123456;98765;SIP0;}.
 * {@link fr.lapetina.tr064.monitor.CallMonitor} keeps a connection open and
 * delivers each line through a bounded {@link java.util.concurrent.BlockingQueue}.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>One daemon reader thread per running monitor, named {@code call-monitor}</li>
 *   <li>Consumers poll the returned queue from any thread</li>
 *   <li>{@code stop()} signals the reader, closes the socket and joins the thread</li>
 * </ul>
 *
 * <h2>Queue Full Policy</h2>
 * <ul>
 *   <li>{@code DROP} - lines arriving while the queue is full are discarded and counted</li>
 *   <li>{@code BLOCK} - the reader waits for free space until stopped</li>
 * </ul>
 */
package fr.lapetina.tr064.monitor;
