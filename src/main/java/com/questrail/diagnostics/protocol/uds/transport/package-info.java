/**
 * UDS Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>transport boundary</em> between a concrete
 * ISO-TP implementation (a kernel CAN socket binding, a UDP tunnel, a
 * simulator, or a test double) and the UDS protocol core.
 *
 * <p>Everything above the port sees only:</p>
 * <ul>
 *   <li>Complete ISO-TP payloads as {@code byte[]}</li>
 *   <li>A bound / not bound state</li>
 *   <li>Timeouts as empty results, failures as {@link java.io.IOException}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no UDS interpretation)</li>
 *   <li>Deliver payloads in arrival order, without merging or splitting</li>
 *   <li>Not retry or schedule anything on their own</li>
 * </ul>
 */
package com.questrail.diagnostics.protocol.uds.transport;
