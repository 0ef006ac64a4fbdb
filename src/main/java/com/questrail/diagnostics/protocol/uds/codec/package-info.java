/**
 * UDS Codec: Application-Layer Framing
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for UDS (ISO-14229)
 * messages carried in ISO-TP payloads:</p>
 *
 * <ul>
 *   <li>Service ID placement and lookup through an injected
 *       {@link com.questrail.diagnostics.protocol.uds.service.ServiceRegistry}</li>
 *   <li>Subfunction byte and its suppress-positive-response bit</li>
 *   <li>Negative response detection ({@code 0x7F} marker)</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] ISO-TP payload
 *        → ResponseFramer     (wire rules applied here)
 *            → Response       (valid or invalid, never an exception)
 *
 *   Request
 *        → RequestFramer
 *            → byte[] ISO-TP payload
 * </pre>
 *
 * <h2>Failure model</h2>
 * <p>Encoding rejects bad caller input with
 * {@link com.questrail.diagnostics.protocol.uds.UdsConfigurationException}.
 * Decoding never throws: a malformed frame must not be able to crash the
 * receive path, so it is turned into an invalid result object.</p>
 */
package com.questrail.diagnostics.protocol.uds.codec;
