package com.questrail.diagnostics.protocol.uds.transport;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Optional;

/**
 * IsoTpSocket
 * -----------------------------------------------------------------------------
 * Minimal port for an ISO-TP (ISO-15765-2) transport.
 *
 * <p>Each {@code send} and each value returned by {@code recv} is one complete
 * ISO-TP payload; segmentation and flow control happen below this port.</p>
 *
 * <p>The read side ({@link #recv(Duration)}) and the write side
 * ({@link #send(byte[])}) are each used by a single thread, never the same
 * one. Implementations need not make one direction safe against concurrent
 * use of itself.</p>
 */
public interface IsoTpSocket
{
    /**
     * Binds the socket to a transport interface and a pair of arbitration IDs.
     *
     * @param interfaceName transport interface, e.g. {@code "can0"}
     * @param rxId          arbitration ID of frames addressed to us
     * @param txId          arbitration ID used for frames we send
     * @throws IOException if binding fails
     */
    void bind(String interfaceName, int rxId, int txId) throws IOException;

    /**
     * Sends one ISO-TP payload.
     *
     * @throws IOException if the transport rejects the payload or is closed
     */
    void send(byte[] payload) throws IOException;

    /**
     * Waits up to {@code timeout} for the next ISO-TP payload.
     *
     * <p>A timeout is not an error: it is reported as {@link Optional#empty()}
     * or, by some implementations, as a {@link SocketTimeoutException}.</p>
     *
     * @throws IOException on an unrecoverable transport failure
     */
    Optional<byte[]> recv(Duration timeout) throws IOException;

    /**
     * Releases the transport. Safe to call more than once.
     */
    void close();

    /**
     * Tells whether the socket is currently bound and usable.
     */
    boolean isBound();
}
