package com.questrail.diagnostics.protocol.uds.transport;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * FakeIsoTpSocket
 * -----------------------------------------------------------------------------
 * Test-only {@link IsoTpSocket} implementation.
 *
 * <p>Stores outbound payloads and lets tests inject inbound payloads or a
 * transport failure. Timed reads may be reported either as empty or as a
 * {@link SocketTimeoutException}, matching both shapes real sockets use.</p>
 */
public final class FakeIsoTpSocket implements IsoTpSocket {

    public record Binding(String interfaceName, int rxId, int txId) {}

    private static final Object FAILURE_MARKER = new Object();

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final List<byte[]> sent = Collections.synchronizedList(new ArrayList<>());

    private volatile boolean bound;
    private volatile Binding binding;
    private volatile boolean timeoutAsException;
    private volatile IOException pendingFailure;
    private volatile CountDownLatch recvGate;
    private volatile int bindCount;
    private volatile int closeCount;

    @Override
    public void bind(String interfaceName, int rxId, int txId) {
        binding = new Binding(interfaceName, rxId, txId);
        bound = true;
        bindCount++;
    }

    @Override
    public void send(byte[] payload) throws IOException {
        Objects.requireNonNull(payload, "payload");
        if (!bound) {
            throw new IOException("Socket is not bound");
        }
        sent.add(payload.clone());
    }

    @Override
    public Optional<byte[]> recv(Duration timeout) throws IOException {
        Object next;
        try {
            CountDownLatch gate = recvGate;
            if (gate != null) {
                gate.await();
            }
            next = inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }

        if (next == null) {
            if (timeoutAsException) {
                throw new SocketTimeoutException("timed out");
            }
            return Optional.empty();
        }
        if (next == FAILURE_MARKER) {
            throw pendingFailure;
        }
        return Optional.of((byte[]) next);
    }

    @Override
    public void close() {
        bound = false;
        closeCount++;
    }

    @Override
    public boolean isBound() {
        return bound;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void inject(byte[] payload) {
        inbound.add(payload.clone());
    }

    /**
     * Makes the next read after already injected payloads fail with {@code failure}.
     */
    public void failNextRecv(IOException failure) {
        pendingFailure = Objects.requireNonNull(failure, "failure");
        inbound.add(FAILURE_MARKER);
    }

    /**
     * Blocks every read, whatever its timeout, until {@link #releaseRecv()}.
     */
    public void holdRecv() {
        recvGate = new CountDownLatch(1);
    }

    public void releaseRecv() {
        CountDownLatch gate = recvGate;
        recvGate = null;
        if (gate != null) {
            gate.countDown();
        }
    }

    public void reportTimeoutAsException(boolean enabled) {
        timeoutAsException = enabled;
    }

    public List<byte[]> sent() {
        synchronized (sent) {
            return List.copyOf(sent);
        }
    }

    public Binding binding() {
        return binding;
    }

    public int bindCount() {
        return bindCount;
    }

    public int closeCount() {
        return closeCount;
    }
}
