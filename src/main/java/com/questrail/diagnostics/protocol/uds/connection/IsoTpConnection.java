package com.questrail.diagnostics.protocol.uds.connection;

import com.questrail.diagnostics.protocol.uds.UdsTimeoutException;
import com.questrail.diagnostics.protocol.uds.codec.RequestFramer;
import com.questrail.diagnostics.protocol.uds.codec.ResponseFramer;
import com.questrail.diagnostics.protocol.uds.codec.impl.DefaultRequestFramer;
import com.questrail.diagnostics.protocol.uds.codec.impl.DefaultResponseFramer;
import com.questrail.diagnostics.protocol.uds.config.ConnectionConfig;
import com.questrail.diagnostics.protocol.uds.model.Request;
import com.questrail.diagnostics.protocol.uds.model.Response;
import com.questrail.diagnostics.protocol.uds.observability.NullObservabilitySink;
import com.questrail.diagnostics.protocol.uds.observability.UdsErrorEvent;
import com.questrail.diagnostics.protocol.uds.observability.UdsFrameEvent;
import com.questrail.diagnostics.protocol.uds.observability.UdsObservabilitySink;
import com.questrail.diagnostics.protocol.uds.observability.UdsTransportEvent;
import com.questrail.diagnostics.protocol.uds.service.ServiceRegistry;
import com.questrail.diagnostics.protocol.uds.transport.IsoTpSocket;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * IsoTpConnection
 * =============================================================================
 * Owns an {@link IsoTpSocket} and decouples frame arrival from the protocol
 * caller waiting for it.
 *
 * <h2>Threading Model</h2>
 * A dedicated receiver thread owns the read side of the socket and is the
 * only producer of a bounded FIFO. The protocol caller owns the write side
 * ({@code send}) and is the only consumer ({@code waitFrame}). The FIFO is
 * the sole synchronization point:
 *
 * <pre>
 *   IsoTpSocket.recv  →  receiver thread  →  rx FIFO  →  waitFrame (caller)
 *   caller  →  send(Request | Response | byte[])  →  IsoTpSocket.send
 * </pre>
 *
 * <p>Frames reach the caller in exactly the order the transport produced them.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   open()   Closed → Open    binds the socket, starts the receiver
 *   close()  Open   → Closed  requests receiver exit, releases the socket
 * </pre>
 *
 * <p>{@link #close()} is advisory for the receiver: it stops at its next
 * poll boundary, so shutdown latency is bounded by
 * {@link ConnectionConfig#receivePollTimeout()}. An in-flight read is never
 * interrupted. The connection may be opened again after closing.</p>
 *
 * <h2>Failure isolation</h2>
 * An unexpected transport exception stops the receiver only. It is reported
 * to the observability sink and becomes visible through {@link #isOpen()};
 * it is never rethrown on the caller's thread. The receiver is not restarted
 * automatically; calling {@link #open()} again rebinds the socket and starts
 * a new one.
 */
public final class IsoTpConnection implements AutoCloseable
{
    private final ConnectionConfig config;
    private final IsoTpSocket socket;
    private final RequestFramer requestFramer;
    private final ResponseFramer responseFramer;
    private final UdsObservabilitySink observabilitySink;

    private final BlockingQueue<byte[]> rxQueue;

    private volatile boolean opened;
    private volatile Receiver receiver;

    /**
     * Creates a connection using the default framers over {@code registry}.
     */
    public IsoTpConnection(ConnectionConfig config, IsoTpSocket socket, ServiceRegistry registry) {
        this(config, socket, new DefaultRequestFramer(registry), new DefaultResponseFramer(registry), null);
    }

    public IsoTpConnection(ConnectionConfig config,
                           IsoTpSocket socket,
                           RequestFramer requestFramer,
                           ResponseFramer responseFramer,
                           UdsObservabilitySink observabilitySink) {
        this.config = Objects.requireNonNull(config, "config");
        this.socket = Objects.requireNonNull(socket, "socket");
        this.requestFramer = Objects.requireNonNull(requestFramer, "requestFramer");
        this.responseFramer = Objects.requireNonNull(responseFramer, "responseFramer");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.rxQueue = new ArrayBlockingQueue<>(config.rxQueueCapacity());
    }

    /**
     * Binds the socket and starts a new receiver, discarding frames left
     * over from a previous session. Calling this on a connection whose
     * receiver is running has no effect; after a receiver failure it rebinds
     * the socket.
     *
     * @return this connection, for use in try-with-resources
     * @throws IOException if the socket cannot be bound
     */
    public synchronized IsoTpConnection open() throws IOException {
        Receiver current = receiver;
        if (opened && current != null && !current.failed) {
            return this;
        }
        if (current != null) {
            // Receiver stopped on a transport failure; release the socket before rebinding.
            receiver = null;
            current.stopRequested = true;
            socket.close();
        }
        opened = false;

        socket.bind(config.interfaceName(), config.rxId(), config.txId());
        rxQueue.clear();

        Receiver r = new Receiver();
        Thread t = new Thread(r, "uds-isotp-rx-" + config.interfaceName());
        t.setDaemon(true);
        r.thread = t;
        receiver = r;
        t.start();

        opened = true;
        observabilitySink.onTransportEvent(new UdsTransportEvent(
                Instant.now(), UdsTransportEvent.Kind.OPENED, config.interfaceName()));
        return this;
    }

    /**
     * Requests the receiver to stop and releases the socket. Idempotent.
     */
    @Override
    public synchronized void close() {
        Receiver r = receiver;
        receiver = null;
        if (r != null) {
            r.stopRequested = true;
        }
        socket.close();

        boolean wasOpened = opened;
        opened = false;

        Thread t = r == null ? null : r.thread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(config.receivePollTimeout().multipliedBy(2).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        if (wasOpened) {
            observabilitySink.onTransportEvent(new UdsTransportEvent(
                    Instant.now(), UdsTransportEvent.Kind.CLOSED, config.interfaceName()));
        }
    }

    /**
     * Tells whether the transport is usable: the socket is bound and the
     * receiver has not stopped on a transport failure.
     */
    public boolean isOpen() {
        Receiver r = receiver;
        return socket.isBound() && r != null && !r.failed;
    }

    public void send(Request request) throws IOException {
        Objects.requireNonNull(request, "request");
        send(requestFramer.encode(request));
    }

    public void send(Response response) throws IOException {
        Objects.requireNonNull(response, "response");
        send(responseFramer.encode(response));
    }

    public void send(byte[] payload) throws IOException {
        Objects.requireNonNull(payload, "payload");
        socket.send(payload);
        observabilitySink.onFrameSent(new UdsFrameEvent(Instant.now(), config.txId(), payload));
    }

    /**
     * Waits for the next frame with the configured default timeout, returning
     * empty if none arrives.
     */
    public Optional<byte[]> waitFrame() {
        return waitFrame(config.defaultFrameTimeout(), false);
    }

    public Optional<byte[]> waitFrame(Duration timeout) {
        return waitFrame(timeout, false);
    }

    /**
     * Waits up to {@code timeout} for the next received frame.
     *
     * <p>An interrupt ends the wait early and is handled like an expired
     * timeout; the thread's interrupt flag is restored.</p>
     *
     * @param timeout          maximum time to wait
     * @param raiseOnTimeout   fail instead of returning empty
     * @return the next frame, or empty when not open or on timeout (non-strict)
     * @throws IllegalStateException if not open and {@code raiseOnTimeout} is set
     * @throws UdsTimeoutException   if no frame arrived in time and {@code raiseOnTimeout} is set
     */
    public Optional<byte[]> waitFrame(Duration timeout, boolean raiseOnTimeout) {
        Objects.requireNonNull(timeout, "timeout");

        if (!opened) {
            if (raiseOnTimeout) {
                throw new IllegalStateException("Connection is not open");
            }
            return Optional.empty();
        }

        byte[] frame;
        try {
            frame = rxQueue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            frame = null;
        }

        if (frame == null) {
            if (raiseOnTimeout) {
                throw new UdsTimeoutException(timeout);
            }
            return Optional.empty();
        }
        return Optional.of(frame);
    }

    /**
     * Waits for the next frame and parses it as a response. The result may
     * be an invalid {@link Response}; check {@link Response#valid()}.
     */
    public Optional<Response> waitResponse(Duration timeout, boolean raiseOnTimeout) {
        return waitFrame(timeout, raiseOnTimeout).map(responseFramer::decode);
    }

    /**
     * Discards every frame currently queued, without blocking.
     *
     * @return number of frames discarded
     */
    public int emptyRxQueue() {
        List<byte[]> stale = new ArrayList<>();
        rxQueue.drainTo(stale);
        return stale.size();
    }

    public ConnectionConfig config() {
        return config;
    }

    /**
     * One receiver run. Each {@link #open()} starts a new one with its own
     * stop flag, so a run that outlives {@link #close()} never resumes after
     * a reopen.
     */
    private final class Receiver implements Runnable
    {
        private volatile boolean stopRequested;
        private volatile boolean failed;
        private Thread thread;

        @Override
        public void run() {
            final Duration pollTimeout = config.receivePollTimeout();

            while (!stopRequested) {
                try {
                    Optional<byte[]> frame = socket.recv(pollTimeout);
                    if (frame.isPresent()) {
                        enqueue(frame.get());
                    }
                } catch (SocketTimeoutException e) {
                    // Timed read elapsed; poll again.
                } catch (Exception e) {
                    if (!stopRequested) {
                        stopRequested = true;
                        failed = true;
                        observabilitySink.onError(new UdsErrorEvent(
                                Instant.now(), "ISO-TP receiver stopped on transport error", e));
                        observabilitySink.onTransportEvent(new UdsTransportEvent(
                                Instant.now(), UdsTransportEvent.Kind.RECEIVER_STOPPED, config.interfaceName()));
                    }
                }
            }
        }

        private void enqueue(byte[] frame) {
            final long waitNanos = config.receivePollTimeout().toNanos();
            try {
                // Bounded FIFO: wait for the consumer, re-checking for close at each poll boundary.
                while (!stopRequested) {
                    if (rxQueue.offer(frame, waitNanos, TimeUnit.NANOSECONDS)) {
                        observabilitySink.onFrameReceived(new UdsFrameEvent(Instant.now(), config.rxId(), frame));
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopRequested = true;
            }
        }
    }
}
