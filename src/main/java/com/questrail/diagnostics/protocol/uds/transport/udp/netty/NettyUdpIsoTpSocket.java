package com.questrail.diagnostics.protocol.uds.transport.udp.netty;

import com.questrail.diagnostics.protocol.uds.transport.IsoTpSocket;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * NettyUdpIsoTpSocket
 * =============================================================================
 * Netty-backed {@link IsoTpSocket} that tunnels complete ISO-TP payloads in
 * UDP datagrams, for use with a CAN gateway or a simulated ECU.
 *
 * <h2>Datagram layout</h2>
 * <pre>
 *   [ arbitration ID : 4 bytes, big endian ][ ISO-TP payload ... ]
 * </pre>
 *
 * <p>{@link #send(byte[])} stamps the bound {@code txId}. Inbound datagrams
 * shorter than the header, or carrying an ID other than the bound
 * {@code rxId}, are dropped.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]} and queued for {@link #recv(Duration)}; reference-counted
 * buffers are released by the inbound handler.
 *
 * <h2>Lifecycle</h2>
 * {@link #bind(String, int, int)} binds synchronously on a dedicated event
 * loop group. {@link #close()} closes the channel and shuts the group down.
 * The interface name passed to {@code bind} only labels the socket.
 */
public final class NettyUdpIsoTpSocket implements IsoTpSocket
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpIsoTpSocket.class);

    static final int HEADER_LENGTH = 4;

    private final InetSocketAddress bindAddress;
    private final InetSocketAddress remoteAddress;

    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();

    private volatile EventLoopGroup group;
    private volatile Channel channel;
    private volatile String interfaceName;
    private volatile int rxId;
    private volatile int txId;
    private volatile Throwable failure;

    public NettyUdpIsoTpSocket(InetSocketAddress bindAddress, InetSocketAddress remoteAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
    }

    @Override
    public synchronized void bind(String interfaceName, int rxId, int txId) throws IOException
    {
        Objects.requireNonNull(interfaceName, "interfaceName");
        if (channel != null) {
            throw new IOException("Socket already bound to " + this.interfaceName);
        }

        EventLoopGroup g = new NioEventLoopGroup(1);
        Bootstrap bootstrap = new Bootstrap()
                .group(g)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            g.shutdownGracefully();
            throw new IOException("Failed to bind UDP tunnel on " + bindAddress, f.cause());
        }

        this.interfaceName = interfaceName;
        this.rxId = rxId;
        this.txId = txId;
        this.failure = null;
        this.group = g;
        this.channel = f.channel();
        inbound.clear();

        log.debug("UDP tunnel {} bound on {} (rx=0x{}, tx=0x{}, remote={})",
                interfaceName, localAddress().orElse(bindAddress), Integer.toHexString(rxId), Integer.toHexString(txId), remoteAddress);
    }

    @Override
    public void send(byte[] payload) throws IOException
    {
        Objects.requireNonNull(payload, "payload");

        Channel ch = requireChannel();

        ByteBuf buf = Unpooled.buffer(HEADER_LENGTH + payload.length);
        buf.writeInt(txId);
        buf.writeBytes(payload);

        ChannelFuture f = ch.writeAndFlush(new DatagramPacket(buf, remoteAddress)).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new IOException("Failed to send datagram to " + remoteAddress, f.cause());
        }
    }

    @Override
    public Optional<byte[]> recv(Duration timeout) throws IOException
    {
        Objects.requireNonNull(timeout, "timeout");
        requireChannel();

        try {
            return Optional.ofNullable(inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public synchronized void close()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        EventLoopGroup g = group;
        group = null;
        if (g != null) {
            g.shutdownGracefully(0, 200, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public boolean isBound()
    {
        Channel ch = channel;
        return ch != null && ch.isActive() && failure == null;
    }

    /**
     * Actual local address, useful when bound to an ephemeral port.
     */
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.ofNullable((InetSocketAddress) ch.localAddress());
    }

    private Channel requireChannel() throws IOException
    {
        Throwable t = failure;
        if (t != null) {
            throw new IOException("UDP tunnel failed", t);
        }
        Channel ch = channel;
        if (ch == null) {
            throw new IOException("Socket is not bound");
        }
        return ch;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Strips the arbitration ID header and queues payloads addressed to us.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            ByteBuf content = packet.content();
            if (content.readableBytes() < HEADER_LENGTH) {
                log.debug("Dropping short datagram from {} ({} bytes)", packet.sender(), content.readableBytes());
                return;
            }

            int id = content.getInt(content.readerIndex());
            if (id != rxId) {
                log.trace("Dropping datagram for arbitration ID 0x{}", Integer.toHexString(id));
                return;
            }

            byte[] payload = new byte[content.readableBytes() - HEADER_LENGTH];
            content.getBytes(content.readerIndex() + HEADER_LENGTH, payload);
            inbound.offer(payload);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            failure = cause;
            ctx.close();
        }
    }
}
