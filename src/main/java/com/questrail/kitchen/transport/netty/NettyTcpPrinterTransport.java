package com.questrail.kitchen.transport.netty;

import com.questrail.kitchen.transport.PrinterAck;
import com.questrail.kitchen.transport.PrinterTransport;
import com.questrail.kitchen.transport.PrinterTransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * NettyTcpPrinterTransport
 * =============================================================================
 * Netty-backed implementation of the {@link PrinterTransport} port for raw TCP
 * printers (usually port 9100).
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT build
 * tickets, retry, or decide what a failure means.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Attempt protocol</h2>
 * <ol>
 *   <li>connect (bounded by the connect timeout)</li>
 *   <li>write the payload followed by {@code DLE EOT 1}</li>
 *   <li>the first byte received is the printer status; the attempt completes
 *       and the connection is closed</li>
 * </ol>
 * One connection per attempt keeps a half-dead socket from poisoning the
 * next ticket.
 */
public final class NettyTcpPrinterTransport implements PrinterTransport
{
    static final byte[] STATUS_REQUEST = {0x10, 0x04, 0x01};

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile boolean running;

    public NettyTcpPrinterTransport(Duration connectTimeout)
    {
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .option(ChannelOption.TCP_NODELAY, true);
    }

    @Override
    public void start()
    {
        running = true;
    }

    @Override
    public void stop()
    {
        running = false;
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    @Override
    public boolean isRunning()
    {
        return running && !group.isShuttingDown();
    }

    @Override
    public CompletableFuture<PrinterAck> send(InetSocketAddress printer, byte[] payload)
    {
        Objects.requireNonNull(printer, "printer");
        Objects.requireNonNull(payload, "payload");

        CompletableFuture<PrinterAck> result = new CompletableFuture<>();
        if (!isRunning()) {
            result.completeExceptionally(new PrinterTransportException("Printer transport is not running"));
            return result;
        }

        // Each attempt gets its own pipeline bound to its own result.
        ChannelFuture connect = bootstrap.clone()
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new StatusHandler(result, printer));
                    }
                })
                .connect(printer);

        connect.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                result.completeExceptionally(
                        new PrinterTransportException("Cannot connect to printer " + printer, f.cause()));
                return;
            }
            Channel ch = f.channel();

            // Abandoned attempts (timeout, cancellation) close their connection.
            result.whenComplete((ack, error) -> ch.close());

            ByteBuf buf = Unpooled.buffer(payload.length + STATUS_REQUEST.length);
            buf.writeBytes(payload);
            buf.writeBytes(STATUS_REQUEST);
            ch.writeAndFlush(buf).addListener((ChannelFutureListener) w -> {
                if (!w.isSuccess()) {
                    result.completeExceptionally(
                            new PrinterTransportException("Write to printer " + printer + " failed", w.cause()));
                }
            });
        });

        result.whenComplete((ack, error) -> {
            if (result.isCancelled()) {
                connect.cancel(false);
            }
        });
        return result;
    }

    /**
     * StatusHandler
     * -------------------------------------------------------------------------
     * Completes the attempt with the first inbound byte and turns channel
     * failures into {@link PrinterTransportException}.
     */
    private static final class StatusHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final CompletableFuture<PrinterAck> result;
        private final InetSocketAddress printer;

        StatusHandler(CompletableFuture<PrinterAck> result, InetSocketAddress printer)
        {
            this.result = result;
            this.printer = printer;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            if (msg.isReadable()) {
                result.complete(new PrinterAck(msg.readUnsignedByte()));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            result.completeExceptionally(
                    new PrinterTransportException("Printer " + printer + " closed the connection without status"));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            result.completeExceptionally(new PrinterTransportException("Printer " + printer + " I/O error", cause));
            ctx.close();
        }
    }
}
