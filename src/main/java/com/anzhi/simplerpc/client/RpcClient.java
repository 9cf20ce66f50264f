package com.anzhi.simplerpc.client;

import com.anzhi.simplerpc.Option;
import com.anzhi.simplerpc.codec.Codec;
import com.anzhi.simplerpc.codec.CodecRegistry;
import com.anzhi.simplerpc.codec.FrameDecoder;
import com.anzhi.simplerpc.codec.Frames;
import com.anzhi.simplerpc.codec.HandshakeSerializer;
import com.anzhi.simplerpc.codec.Header;
import com.anzhi.simplerpc.codec.Slots;
import com.anzhi.simplerpc.error.CodecException;
import com.anzhi.simplerpc.error.RpcException;
import com.anzhi.simplerpc.error.RpcTimeoutException;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RPC 客户端，对应一条连接。
 * <p>
 * 建立连接后先发送 Option，之后每次调用分配一个递增的 seq，响应按 seq 找回对应的 {@link Call}。
 * 同一个客户端可以被多个线程并发使用。
 */
public class RpcClient implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(RpcClient.class);

    static final String ERR_SHUTDOWN = "connection is shut down";

    private final Option option;
    private final CodecRegistry codecs;
    private final String address;

    // 保证一次发送一个完整的请求，同时保护 seq 的分配顺序
    private final ReentrantLock sending = new ReentrantLock();
    private final AtomicLong seq = new AtomicLong();
    private final ConcurrentHashMap<Long, Call<?>> pending = new ConcurrentHashMap<>();
    // 用户主动关闭
    private final AtomicBoolean closing = new AtomicBoolean();
    // 连接已断开
    private volatile boolean shutdown;

    private volatile Channel channel;
    private volatile Codec codec;

    private RpcClient(String address, Option option, CodecRegistry codecs) {
        this.address = address;
        this.option = option;
        this.codecs = codecs;
    }

    public static RpcClient dial(String address) throws InterruptedException {
        return dial(address, Option.defaults());
    }

    public static RpcClient dial(String address, Option option) throws InterruptedException {
        return dial(address, option, CodecRegistry.defaults());
    }

    /**
     * 连接服务端并完成握手。连接超时由 {@link Option#getConnectTimeout()} 决定，0 表示不限制。
     *
     * @param address host:port
     * @throws RpcTimeoutException 连接超时
     * @throws RpcException        连接失败或编码类型不受支持
     */
    public static RpcClient dial(String address, Option option, CodecRegistry codecs) throws InterruptedException {
        if (!codecs.supports(option.getCodecType())) {
            throw new CodecException("rpc client: unsupported codec type " + option.getCodecType());
        }
        int colon = address.lastIndexOf(':');
        if (colon <= 0) {
            throw new RpcException("rpc client: wrong address format '" + address + "', expect host:port");
        }
        String host = address.substring(0, colon);
        int port = Integer.parseInt(address.substring(colon + 1));

        RpcClient client = new RpcClient(address, option, codecs);
        Duration connectTimeout = option.getConnectTimeout();
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(ClientGroup.INSTANCE)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    public void initChannel(SocketChannel ch) throws Exception {
                        ch.pipeline().addLast(new FrameDecoder());
                        ch.pipeline().addLast(client.new ResponseHandler());
                    }
                });

        ChannelFuture connectFuture = bootstrap.connect(host, port);
        if (connectTimeout.isZero()) {
            connectFuture.await();
        } else if (!connectFuture.await(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            connectFuture.cancel(true);
            throw new RpcTimeoutException("rpc client: connect timeout: expect within " + connectTimeout, connectTimeout);
        }
        if (!connectFuture.isSuccess()) {
            Throwable cause = connectFuture.cause();
            logger.error("Failed to connect to {}", address, cause);
            throw new RpcException("rpc client: dial " + address + " failed: " + cause, cause);
        }
        logger.debug("Successfully connected to {}", address);
        client.attach(connectFuture.channel());
        return client;
    }

    private void attach(Channel channel) throws InterruptedException {
        this.channel = channel;
        this.codec = codecs.newCodec(option.getCodecType(), channel);
        // 握手：Option 固定用 JSON 编码，单独占一个帧
        ChannelFuture handshake = channel.writeAndFlush(
                Frames.frames(channel.alloc(), HandshakeSerializer.serialize(option))).await();
        if (!handshake.isSuccess()) {
            channel.close();
            throw new RpcException("rpc client: options error: " + handshake.cause(), handshake.cause());
        }
    }

    /**
     * 异步调用，返回的 future 在收到响应时完成；服务端返回错误时以 {@link RpcException} 异常完成。
     */
    public <R> CompletableFuture<R> go(String serviceMethod, Object args, Class<R> replyType) {
        return send(serviceMethod, args, replyType).getFuture();
    }

    public <R> R call(String serviceMethod, Object args, Class<R> replyType) throws InterruptedException {
        return call(serviceMethod, args, replyType, Duration.ZERO);
    }

    /**
     * 同步调用，timeout 为 0 时一直等待。
     *
     * @throws RpcTimeoutException 超时未收到响应，这次调用随即被放弃
     * @throws RpcException        服务端返回错误或连接断开
     */
    public <R> R call(String serviceMethod, Object args, Class<R> replyType, Duration timeout) throws InterruptedException {
        Call<R> call = send(serviceMethod, args, replyType);
        try {
            if (timeout.isZero()) {
                return call.getFuture().get();
            }
            return call.getFuture().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RpcException) {
                throw (RpcException) cause;
            }
            throw new RpcException("rpc client: call failed: " + cause, cause);
        } catch (TimeoutException e) {
            pending.remove(call.getSeq());
            throw new RpcTimeoutException("rpc client: call failed: timeout after " + timeout, timeout);
        } catch (InterruptedException e) {
            pending.remove(call.getSeq());
            throw e;
        }
    }

    private <R> Call<R> send(String serviceMethod, Object args, Class<R> replyType) {
        Call<R> call = new Call<>(serviceMethod, args, Slots.wrap(replyType));
        sending.lock();
        try {
            if (closing.get() || shutdown) {
                call.fail(new RpcException(ERR_SHUTDOWN));
                return call;
            }
            long s = seq.incrementAndGet();
            call.setSeq(s);
            pending.put(s, call);
            codec.write(new Header(serviceMethod, s), args).addListener(f -> {
                if (!f.isSuccess()) {
                    Call<?> failed = pending.remove(s);
                    if (failed != null) {
                        failed.fail(new RpcException("rpc client: write request error: " + f.cause(), f.cause()));
                    }
                }
            });
        } catch (CodecException e) {
            pending.remove(call.getSeq());
            call.fail(e);
        } finally {
            sending.unlock();
        }
        return call;
    }

    private void terminateCalls(RpcException cause) {
        sending.lock();
        try {
            shutdown = true;
            for (Long s : pending.keySet()) {
                Call<?> call = pending.remove(s);
                if (call != null) {
                    call.fail(cause);
                }
            }
        } finally {
            sending.unlock();
        }
    }

    public boolean isAvailable() {
        Channel ch = channel;
        return !closing.get() && !shutdown && ch != null && ch.isActive();
    }

    public String getAddress() { return address; }
    public Option getOption() { return option; }

    /**
     * 关闭连接，进行中的调用以 "connection is shut down" 失败。重复调用没有副作用。
     */
    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        Channel ch = channel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        terminateCalls(new RpcException(ERR_SHUTDOWN));
    }

    // 内部 Handler，用于处理响应
    private class ResponseHandler extends SimpleChannelInboundHandler<ByteBuf> {
        private Header header;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) throws Exception {
            if (header == null) {
                try {
                    header = codec.readHeader(frame);
                } catch (CodecException e) {
                    logger.error("rpc client: read header error from {}: {}", address, e.getMessage());
                    terminateCalls(new RpcException("rpc client: read header error: " + e.getMessage(), e));
                    ctx.close();
                }
                return;
            }
            Header h = header;
            header = null;

            Call<?> call = pending.remove(h.getSeq());
            if (call == null) {
                // 调用方已经放弃（比如超时），Body 直接丢弃
                codec.discardBody(frame);
                logger.debug("Received response for unknown seq: {}", h.getSeq());
                return;
            }
            if (h.hasError()) {
                codec.discardBody(frame);
                call.fail(new RpcException(h.getError()));
                return;
            }
            complete(call, frame);
        }

        private <R> void complete(Call<R> call, ByteBuf frame) {
            try {
                call.complete(codec.readBody(frame, call.getReplyType(), null));
            } catch (CodecException e) {
                call.fail(new RpcException("rpc client: reading body " + e.getMessage(), e));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            terminateCalls(new RpcException(ERR_SHUTDOWN));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            logger.error("Exception caught in rpc client handler for {}", address, cause);
            terminateCalls(new RpcException("rpc client: " + cause.getMessage(), cause));
            ctx.close();
        }
    }

    /**
     * 所有客户端共享一组 EventLoop，线程为守护线程。
     */
    private static final class ClientGroup {
        static final EventLoopGroup INSTANCE = new NioEventLoopGroup(0, new DefaultThreadFactory("rpc-client", true));
    }
}
