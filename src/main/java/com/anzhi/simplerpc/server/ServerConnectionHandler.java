package com.anzhi.simplerpc.server;

import com.anzhi.simplerpc.Option;
import com.anzhi.simplerpc.codec.Codec;
import com.anzhi.simplerpc.codec.CodecFactory;
import com.anzhi.simplerpc.codec.CodecRegistry;
import com.anzhi.simplerpc.codec.HandshakeSerializer;
import com.anzhi.simplerpc.codec.Header;
import com.anzhi.simplerpc.error.CodecException;
import com.anzhi.simplerpc.error.RpcException;
import com.anzhi.simplerpc.service.MethodEntry;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.handler.codec.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 一条连接上的服务端处理流程：
 * <pre>
 * AWAITING_OPTION -> SERVING -> DRAINING -> CLOSED
 * </pre>
 * 读方向在 Netty 的 EventLoop 上顺序进行；每个请求交给工作线程并发执行，
 * 所有响应都在同一把写锁下发出，一个完整的 Header+Body 不会和别的响应交织。
 */
class ServerConnectionHandler extends SimpleChannelInboundHandler<ByteBuf> {
    private static final Logger logger = LoggerFactory.getLogger(ServerConnectionHandler.class);

    // 出错时响应 Body 的占位符
    static final Object INVALID_REQUEST = Collections.emptyMap();

    enum State { AWAITING_OPTION, SERVING, DRAINING, CLOSED }

    private final RpcServer server;
    private final CodecRegistry codecs;
    private final Executor workers;
    private final ScheduledExecutorService timer;

    // 保证一次发送一个完整的响应
    private final ReentrantLock sending = new ReentrantLock();
    // 已分发、尚未完成的请求数
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile State state = State.AWAITING_OPTION;

    private ChannelHandlerContext ctx;
    private Option option;
    private Codec codec;
    // 已读到 Header，等待它的 Body
    private Header pendingHeader;

    ServerConnectionHandler(RpcServer server, CodecRegistry codecs, Executor workers, ScheduledExecutorService timer) {
        this.server = server;
        this.codecs = codecs;
        this.workers = workers;
        this.timer = timer;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
        switch (state) {
            case AWAITING_OPTION:
                handshake(ctx, frame);
                break;
            case SERVING:
                if (pendingHeader == null) {
                    readHeader(frame);
                } else {
                    readBody(frame);
                }
                break;
            default:
                // 排空或已关闭，后续数据全部丢弃
                break;
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof ChannelInputShutdownEvent) {
            logger.debug("rpc server: connection {} reached end of input", ctx.channel().remoteAddress());
            startDraining();
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        logger.debug("rpc server: connection {} closed by peer", ctx.channel().remoteAddress());
        startDraining();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // 帧都切不出来，没有 Header 可以挂错误信息，只能结束这条连接
            logger.error("rpc server: framing error on {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            logger.warn("rpc server: connection {} error: {}", ctx.channel().remoteAddress(), cause.toString());
        }
        stopReading(ctx);
    }

    private void handshake(ChannelHandlerContext ctx, ByteBuf frame) {
        Option opt;
        try {
            opt = HandshakeSerializer.deserialize(frame);
        } catch (CodecException e) {
            logger.warn("rpc server: options error: {}", e.getMessage());
            abort(ctx);
            return;
        }
        if (opt.getMagicNumber() != Option.MAGIC_NUMBER) {
            logger.warn("rpc server: invalid magic number {}", Integer.toHexString(opt.getMagicNumber()));
            abort(ctx);
            return;
        }
        Optional<CodecFactory> factory = codecs.lookup(opt.getCodecType());
        if (factory.isEmpty()) {
            logger.warn("rpc server: invalid codec type {}", opt.getCodecType());
            abort(ctx);
            return;
        }
        this.option = opt;
        this.codec = factory.get().newCodec(ctx.channel());
        this.state = State.SERVING;
        logger.debug("rpc server: connection {} accepted with {}", ctx.channel().remoteAddress(), opt);
    }

    private void readHeader(ByteBuf frame) {
        try {
            pendingHeader = codec.readHeader(frame);
        } catch (CodecException e) {
            logger.error("rpc server: read header error: {}", e.getMessage());
            stopReading(ctx);
        }
    }

    private void readBody(ByteBuf frame) {
        Header header = pendingHeader;
        pendingHeader = null;

        Request request;
        try {
            request = server.resolve(header);
        } catch (RpcException e) {
            // Body 依然要读掉，保证流上的下一帧是 Header
            codec.discardBody(frame);
            write(header.withError(e.getMessage()), INVALID_REQUEST);
            return;
        }

        try {
            request.setArg(readArg(frame, request.getMethod()));
            request.setReply(request.getMethod().newReply());
        } catch (CodecException | IllegalStateException e) {
            // 解码失败或参数/返回值槽位无法分配
            logger.warn("rpc server: read body err: {}", e.getMessage());
            write(header.withError("rpc server: read body err: " + e.getMessage()), INVALID_REQUEST);
            return;
        }
        dispatch(request);
    }

    private <A> A readArg(ByteBuf frame, MethodEntry<A, ?> method) {
        return codec.readBody(frame, method.getArgType(), method.newArg());
    }

    private void dispatch(Request request) {
        inFlight.incrementAndGet();
        Duration timeout = option.getHandleTimeout();
        ScheduledFuture<?> timeoutTask = null;
        try {
            if (!timeout.isZero() && !timeout.isNegative()) {
                timeoutTask = timer.schedule(() -> onTimeout(request, timeout), toNanos(timeout), TimeUnit.NANOSECONDS);
            }
            final ScheduledFuture<?> task = timeoutTask;
            workers.execute(() -> handleRequest(request, task));
        } catch (RuntimeException e) {
            // 请求已计入 inFlight，任何分发失败都必须回复并完成，否则排空永远结束不了
            logger.warn("rpc server: cannot dispatch request {}: {}", request.getHeader(), e.toString());
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
            String message = e instanceof RejectedExecutionException
                    ? "rpc server: server is shutting down"
                    : "rpc server: dispatch error: " + errorMessage(e);
            sendResponse(request, request.getHeader().withError(message), INVALID_REQUEST);
            complete(request);
        }
    }

    private void handleRequest(Request request, ScheduledFuture<?> timeoutTask) {
        Header header = request.getHeader();
        Header response;
        Object body;
        try {
            body = request.getService().call(request.getMethod(), request.getArg(), request.getReply());
            response = header.withError("");
        } catch (Exception e) {
            logger.debug("rpc server: {} failed", header.getServiceMethod(), e);
            response = header.withError(errorMessage(e));
            body = INVALID_REQUEST;
        } catch (Error e) {
            logger.error("rpc server: {} failed", header.getServiceMethod(), e);
            response = header.withError(errorMessage(e));
            body = INVALID_REQUEST;
        }
        // 调用结束，不再需要超时响应
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
        try {
            if (!sendResponse(request, response, body)) {
                logger.debug("rpc server: drop late response of {} seq {}", header.getServiceMethod(), header.getSeq());
            }
        } finally {
            complete(request);
        }
    }

    private void onTimeout(Request request, Duration timeout) {
        Header header = request.getHeader();
        String message = "rpc server: request handle timeout: expect within " + format(timeout);
        if (sendResponse(request, header.withError(message), INVALID_REQUEST)) {
            logger.warn("rpc server: {} seq {} timed out after {}", header.getServiceMethod(), header.getSeq(), format(timeout));
        }
        // 不等待调用本身结束，它在后台跑完后的响应会被丢弃
        complete(request);
    }

    /**
     * 每个请求至多发送一次响应。
     *
     * @return 这次是否真的发出了响应
     */
    private boolean sendResponse(Request request, Header header, Object body) {
        sending.lock();
        try {
            if (!request.markResponded()) {
                return false;
            }
            write(header, body);
            return true;
        } finally {
            sending.unlock();
        }
    }

    private void write(Header header, Object body) {
        sending.lock();
        try {
            if (state == State.CLOSED || !ctx.channel().isActive()) {
                logger.debug("rpc server: connection closed, response {} dropped", header);
                return;
            }
            ChannelFuture future;
            try {
                future = codec.write(header, body);
            } catch (CodecException e) {
                // 返回值编码失败，改为回一个错误
                logger.error("rpc server: write response error: {}", e.getMessage());
                future = codec.write(header.withError("rpc server: write response error: " + e.getMessage()), INVALID_REQUEST);
            }
            future.addListener(f -> {
                if (!f.isSuccess()) {
                    logger.error("rpc server: write response error: {}", String.valueOf(f.cause()));
                }
            });
        } finally {
            sending.unlock();
        }
    }

    private void complete(Request request) {
        if (request.markCompleted() && inFlight.decrementAndGet() == 0 && state == State.DRAINING) {
            closeConnection();
        }
    }

    private void stopReading(ChannelHandlerContext ctx) {
        ctx.channel().config().setAutoRead(false);
        startDraining();
    }

    private void startDraining() {
        if (state == State.AWAITING_OPTION || state == State.SERVING) {
            state = State.DRAINING;
        }
        if (inFlight.get() == 0) {
            closeConnection();
        }
    }

    private void abort(ChannelHandlerContext ctx) {
        state = State.CLOSED;
        closed.set(true);
        ctx.close();
    }

    private void closeConnection() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        state = State.CLOSED;
        if (codec != null) {
            codec.close();
        } else {
            ctx.close();
        }
    }

    State state() {
        return state;
    }

    static String errorMessage(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isEmpty() ? e.toString() : message;
    }

    /**
     * 超出 long 纳秒范围的超时按最大值处理，相当于不限制。
     */
    static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * 1s、1500ms 这样的简短格式。
     */
    static String format(Duration duration) {
        long millis;
        try {
            millis = duration.toMillis();
        } catch (ArithmeticException e) {
            return duration.getSeconds() + "s";
        }
        if (millis == 0) {
            return duration.toNanos() / 1000 + "us";
        }
        if (millis % 1000 == 0) {
            return millis / 1000 + "s";
        }
        return millis + "ms";
    }
}
