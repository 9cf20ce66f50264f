package com.anzhi.simplerpc.registry;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * 注册中心的 HTTP 接口，所有有用的信息都放在 HTTP Header 里：
 * <ul>
 *     <li>GET：返回所有存活的实例，逗号分隔，放在 X-SimpleRpc-Servers 里</li>
 *     <li>POST：添加实例或发送心跳，地址放在 X-SimpleRpc-Server 里</li>
 * </ul>
 */
@ChannelHandler.Sharable
public class RegistryHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger logger = LoggerFactory.getLogger(RegistryHttpHandler.class);

    public static final String SERVERS_HEADER = "X-SimpleRpc-Servers";
    public static final String SERVER_HEADER = "X-SimpleRpc-Server";

    private final SimpleRegistry registry;
    private final String path;

    public RegistryHttpHandler(SimpleRegistry registry, String path) {
        this.registry = registry;
        this.path = path;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String requestPath = new QueryStringDecoder(request.uri()).path();
        if (!requestPath.equals(path)) {
            sendResponse(ctx, request, newResponse(HttpResponseStatus.NOT_FOUND));
            return;
        }

        HttpMethod method = request.method();
        if (HttpMethod.GET.equals(method)) {
            FullHttpResponse response = newResponse(HttpResponseStatus.OK);
            response.headers().set(SERVERS_HEADER, String.join(",", registry.listAlive()));
            sendResponse(ctx, request, response);
        } else if (HttpMethod.POST.equals(method)) {
            String addr = request.headers().get(SERVER_HEADER);
            if (addr == null || addr.isEmpty()) {
                logger.warn("rpc registry: heartbeat from {} without {}", ctx.channel().remoteAddress(), SERVER_HEADER);
                sendResponse(ctx, request, newResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR));
                return;
            }
            registry.recordHeartbeat(addr);
            sendResponse(ctx, request, newResponse(HttpResponseStatus.OK));
        } else {
            sendResponse(ctx, request, newResponse(HttpResponseStatus.METHOD_NOT_ALLOWED));
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("Exception caught in registry handler", cause);
        ctx.close();
    }

    private static FullHttpResponse newResponse(HttpResponseStatus status) {
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.EMPTY_BUFFER);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
        return response;
    }

    private static void sendResponse(ChannelHandlerContext ctx, FullHttpRequest request, FullHttpResponse response) {
        if (HttpUtil.isKeepAlive(request)) {
            HttpUtil.setKeepAlive(response, true);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
