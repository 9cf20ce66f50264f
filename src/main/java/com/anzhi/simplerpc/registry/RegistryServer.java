package com.anzhi.simplerpc.registry;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * 通过 HTTP 对外提供 {@link SimpleRegistry}。
 */
public class RegistryServer {
    private static final Logger logger = LoggerFactory.getLogger(RegistryServer.class);

    private final SimpleRegistry registry;
    private final String path;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RegistryServer(SimpleRegistry registry) {
        this(registry, SimpleRegistry.DEFAULT_PATH);
    }

    public RegistryServer(SimpleRegistry registry, String path) {
        this.registry = registry;
        this.path = path;
    }

    public synchronized InetSocketAddress start(int port) throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("registry already started on " + serverChannel.localAddress());
        }
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("registry-boss"));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("registry-io"));
        RegistryHttpHandler handler = new RegistryHttpHandler(registry, path);

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(65536));
                        pipeline.addLast(handler);
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        try {
            serverChannel = bootstrap.bind(port).sync().channel();
        } catch (Exception e) {
            workerGroup.shutdownGracefully();
            bossGroup.shutdownGracefully();
            serverChannel = null;
            throw e;
        }
        InetSocketAddress local = (InetSocketAddress) serverChannel.localAddress();
        logger.info("rpc registry path: {} on port {}", path, local.getPort());
        return local;
    }

    /**
     * 注册中心的完整 URL，例如 http://127.0.0.1:9999/_simple_rpc_/registry。
     */
    public String getUrl() {
        if (serverChannel == null) {
            throw new IllegalStateException("registry not started");
        }
        InetSocketAddress local = (InetSocketAddress) serverChannel.localAddress();
        return "http://127.0.0.1:" + local.getPort() + path;
    }

    public SimpleRegistry getRegistry() {
        return registry;
    }

    public synchronized void shutdown() {
        logger.info("Shutting down registry...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }
}
