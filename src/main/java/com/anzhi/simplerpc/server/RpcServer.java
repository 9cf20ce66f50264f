package com.anzhi.simplerpc.server;

import com.anzhi.simplerpc.codec.CodecRegistry;
import com.anzhi.simplerpc.codec.FrameDecoder;
import com.anzhi.simplerpc.codec.Header;
import com.anzhi.simplerpc.error.RpcException;
import com.anzhi.simplerpc.service.MethodEntry;
import com.anzhi.simplerpc.service.Service;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * RPC 服务端。持有若干具名服务，每条连接由一个 {@link ServerConnectionHandler} 负责。
 * <p>
 * 从收到请求到回复分三步：按参数类型把 Body 反序列化，调用方法，把返回值序列化后写回。
 */
public class RpcServer {
    private static final Logger logger = LoggerFactory.getLogger(RpcServer.class);

    private final ConcurrentHashMap<String, Service> serviceMap = new ConcurrentHashMap<>();
    private final CodecRegistry codecs;
    private final ExecutorService workers;
    private final ScheduledThreadPoolExecutor timer;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RpcServer() {
        this(CodecRegistry.defaults());
    }

    public RpcServer(CodecRegistry codecs) {
        this.codecs = codecs;
        this.workers = Executors.newCachedThreadPool(new DefaultThreadFactory("rpc-worker", true));
        this.timer = new ScheduledThreadPoolExecutor(1, new DefaultThreadFactory("rpc-timeout", true));
        // 请求按时完成后取消的超时任务直接移出队列
        this.timer.setRemoveOnCancelPolicy(true);
    }

    /**
     * 反射登记接收者上符合条件的方法，服务名为接收者的类名。
     */
    public void register(Object receiver) {
        register(Service.of(receiver));
    }

    /**
     * @throws RpcException 同名服务已经存在
     */
    public void register(Service service) {
        if (serviceMap.putIfAbsent(service.getName(), service) != null) {
            throw new RpcException("rpc: service already defined: " + service.getName());
        }
        logger.info("rpc server: service {} registered with methods {}", service.getName(), service.getMethodNames());
    }

    public Optional<Service> getService(String name) {
        return Optional.ofNullable(serviceMap.get(name));
    }

    public Collection<Service> getServices() {
        return Collections.unmodifiableCollection(serviceMap.values());
    }

    /**
     * 按最后一个 "." 把 "Service.Method" 拆开，分别查找服务和方法。
     */
    Request resolve(Header header) {
        String serviceMethod = header.getServiceMethod();
        int dot = serviceMethod == null ? -1 : serviceMethod.lastIndexOf('.');
        if (dot < 0) {
            throw new RpcException("rpc server: service/method request ill-formed: " + serviceMethod);
        }
        String serviceName = serviceMethod.substring(0, dot);
        String methodName = serviceMethod.substring(dot + 1);
        Service service = serviceMap.get(serviceName);
        if (service == null) {
            throw new RpcException("rpc server: can't find service " + serviceName);
        }
        MethodEntry<?, ?> method = service.getMethod(methodName);
        if (method == null) {
            throw new RpcException("rpc server: can't find method " + methodName);
        }
        return new Request(header, service, method);
    }

    /**
     * 在所有网卡上监听，port 为 0 时由系统分配端口。
     */
    public InetSocketAddress start(int port) throws InterruptedException {
        return start(new InetSocketAddress(port));
    }

    public InetSocketAddress start(String host, int port) throws InterruptedException {
        return start(new InetSocketAddress(host, port));
    }

    private synchronized InetSocketAddress start(InetSocketAddress bindAddress) throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("rpc server already started on " + serverChannel.localAddress());
        }
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("rpc-boss"));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("rpc-io"));

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    public void initChannel(SocketChannel ch) throws Exception {
                        ch.pipeline().addLast(new FrameDecoder());
                        // 每条连接一个处理器，持有该连接的写锁和在途请求计数
                        ch.pipeline().addLast(new ServerConnectionHandler(RpcServer.this, codecs, workers, timer));
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                // 对端关闭写方向后仍要把在途请求的响应发完
                .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .childOption(ChannelOption.TCP_NODELAY, true);

        // 绑定端口并同步等待成功
        try {
            serverChannel = b.bind(bindAddress).sync().channel();
        } catch (Exception e) {
            workerGroup.shutdownGracefully();
            bossGroup.shutdownGracefully();
            serverChannel = null;
            throw e;
        }
        InetSocketAddress local = (InetSocketAddress) serverChannel.localAddress();
        logger.info("RPC Server started and listening on {}", local);
        return local;
    }

    /**
     * 供注册中心和客户端使用的 host:port，监听通配地址时使用回环地址。
     */
    public String getAddress() {
        if (serverChannel == null) {
            throw new IllegalStateException("rpc server not started");
        }
        InetSocketAddress local = (InetSocketAddress) serverChannel.localAddress();
        String host = local.getAddress().isAnyLocalAddress() ? "127.0.0.1" : local.getAddress().getHostAddress();
        return host + ":" + local.getPort();
    }

    public void blockUntilShutdown() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    public synchronized void shutdown() {
        logger.info("Shutting down RpcServer...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        workers.shutdown();
        timer.shutdownNow();
    }
}
