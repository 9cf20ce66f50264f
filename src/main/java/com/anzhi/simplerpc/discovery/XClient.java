package com.anzhi.simplerpc.discovery;

import com.anzhi.simplerpc.Option;
import com.anzhi.simplerpc.client.RpcClient;
import com.anzhi.simplerpc.codec.CodecRegistry;
import com.anzhi.simplerpc.error.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * 支持负载均衡的客户端：每次调用先通过 {@link Discovery} 选出一个实例，
 * 再复用（或新建）到该实例的 {@link RpcClient}。
 */
public class XClient implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(XClient.class);

    private final Discovery discovery;
    private final SelectMode mode;
    private final Option option;
    private final CodecRegistry codecs;
    // 按地址缓存连接
    private final Map<String, RpcClient> clients = new ConcurrentHashMap<>();

    public XClient(Discovery discovery, SelectMode mode) {
        this(discovery, mode, Option.defaults());
    }

    public XClient(Discovery discovery, SelectMode mode, Option option) {
        this(discovery, mode, option, CodecRegistry.defaults());
    }

    public XClient(Discovery discovery, SelectMode mode, Option option, CodecRegistry codecs) {
        this.discovery = discovery;
        this.mode = mode;
        this.option = option;
        this.codecs = codecs;
    }

    /**
     * 按负载均衡策略选择一个实例发起调用。
     */
    public <R> R call(String serviceMethod, Object args, Class<R> replyType) throws InterruptedException {
        discovery.refresh();
        String addr = discovery.get(mode);
        return dial(addr).call(serviceMethod, args, replyType);
    }

    /**
     * 并发调用所有实例，任一实例出错即返回该错误，否则返回其中一个实例的结果。
     */
    public <R> R broadcast(String serviceMethod, Object args, Class<R> replyType) throws InterruptedException {
        discovery.refresh();
        List<String> servers = discovery.getAll();
        if (servers.isEmpty()) {
            throw new RpcException("rpc discovery: no available servers");
        }
        List<CompletableFuture<R>> futures = new ArrayList<>();
        for (String addr : servers) {
            try {
                futures.add(dial(addr).go(serviceMethod, args, replyType));
            } catch (RpcException e) {
                futures.add(CompletableFuture.failedFuture(e));
            }
        }
        // 任何一个失败都让整体立即失败
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        for (CompletableFuture<R> future : futures) {
            future.whenComplete((reply, error) -> {
                if (error != null) {
                    firstFailure.completeExceptionally(error);
                }
            });
        }
        CompletableFuture<Object> done = CompletableFuture.anyOf(
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])), firstFailure);
        try {
            done.get();
            return futures.get(0).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RpcException) {
                throw (RpcException) cause;
            }
            throw new RpcException("rpc client: broadcast " + serviceMethod + " failed: " + cause, cause);
        }
    }

    private RpcClient dial(String addr) throws InterruptedException {
        RpcClient client = clients.get(addr);
        if (client != null && client.isAvailable()) {
            return client;
        }
        synchronized (clients) {
            client = clients.get(addr);
            if (client != null && !client.isAvailable()) {
                logger.debug("rpc client: connection to {} unavailable, redial", addr);
                client.close();
                clients.remove(addr);
                client = null;
            }
            if (client == null) {
                client = RpcClient.dial(addr, option, codecs);
                clients.put(addr, client);
            }
            return client;
        }
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    @Override
    public void close() {
        synchronized (clients) {
            for (RpcClient client : clients.values()) {
                client.close();
            }
            clients.clear();
        }
    }
}
