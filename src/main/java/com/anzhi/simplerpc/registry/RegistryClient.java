package com.anzhi.simplerpc.registry;

import com.anzhi.simplerpc.error.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 注册中心的 HTTP 客户端，服务端用它发送心跳，服务发现用它拉取存活列表。
 */
public class RegistryClient {
    private static final Logger logger = LoggerFactory.getLogger(RegistryClient.class);

    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final URI registry;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public RegistryClient(String registryUrl) {
        this(registryUrl, DEFAULT_REQUEST_TIMEOUT);
    }

    public RegistryClient(String registryUrl, Duration requestTimeout) {
        this.registry = URI.create(registryUrl);
        this.requestTimeout = requestTimeout;
        // 注册中心只实现了 HTTP/1.1
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
    }

    /**
     * 添加实例或刷新心跳。
     *
     * @throws RpcException 请求失败或注册中心返回非 2xx
     */
    public void sendHeartbeat(String addr) throws InterruptedException {
        logger.debug("{} send heart beat to registry {}", addr, registry);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(registry)
                .timeout(requestTimeout)
                .header(RegistryHttpHandler.SERVER_HEADER, addr)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<Void> response = send(request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new RpcException("rpc registry: heart beat rejected with status " + response.statusCode());
        }
    }

    /**
     * 拉取存活实例列表，注册中心已按字典序排列。
     */
    public List<String> fetchServers() throws InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(registry)
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<Void> response = send(request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new RpcException("rpc registry: refresh rejected with status " + response.statusCode());
        }
        String header = response.headers().firstValue(RegistryHttpHandler.SERVERS_HEADER).orElse("");
        List<String> servers = new ArrayList<>();
        for (String server : header.split(",")) {
            String trimmed = server.trim();
            if (!trimmed.isEmpty()) {
                servers.add(trimmed);
            }
        }
        return servers;
    }

    public String getRegistryUrl() {
        return registry.toString();
    }

    private HttpResponse<Void> send(HttpRequest request) throws InterruptedException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new RpcException("rpc registry: " + request.method() + " " + registry + " failed: " + e, e);
        }
    }
}
