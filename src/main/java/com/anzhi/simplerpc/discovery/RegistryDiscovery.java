package com.anzhi.simplerpc.discovery;

import com.anzhi.simplerpc.registry.RegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 基于注册中心的服务发现。
 * <p>
 * {@link #refresh()} 从注册中心拉取存活实例；距离上次更新不足 updateInterval 时直接跳过。
 * 组件本身不做定时刷新，由调用方在需要时调用。
 */
public class RegistryDiscovery extends MultiServersDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(RegistryDiscovery.class);

    public static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofSeconds(10);

    private final RegistryClient registry;
    private final Duration updateInterval;
    private final Clock clock;
    private volatile Instant lastUpdate = Instant.MIN;

    public RegistryDiscovery(String registryUrl) {
        this(new RegistryClient(registryUrl), DEFAULT_UPDATE_INTERVAL);
    }

    public RegistryDiscovery(RegistryClient registry, Duration updateInterval) {
        this(registry, updateInterval, Clock.systemUTC());
    }

    public RegistryDiscovery(RegistryClient registry, Duration updateInterval, Clock clock) {
        super(Collections.emptyList());
        this.registry = registry;
        this.updateInterval = updateInterval == null || updateInterval.isZero() ? DEFAULT_UPDATE_INTERVAL : updateInterval;
        this.clock = clock;
    }

    @Override
    public void update(List<String> servers) {
        super.update(servers);
        lastUpdate = clock.instant();
    }

    /**
     * @throws com.anzhi.simplerpc.error.RpcException 拉取失败
     */
    @Override
    public synchronized void refresh() throws InterruptedException {
        Instant now = clock.instant();
        if (lastUpdate.plus(updateInterval).isAfter(now)) {
            return;
        }
        logger.debug("rpc registry: refresh servers from registry {}", registry.getRegistryUrl());
        List<String> servers = registry.fetchServers();
        update(servers);
    }

    public Instant getLastUpdate() {
        return lastUpdate;
    }
}
