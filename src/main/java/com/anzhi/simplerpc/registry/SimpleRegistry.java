package com.anzhi.simplerpc.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 简单的注册中心：接收心跳保持服务实例存活，查询时返回存活的实例并顺带删除超时的实例。
 * <p>
 * 默认超时 5 分钟，超过这个时间没有心跳的实例视为不可用；超时为 0 时实例永不过期。
 */
public class SimpleRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SimpleRegistry.class);

    public static final String DEFAULT_PATH = "/_simple_rpc_/registry";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private final Duration timeout;
    private final Clock clock;
    // 查询时的过期删除必须和存活判断在同一个临界区里
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ServerItem> servers = new HashMap<>();

    public SimpleRegistry() {
        this(DEFAULT_TIMEOUT);
    }

    public SimpleRegistry(Duration timeout) {
        this(timeout, Clock.systemUTC());
    }

    public SimpleRegistry(Duration timeout, Clock clock) {
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * 添加服务实例；已存在时刷新心跳时间。
     */
    public void recordHeartbeat(String addr) {
        Instant now = clock.instant();
        lock.lock();
        try {
            ServerItem item = servers.get(addr);
            if (item == null) {
                servers.put(addr, new ServerItem(addr, now));
                logger.info("rpc registry: server {} joined", addr);
            } else {
                item.setLastHeartbeat(now);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 返回按字典序排列的存活实例，超时的实例在这里被删除。
     */
    public List<String> listAlive() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<String> alive = new ArrayList<>();
            Iterator<ServerItem> it = servers.values().iterator();
            while (it.hasNext()) {
                ServerItem item = it.next();
                if (timeout.isZero() || item.getLastHeartbeat().plus(timeout).isAfter(now)) {
                    alive.add(item.getAddr());
                } else {
                    it.remove();
                    logger.info("rpc registry: server {} expired, last heartbeat at {}", item.getAddr(), item.getLastHeartbeat());
                }
            }
            Collections.sort(alive);
            return alive;
        } finally {
            lock.unlock();
        }
    }

    public Duration getTimeout() { return timeout; }
}
