package com.anzhi.simplerpc.registry;

import com.anzhi.simplerpc.error.RpcException;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 服务端定时向注册中心发送心跳。
 * <p>
 * 启动时立即发送一次，之后按周期发送；任何一次发送失败都会停止后续心跳，只记录日志，不抛出。
 */
public class Heartbeat {
    private static final Logger logger = LoggerFactory.getLogger(Heartbeat.class);

    private final RegistryClient client;
    private final String addr;
    private final Duration period;
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(new DefaultThreadFactory("rpc-heartbeat", true));
    private volatile ScheduledFuture<?> heartbeatFuture;
    private volatile boolean running;

    private Heartbeat(RegistryClient client, String addr, Duration period) {
        this.client = client;
        this.addr = addr;
        this.period = period;
    }

    /**
     * 默认周期比注册中心的默认过期时间少 1 分钟，保证实例被删除前有足够的时间发送心跳。
     */
    public static Duration defaultPeriod() {
        return SimpleRegistry.DEFAULT_TIMEOUT.minus(Duration.ofMinutes(1));
    }

    public static Heartbeat start(String registryUrl, String addr, Duration period) {
        return start(new RegistryClient(registryUrl), addr, period);
    }

    /**
     * @param period 心跳周期，为 0 时使用 {@link #defaultPeriod()}
     */
    public static Heartbeat start(RegistryClient client, String addr, Duration period) {
        Duration effective = period == null || period.isZero() ? defaultPeriod() : period;
        Heartbeat heartbeat = new Heartbeat(client, addr, effective);
        heartbeat.begin();
        return heartbeat;
    }

    private void begin() {
        running = true;
        if (!beat()) {
            return;
        }
        heartbeatFuture = scheduler.scheduleAtFixedRate(() -> {
            if (!beat()) {
                ScheduledFuture<?> f = heartbeatFuture;
                if (f != null) {
                    f.cancel(false);
                }
            }
        }, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean beat() {
        try {
            client.sendHeartbeat(addr);
            return true;
        } catch (RpcException e) {
            logger.error("rpc server: heart beat err: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("rpc server: heart beat of {} interrupted", addr);
        }
        stopQuietly();
        return false;
    }

    private void stopQuietly() {
        running = false;
        scheduler.shutdown();
    }

    public void stop() {
        running = false;
        ScheduledFuture<?> f = heartbeatFuture;
        if (f != null) {
            f.cancel(false);
        }
        scheduler.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    public String getAddr() { return addr; }
    public Duration getPeriod() { return period; }
}
