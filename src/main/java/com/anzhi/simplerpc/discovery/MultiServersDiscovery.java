package com.anzhi.simplerpc.discovery;

import com.anzhi.simplerpc.error.RpcException;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 不依赖注册中心的服务发现，实例地址由用户显式提供。
 */
public class MultiServersDiscovery implements Discovery {

    // Random 本身是线程安全的，选择时只需要读锁
    private final Random random;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private List<String> servers;
    // 轮询到的位置，初始值随机，避免每个实例都从 0 开始
    private final AtomicInteger index;

    public MultiServersDiscovery(List<String> servers) {
        // 使用时间戳作为随机数种子，避免每次产生相同的随机数序列
        this(servers, new Random(System.nanoTime()));
    }

    MultiServersDiscovery(List<String> servers, Random random) {
        this.servers = new ArrayList<>(servers);
        this.random = random;
        this.index = new AtomicInteger(random.nextInt(Integer.MAX_VALUE - 1));
    }

    /**
     * 没有注册中心，什么也不做。
     */
    @Override
    public void refresh() throws InterruptedException {
    }

    @Override
    public void update(List<String> servers) {
        lock.writeLock().lock();
        try {
            this.servers = new ArrayList<>(servers);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String get(SelectMode mode) {
        lock.readLock().lock();
        try {
            int n = servers.size();
            if (n == 0) {
                throw new RpcException("rpc discovery: no available servers");
            }
            if (mode == null) {
                throw new RpcException("rpc discovery: not supported select mode");
            }
            switch (mode) {
                case RANDOM:
                    return servers.get(random.nextInt(n));
                case ROUND_ROBIN:
                    // 列表可能已经更新过，取模保证不越界
                    int current = index.getAndUpdate(i -> (i % n + 1) % n);
                    return servers.get(current % n);
                default:
                    throw new RpcException("rpc discovery: not supported select mode");
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> getAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(servers);
        } finally {
            lock.readLock().unlock();
        }
    }
}
