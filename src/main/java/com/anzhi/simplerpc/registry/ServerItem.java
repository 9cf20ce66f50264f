package com.anzhi.simplerpc.registry;

import java.time.Instant;

/**
 * 注册中心里的一个服务实例：地址以及最近一次心跳的时间。
 */
public class ServerItem {
    private final String addr;
    private Instant lastHeartbeat;

    ServerItem(String addr, Instant lastHeartbeat) {
        this.addr = addr;
        this.lastHeartbeat = lastHeartbeat;
    }

    public String getAddr() { return addr; }
    public Instant getLastHeartbeat() { return lastHeartbeat; }
    void setLastHeartbeat(Instant lastHeartbeat) { this.lastHeartbeat = lastHeartbeat; }
}
