package com.anzhi.simplerpc.server;

import com.anzhi.simplerpc.codec.Header;
import com.anzhi.simplerpc.service.MethodEntry;
import com.anzhi.simplerpc.service.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次调用的全部信息，从解码成功开始，到响应发出（或超时）为止。
 */
final class Request {

    private final Header header;
    private final Service service;
    private final MethodEntry<?, ?> method;
    private Object arg;
    private Object reply;

    // 每个请求只允许一个响应上线，超时路径和正常路径谁先拿到写锁谁发
    private final AtomicBoolean responded = new AtomicBoolean();
    // 连接排空计数只减一次
    private final AtomicBoolean completed = new AtomicBoolean();

    Request(Header header, Service service, MethodEntry<?, ?> method) {
        this.header = header;
        this.service = service;
        this.method = method;
    }

    boolean markResponded() {
        return responded.compareAndSet(false, true);
    }

    boolean markCompleted() {
        return completed.compareAndSet(false, true);
    }

    Header getHeader() { return header; }
    Service getService() { return service; }
    MethodEntry<?, ?> getMethod() { return method; }
    Object getArg() { return arg; }
    void setArg(Object arg) { this.arg = arg; }
    Object getReply() { return reply; }
    void setReply(Object reply) { this.reply = reply; }
}
