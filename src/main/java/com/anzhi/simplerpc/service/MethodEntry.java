package com.anzhi.simplerpc.service;

import com.anzhi.simplerpc.codec.Slots;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 服务中的一个方法：参数类型、返回值类型、方法体以及调用计数。
 */
public final class MethodEntry<A, R> {

    private final String name;
    private final Class<A> argType;
    private final Class<R> replyType;
    private final MethodHandler<A, R> handler;
    private final AtomicLong numCalls = new AtomicLong();

    MethodEntry(String name, Class<A> argType, Class<R> replyType, MethodHandler<A, R> handler) {
        this.name = name;
        this.argType = Slots.wrap(argType);
        this.replyType = Slots.wrap(replyType);
        this.handler = handler;
    }

    public A newArg() {
        return Slots.newInstance(argType);
    }

    /**
     * List/Map 类型的返回值预先初始化为空实例，方法体可以直接填充。
     */
    public R newReply() {
        return Slots.newInstance(replyType);
    }

    Object invoke(Object arg, Object reply) throws Exception {
        numCalls.incrementAndGet();
        return handler.handle(argType.cast(arg), replyType.cast(reply));
    }

    public String getName() { return name; }
    public Class<A> getArgType() { return argType; }
    public Class<R> getReplyType() { return replyType; }
    public long getNumCalls() { return numCalls.get(); }

    @Override
    public String toString() {
        return name + "(" + argType.getSimpleName() + ", " + replyType.getSimpleName() + ")";
    }
}
