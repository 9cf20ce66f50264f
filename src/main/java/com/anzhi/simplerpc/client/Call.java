package com.anzhi.simplerpc.client;

import java.util.concurrent.CompletableFuture;

/**
 * 一次进行中的 RPC 调用。
 */
public final class Call<R> {

    private final String serviceMethod;
    private final Object args;
    private final Class<R> replyType;
    private final CompletableFuture<R> future = new CompletableFuture<>();
    private volatile long seq;

    Call(String serviceMethod, Object args, Class<R> replyType) {
        this.serviceMethod = serviceMethod;
        this.args = args;
        this.replyType = replyType;
    }

    void complete(R reply) {
        future.complete(reply);
    }

    void fail(Throwable cause) {
        future.completeExceptionally(cause);
    }

    void setSeq(long seq) { this.seq = seq; }

    public long getSeq() { return seq; }
    public String getServiceMethod() { return serviceMethod; }
    public Object getArgs() { return args; }
    public Class<R> getReplyType() { return replyType; }
    public CompletableFuture<R> getFuture() { return future; }
}
