package com.anzhi.simplerpc.error;

import java.time.Duration;

public class RpcTimeoutException extends RpcException {
    private static final long serialVersionUID = 1L;

    private final Duration timeout;

    public RpcTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    public Duration getTimeout() { return timeout; }
}
