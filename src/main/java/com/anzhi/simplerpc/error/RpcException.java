package com.anzhi.simplerpc.error;

/**
 * 框架内所有 RPC 错误的基类。
 * 服务端的单次调用错误不会以异常形式跨越连接边界，而是写入 Header 的 error 字段；
 * 客户端收到带 error 的响应时，以 RpcException 的形式交给调用方。
 */
public class RpcException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
