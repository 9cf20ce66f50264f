package com.anzhi.simplerpc.error;

/**
 * 编解码失败：握手 Option 无法解析、Header/Body 格式错误、或不支持的编码类型。
 */
public class CodecException extends RpcException {
    private static final long serialVersionUID = 1L;

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
