package com.anzhi.simplerpc.codec;

/**
 * 内置的编码类型标签，握手时放在 Option.codecType 里。
 */
public final class CodecType {
    // 二进制编码（CBOR），默认值
    public static final String BINARY = "application/cbor";
    public static final String JSON = "application/json";

    private CodecType() {
    }
}
