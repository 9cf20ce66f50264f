package com.anzhi.simplerpc;

import com.anzhi.simplerpc.codec.CodecType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;

/**
 * 握手消息，每条连接最开始发送一次，之后才是若干对 Header/Body。
 * <pre>
 * | Option{MagicNumber, CodecType} | Header1 | Body1 | Header2 | Body2 | ...
 * | <----   固定 JSON 编码   ----> | <----   编码方式由 CodecType 决定   ---->
 * </pre>
 * Option 固定使用 JSON 编码，双方先就后续的编码方式达成一致，再用它收发消息。
 */
public final class Option implements Serializable {
    private static final long serialVersionUID = 1L;

    // 标记这是一个 SimpleRPC 请求
    public static final int MAGIC_NUMBER = 0x3bef5c;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private static final Option DEFAULT = new Option(MAGIC_NUMBER, CodecType.BINARY, DEFAULT_CONNECT_TIMEOUT, Duration.ZERO);

    private final int magicNumber;
    private final String codecType;
    // 0 表示不限制
    private final Duration connectTimeout;
    // 0 表示不限制
    private final Duration handleTimeout;

    @JsonCreator
    public Option(
            @JsonProperty("magicNumber") int magicNumber,
            @JsonProperty("codecType") String codecType,
            @JsonProperty("connectTimeout") Duration connectTimeout,
            @JsonProperty("handleTimeout") Duration handleTimeout) {
        this.magicNumber = magicNumber;
        this.codecType = codecType;
        this.connectTimeout = connectTimeout == null ? Duration.ZERO : connectTimeout;
        this.handleTimeout = handleTimeout == null ? Duration.ZERO : handleTimeout;
    }

    /**
     * 默认使用二进制编码，连接超时 10s，处理超时不限制。
     */
    public static Option defaults() {
        return DEFAULT;
    }

    public Option withCodecType(String codecType) {
        return new Option(magicNumber, codecType, connectTimeout, handleTimeout);
    }

    public Option withConnectTimeout(Duration connectTimeout) {
        return new Option(magicNumber, codecType, connectTimeout, handleTimeout);
    }

    public Option withHandleTimeout(Duration handleTimeout) {
        return new Option(magicNumber, codecType, connectTimeout, handleTimeout);
    }

    // Getters...
    public int getMagicNumber() { return magicNumber; }
    public String getCodecType() { return codecType; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getHandleTimeout() { return handleTimeout; }

    @Override
    public String toString() {
        return "Option{" +
                "magicNumber=0x" + Integer.toHexString(magicNumber) +
                ", codecType='" + codecType + '\'' +
                ", connectTimeout=" + connectTimeout +
                ", handleTimeout=" + handleTimeout +
                '}';
    }
}
