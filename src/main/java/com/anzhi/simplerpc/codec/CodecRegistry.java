package com.anzhi.simplerpc.codec;

import com.anzhi.simplerpc.error.CodecException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import io.netty.channel.Channel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 编码类型标签到 {@link CodecFactory} 的映射。
 * 启动时通过 {@link Builder} 填充，之后只读；服务端和客户端在构造时各自持有一份。
 */
public final class CodecRegistry {

    private static final CodecRegistry DEFAULTS = builder()
            .register(CodecType.BINARY, JacksonCodec.factory(JacksonCodec.configure(new CBORMapper())))
            .register(CodecType.JSON, JacksonCodec.factory(JacksonCodec.configure(new JsonMapper())))
            .build();

    private final Map<String, CodecFactory> factories;

    private CodecRegistry(Map<String, CodecFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /**
     * 内置的 CBOR 和 JSON 两种编码。
     */
    public static CodecRegistry defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<CodecFactory> lookup(String codecType) {
        if (codecType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(factories.get(codecType));
    }

    public boolean supports(String codecType) {
        return lookup(codecType).isPresent();
    }

    public Codec newCodec(String codecType, Channel channel) {
        CodecFactory factory = lookup(codecType)
                .orElseThrow(() -> new CodecException("unsupported codec type: " + codecType));
        return factory.newCodec(channel);
    }

    public Set<String> codecTypes() {
        return factories.keySet();
    }

    public static final class Builder {
        private final Map<String, CodecFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String codecType, CodecFactory factory) {
            if (codecType == null || codecType.isEmpty()) {
                throw new IllegalArgumentException("codec type must not be empty");
            }
            if (factories.putIfAbsent(codecType, factory) != null) {
                throw new IllegalArgumentException("codec type already registered: " + codecType);
            }
            return this;
        }

        public CodecRegistry build() {
            return new CodecRegistry(factories);
        }
    }
}
