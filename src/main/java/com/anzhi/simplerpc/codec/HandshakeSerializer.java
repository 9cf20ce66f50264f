package com.anzhi.simplerpc.codec;

import com.anzhi.simplerpc.Option;
import com.anzhi.simplerpc.error.CodecException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;

import java.io.IOException;
import java.io.InputStream;

/**
 * 握手专用的 JSON 编解码，与后续协商出的 Body 编码无关。
 */
public final class HandshakeSerializer {

    // ObjectMapper 是线程安全的，可以作为单例重复使用
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static {
        // Option 里的超时是 Duration
        objectMapper.registerModule(new JavaTimeModule());
    }

    private HandshakeSerializer() {
    }

    public static byte[] serialize(Option option) {
        try {
            return objectMapper.writeValueAsBytes(option);
        } catch (JsonProcessingException e) {
            throw new CodecException("Error serializing option to JSON", e);
        }
    }

    public static Option deserialize(ByteBuf frame) {
        Option option;
        try (InputStream in = new ByteBufInputStream(frame)) {
            option = objectMapper.readValue(in, Option.class);
        } catch (IOException e) {
            throw new CodecException("Error deserializing JSON to option: " + e.getMessage(), e);
        }
        if (option == null) {
            throw new CodecException("Error deserializing JSON to option: empty option");
        }
        return option;
    }
}
