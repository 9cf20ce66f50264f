package com.anzhi.simplerpc.codec;

import com.anzhi.simplerpc.error.CodecException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.io.IOException;
import java.io.InputStream;

/**
 * 基于 Jackson 的编解码器。二进制（CBOR）和文本（JSON）共用同一份实现，只是 ObjectMapper 不同。
 */
public class JacksonCodec implements Codec {

    private final ObjectMapper mapper;
    private final Channel channel;

    public JacksonCodec(ObjectMapper mapper, Channel channel) {
        this.mapper = mapper;
        this.channel = channel;
    }

    /**
     * ObjectMapper 是线程安全的，同一种编码的所有连接共享一个实例。
     */
    public static CodecFactory factory(ObjectMapper mapper) {
        return channel -> new JacksonCodec(mapper, channel);
    }

    public static ObjectMapper configure(ObjectMapper mapper) {
        // 注册 JSR-310 模块以支持 Java 8 的日期和时间类型
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        return mapper;
    }

    @Override
    public Header readHeader(ByteBuf frame) throws CodecException {
        Header header;
        try (InputStream in = new ByteBufInputStream(frame)) {
            header = mapper.readValue(in, Header.class);
        } catch (IOException e) {
            throw new CodecException("malformed header: " + e.getMessage(), e);
        }
        if (header == null) {
            throw new CodecException("malformed header: empty header");
        }
        return header;
    }

    @Override
    public <T> T readBody(ByteBuf frame, Class<T> type, T slot) throws CodecException {
        try (InputStream in = new ByteBufInputStream(frame)) {
            if (slot != null && !Slots.isValueShaped(type)) {
                return mapper.readerForUpdating(slot).readValue(in);
            }
            return mapper.readValue(in, type);
        } catch (IOException e) {
            throw new CodecException("cannot decode body as " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ChannelFuture write(Header header, Object body) throws CodecException {
        byte[] headerBytes;
        byte[] bodyBytes;
        try {
            headerBytes = mapper.writeValueAsBytes(header);
            bodyBytes = mapper.writeValueAsBytes(body);
        } catch (IOException e) {
            throw new CodecException("cannot encode message " + header.getServiceMethod() + ": " + e.getMessage(), e);
        }
        return channel.writeAndFlush(Frames.frames(channel.alloc(), headerBytes, bodyBytes));
    }

    @Override
    public void close() {
        if (channel.isOpen()) {
            channel.close();
        }
    }

    public Channel channel() {
        return channel;
    }
}
