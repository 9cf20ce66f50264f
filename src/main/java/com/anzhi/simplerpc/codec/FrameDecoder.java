package com.anzhi.simplerpc.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

import java.util.List;

/**
 * 按 4 字节长度前缀把字节流切成帧，每个帧向后传递一个 {@link ByteBuf}。
 * Option、Header、Body 各占一个帧。
 */
public class FrameDecoder extends ByteToMessageDecoder {

    private final int maxFrameLength;

    public FrameDecoder() {
        this(Frames.MAX_FRAME_LENGTH);
    }

    public FrameDecoder(int maxFrameLength) {
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        // 检查是否至少有4个字节可读 (用于读取消息长度)
        if (in.readableBytes() < Frames.LENGTH_FIELD) {
            return;
        }

        // 标记当前的读索引
        in.markReaderIndex();

        int dataLength = in.readInt();
        if (dataLength < 0) {
            throw new CorruptedFrameException("negative frame length: " + dataLength);
        }
        if (dataLength > maxFrameLength) {
            throw new TooLongFrameException("frame length " + dataLength + " exceeds " + maxFrameLength);
        }

        // 如果剩余的可读字节数小于消息长度，说明消息不完整，重置读索引并等待
        if (in.readableBytes() < dataLength) {
            in.resetReaderIndex();
            return;
        }

        out.add(in.readRetainedSlice(dataLength));
    }
}
