package com.anzhi.simplerpc.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

/**
 * 帧格式：4 字节大端长度 + 数据。
 */
public final class Frames {
    public static final int LENGTH_FIELD = 4;
    public static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private Frames() {
    }

    public static void writeFrame(ByteBuf out, byte[] data) {
        // 先写长度，再写消息体本身
        out.writeInt(data.length);
        out.writeBytes(data);
    }

    /**
     * 把多个帧写进同一个缓冲区，保证它们在流上连续出现。
     */
    public static ByteBuf frames(ByteBufAllocator alloc, byte[]... parts) {
        int size = 0;
        for (byte[] part : parts) {
            size += LENGTH_FIELD + part.length;
        }
        ByteBuf out = alloc.buffer(size);
        for (byte[] part : parts) {
            writeFrame(out, part);
        }
        return out;
    }
}
