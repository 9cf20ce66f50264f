package com.anzhi.simplerpc.codec;

import com.anzhi.simplerpc.error.CodecException;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFuture;

import java.io.Closeable;

/**
 * 消息编解码器，绑定在一条连接上。
 * <p>
 * 读方向由 {@link FrameDecoder} 切出的帧驱动：先 {@link #readHeader}，再用同一个编解码器
 * {@link #readBody} 读取紧随其后的 Body 帧。流结束由传输层的 channelInactive 通知，
 * 与格式错误（抛出 {@link CodecException}）区分开。
 */
public interface Codec extends Closeable {

    Header readHeader(ByteBuf frame) throws CodecException;

    /**
     * 把 Body 帧解码到调用方准备好的槽位里。
     *
     * @param frame 一个完整的 Body 帧
     * @param type  槽位类型
     * @param slot  预先分配的实例；可变对象（bean、集合）原地填充，
     *              值类型（包装类、String、枚举、数组）或 null 时返回新解码的值
     * @return 填充后的值
     */
    <T> T readBody(ByteBuf frame, Class<T> type, T slot) throws CodecException;

    /**
     * 把 Header 和 Body 作为一条完整消息写出，两个帧放在同一个缓冲区里，不会被拆开。
     */
    ChannelFuture write(Header header, Object body) throws CodecException;

    /**
     * 跳过一个不需要解码的 Body 帧。
     */
    default void discardBody(ByteBuf frame) {
        frame.skipBytes(frame.readableBytes());
    }

    @Override
    void close();
}
