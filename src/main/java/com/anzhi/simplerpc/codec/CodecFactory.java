package com.anzhi.simplerpc.codec;

import io.netty.channel.Channel;

@FunctionalInterface
public interface CodecFactory {
    Codec newCodec(Channel channel);
}
