/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.minidis.server;

import com.minidis.protocol.resp.RespDecoder;
import com.minidis.protocol.resp.RespDecoderException;
import com.minidis.protocol.resp.RespFrame;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.TooLongFrameException;

import java.util.List;

/**
 * Turns the inbound byte stream into {@link RespFrame}s. Incomplete frames stay in the
 * cumulation until more bytes arrive. Malformed input fails the channel, so the pending
 * bytes are discarded before the error is propagated.
 */
public class RespFrameDecoder extends ByteToMessageDecoder {
    private final long maxFrameSize;

    public RespFrameDecoder(long maxFrameSize) {
        if (maxFrameSize <= 0) {
            throw new IllegalArgumentException("maxFrameSize must be positive: " + maxFrameSize);
        }
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        RespFrame frame;
        try {
            frame = RespDecoder.decode(in);
        } catch (RespDecoderException e) {
            in.skipBytes(in.readableBytes());
            throw e;
        }

        if (frame != null) {
            out.add(frame);
            return;
        }

        if (in.readableBytes() > maxFrameSize) {
            int pending = in.readableBytes();
            in.skipBytes(pending);
            throw new TooLongFrameException(
                    String.format("frame is larger than %d bytes (%d bytes pending)", maxFrameSize, pending)
            );
        }
    }
}
