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

import com.minidis.protocol.resp.RespEncoder;
import com.minidis.protocol.resp.RespFrame;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

@ChannelHandler.Sharable
public class RespFrameEncoder extends MessageToByteEncoder<RespFrame> {
    public static final RespFrameEncoder INSTANCE = new RespFrameEncoder();

    @Override
    protected void encode(ChannelHandlerContext ctx, RespFrame msg, ByteBuf out) {
        RespEncoder.encode(msg, out);
    }
}
