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

package com.minidis.server.impl;

import com.minidis.protocol.resp.RespFrame;
import com.minidis.server.RESPError;
import com.minidis.server.Response;
import io.netty.channel.ChannelHandlerContext;

import java.util.List;

public class RespResponse implements Response {
    private final ChannelHandlerContext ctx;

    public RespResponse(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void writeOK() {
        writeSimpleString(OK);
    }

    @Override
    public void writeInteger(long value) {
        write(RespFrame.integer(value));
    }

    @Override
    public void writeArray(List<RespFrame> children) {
        write(new RespFrame.Array(children));
    }

    @Override
    public void writeSimpleString(String msg) {
        write(RespFrame.simpleString(msg));
    }

    @Override
    public void writeBulkString(byte[] content) {
        write(RespFrame.bulkString(content));
    }

    @Override
    public void writeNullBulkString() {
        write(RespFrame.NullBulkString.INSTANCE);
    }

    @Override
    public void writeError(String content) {
        writeError(RESPError.ERR, content);
    }

    @Override
    public void writeError(RESPError prefix, String content) {
        write(RespFrame.error(String.format("%s %s", prefix, RESPError.sanitize(content))));
    }

    @Override
    public void write(RespFrame frame) {
        ctx.writeAndFlush(frame);
    }

    @Override
    public ChannelHandlerContext getContext() {
        return ctx;
    }
}
