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
import com.minidis.server.MalformedRequestException;
import com.minidis.server.Request;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.util.CharsetUtil;
import io.netty.util.DefaultAttributeMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

public class RespRequest extends DefaultAttributeMap implements Request {
    private final ChannelHandlerContext ctx;
    private final RespFrame frame;
    private final String command;
    private final List<ByteBuf> params;

    public RespRequest(ChannelHandlerContext ctx, RespFrame frame) throws MalformedRequestException {
        this.ctx = ctx;
        this.frame = checkNotNull(frame, "frame cannot be null");

        if (!(frame instanceof RespFrame.Array array)) {
            throw new MalformedRequestException(String.format("expected an array of bulk strings, got %s", frame.type()));
        }
        if (array.values().isEmpty()) {
            throw new MalformedRequestException("empty command");
        }

        List<ByteBuf> arguments = new ArrayList<>(array.values().size());
        for (RespFrame value : array.values()) {
            if (!(value instanceof RespFrame.BulkString bulkString)) {
                throw new MalformedRequestException(String.format("expected a bulk string argument, got %s", value.type()));
            }
            arguments.add(Unpooled.wrappedBuffer(bulkString.value()).asReadOnly());
        }

        this.command = arguments.get(0).toString(CharsetUtil.UTF_8).toUpperCase();
        this.params = Collections.unmodifiableList(arguments.subList(1, arguments.size()));
    }

    @Override
    public String getCommand() {
        return command;
    }

    @Override
    public List<ByteBuf> getParams() {
        return params;
    }

    @Override
    public RespFrame getFrame() {
        return frame;
    }

    @Override
    public ChannelHandlerContext getContext() {
        return ctx;
    }
}
