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

import com.minidis.protocol.resp.RespFrame;
import io.netty.channel.ChannelHandlerContext;

import java.util.List;

public interface Response {
    String OK = "OK";
    String PONG = "PONG";

    void writeOK();

    void writeInteger(long value);

    void writeArray(List<RespFrame> children);

    void writeSimpleString(String msg);

    void writeBulkString(byte[] content);

    void writeNullBulkString();

    void writeError(String content);

    void writeError(RESPError prefix, String content);

    void write(RespFrame frame);

    ChannelHandlerContext getContext();
}
