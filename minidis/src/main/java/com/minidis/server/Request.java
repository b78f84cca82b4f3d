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
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.util.AttributeMap;

import java.util.List;

/**
 * The Request interface represents a command received from a client.
 * It extends the AttributeMap interface so that handlers can attach the parsed message.
 */
public interface Request extends AttributeMap {
    /**
     * Retrieves the command name, upper cased.
     *
     * @return the command associated with the Request
     */
    String getCommand();

    /**
     * Retrieves the arguments that follow the command name.
     *
     * @return the list of parameters as read-only ByteBuf views
     */
    List<ByteBuf> getParams();

    /**
     * Retrieves the decoded frame this request was built from.
     *
     * @return the request frame
     */
    RespFrame getFrame();

    /**
     * Retrieves the ChannelHandlerContext associated with the Request.
     *
     * @return the ChannelHandlerContext associated with the Request
     */
    ChannelHandlerContext getContext();
}
