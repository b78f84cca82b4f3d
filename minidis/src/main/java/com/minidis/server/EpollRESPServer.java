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

import com.minidis.Context;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;

/**
 * The EpollRESPServer class represents a RESP server that uses the native Epoll transport. Linux only.
 */
public class EpollRESPServer extends RESPServer {
    public EpollRESPServer(Context context) {
        super(context, EpollServerSocketChannel.class, new EpollEventLoopGroup(), new EpollEventLoopGroup());
    }
}
