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

package com.minidis.backend.handlers.connection.protocol;

import com.minidis.server.MinidisMessage;
import com.minidis.server.Request;
import io.netty.buffer.ByteBufUtil;

public class EchoMessage implements MinidisMessage<Void> {
    public static final String COMMAND = "ECHO";
    public static final int MINIMUM_PARAMETER_COUNT = 1;
    public static final int MAXIMUM_PARAMETER_COUNT = 1;

    private final byte[] message;

    public EchoMessage(Request request) {
        this.message = ByteBufUtil.getBytes(request.getParams().get(0));
    }

    public byte[] getMessage() {
        return message;
    }

    @Override
    public Void getKey() {
        return null;
    }
}
