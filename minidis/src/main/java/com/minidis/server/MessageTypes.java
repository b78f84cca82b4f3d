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

import com.minidis.backend.handlers.connection.protocol.EchoMessage;
import com.minidis.backend.handlers.connection.protocol.PingMessage;
import com.minidis.backend.handlers.hash.protocol.HGetAllMessage;
import com.minidis.backend.handlers.hash.protocol.HGetMessage;
import com.minidis.backend.handlers.hash.protocol.HSetMessage;
import com.minidis.backend.handlers.string.protocol.GetMessage;
import com.minidis.backend.handlers.string.protocol.SetMessage;
import io.netty.util.AttributeKey;

/**
 * Attribute keys under which handlers store the parsed message on a {@link Request}.
 */
public class MessageTypes {
    public static final AttributeKey<PingMessage> PING = AttributeKey.valueOf(PingMessage.COMMAND);
    public static final AttributeKey<EchoMessage> ECHO = AttributeKey.valueOf(EchoMessage.COMMAND);
    public static final AttributeKey<GetMessage> GET = AttributeKey.valueOf(GetMessage.COMMAND);
    public static final AttributeKey<SetMessage> SET = AttributeKey.valueOf(SetMessage.COMMAND);
    public static final AttributeKey<HSetMessage> HSET = AttributeKey.valueOf(HSetMessage.COMMAND);
    public static final AttributeKey<HGetMessage> HGET = AttributeKey.valueOf(HGetMessage.COMMAND);
    public static final AttributeKey<HGetAllMessage> HGETALL = AttributeKey.valueOf(HGetAllMessage.COMMAND);
}
