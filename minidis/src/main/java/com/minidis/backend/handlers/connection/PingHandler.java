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

package com.minidis.backend.handlers.connection;

import com.minidis.backend.handlers.connection.protocol.PingMessage;
import com.minidis.server.Handler;
import com.minidis.server.MessageTypes;
import com.minidis.server.Request;
import com.minidis.server.Response;
import com.minidis.server.annotation.Command;
import com.minidis.server.annotation.MaximumParameterCount;

@Command(PingMessage.COMMAND)
@MaximumParameterCount(PingMessage.MAXIMUM_PARAMETER_COUNT)
public class PingHandler implements Handler {

    @Override
    public void beforeExecute(Request request) {
        request.attr(MessageTypes.PING).set(new PingMessage(request));
    }

    @Override
    public void execute(Request request, Response response) {
        PingMessage pingMessage = request.attr(MessageTypes.PING).get();
        if (pingMessage.getMessage() != null) {
            response.writeBulkString(pingMessage.getMessage());
            return;
        }
        response.writeSimpleString(Response.PONG);
    }
}
