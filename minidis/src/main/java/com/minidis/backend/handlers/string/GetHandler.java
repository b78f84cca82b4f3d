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

package com.minidis.backend.handlers.string;

import com.minidis.backend.Backend;
import com.minidis.backend.ValueContainer;
import com.minidis.backend.ValueKind;
import com.minidis.backend.handlers.BaseHandler;
import com.minidis.backend.handlers.string.protocol.GetMessage;
import com.minidis.server.Handler;
import com.minidis.server.MessageTypes;
import com.minidis.server.Request;
import com.minidis.server.Response;
import com.minidis.server.annotation.Command;
import com.minidis.server.annotation.MaximumParameterCount;
import com.minidis.server.annotation.MinimumParameterCount;

import java.util.concurrent.locks.ReadWriteLock;

import static com.minidis.backend.Backend.checkValueKind;

@Command(GetMessage.COMMAND)
@MinimumParameterCount(GetMessage.MINIMUM_PARAMETER_COUNT)
@MaximumParameterCount(GetMessage.MAXIMUM_PARAMETER_COUNT)
public class GetHandler extends BaseHandler implements Handler {
    public GetHandler(Backend backend) {
        super(backend);
    }

    @Override
    public void beforeExecute(Request request) {
        request.attr(MessageTypes.GET).set(new GetMessage(request));
    }

    @Override
    public void execute(Request request, Response response) {
        GetMessage getMessage = request.attr(MessageTypes.GET).get();

        ReadWriteLock lock = backend.striped().get(getMessage.getKey());
        lock.readLock().lock();
        byte[] value;
        try {
            ValueContainer container = backend.storage().get(getMessage.getKey());
            if (container == null) {
                response.writeNullBulkString();
                return;
            }
            checkValueKind(container, ValueKind.STRING);
            value = container.string();
        } finally {
            lock.readLock().unlock();
        }
        response.writeBulkString(value);
    }
}
