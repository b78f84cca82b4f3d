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

package com.minidis.backend.handlers.hash;

import com.minidis.backend.Backend;
import com.minidis.backend.ValueContainer;
import com.minidis.backend.ValueKind;
import com.minidis.backend.handlers.BaseHandler;
import com.minidis.backend.handlers.hash.protocol.HGetMessage;
import com.minidis.server.Handler;
import com.minidis.server.MessageTypes;
import com.minidis.server.Request;
import com.minidis.server.Response;
import com.minidis.server.annotation.Command;
import com.minidis.server.annotation.MaximumParameterCount;
import com.minidis.server.annotation.MinimumParameterCount;

import java.util.concurrent.locks.ReadWriteLock;

import static com.minidis.backend.Backend.checkValueKind;

@Command(HGetMessage.COMMAND)
@MinimumParameterCount(HGetMessage.MINIMUM_PARAMETER_COUNT)
@MaximumParameterCount(HGetMessage.MAXIMUM_PARAMETER_COUNT)
public class HGetHandler extends BaseHandler implements Handler {
    public HGetHandler(Backend backend) {
        super(backend);
    }

    @Override
    public void beforeExecute(Request request) {
        request.attr(MessageTypes.HGET).set(new HGetMessage(request));
    }

    @Override
    public void execute(Request request, Response response) {
        HGetMessage hgetMessage = request.attr(MessageTypes.HGET).get();

        ReadWriteLock lock = backend.striped().get(hgetMessage.getKey());
        lock.readLock().lock();
        byte[] value;
        try {
            ValueContainer container = backend.storage().get(hgetMessage.getKey());
            if (container == null) {
                response.writeNullBulkString();
                return;
            }
            checkValueKind(container, ValueKind.HASH);
            value = container.hash().get(hgetMessage.getField());
        } finally {
            lock.readLock().unlock();
        }

        if (value == null) {
            response.writeNullBulkString();
            return;
        }
        response.writeBulkString(value);
    }
}
