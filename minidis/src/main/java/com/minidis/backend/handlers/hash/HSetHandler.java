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
import com.minidis.backend.HashValue;
import com.minidis.backend.ValueContainer;
import com.minidis.backend.ValueKind;
import com.minidis.backend.handlers.BaseHandler;
import com.minidis.backend.handlers.hash.protocol.FieldValuePair;
import com.minidis.backend.handlers.hash.protocol.HSetMessage;
import com.minidis.server.Handler;
import com.minidis.server.MessageTypes;
import com.minidis.server.Request;
import com.minidis.server.Response;
import com.minidis.server.annotation.Command;
import com.minidis.server.annotation.MinimumParameterCount;

import java.util.concurrent.locks.ReadWriteLock;

import static com.minidis.backend.Backend.checkValueKind;

@Command(HSetMessage.COMMAND)
@MinimumParameterCount(HSetMessage.MINIMUM_PARAMETER_COUNT)
public class HSetHandler extends BaseHandler implements Handler {
    public HSetHandler(Backend backend) {
        super(backend);
    }

    @Override
    public void beforeExecute(Request request) {
        request.attr(MessageTypes.HSET).set(new HSetMessage(request));
    }

    @Override
    public void execute(Request request, Response response) {
        HSetMessage message = request.attr(MessageTypes.HSET).get();

        ReadWriteLock lock = backend.striped().get(message.getKey());
        lock.writeLock().lock();
        int total = 0;
        try {
            HashValue hashValue;
            ValueContainer previous = backend.storage().get(message.getKey());
            if (previous == null) {
                hashValue = new HashValue();
                backend.storage().put(message.getKey(), new ValueContainer(hashValue));
            } else {
                checkValueKind(previous, ValueKind.HASH);
                hashValue = previous.hash();
            }

            for (FieldValuePair fieldValuePair : message.getFieldValuePairs()) {
                if (hashValue.put(fieldValuePair.getField(), fieldValuePair.getValue()) == null) {
                    total++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        response.writeInteger(total);
    }
}
