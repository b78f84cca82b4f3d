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
import com.minidis.backend.handlers.hash.protocol.HGetAllMessage;
import com.minidis.protocol.resp.RespFrame;
import com.minidis.server.Handler;
import com.minidis.server.MessageTypes;
import com.minidis.server.Request;
import com.minidis.server.Response;
import com.minidis.server.annotation.Command;
import com.minidis.server.annotation.MaximumParameterCount;
import com.minidis.server.annotation.MinimumParameterCount;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;

import static com.minidis.backend.Backend.checkValueKind;

/**
 * Replies with a flat array of field and value pairs, ordered by field name.
 */
@Command(HGetAllMessage.COMMAND)
@MinimumParameterCount(HGetAllMessage.MINIMUM_PARAMETER_COUNT)
@MaximumParameterCount(HGetAllMessage.MAXIMUM_PARAMETER_COUNT)
public class HGetAllHandler extends BaseHandler implements Handler {
    public HGetAllHandler(Backend backend) {
        super(backend);
    }

    @Override
    public void beforeExecute(Request request) {
        request.attr(MessageTypes.HGETALL).set(new HGetAllMessage(request));
    }

    @Override
    public void execute(Request request, Response response) {
        HGetAllMessage hgetallMessage = request.attr(MessageTypes.HGETALL).get();

        List<RespFrame> result = new ArrayList<>();
        ReadWriteLock lock = backend.striped().get(hgetallMessage.getKey());
        lock.readLock().lock();
        try {
            ValueContainer container = backend.storage().get(hgetallMessage.getKey());
            if (container != null) {
                checkValueKind(container, ValueKind.HASH);
                for (Map.Entry<String, byte[]> entry : container.hash().entrySet()) {
                    result.add(RespFrame.bulkString(entry.getKey()));
                    result.add(RespFrame.bulkString(entry.getValue()));
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        response.writeArray(result);
    }
}
