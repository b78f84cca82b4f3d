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
import com.minidis.backend.handlers.BaseHandler;
import com.minidis.backend.handlers.string.protocol.SetMessage;
import com.minidis.server.Handler;
import com.minidis.server.MessageTypes;
import com.minidis.server.Request;
import com.minidis.server.Response;
import com.minidis.server.annotation.Command;
import com.minidis.server.annotation.MaximumParameterCount;
import com.minidis.server.annotation.MinimumParameterCount;

import java.util.concurrent.locks.ReadWriteLock;

/**
 * Stores a string value, replacing whatever the key held before, hashes included.
 */
@Command(SetMessage.COMMAND)
@MinimumParameterCount(SetMessage.MINIMUM_PARAMETER_COUNT)
@MaximumParameterCount(SetMessage.MAXIMUM_PARAMETER_COUNT)
public class SetHandler extends BaseHandler implements Handler {
    public SetHandler(Backend backend) {
        super(backend);
    }

    @Override
    public void beforeExecute(Request request) {
        request.attr(MessageTypes.SET).set(new SetMessage(request));
    }

    @Override
    public void execute(Request request, Response response) {
        SetMessage setMessage = request.attr(MessageTypes.SET).get();

        ReadWriteLock lock = backend.striped().get(setMessage.getKey());
        lock.writeLock().lock();
        try {
            backend.storage().put(setMessage.getKey(), new ValueContainer(setMessage.getValue()));
        } finally {
            lock.writeLock().unlock();
        }
        response.writeOK();
    }
}
