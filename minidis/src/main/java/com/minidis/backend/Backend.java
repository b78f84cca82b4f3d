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

package com.minidis.backend;

import com.google.common.util.concurrent.Striped;
import com.minidis.Context;
import com.minidis.MinidisService;
import com.minidis.backend.handlers.connection.EchoHandler;
import com.minidis.backend.handlers.connection.PingHandler;
import com.minidis.backend.handlers.hash.HGetAllHandler;
import com.minidis.backend.handlers.hash.HGetHandler;
import com.minidis.backend.handlers.hash.HSetHandler;
import com.minidis.backend.handlers.string.GetHandler;
import com.minidis.backend.handlers.string.SetHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Backend is the process-wide in-memory keyspace shared by every client connection.
 * <p>
 * Strings and hashes live in the same keyspace. Every read or write of a key is done
 * while holding the key's stripe of {@link #striped()}, so multi-step updates such as
 * HSET are atomic with respect to other connections.
 */
public class Backend implements MinidisService {
    public static final String NAME = "Backend";
    private static final Logger LOGGER = LoggerFactory.getLogger(Backend.class);

    private final Context context;
    private final ConcurrentHashMap<String, ValueContainer> storage = new ConcurrentHashMap<>();
    private final Striped<ReadWriteLock> striped = Striped.lazyWeakReadWriteLock(271);

    public Backend(Context context) {
        this.context = context;
        context.getHandlers().register(
                new PingHandler(),
                new EchoHandler(),
                new GetHandler(this),
                new SetHandler(this),
                new HSetHandler(this),
                new HGetHandler(this),
                new HGetAllHandler(this)
        );
    }

    /**
     * Throws {@link WrongTypeException} unless the container holds a value of the given kind.
     *
     * @param container the stored value, never null
     * @param kind      the kind the command operates on
     */
    public static void checkValueKind(ValueContainer container, ValueKind kind) {
        if (container.kind() != kind) {
            throw new WrongTypeException();
        }
    }

    public ConcurrentHashMap<String, ValueContainer> storage() {
        return storage;
    }

    public Striped<ReadWriteLock> striped() {
        return striped;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Context getContext() {
        return context;
    }

    @Override
    public void shutdown() {
        LOGGER.debug("Dropping {} keys", storage.size());
        storage.clear();
    }
}
