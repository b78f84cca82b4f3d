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

package com.minidis;

import com.minidis.server.Handlers;
import com.typesafe.config.Config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.google.common.base.Preconditions.checkNotNull;

public class ContextImpl implements Context {
    private final Config config;
    private final Handlers handlers = new Handlers();
    private final LinkedHashMap<String, MinidisService> services = new LinkedHashMap<>();
    private final ReadWriteLock servicesLock = new ReentrantReadWriteLock();

    public ContextImpl(Config config) {
        this.config = checkNotNull(config, "config cannot be null");
    }

    @Override
    public Config getConfig() {
        return config;
    }

    @Override
    public Handlers getHandlers() {
        return handlers;
    }

    @Override
    public void registerService(String id, MinidisService service) {
        checkNotNull(service, "service cannot be null");
        servicesLock.writeLock().lock();
        try {
            if (services.containsKey(id)) {
                throw new IllegalStateException(String.format("service already registered '%s'", id));
            }
            services.put(id, service);
        } finally {
            servicesLock.writeLock().unlock();
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getService(String id) {
        servicesLock.readLock().lock();
        try {
            return (T) services.get(id);
        } finally {
            servicesLock.readLock().unlock();
        }
    }

    /**
     * Returns the registered services in registration order.
     */
    @Override
    public List<MinidisService> getServices() {
        servicesLock.readLock().lock();
        try {
            return new ArrayList<>(services.values());
        } finally {
            servicesLock.readLock().unlock();
        }
    }
}
