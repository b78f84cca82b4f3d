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

package com.minidis.instance;

import com.google.common.collect.Lists;
import com.minidis.Context;
import com.minidis.ContextImpl;
import com.minidis.MinidisException;
import com.minidis.MinidisService;
import com.minidis.backend.Backend;
import com.minidis.network.Address;
import com.minidis.server.EpollRESPServer;
import com.minidis.server.NioRESPServer;
import com.minidis.server.RESPServer;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.UnknownHostException;

/**
 * A single Minidis process: one shared {@link Backend} served over RESP by one {@link RESPServer}.
 */
public class MinidisInstance {
    private static final Logger LOGGER = LoggerFactory.getLogger(MinidisInstance.class);
    private static final String NETTY_TRANSPORT_NIO = "nio";
    private static final String NETTY_TRANSPORT_EPOLL = "epoll";
    private static final String DEFAULT_NETTY_TRANSPORT = NETTY_TRANSPORT_NIO;
    private static final String TRANSPORT_CONFIG_PATH = "network.netty.transport";

    protected final Config config;
    protected Context context;
    private Address address;
    private volatile MinidisInstanceStatus status;

    public MinidisInstance() {
        this(ConfigFactory.load());
    }

    public MinidisInstance(Config config) {
        this.config = config;
    }

    private RESPServer initializeRESPServer() {
        String nettyTransport = DEFAULT_NETTY_TRANSPORT;
        if (config.hasPath(TRANSPORT_CONFIG_PATH)) {
            nettyTransport = config.getString(TRANSPORT_CONFIG_PATH);
        }

        if (nettyTransport.equals(NETTY_TRANSPORT_NIO)) {
            return new NioRESPServer(context);
        } else if (nettyTransport.equals(NETTY_TRANSPORT_EPOLL)) {
            return new EpollRESPServer(context);
        }
        throw new MinidisException(String.format("invalid %s: %s", TRANSPORT_CONFIG_PATH, nettyTransport));
    }

    private Address resolveAddress() throws UnknownHostException {
        String host = config.getString("network.host");
        int port = config.getInt("network.port");
        return new Address(host, port);
    }

    public synchronized void start() throws UnknownHostException, InterruptedException {
        if (status == MinidisInstanceStatus.RUNNING) {
            throw new IllegalStateException("Minidis instance is already running");
        }
        LOGGER.info("Initializing a new Minidis instance");
        setStatus(MinidisInstanceStatus.INITIALIZING);

        try {
            context = new ContextImpl(config);

            // Registration order matters, services are shut down in reverse.
            Backend backend = new Backend(context);
            context.registerService(Backend.NAME, backend);

            address = resolveAddress();
            RESPServer server = initializeRESPServer();
            context.registerService(server.getName(), server);
            server.start(address);

            setStatus(MinidisInstanceStatus.RUNNING);
        } catch (Exception e) {
            LOGGER.error("Failed to initialize the instance", e);
            shutdown();
            throw e;
        }

        LOGGER.info("Ready to accept connections");
    }

    public synchronized void shutdown() {
        if (context == null || status == MinidisInstanceStatus.STOPPED) {
            return;
        }

        LOGGER.info("Shutting down Minidis");
        setStatus(MinidisInstanceStatus.STOPPED);

        for (MinidisService service : Lists.reverse(context.getServices())) {
            try {
                LOGGER.debug("{} service has been shutting down", service.getName());
                service.shutdown();
            } catch (Exception e) {
                LOGGER.error("{} service cannot be closed due to errors", service.getName(), e);
            }
        }
    }

    private void setStatus(MinidisInstanceStatus status) {
        this.status = status;
        LOGGER.info("Setting instance status to {}", status);
    }

    public MinidisInstanceStatus getStatus() {
        return status;
    }

    /**
     * @return the address the RESP server listens on, null before {@link #start()}
     */
    public Address getAddress() {
        return address;
    }

    public Context getContext() {
        return context;
    }
}
