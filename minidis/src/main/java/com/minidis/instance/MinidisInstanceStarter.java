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

import com.minidis.network.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MinidisInstanceStarter {
    private static final Logger LOGGER = LoggerFactory.getLogger(MinidisInstanceStarter.class);

    private static void greeting(Address address) {
        LOGGER.info("pid: {} has been started", ProcessHandle.current().pid());
        LOGGER.info("Minidis on {}/{} Java {}",
                System.getProperty("os.name"),
                System.getProperty("os.arch"),
                System.getProperty("java.version"));
        LOGGER.info("Listening client connections on {}", address);
    }

    public static void main(String[] args) {
        MinidisInstance instance = new MinidisInstance();
        Thread shutdownHook = createShutdownHook(instance);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            instance.start();
            greeting(instance.getAddress());
        } catch (Exception e) {
            LOGGER.error("Failed to start Minidis instance", e);
            System.exit(1);
        }
    }

    private static Thread createShutdownHook(MinidisInstance instance) {
        return new Thread(() -> {
            try {
                instance.shutdown();
            } finally {
                LOGGER.info("Quit!");
            }
        });
    }
}
