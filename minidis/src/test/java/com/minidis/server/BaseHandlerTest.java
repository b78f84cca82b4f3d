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

package com.minidis.server;

import com.minidis.BaseTest;
import com.minidis.Context;
import com.minidis.ContextImpl;
import com.minidis.backend.Backend;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/**
 * Runs commands through the same pipeline the RESP server installs, on an {@link EmbeddedChannel}.
 */
public class BaseHandlerTest extends BaseTest {
    protected Context context;
    protected Backend backend;
    protected EmbeddedChannel channel;

    @BeforeEach
    public void setup() {
        context = new ContextImpl(loadConfig("test.conf"));
        backend = new Backend(context);
        context.registerService(Backend.NAME, backend);
        channel = newChannel();
    }

    @AfterEach
    public void tearDown() {
        channel.finishAndReleaseAll();
        backend.shutdown();
    }

    protected EmbeddedChannel newChannel() {
        return new EmbeddedChannel(
                new RespFrameDecoder(context.getConfig().getBytes("network.max_frame_size")),
                RespFrameEncoder.INSTANCE,
                new MinidisChannelHandler(context)
        );
    }
}
