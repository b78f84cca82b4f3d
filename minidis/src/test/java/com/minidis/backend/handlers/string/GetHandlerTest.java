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

import com.minidis.MinidisCommandBuilder;
import com.minidis.protocol.resp.RespFrame;
import com.minidis.server.BaseHandlerTest;
import io.lettuce.core.codec.StringCodec;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GetHandlerTest extends BaseHandlerTest {

    @Test
    public void test_GET_KeyNotExists() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        ByteBuf buf = Unpooled.buffer();
        cmd.get("mykey").encode(buf);

        assertEquals(RespFrame.NullBulkString.INSTANCE, runCommand(channel, buf));
    }

    @Test
    public void test_GET_WRONGTYPE() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        {
            ByteBuf buf = Unpooled.buffer();
            cmd.hset("mykey", "field", "value").encode(buf);
            runCommand(channel, buf);
        }

        ByteBuf buf = Unpooled.buffer();
        cmd.get("mykey").encode(buf);
        assertEquals(
                RespFrame.error("WRONGTYPE Operation against a key holding the wrong kind of value"),
                runCommand(channel, buf)
        );
    }

    @Test
    public void test_GET_visibleFromOtherConnection() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        {
            ByteBuf buf = Unpooled.buffer();
            cmd.set("mykey", "myvalue").encode(buf);
            runCommand(channel, buf);
        }

        EmbeddedChannel other = newChannel();
        try {
            ByteBuf buf = Unpooled.buffer();
            cmd.get("mykey").encode(buf);
            assertEquals(RespFrame.bulkString("myvalue"), runCommand(other, buf));
        } finally {
            other.finishAndReleaseAll();
        }
    }
}
