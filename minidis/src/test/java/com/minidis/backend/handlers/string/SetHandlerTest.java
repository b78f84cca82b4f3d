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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SetHandlerTest extends BaseHandlerTest {

    @Test
    public void test_SET() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        {
            ByteBuf buf = Unpooled.buffer();
            cmd.set("mykey", "myvalue").encode(buf);
            assertEquals(RespFrame.simpleString("OK"), runCommand(channel, buf));
        }

        {
            ByteBuf buf = Unpooled.buffer();
            cmd.get("mykey").encode(buf);
            assertEquals(RespFrame.bulkString("myvalue"), runCommand(channel, buf));
        }
    }

    @Test
    public void test_SET_overwrite() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        for (String value : new String[]{"first", "second"}) {
            ByteBuf buf = Unpooled.buffer();
            cmd.set("mykey", value).encode(buf);
            assertEquals(RespFrame.simpleString("OK"), runCommand(channel, buf));
        }

        ByteBuf buf = Unpooled.buffer();
        cmd.get("mykey").encode(buf);
        assertEquals(RespFrame.bulkString("second"), runCommand(channel, buf));
    }

    @Test
    public void test_SET_replacesHash() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        {
            ByteBuf buf = Unpooled.buffer();
            cmd.hset("mykey", "field", "value").encode(buf);
            assertEquals(RespFrame.integer(1), runCommand(channel, buf));
        }

        {
            ByteBuf buf = Unpooled.buffer();
            cmd.set("mykey", "string").encode(buf);
            assertEquals(RespFrame.simpleString("OK"), runCommand(channel, buf));
        }

        {
            ByteBuf buf = Unpooled.buffer();
            cmd.get("mykey").encode(buf);
            assertEquals(RespFrame.bulkString("string"), runCommand(channel, buf));
        }
    }

    @Test
    public void test_SET_wrongNumberOfArguments() {
        ByteBuf buf = Unpooled.copiedBuffer("*2\r\n$3\r\nset\r\n$5\r\nmykey\r\n".getBytes());

        assertEquals(RespFrame.error("ERR wrong number of arguments for 'SET' command"), runCommand(channel, buf));
    }
}
