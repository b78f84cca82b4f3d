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

import com.minidis.MinidisCommandBuilder;
import com.minidis.protocol.resp.RespFrame;
import com.minidis.server.BaseHandlerTest;
import io.lettuce.core.codec.StringCodec;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

public class HGetAllHandlerTest extends BaseHandlerTest {

    @Test
    public void test_HGETALL() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        HashMap<String, String> map = new HashMap<>();
        {
            ByteBuf buf = Unpooled.buffer();
            for (int i = 0; i < 10; i++) {
                map.put(String.format("key-%d", i), String.format("value-%d", i));
            }
            cmd.hset("mykey", map).encode(buf);
            assertEquals(RespFrame.integer(10), runCommand(channel, buf));
        }

        ByteBuf buf = Unpooled.buffer();
        cmd.hgetall("mykey").encode(buf);
        RespFrame msg = runCommand(channel, buf);
        assertInstanceOf(RespFrame.Array.class, msg);
        RespFrame.Array actualMessage = (RespFrame.Array) msg;
        assertEquals(20, actualMessage.values().size());

        for (int i = 0; i < actualMessage.values().size(); i = i + 2) {
            RespFrame.BulkString field = (RespFrame.BulkString) actualMessage.values().get(i);
            RespFrame.BulkString value = (RespFrame.BulkString) actualMessage.values().get(i + 1);
            assertEquals(String.format("key-%d", i / 2), field.asString());
            assertEquals(map.get(field.asString()), value.asString());
        }
    }

    @Test
    public void test_HGETALL_sortedByField() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        for (String field : new String[]{"c", "a", "b"}) {
            ByteBuf buf = Unpooled.buffer();
            cmd.hset("mykey", field, field.toUpperCase()).encode(buf);
            runCommand(channel, buf);
        }

        ByteBuf buf = Unpooled.buffer();
        cmd.hgetall("mykey").encode(buf);
        RespFrame expected = RespFrame.array(
                RespFrame.bulkString("a"), RespFrame.bulkString("A"),
                RespFrame.bulkString("b"), RespFrame.bulkString("B"),
                RespFrame.bulkString("c"), RespFrame.bulkString("C")
        );
        assertEquals(expected, runCommand(channel, buf));
    }

    @Test
    public void test_HGETALL_KeyNotExists() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        ByteBuf buf = Unpooled.buffer();
        cmd.hgetall("mykey").encode(buf);

        assertEquals(RespFrame.array(), runCommand(channel, buf));
    }

    @Test
    public void test_HGETALL_WRONGTYPE() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        {
            ByteBuf buf = Unpooled.buffer();
            cmd.set("mykey", "string").encode(buf);
            runCommand(channel, buf);
        }

        ByteBuf buf = Unpooled.buffer();
        cmd.hgetall("mykey").encode(buf);
        assertEquals(
                RespFrame.error("WRONGTYPE Operation against a key holding the wrong kind of value"),
                runCommand(channel, buf)
        );
    }
}
