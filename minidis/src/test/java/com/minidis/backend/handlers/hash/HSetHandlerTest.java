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

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class HSetHandlerTest extends BaseHandlerTest {

    @Test
    public void test_HSET() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        ByteBuf buf = Unpooled.buffer();
        cmd.hset("mykey", "field", "value").encode(buf);

        assertEquals(RespFrame.integer(1), runCommand(channel, buf));
    }

    @Test
    public void test_HSET_countsOnlyNewFields() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        {
            ByteBuf buf = Unpooled.buffer();
            cmd.hset("mykey", "field-1", "value").encode(buf);
            assertEquals(RespFrame.integer(1), runCommand(channel, buf));
        }

        Map<String, String> map = new LinkedHashMap<>();
        map.put("field-1", "updated");
        map.put("field-2", "value");
        map.put("field-3", "value");

        ByteBuf buf = Unpooled.buffer();
        cmd.hset("mykey", map).encode(buf);
        assertEquals(RespFrame.integer(2), runCommand(channel, buf));

        ByteBuf hget = Unpooled.buffer();
        cmd.hget("mykey", "field-1").encode(hget);
        assertEquals(RespFrame.bulkString("updated"), runCommand(channel, hget));
    }

    @Test
    public void test_HSET_sameFieldTwiceInOneCommand() {
        ByteBuf buf = Unpooled.copiedBuffer(
                "*6\r\n$4\r\nHSET\r\n$5\r\nmykey\r\n$1\r\nf\r\n$1\r\na\r\n$1\r\nf\r\n$1\r\nb\r\n".getBytes()
        );
        assertEquals(RespFrame.integer(1), runCommand(channel, buf));

        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        ByteBuf hget = Unpooled.buffer();
        cmd.hget("mykey", "f").encode(hget);
        assertEquals(RespFrame.bulkString("b"), runCommand(channel, hget));
    }

    @Test
    public void test_HSET_missingValue() {
        ByteBuf buf = Unpooled.copiedBuffer(
                "*5\r\n$4\r\nHSET\r\n$5\r\nmykey\r\n$1\r\nf\r\n$1\r\na\r\n$1\r\ng\r\n".getBytes()
        );
        assertEquals(RespFrame.error("ERR wrong number of arguments for 'HSET' command"), runCommand(channel, buf));
    }

    @Test
    public void test_HSET_tooFewArguments() {
        ByteBuf buf = Unpooled.copiedBuffer("*3\r\n$4\r\nHSET\r\n$5\r\nmykey\r\n$1\r\nf\r\n".getBytes());

        assertEquals(RespFrame.error("ERR wrong number of arguments for 'HSET' command"), runCommand(channel, buf));
    }

    @Test
    public void test_HSET_WRONGTYPE() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        {
            ByteBuf buf = Unpooled.buffer();
            cmd.set("mykey", "string").encode(buf);
            runCommand(channel, buf);
        }

        ByteBuf buf = Unpooled.buffer();
        cmd.hset("mykey", "field", "value").encode(buf);
        assertEquals(
                RespFrame.error("WRONGTYPE Operation against a key holding the wrong kind of value"),
                runCommand(channel, buf)
        );
    }
}
