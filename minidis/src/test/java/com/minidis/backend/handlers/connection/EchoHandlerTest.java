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

package com.minidis.backend.handlers.connection;

import com.minidis.MinidisCommandBuilder;
import com.minidis.protocol.resp.RespFrame;
import com.minidis.server.BaseHandlerTest;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.StringCodec;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class EchoHandlerTest extends BaseHandlerTest {

    @Test
    public void test_ECHO() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        ByteBuf buf = Unpooled.buffer();
        cmd.echo("Hello World!").encode(buf);

        assertEquals(RespFrame.bulkString("Hello World!"), runCommand(channel, buf));
    }

    @Test
    public void test_ECHO_binarySafe() {
        MinidisCommandBuilder<byte[], byte[]> cmd = new MinidisCommandBuilder<>(ByteArrayCodec.INSTANCE);
        byte[] message = new byte[]{0, '\r', '\n', (byte) 0xff};
        ByteBuf buf = Unpooled.buffer();
        cmd.echo(message).encode(buf);

        assertEquals(RespFrame.bulkString(message), runCommand(channel, buf));
    }

    @Test
    public void test_ECHO_missingArgument() {
        ByteBuf buf = Unpooled.copiedBuffer("*1\r\n$4\r\necho\r\n".getBytes());

        assertEquals(RespFrame.error("ERR wrong number of arguments for 'ECHO' command"), runCommand(channel, buf));
    }
}
