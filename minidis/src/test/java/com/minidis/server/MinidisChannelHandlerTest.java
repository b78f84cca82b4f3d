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

import com.minidis.MinidisCommandBuilder;
import com.minidis.protocol.resp.RespFrame;
import io.lettuce.core.codec.StringCodec;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class MinidisChannelHandlerTest extends BaseHandlerTest {

    private ByteBuf wrap(String data) {
        return Unpooled.copiedBuffer(data, StandardCharsets.UTF_8);
    }

    private void assertProtocolErrorAndClosed(RespFrame reply) {
        assertInstanceOf(RespFrame.SimpleError.class, reply);
        String message = ((RespFrame.SimpleError) reply).value();
        assertTrue(message.startsWith("ERR Protocol error: "), message);
        assertFalse(channel.isOpen());
    }

    @Test
    public void test_unknownCommand() {
        RespFrame reply = runCommand(channel, wrap("*2\r\n$6\r\nFOOBAR\r\n$3\r\nbaz\r\n"));

        assertEquals(RespFrame.error("ERR unknown command 'FOOBAR'"), reply);
        assertTrue(channel.isOpen());
    }

    @Test
    public void test_commandNameIsCaseInsensitive() {
        assertEquals(RespFrame.simpleString("PONG"), runCommand(channel, wrap("*1\r\n$4\r\npInG\r\n")));
    }

    @Test
    public void test_errorMessageIsSanitized() {
        RespFrame reply = runCommand(channel, wrap("*1\r\n$5\r\nA\r\nBC\r\n"));

        assertEquals(RespFrame.error("ERR unknown command 'A  BC'"), reply);
    }

    @Test
    public void test_commandSplitAcrossWrites() {
        byte[] command = "*3\r\n$3\r\nSET\r\n$5\r\nhello\r\n$5\r\nworld\r\n".getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < command.length - 1; i++) {
            channel.writeInbound(Unpooled.wrappedBuffer(command, i, 1));
            assertNull(channel.readOutbound());
        }
        channel.writeInbound(Unpooled.wrappedBuffer(command, command.length - 1, 1));

        assertEquals(RespFrame.simpleString("OK"), readReply(channel));
        assertNull(channel.readOutbound());
    }

    @Test
    public void test_pipelinedCommands() {
        MinidisCommandBuilder<String, String> cmd = new MinidisCommandBuilder<>(StringCodec.UTF8);
        ByteBuf buf = Unpooled.buffer();
        cmd.set("mykey", "myvalue").encode(buf);
        cmd.get("mykey").encode(buf);
        cmd.ping().encode(buf);

        channel.writeInbound(buf);
        assertEquals(RespFrame.simpleString("OK"), readReply(channel));
        assertEquals(RespFrame.bulkString("myvalue"), readReply(channel));
        assertEquals(RespFrame.simpleString("PONG"), readReply(channel));
        assertNull(channel.readOutbound());
    }

    @Test
    public void test_garbagePrefixClosesConnection() {
        assertProtocolErrorAndClosed(runCommand(channel, wrap("?garbage\r\n")));
    }

    @Test
    public void test_framesBeforeGarbageAreServed() {
        channel.writeInbound(wrap("*1\r\n$4\r\nPING\r\n!oops\r\n"));

        assertEquals(RespFrame.simpleString("PONG"), readReply(channel));
        assertProtocolErrorAndClosed(readReply(channel));
    }

    @Test
    public void test_malformedLengthClosesConnection() {
        assertProtocolErrorAndClosed(runCommand(channel, wrap("*1\r\n$x\r\n")));
    }

    @Test
    public void test_nonArrayRequestClosesConnection() {
        assertProtocolErrorAndClosed(runCommand(channel, wrap("+PING\r\n")));
    }

    @Test
    public void test_nonBulkStringArgumentClosesConnection() {
        assertProtocolErrorAndClosed(runCommand(channel, wrap("*2\r\n$3\r\nGET\r\n:1\r\n")));
    }

    @Test
    public void test_emptyArrayClosesConnection() {
        assertProtocolErrorAndClosed(runCommand(channel, wrap("*0\r\n")));
    }

    @Test
    public void test_tooLongFrameClosesConnection() {
        long maxFrameSize = context.getConfig().getBytes("network.max_frame_size");
        StringBuilder data = new StringBuilder("*2\r\n$3\r\nGET\r\n$").append(maxFrameSize * 2).append("\r\n");
        for (int i = 0; i < maxFrameSize; i++) {
            data.append('a');
        }

        assertProtocolErrorAndClosed(runCommand(channel, wrap(data.toString())));
    }
}
