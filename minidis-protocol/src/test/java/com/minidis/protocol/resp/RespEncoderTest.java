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

package com.minidis.protocol.resp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RespEncoderTest {

    private String encode(RespFrame frame) {
        return new String(RespEncoder.encode(frame), StandardCharsets.UTF_8);
    }

    @Test
    void shouldEncodeSimpleString() {
        assertEquals("+OK\r\n", encode(RespFrame.simpleString("OK")));
    }

    @Test
    void shouldEncodeSimpleError() {
        assertEquals("-Error message\r\n", encode(RespFrame.error("Error message")));
    }

    @Test
    void shouldEncodeIntegerWithExplicitSign() {
        assertEquals(":+123\r\n", encode(RespFrame.integer(123)));
        assertEquals(":-123\r\n", encode(RespFrame.integer(-123)));
        assertEquals(":+0\r\n", encode(RespFrame.integer(0)));
    }

    @Test
    void shouldEncodeBulkString() {
        assertEquals("$5\r\nhello\r\n", encode(RespFrame.bulkString("hello")));
        assertEquals("$0\r\n\r\n", encode(RespFrame.bulkString("")));
    }

    @Test
    void shouldCountBulkStringLengthInBytes() {
        // Two characters, four bytes in UTF-8.
        assertEquals("$4\r\nçş\r\n", encode(RespFrame.bulkString("çş")));
    }

    @Test
    void shouldEncodeNulls() {
        assertEquals("$-1\r\n", encode(RespFrame.NullBulkString.INSTANCE));
        assertEquals("*-1\r\n", encode(RespFrame.NullArray.INSTANCE));
        assertEquals("_\r\n", encode(RespFrame.Null.INSTANCE));
    }

    @Test
    void shouldEncodeArray() {
        RespFrame frame = RespFrame.array(
                RespFrame.bulkString("set"),
                RespFrame.bulkString("hello"),
                RespFrame.bulkString("world")
        );
        assertEquals("*3\r\n$3\r\nset\r\n$5\r\nhello\r\n$5\r\nworld\r\n", encode(frame));
    }

    @Test
    void shouldEncodeEmptyArray() {
        assertEquals("*0\r\n", encode(new RespFrame.Array(List.of())));
    }

    @Test
    void shouldEncodeBooleans() {
        assertEquals("#t\r\n", encode(RespFrame.bool(true)));
        assertEquals("#f\r\n", encode(RespFrame.bool(false)));
    }

    @Test
    void shouldEncodeDoubleWithExplicitSign() {
        assertEquals(",+123.456\r\n", encode(RespFrame.dbl(123.456)));
        assertEquals(",-123.456\r\n", encode(RespFrame.dbl(-123.456)));
        assertEquals(",+1.23456E8\r\n", encode(RespFrame.dbl(1.23456e+8)));
        assertEquals(",-1.23456E-9\r\n", encode(RespFrame.dbl(-1.23456e-9)));
        assertEquals(",-0.0\r\n", encode(RespFrame.dbl(-0.0)));
    }

    @Test
    void shouldEncodeNonFiniteDoubles() {
        assertEquals(",inf\r\n", encode(RespFrame.dbl(Double.POSITIVE_INFINITY)));
        assertEquals(",-inf\r\n", encode(RespFrame.dbl(Double.NEGATIVE_INFINITY)));
        assertEquals(",nan\r\n", encode(RespFrame.dbl(Double.NaN)));
    }

    @Test
    void shouldEncodeMap() {
        Map<String, RespFrame> values = new LinkedHashMap<>();
        values.put("hello", RespFrame.bulkString("world"));
        values.put("foo", RespFrame.dbl(-123456.789));

        assertEquals("%2\r\n+hello\r\n$5\r\nworld\r\n+foo\r\n,-123456.789\r\n", encode(RespFrame.map(values)));
    }

    @Test
    void shouldEncodeSet() {
        RespFrame frame = RespFrame.set(RespFrame.array(RespFrame.integer(1234), RespFrame.bool(true)), RespFrame.bulkString("world"));
        assertEquals("~2\r\n*2\r\n:+1234\r\n#t\r\n$5\r\nworld\r\n", encode(frame));
    }

    @Test
    void shouldAppendToExistingBuffer() {
        ByteBuf buf = Unpooled.buffer();
        try {
            buf.writeCharSequence("+OK\r\n", StandardCharsets.US_ASCII);
            RespEncoder.encode(RespFrame.integer(7), buf);
            assertEquals("+OK\r\n:+7\r\n", buf.toString(StandardCharsets.US_ASCII));
        } finally {
            buf.release();
        }
    }

    @Test
    void shouldNormalizeDecodedInput() {
        ByteBuf buf = Unpooled.copiedBuffer("*2\r\n:5\r\n,1.50\r\n", StandardCharsets.US_ASCII);
        try {
            RespFrame frame = RespDecoder.decode(buf);
            assertEquals("*2\r\n:+5\r\n,+1.5\r\n", encode(frame));
        } finally {
            buf.release();
        }
    }
}
