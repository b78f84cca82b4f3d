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
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Writes RESP frames in their wire form.
 * <p>
 * Encoding never fails. Integers and doubles are always written with an explicit sign, so re-encoding a decoded
 * frame yields the normalized form.
 */
public final class RespEncoder {
    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_BULK_STRING = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL = "_\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] TRUE = "#t\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FALSE = "#f\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespEncoder() {
    }

    /**
     * Encodes a frame into a new byte array.
     */
    public static byte[] encode(RespFrame frame) {
        ByteBuf buf = Unpooled.buffer();
        try {
            encode(frame, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    /**
     * Appends the wire form of a frame to the given buffer.
     *
     * @param frame the frame to encode
     * @param out   the buffer to write to
     */
    public static void encode(RespFrame frame, ByteBuf out) {
        switch (frame.type()) {
            case SIMPLE_STRING -> writeLine(out, RespType.SIMPLE_STRING, ((RespFrame.SimpleString) frame).value());
            case SIMPLE_ERROR -> writeLine(out, RespType.SIMPLE_ERROR, ((RespFrame.SimpleError) frame).value());
            case NUMBER -> writeLine(out, RespType.NUMBER, signed(Long.toString(((RespFrame.Number) frame).value())));
            case BULK_STRING -> {
                byte[] value = ((RespFrame.BulkString) frame).value();
                writeHeader(out, RespType.BULK_STRING, value.length);
                out.writeBytes(value);
                out.writeBytes(CRLF);
            }
            case NULL_BULK_STRING -> out.writeBytes(NULL_BULK_STRING);
            case ARRAY -> writeAggregate(out, RespType.ARRAY, ((RespFrame.Array) frame).values());
            case NULL -> out.writeBytes(NULL);
            case NULL_ARRAY -> out.writeBytes(NULL_ARRAY);
            case BOOLEAN -> out.writeBytes(((RespFrame.Boolean) frame).value() ? TRUE : FALSE);
            case DOUBLE -> writeLine(out, RespType.DOUBLE, formatDouble(((RespFrame.Double) frame).value()));
            case MAP -> {
                Map<String, RespFrame> values = ((RespFrame.RespMap) frame).values();
                writeHeader(out, RespType.MAP, values.size());
                for (Map.Entry<String, RespFrame> entry : values.entrySet()) {
                    writeLine(out, RespType.SIMPLE_STRING, entry.getKey());
                    encode(entry.getValue(), out);
                }
            }
            case SET -> writeAggregate(out, RespType.SET, ((RespFrame.RespSet) frame).values());
        }
    }

    private static void writeAggregate(ByteBuf out, RespType type, List<RespFrame> values) {
        writeHeader(out, type, values.size());
        for (RespFrame value : values) {
            encode(value, out);
        }
    }

    private static void writeHeader(ByteBuf out, RespType type, int length) {
        out.writeByte(type.getPrefix());
        out.writeCharSequence(Integer.toString(length), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }

    private static void writeLine(ByteBuf out, RespType type, String value) {
        out.writeByte(type.getPrefix());
        out.writeCharSequence(value, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }

    private static String formatDouble(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        // Double.toString yields the shortest digits that parse back to the same value, e.g. 1.5 or 1.0E-9
        return signed(Double.toString(value));
    }

    private static String signed(String value) {
        return value.charAt(0) == '-' ? value : "+" + value;
    }
}
