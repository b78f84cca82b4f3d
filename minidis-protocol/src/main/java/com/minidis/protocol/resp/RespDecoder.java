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

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.minidis.protocol.resp.RespLookahead.CRLF_LENGTH;
import static com.minidis.protocol.resp.RespLookahead.MIN_FRAME_LENGTH;
import static com.minidis.protocol.resp.RespLookahead.NOT_COMPLETE;
import static com.minidis.protocol.resp.RespLookahead.findLineEnd;
import static com.minidis.protocol.resp.RespLookahead.parseLength;

/**
 * Decodes RESP frames from a growable input buffer.
 * <p>
 * {@link #decode(ByteBuf)} is all-or-nothing: it either consumes exactly the bytes of one complete frame, or it
 * leaves the reader index where it was. The latter happens when the buffer does not hold a complete frame yet
 * ({@code null} is returned, the caller retries after appending more bytes) and when the frame is malformed
 * (a {@link RespDecoderException} is thrown).
 */
public final class RespDecoder {
    private static final byte[] NULL_BULK_STRING = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL = "_\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] TRUE = "#t\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FALSE = "#f\r\n".getBytes(StandardCharsets.US_ASCII);

    // ,[<+|->]<integral>[.<fractional>][<E|e>[sign]<exponent>]
    private static final Pattern DOUBLE_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private RespDecoder() {
    }

    /**
     * Decodes one frame from the readable bytes of the buffer.
     *
     * @param buf the input buffer, its reader index is advanced past the decoded frame
     * @return the decoded frame, or {@code null} if the buffer does not hold a complete frame yet
     * @throws RespDecoderException if the bytes cannot be decoded, the buffer is left untouched
     */
    public static RespFrame decode(ByteBuf buf) {
        // Work on a duplicate so that nothing is consumed until the whole frame has been decoded.
        ByteBuf cursor = buf.duplicate();
        RespFrame frame = decodeFrame(cursor);
        if (frame != null) {
            buf.readerIndex(cursor.readerIndex());
        }
        return frame;
    }

    private static RespFrame decodeFrame(ByteBuf cursor) {
        if (!cursor.isReadable()) {
            return null;
        }
        byte prefix = cursor.getByte(cursor.readerIndex());
        RespType type = RespType.fromPrefix(prefix);
        if (type == null) {
            throw RespLookahead.unknownPrefix(prefix);
        }
        return switch (type) {
            case SIMPLE_STRING -> decodeSimpleString(cursor);
            case SIMPLE_ERROR -> decodeSimpleError(cursor);
            case NUMBER -> decodeNumber(cursor);
            case BULK_STRING -> {
                LiteralMatch match = matchLiteral(cursor, NULL_BULK_STRING);
                if (match == LiteralMatch.NOT_COMPLETE) {
                    yield null;
                }
                if (match == LiteralMatch.MATCH) {
                    cursor.skipBytes(NULL_BULK_STRING.length);
                    yield RespFrame.NullBulkString.INSTANCE;
                }
                yield decodeBulkString(cursor);
            }
            case ARRAY -> {
                LiteralMatch match = matchLiteral(cursor, NULL_ARRAY);
                if (match == LiteralMatch.NOT_COMPLETE) {
                    yield null;
                }
                if (match == LiteralMatch.MATCH) {
                    cursor.skipBytes(NULL_ARRAY.length);
                    yield RespFrame.NullArray.INSTANCE;
                }
                yield decodeAggregate(cursor, RespType.ARRAY);
            }
            case NULL -> decodeNull(cursor);
            case BOOLEAN -> decodeBoolean(cursor);
            case DOUBLE -> decodeDouble(cursor);
            case MAP -> decodeAggregate(cursor, RespType.MAP);
            case SET -> decodeAggregate(cursor, RespType.SET);
            case NULL_BULK_STRING, NULL_ARRAY -> throw new IllegalStateException("prefix table resolved to " + type);
        };
    }

    private static RespFrame decodeSimpleString(ByteBuf cursor) {
        String value = readLine(cursor, true);
        return value == null ? null : new RespFrame.SimpleString(value);
    }

    private static RespFrame decodeSimpleError(ByteBuf cursor) {
        String value = readLine(cursor, true);
        return value == null ? null : new RespFrame.SimpleError(value);
    }

    private static RespFrame decodeNumber(ByteBuf cursor) {
        String value = readLine(cursor, false);
        if (value == null) {
            return null;
        }
        try {
            return new RespFrame.Number(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new RespParseException(String.format("'%s' is not a 64-bit signed integer", value), e);
        }
    }

    private static RespFrame decodeDouble(ByteBuf cursor) {
        String value = readLine(cursor, false);
        if (value == null) {
            return null;
        }
        return new RespFrame.Double(parseDouble(value));
    }

    private static double parseDouble(String value) {
        switch (value) {
            case "inf", "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                break;
        }
        if (!DOUBLE_PATTERN.matcher(value).matches()) {
            throw new RespParseException(String.format("'%s' is not a valid double", value));
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new RespParseException(String.format("'%s' is not a valid double", value), e);
        }
    }

    private static RespFrame decodeNull(ByteBuf cursor) {
        LiteralMatch match = matchLiteral(cursor, NULL);
        if (match == LiteralMatch.NOT_COMPLETE) {
            return null;
        }
        if (match == LiteralMatch.MISMATCH) {
            throw new InvalidFrameTypeException("expected null");
        }
        cursor.skipBytes(NULL.length);
        return RespFrame.Null.INSTANCE;
    }

    private static RespFrame decodeBoolean(ByteBuf cursor) {
        for (byte[] literal : new byte[][]{TRUE, FALSE}) {
            LiteralMatch match = matchLiteral(cursor, literal);
            if (match == LiteralMatch.NOT_COMPLETE) {
                return null;
            }
            if (match == LiteralMatch.MATCH) {
                cursor.skipBytes(literal.length);
                return RespFrame.bool(literal == TRUE);
            }
        }
        throw new InvalidFrameTypeException("expected boolean");
    }

    private static RespFrame decodeBulkString(ByteBuf cursor) {
        int start = cursor.readerIndex();
        int total = RespLookahead.expectLength(cursor);
        if (total == NOT_COMPLETE) {
            return null;
        }
        int headerLength = findLineEnd(cursor, start, cursor.writerIndex()) + CRLF_LENGTH - start;
        byte[] value = new byte[total - headerLength - CRLF_LENGTH];
        cursor.skipBytes(headerLength);
        cursor.readBytes(value);
        cursor.skipBytes(CRLF_LENGTH);
        return new RespFrame.BulkString(value);
    }

    private static RespFrame decodeAggregate(ByteBuf cursor, RespType type) {
        int start = cursor.readerIndex();
        // Measure everything nested in the aggregate before consuming its header.
        int total = RespLookahead.expectLength(cursor);
        if (total == NOT_COMPLETE) {
            return null;
        }
        int end = findLineEnd(cursor, start, start + total);
        int count = (int) parseLength(cursor, start, end);
        cursor.readerIndex(end + CRLF_LENGTH);

        if (type == RespType.MAP) {
            Map<String, RespFrame> values = new LinkedHashMap<>();
            for (int i = 0; i < count; i++) {
                String key = decodeMapKey(cursor);
                values.put(key, decodeNested(cursor));
            }
            return new RespFrame.RespMap(values);
        }

        List<RespFrame> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(decodeNested(cursor));
        }
        if (type == RespType.SET) {
            return new RespFrame.RespSet(values);
        }
        return new RespFrame.Array(values);
    }

    private static String decodeMapKey(ByteBuf cursor) {
        byte prefix = cursor.getByte(cursor.readerIndex());
        if (prefix != RespType.SIMPLE_STRING.getPrefix()) {
            throw new InvalidFrameException(String.format("map key must be a simple string, got prefix '%c'", (char) prefix));
        }
        return readLine(cursor, true);
    }

    private static RespFrame decodeNested(ByteBuf cursor) {
        RespFrame frame = decodeFrame(cursor);
        if (frame == null) {
            // Cannot happen for a measured aggregate unless the measurement and the decoders disagree.
            throw new InvalidFrameException("incomplete nested frame");
        }
        return frame;
    }

    /**
     * Reads the text between the prefix byte and the CRLF, then consumes the whole line.
     *
     * @return the text, or {@code null} if the line is not complete yet
     */
    private static String readLine(ByteBuf cursor, boolean utf8) {
        int start = cursor.readerIndex();
        int end = findLineEnd(cursor, start, cursor.writerIndex());
        if (end < 0) {
            return null;
        }
        String value;
        if (utf8) {
            value = decodeUtf8(cursor, start + 1, end - start - 1);
        } else {
            value = cursor.toString(start + 1, end - start - 1, StandardCharsets.US_ASCII);
        }
        cursor.readerIndex(end + CRLF_LENGTH);
        return value;
    }

    private static String decodeUtf8(ByteBuf cursor, int index, int length) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(cursor.nioBuffer(index, length)).toString();
        } catch (CharacterCodingException e) {
            throw new RespParseException("invalid UTF-8 text", e);
        }
    }

    private static LiteralMatch matchLiteral(ByteBuf cursor, byte[] literal) {
        int readable = cursor.readableBytes();
        if (readable < MIN_FRAME_LENGTH) {
            return LiteralMatch.NOT_COMPLETE;
        }
        int start = cursor.readerIndex();
        int length = Math.min(readable, literal.length);
        for (int i = 0; i < length; i++) {
            if (cursor.getByte(start + i) != literal[i]) {
                return LiteralMatch.MISMATCH;
            }
        }
        return readable < literal.length ? LiteralMatch.NOT_COMPLETE : LiteralMatch.MATCH;
    }

    private enum LiteralMatch {
        MATCH,
        MISMATCH,
        NOT_COMPLETE
    }
}
