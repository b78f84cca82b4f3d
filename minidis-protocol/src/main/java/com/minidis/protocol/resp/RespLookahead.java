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

import java.nio.charset.StandardCharsets;

/**
 * Measures RESP frames without consuming them.
 * <p>
 * All methods work on absolute indexes of the given buffer and never change its reader or writer index. The
 * measured window does not need to hold the complete frame: a frame that runs past the end of the window is
 * reported as {@link #NOT_COMPLETE}, malformed framing is reported with a {@link RespDecoderException}.
 */
public final class RespLookahead {
    /**
     * Returned when the window ends before the frame does.
     */
    public static final int NOT_COMPLETE = -1;

    /**
     * Largest accepted bulk string payload, the same default as Redis' proto-max-bulk-len.
     */
    public static final long MAX_BULK_LENGTH = 512L * 1024 * 1024;

    /**
     * Maximum depth of nested aggregates.
     */
    public static final int MAX_NESTING_DEPTH = 128;

    static final byte CR = '\r';
    static final byte LF = '\n';
    static final int CRLF_LENGTH = 2;
    static final int MIN_FRAME_LENGTH = 3;

    private RespLookahead() {
    }

    /**
     * Measures the frame starting at the reader index of the buffer.
     *
     * @param buf the buffer to inspect
     * @return the number of bytes the frame occupies, or {@link #NOT_COMPLETE}
     * @throws InvalidFrameTypeException   if a frame starts with an unknown prefix
     * @throws InvalidFrameLengthException if a declared length is malformed or inconsistent
     * @throws InvalidFrameException       if aggregates are nested too deeply
     */
    public static int expectLength(ByteBuf buf) {
        return expectLength(buf, buf.readerIndex(), buf.writerIndex());
    }

    /**
     * Measures the frame starting at {@code from}, looking no further than {@code to} (exclusive).
     *
     * @param buf  the buffer to inspect
     * @param from absolute index of the first byte of the frame
     * @param to   absolute index one past the last readable byte
     * @return the number of bytes the frame occupies, or {@link #NOT_COMPLETE}
     */
    public static int expectLength(ByteBuf buf, int from, int to) {
        return measure(buf, from, to, 0);
    }

    private static int measure(ByteBuf buf, int from, int to, int depth) {
        if (from >= to) {
            return NOT_COMPLETE;
        }
        RespType type = RespType.fromPrefix(buf.getByte(from));
        if (type == null) {
            throw unknownPrefix(buf.getByte(from));
        }
        return switch (type) {
            case BULK_STRING -> measureBulkString(buf, from, to);
            case ARRAY, SET -> measureAggregate(buf, type, from, to, 1, depth);
            case MAP -> measureAggregate(buf, type, from, to, 2, depth);
            default -> measureLine(buf, from, to);
        };
    }

    private static int measureLine(ByteBuf buf, int from, int to) {
        int end = findLineEnd(buf, from, to);
        if (end < 0) {
            return NOT_COMPLETE;
        }
        return end + CRLF_LENGTH - from;
    }

    private static int measureBulkString(ByteBuf buf, int from, int to) {
        int end = findLineEnd(buf, from, to);
        if (end < 0) {
            return NOT_COMPLETE;
        }
        int headerLength = end + CRLF_LENGTH - from;
        if (isNullLiteralHeader(buf, from, end)) {
            return headerLength;
        }

        long length = parseLength(buf, from, end);
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new InvalidFrameLengthException(length);
        }
        long total = headerLength + length + CRLF_LENGTH;
        if (total > to - from) {
            return NOT_COMPLETE;
        }
        int trailer = from + (int) total - CRLF_LENGTH;
        if (buf.getByte(trailer) != CR || buf.getByte(trailer + 1) != LF) {
            // The payload is longer than declared.
            throw new InvalidFrameLengthException(length);
        }
        return (int) total;
    }

    private static int measureAggregate(ByteBuf buf, RespType type, int from, int to, int framesPerEntry, int depth) {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new InvalidFrameException(String.format("aggregates nested deeper than %d levels", MAX_NESTING_DEPTH));
        }
        int end = findLineEnd(buf, from, to);
        if (end < 0) {
            return NOT_COMPLETE;
        }
        int total = end + CRLF_LENGTH - from;
        if (type == RespType.ARRAY && isNullLiteralHeader(buf, from, end)) {
            return total;
        }

        long count = parseLength(buf, from, end);
        if (count < 0 || count > Integer.MAX_VALUE) {
            throw new InvalidFrameLengthException(count);
        }
        long frames = count * framesPerEntry;
        for (long i = 0; i < frames; i++) {
            int length = measure(buf, from + total, to, depth + 1);
            if (length == NOT_COMPLETE) {
                return NOT_COMPLETE;
            }
            total += length;
        }
        return total;
    }

    /**
     * Locates the CRLF that terminates the header line of the frame starting at {@code from}.
     *
     * @return the absolute index of the CR byte, or -1 if the line is not complete yet
     */
    static int findLineEnd(ByteBuf buf, int from, int to) {
        if (to - from < MIN_FRAME_LENGTH) {
            return -1;
        }
        int index = from + 1;
        while (index < to) {
            int lf = buf.indexOf(index, to, LF);
            if (lf < 0) {
                return -1;
            }
            if (lf - 1 > from && buf.getByte(lf - 1) == CR) {
                return lf - 1;
            }
            index = lf + 1;
        }
        return -1;
    }

    /**
     * Parses the decimal length or count that follows the prefix byte of a header line.
     */
    static long parseLength(ByteBuf buf, int from, int end) {
        String header = buf.toString(from + 1, end - from - 1, StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(header);
        } catch (NumberFormatException e) {
            throw new InvalidFrameLengthException(header);
        }
    }

    private static boolean isNullLiteralHeader(ByteBuf buf, int from, int end) {
        return end - from == 3 && buf.getByte(from + 1) == '-' && buf.getByte(from + 2) == '1';
    }

    static InvalidFrameTypeException unknownPrefix(byte prefix) {
        return new InvalidFrameTypeException(String.format("unknown prefix byte 0x%02x", prefix & 0xff));
    }
}
