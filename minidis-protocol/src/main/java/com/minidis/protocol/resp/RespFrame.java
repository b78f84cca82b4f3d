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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a single RESP frame.
 * <p>
 * The variant set is closed. Frames are immutable once constructed and compare structurally.
 */
public sealed interface RespFrame permits
        RespFrame.SimpleString,
        RespFrame.SimpleError,
        RespFrame.Number,
        RespFrame.BulkString,
        RespFrame.NullBulkString,
        RespFrame.Array,
        RespFrame.Null,
        RespFrame.NullArray,
        RespFrame.Boolean,
        RespFrame.Double,
        RespFrame.RespMap,
        RespFrame.RespSet {

    static SimpleString simpleString(String value) {
        return new SimpleString(value);
    }

    static SimpleError error(String value) {
        return new SimpleError(value);
    }

    static Number integer(long value) {
        return new Number(value);
    }

    static BulkString bulkString(byte[] value) {
        return new BulkString(value);
    }

    static BulkString bulkString(String value) {
        return new BulkString(value.getBytes(StandardCharsets.UTF_8));
    }

    static Array array(RespFrame... values) {
        return new Array(List.of(values));
    }

    static RespSet set(RespFrame... values) {
        return new RespSet(List.of(values));
    }

    static RespMap map(Map<String, RespFrame> values) {
        return new RespMap(values);
    }

    static Boolean bool(boolean value) {
        return value ? Boolean.TRUE : Boolean.FALSE;
    }

    static Double dbl(double value) {
        return new Double(value);
    }

    RespType type();

    // Simple types

    record SimpleString(String value) implements RespFrame {
        public SimpleString {
            if (value == null) {
                throw new NullPointerException("value cannot be null");
            }
        }

        @Override
        public RespType type() {
            return RespType.SIMPLE_STRING;
        }
    }

    record SimpleError(String value) implements RespFrame {
        public SimpleError {
            if (value == null) {
                throw new NullPointerException("value cannot be null");
            }
        }

        @Override
        public RespType type() {
            return RespType.SIMPLE_ERROR;
        }
    }

    record Number(long value) implements RespFrame {
        @Override
        public RespType type() {
            return RespType.NUMBER;
        }
    }

    /**
     * Binary safe string. The payload array is owned by the frame and must not be modified after construction.
     */
    record BulkString(byte[] value) implements RespFrame {
        public BulkString {
            if (value == null) {
                throw new NullPointerException("value cannot be null");
            }
        }

        public String asString() {
            return new String(value, StandardCharsets.UTF_8);
        }

        @Override
        public RespType type() {
            return RespType.BULK_STRING;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BulkString other)) {
                return false;
            }
            return Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BulkString[" + asString() + "]";
        }
    }

    record NullBulkString() implements RespFrame {
        public static final NullBulkString INSTANCE = new NullBulkString();

        @Override
        public RespType type() {
            return RespType.NULL_BULK_STRING;
        }
    }

    record Null() implements RespFrame {
        public static final Null INSTANCE = new Null();

        @Override
        public RespType type() {
            return RespType.NULL;
        }
    }

    record NullArray() implements RespFrame {
        public static final NullArray INSTANCE = new NullArray();

        @Override
        public RespType type() {
            return RespType.NULL_ARRAY;
        }
    }

    record Boolean(boolean value) implements RespFrame {
        public static final Boolean TRUE = new Boolean(true);
        public static final Boolean FALSE = new Boolean(false);

        @Override
        public RespType type() {
            return RespType.BOOLEAN;
        }
    }

    record Double(double value) implements RespFrame {
        @Override
        public RespType type() {
            return RespType.DOUBLE;
        }
    }

    // Aggregate types

    record Array(List<RespFrame> values) implements RespFrame {
        public Array {
            values = List.copyOf(values);
        }

        @Override
        public RespType type() {
            return RespType.ARRAY;
        }
    }

    /**
     * String keyed map. Keys are unique, iteration follows insertion order.
     */
    record RespMap(Map<String, RespFrame> values) implements RespFrame {
        public RespMap {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public RespType type() {
            return RespType.MAP;
        }
    }

    /**
     * Set frame. Backed by an ordered list, so duplicates and order are preserved as received.
     */
    record RespSet(List<RespFrame> values) implements RespFrame {
        public RespSet {
            values = List.copyOf(values);
        }

        @Override
        public RespType type() {
            return RespType.SET;
        }
    }
}
