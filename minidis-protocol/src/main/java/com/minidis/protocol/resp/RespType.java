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

/**
 * RESP2/RESP3 frame types handled by the codec.
 * <p>
 * {@link #NULL_BULK_STRING} and {@link #NULL_ARRAY} share their prefix with {@link #BULK_STRING} and
 * {@link #ARRAY}. The prefix table resolves an ambiguous prefix to the general type, the decoder then tries
 * the fixed null literal first.
 */
public enum RespType {
    SIMPLE_STRING('+'),
    SIMPLE_ERROR('-'),
    NUMBER(':'),
    BULK_STRING('$'),
    NULL_BULK_STRING('$'),
    ARRAY('*'),
    NULL_ARRAY('*'),
    NULL('_'),
    BOOLEAN('#'),
    DOUBLE(','),
    MAP('%'),
    SET('~');

    private static final RespType[] PREFIX_TABLE = new RespType[128];

    static {
        for (RespType type : values()) {
            if (type == NULL_BULK_STRING || type == NULL_ARRAY) {
                continue;
            }
            PREFIX_TABLE[type.prefix] = type;
        }
    }

    private final byte prefix;

    RespType(char prefix) {
        this.prefix = (byte) prefix;
    }

    /**
     * Resolves a leading byte to its frame type.
     *
     * @param prefix the first byte of a frame
     * @return the frame type, or {@code null} if the byte is not a known prefix
     */
    public static RespType fromPrefix(byte prefix) {
        if (prefix < 0) {
            return null;
        }
        return PREFIX_TABLE[prefix];
    }

    public byte getPrefix() {
        return prefix;
    }
}
