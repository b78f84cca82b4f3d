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
 * Thrown when a declared length or element count is malformed, out of range or inconsistent with the payload.
 */
public class InvalidFrameLengthException extends RespDecoderException {
    private final long length;

    public InvalidFrameLengthException(long length) {
        super(String.format("Invalid frame length: %d", length));
        this.length = length;
    }

    public InvalidFrameLengthException(String header) {
        super(String.format("Invalid frame length: '%s'", header));
        this.length = -1;
    }

    /**
     * @return the offending length, or -1 if the header could not be parsed as a number
     */
    public long getLength() {
        return length;
    }
}
