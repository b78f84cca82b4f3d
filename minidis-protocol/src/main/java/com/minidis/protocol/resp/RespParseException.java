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
 * Thrown when the payload of a well-framed frame cannot be converted to its value: integer, float or UTF-8 text.
 */
public class RespParseException extends RespDecoderException {
    public RespParseException(String message, Throwable cause) {
        super(String.format("Parse error: %s", message), cause);
    }

    public RespParseException(String message) {
        super(String.format("Parse error: %s", message));
    }
}
