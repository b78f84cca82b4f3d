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

import com.minidis.MinidisException;

/**
 * Thrown when a well-formed frame cannot be a command, for example a bare
 * simple string or an array holding something other than bulk strings.
 * The connection is closed after the error reply.
 */
public class MalformedRequestException extends MinidisException {
    public MalformedRequestException(String message) {
        super(String.format(RESPError.PROTOCOL_ERROR_MESSAGE, message));
    }
}
