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

package com.minidis;

import com.minidis.server.RESPError;

/**
 * Base class of the errors that are answered to the client as a RESP error reply.
 * The prefix becomes the first word of the reply, for example {@code -WRONGTYPE ...}.
 */
public class MinidisException extends RuntimeException {
    private final RESPError prefix;

    public MinidisException(String message) {
        this(RESPError.ERR, message);
    }

    public MinidisException(RESPError prefix, String message) {
        super(message);
        this.prefix = prefix;
    }

    public MinidisException(String message, Throwable cause) {
        super(message, cause);
        this.prefix = RESPError.ERR;
    }

    public MinidisException(Throwable cause) {
        super(cause);
        this.prefix = RESPError.ERR;
    }

    public RESPError getPrefix() {
        return prefix;
    }
}
