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

public enum RESPError {
    WRONGTYPE,
    ERR;

    public final static String WRONGTYPE_MESSAGE = "Operation against a key holding the wrong kind of value";
    public final static String PROTOCOL_ERROR_MESSAGE = "Protocol error: %s";

    /**
     * Replaces line breaks so that the text fits into a single simple error line.
     */
    public static String sanitize(String message) {
        if (message == null) {
            return "";
        }
        return message.replace('\r', ' ').replace('\n', ' ');
    }

    public String toString() {
        return this.name();
    }
}
