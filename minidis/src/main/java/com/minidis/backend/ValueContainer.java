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

package com.minidis.backend;

public class ValueContainer {
    private final ValueKind kind;
    private byte[] stringValue;
    private HashValue hashValue;

    public ValueContainer(byte[] value) {
        this.kind = ValueKind.STRING;
        this.stringValue = value;
    }

    public ValueContainer(HashValue value) {
        this.kind = ValueKind.HASH;
        this.hashValue = value;
    }

    public ValueKind kind() {
        return kind;
    }

    public byte[] string() {
        return stringValue;
    }

    public HashValue hash() {
        return hashValue;
    }
}
