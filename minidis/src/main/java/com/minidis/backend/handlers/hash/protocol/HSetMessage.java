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

package com.minidis.backend.handlers.hash.protocol;

import com.minidis.server.MinidisMessage;
import com.minidis.server.Request;
import com.minidis.server.WrongNumberOfArgumentsException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class HSetMessage implements MinidisMessage<String> {
    public static final String COMMAND = "HSET";
    public static final int MINIMUM_PARAMETER_COUNT = 3;
    private final Request request;
    private final List<FieldValuePair> fieldValuePairs = new ArrayList<>();
    private String key;

    public HSetMessage(Request request) {
        this.request = request;
        parse();
    }

    private void parse() {
        List<ByteBuf> params = request.getParams();
        // key followed by field/value pairs
        if (params.size() % 2 == 0) {
            throw new WrongNumberOfArgumentsException(
                    String.format("wrong number of arguments for '%s' command", request.getCommand())
            );
        }

        key = new String(ByteBufUtil.getBytes(params.get(0)), StandardCharsets.UTF_8);
        for (int i = 1; i < params.size(); i += 2) {
            String field = new String(ByteBufUtil.getBytes(params.get(i)), StandardCharsets.UTF_8);
            byte[] value = ByteBufUtil.getBytes(params.get(i + 1));
            fieldValuePairs.add(new FieldValuePair(field, value));
        }
    }

    @Override
    public String getKey() {
        return key;
    }

    public List<FieldValuePair> getFieldValuePairs() {
        return fieldValuePairs;
    }
}
