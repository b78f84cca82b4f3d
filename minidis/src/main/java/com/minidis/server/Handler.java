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

public interface Handler {
    /**
     * Parses and validates the request before it is executed. Implementations
     * attach the parsed message to the request as an attribute.
     *
     * @param request the request object
     */
    void beforeExecute(Request request);

    /**
     * Executes the given request and writes exactly one reply to the response.
     *
     * @param request  the request object to be executed
     * @param response the Response object used to write the reply back to the client
     * @throws Exception if an error occurs during execution
     */
    void execute(Request request, Response response) throws Exception;
}
