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

import com.minidis.server.annotation.Command;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Maps upper case command names to their handlers.
 */
public class Handlers {
    private final ConcurrentHashMap<String, Handler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a command handler with a specified command.
     *
     * @param command the command to register
     * @param handler the handler for the command
     * @throws CommandAlreadyRegisteredException if the command is already registered
     */
    public void register(String command, Handler handler) throws CommandAlreadyRegisteredException {
        checkNotNull(handler, "handler cannot be null");
        if (handlers.putIfAbsent(command.toUpperCase(), handler) != null) {
            throw new CommandAlreadyRegisteredException(String.format("command already registered '%s'", command));
        }
    }

    /**
     * Registers the given handlers under the command names of their {@link Command} annotations.
     *
     * @param handlers handlers to register
     * @throws CommandAlreadyRegisteredException if one of the commands is already registered
     */
    public void register(Handler... handlers) throws CommandAlreadyRegisteredException {
        for (Handler handler : handlers) {
            Command command = handler.getClass().getAnnotation(Command.class);
            if (command == null) {
                throw new IllegalArgumentException(
                        String.format("%s has no @Command annotation", handler.getClass().getSimpleName())
                );
            }
            register(command.value(), handler);
        }
    }

    /**
     * Retrieves the registered handler for the given command.
     *
     * @param command the command for which to retrieve the handler
     * @return the registered handler
     * @throws CommandNotFoundException if the command is not registered
     */
    public Handler get(String command) throws CommandNotFoundException {
        Handler handler = handlers.get(command.toUpperCase());
        if (handler == null) {
            throw new CommandNotFoundException(String.format("unknown command '%s'", command));
        }
        return handler;
    }

    public Set<String> getCommands() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
