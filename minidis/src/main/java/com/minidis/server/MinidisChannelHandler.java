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

import com.minidis.Context;
import com.minidis.MinidisException;
import com.minidis.protocol.resp.RespFrame;
import com.minidis.server.annotation.MaximumParameterCount;
import com.minidis.server.annotation.MinimumParameterCount;
import com.minidis.server.impl.RespRequest;
import com.minidis.server.impl.RespResponse;
import com.typesafe.config.Config;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MinidisChannelHandler is the last inbound handler of a client connection. It turns every
 * decoded frame into a {@link Request}, dispatches it to the registered {@link Handler} and
 * writes the reply.
 * <p>
 * Failures raised by a handler are answered with an error reply and the connection stays open.
 * Codec failures and requests that are not arrays of bulk strings are answered with a protocol
 * error and the connection is closed, since the stream cannot be resynchronized.
 */
public class MinidisChannelHandler extends ChannelInboundHandlerAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(MinidisChannelHandler.class);

    private final Handlers handlers;
    private final boolean logCommandForDebugging;

    public MinidisChannelHandler(Context context) {
        this.handlers = context.getHandlers();

        Config config = context.getConfig();
        this.logCommandForDebugging = config.hasPath("log_command_for_debugging") && config.getBoolean("log_command_for_debugging");
    }

    private void checkMaximumParameterCount(Handler handler, Request request) throws WrongNumberOfArgumentsException {
        MaximumParameterCount annotation = handler.getClass().getAnnotation(MaximumParameterCount.class);
        if (annotation != null) {
            if (request.getParams().size() > annotation.value()) {
                throw new WrongNumberOfArgumentsException(
                        String.format("wrong number of arguments for '%s' command", request.getCommand())
                );
            }
        }
    }

    private void checkMinimumParameterCount(Handler handler, Request request) throws WrongNumberOfArgumentsException {
        MinimumParameterCount annotation = handler.getClass().getAnnotation(MinimumParameterCount.class);
        if (annotation != null) {
            if (request.getParams().size() < annotation.value()) {
                throw new WrongNumberOfArgumentsException(
                        String.format("wrong number of arguments for '%s' command", request.getCommand())
                );
            }
        }
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        LOGGER.debug("Client connected: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        LOGGER.debug("Client disconnected: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    private String commandToString(Request request) {
        List<String> command = new ArrayList<>(List.of(request.getCommand()));
        for (ByteBuf param : request.getParams()) {
            command.add(param.toString(CharsetUtil.UTF_8));
        }
        return String.join(" ", command);
    }

    private void exceptionToRespError(Request request, Response response, Exception exception) {
        if (exception instanceof MinidisException exp) {
            if (exp.getCause() != null) {
                response.writeError(exp.getPrefix(), exp.getCause().getMessage());
            } else {
                response.writeError(exp.getPrefix(), exp.getMessage());
            }
        } else {
            LOGGER.debug("Unhandled error while serving command: {}", commandToString(request), exception);
            response.writeError(exception.getMessage());
        }
    }

    private void beforeExecute(Handler handler, Request request) {
        checkMinimumParameterCount(handler, request);
        checkMaximumParameterCount(handler, request);
        handler.beforeExecute(request);
    }

    private void writeProtocolErrorAndClose(ChannelHandlerContext ctx, String message) {
        String error = String.format("%s %s", RESPError.ERR, RESPError.sanitize(message));
        ctx.writeAndFlush(RespFrame.error(error)).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object message) {
        if (!(message instanceof RespFrame frame)) {
            ctx.fireChannelRead(message);
            return;
        }

        Request request;
        try {
            request = new RespRequest(ctx, frame);
        } catch (MalformedRequestException e) {
            LOGGER.warn("Closing connection to {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            writeProtocolErrorAndClose(ctx, e.getMessage());
            return;
        }

        if (logCommandForDebugging) {
            LOGGER.debug("Received command: {}", commandToString(request));
        }

        Response response = new RespResponse(ctx);
        try {
            Handler handler = handlers.get(request.getCommand());
            beforeExecute(handler, request);
            handler.execute(request, response);
        } catch (Exception e) {
            exceptionToRespError(request, response, e);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            LOGGER.warn("Closing connection to {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            writeProtocolErrorAndClose(ctx, String.format(RESPError.PROTOCOL_ERROR_MESSAGE, cause.getMessage()));
            return;
        }
        if (!(Objects.requireNonNull(cause) instanceof SocketException)) {
            LOGGER.error("Unhandled exception caught in channel handler", cause);
        }
        ctx.close();
    }
}
