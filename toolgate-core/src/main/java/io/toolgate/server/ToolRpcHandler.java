/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.server;

import java.io.IOException;
import java.util.Map;

import io.toolgate.common.ToolCallContext;
import io.toolgate.json.ToolGateJsonMapper;
import io.toolgate.schema.ToolGateSchema;
import io.toolgate.schema.ToolGateSchema.CallToolRequest;
import io.toolgate.schema.ToolGateSchema.JSONRPCRequest;
import io.toolgate.schema.ToolGateSchema.JSONRPCResponse;
import io.toolgate.schema.ToolGateSchema.JSONRPCResponse.JSONRPCError;
import io.toolgate.util.Assert;
import io.toolgate.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Dispatches JSON-RPC 2.0 requests to a {@link ToolGateServer}. Supports
 * {@code tools/list}, {@code tools/call} and {@code ping}.
 */
public class ToolRpcHandler {

	private static final Logger logger = LoggerFactory.getLogger(ToolRpcHandler.class);

	private final Map<String, RequestHandler> requestHandlers;

	private final ToolGateJsonMapper jsonMapper;

	ToolRpcHandler(ToolGateServer server, ToolGateJsonMapper jsonMapper) {
		Assert.notNull(server, "server must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.jsonMapper = jsonMapper;
		this.requestHandlers = Map.of(ToolGateSchema.METHOD_PING, (context, params) -> Mono.just(Map.of()),
				ToolGateSchema.METHOD_TOOLS_LIST, (context, params) -> server.listTools(context),
				ToolGateSchema.METHOD_TOOLS_CALL,
				(context, params) -> server.callTool(context, toCallToolRequest(params)));
	}

	/**
	 * Handle a decoded request.
	 * @param context the call context
	 * @param request the request
	 * @return the response; failures are reported inside it, never as an error signal
	 */
	public Mono<JSONRPCResponse> handleRequest(ToolCallContext context, JSONRPCRequest request) {
		if (request == null || !ToolGateSchema.JSONRPC_VERSION.equals(request.jsonrpc())
				|| !Utils.hasText(request.method())) {
			Object id = request != null ? request.id() : null;
			return Mono.just(errorResponse(id,
					new JSONRPCError(ToolGateSchema.ErrorCodes.INVALID_REQUEST, "Invalid JSON-RPC request", null)));
		}
		RequestHandler requestHandler = this.requestHandlers.get(request.method());
		if (requestHandler == null) {
			return Mono.just(errorResponse(request.id(), new JSONRPCError(ToolGateSchema.ErrorCodes.METHOD_NOT_FOUND,
					"Method not found: " + request.method(), null)));
		}
		return Mono.defer(() -> requestHandler.handle(context, request.params()))
			.map(result -> new JSONRPCResponse(ToolGateSchema.JSONRPC_VERSION, request.id(), result, null))
			.onErrorResume(t -> Mono.just(errorResponse(request.id(), toJsonRpcError(request.method(), t))));
	}

	/**
	 * Handle a raw JSON message.
	 * @param context the call context
	 * @param message the JSON-RPC request as text
	 * @return the JSON-RPC response as text
	 */
	public Mono<String> handleMessage(ToolCallContext context, String message) {
		JSONRPCRequest request;
		try {
			request = this.jsonMapper.readValue(message, JSONRPCRequest.class);
		}
		catch (IOException | IllegalArgumentException ex) {
			logger.debug("Rejected unparsable JSON-RPC message", ex);
			return serialize(errorResponse(null,
					new JSONRPCError(ToolGateSchema.ErrorCodes.PARSE_ERROR, "Parse error", null)));
		}
		return handleRequest(context, request).flatMap(this::serialize);
	}

	private Mono<String> serialize(JSONRPCResponse response) {
		return Mono.fromCallable(() -> this.jsonMapper.writeValueAsString(response));
	}

	private CallToolRequest toCallToolRequest(Object params) {
		if (params == null) {
			throw ToolGateRpcException.invalidParams("Missing params for " + ToolGateSchema.METHOD_TOOLS_CALL, null);
		}
		CallToolRequest request;
		try {
			request = this.jsonMapper.convertValue(params, CallToolRequest.class);
		}
		catch (IllegalArgumentException ex) {
			throw new ToolGateRpcException(new JSONRPCError(ToolGateSchema.ErrorCodes.INVALID_PARAMS,
					"Invalid params for " + ToolGateSchema.METHOD_TOOLS_CALL, null), ex);
		}
		if (!Utils.hasText(request.name())) {
			throw ToolGateRpcException.invalidParams("Tool name must not be empty", null);
		}
		return request;
	}

	private static JSONRPCError toJsonRpcError(String method, Throwable t) {
		if (t instanceof ToolGateRpcException rpcException) {
			return rpcException.getJsonRpcError();
		}
		logger.error("Unexpected failure handling {}", method, t);
		return new JSONRPCError(ToolGateSchema.ErrorCodes.INTERNAL_ERROR, "Internal error", null);
	}

	private static JSONRPCResponse errorResponse(Object id, JSONRPCError error) {
		return new JSONRPCResponse(ToolGateSchema.JSONRPC_VERSION, id, null, error);
	}

	@FunctionalInterface
	interface RequestHandler {

		Mono<?> handle(ToolCallContext context, Object params);

	}

}
