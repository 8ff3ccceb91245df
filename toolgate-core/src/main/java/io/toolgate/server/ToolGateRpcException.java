/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.server;

import io.toolgate.schema.ToolGateSchema;
import io.toolgate.schema.ToolGateSchema.JSONRPCResponse.JSONRPCError;

/**
 * A failure that reaches the client as a JSON-RPC error rather than a tool result.
 */
public class ToolGateRpcException extends RuntimeException {

	private final JSONRPCError jsonRpcError;

	public ToolGateRpcException(JSONRPCError jsonRpcError) {
		this(jsonRpcError, null);
	}

	public ToolGateRpcException(JSONRPCError jsonRpcError, Throwable cause) {
		super(jsonRpcError.message(), cause);
		this.jsonRpcError = jsonRpcError;
	}

	public static ToolGateRpcException internalError(Throwable cause) {
		return new ToolGateRpcException(
				new JSONRPCError(ToolGateSchema.ErrorCodes.INTERNAL_ERROR, "Internal error", null), cause);
	}

	public static ToolGateRpcException invalidParams(String message, Object data) {
		return new ToolGateRpcException(new JSONRPCError(ToolGateSchema.ErrorCodes.INVALID_PARAMS, message, data));
	}

	public JSONRPCError getJsonRpcError() {
		return this.jsonRpcError;
	}

}
