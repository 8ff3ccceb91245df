/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.server;

import java.util.Map;

import io.toolgate.access.ToolInvocation;
import io.toolgate.schema.ToolGateSchema.CallToolResult;
import reactor.core.publisher.Mono;

/**
 * Body of a tool. Runs only after the invocation guard has authorized the call, inside
 * the tenant scope carried by the invocation.
 */
@FunctionalInterface
public interface ToolHandler {

	/**
	 * @param invocation the authorized invocation; its scope is released once the
	 * returned Mono terminates or is cancelled
	 * @param arguments the call arguments, never {@code null}
	 * @return the tool result
	 */
	Mono<CallToolResult> handle(ToolInvocation invocation, Map<String, Object> arguments);

}
