/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.toolgate.catalog.ToolCatalog;
import io.toolgate.json.ToolGateJsonMapper;
import io.toolgate.schema.ToolGateSchema;
import io.toolgate.schema.ToolGateSchema.CallToolResult;
import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;

/**
 * The built-in {@code health} tool. It is visible to every caller and needs no tenant.
 */
public final class HealthTool {

	public static final String DESCRIPTION = "Returns the health status of the engine";

	private HealthTool() {
	}

	/**
	 * @param serverVersion version reported by the tool
	 * @param jsonMapper mapper used to render the status
	 * @return the registration of the health tool
	 */
	public static ToolRegistration registration(String serverVersion, ToolGateJsonMapper jsonMapper) {
		Assert.hasText(serverVersion, "serverVersion must not be empty");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		ToolGateSchema.Tool tool = ToolGateSchema.Tool.builder().name(ToolCatalog.HEALTH).description(DESCRIPTION).build();
		HealthStatus status = new HealthStatus("healthy", serverVersion);
		return new ToolRegistration(tool,
				(invocation, arguments) -> Mono.fromCallable(() -> jsonMapper.writeValueAsString(status))
					.map(CallToolResult::text));
	}

	public record HealthStatus( // @formatter:off
		@JsonProperty("engine") String engine,
		@JsonProperty("version") String version) { // @formatter:on
	}

}
