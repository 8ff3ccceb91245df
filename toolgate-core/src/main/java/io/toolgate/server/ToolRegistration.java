/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.server;

import io.toolgate.schema.ToolGateSchema;
import io.toolgate.util.Assert;

/**
 * A tool descriptor bound to its handler.
 *
 * @param tool the descriptor listed by {@code tools/list}
 * @param handler the body run by {@code tools/call}
 */
public record ToolRegistration(ToolGateSchema.Tool tool, ToolHandler handler) {

	public ToolRegistration {
		Assert.notNull(tool, "tool must not be null");
		Assert.notNull(handler, "handler must not be null");
	}

	public String name() {
		return this.tool.name();
	}

}
