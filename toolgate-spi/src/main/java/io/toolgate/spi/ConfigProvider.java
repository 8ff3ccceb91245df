/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.spi;

import java.util.UUID;

import io.toolgate.schema.ToolGroupsState;
import reactor.core.publisher.Mono;

/**
 * Reads a tenant's tool-group configuration.
 */
public interface ConfigProvider {

	/**
	 * Fetch the current tool-group snapshot of a tenant. Called once per resolution;
	 * implementations must not cache across calls on behalf of ToolGate.
	 * @param tenantId the tenant
	 * @return the snapshot, or an empty Mono when the tenant never stored one (defaults
	 * apply). An error signal makes the resolution fail closed.
	 */
	Mono<ToolGroupsState> getToolGroupsState(UUID tenantId);

}
