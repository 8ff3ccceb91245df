/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.spi;

import java.util.UUID;

import reactor.core.publisher.Mono;

/**
 * Opens tenant-bound resources for tool bodies.
 */
@FunctionalInterface
public interface TenantScopeProvider {

	/**
	 * @param tenantId the tenant
	 * @return a freshly opened scope; the subscriber owns it and must close it
	 */
	Mono<TenantScope> open(UUID tenantId);

}
