/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.spi;

import java.util.UUID;

import reactor.core.publisher.Mono;

/**
 * Reports the default data source of a tenant.
 */
public interface DatasourceProvider {

	/**
	 * @param tenantId the tenant
	 * @return the id of the default data source; an empty Mono or the nil UUID means
	 * "not configured"
	 */
	Mono<UUID> getDefaultDatasourceId(UUID tenantId);

}
