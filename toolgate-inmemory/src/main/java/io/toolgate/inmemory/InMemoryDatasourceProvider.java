/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.inmemory;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import io.toolgate.spi.DatasourceProvider;
import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;

public class InMemoryDatasourceProvider implements DatasourceProvider {

	private final ConcurrentHashMap<UUID, UUID> defaults = new ConcurrentHashMap<>();

	@Override
	public Mono<UUID> getDefaultDatasourceId(UUID tenantId) {
		return Mono.justOrEmpty(this.defaults.get(tenantId));
	}

	public void setDefaultDatasource(UUID tenantId, UUID datasourceId) {
		Assert.notNull(tenantId, "tenantId must not be null");
		Assert.notNull(datasourceId, "datasourceId must not be null");
		this.defaults.put(tenantId, datasourceId);
	}

	public void clearDefaultDatasource(UUID tenantId) {
		this.defaults.remove(tenantId);
	}

}
