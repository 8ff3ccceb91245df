/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.inmemory;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import io.toolgate.schema.AppIds;
import io.toolgate.spi.InstalledAppsProvider;
import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;

/**
 * {@link InstalledAppsProvider} backed by an in-memory set per tenant.
 * {@link AppIds#MCP_SERVER} is always reported as installed.
 */
public class InMemoryInstalledAppsProvider implements InstalledAppsProvider {

	private final ConcurrentHashMap<UUID, Set<String>> installed = new ConcurrentHashMap<>();

	@Override
	public Mono<Boolean> isInstalled(UUID tenantId, String appId) {
		if (AppIds.MCP_SERVER.equals(appId)) {
			return Mono.just(true);
		}
		return Mono.just(this.installed.getOrDefault(tenantId, Set.of()).contains(appId));
	}

	public void install(UUID tenantId, String appId) {
		Assert.notNull(tenantId, "tenantId must not be null");
		Assert.hasText(appId, "appId must not be empty");
		this.installed.computeIfAbsent(tenantId, id -> ConcurrentHashMap.newKeySet()).add(appId);
	}

	public void uninstall(UUID tenantId, String appId) {
		Set<String> apps = this.installed.get(tenantId);
		if (apps != null) {
			apps.remove(appId);
		}
	}

}
