/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.server;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.toolgate.schema.ToolGateSchema;
import io.toolgate.schema.ToolGateSchema.CallToolResult;
import io.toolgate.schema.ToolGroupsState;
import io.toolgate.spi.TenantScope;
import io.toolgate.spi.TenantScopeProvider;
import reactor.core.publisher.Mono;

/**
 * Mutable tenant facts and counting scopes for server tests.
 */
class ServerFixtures {

	static final UUID TENANT = UUID.fromString("9e7d6c5b-4a39-4281-b7f6-e5d4c3b2a190");

	final Map<UUID, ToolGroupsState> states = new ConcurrentHashMap<>();

	final Set<UUID> datasources = ConcurrentHashMap.newKeySet();

	final Set<String> installedApps = ConcurrentHashMap.newKeySet();

	final AtomicInteger openScopes = new AtomicInteger();

	volatile boolean scopesUnavailable;

	ServerFixtures() {
		this.datasources.add(TENANT);
	}

	ToolGateServer.Builder serverBuilder() {
		TenantScopeProvider scopes = tenantId -> {
			if (this.scopesUnavailable) {
				return Mono.error(new IllegalStateException("no connection"));
			}
			this.openScopes.incrementAndGet();
			return Mono.just(new TenantScope() {

				@Override
				public UUID tenantId() {
					return tenantId;
				}

				@Override
				public void close() {
					openScopes.decrementAndGet();
				}
			});
		};
		return ToolGateServer.builder()
			.configProvider(tenantId -> Mono.justOrEmpty(this.states.get(tenantId)))
			.datasourceProvider(
					tenantId -> this.datasources.contains(tenantId) ? Mono.just(UUID.randomUUID()) : Mono.empty())
			.installedAppsProvider((tenantId, appId) -> Mono.just(this.installedApps.contains(appId)))
			.tenantScopeProvider(scopes);
	}

	static ToolRegistration echoTool() {
		return new ToolRegistration(ToolGateSchema.Tool.builder().name("echo").description("Echo").build(),
				(invocation, arguments) -> Mono.just(CallToolResult.text(String.valueOf(arguments.get("message")))));
	}

	static ToolRegistration textTool(String name, String text) {
		return new ToolRegistration(ToolGateSchema.Tool.builder().name(name).description(name).build(),
				(invocation, arguments) -> Mono.just(CallToolResult.text(text)));
	}

}
