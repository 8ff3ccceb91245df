/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.inmemory;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.toolgate.spi.TenantScope;
import io.toolgate.spi.TenantScopeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * {@link TenantScopeProvider} that hands out lightweight scopes and keeps count of the
 * ones still open, so leaks are observable.
 */
public class InMemoryTenantScopeProvider implements TenantScopeProvider {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryTenantScopeProvider.class);

	private final Set<InMemoryTenantScope> openScopes = ConcurrentHashMap.newKeySet();

	private final Set<UUID> unavailableTenants = ConcurrentHashMap.newKeySet();

	private final AtomicInteger opened = new AtomicInteger();

	@Override
	public Mono<TenantScope> open(UUID tenantId) {
		return Mono.fromCallable(() -> {
			if (this.unavailableTenants.contains(tenantId)) {
				throw new IllegalStateException("Tenant storage unavailable for " + tenantId);
			}
			InMemoryTenantScope scope = new InMemoryTenantScope(tenantId);
			this.openScopes.add(scope);
			this.opened.incrementAndGet();
			logger.trace("Opened scope for tenant_id={}", tenantId);
			return scope;
		});
	}

	/**
	 * Make every subsequent {@link #open} for the tenant fail.
	 * @param tenantId the tenant
	 */
	public void markUnavailable(UUID tenantId) {
		this.unavailableTenants.add(tenantId);
	}

	public void markAvailable(UUID tenantId) {
		this.unavailableTenants.remove(tenantId);
	}

	public int openScopeCount() {
		return this.openScopes.size();
	}

	public int openedScopeCount() {
		return this.opened.get();
	}

	private final class InMemoryTenantScope implements TenantScope {

		private final UUID tenantId;

		private final AtomicBoolean closed = new AtomicBoolean();

		private InMemoryTenantScope(UUID tenantId) {
			this.tenantId = tenantId;
		}

		@Override
		public UUID tenantId() {
			return this.tenantId;
		}

		@Override
		public void close() {
			if (this.closed.compareAndSet(false, true)) {
				openScopes.remove(this);
				logger.trace("Released scope for tenant_id={}", this.tenantId);
			}
		}

	}

}
