/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import io.toolgate.common.ToolCallContext;
import io.toolgate.schema.PrincipalClass;
import io.toolgate.spi.TenantScope;
import io.toolgate.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * A permitted tool call together with the tenant scope it runs in. Closing the
 * invocation releases the scope exactly once, however many times it is closed.
 */
public final class ToolInvocation implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ToolInvocation.class);

	private final String toolName;

	private final PrincipalClass principal;

	private final ToolCallContext context;

	private final TenantScope scope;

	private final AtomicBoolean closed = new AtomicBoolean();

	ToolInvocation(String toolName, PrincipalClass principal, ToolCallContext context, @Nullable TenantScope scope) {
		Assert.hasText(toolName, "toolName must not be empty");
		Assert.notNull(principal, "principal must not be null");
		Assert.notNull(context, "context must not be null");
		this.toolName = toolName;
		this.principal = principal;
		this.context = context;
		this.scope = scope;
	}

	public String toolName() {
		return this.toolName;
	}

	public PrincipalClass principal() {
		return this.principal;
	}

	/**
	 * @return the call context, carrying the tenant id and provenance user id once
	 * scoped
	 */
	public ToolCallContext context() {
		return this.context;
	}

	/**
	 * @return the tenant scope, or {@code null} for an unauthenticated health check
	 */
	@Nullable
	public TenantScope scope() {
		return this.scope;
	}

	@Nullable
	public UUID tenantId() {
		return this.scope != null ? this.scope.tenantId() : null;
	}

	@Nullable
	public UUID provenanceUserId() {
		return this.context.get(ToolCallContext.PROVENANCE_USER_ID_KEY) instanceof UUID id ? id : null;
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true) || this.scope == null) {
			return;
		}
		try {
			this.scope.close();
		}
		catch (RuntimeException ex) {
			logger.warn("Failed to release tenant scope for tool {} on tenant_id={}", this.toolName,
					this.scope.tenantId(), ex);
		}
	}

}
