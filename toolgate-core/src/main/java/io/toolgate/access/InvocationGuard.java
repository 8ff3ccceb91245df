/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.UUID;
import java.util.function.Function;

import io.toolgate.common.ToolCallContext;
import io.toolgate.spi.TenantScopeProvider;
import io.toolgate.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Checks a tool call against the caller's permitted set and opens the tenant scope
 * the tool body runs in.
 * <p>
 * Callers that only need the check use {@link #acquire} and own the returned
 * {@link ToolInvocation}. {@link #execute} runs a body inside the invocation and
 * releases the scope on success, error and cancellation.
 */
public class InvocationGuard {

	private static final Logger logger = LoggerFactory.getLogger(InvocationGuard.class);

	private final ToolCapabilityService capabilityService;

	private final TenantScopeProvider scopeProvider;

	public InvocationGuard(ToolCapabilityService capabilityService, TenantScopeProvider scopeProvider) {
		Assert.notNull(capabilityService, "capabilityService must not be null");
		Assert.notNull(scopeProvider, "scopeProvider must not be null");
		this.capabilityService = capabilityService;
		this.scopeProvider = scopeProvider;
	}

	/**
	 * Check the call and open its scope.
	 * @param context the call context
	 * @param toolName the requested tool
	 * @return the invocation, or a {@link ToolAccessException} error
	 */
	public Mono<ToolInvocation> acquire(ToolCallContext context, String toolName) {
		return this.capabilityService.resolve(context).flatMap(decision -> {
			if (!decision.permits(toolName)) {
				if (!decision.isAuthenticated()) {
					logger.debug("Rejected unauthenticated call to tool {}", toolName);
					return Mono.error(ToolAccessException.authenticationRequired(toolName));
				}
				logger.debug("Tool {} is not enabled for {} on tenant_id={}", toolName, decision.principal(),
						decision.tenantId());
				return Mono.error(ToolAccessException.toolNotEnabled(toolName));
			}
			if (!decision.isAuthenticated()) {
				// only health is permitted here and it needs no tenant
				return Mono.just(new ToolInvocation(toolName, decision.principal(), context.copy(), null));
			}
			return openScope(context, toolName, decision);
		});
	}

	/**
	 * Run a tool body inside a checked invocation. The scope is released once the body
	 * completes, fails or is cancelled.
	 * @param context the call context
	 * @param toolName the requested tool
	 * @param body the tool body
	 * @param <T> result type
	 * @return the body's result, or a {@link ToolAccessException} error when the call
	 * is not allowed
	 */
	public <T> Mono<T> execute(ToolCallContext context, String toolName, Function<ToolInvocation, Mono<T>> body) {
		Assert.notNull(body, "body must not be null");
		return Mono.usingWhen(acquire(context, toolName), invocation -> Mono.defer(() -> body.apply(invocation)),
				invocation -> Mono.fromRunnable(invocation::close),
				(invocation, error) -> Mono.fromRunnable(invocation::close),
				invocation -> Mono.fromRunnable(invocation::close));
	}

	private Mono<ToolInvocation> openScope(ToolCallContext context, String toolName, CapabilityDecision decision) {
		UUID tenantId = decision.tenantId();
		return Mono.defer(() -> this.scopeProvider.open(tenantId))
			.switchIfEmpty(Mono.error(() -> new IllegalStateException("Scope provider returned no scope")))
			.onErrorMap(ex -> !(ex instanceof ToolAccessException), ex -> {
				logger.error("Failed to acquire tenant scope for tool {} on tenant_id={}", toolName, tenantId, ex);
				return ToolAccessException.resourceAcquisitionFailed(tenantId, toolName, ex);
			})
			.map(scope -> {
				ToolCallContext scoped = context.copy();
				scoped.put(ToolCallContext.TENANT_ID_KEY, tenantId);
				scoped.put(ToolCallContext.PROVENANCE_USER_ID_KEY,
						PrincipalClassifier.provenanceUserId(decision.claims()));
				return new ToolInvocation(toolName, decision.principal(), scoped, scope);
			});
	}

}
