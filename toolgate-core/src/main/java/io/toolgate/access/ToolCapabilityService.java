/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.Set;
import java.util.UUID;

import io.toolgate.auth.AuthClaims;
import io.toolgate.catalog.ToolCatalog;
import io.toolgate.common.ToolCallContext;
import io.toolgate.schema.PrincipalClass;
import io.toolgate.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * The one place that turns a call context into a {@link CapabilityDecision}. Both
 * {@link ToolListFilter} and {@link InvocationGuard} ask this service, so what a caller
 * sees in {@code tools/list} is exactly what it may call.
 * <p>
 * Concurrent calls on the same session may observe different configuration snapshots
 * if the configuration changes between them. Each resolution reads its own fresh
 * snapshot and no locking is attempted.
 */
public class ToolCapabilityService {

	private static final Logger logger = LoggerFactory.getLogger(ToolCapabilityService.class);

	private final TenantFactsLoader factsLoader;

	private final CapabilityResolver resolver;

	public ToolCapabilityService(TenantFactsLoader factsLoader, CapabilityResolver resolver) {
		Assert.notNull(factsLoader, "factsLoader must not be null");
		Assert.notNull(resolver, "resolver must not be null");
		this.factsLoader = factsLoader;
		this.resolver = resolver;
	}

	/**
	 * Resolve the capabilities of the caller described by the context.
	 * @param context the call context
	 * @return the decision, or an error of category
	 * {@link ToolAccessErrorCategory#INVALID_TENANT_IDENTIFIER} when the claims carry a
	 * tenant id that does not parse
	 */
	public Mono<CapabilityDecision> resolve(ToolCallContext context) {
		Assert.notNull(context, "context must not be null");
		return Mono.defer(() -> {
			AuthClaims claims = context.authClaims();
			PrincipalClass principal = PrincipalClassifier.classify(claims);
			if (principal == PrincipalClass.UNAUTHENTICATED) {
				return Mono.just(new CapabilityDecision(principal, null, null, Set.of(ToolCatalog.HEALTH)));
			}
			UUID tenantId = PrincipalClassifier.tenantId(claims);
			return this.factsLoader.load(tenantId, principal).map(facts -> {
				Set<String> permitted = this.resolver.resolve(principal, facts);
				logger.debug("Resolved {} tools for {} on tenant_id={}", permitted.size(), principal, tenantId);
				return new CapabilityDecision(principal, claims, tenantId, permitted);
			});
		});
	}

}
