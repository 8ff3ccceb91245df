/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.Set;
import java.util.UUID;

import io.toolgate.auth.AuthClaims;
import io.toolgate.schema.PrincipalClass;
import io.toolgate.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Outcome of one capability resolution.
 *
 * @param principal principal class of the caller
 * @param claims the caller's claims, {@code null} when unauthenticated
 * @param tenantId parsed tenant id, {@code null} when unauthenticated
 * @param permittedTools permitted tool names in canonical order
 */
public record CapabilityDecision(PrincipalClass principal, @Nullable AuthClaims claims, @Nullable UUID tenantId,
		Set<String> permittedTools) {

	public CapabilityDecision {
		Assert.notNull(principal, "principal must not be null");
		Assert.notNull(permittedTools, "permittedTools must not be null");
	}

	public boolean permits(String toolName) {
		return toolName != null && this.permittedTools.contains(toolName);
	}

	public boolean isAuthenticated() {
		return this.principal != PrincipalClass.UNAUTHENTICATED;
	}

}
