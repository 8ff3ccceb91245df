/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.UUID;

import io.toolgate.auth.AuthClaims;
import io.toolgate.schema.PrincipalClass;
import io.toolgate.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Reads the principal class, tenant and provenance user out of verified claims.
 */
public final class PrincipalClassifier {

	private PrincipalClassifier() {
	}

	public static PrincipalClass classify(@Nullable AuthClaims claims) {
		if (claims == null) {
			return PrincipalClass.UNAUTHENTICATED;
		}
		return claims.isAgent() ? PrincipalClass.AGENT : PrincipalClass.USER;
	}

	/**
	 * Parse the tenant id carried by the claims.
	 * @param claims verified claims
	 * @return the tenant id
	 * @throws ToolAccessException with {@link ToolAccessErrorCategory#INVALID_TENANT_IDENTIFIER}
	 * when the id is missing or not a UUID
	 */
	public static UUID tenantId(AuthClaims claims) {
		String raw = claims.tenantId();
		if (!Utils.hasText(raw)) {
			throw ToolAccessException.invalidTenantIdentifier(String.valueOf(raw), null);
		}
		try {
			return UUID.fromString(raw.trim());
		}
		catch (IllegalArgumentException ex) {
			throw ToolAccessException.invalidTenantIdentifier(raw, ex);
		}
	}

	/**
	 * The user recorded as the actor of a call. Agents have none; a user subject that
	 * is not a UUID has none either.
	 * @param claims verified claims
	 * @return the provenance user id, or {@code null}
	 */
	@Nullable
	public static UUID provenanceUserId(@Nullable AuthClaims claims) {
		if (claims == null || claims.isAgent() || !Utils.hasText(claims.subject())) {
			return null;
		}
		try {
			return UUID.fromString(claims.subject());
		}
		catch (IllegalArgumentException ex) {
			return null;
		}
	}

}
