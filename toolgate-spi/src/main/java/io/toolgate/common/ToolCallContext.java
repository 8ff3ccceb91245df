/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.common;

import io.toolgate.auth.AuthClaims;

/**
 * Per-call key/value context handed from the transport to the tool server. The
 * transport stores verified {@link AuthClaims} under {@link #AUTH_CLAIMS_KEY}; the
 * invocation guard adds tenant and provenance entries before a tool body runs.
 */
public interface ToolCallContext {

	String AUTH_CLAIMS_KEY = "toolgate.authClaims";

	String TENANT_ID_KEY = "toolgate.tenantId";

	String PROVENANCE_USER_ID_KEY = "toolgate.provenanceUserId";

	static ToolCallContext create() {
		return new DefaultToolCallContext();
	}

	static ToolCallContext of(AuthClaims claims) {
		ToolCallContext context = new DefaultToolCallContext();
		context.put(AUTH_CLAIMS_KEY, claims);
		return context;
	}

	/**
	 * Extract a value from the context.
	 * @param key the key under which to look up a value
	 * @return the stored value, or {@code null}
	 */
	Object get(String key);

	/**
	 * Store a value. A {@code null} value removes the key.
	 * @param key the key
	 * @param value the value
	 */
	void put(String key, Object value);

	/**
	 * Copies the contents of the context to allow further modifications without
	 * affecting the initial object.
	 * @return a new instance with the underlying storage copied
	 */
	ToolCallContext copy();

	/**
	 * The verified claims of the caller.
	 * @return the claims, or {@code null} for an unauthenticated call
	 */
	default AuthClaims authClaims() {
		return get(AUTH_CLAIMS_KEY) instanceof AuthClaims claims ? claims : null;
	}

}
