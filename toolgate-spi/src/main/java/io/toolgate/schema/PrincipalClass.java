/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.schema;

/**
 * Kind of caller making a tool request.
 */
public enum PrincipalClass {

	/**
	 * No verified claims are attached to the call.
	 */
	UNAUTHENTICATED,

	/**
	 * API-key authenticated automated agent (subject {@code agent}).
	 */
	AGENT,

	/**
	 * Any other authenticated caller. Roles do not split this class further.
	 */
	USER

}
