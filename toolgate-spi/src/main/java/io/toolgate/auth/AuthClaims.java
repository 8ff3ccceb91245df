/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.auth;

import java.util.List;

/**
 * Verified claims attached to an inbound tool call. Verification happens upstream;
 * ToolGate only reads them.
 *
 * @param tenantId raw tenant (project) identifier, expected to be a UUID
 * @param subject the authenticated subject, {@value #AGENT_SUBJECT} for agents
 * @param roles role names, carried along but not consulted for tool gating
 */
public record AuthClaims(String tenantId, String subject, List<String> roles) {

	/**
	 * Subject carried by API-key authenticated agents.
	 */
	public static final String AGENT_SUBJECT = "agent";

	public AuthClaims {
		roles = roles != null ? List.copyOf(roles) : List.of();
	}

	public AuthClaims(String tenantId, String subject) {
		this(tenantId, subject, List.of());
	}

	public static AuthClaims agent(String tenantId) {
		return new AuthClaims(tenantId, AGENT_SUBJECT);
	}

	public boolean isAgent() {
		return AGENT_SUBJECT.equals(this.subject);
	}

}
