/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.schema;

/**
 * Identifiers of installable add-on apps consulted by tool gating.
 */
public final class AppIds {

	/**
	 * The tool server itself. Always installed.
	 */
	public static final String MCP_SERVER = "mcp-server";

	/**
	 * Gates every tool for agent principals.
	 */
	public static final String AI_AGENTS = "ai-agents";

	/**
	 * Gates the Data Liaison business and developer tools.
	 */
	public static final String AI_DATA_LIAISON = "ai-data-liaison";

	private AppIds() {
	}

}
