/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

/**
 * Categories of tool access failures.
 * <p>
 * Actionable categories are returned to the caller as a structured tool error so the
 * client can react to them. The others are internal and reach the caller only as an
 * opaque internal error.
 */
public enum ToolAccessErrorCategory {

	/**
	 * No claims are attached to the call.
	 */
	AUTHENTICATION_REQUIRED("authentication_required", true),

	/**
	 * Claims are present but the tenant (project) id does not parse.
	 */
	INVALID_TENANT_IDENTIFIER("invalid_project_id", true),

	/**
	 * The tool is not in the caller's permitted set. The common, expected denial.
	 */
	TOOL_NOT_ENABLED("tool_not_enabled", true),

	/**
	 * The tenant-scoped resource could not be opened. Not a denial.
	 */
	RESOURCE_ACQUISITION_FAILED("resource_acquisition_failed", false),

	/**
	 * The configuration snapshot could not be read. Resolution fails closed.
	 */
	CONFIG_FETCH_FAILED("config_fetch_failed", false);

	private final String code;

	private final boolean actionable;

	ToolAccessErrorCategory(String code, boolean actionable) {
		this.code = code;
		this.actionable = actionable;
	}

	public String code() {
		return this.code;
	}

	public boolean isActionable() {
		return this.actionable;
	}

}
