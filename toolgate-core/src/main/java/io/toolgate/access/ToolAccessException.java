/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.UUID;

import io.toolgate.util.Assert;

/**
 * Raised when a tool call cannot proceed past the access check.
 */
public class ToolAccessException extends RuntimeException {

	private final ToolAccessErrorCategory category;

	private final String toolName;

	public ToolAccessException(ToolAccessErrorCategory category, String message, String toolName, Throwable cause) {
		super(message, cause);
		Assert.notNull(category, "category must not be null");
		this.category = category;
		this.toolName = toolName;
	}

	public static ToolAccessException authenticationRequired(String toolName) {
		return new ToolAccessException(ToolAccessErrorCategory.AUTHENTICATION_REQUIRED, "authentication required",
				toolName, null);
	}

	public static ToolAccessException invalidTenantIdentifier(String rawTenantId, Throwable cause) {
		return new ToolAccessException(ToolAccessErrorCategory.INVALID_TENANT_IDENTIFIER,
				"invalid project ID: " + rawTenantId, null, cause);
	}

	public static ToolAccessException toolNotEnabled(String toolName) {
		return new ToolAccessException(ToolAccessErrorCategory.TOOL_NOT_ENABLED,
				toolName + " tool is not enabled for this project", toolName, null);
	}

	public static ToolAccessException resourceAcquisitionFailed(UUID tenantId, String toolName, Throwable cause) {
		return new ToolAccessException(ToolAccessErrorCategory.RESOURCE_ACQUISITION_FAILED,
				"failed to acquire tenant scope for project " + tenantId, toolName, cause);
	}

	public static ToolAccessException configFetchFailed(UUID tenantId, Throwable cause) {
		return new ToolAccessException(ToolAccessErrorCategory.CONFIG_FETCH_FAILED,
				"failed to check tool configuration for project " + tenantId, null, cause);
	}

	public ToolAccessErrorCategory getCategory() {
		return this.category;
	}

	/**
	 * @return the requested tool, or {@code null} when the failure is not tied to one
	 */
	public String getToolName() {
		return this.toolName;
	}

	public boolean isActionable() {
		return this.category.isActionable();
	}

}
