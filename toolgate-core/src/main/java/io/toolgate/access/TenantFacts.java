/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import io.toolgate.schema.ToolGroupsState;
import io.toolgate.util.Assert;

/**
 * Everything the {@link CapabilityResolver} needs to know about a tenant, read fresh
 * for one resolution.
 *
 * @param state the configuration snapshot; defaults when the tenant stored none
 * @param configAvailable {@code false} when reading the snapshot failed
 * @param datasourceConfigured whether the tenant has a default data source
 * @param installedApps add-on apps known to be installed
 */
public record TenantFacts(ToolGroupsState state, boolean configAvailable, boolean datasourceConfigured,
		InstalledApps installedApps) {

	public TenantFacts {
		Assert.notNull(state, "state must not be null");
		Assert.notNull(installedApps, "installedApps must not be null");
	}

	public static TenantFacts of(ToolGroupsState state, boolean datasourceConfigured, InstalledApps installedApps) {
		return new TenantFacts(state, true, datasourceConfigured, installedApps);
	}

	/**
	 * Facts for a tenant whose configuration could not be read.
	 * @param datasourceConfigured whether the tenant has a default data source
	 * @param installedApps installed add-on apps
	 * @return facts that resolve to the health tool only
	 */
	public static TenantFacts configUnavailable(boolean datasourceConfigured, InstalledApps installedApps) {
		return new TenantFacts(ToolGroupsState.defaults(), false, datasourceConfigured, installedApps);
	}

}
