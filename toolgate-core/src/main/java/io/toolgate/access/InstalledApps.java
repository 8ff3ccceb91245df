/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

import io.toolgate.schema.AppIds;
import io.toolgate.util.Assert;

/**
 * Add-on apps known to be installed for a tenant. Anything not listed is treated as not
 * installed; {@link AppIds#MCP_SERVER} is always installed.
 */
public final class InstalledApps {

	private static final InstalledApps NONE = new InstalledApps(Set.of());

	private final Set<String> appIds;

	private InstalledApps(Set<String> appIds) {
		this.appIds = appIds;
	}

	public static InstalledApps none() {
		return NONE;
	}

	public static InstalledApps of(String... appIds) {
		return of(Set.of(appIds));
	}

	public static InstalledApps of(Collection<String> appIds) {
		Assert.notNull(appIds, "appIds must not be null");
		return appIds.isEmpty() ? NONE : new InstalledApps(Set.copyOf(appIds));
	}

	public boolean isInstalled(String appId) {
		return AppIds.MCP_SERVER.equals(appId) || this.appIds.contains(appId);
	}

	public Set<String> appIds() {
		return this.appIds;
	}

	@Override
	public boolean equals(Object o) {
		return this == o || (o instanceof InstalledApps other && this.appIds.equals(other.appIds));
	}

	@Override
	public int hashCode() {
		return this.appIds.hashCode();
	}

	@Override
	public String toString() {
		return "InstalledApps" + new TreeSet<>(this.appIds);
	}

}
