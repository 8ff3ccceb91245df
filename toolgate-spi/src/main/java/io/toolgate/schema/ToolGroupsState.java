/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import io.toolgate.util.Assert;

/**
 * Snapshot of a tenant's tool-group configuration, as read from storage for one
 * resolution.
 * <p>
 * Lookups never fail: a group missing from the snapshot resolves to its documented
 * default, a group stored with an empty body resolves to {@link ToolGroupConfig#DISABLED},
 * and a group name this version does not know always resolves to
 * {@link ToolGroupConfig#DISABLED}.
 */
public final class ToolGroupsState {

	/**
	 * Version written by this release. Version 2 documents carry an explicit
	 * {@code schemaVersion} marker.
	 */
	public static final int CURRENT_SCHEMA_VERSION = 2;

	/**
	 * Version assumed for stored documents that predate the version marker.
	 */
	public static final int LEGACY_SCHEMA_VERSION = 1;

	public static final String DEVELOPER = "developer";

	public static final String AGENT_TOOLS = "agent_tools";

	/**
	 * Deprecated business-tools group, kept so that older documents still parse.
	 */
	public static final String APPROVED_QUERIES = "approved_queries";

	public static final Set<String> KNOWN_GROUPS = Set.of(DEVELOPER, AGENT_TOOLS, APPROVED_QUERIES);

	private static final ToolGroupsState DEFAULTS = new ToolGroupsState(CURRENT_SCHEMA_VERSION, Map.of());

	private final int schemaVersion;

	private final Map<String, ToolGroupConfig> groups;

	private ToolGroupsState(int schemaVersion, Map<String, ToolGroupConfig> groups) {
		this.schemaVersion = schemaVersion;
		// LinkedHashMap keeps null bodies, Map.copyOf would reject them
		this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
	}

	/**
	 * The state of a tenant that has never stored any configuration.
	 * @return the defaults snapshot
	 */
	public static ToolGroupsState defaults() {
		return DEFAULTS;
	}

	public static ToolGroupsState of(Map<String, ToolGroupConfig> groups) {
		return of(CURRENT_SCHEMA_VERSION, groups);
	}

	public static ToolGroupsState of(int schemaVersion, Map<String, ToolGroupConfig> groups) {
		Assert.notNull(groups, "groups must not be null");
		return new ToolGroupsState(schemaVersion, groups);
	}

	/**
	 * Default configuration of a group when the tenant has not stored one. A newly
	 * provisioned tenant gets the developer loadouts and the agent path.
	 * @param groupName the group name
	 * @return the default configuration, {@link ToolGroupConfig#DISABLED} for unknown
	 * groups
	 */
	public static ToolGroupConfig defaultConfig(String groupName) {
		if (DEVELOPER.equals(groupName)) {
			return new ToolGroupConfig(true, true, true, true, false);
		}
		if (AGENT_TOOLS.equals(groupName) || APPROVED_QUERIES.equals(groupName)) {
			return new ToolGroupConfig(true, false, false, false, false);
		}
		return ToolGroupConfig.DISABLED;
	}

	/**
	 * Effective configuration of a group.
	 * @param groupName the group name
	 * @return the stored configuration, the default when absent, or
	 * {@link ToolGroupConfig#DISABLED} when unknown or stored empty
	 */
	public ToolGroupConfig group(String groupName) {
		if (!KNOWN_GROUPS.contains(groupName)) {
			return ToolGroupConfig.DISABLED;
		}
		if (!this.groups.containsKey(groupName)) {
			return defaultConfig(groupName);
		}
		ToolGroupConfig stored = this.groups.get(groupName);
		return stored != null ? stored : ToolGroupConfig.DISABLED;
	}

	public int schemaVersion() {
		return this.schemaVersion;
	}

	/**
	 * The groups exactly as stored, including unknown names and empty bodies.
	 * @return unmodifiable view of the stored groups
	 */
	public Map<String, ToolGroupConfig> storedGroups() {
		return this.groups;
	}

	/**
	 * Stored group names this version does not recognize. They never contribute tools.
	 * @return sorted unknown group names
	 */
	public Set<String> unknownGroups() {
		Set<String> unknown = new TreeSet<>(this.groups.keySet());
		unknown.removeAll(KNOWN_GROUPS);
		return unknown;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ToolGroupsState other)) {
			return false;
		}
		return this.schemaVersion == other.schemaVersion && this.groups.equals(other.groups);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.schemaVersion, this.groups);
	}

	@Override
	public String toString() {
		return "ToolGroupsState{schemaVersion=" + this.schemaVersion + ", groups=" + this.groups + "}";
	}

}
