/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.config;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import io.toolgate.json.ToolGateJsonMapper;
import io.toolgate.json.TypeRef;
import io.toolgate.schema.ToolGroupConfig;
import io.toolgate.schema.ToolGroupsState;
import io.toolgate.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the persisted tool-group document.
 * <p>
 * The current layout is {@code {"schemaVersion": 2, "toolGroups": {...}}}. A document
 * without {@code schemaVersion} is version 1; version 1 documents may also carry the
 * groups at the root instead of under {@code toolGroups}. Versions newer than
 * {@link ToolGroupsState#CURRENT_SCHEMA_VERSION} are rejected so that a configuration
 * this version cannot interpret never grants anything.
 * <p>
 * {@code forceMode} and the {@code enabled} flag of the {@code developer} group no
 * longer change the resolved tools. Documents that still set them are reported at
 * DEBUG.
 */
public class ToolConfigDocuments {

	private static final Logger logger = LoggerFactory.getLogger(ToolConfigDocuments.class);

	private static final String SCHEMA_VERSION_FIELD = "schemaVersion";

	private static final String TOOL_GROUPS_FIELD = "toolGroups";

	private static final TypeRef<Map<String, Object>> DOCUMENT_TYPE = new TypeRef<>() {
	};

	private static final TypeRef<Map<String, ToolGroupConfig>> GROUPS_TYPE = new TypeRef<>() {
	};

	private final ToolGateJsonMapper jsonMapper;

	public ToolConfigDocuments(ToolGateJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Parse a stored document.
	 * @param json the document
	 * @return the snapshot
	 * @throws IllegalArgumentException when the document is malformed or has an
	 * unsupported version
	 */
	public ToolGroupsState read(String json) {
		Assert.hasText(json, "json must not be empty");
		Map<String, Object> document;
		try {
			document = this.jsonMapper.readValue(json, DOCUMENT_TYPE);
		}
		catch (IOException ex) {
			throw new IllegalArgumentException("Malformed tool configuration document", ex);
		}
		if (document == null) {
			throw new IllegalArgumentException("Tool configuration document must be a JSON object");
		}

		int version = schemaVersion(document.get(SCHEMA_VERSION_FIELD));
		if (version > ToolGroupsState.CURRENT_SCHEMA_VERSION || version < ToolGroupsState.LEGACY_SCHEMA_VERSION) {
			throw new IllegalArgumentException("Unsupported tool configuration schemaVersion: " + version);
		}

		Object rawGroups;
		if (document.containsKey(TOOL_GROUPS_FIELD)) {
			rawGroups = document.get(TOOL_GROUPS_FIELD);
		}
		else if (version == ToolGroupsState.LEGACY_SCHEMA_VERSION) {
			Map<String, Object> rootGroups = new LinkedHashMap<>(document);
			rootGroups.remove(SCHEMA_VERSION_FIELD);
			rawGroups = rootGroups;
		}
		else {
			rawGroups = Map.of();
		}

		Map<String, ToolGroupConfig> groups;
		try {
			groups = rawGroups != null ? this.jsonMapper.convertValue(rawGroups, GROUPS_TYPE) : Map.of();
		}
		catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Malformed toolGroups in tool configuration document", ex);
		}

		ToolGroupsState state = ToolGroupsState.of(version, groups != null ? groups : Map.of());
		reportInertFields(state);
		return state;
	}

	/**
	 * Serialize a snapshot in the current layout.
	 * @param state the snapshot
	 * @return the document
	 */
	public String write(ToolGroupsState state) {
		Assert.notNull(state, "state must not be null");
		StoredToolConfig stored = new StoredToolConfig(ToolGroupsState.CURRENT_SCHEMA_VERSION, state.storedGroups());
		try {
			return this.jsonMapper.writeValueAsString(stored);
		}
		catch (IOException ex) {
			throw new IllegalStateException("Failed to serialize tool configuration document", ex);
		}
	}

	private static int schemaVersion(Object raw) {
		if (raw == null) {
			return ToolGroupsState.LEGACY_SCHEMA_VERSION;
		}
		if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
			long version = ((Number) raw).longValue();
			if (version < Integer.MIN_VALUE || version > Integer.MAX_VALUE) {
				throw new IllegalArgumentException("Unsupported tool configuration schemaVersion: " + raw);
			}
			return (int) version;
		}
		throw new IllegalArgumentException("schemaVersion must be an integer but was: " + raw);
	}

	private static void reportInertFields(ToolGroupsState state) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		state.storedGroups().forEach((name, config) -> {
			if (config != null && config.forceMode()) {
				logger.debug("Tool group {} sets legacy forceMode, which has no effect (schemaVersion={})", name,
						state.schemaVersion());
			}
		});
		ToolGroupConfig developer = state.storedGroups().get(ToolGroupsState.DEVELOPER);
		if (developer != null && !developer.enabled()) {
			logger.debug("Tool group developer sets legacy enabled=false, which has no effect (schemaVersion={})",
					state.schemaVersion());
		}
		if (!state.unknownGroups().isEmpty()) {
			logger.debug("Tool configuration contains unknown groups {}, they grant nothing", state.unknownGroups());
		}
	}

}
