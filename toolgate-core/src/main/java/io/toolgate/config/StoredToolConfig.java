/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.config;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.toolgate.schema.ToolGroupConfig;

/**
 * Persisted form of a tenant's tool-group configuration.
 *
 * @param schemaVersion document version, {@code null} in legacy documents
 * @param toolGroups group name to configuration; a {@code null} value is an explicitly
 * emptied group
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredToolConfig( // @formatter:off
	@JsonProperty("schemaVersion") Integer schemaVersion,
	@JsonProperty("toolGroups") Map<String, ToolGroupConfig> toolGroups) { // @formatter:on
}
