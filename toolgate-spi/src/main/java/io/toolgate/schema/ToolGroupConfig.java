/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stored configuration of one tool group for a tenant.
 * <p>
 * {@code enabled} is a legacy flag whose meaning depends on the group: it gates the
 * agent path for {@code agent_tools} and is inert for interactive users.
 * {@code forceMode} is retained for stored documents only and has no effect.
 *
 * @param enabled legacy group switch
 * @param addQueryTools adds the query loadout for interactive users
 * @param addOntologyMaintenance adds the ontology maintenance loadout
 * @param addOntologyQuestions adds the ontology questions loadout
 * @param forceMode legacy, inert
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolGroupConfig( // @formatter:off
	@JsonProperty("enabled") boolean enabled,
	@JsonProperty("addQueryTools") boolean addQueryTools,
	@JsonProperty("addOntologyMaintenance") boolean addOntologyMaintenance,
	@JsonProperty("addOntologyQuestions") boolean addOntologyQuestions,
	@JsonProperty("forceMode") boolean forceMode) { // @formatter:on

	/**
	 * A configuration with every flag off.
	 */
	public static final ToolGroupConfig DISABLED = new ToolGroupConfig(false, false, false, false, false);

	public static Builder builder() {
		return new Builder();
	}

	public Builder mutate() {
		return new Builder().enabled(this.enabled)
			.addQueryTools(this.addQueryTools)
			.addOntologyMaintenance(this.addOntologyMaintenance)
			.addOntologyQuestions(this.addOntologyQuestions)
			.forceMode(this.forceMode);
	}

	public static class Builder {

		private boolean enabled;

		private boolean addQueryTools;

		private boolean addOntologyMaintenance;

		private boolean addOntologyQuestions;

		private boolean forceMode;

		public Builder enabled(boolean enabled) {
			this.enabled = enabled;
			return this;
		}

		public Builder addQueryTools(boolean addQueryTools) {
			this.addQueryTools = addQueryTools;
			return this;
		}

		public Builder addOntologyMaintenance(boolean addOntologyMaintenance) {
			this.addOntologyMaintenance = addOntologyMaintenance;
			return this;
		}

		public Builder addOntologyQuestions(boolean addOntologyQuestions) {
			this.addOntologyQuestions = addOntologyQuestions;
			return this;
		}

		public Builder forceMode(boolean forceMode) {
			this.forceMode = forceMode;
			return this;
		}

		public ToolGroupConfig build() {
			return new ToolGroupConfig(enabled, addQueryTools, addOntologyMaintenance, addOntologyQuestions,
					forceMode);
		}

	}
}
