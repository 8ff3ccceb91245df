/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.schema;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolGroupsStateTests {

	@Test
	void defaultsForNewTenant() {
		ToolGroupsState defaults = ToolGroupsState.defaults();

		assertThat(defaults.schemaVersion()).isEqualTo(ToolGroupsState.CURRENT_SCHEMA_VERSION);
		assertThat(defaults.group(ToolGroupsState.DEVELOPER))
			.isEqualTo(new ToolGroupConfig(true, true, true, true, false));
		assertThat(defaults.group(ToolGroupsState.AGENT_TOOLS).enabled()).isTrue();
		assertThat(defaults.group(ToolGroupsState.APPROVED_QUERIES).enabled()).isTrue();
	}

	@Test
	void absentGroupUsesDefault() {
		ToolGroupsState state = ToolGroupsState
			.of(Map.of(ToolGroupsState.AGENT_TOOLS, ToolGroupConfig.builder().enabled(false).build()));

		assertThat(state.group(ToolGroupsState.DEVELOPER))
			.isEqualTo(ToolGroupsState.defaultConfig(ToolGroupsState.DEVELOPER));
		assertThat(state.group(ToolGroupsState.AGENT_TOOLS).enabled()).isFalse();
	}

	@Test
	void emptyGroupBodyIsDisabled() {
		Map<String, ToolGroupConfig> groups = new HashMap<>();
		groups.put(ToolGroupsState.DEVELOPER, null);

		ToolGroupsState state = ToolGroupsState.of(groups);

		assertThat(state.group(ToolGroupsState.DEVELOPER)).isEqualTo(ToolGroupConfig.DISABLED);
		assertThat(state.storedGroups()).containsKey(ToolGroupsState.DEVELOPER);
	}

	@Test
	void unknownGroupIsAlwaysDisabled() {
		ToolGroupsState state = ToolGroupsState.of(Map.of("admin", new ToolGroupConfig(true, true, true, true, true)));

		assertThat(state.group("admin")).isEqualTo(ToolGroupConfig.DISABLED);
		assertThat(state.unknownGroups()).containsExactly("admin");
		assertThat(ToolGroupsState.defaultConfig("admin")).isEqualTo(ToolGroupConfig.DISABLED);
	}

	@Test
	void snapshotIsDetachedFromSourceMap() {
		Map<String, ToolGroupConfig> groups = new HashMap<>();
		ToolGroupsState state = ToolGroupsState.of(groups);

		groups.put(ToolGroupsState.DEVELOPER, ToolGroupConfig.DISABLED);

		assertThat(state.storedGroups()).isEmpty();
		assertThatThrownBy(() -> state.storedGroups().put("x", ToolGroupConfig.DISABLED))
			.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void mutateKeepsUntouchedFlags() {
		ToolGroupConfig config = ToolGroupConfig.builder().addQueryTools(true).forceMode(true).build();

		ToolGroupConfig changed = config.mutate().addOntologyQuestions(true).build();

		assertThat(changed).isEqualTo(new ToolGroupConfig(false, true, false, true, true));
	}

	@Test
	void equalityCoversVersionAndGroups() {
		assertThat(ToolGroupsState.of(Map.of())).isEqualTo(ToolGroupsState.defaults());
		assertThat(ToolGroupsState.of(ToolGroupsState.LEGACY_SCHEMA_VERSION, Map.of()))
			.isNotEqualTo(ToolGroupsState.defaults());
	}

}
