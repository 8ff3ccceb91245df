/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.catalog;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Pins the exact membership of every loadout. A change here changes what callers can do.
 */
class LoadoutTests {

	@Test
	void defaultLoadout() {
		assertThat(Loadout.DEFAULT.toolNames()).containsExactly("health");
	}

	@Test
	void developerCoreLoadout() {
		assertThat(Loadout.DEVELOPER_CORE.toolNames()).containsExactly("echo", "execute");
	}

	@Test
	void limitedQueryLoadout() {
		assertThat(Loadout.LIMITED_QUERY.toolNames()).containsExactly("list_approved_queries",
				"execute_approved_query");
	}

	@Test
	void queryLoadout() {
		assertThat(Loadout.QUERY.toolNames()).containsExactly("validate", "query", "explain_query",
				"list_approved_queries", "execute_approved_query", "search_schema", "get_schema", "get_context",
				"get_entity", "get_glossary_sql", "get_ontology", "get_query_history", "list_glossary", "probe_column",
				"probe_columns", "probe_relationship", "sample");
	}

	@Test
	void ontologyMaintenanceLoadout() {
		assertThat(Loadout.ONTOLOGY_MAINTENANCE.toolNames()).containsExactly("create_glossary_term", "update_column",
				"update_entity", "update_glossary_term", "update_project_knowledge", "update_relationship",
				"delete_column_metadata", "delete_entity", "delete_glossary_term", "delete_project_knowledge",
				"delete_relationship", "refresh_schema", "scan_data_changes", "list_pending_changes", "approve_change",
				"reject_change", "approve_all_changes");
	}

	@Test
	void ontologyQuestionsLoadout() {
		assertThat(Loadout.ONTOLOGY_QUESTIONS.toolNames()).containsExactly("list_ontology_questions",
				"dismiss_ontology_question", "escalate_ontology_question", "resolve_ontology_question",
				"skip_ontology_question");
	}

	@Test
	void dataLiaisonLoadouts() {
		assertThat(Loadout.DATA_LIAISON_BUSINESS.toolNames()).containsExactly("suggest_approved_query",
				"suggest_query_update");
		assertThat(Loadout.DATA_LIAISON_DEVELOPER.toolNames()).containsExactly("list_query_suggestions",
				"approve_query_suggestion", "reject_query_suggestion", "create_approved_query",
				"update_approved_query", "delete_approved_query");
	}

	@Test
	void healthOnlyLivesInDefault() {
		for (Loadout loadout : Loadout.values()) {
			if (loadout != Loadout.DEFAULT) {
				assertThat(loadout.contains(ToolCatalog.HEALTH)).as(loadout.id()).isFalse();
			}
		}
	}

	@Test
	void dataLiaisonToolsStayOutOfOtherLoadouts() {
		for (String name : Loadout.DATA_LIAISON_BUSINESS.toolNames()) {
			assertThat(Loadout.QUERY.contains(name)).as(name).isFalse();
			assertThat(Loadout.isDataLiaisonTool(name)).isTrue();
		}
		for (String name : Loadout.DATA_LIAISON_DEVELOPER.toolNames()) {
			assertThat(Loadout.ONTOLOGY_MAINTENANCE.contains(name)).as(name).isFalse();
			assertThat(Loadout.isDataLiaisonTool(name)).isTrue();
		}
		assertThat(Loadout.isDataLiaisonTool("query")).isFalse();
	}

	@Test
	void lookupById() {
		assertThat(Loadout.fromId("ontology_questions")).contains(Loadout.ONTOLOGY_QUESTIONS);
		assertThat(Loadout.fromId("forced_mode")).isEmpty();
	}

}
