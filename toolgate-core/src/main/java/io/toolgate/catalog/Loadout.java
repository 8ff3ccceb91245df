/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.catalog;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Named bundles of tools, enabled and disabled as a unit. Membership is part of the
 * security posture of the server: changing it changes what tenants expose.
 */
public enum Loadout {

	/**
	 * Always available to every principal.
	 */
	DEFAULT("default", "health"),

	DEVELOPER_CORE("developer_core", "echo", "execute"),

	/**
	 * Pre-approved queries only. The whole agent surface.
	 */
	LIMITED_QUERY("limited_query", "list_approved_queries", "execute_approved_query"),

	/**
	 * Ad-hoc querying plus schema and ontology reads.
	 */
	QUERY("query", "validate", "query", "explain_query", "list_approved_queries", "execute_approved_query",
			"search_schema", "get_schema", "get_context", "get_entity", "get_glossary_sql", "get_ontology",
			"get_query_history", "list_glossary", "probe_column", "probe_columns", "probe_relationship", "sample"),

	ONTOLOGY_MAINTENANCE("ontology_maintenance", "create_glossary_term", "update_column", "update_entity",
			"update_glossary_term", "update_project_knowledge", "update_relationship", "delete_column_metadata",
			"delete_entity", "delete_glossary_term", "delete_project_knowledge", "delete_relationship",
			"refresh_schema", "scan_data_changes", "list_pending_changes", "approve_change", "reject_change",
			"approve_all_changes"),

	ONTOLOGY_QUESTIONS("ontology_questions", "list_ontology_questions", "dismiss_ontology_question",
			"escalate_ontology_question", "resolve_ontology_question", "skip_ontology_question"),

	/**
	 * Requires the {@code ai-data-liaison} app.
	 */
	DATA_LIAISON_BUSINESS("data_liaison_business", "suggest_approved_query", "suggest_query_update"),

	/**
	 * Requires the {@code ai-data-liaison} app.
	 */
	DATA_LIAISON_DEVELOPER("data_liaison_developer", "list_query_suggestions", "approve_query_suggestion",
			"reject_query_suggestion", "create_approved_query", "update_approved_query", "delete_approved_query");

	private final String id;

	private final Set<String> toolNames;

	Loadout(String id, String... toolNames) {
		this.id = id;
		this.toolNames = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(toolNames)));
	}

	public String id() {
		return this.id;
	}

	/**
	 * @return tool names of this loadout, in declaration order
	 */
	public Set<String> toolNames() {
		return this.toolNames;
	}

	public boolean contains(String toolName) {
		return this.toolNames.contains(toolName);
	}

	public static Optional<Loadout> fromId(String id) {
		return Arrays.stream(values()).filter(l -> l.id.equals(id)).findFirst();
	}

	/**
	 * @param toolName a tool name
	 * @return whether the tool can only be reached through the Data Liaison app
	 */
	public static boolean isDataLiaisonTool(String toolName) {
		return DATA_LIAISON_BUSINESS.contains(toolName) || DATA_LIAISON_DEVELOPER.contains(toolName);
	}

}
