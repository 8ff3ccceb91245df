/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static registry of every tool the server knows about, in canonical presentation
 * order. Append-only: new tools go at the end of their section.
 */
public final class ToolCatalog {

	public static final String HEALTH = "health";

	private static final List<ToolSpec> ALL_TOOLS = List.of(
			// Default
			new ToolSpec(HEALTH, "Server health check"),

			// Developer Core
			new ToolSpec("echo", "Echo back input message for testing"),
			new ToolSpec("execute", "Execute DDL/DML statements"),

			// Query
			new ToolSpec("validate", "Check SQL syntax without executing"),
			new ToolSpec("query", "Execute read-only SQL SELECT statements"),
			new ToolSpec("explain_query", "Analyze SQL query performance using EXPLAIN ANALYZE"),
			new ToolSpec("list_approved_queries", "List pre-approved SQL queries"),
			new ToolSpec("execute_approved_query", "Execute a pre-approved query by ID"),
			new ToolSpec("search_schema", "Full-text search across tables, columns, and entities"),
			new ToolSpec("get_schema", "Get database schema with entity semantics"),
			new ToolSpec("get_context", "Get unified database context with progressive depth"),
			new ToolSpec("get_entity", "Retrieve full entity details including aliases and relationships"),
			new ToolSpec("get_glossary_sql", "Get SQL definition for a business term"),
			new ToolSpec("get_ontology", "Get business ontology for query generation"),
			new ToolSpec("get_query_history", "Get recent query execution history"),
			new ToolSpec("list_glossary", "List all business glossary terms"),
			new ToolSpec("probe_column", "Deep-dive into a column with statistics and joinability"),
			new ToolSpec("probe_columns", "Batch variant of probe_column"),
			new ToolSpec("probe_relationship", "Deep-dive into relationships between entities"),
			new ToolSpec("sample", "Quick data preview from a table"),

			// Data Liaison (business)
			new ToolSpec("suggest_approved_query", "Suggest a reusable parameterized query for approval"),
			new ToolSpec("suggest_query_update", "Suggest an update to an existing approved query"),

			// Ontology Questions
			new ToolSpec("list_ontology_questions", "List ontology questions with filtering and pagination"),
			new ToolSpec("dismiss_ontology_question", "Mark a question as not worth pursuing"),
			new ToolSpec("escalate_ontology_question", "Mark a question as requiring human domain knowledge"),
			new ToolSpec("resolve_ontology_question", "Mark an ontology question as resolved"),
			new ToolSpec("skip_ontology_question", "Mark a question as skipped for revisiting later"),

			// Ontology Maintenance
			new ToolSpec("create_glossary_term", "Create a new business glossary term with SQL definition"),
			new ToolSpec("update_column", "Add or update semantic information about a column"),
			new ToolSpec("update_entity", "Create or update entity metadata"),
			new ToolSpec("update_glossary_term", "Create or update a business glossary term"),
			new ToolSpec("update_project_knowledge", "Create or update domain facts"),
			new ToolSpec("update_relationship", "Create or update a relationship between entities"),
			new ToolSpec("delete_column_metadata", "Clear custom metadata for a column"),
			new ToolSpec("delete_entity", "Remove an incorrectly identified entity"),
			new ToolSpec("delete_glossary_term", "Delete a business glossary term"),
			new ToolSpec("delete_project_knowledge", "Remove incorrect or outdated domain facts"),
			new ToolSpec("delete_relationship", "Remove an incorrectly identified relationship"),
			new ToolSpec("refresh_schema", "Refresh schema from datasource and detect changes"),
			new ToolSpec("scan_data_changes", "Scan for data-level changes in selected tables"),
			new ToolSpec("list_pending_changes", "List pending ontology changes awaiting review"),
			new ToolSpec("approve_change", "Approve a pending ontology change and apply it"),
			new ToolSpec("reject_change", "Reject a pending ontology change without applying it"),
			new ToolSpec("approve_all_changes", "Approve all pending ontology changes that can be applied"),

			// Data Liaison (developer)
			new ToolSpec("list_query_suggestions", "List query suggestions awaiting review"),
			new ToolSpec("approve_query_suggestion", "Approve a suggested query and publish it"),
			new ToolSpec("reject_query_suggestion", "Reject a suggested query"),
			new ToolSpec("create_approved_query", "Create a new approved query"),
			new ToolSpec("update_approved_query", "Update an existing approved query"),
			new ToolSpec("delete_approved_query", "Delete an approved query"));

	private static final Map<String, Integer> ORDER;

	static {
		Map<String, Integer> order = new HashMap<>();
		for (int i = 0; i < ALL_TOOLS.size(); i++) {
			if (order.put(ALL_TOOLS.get(i).name(), i) != null) {
				throw new IllegalStateException("Duplicate tool in catalog: " + ALL_TOOLS.get(i).name());
			}
		}
		for (Loadout loadout : Loadout.values()) {
			for (String name : loadout.toolNames()) {
				if (!order.containsKey(name)) {
					throw new IllegalStateException(
							"Loadout " + loadout.id() + " references unknown tool: " + name);
				}
			}
		}
		ORDER = Collections.unmodifiableMap(order);
	}

	private ToolCatalog() {
	}

	/**
	 * @return every tool in canonical order
	 */
	public static List<ToolSpec> all() {
		return ALL_TOOLS;
	}

	public static Optional<ToolSpec> get(String name) {
		Integer index = ORDER.get(name);
		return index != null ? Optional.of(ALL_TOOLS.get(index)) : Optional.empty();
	}

	public static boolean contains(String name) {
		return ORDER.containsKey(name);
	}

	/**
	 * @param name a tool name
	 * @return the canonical position of the tool, or -1 when unknown
	 */
	public static int order(String name) {
		return ORDER.getOrDefault(name, -1);
	}

	/**
	 * Merge loadouts into one de-duplicated tool list in canonical order.
	 * @param loadouts the loadouts to merge
	 * @return the merged tools
	 */
	public static List<ToolSpec> merge(Collection<Loadout> loadouts) {
		Set<String> names = new LinkedHashSet<>();
		for (Loadout loadout : loadouts) {
			names.addAll(loadout.toolNames());
		}
		return ALL_TOOLS.stream().filter(tool -> names.contains(tool.name())).toList();
	}

	/**
	 * Order a set of tool names canonically. Names outside the catalog are dropped.
	 * @param names tool names
	 * @return unmodifiable, canonically ordered names
	 */
	public static Set<String> canonicalOrder(Collection<String> names) {
		Set<String> ordered = new LinkedHashSet<>();
		for (ToolSpec tool : ALL_TOOLS) {
			if (names.contains(tool.name())) {
				ordered.add(tool.name());
			}
		}
		return Collections.unmodifiableSet(ordered);
	}

}
