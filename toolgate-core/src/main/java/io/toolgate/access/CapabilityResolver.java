/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import io.toolgate.catalog.Loadout;
import io.toolgate.catalog.ToolCatalog;
import io.toolgate.schema.AppIds;
import io.toolgate.schema.PrincipalClass;
import io.toolgate.schema.ToolGroupConfig;
import io.toolgate.schema.ToolGroupsState;
import reactor.util.annotation.Nullable;

/**
 * Computes the set of tools a principal may see and call for one tenant.
 * <p>
 * Resolution is a pure function of its inputs: it performs no I/O and keeps no state,
 * so two calls with equal inputs return equal sets. Every input that cannot be
 * trusted collapses the result to the health tool alone.
 * <ul>
 * <li>Unauthenticated callers, tenants without a readable configuration and tenants
 * without a default data source get {@code health} only.</li>
 * <li>Agents get the limited query loadout when the {@code ai-agents} app is installed
 * and {@code agent_tools.enabled} is set.</li>
 * <li>Interactive users always get the developer core loadout. The flags of the
 * {@code developer} group add query, ontology maintenance and ontology question
 * loadouts; the {@code ai-data-liaison} app adds its business and developer
 * loadouts on top of query and ontology maintenance respectively.</li>
 * </ul>
 */
public class CapabilityResolver {

	private static final Set<String> HEALTH_ONLY = Set.of(ToolCatalog.HEALTH);

	/**
	 * Resolve the permitted tool names.
	 * @param principal the principal class of the caller
	 * @param facts tenant facts, may be {@code null} for unauthenticated callers
	 * @return unmodifiable tool names in canonical catalog order, always containing
	 * {@code health}
	 */
	public Set<String> resolve(@Nullable PrincipalClass principal, @Nullable TenantFacts facts) {
		Set<Loadout> loadouts = resolveLoadouts(principal, facts);
		List<String> names = new ArrayList<>();
		for (Loadout loadout : loadouts) {
			names.addAll(loadout.toolNames());
		}
		return names.size() == 1 ? HEALTH_ONLY : ToolCatalog.canonicalOrder(names);
	}

	/**
	 * Resolve the loadouts whose union makes up the permitted set.
	 * @param principal the principal class of the caller
	 * @param facts tenant facts
	 * @return the loadouts, always containing {@link Loadout#DEFAULT}
	 */
	public Set<Loadout> resolveLoadouts(@Nullable PrincipalClass principal, @Nullable TenantFacts facts) {
		Set<Loadout> loadouts = EnumSet.of(Loadout.DEFAULT);
		if (principal == null || principal == PrincipalClass.UNAUTHENTICATED || facts == null) {
			return loadouts;
		}
		if (!facts.configAvailable() || !facts.datasourceConfigured()) {
			return loadouts;
		}
		switch (principal) {
			case AGENT -> addAgentLoadouts(facts, loadouts);
			case USER -> addUserLoadouts(facts, loadouts);
			default -> {
			}
		}
		return loadouts;
	}

	private void addAgentLoadouts(TenantFacts facts, Collection<Loadout> loadouts) {
		if (!facts.installedApps().isInstalled(AppIds.AI_AGENTS)) {
			return;
		}
		if (facts.state().group(ToolGroupsState.AGENT_TOOLS).enabled()) {
			loadouts.add(Loadout.LIMITED_QUERY);
		}
	}

	private void addUserLoadouts(TenantFacts facts, Collection<Loadout> loadouts) {
		// developer.enabled is inert here, the flags below decide
		ToolGroupConfig developer = facts.state().group(ToolGroupsState.DEVELOPER);
		boolean dataLiaison = facts.installedApps().isInstalled(AppIds.AI_DATA_LIAISON);

		loadouts.add(Loadout.DEVELOPER_CORE);
		if (developer.addQueryTools()) {
			loadouts.add(Loadout.QUERY);
			if (dataLiaison) {
				loadouts.add(Loadout.DATA_LIAISON_BUSINESS);
			}
		}
		if (developer.addOntologyMaintenance()) {
			loadouts.add(Loadout.ONTOLOGY_MAINTENANCE);
			if (dataLiaison) {
				loadouts.add(Loadout.DATA_LIAISON_DEVELOPER);
			}
		}
		if (developer.addOntologyQuestions()) {
			loadouts.add(Loadout.ONTOLOGY_QUESTIONS);
		}
	}

}
