/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.Optional;
import java.util.UUID;

import io.toolgate.schema.AppIds;
import io.toolgate.schema.PrincipalClass;
import io.toolgate.schema.ToolGroupsState;
import io.toolgate.spi.ConfigProvider;
import io.toolgate.spi.DatasourceProvider;
import io.toolgate.spi.InstalledAppsProvider;
import io.toolgate.util.Assert;
import io.toolgate.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Reads a fresh {@link TenantFacts} snapshot from the providers. Nothing is cached:
 * every resolution sees the configuration as it is at that moment.
 * <p>
 * Only the add-on app that matters for the principal is queried: {@code ai-agents}
 * for agents, {@code ai-data-liaison} for interactive users.
 */
public class TenantFactsLoader {

	private static final Logger logger = LoggerFactory.getLogger(TenantFactsLoader.class);

	private final ConfigProvider configProvider;

	private final DatasourceProvider datasourceProvider;

	private final InstalledAppsProvider installedAppsProvider;

	private final FailClosedPolicy policy;

	public TenantFactsLoader(ConfigProvider configProvider, DatasourceProvider datasourceProvider,
			@Nullable InstalledAppsProvider installedAppsProvider, FailClosedPolicy policy) {
		Assert.notNull(configProvider, "configProvider must not be null");
		Assert.notNull(datasourceProvider, "datasourceProvider must not be null");
		Assert.notNull(policy, "policy must not be null");
		this.configProvider = configProvider;
		this.datasourceProvider = datasourceProvider;
		this.installedAppsProvider = installedAppsProvider;
		this.policy = policy;
	}

	/**
	 * Load the facts of a tenant. The returned Mono never errors: failures are folded
	 * into facts that resolve closed.
	 * @param tenantId the tenant
	 * @param principal the principal class of the caller
	 * @return the facts
	 */
	public Mono<TenantFacts> load(UUID tenantId, PrincipalClass principal) {
		Assert.notNull(tenantId, "tenantId must not be null");
		return Mono.zip(loadState(tenantId), loadDatasourceConfigured(tenantId), loadInstalledApps(tenantId, principal))
			.map(tuple -> tuple.getT1()
				.map(state -> TenantFacts.of(state, tuple.getT2(), tuple.getT3()))
				.orElseGet(() -> TenantFacts.configUnavailable(tuple.getT2(), tuple.getT3())));
	}

	private Mono<Optional<ToolGroupsState>> loadState(UUID tenantId) {
		return this.policy.bounded(() -> this.configProvider.getToolGroupsState(tenantId))
			.defaultIfEmpty(ToolGroupsState.defaults())
			.doOnNext(state -> {
				if (!state.unknownGroups().isEmpty()) {
					logger.debug("Ignoring unknown tool groups {} for tenant_id={}", state.unknownGroups(), tenantId);
				}
			})
			.map(Optional::of)
			.onErrorResume(ex -> {
				ToolAccessException failure = ToolAccessException.configFetchFailed(tenantId, ex);
				logger.error("{} ({}), exposing health only", failure.getMessage(), failure.getCategory().code(), ex);
				return Mono.just(Optional.<ToolGroupsState>empty());
			});
	}

	private Mono<Boolean> loadDatasourceConfigured(UUID tenantId) {
		return this.policy.gate("datasource", tenantId, () -> this.datasourceProvider.getDefaultDatasourceId(tenantId)
			.map(datasourceId -> !Utils.isNil(datasourceId)));
	}

	private Mono<InstalledApps> loadInstalledApps(UUID tenantId, PrincipalClass principal) {
		String appId = switch (principal) {
			case AGENT -> AppIds.AI_AGENTS;
			case USER -> AppIds.AI_DATA_LIAISON;
			default -> null;
		};
		if (appId == null) {
			return Mono.just(InstalledApps.none());
		}
		InstalledAppsProvider provider = this.installedAppsProvider;
		return this.policy
			.gate("app:" + appId, tenantId, provider != null ? () -> provider.isInstalled(tenantId, appId) : null)
			.map(installed -> installed ? InstalledApps.of(appId) : InstalledApps.none());
	}

}
