/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.spi;

import java.util.UUID;

import reactor.core.publisher.Mono;

/**
 * Reports whether optional add-on apps are installed for a tenant.
 * <p>
 * Callers treat a missing provider, an empty result and an error alike: the app is
 * not installed.
 */
public interface InstalledAppsProvider {

	/**
	 * @param tenantId the tenant
	 * @param appId the app, see {@link io.toolgate.schema.AppIds}
	 * @return whether the app is installed
	 */
	Mono<Boolean> isInstalled(UUID tenantId, String appId);

}
