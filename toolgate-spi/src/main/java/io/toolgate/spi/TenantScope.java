/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.spi;

import java.util.UUID;

/**
 * A tenant-bound resource (typically a connection with the tenant set) owned by exactly
 * one in-flight tool call.
 */
public interface TenantScope extends AutoCloseable {

	UUID tenantId();

	/**
	 * Release the resource. Must be idempotent and must not throw.
	 */
	@Override
	void close();

}
