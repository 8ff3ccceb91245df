/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.json;

import java.util.function.Supplier;

/**
 * Strategy interface for resolving a {@link ToolGateJsonMapper} through
 * {@link java.util.ServiceLoader}.
 */
public interface ToolGateJsonMapperSupplier extends Supplier<ToolGateJsonMapper> {

}
