/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.server;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.toolgate.catalog.ToolCatalog;
import io.toolgate.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe registry of tool handlers.
 * <p>
 * Only tools known to the {@link ToolCatalog} can be registered, since no loadout could
 * ever permit any other. Registering a name twice replaces the earlier registration.
 * Finding a tool here says nothing about whether a caller may use it; that is decided
 * by the invocation guard.
 */
public class ToolRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

	private final ConcurrentHashMap<String, ToolRegistration> tools = new ConcurrentHashMap<>();

	public void register(ToolRegistration registration) {
		Assert.notNull(registration, "registration must not be null");
		String name = registration.name();
		if (!ToolCatalog.contains(name)) {
			throw new IllegalArgumentException("Tool " + name + " is not part of the tool catalog");
		}
		if (this.tools.put(name, registration) != null) {
			logger.debug("Replaced registration of tool {}", name);
		}
	}

	public void remove(String name) {
		if (this.tools.remove(name) == null) {
			logger.warn("Ignoring removal of unregistered tool {}", name);
		}
	}

	public Optional<ToolRegistration> get(String name) {
		return name != null ? Optional.ofNullable(this.tools.get(name)) : Optional.empty();
	}

	/**
	 * @return every registration, in canonical catalog order
	 */
	public List<ToolRegistration> list() {
		return this.tools.values()
			.stream()
			.sorted(Comparator.comparingInt(registration -> ToolCatalog.order(registration.name())))
			.toList();
	}

	public int size() {
		return this.tools.size();
	}

}
