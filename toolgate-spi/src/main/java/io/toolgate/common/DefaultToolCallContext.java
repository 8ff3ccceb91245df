/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.common;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.toolgate.util.Assert;

/**
 * Default {@link ToolCallContext} backed by a {@link ConcurrentHashMap}.
 */
public class DefaultToolCallContext implements ToolCallContext {

	private final Map<String, Object> storage;

	public DefaultToolCallContext() {
		this(new ConcurrentHashMap<>());
	}

	DefaultToolCallContext(Map<String, Object> storage) {
		Assert.notNull(storage, "Storage must not be null");
		this.storage = storage;
	}

	@Override
	public Object get(String key) {
		return this.storage.get(key);
	}

	@Override
	public void put(String key, Object value) {
		if (value != null) {
			this.storage.put(key, value);
		}
		else {
			this.storage.remove(key);
		}
	}

	@Override
	public ToolCallContext copy() {
		return new DefaultToolCallContext(new ConcurrentHashMap<>(this.storage));
	}

	@Override
	public String toString() {
		return "DefaultToolCallContext" + this.storage.keySet();
	}

}
