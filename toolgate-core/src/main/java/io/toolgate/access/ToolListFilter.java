/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import io.toolgate.common.ToolCallContext;
import io.toolgate.schema.ToolGateSchema;
import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Narrows a tool listing to what the caller may call.
 */
public class ToolListFilter {

	private final ToolCapabilityService capabilityService;

	public ToolListFilter(ToolCapabilityService capabilityService) {
		Assert.notNull(capabilityService, "capabilityService must not be null");
		this.capabilityService = capabilityService;
	}

	public Mono<List<ToolGateSchema.Tool>> filter(ToolCallContext context, List<ToolGateSchema.Tool> tools) {
		return filter(context, tools, ToolGateSchema.Tool::name);
	}

	/**
	 * Keep the permitted items, in their original order. Later duplicates of a name are
	 * dropped.
	 * @param context the call context
	 * @param items the full listing
	 * @param nameOf extracts the tool name of an item
	 * @param <T> item type
	 * @return the visible items
	 */
	public <T> Mono<List<T>> filter(ToolCallContext context, List<T> items, Function<T, String> nameOf) {
		Assert.notNull(items, "items must not be null");
		Assert.notNull(nameOf, "nameOf must not be null");
		return this.capabilityService.resolve(context).map(decision -> {
			Set<String> seen = new HashSet<>();
			List<T> visible = new ArrayList<>();
			for (T item : items) {
				String name = nameOf.apply(item);
				if (decision.permits(name) && seen.add(name)) {
					visible.add(item);
				}
			}
			return List.copyOf(visible);
		});
	}

}
