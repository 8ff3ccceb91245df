/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.catalog;

import java.util.regex.Pattern;

import io.toolgate.util.Assert;

/**
 * One entry of the {@link ToolCatalog}. The name is a stable identifier; removing or
 * renaming it is a breaking change for every stored configuration and client.
 *
 * @param name tool name, 1 to 128 characters from {@code [A-Za-z0-9_.-]}
 * @param description short description shown to callers
 */
public record ToolSpec(String name, String description) {

	private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_.\\-]{1,128}");

	public ToolSpec {
		Assert.hasText(name, "name must not be empty");
		if (!NAME_PATTERN.matcher(name).matches()) {
			throw new IllegalArgumentException("Invalid tool name: " + name);
		}
	}

}
