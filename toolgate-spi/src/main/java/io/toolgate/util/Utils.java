/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.util;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	/**
	 * The all-zero UUID. Providers use it to say "nothing configured".
	 */
	public static final UUID NIL_UUID = new UUID(0L, 0L);

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Return {@code true} if the supplied Map is {@code null} or empty.
	 * @param map the Map to check
	 * @return whether the given Map is empty
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * Return {@code true} if the id is {@code null} or the all-zero UUID.
	 * @param id the id to check
	 * @return whether the id identifies nothing
	 */
	public static boolean isNil(@Nullable UUID id) {
		return (id == null || NIL_UUID.equals(id));
	}

}
