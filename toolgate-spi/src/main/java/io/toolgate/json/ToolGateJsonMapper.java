/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.json;

import java.io.IOException;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Abstraction for JSON serialization/deserialization to decouple ToolGate from any
 * specific JSON library. A Jackson implementation lives in the
 * {@code toolgate-json-jackson} module and is discovered through
 * {@link ServiceLoader}.
 */
public interface ToolGateJsonMapper {

	/**
	 * Deserialize JSON string into a target type.
	 * @param content JSON as String
	 * @param type target class
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, Class<T> type) throws IOException;

	/**
	 * Deserialize JSON string into a parameterized target type.
	 * @param content JSON as String
	 * @param type parameterized type reference
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	/**
	 * Convert a value to a given type, useful for mapping nested JSON structures such
	 * as JSON-RPC params.
	 * @param fromValue source value
	 * @param type target class
	 * @return converted value
	 * @param <T> generic type
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	/**
	 * Convert a value to a given parameterized type.
	 * @param fromValue source value
	 * @param type target type reference
	 * @return converted value
	 * @param <T> generic type
	 */
	<T> T convertValue(Object fromValue, TypeRef<T> type);

	/**
	 * Serialize an object to JSON string.
	 * @param value object to serialize
	 * @return JSON as String
	 * @throws IOException on serialization errors
	 */
	String writeValueAsString(Object value) throws IOException;

	/**
	 * Resolves the default {@link ToolGateJsonMapper}.
	 * @return The default {@link ToolGateJsonMapper}
	 * @throws IllegalStateException If no {@link ToolGateJsonMapper} implementation
	 * exists on the classpath.
	 */
	static ToolGateJsonMapper createDefault() {
		AtomicReference<IllegalStateException> ex = new AtomicReference<>();
		return ServiceLoader.load(ToolGateJsonMapperSupplier.class).stream().flatMap(p -> {
			try {
				return Stream.ofNullable(p.get());
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).flatMap(supplier -> {
			try {
				return Stream.of(supplier.get());
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).findFirst().orElseThrow(() -> {
			if (ex.get() != null) {
				return ex.get();
			}
			return new IllegalStateException("No default ToolGateJsonMapper implementation found");
		});
	}

	private static void addException(AtomicReference<IllegalStateException> ref, Exception toAdd) {
		ref.updateAndGet(existing -> {
			if (existing == null) {
				return new IllegalStateException("Failed to initialize default ToolGateJsonMapper", toAdd);
			}
			existing.addSuppressed(toAdd);
			return existing;
		});
	}

}
