/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.json;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures generic type information at runtime for parameterized JSON
 * (de)serialization. Usage: {@code new TypeRef<Map<String, Object>>(){}}.
 *
 * @param <T> the type to capture
 */
public abstract class TypeRef<T> {

	private final Type type;

	protected TypeRef() {
		Type superClass = getClass().getGenericSuperclass();
		if (!(superClass instanceof ParameterizedType parameterized)) {
			throw new IllegalStateException("TypeRef must be created with a type argument");
		}
		this.type = parameterized.getActualTypeArguments()[0];
	}

	/**
	 * Returns the captured type.
	 * @return the captured type
	 */
	public Type getType() {
		return this.type;
	}

}
