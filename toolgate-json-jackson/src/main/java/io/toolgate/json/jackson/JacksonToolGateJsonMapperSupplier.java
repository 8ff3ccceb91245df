/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.json.jackson;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import io.toolgate.json.ToolGateJsonMapper;
import io.toolgate.json.ToolGateJsonMapperSupplier;

/**
 * Supplies a Jackson-backed {@link ToolGateJsonMapper}. Registered through
 * {@link java.util.ServiceLoader}, so {@link ToolGateJsonMapper#createDefault()} finds
 * it when this module is on the classpath.
 */
public class JacksonToolGateJsonMapperSupplier implements ToolGateJsonMapperSupplier {

	@Override
	public ToolGateJsonMapper get() {
		return new JacksonToolGateJsonMapper(createMapper());
	}

	/**
	 * Creates the mapper. It never calls {@code setAccessible()}, so mapped types must be
	 * public, and it reads record component names through the
	 * {@link ParameterNamesModule}.
	 * @return the mapper
	 */
	private static ObjectMapper createMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
