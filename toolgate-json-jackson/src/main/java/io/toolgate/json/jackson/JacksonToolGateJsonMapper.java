/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.json.jackson;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolgate.json.ToolGateJsonMapper;
import io.toolgate.json.TypeRef;
import io.toolgate.util.Assert;

/**
 * Jackson-based implementation of {@link ToolGateJsonMapper}.
 */
public final class JacksonToolGateJsonMapper implements ToolGateJsonMapper {

	private final ObjectMapper objectMapper;

	public JacksonToolGateJsonMapper(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	/**
	 * @return the underlying Jackson {@link ObjectMapper}
	 */
	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return this.objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, TypeRef<T> type) throws IOException {
		return this.objectMapper.readValue(content, javaType(type));
	}

	@Override
	public <T> T convertValue(Object fromValue, Class<T> type) {
		return this.objectMapper.convertValue(fromValue, type);
	}

	@Override
	public <T> T convertValue(Object fromValue, TypeRef<T> type) {
		return this.objectMapper.convertValue(fromValue, javaType(type));
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return this.objectMapper.writeValueAsString(value);
	}

	private JavaType javaType(TypeRef<?> type) {
		return this.objectMapper.getTypeFactory().constructType(type.getType());
	}

}
