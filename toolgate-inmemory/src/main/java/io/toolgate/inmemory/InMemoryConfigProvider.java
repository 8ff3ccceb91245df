/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.inmemory;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import io.toolgate.config.ToolConfigDocuments;
import io.toolgate.json.ToolGateJsonMapper;
import io.toolgate.schema.ToolGroupsState;
import io.toolgate.spi.ConfigProvider;
import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;

/**
 * {@link ConfigProvider} keeping each tenant's stored tool configuration document in
 * memory. Documents are parsed on every read, like a database-backed provider would.
 */
public class InMemoryConfigProvider implements ConfigProvider {

	private final ConcurrentHashMap<UUID, String> documents = new ConcurrentHashMap<>();

	private final ToolConfigDocuments codec;

	public InMemoryConfigProvider() {
		this(ToolGateJsonMapper.createDefault());
	}

	public InMemoryConfigProvider(ToolGateJsonMapper jsonMapper) {
		this.codec = new ToolConfigDocuments(jsonMapper);
	}

	@Override
	public Mono<ToolGroupsState> getToolGroupsState(UUID tenantId) {
		return Mono.fromCallable(() -> {
			String document = this.documents.get(tenantId);
			return document != null ? this.codec.read(document) : null;
		});
	}

	public void putState(UUID tenantId, ToolGroupsState state) {
		putDocument(tenantId, this.codec.write(state));
	}

	/**
	 * Store a raw document. It is not validated until it is read.
	 * @param tenantId the tenant
	 * @param document the JSON document
	 */
	public void putDocument(UUID tenantId, String document) {
		Assert.notNull(tenantId, "tenantId must not be null");
		Assert.notNull(document, "document must not be null");
		this.documents.put(tenantId, document);
	}

	public String getDocument(UUID tenantId) {
		return this.documents.get(tenantId);
	}

	public void remove(UUID tenantId) {
		this.documents.remove(tenantId);
	}

}
