/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.server;

import java.util.ArrayList;
import java.util.List;

import io.toolgate.access.CapabilityResolver;
import io.toolgate.access.FailClosedPolicy;
import io.toolgate.access.InvocationGuard;
import io.toolgate.access.TenantFactsLoader;
import io.toolgate.access.ToolAccessException;
import io.toolgate.access.ToolCapabilityService;
import io.toolgate.access.ToolListFilter;
import io.toolgate.catalog.ToolCatalog;
import io.toolgate.common.ToolCallContext;
import io.toolgate.config.ToolGateOptions;
import io.toolgate.json.ToolGateJsonMapper;
import io.toolgate.schema.ToolGateSchema;
import io.toolgate.schema.ToolGateSchema.CallToolRequest;
import io.toolgate.schema.ToolGateSchema.CallToolResult;
import io.toolgate.schema.ToolGateSchema.ErrorResponse;
import io.toolgate.schema.ToolGateSchema.ListToolsResult;
import io.toolgate.spi.ConfigProvider;
import io.toolgate.spi.DatasourceProvider;
import io.toolgate.spi.InstalledAppsProvider;
import io.toolgate.spi.TenantScopeProvider;
import io.toolgate.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Serves {@code tools/list} and {@code tools/call} for registered tools, restricted to
 * what each caller is permitted.
 * <p>
 * Listing goes through the {@link ToolListFilter} and calling through the
 * {@link InvocationGuard}; both share one {@link ToolCapabilityService}, so a tool is
 * listed exactly when calling it would pass the access check.
 *
 * <pre>{@code
 * ToolGateServer server = ToolGateServer.builder()
 *     .configProvider(configProvider)
 *     .datasourceProvider(datasourceProvider)
 *     .installedAppsProvider(installedAppsProvider)
 *     .tenantScopeProvider(scopeProvider)
 *     .tool(queryTool, queryHandler)
 *     .build();
 * }</pre>
 */
public class ToolGateServer {

	private static final Logger logger = LoggerFactory.getLogger(ToolGateServer.class);

	private final ToolGateOptions options;

	private final ToolGateJsonMapper jsonMapper;

	private final ToolRegistry registry;

	private final ToolCapabilityService capabilityService;

	private final ToolListFilter listFilter;

	private final InvocationGuard invocationGuard;

	private final ToolRpcHandler rpcHandler;

	private ToolGateServer(Builder builder) {
		this.options = builder.options != null ? builder.options : ToolGateOptions.defaults();
		this.jsonMapper = builder.jsonMapper != null ? builder.jsonMapper : ToolGateJsonMapper.createDefault();

		FailClosedPolicy policy = new FailClosedPolicy(this.options.getFactsTimeout());
		TenantFactsLoader factsLoader = new TenantFactsLoader(builder.configProvider, builder.datasourceProvider,
				builder.installedAppsProvider, policy);
		this.capabilityService = new ToolCapabilityService(factsLoader, new CapabilityResolver());
		this.listFilter = new ToolListFilter(this.capabilityService);
		this.invocationGuard = new InvocationGuard(this.capabilityService, builder.tenantScopeProvider);

		this.registry = new ToolRegistry();
		this.registry.register(HealthTool.registration(this.options.getServerVersion(), this.jsonMapper));
		builder.tools.forEach(this.registry::register);

		this.rpcHandler = new ToolRpcHandler(this, this.jsonMapper);
		logger.info("Started {} {} with {} registered tools", this.options.getServerName(),
				this.options.getServerVersion(), this.registry.size());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * List the registered tools the caller may call, in canonical catalog order.
	 * @param context the call context
	 * @return the visible tools, or a {@link ToolGateRpcException} when the caller's
	 * tenant id is malformed
	 */
	public Mono<ListToolsResult> listTools(ToolCallContext context) {
		return this.listFilter.filter(context, this.registry.list(), ToolRegistration::name)
			.map(visible -> new ListToolsResult(visible.stream().map(ToolRegistration::tool).toList()))
			.onErrorMap(ToolAccessException.class, this::toRpcException);
	}

	/**
	 * Call a tool. Access failures the caller can act on come back as an error
	 * {@link CallToolResult}; internal failures as a {@link ToolGateRpcException}.
	 * @param context the call context
	 * @param request the call
	 * @return the tool result
	 */
	public Mono<CallToolResult> callTool(ToolCallContext context, CallToolRequest request) {
		Assert.notNull(request, "request must not be null");
		String toolName = request.name();
		return this.invocationGuard
			.execute(context, toolName, invocation -> this.registry.get(toolName)
				.map(registration -> registration.handler().handle(invocation, request.arguments()))
				.orElseGet(() -> Mono
					.error(ToolGateRpcException.invalidParams("Tool not registered: " + toolName, null))))
			.onErrorResume(ToolAccessException.class, ex -> {
				if (ex.isActionable()) {
					return Mono.fromCallable(() -> errorResult(ex));
				}
				return Mono.error(toRpcException(ex));
			});
	}

	public void addTool(ToolRegistration registration) {
		this.registry.register(registration);
	}

	/**
	 * Unregister a tool. {@code health} is always visible to every caller and cannot be
	 * removed; it can only be replaced through {@link #addTool(ToolRegistration)}.
	 * @param toolName the tool to remove
	 * @throws IllegalArgumentException when asked to remove {@code health}
	 */
	public void removeTool(String toolName) {
		if (ToolCatalog.HEALTH.equals(toolName)) {
			throw new IllegalArgumentException("Tool " + ToolCatalog.HEALTH + " cannot be removed");
		}
		this.registry.remove(toolName);
	}

	public ToolRpcHandler getRpcHandler() {
		return this.rpcHandler;
	}

	public ToolCapabilityService getCapabilityService() {
		return this.capabilityService;
	}

	public InvocationGuard getInvocationGuard() {
		return this.invocationGuard;
	}

	public ToolGateOptions getOptions() {
		return this.options;
	}

	private CallToolResult errorResult(ToolAccessException ex) throws Exception {
		ErrorResponse body = new ErrorResponse(ex.getCategory().code(), ex.getMessage());
		return CallToolResult.error(this.jsonMapper.writeValueAsString(body));
	}

	private ToolGateRpcException toRpcException(ToolAccessException ex) {
		if (ex.isActionable()) {
			return ToolGateRpcException.invalidParams(ex.getMessage(),
					new ErrorResponse(ex.getCategory().code(), ex.getMessage()));
		}
		return ToolGateRpcException.internalError(ex);
	}

	public static class Builder {

		private ConfigProvider configProvider;

		private DatasourceProvider datasourceProvider;

		private InstalledAppsProvider installedAppsProvider;

		private TenantScopeProvider tenantScopeProvider;

		private ToolGateOptions options;

		private ToolGateJsonMapper jsonMapper;

		private final List<ToolRegistration> tools = new ArrayList<>();

		private Builder() {
		}

		public Builder configProvider(ConfigProvider configProvider) {
			Assert.notNull(configProvider, "configProvider must not be null");
			this.configProvider = configProvider;
			return this;
		}

		public Builder datasourceProvider(DatasourceProvider datasourceProvider) {
			Assert.notNull(datasourceProvider, "datasourceProvider must not be null");
			this.datasourceProvider = datasourceProvider;
			return this;
		}

		/**
		 * Optional. Without it no add-on app counts as installed.
		 * @param installedAppsProvider the provider
		 * @return this builder
		 */
		public Builder installedAppsProvider(InstalledAppsProvider installedAppsProvider) {
			this.installedAppsProvider = installedAppsProvider;
			return this;
		}

		public Builder tenantScopeProvider(TenantScopeProvider tenantScopeProvider) {
			Assert.notNull(tenantScopeProvider, "tenantScopeProvider must not be null");
			this.tenantScopeProvider = tenantScopeProvider;
			return this;
		}

		public Builder options(ToolGateOptions options) {
			Assert.notNull(options, "options must not be null");
			this.options = options;
			return this;
		}

		public Builder jsonMapper(ToolGateJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public Builder tool(ToolGateSchema.Tool tool, ToolHandler handler) {
			return tool(new ToolRegistration(tool, handler));
		}

		public Builder tool(ToolRegistration registration) {
			Assert.notNull(registration, "registration must not be null");
			this.tools.add(registration);
			return this;
		}

		public Builder tools(List<ToolRegistration> registrations) {
			Assert.notNull(registrations, "registrations must not be null");
			registrations.forEach(this::tool);
			return this;
		}

		public ToolGateServer build() {
			Assert.notNull(this.configProvider, "configProvider must be set");
			Assert.notNull(this.datasourceProvider, "datasourceProvider must be set");
			Assert.notNull(this.tenantScopeProvider, "tenantScopeProvider must be set");
			return new ToolGateServer(this);
		}

	}

}
