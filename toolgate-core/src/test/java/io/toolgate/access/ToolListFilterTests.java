/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.util.List;
import java.util.Map;

import io.toolgate.auth.AuthClaims;
import io.toolgate.common.ToolCallContext;
import io.toolgate.schema.AppIds;
import io.toolgate.schema.ToolGateSchema;
import io.toolgate.schema.ToolGroupConfig;
import io.toolgate.schema.ToolGroupsState;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static io.toolgate.access.AccessFixtures.TENANT;
import static io.toolgate.access.AccessFixtures.USER;
import static org.assertj.core.api.Assertions.assertThat;

class ToolListFilterTests {

	private static ToolGateSchema.Tool tool(String name) {
		return ToolGateSchema.Tool.builder().name(name).description(name).build();
	}

	private static final List<ToolGateSchema.Tool> TOOLS = List.of(tool("sample"), tool("health"), tool("query"),
			tool("echo"), tool("list_approved_queries"), tool("execute"), tool("suggest_approved_query"));

	private static final ToolCallContext USER_CONTEXT = ToolCallContext
		.of(new AuthClaims(TENANT.toString(), USER.toString()));

	@Test
	void keepsPermittedToolsInOriginalOrder() {
		ToolGroupsState state = ToolGroupsState.of(Map.of(ToolGroupsState.DEVELOPER, ToolGroupConfig.DISABLED));
		ToolListFilter filter = new ToolListFilter(AccessFixtures.capabilityService(state, true));

		StepVerifier.create(filter.filter(USER_CONTEXT, TOOLS))
			.assertNext(visible -> assertThat(visible).extracting(ToolGateSchema.Tool::name)
				.containsExactly("health", "echo", "execute"))
			.verifyComplete();
	}

	@Test
	void dropsDuplicateNames() {
		ToolListFilter filter = new ToolListFilter(AccessFixtures.capabilityService(null, true));
		ToolGateSchema.Tool second = ToolGateSchema.Tool.builder().name("health").description("again").build();

		StepVerifier.create(filter.filter(USER_CONTEXT, List.of(tool("health"), second)))
			.assertNext(visible -> assertThat(visible).singleElement()
				.extracting(ToolGateSchema.Tool::description)
				.isEqualTo("health"))
			.verifyComplete();
	}

	@Test
	void unauthenticatedCallerSeesHealthOnly() {
		ToolListFilter filter = new ToolListFilter(
				AccessFixtures.capabilityService(null, true, AppIds.AI_AGENTS, AppIds.AI_DATA_LIAISON));

		StepVerifier.create(filter.filter(ToolCallContext.create(), TOOLS))
			.assertNext(visible -> assertThat(visible).extracting(ToolGateSchema.Tool::name).containsExactly("health"))
			.verifyComplete();
	}

	@Test
	void dataLiaisonToolAppearsOnlyWithApp() {
		ToolListFilter withApp = new ToolListFilter(
				AccessFixtures.capabilityService(null, true, AppIds.AI_DATA_LIAISON));
		ToolListFilter withoutApp = new ToolListFilter(AccessFixtures.capabilityService(null, true));

		StepVerifier.create(withApp.filter(USER_CONTEXT, TOOLS))
			.assertNext(visible -> assertThat(visible).extracting(ToolGateSchema.Tool::name)
				.contains("suggest_approved_query"))
			.verifyComplete();
		StepVerifier.create(withoutApp.filter(USER_CONTEXT, TOOLS))
			.assertNext(visible -> assertThat(visible).extracting(ToolGateSchema.Tool::name)
				.doesNotContain("suggest_approved_query"))
			.verifyComplete();
	}

	@Test
	void malformedTenantIdIsAnError() {
		ToolListFilter filter = new ToolListFilter(AccessFixtures.capabilityService(null, true));

		StepVerifier.create(filter.filter(ToolCallContext.of(AuthClaims.agent("project-42")), TOOLS))
			.expectErrorSatisfies(ex -> assertThat(ex).isInstanceOfSatisfying(ToolAccessException.class,
					access -> assertThat(access.getCategory())
						.isEqualTo(ToolAccessErrorCategory.INVALID_TENANT_IDENTIFIER)))
			.verify();
	}

}
