/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.server;

import java.time.Duration;
import java.util.Map;

import io.toolgate.auth.AuthClaims;
import io.toolgate.common.ToolCallContext;
import io.toolgate.json.ToolGateJsonMapper;
import io.toolgate.json.TypeRef;
import io.toolgate.schema.ToolGateSchema;
import io.toolgate.schema.ToolGateSchema.CallToolResult;
import io.toolgate.schema.ToolGateSchema.JSONRPCRequest;
import io.toolgate.schema.ToolGateSchema.JSONRPCResponse;
import io.toolgate.schema.ToolGateSchema.ListToolsResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static io.toolgate.server.ServerFixtures.TENANT;
import static org.assertj.core.api.Assertions.assertThat;

class ToolRpcHandlerTests {

	private static final ToolGateJsonMapper JSON = ToolGateJsonMapper.createDefault();

	private static final ToolCallContext USER = ToolCallContext
		.of(new AuthClaims(TENANT.toString(), "1f0e2d3c-4b5a-4968-8776-a5b4c3d2e1f0"));

	private ServerFixtures fixtures;

	private ToolRpcHandler handler;

	@BeforeEach
	void setUp() {
		fixtures = new ServerFixtures();
		handler = fixtures.serverBuilder().tool(ServerFixtures.echoTool()).build().getRpcHandler();
	}

	private static JSONRPCRequest request(String method, Object params) {
		return new JSONRPCRequest(ToolGateSchema.JSONRPC_VERSION, method, 1, params);
	}

	@Test
	void pingAnswersEmptyResult() {
		StepVerifier.create(handler.handleRequest(USER, request(ToolGateSchema.METHOD_PING, null)))
			.assertNext(response -> {
				assertThat(response.error()).isNull();
				assertThat(response.result()).isEqualTo(Map.of());
				assertThat(response.id()).isEqualTo(1);
			})
			.verifyComplete();
	}

	@Test
	void toolsListReturnsFilteredTools() {
		StepVerifier.create(handler.handleRequest(ToolCallContext.create(), request(ToolGateSchema.METHOD_TOOLS_LIST, null)))
			.assertNext(response -> {
				assertThat(response.result()).isInstanceOf(ListToolsResult.class);
				assertThat(((ListToolsResult) response.result()).tools()).extracting(ToolGateSchema.Tool::name)
					.containsExactly("health");
			})
			.verifyComplete();
	}

	@Test
	void toolsCallDispatchesToServer() {
		Map<String, Object> params = Map.of("name", "echo", "arguments", Map.of("message", "ping"));

		StepVerifier.create(handler.handleRequest(USER, request(ToolGateSchema.METHOD_TOOLS_CALL, params)))
			.assertNext(response -> {
				CallToolResult result = (CallToolResult) response.result();
				assertThat(result.isError()).isFalse();
				assertThat(result.content().get(0).text()).isEqualTo("ping");
			})
			.verifyComplete();
	}

	@Test
	void unknownMethodIsMethodNotFound() {
		StepVerifier.create(handler.handleRequest(USER, request("resources/list", null)))
			.assertNext(response -> assertThat(response.error().code())
				.isEqualTo(ToolGateSchema.ErrorCodes.METHOD_NOT_FOUND))
			.verifyComplete();
	}

	@Test
	void wrongProtocolVersionIsInvalidRequest() {
		JSONRPCRequest request = new JSONRPCRequest("1.0", ToolGateSchema.METHOD_PING, 3, null);

		StepVerifier.create(handler.handleRequest(USER, request))
			.assertNext(response -> {
				assertThat(response.error().code()).isEqualTo(ToolGateSchema.ErrorCodes.INVALID_REQUEST);
				assertThat(response.id()).isEqualTo(3);
			})
			.verifyComplete();
	}

	@Test
	void callWithoutNameIsInvalidParams() {
		StepVerifier.create(handler.handleRequest(USER, request(ToolGateSchema.METHOD_TOOLS_CALL, Map.of())))
			.assertNext(response -> assertThat(response.error().code())
				.isEqualTo(ToolGateSchema.ErrorCodes.INVALID_PARAMS))
			.verifyComplete();
		StepVerifier.create(handler.handleRequest(USER, request(ToolGateSchema.METHOD_TOOLS_CALL, null)))
			.assertNext(response -> assertThat(response.error().code())
				.isEqualTo(ToolGateSchema.ErrorCodes.INVALID_PARAMS))
			.verifyComplete();
	}

	@Test
	void scopeFailureSurfacesAsInternalError() {
		fixtures.scopesUnavailable = true;
		Map<String, Object> params = Map.of("name", "echo", "arguments", Map.of());

		StepVerifier.create(handler.handleRequest(USER, request(ToolGateSchema.METHOD_TOOLS_CALL, params)))
			.assertNext(response -> {
				assertThat(response.result()).isNull();
				assertThat(response.error().code()).isEqualTo(ToolGateSchema.ErrorCodes.INTERNAL_ERROR);
				assertThat(response.error().message()).doesNotContain(TENANT.toString());
			})
			.verifyComplete();
	}

	@Test
	void handlesRawJsonMessages() throws Exception {
		String message = """
				{"jsonrpc": "2.0", "id": "a-1", "method": "tools/call", "params": {"name": "suggest_approved_query"}}
				""";

		String raw = handler.handleMessage(USER, message).block(Duration.ofSeconds(5));
		JSONRPCResponse response = JSON.readValue(raw, JSONRPCResponse.class);

		assertThat(response.id()).isEqualTo("a-1");
		assertThat(response.error()).isNull();
		Map<String, Object> result = JSON.convertValue(response.result(), new TypeRef<Map<String, Object>>() {
		});
		assertThat(result).containsEntry("isError", true);
	}

	@Test
	void unparsableMessageIsParseError() throws Exception {
		String raw = handler.handleMessage(USER, "{\"jsonrpc\": ").block(Duration.ofSeconds(5));

		JSONRPCResponse response = JSON.readValue(raw, JSONRPCResponse.class);
		assertThat(response.error().code()).isEqualTo(ToolGateSchema.ErrorCodes.PARSE_ERROR);
	}

}
