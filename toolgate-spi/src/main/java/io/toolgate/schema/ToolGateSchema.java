/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.schema;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.toolgate.util.Assert;

/**
 * Records exchanged over the tool RPC surface. The shapes follow JSON-RPC 2.0 and the
 * {@code tools/list} and {@code tools/call} methods of the Model Context Protocol.
 */
public final class ToolGateSchema {

	private ToolGateSchema() {
	}

	public static final String JSONRPC_VERSION = "2.0";

	// ---------------------------
	// Method Names
	// ---------------------------

	public static final String METHOD_PING = "ping";

	public static final String METHOD_TOOLS_LIST = "tools/list";

	public static final String METHOD_TOOLS_CALL = "tools/call";

	// ---------------------------
	// JSON-RPC Error Codes
	// ---------------------------
	/**
	 * Standard error codes used in JSON-RPC responses.
	 */
	public static final class ErrorCodes {

		/**
		 * Invalid JSON was received by the server.
		 */
		public static final int PARSE_ERROR = -32700;

		/**
		 * The JSON sent is not a valid Request object.
		 */
		public static final int INVALID_REQUEST = -32600;

		/**
		 * The method does not exist / is not available.
		 */
		public static final int METHOD_NOT_FOUND = -32601;

		/**
		 * Invalid method parameter(s).
		 */
		public static final int INVALID_PARAMS = -32602;

		/**
		 * Internal JSON-RPC error.
		 */
		public static final int INTERNAL_ERROR = -32603;

		private ErrorCodes() {
		}

	}

	// ---------------------------
	// JSON-RPC Message Types
	// ---------------------------

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCRequest( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("method") String method,
		@JsonProperty("id") Object id,
		@JsonProperty("params") Object params) { // @formatter:on
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCResponse( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("id") Object id,
		@JsonProperty("result") Object result,
		@JsonProperty("error") JSONRPCError error) { // @formatter:on

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		@JsonIgnoreProperties(ignoreUnknown = true)
		public record JSONRPCError( // @formatter:off
			@JsonProperty("code") int code,
			@JsonProperty("message") String message,
			@JsonProperty("data") Object data) { // @formatter:on
		}
	}

	// ---------------------------
	// Tool Types
	// ---------------------------

	/**
	 * A tool descriptor as returned by {@code tools/list}.
	 *
	 * @param name unique, stable tool name
	 * @param description human readable description
	 * @param inputSchema JSON schema of the arguments, opaque to ToolGate
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Tool( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("description") String description,
		@JsonProperty("inputSchema") Map<String, Object> inputSchema) { // @formatter:on

		public static Builder builder() {
			return new Builder();
		}

		public static class Builder {

			private String name;

			private String description;

			private Map<String, Object> inputSchema = Map.of("type", "object");

			public Builder name(String name) {
				this.name = name;
				return this;
			}

			public Builder description(String description) {
				this.description = description;
				return this;
			}

			public Builder inputSchema(Map<String, Object> inputSchema) {
				Assert.notNull(inputSchema, "inputSchema must not be null");
				this.inputSchema = inputSchema;
				return this;
			}

			public Tool build() {
				Assert.hasText(name, "name must not be empty");
				return new Tool(name, description, inputSchema);
			}

		}
	}

	/**
	 * The server's response to a {@code tools/list} request.
	 *
	 * @param tools the tools visible to the caller
	 * @param nextCursor pagination cursor, always {@code null} for now
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ListToolsResult( // @formatter:off
		@JsonProperty("tools") List<Tool> tools,
		@JsonProperty("nextCursor") String nextCursor) { // @formatter:on

		public ListToolsResult(List<Tool> tools) {
			this(tools, null);
		}
	}

	/**
	 * Used by the client to call a tool provided by the server.
	 *
	 * @param name the name of the tool to call
	 * @param arguments arguments to pass to the tool
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record CallToolRequest( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("arguments") Map<String, Object> arguments) { // @formatter:on

		public CallToolRequest {
			arguments = arguments != null ? arguments : Map.of();
		}
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TextContent( // @formatter:off
		@JsonProperty("type") String type,
		@JsonProperty("text") String text) { // @formatter:on

		public TextContent(String text) {
			this("text", text);
		}
	}

	/**
	 * The server's response to a {@code tools/call} request.
	 *
	 * @param content output of the tool
	 * @param isError whether the content describes a failure the caller can act on
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record CallToolResult( // @formatter:off
		@JsonProperty("content") List<TextContent> content,
		@JsonProperty("isError") Boolean isError) { // @formatter:on

		public static CallToolResult text(String text) {
			return new CallToolResult(List.of(new TextContent(text)), false);
		}

		public static CallToolResult error(String text) {
			return new CallToolResult(List.of(new TextContent(text)), true);
		}
	}

	/**
	 * Body of an actionable tool error, serialized into the text content of a
	 * {@link CallToolResult} with {@code isError = true}.
	 *
	 * @param error always {@code true}
	 * @param code machine readable error code, e.g. {@code tool_not_enabled}
	 * @param message human readable message
	 * @param details optional extra context
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ErrorResponse( // @formatter:off
		@JsonProperty("error") boolean error,
		@JsonProperty("code") String code,
		@JsonProperty("message") String message,
		@JsonProperty("details") Object details) { // @formatter:on

		public ErrorResponse(String code, String message) {
			this(true, code, message, null);
		}
	}

}
