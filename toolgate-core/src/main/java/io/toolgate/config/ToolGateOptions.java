/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.config;

import java.time.Duration;

import io.toolgate.util.Assert;

/**
 * Tunables of a {@link io.toolgate.server.ToolGateServer}. Unset values fall back to
 * system properties, then to built-in defaults.
 */
public final class ToolGateOptions {

	/**
	 * System property overriding the deadline of each tenant fact lookup, in
	 * milliseconds.
	 */
	public static final String FACTS_TIMEOUT_PROPERTY = "io.toolgate.factsTimeoutMillis";

	public static final Duration DEFAULT_FACTS_TIMEOUT = Duration.ofSeconds(5);

	public static final String DEFAULT_SERVER_NAME = "toolgate";

	public static final String DEFAULT_SERVER_VERSION = "0.3.0";

	private final Duration factsTimeout;

	private final String serverName;

	private final String serverVersion;

	private ToolGateOptions(Builder builder) {
		this.factsTimeout = builder.factsTimeout != null ? builder.factsTimeout : factsTimeoutFromSystemProperty();
		this.serverName = builder.serverName;
		this.serverVersion = builder.serverVersion;
	}

	public static ToolGateOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Duration getFactsTimeout() {
		return this.factsTimeout;
	}

	public String getServerName() {
		return this.serverName;
	}

	public String getServerVersion() {
		return this.serverVersion;
	}

	private static Duration factsTimeoutFromSystemProperty() {
		Long millis = Long.getLong(FACTS_TIMEOUT_PROPERTY);
		if (millis == null || millis <= 0) {
			return DEFAULT_FACTS_TIMEOUT;
		}
		return Duration.ofMillis(millis);
	}

	@Override
	public String toString() {
		return "ToolGateOptions{factsTimeout=" + this.factsTimeout + ", serverName=" + this.serverName
				+ ", serverVersion=" + this.serverVersion + "}";
	}

	public static final class Builder {

		private Duration factsTimeout;

		private String serverName = DEFAULT_SERVER_NAME;

		private String serverVersion = DEFAULT_SERVER_VERSION;

		private Builder() {
		}

		/**
		 * Deadline applied to each tenant fact lookup. A lookup that misses it counts as
		 * a failure and resolves closed.
		 * @param factsTimeout the deadline, must be positive
		 * @return this builder
		 */
		public Builder factsTimeout(Duration factsTimeout) {
			Assert.notNull(factsTimeout, "factsTimeout must not be null");
			if (factsTimeout.isNegative() || factsTimeout.isZero()) {
				throw new IllegalArgumentException("factsTimeout must be positive");
			}
			this.factsTimeout = factsTimeout;
			return this;
		}

		public Builder serverName(String serverName) {
			Assert.hasText(serverName, "serverName must not be empty");
			this.serverName = serverName;
			return this;
		}

		public Builder serverVersion(String serverVersion) {
			Assert.hasText(serverVersion, "serverVersion must not be empty");
			this.serverVersion = serverVersion;
			return this;
		}

		public ToolGateOptions build() {
			return new ToolGateOptions(this);
		}

	}

}
