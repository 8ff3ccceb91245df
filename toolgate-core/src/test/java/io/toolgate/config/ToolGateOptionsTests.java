/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.config;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolGateOptionsTests {

	@AfterEach
	void clearProperty() {
		System.clearProperty(ToolGateOptions.FACTS_TIMEOUT_PROPERTY);
	}

	@Test
	void defaults() {
		ToolGateOptions options = ToolGateOptions.defaults();

		assertThat(options.getFactsTimeout()).isEqualTo(ToolGateOptions.DEFAULT_FACTS_TIMEOUT);
		assertThat(options.getServerName()).isEqualTo("toolgate");
		assertThat(options.getServerVersion()).isEqualTo(ToolGateOptions.DEFAULT_SERVER_VERSION);
	}

	@Test
	void systemPropertyOverridesDefaultTimeout() {
		System.setProperty(ToolGateOptions.FACTS_TIMEOUT_PROPERTY, "750");

		assertThat(ToolGateOptions.defaults().getFactsTimeout()).isEqualTo(Duration.ofMillis(750));
	}

	@Test
	void builderWinsOverSystemProperty() {
		System.setProperty(ToolGateOptions.FACTS_TIMEOUT_PROPERTY, "750");

		ToolGateOptions options = ToolGateOptions.builder().factsTimeout(Duration.ofSeconds(2)).build();

		assertThat(options.getFactsTimeout()).isEqualTo(Duration.ofSeconds(2));
	}

	@Test
	void rejectsNonPositiveTimeout() {
		assertThatThrownBy(() -> ToolGateOptions.builder().factsTimeout(Duration.ofMillis(-1)))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
