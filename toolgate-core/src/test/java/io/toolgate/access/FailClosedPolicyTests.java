/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.time.Duration;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FailClosedPolicyTests {

	private static final UUID TENANT = UUID.randomUUID();

	private final FailClosedPolicy policy = new FailClosedPolicy(Duration.ofMillis(200));

	@Test
	void openOnlyWhenProviderSaysTrue() {
		StepVerifier.create(policy.gate("test", TENANT, () -> Mono.just(true))).expectNext(true).verifyComplete();
		StepVerifier.create(policy.gate("test", TENANT, () -> Mono.just(false))).expectNext(false).verifyComplete();
	}

	@Test
	void missingProviderIsClosed() {
		StepVerifier.create(policy.gate("test", TENANT, null)).expectNext(false).verifyComplete();
	}

	@Test
	void emptyAnswerIsClosed() {
		StepVerifier.create(policy.gate("test", TENANT, Mono::empty)).expectNext(false).verifyComplete();
	}

	@Test
	void errorIsClosed() {
		StepVerifier.create(policy.gate("test", TENANT, () -> Mono.error(new IllegalStateException("db down"))))
			.expectNext(false)
			.verifyComplete();
	}

	@Test
	void providerThrowingOrReturningNullIsClosed() {
		StepVerifier.create(policy.gate("test", TENANT, () -> {
			throw new IllegalStateException("boom");
		})).expectNext(false).verifyComplete();
		StepVerifier.create(policy.gate("test", TENANT, () -> null)).expectNext(false).verifyComplete();
	}

	@Test
	void timeoutIsClosed() {
		StepVerifier.withVirtualTime(() -> policy.gate("test", TENANT, Mono::never))
			.thenAwait(Duration.ofSeconds(1))
			.expectNext(false)
			.verifyComplete();
	}

	@Test
	void rejectsNonPositiveTimeout() {
		assertThatThrownBy(() -> new FailClosedPolicy(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
	}

}
