/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.toolgate.access;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

import io.toolgate.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * The single denial-on-ambiguity path shared by every gate of the resolver.
 * <p>
 * A gate is a yes/no question asked of an external provider. The answer is "yes" only
 * when the provider exists, answers within the deadline, and answers {@code true}.
 * Missing providers, empty answers, errors and timeouts all mean "no".
 */
public final class FailClosedPolicy {

	private static final Logger logger = LoggerFactory.getLogger(FailClosedPolicy.class);

	private final Duration timeout;

	public FailClosedPolicy(Duration timeout) {
		Assert.notNull(timeout, "timeout must not be null");
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		this.timeout = timeout;
	}

	public Duration getTimeout() {
		return this.timeout;
	}

	/**
	 * Evaluate a gate.
	 * @param gateName name used in logs
	 * @param tenantId tenant the question is about
	 * @param check the provider call, or {@code null} when no provider is configured
	 * @return a Mono that always emits exactly one boolean
	 */
	public Mono<Boolean> gate(String gateName, UUID tenantId, @Nullable Supplier<Mono<Boolean>> check) {
		if (check == null) {
			logger.debug("Gate {} has no provider for tenant_id={}, treating as closed", gateName, tenantId);
			return Mono.just(false);
		}
		return Mono.defer(check)
			.timeout(this.timeout)
			.map(Boolean.TRUE::equals)
			.defaultIfEmpty(false)
			.onErrorResume(ex -> {
				logger.warn("Gate {} failed for tenant_id={}, treating as closed", gateName, tenantId, ex);
				return Mono.just(false);
			});
	}

	/**
	 * Bound a provider call by the deadline without deciding what its failure means.
	 * @param source the provider call
	 * @param <T> the emitted type
	 * @return the call with the deadline applied
	 */
	public <T> Mono<T> bounded(Supplier<Mono<T>> source) {
		return Mono.defer(source).timeout(this.timeout);
	}

}
