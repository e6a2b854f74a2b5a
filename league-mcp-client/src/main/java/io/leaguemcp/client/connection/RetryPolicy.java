/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.connection;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import io.leaguemcp.client.McpClientConfig;
import io.leaguemcp.spec.McpError;
import io.leaguemcp.util.Assert;

/**
 * 带抖动的指数退避。
 *
 * <p>
 * 第{@code n}次重试（从0开始）的等待时间为
 * {@code min(baseDelay * 2^n + jitter, maxDelay)}，其中{@code jitter}在
 * {@code [0, baseDelay * 2^n * 0.1)}上均匀分布。
 */
public class RetryPolicy {

	static final double JITTER_FACTOR = 0.1;

	private final int maxAttempts;

	private final Duration baseDelay;

	private final Duration maxDelay;

	private final DoubleSupplier random;

	public RetryPolicy(McpClientConfig.RetryConfig config) {
		this(config, () -> ThreadLocalRandom.current().nextDouble());
	}

	/**
	 * @param config 重试配置
	 * @param random 返回{@code [0, 1)}之间随机数的来源
	 */
	public RetryPolicy(McpClientConfig.RetryConfig config, DoubleSupplier random) {
		Assert.notNull(config, "The config can not be null");
		Assert.notNull(random, "The random source can not be null");
		this.maxAttempts = config.maxAttempts();
		this.baseDelay = config.baseDelay();
		this.maxDelay = config.maxDelay();
		this.random = random;
	}

	/**
	 * 计算第{@code attempt}次重试前的等待时间。
	 * @param attempt 重试序号，从0开始
	 * @return 等待时间，不超过{@code maxDelay}
	 */
	public Duration delay(int attempt) {
		Assert.isTrue(attempt >= 0, "attempt must not be negative");
		double baseNanos = this.baseDelay.toNanos();
		double maxNanos = this.maxDelay.toNanos();
		double exponential = baseNanos * Math.pow(2, attempt);
		if (exponential >= maxNanos) {
			return this.maxDelay;
		}
		double jitter = this.random.getAsDouble() * exponential * JITTER_FACTOR;
		return Duration.ofNanos((long) Math.min(exponential + jitter, maxNanos));
	}

	/**
	 * 判断一次失败的尝试之后是否还应重试。只有瞬时错误且尝试次数未用尽时才重试。
	 * @param attemptsMade 已经进行的尝试次数
	 * @param maxAttemptsForCall 本次调用允许的最大尝试次数
	 * @param error 本次尝试的错误
	 * @return 应当重试时为{@code true}
	 */
	public boolean shouldRetry(int attemptsMade, int maxAttemptsForCall, McpError error) {
		return error.isTransient() && attemptsMade < Math.min(maxAttemptsForCall, this.maxAttempts);
	}

	public int getMaxAttempts() {
		return this.maxAttempts;
	}

}
