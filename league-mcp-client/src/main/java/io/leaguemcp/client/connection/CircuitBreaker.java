/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.connection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.leaguemcp.client.McpClientConfig;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 单个会话的熔断器。
 *
 * <p>
 * 状态只按以下路径迁移：
 * <ul>
 * <li>{@code CLOSED → OPEN}：连续失败达到阈值，记录打开时间并清零计数</li>
 * <li>{@code OPEN → HALF_OPEN}：冷却时间结束后的下一次调用，作为唯一的探测放行</li>
 * <li>{@code HALF_OPEN → CLOSED}：探测成功，计数清零</li>
 * <li>{@code HALF_OPEN → OPEN}：探测失败，重新记录打开时间</li>
 * </ul>
 * HALF_OPEN期间同一时刻最多只有一个探测在途。
 * </p>
 *
 * <p>
 * 调用方通过{@link #tryAcquirePermission()}获得一个{@link Permit}，并在尝试结束时用同一个许可报告
 * {@link #onSuccess}、{@link #onFailure}或{@link #release}。所有方法都在实例锁内执行。
 * </p>
 */
public class CircuitBreaker {

	private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

	public enum State {

		CLOSED, OPEN, HALF_OPEN

	}

	/**
	 * 一次尝试获得的许可。
	 */
	public enum Permit {

		/** 熔断器拒绝本次尝试 */
		REJECTED,

		/** 闭合状态下的普通放行 */
		NORMAL,

		/** 半开状态下的唯一探测 */
		PROBE

	}

	/**
	 * 熔断器状态快照。
	 *
	 * @param state 当前状态
	 * @param consecutiveFailures 连续失败次数
	 * @param openedAt 最近一次打开的时间，从未打开时为{@code null}
	 * @param totalFailures 累计失败次数
	 * @param rejectedCalls 累计被拒绝的调用次数
	 */
	public record Snapshot(State state, int consecutiveFailures, Instant openedAt, long totalFailures,
			long rejectedCalls) {
	}

	private final String name;

	private final int failureThreshold;

	private final Duration recoveryTimeout;

	private final Clock clock;

	private State state = State.CLOSED;

	private int consecutiveFailures;

	private Instant openedAt;

	/** 熔断器离开CLOSED状态的时间，闭合时为{@code null} */
	private Instant unhealthySince;

	private boolean probeInFlight;

	private long totalFailures;

	private long rejectedCalls;

	public CircuitBreaker(String name, McpClientConfig.CircuitBreakerConfig config, Clock clock) {
		Assert.hasText(name, "The name can not be empty");
		Assert.notNull(config, "The config can not be null");
		Assert.notNull(clock, "The clock can not be null");
		this.name = name;
		this.failureThreshold = config.failureThreshold();
		this.recoveryTimeout = config.recoveryTimeout();
		this.clock = clock;
	}

	/**
	 * 为一次尝试申请许可。冷却结束后的第一次申请会把熔断器推进到HALF_OPEN并获得探测许可。
	 * @return 许可，被拒绝时为{@link Permit#REJECTED}
	 */
	public synchronized Permit tryAcquirePermission() {
		switch (this.state) {
			case CLOSED:
				return Permit.NORMAL;
			case OPEN:
				if (cooldownElapsed()) {
					transitionTo(State.HALF_OPEN);
					this.probeInFlight = true;
					return Permit.PROBE;
				}
				this.rejectedCalls++;
				return Permit.REJECTED;
			case HALF_OPEN:
				if (!this.probeInFlight) {
					this.probeInFlight = true;
					return Permit.PROBE;
				}
				this.rejectedCalls++;
				return Permit.REJECTED;
			default:
				throw new IllegalStateException("Unknown circuit state: " + this.state);
		}
	}

	/**
	 * 不改变状态地判断此刻的调用是否会被放行，用于在排队之前同步拒绝调用。
	 * @return 调用会被放行时为{@code true}
	 */
	public synchronized boolean isCallPermitted() {
		switch (this.state) {
			case CLOSED:
				return true;
			case OPEN:
				return cooldownElapsed();
			case HALF_OPEN:
				return !this.probeInFlight;
			default:
				return false;
		}
	}

	public synchronized void onSuccess(Permit permit) {
		if (permit == Permit.PROBE && this.state == State.HALF_OPEN) {
			this.probeInFlight = false;
			this.consecutiveFailures = 0;
			transitionTo(State.CLOSED);
		}
		else if (permit == Permit.NORMAL && this.state == State.CLOSED) {
			this.consecutiveFailures = 0;
		}
	}

	public synchronized void onFailure(Permit permit) {
		if (permit == Permit.REJECTED) {
			return;
		}
		this.totalFailures++;
		if (permit == Permit.PROBE && this.state == State.HALF_OPEN) {
			this.probeInFlight = false;
			open();
		}
		else if (permit == Permit.NORMAL && this.state == State.CLOSED) {
			this.consecutiveFailures++;
			if (this.consecutiveFailures >= this.failureThreshold) {
				open();
			}
		}
	}

	/**
	 * 结束一次既不算成功也不算失败的尝试（例如本地产生的永久错误）。探测许可被归还，状态不变。
	 * @param permit 尝试持有的许可
	 */
	public synchronized void release(Permit permit) {
		if (permit == Permit.PROBE && this.state == State.HALF_OPEN) {
			this.probeInFlight = false;
		}
	}

	/**
	 * @return 距离允许下一次探测的剩余时间，当前已允许时为零
	 */
	public synchronized Duration remainingCooldown() {
		if (this.state != State.OPEN) {
			return Duration.ZERO;
		}
		Duration elapsed = Duration.between(this.openedAt, this.clock.instant());
		Duration remaining = this.recoveryTimeout.minus(elapsed);
		return remaining.isNegative() ? Duration.ZERO : remaining;
	}

	/**
	 * @return 熔断器已经持续未闭合的时长，闭合时为{@link Duration#ZERO}
	 */
	public synchronized Duration unhealthyFor() {
		if (this.unhealthySince == null) {
			return Duration.ZERO;
		}
		return Duration.between(this.unhealthySince, this.clock.instant());
	}

	public synchronized State getState() {
		return this.state;
	}

	public synchronized int getConsecutiveFailures() {
		return this.consecutiveFailures;
	}

	public synchronized Snapshot snapshot() {
		return new Snapshot(this.state, this.consecutiveFailures, this.openedAt, this.totalFailures,
				this.rejectedCalls);
	}

	private boolean cooldownElapsed() {
		return !this.clock.instant().isBefore(this.openedAt.plus(this.recoveryTimeout));
	}

	private void open() {
		this.openedAt = this.clock.instant();
		this.consecutiveFailures = 0;
		if (this.unhealthySince == null) {
			this.unhealthySince = this.openedAt;
		}
		transitionTo(State.OPEN);
	}

	private void transitionTo(State next) {
		if (this.state == next) {
			return;
		}
		logger.info("Circuit for '{}' transitioned {} -> {}", this.name, this.state, next);
		this.state = next;
		if (next == State.CLOSED) {
			this.unhealthySince = null;
		}
	}

}
