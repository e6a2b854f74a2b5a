/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.connection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import io.leaguemcp.client.McpClientConfig;
import io.leaguemcp.spec.CircuitOpenError;
import io.leaguemcp.spec.SessionClosedError;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 会话范围内的周期性心跳任务。
 *
 * <p>
 * 每个周期发出一次探测（由{@link ConnectionManager#ping(Duration)}以URGENT优先级发送），
 * 上一次探测尚未结束时跳过本周期。探测失败已经由连接管理器计入熔断器，这里只负责会话健康状态：
 * 连续{@code failureThreshold}次失败通知监听器会话降级，任一次成功恢复正常。
 * 熔断器拒绝的探测不计为心跳失败。
 * </p>
 *
 * <p>
 * 如果熔断器持续未闭合超过放弃窗口，监听器会收到一次放弃通知，由会话管理器销毁会话。
 * {@link #stop()}保证任务被取消，会话关闭时必须调用。
 * </p>
 */
public class HeartbeatMonitor {

	private static final Logger logger = LoggerFactory.getLogger(HeartbeatMonitor.class);

	/**
	 * 心跳结果的接收者。
	 */
	public interface Listener {

		void onHeartbeatSuccess(Instant at);

		/**
		 * @param consecutiveFailures 连续失败次数
		 * @param degraded 是否已达到降级阈值
		 */
		void onHeartbeatFailure(int consecutiveFailures, boolean degraded);

		void onGiveUp(Duration unhealthyFor);

	}

	private final String serverName;

	private final Supplier<Mono<Void>> probe;

	private final CircuitBreaker circuitBreaker;

	private final McpClientConfig.HeartbeatConfig config;

	private final Duration giveUpAfter;

	private final Clock clock;

	private final Listener listener;

	private final Scheduler scheduler;

	private final AtomicBoolean beating = new AtomicBoolean(false);

	private final AtomicBoolean gaveUp = new AtomicBoolean(false);

	private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

	private volatile Disposable task;

	public HeartbeatMonitor(String serverName, Supplier<Mono<Void>> probe, CircuitBreaker circuitBreaker,
			McpClientConfig.HeartbeatConfig config, Duration giveUpAfter, Clock clock, Listener listener) {
		this(serverName, probe, circuitBreaker, config, giveUpAfter, clock, listener, Schedulers.parallel());
	}

	HeartbeatMonitor(String serverName, Supplier<Mono<Void>> probe, CircuitBreaker circuitBreaker,
			McpClientConfig.HeartbeatConfig config, Duration giveUpAfter, Clock clock, Listener listener,
			Scheduler scheduler) {
		Assert.hasText(serverName, "The serverName can not be empty");
		Assert.notNull(probe, "The probe can not be null");
		Assert.notNull(circuitBreaker, "The circuitBreaker can not be null");
		Assert.notNull(config, "The config can not be null");
		Assert.notNull(giveUpAfter, "The giveUpAfter can not be null");
		Assert.notNull(clock, "The clock can not be null");
		Assert.notNull(listener, "The listener can not be null");
		Assert.notNull(scheduler, "The scheduler can not be null");
		this.serverName = serverName;
		this.probe = probe;
		this.circuitBreaker = circuitBreaker;
		this.config = config;
		this.giveUpAfter = giveUpAfter;
		this.clock = clock;
		this.listener = listener;
		this.scheduler = scheduler;
	}

	public synchronized void start() {
		if (this.task != null && !this.task.isDisposed()) {
			return;
		}
		this.task = Flux.interval(this.config.interval(), this.config.interval(), this.scheduler)
			.subscribe(tick -> beat(), error -> logger.error("Heartbeat task for '{}' failed", this.serverName, error));
		logger.debug("Heartbeat for '{}' started every {} ms", this.serverName, this.config.interval().toMillis());
	}

	public synchronized void stop() {
		if (this.task != null) {
			this.task.dispose();
			this.task = null;
			logger.debug("Heartbeat for '{}' stopped", this.serverName);
		}
	}

	public boolean isRunning() {
		Disposable current = this.task;
		return current != null && !current.isDisposed();
	}

	public int getConsecutiveFailures() {
		return this.consecutiveFailures.get();
	}

	/**
	 * 执行一次心跳周期：先检查放弃窗口，再发出探测。
	 */
	void beat() {
		if (checkGiveUp()) {
			return;
		}
		if (!this.beating.compareAndSet(false, true)) {
			logger.debug("Previous heartbeat to '{}' still running, skipping", this.serverName);
			return;
		}
		Mono<Void> ping;
		try {
			ping = this.probe.get();
		}
		catch (RuntimeException e) {
			this.beating.set(false);
			onFailure(e);
			return;
		}
		ping.doFinally(signal -> this.beating.set(false)).subscribe(null, this::onFailure, this::onSuccess);
	}

	private boolean checkGiveUp() {
		if (this.giveUpAfter.isZero() || this.gaveUp.get()) {
			return this.gaveUp.get();
		}
		Duration unhealthyFor = this.circuitBreaker.unhealthyFor();
		if (unhealthyFor.compareTo(this.giveUpAfter) >= 0 && this.gaveUp.compareAndSet(false, true)) {
			logger.warn("Circuit for '{}' has not closed for {} s, giving up on the session", this.serverName,
					unhealthyFor.toSeconds());
			stop();
			this.listener.onGiveUp(unhealthyFor);
			return true;
		}
		return false;
	}

	private void onSuccess() {
		int previous = this.consecutiveFailures.getAndSet(0);
		if (previous > 0) {
			logger.info("Heartbeat to '{}' recovered after {} failure(s)", this.serverName, previous);
		}
		this.listener.onHeartbeatSuccess(this.clock.instant());
	}

	private void onFailure(Throwable error) {
		if (error instanceof SessionClosedError) {
			return;
		}
		if (error instanceof CircuitOpenError) {
			logger.debug("Heartbeat to '{}' skipped, circuit open", this.serverName);
			return;
		}
		int failures = this.consecutiveFailures.incrementAndGet();
		boolean degraded = failures >= this.config.failureThreshold();
		logger.warn("Heartbeat to '{}' failed ({}/{}): {}", this.serverName, failures, this.config.failureThreshold(),
				error.getMessage());
		this.listener.onHeartbeatFailure(failures, degraded);
	}

}
