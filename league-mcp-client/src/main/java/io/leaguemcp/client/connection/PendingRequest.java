/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.connection;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import io.leaguemcp.client.queue.MessagePriority;
import io.leaguemcp.spec.McpSchema;
import reactor.core.Disposable;

/**
 * 一个等待响应的在途请求。
 *
 * <p>
 * 请求恰好被解决一次：响应、超时、会话关闭或调用方取消中最先发生的一个通过
 * {@link CompletableFuture#complete}/{@link CompletableFuture#completeExceptionally}赢得竞争，
 * 其余的调用返回{@code false}且不产生任何效果。
 * </p>
 *
 * <p>
 * 每次尝试持有一个熔断器许可。{@link #endAttempt()}以原子方式交出该许可，
 * 保证同一次尝试的结果只向熔断器报告一次，即使迟到的响应与超时同时发生。
 * </p>
 */
public class PendingRequest {

	private final McpSchema.JSONRPCRequest request;

	private final MessagePriority priority;

	private final Instant deadline;

	private final int maxAttempts;

	private final CompletableFuture<McpSchema.JSONRPCResponse> future = new CompletableFuture<>();

	private final AtomicReference<CircuitBreaker.Permit> inFlightPermit = new AtomicReference<>();

	private volatile int attempts;

	private volatile Disposable deadlineTimer;

	public PendingRequest(McpSchema.JSONRPCRequest request, MessagePriority priority, Instant deadline,
			int maxAttempts) {
		this.request = request;
		this.priority = priority;
		this.deadline = deadline;
		this.maxAttempts = maxAttempts;
		this.future.whenComplete((response, error) -> {
			Disposable timer = this.deadlineTimer;
			if (timer != null) {
				timer.dispose();
			}
		});
	}

	public Object correlationId() {
		return this.request.id();
	}

	public McpSchema.JSONRPCRequest request() {
		return this.request;
	}

	public MessagePriority priority() {
		return this.priority;
	}

	/**
	 * @return 绝对截止时间，在入队时由调用的超时参数确定，重试不会延长它
	 */
	public Instant deadline() {
		return this.deadline;
	}

	public int maxAttempts() {
		return this.maxAttempts;
	}

	public int attempts() {
		return this.attempts;
	}

	public CompletableFuture<McpSchema.JSONRPCResponse> future() {
		return this.future;
	}

	public boolean isDone() {
		return this.future.isDone();
	}

	/**
	 * 以响应解决请求。
	 * @param response 响应
	 * @return 本次调用解决了请求时为{@code true}
	 */
	public boolean complete(McpSchema.JSONRPCResponse response) {
		return this.future.complete(response);
	}

	/**
	 * 以错误解决请求。
	 * @param error 错误
	 * @return 本次调用解决了请求时为{@code true}
	 */
	public boolean fail(Throwable error) {
		return this.future.completeExceptionally(error);
	}

	void setDeadlineTimer(Disposable deadlineTimer) {
		this.deadlineTimer = deadlineTimer;
		if (this.future.isDone()) {
			deadlineTimer.dispose();
		}
	}

	void beginAttempt(CircuitBreaker.Permit permit) {
		this.attempts++;
		this.inFlightPermit.set(permit);
	}

	/**
	 * 结束当前尝试并交出其许可。
	 * @return 当前尝试的许可，如果没有在途尝试或已被其他路径交出则为{@code null}
	 */
	CircuitBreaker.Permit endAttempt() {
		return this.inFlightPermit.getAndSet(null);
	}

	@Override
	public String toString() {
		return "PendingRequest[id=" + this.request.id() + ", method=" + this.request.method() + ", priority="
				+ this.priority + ", attempts=" + this.attempts + "]";
	}

}
