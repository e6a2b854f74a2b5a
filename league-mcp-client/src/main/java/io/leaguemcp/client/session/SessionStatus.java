/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.session;

import java.time.Instant;

import io.leaguemcp.client.connection.CircuitBreaker;

/**
 * 会话在某一时刻的可观测状态。
 *
 * @param serverName 服务器名
 * @param sessionId 会话ID
 * @param state 会话状态
 * @param circuitState 熔断器状态
 * @param consecutiveFailures 熔断器的连续失败次数
 * @param lastHeartbeatAt 最近一次成功心跳的时间，尚无成功心跳时为{@code null}
 * @param pendingRequests 在途请求数
 * @param queueDepth 出站队列中等待分发的请求数
 * @param totalRequests 累计发出的尝试次数
 * @param totalErrors 累计失败的尝试次数
 * @param droppedNotifications 因入站队列已满而丢弃的通知数，非零表示订阅者可能错过了资源更新
 */
public record SessionStatus(String serverName, String sessionId, SessionState state,
		CircuitBreaker.State circuitState, int consecutiveFailures, Instant lastHeartbeatAt, int pendingRequests,
		int queueDepth, long totalRequests, long totalErrors, long droppedNotifications) {
}
