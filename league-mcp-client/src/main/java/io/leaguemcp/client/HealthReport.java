/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client;

import java.time.Instant;
import java.util.List;

import io.leaguemcp.client.connection.CircuitBreaker;
import io.leaguemcp.client.session.SessionState;
import io.leaguemcp.client.session.SessionStatus;

/**
 * 客户端核心的健康快照。
 *
 * @param generatedAt 生成时间
 * @param sessions 各会话的状态，按服务器名排序
 * @param toolCount 已注册的工具数
 * @param resourceCount 已发现的资源数
 * @param subscriptionCount 活动订阅数
 * @param cachedResources 资源缓存项数
 */
public record HealthReport(Instant generatedAt, List<SessionStatus> sessions, int toolCount, int resourceCount,
		int subscriptionCount, int cachedResources) {

	/**
	 * @return 所有会话都处于ACTIVE状态且熔断器闭合时为{@code true}
	 */
	public boolean isHealthy() {
		return this.sessions.stream()
			.allMatch(status -> status.state() == SessionState.ACTIVE
					&& status.circuitState() == CircuitBreaker.State.CLOSED);
	}

}
