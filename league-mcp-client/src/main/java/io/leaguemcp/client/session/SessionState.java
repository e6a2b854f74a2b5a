/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.session;

/**
 * 会话的生命周期状态。
 */
public enum SessionState {

	/** 正在连接传输层并执行握手 */
	CONNECTING,

	/** 握手完成，心跳正常 */
	ACTIVE,

	/** 连续心跳失败达到阈值，调用仍然受熔断器约束地继续发送 */
	DEGRADED,

	/** 会话已关闭，不再接受调用 */
	CLOSED

}
