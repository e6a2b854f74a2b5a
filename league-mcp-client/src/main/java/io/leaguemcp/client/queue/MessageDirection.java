/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.queue;

public enum MessageDirection {

	/** 发往服务器的请求 */
	OUTBOUND,

	/** 从服务器收到、等待路由的消息 */
	INBOUND

}
