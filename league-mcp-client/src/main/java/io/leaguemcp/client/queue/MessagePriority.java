/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.queue;

/**
 * 消息分发优先级。出队时严格按照声明顺序扫描，心跳总是使用{@link #URGENT}，
 * 以免被积压的应用流量饿死。
 */
public enum MessagePriority {

	URGENT,

	HIGH,

	NORMAL

}
