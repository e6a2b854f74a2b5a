/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.queue;

import java.time.Instant;

/**
 * 分发队列中的一个工作单元。
 *
 * @param id 队列内唯一的消息ID
 * @param priority 优先级
 * @param direction 方向
 * @param payload 负载
 * @param enqueuedAt 入队时间
 * @param <T> 负载类型
 */
public record QueuedMessage<T>(String id, MessagePriority priority, MessageDirection direction, T payload,
		Instant enqueuedAt) {
}
