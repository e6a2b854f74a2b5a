/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.queue;

import java.util.Map;

/**
 * 队列统计快照。
 *
 * @param size 当前排队的消息总数
 * @param sizeByPriority 各优先级当前排队数
 * @param totalEnqueued 累计入队数
 * @param totalDequeued 累计出队数
 * @param totalDropped 因队列已满或负载过期而丢弃的累计数
 * @param maxSize 队列容量
 */
public record QueueStats(int size, Map<MessagePriority, Integer> sizeByPriority, long totalEnqueued,
		long totalDequeued, long totalDropped, int maxSize) {
}
