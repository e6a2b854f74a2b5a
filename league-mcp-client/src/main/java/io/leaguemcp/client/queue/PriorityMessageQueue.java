/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.queue;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import io.leaguemcp.spec.McpError;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 线程安全的三级FIFO队列。
 *
 * <p>
 * 出队时从高到低扫描{@link MessagePriority#URGENT}、{@link MessagePriority#HIGH}、
 * {@link MessagePriority#NORMAL}，返回最高非空层中最早入队的消息；同一层内保持入队顺序。
 * 该队列只决定<em>分发</em>顺序，不约束完成顺序。
 * </p>
 *
 * <p>
 * 可选的丢弃谓词在出队时检查负载，命中的消息（例如已经超时或被取消的调用）被静默跳过并计入丢弃数。
 * </p>
 *
 * @param <T> 负载类型
 */
public class PriorityMessageQueue<T> {

	private static final Logger logger = LoggerFactory.getLogger(PriorityMessageQueue.class);

	public static final int DEFAULT_MAX_SIZE = 1000;

	private final ReentrantLock lock = new ReentrantLock();

	private final Condition notEmpty = this.lock.newCondition();

	private final EnumMap<MessagePriority, ArrayDeque<QueuedMessage<T>>> tiers = new EnumMap<>(MessagePriority.class);

	private final String name;

	private final int maxSize;

	private final Predicate<? super T> discardPredicate;

	private final Clock clock;

	private final String idPrefix = UUID.randomUUID().toString().substring(0, 8);

	private final AtomicLong idCounter = new AtomicLong(0);

	private int size;

	private long totalEnqueued;

	private long totalDequeued;

	private long totalDropped;

	public PriorityMessageQueue(String name) {
		this(name, DEFAULT_MAX_SIZE, payload -> false, Clock.systemUTC());
	}

	/**
	 * 创建队列。
	 * @param name 队列名，仅用于日志
	 * @param maxSize 容量上限
	 * @param discardPredicate 出队时判断负载是否应被丢弃
	 * @param clock 用于记录入队时间的时钟
	 */
	public PriorityMessageQueue(String name, int maxSize, Predicate<? super T> discardPredicate, Clock clock) {
		Assert.hasText(name, "The name can not be empty");
		Assert.isTrue(maxSize > 0, "The maxSize must be positive");
		Assert.notNull(discardPredicate, "The discardPredicate can not be null");
		Assert.notNull(clock, "The clock can not be null");
		this.name = name;
		this.maxSize = maxSize;
		this.discardPredicate = discardPredicate;
		this.clock = clock;
		for (MessagePriority priority : MessagePriority.values()) {
			this.tiers.put(priority, new ArrayDeque<>());
		}
	}

	public QueuedMessage<T> enqueue(T payload, MessagePriority priority) {
		return enqueue(payload, priority, MessageDirection.OUTBOUND);
	}

	/**
	 * 将负载放入对应优先级层的末尾，并唤醒一个等待的出队者。
	 * @param payload 负载
	 * @param priority 优先级
	 * @param direction 方向
	 * @return 入队的消息
	 * @throws McpError 如果队列已满
	 */
	public QueuedMessage<T> enqueue(T payload, MessagePriority priority, MessageDirection direction) {
		Assert.notNull(payload, "The payload can not be null");
		Assert.notNull(priority, "The priority can not be null");
		Assert.notNull(direction, "The direction can not be null");

		this.lock.lock();
		try {
			if (this.size >= this.maxSize) {
				this.totalDropped++;
				logger.warn("Queue '{}' is full ({} messages), rejecting {} message", this.name, this.size, priority);
				throw new McpError("Queue '" + this.name + "' is full");
			}
			QueuedMessage<T> message = new QueuedMessage<>(this.idPrefix + "-" + this.idCounter.getAndIncrement(),
					priority, direction, payload, this.clock.instant());
			this.tiers.get(priority).addLast(message);
			this.size++;
			this.totalEnqueued++;
			this.notEmpty.signal();
			return message;
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * 取出最高优先级层中最早的消息，队列为空时最多等待给定时长。
	 * @param timeout 最长等待时间
	 * @return 出队的消息，超时则为{@code null}
	 * @throws InterruptedException 如果等待时线程被中断
	 */
	public QueuedMessage<T> dequeue(Duration timeout) throws InterruptedException {
		Assert.notNull(timeout, "The timeout can not be null");
		long remainingNanos = timeout.toNanos();
		this.lock.lockInterruptibly();
		try {
			while (true) {
				QueuedMessage<T> message = pollLocked();
				if (message != null) {
					return message;
				}
				if (remainingNanos <= 0) {
					return null;
				}
				remainingNanos = this.notEmpty.awaitNanos(remainingNanos);
			}
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * 非阻塞地取出最高优先级层中最早的消息。
	 * @return 出队的消息，队列为空时为{@code null}
	 */
	public QueuedMessage<T> poll() {
		this.lock.lock();
		try {
			return pollLocked();
		}
		finally {
			this.lock.unlock();
		}
	}

	private QueuedMessage<T> pollLocked() {
		for (MessagePriority priority : MessagePriority.values()) {
			ArrayDeque<QueuedMessage<T>> tier = this.tiers.get(priority);
			QueuedMessage<T> message;
			while ((message = tier.pollFirst()) != null) {
				this.size--;
				if (this.discardPredicate.test(message.payload())) {
					this.totalDropped++;
					logger.debug("Queue '{}' dropped stale message {}", this.name, message.id());
					continue;
				}
				this.totalDequeued++;
				return message;
			}
		}
		return null;
	}

	/**
	 * 移除所有负载满足条件的消息。
	 * @param filter 过滤条件
	 * @return 被移除的消息，按出队顺序排列
	 */
	public List<QueuedMessage<T>> removeIf(Predicate<? super T> filter) {
		Assert.notNull(filter, "The filter can not be null");
		List<QueuedMessage<T>> removed = new ArrayList<>();
		this.lock.lock();
		try {
			for (MessagePriority priority : MessagePriority.values()) {
				Iterator<QueuedMessage<T>> it = this.tiers.get(priority).iterator();
				while (it.hasNext()) {
					QueuedMessage<T> message = it.next();
					if (filter.test(message.payload())) {
						it.remove();
						this.size--;
						removed.add(message);
					}
				}
			}
			return removed;
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * 清空队列。
	 * @return 清空前排队的所有消息，按出队顺序排列
	 */
	public List<QueuedMessage<T>> drain() {
		return removeIf(payload -> true);
	}

	public int size() {
		this.lock.lock();
		try {
			return this.size;
		}
		finally {
			this.lock.unlock();
		}
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public QueueStats stats() {
		this.lock.lock();
		try {
			Map<MessagePriority, Integer> sizes = new EnumMap<>(MessagePriority.class);
			this.tiers.forEach((priority, tier) -> sizes.put(priority, tier.size()));
			return new QueueStats(this.size, Map.copyOf(sizes), this.totalEnqueued, this.totalDequeued,
					this.totalDropped, this.maxSize);
		}
		finally {
			this.lock.unlock();
		}
	}

}
