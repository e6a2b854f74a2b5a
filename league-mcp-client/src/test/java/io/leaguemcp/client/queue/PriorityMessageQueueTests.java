/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.queue;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import io.leaguemcp.spec.McpError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PriorityMessageQueueTests {

	@Test
	void dequeuesHighestTierFirstAndFifoWithinTier() throws InterruptedException {
		PriorityMessageQueue<String> queue = new PriorityMessageQueue<>("test");
		queue.enqueue("normal-1", MessagePriority.NORMAL);
		queue.enqueue("high-1", MessagePriority.HIGH);
		queue.enqueue("normal-2", MessagePriority.NORMAL);
		queue.enqueue("urgent-1", MessagePriority.URGENT);
		queue.enqueue("high-2", MessagePriority.HIGH);

		List<String> order = new ArrayList<>();
		QueuedMessage<String> message;
		while ((message = queue.dequeue(Duration.ZERO)) != null) {
			order.add(message.payload());
		}

		assertThat(order).containsExactly("urgent-1", "high-1", "high-2", "normal-1", "normal-2");
	}

	@Test
	void urgentHeartbeatOvertakesBacklog() throws InterruptedException {
		PriorityMessageQueue<String> queue = new PriorityMessageQueue<>("test");
		for (int i = 0; i < 100; i++) {
			queue.enqueue("call-" + i, MessagePriority.NORMAL);
		}
		queue.enqueue("ping", MessagePriority.URGENT);

		assertThat(queue.dequeue(Duration.ZERO).payload()).isEqualTo("ping");
	}

	@Test
	void dequeueReturnsNullAfterTimeoutOnEmptyQueue() throws InterruptedException {
		PriorityMessageQueue<String> queue = new PriorityMessageQueue<>("test");

		long start = System.nanoTime();
		QueuedMessage<String> message = queue.dequeue(Duration.ofMillis(50));

		assertThat(message).isNull();
		assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(40));
	}

	@Test
	void blockedDequeueIsWokenByEnqueue() throws Exception {
		PriorityMessageQueue<String> queue = new PriorityMessageQueue<>("test");
		AtomicReference<QueuedMessage<String>> received = new AtomicReference<>();
		CountDownLatch done = new CountDownLatch(1);
		Thread consumer = new Thread(() -> {
			try {
				received.set(queue.dequeue(Duration.ofSeconds(5)));
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			done.countDown();
		});
		consumer.start();

		queue.enqueue("hello", MessagePriority.HIGH, MessageDirection.INBOUND);

		assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
		assertThat(received.get().payload()).isEqualTo("hello");
		assertThat(received.get().direction()).isEqualTo(MessageDirection.INBOUND);
		assertThat(received.get().priority()).isEqualTo(MessagePriority.HIGH);
	}

	@Test
	void rejectsEnqueueWhenFullAndCountsDrop() {
		PriorityMessageQueue<String> queue = new PriorityMessageQueue<>("small", 2, payload -> false,
				Clock.systemUTC());
		queue.enqueue("a", MessagePriority.NORMAL);
		queue.enqueue("b", MessagePriority.URGENT);

		assertThatThrownBy(() -> queue.enqueue("c", MessagePriority.URGENT)).isInstanceOf(McpError.class)
			.hasMessageContaining("full");

		QueueStats stats = queue.stats();
		assertThat(stats.size()).isEqualTo(2);
		assertThat(stats.totalEnqueued()).isEqualTo(2);
		assertThat(stats.totalDropped()).isEqualTo(1);
		assertThat(stats.maxSize()).isEqualTo(2);
	}

	@Test
	void skipsDiscardedPayloadsOnDequeue() {
		Set<String> expired = Set.of("stale");
		PriorityMessageQueue<String> queue = new PriorityMessageQueue<>("test", 10, expired::contains,
				Clock.systemUTC());
		queue.enqueue("stale", MessagePriority.URGENT);
		queue.enqueue("fresh", MessagePriority.NORMAL);

		assertThat(queue.poll().payload()).isEqualTo("fresh");
		assertThat(queue.poll()).isNull();

		QueueStats stats = queue.stats();
		assertThat(stats.totalDequeued()).isEqualTo(1);
		assertThat(stats.totalDropped()).isEqualTo(1);
		assertThat(queue.isEmpty()).isTrue();
	}

	@Test
	void drainReturnsEverythingInDequeueOrder() {
		PriorityMessageQueue<String> queue = new PriorityMessageQueue<>("test");
		queue.enqueue("n", MessagePriority.NORMAL);
		queue.enqueue("u", MessagePriority.URGENT);
		queue.enqueue("h", MessagePriority.HIGH);

		List<QueuedMessage<String>> drained = queue.drain();

		assertThat(drained).extracting(QueuedMessage::payload).containsExactly("u", "h", "n");
		assertThat(queue.size()).isZero();
		assertThat(queue.stats().sizeByPriority()).containsEntry(MessagePriority.URGENT, 0);
	}

	@Test
	void statsReportPerTierDepth() {
		PriorityMessageQueue<String> queue = new PriorityMessageQueue<>("test");
		queue.enqueue("a", MessagePriority.NORMAL);
		queue.enqueue("b", MessagePriority.NORMAL);
		queue.enqueue("c", MessagePriority.HIGH);

		QueueStats stats = queue.stats();

		assertThat(stats.size()).isEqualTo(3);
		assertThat(stats.sizeByPriority()).containsEntry(MessagePriority.NORMAL, 2)
			.containsEntry(MessagePriority.HIGH, 1)
			.containsEntry(MessagePriority.URGENT, 0);
	}

	@Test
	void concurrentProducersLoseNothing() throws Exception {
		PriorityMessageQueue<Integer> queue = new PriorityMessageQueue<>("test", 10_000, payload -> false,
				Clock.systemUTC());
		ExecutorService producers = Executors.newFixedThreadPool(4);
		for (int p = 0; p < 4; p++) {
			int base = p * 1000;
			producers.submit(() -> {
				for (int i = 0; i < 1000; i++) {
					queue.enqueue(base + i, MessagePriority.values()[i % 3]);
				}
			});
		}
		producers.shutdown();
		assertThat(producers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

		Set<Integer> seen = new HashSet<>();
		QueuedMessage<Integer> message;
		while ((message = queue.poll()) != null) {
			seen.add(message.payload());
		}
		assertThat(seen).hasSize(4000);
	}

}
