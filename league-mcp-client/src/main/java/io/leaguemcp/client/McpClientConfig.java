/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.leaguemcp.util.Assert;

/**
 * 客户端核心的全部可调参数。
 *
 * <p>
 * 配置由外部加载器提供，核心本身不拥有配置文件。{@link #load(InputStream)}读取如下形式的JSON，
 * 时长一律以秒为单位（可以是小数），缺失的键取默认值：
 *
 * <pre>
 * {
 *   "retry":           { "max_attempts": 3, "base_delay": 1.0, "max_delay": 30.0 },
 *   "circuit_breaker": { "failure_threshold": 5, "recovery_timeout": 30.0 },
 *   "heartbeat":       { "enabled": true, "interval_seconds": 10, "timeout_seconds": 5, "failure_threshold": 3 },
 *   "queue":           { "max_size": 1000, "poll_interval": 0.1 },
 *   "session":         { "request_timeout": 30.0, "give_up_after": 300.0 },
 *   "resources":       { "cache_ttl": 60.0 }
 * }
 * </pre>
 *
 * @param retry 重试与退避
 * @param circuitBreaker 熔断器
 * @param heartbeat 心跳
 * @param queue 分发队列
 * @param session 会话级超时
 * @param resources 资源缓存
 */
public record McpClientConfig(RetryConfig retry, CircuitBreakerConfig circuitBreaker, HeartbeatConfig heartbeat,
		QueueConfig queue, SessionConfig session, ResourceConfig resources) {

	/** 类路径上的默认配置文件 */
	public static final String DEFAULTS_RESOURCE = "/league-mcp-client.json";

	public McpClientConfig {
		Assert.notNull(retry, "retry config must not be null");
		Assert.notNull(circuitBreaker, "circuitBreaker config must not be null");
		Assert.notNull(heartbeat, "heartbeat config must not be null");
		Assert.notNull(queue, "queue config must not be null");
		Assert.notNull(session, "session config must not be null");
		Assert.notNull(resources, "resources config must not be null");
	}

	/**
	 * @param maxAttempts 单次调用的最大尝试次数（含首次）
	 * @param baseDelay 退避基数
	 * @param maxDelay 退避上限
	 */
	public record RetryConfig(int maxAttempts, Duration baseDelay, Duration maxDelay) {

		public RetryConfig {
			Assert.isTrue(maxAttempts >= 1, "maxAttempts must be at least 1");
			Assert.positive(baseDelay, "baseDelay must be positive");
			Assert.positive(maxDelay, "maxDelay must be positive");
		}

		public static RetryConfig defaults() {
			return new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(30));
		}

	}

	/**
	 * @param failureThreshold 触发打开的连续失败次数
	 * @param recoveryTimeout 打开后允许探测前的冷却时间
	 */
	public record CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout) {

		public CircuitBreakerConfig {
			Assert.isTrue(failureThreshold >= 1, "failureThreshold must be at least 1");
			Assert.positive(recoveryTimeout, "recoveryTimeout must be positive");
		}

		public static CircuitBreakerConfig defaults() {
			return new CircuitBreakerConfig(5, Duration.ofSeconds(30));
		}

	}

	/**
	 * @param enabled 是否启动心跳
	 * @param interval 心跳间隔
	 * @param timeout 单次心跳的截止时间
	 * @param failureThreshold 将会话标记为DEGRADED的连续心跳失败次数
	 */
	public record HeartbeatConfig(boolean enabled, Duration interval, Duration timeout, int failureThreshold) {

		public HeartbeatConfig {
			Assert.positive(interval, "interval must be positive");
			Assert.positive(timeout, "timeout must be positive");
			Assert.isTrue(failureThreshold >= 1, "failureThreshold must be at least 1");
		}

		public static HeartbeatConfig defaults() {
			return new HeartbeatConfig(true, Duration.ofSeconds(10), Duration.ofSeconds(5), 3);
		}

		public static HeartbeatConfig disabled() {
			return new HeartbeatConfig(false, Duration.ofSeconds(10), Duration.ofSeconds(5), 3);
		}

	}

	/**
	 * @param maxSize 每个队列的容量
	 * @param pollInterval 分发循环检查关闭标志的最长间隔
	 */
	public record QueueConfig(int maxSize, Duration pollInterval) {

		public QueueConfig {
			Assert.isTrue(maxSize >= 1, "maxSize must be at least 1");
			Assert.positive(pollInterval, "pollInterval must be positive");
		}

		public static QueueConfig defaults() {
			return new QueueConfig(1000, Duration.ofMillis(100));
		}

	}

	/**
	 * @param requestTimeout 应用调用的默认截止时间
	 * @param giveUpAfter 熔断器持续未闭合多久后销毁会话，{@link Duration#ZERO}表示永不放弃
	 */
	public record SessionConfig(Duration requestTimeout, Duration giveUpAfter) {

		public SessionConfig {
			Assert.positive(requestTimeout, "requestTimeout must be positive");
			Assert.isTrue(giveUpAfter != null && !giveUpAfter.isNegative(), "giveUpAfter must not be negative");
		}

		public static SessionConfig defaults() {
			return new SessionConfig(Duration.ofSeconds(30), Duration.ofMinutes(5));
		}

	}

	/**
	 * @param cacheTtl 资源读取缓存的有效期
	 */
	public record ResourceConfig(Duration cacheTtl) {

		public ResourceConfig {
			Assert.positive(cacheTtl, "cacheTtl must be positive");
		}

		public static ResourceConfig defaults() {
			return new ResourceConfig(Duration.ofSeconds(60));
		}

	}

	public static McpClientConfig defaults() {
		return new McpClientConfig(RetryConfig.defaults(), CircuitBreakerConfig.defaults(), HeartbeatConfig.defaults(),
				QueueConfig.defaults(), SessionConfig.defaults(), ResourceConfig.defaults());
	}

	public McpClientConfig withRetry(RetryConfig retry) {
		return new McpClientConfig(retry, this.circuitBreaker, this.heartbeat, this.queue, this.session,
				this.resources);
	}

	public McpClientConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
		return new McpClientConfig(this.retry, circuitBreaker, this.heartbeat, this.queue, this.session,
				this.resources);
	}

	public McpClientConfig withHeartbeat(HeartbeatConfig heartbeat) {
		return new McpClientConfig(this.retry, this.circuitBreaker, heartbeat, this.queue, this.session,
				this.resources);
	}

	public McpClientConfig withQueue(QueueConfig queue) {
		return new McpClientConfig(this.retry, this.circuitBreaker, this.heartbeat, queue, this.session,
				this.resources);
	}

	public McpClientConfig withSession(SessionConfig session) {
		return new McpClientConfig(this.retry, this.circuitBreaker, this.heartbeat, this.queue, session,
				this.resources);
	}

	public McpClientConfig withResources(ResourceConfig resources) {
		return new McpClientConfig(this.retry, this.circuitBreaker, this.heartbeat, this.queue, this.session,
				resources);
	}

	/**
	 * 读取类路径上的默认配置。
	 * @return 默认配置
	 */
	public static McpClientConfig loadDefaults() {
		try (InputStream in = McpClientConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (in == null) {
				return defaults();
			}
			return load(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
		}
	}

	/**
	 * 从JSON读取配置，缺失的键取默认值。
	 * @param in JSON输入流
	 * @return 配置
	 * @throws UncheckedIOException 如果输入不是合法的JSON
	 */
	public static McpClientConfig load(InputStream in) {
		Assert.notNull(in, "input stream must not be null");
		JsonNode root;
		try {
			root = new ObjectMapper().readTree(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to parse client configuration", e);
		}
		if (root == null) {
			root = MissingNode.getInstance();
		}

		McpClientConfig d = defaults();

		JsonNode retry = root.path("retry");
		JsonNode breaker = root.path("circuit_breaker");
		JsonNode heartbeat = root.path("heartbeat");
		JsonNode queue = root.path("queue");
		JsonNode session = root.path("session");
		JsonNode resources = root.path("resources");

		return new McpClientConfig(
				new RetryConfig(retry.path("max_attempts").asInt(d.retry().maxAttempts()),
						seconds(retry, "base_delay", d.retry().baseDelay()),
						seconds(retry, "max_delay", d.retry().maxDelay())),
				new CircuitBreakerConfig(breaker.path("failure_threshold").asInt(d.circuitBreaker().failureThreshold()),
						seconds(breaker, "recovery_timeout", d.circuitBreaker().recoveryTimeout())),
				new HeartbeatConfig(heartbeat.path("enabled").asBoolean(d.heartbeat().enabled()),
						seconds(heartbeat, "interval_seconds", d.heartbeat().interval()),
						seconds(heartbeat, "timeout_seconds", d.heartbeat().timeout()),
						heartbeat.path("failure_threshold").asInt(d.heartbeat().failureThreshold())),
				new QueueConfig(queue.path("max_size").asInt(d.queue().maxSize()),
						seconds(queue, "poll_interval", d.queue().pollInterval())),
				new SessionConfig(seconds(session, "request_timeout", d.session().requestTimeout()),
						seconds(session, "give_up_after", d.session().giveUpAfter())),
				new ResourceConfig(seconds(resources, "cache_ttl", d.resources().cacheTtl())));
	}

	private static Duration seconds(JsonNode section, String key, Duration defaultValue) {
		JsonNode node = section.path(key);
		if (!node.isNumber()) {
			return defaultValue;
		}
		return Duration.ofNanos(Math.round(node.asDouble() * 1_000_000_000d));
	}

}
