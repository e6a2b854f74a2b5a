/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client;

import java.time.Clock;
import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leaguemcp.client.session.TransportFactory;
import io.leaguemcp.spec.McpSchema.Implementation;
import io.leaguemcp.util.Assert;

/**
 * 创建联赛MCP客户端的工厂。
 *
 * <p>
 * 创建异步客户端的示例：<pre>{@code
 * McpAsyncClient client = McpClient.async()
 *     .clientInfo(new Implementation("player-P01", "1.0.0"))
 *     .requestTimeout(Duration.ofSeconds(5))
 *     .build();
 * client.connect(ServerEndpoint.http("league_server", "http://localhost:8000")).block();
 * client.callTool("league_server.get_standings", Map.of()).block();
 * }</pre>
 *
 * <p>
 * 未指定配置时使用{@link McpClientConfig#loadDefaults()}，即类路径上的
 * {@value McpClientConfig#DEFAULTS_RESOURCE}或内置默认值。
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 * @see McpAsyncClient
 * @see McpSyncClient
 */
public interface McpClient {

	/** 未指定时握手发送的客户端信息 */
	Implementation DEFAULT_CLIENT_INFO = new Implementation("league-mcp-client", "0.1.0");

	static SyncSpec sync() {
		return new SyncSpec();
	}

	static AsyncSpec async() {
		return new AsyncSpec();
	}

	/**
	 * 同步客户端规范，在{@link AsyncSpec}之上构建阻塞式客户端。
	 */
	class SyncSpec {

		private final AsyncSpec delegate = new AsyncSpec();

		private SyncSpec() {
		}

		public SyncSpec config(McpClientConfig config) {
			this.delegate.config(config);
			return this;
		}

		public SyncSpec requestTimeout(Duration requestTimeout) {
			this.delegate.requestTimeout(requestTimeout);
			return this;
		}

		public SyncSpec clientInfo(Implementation clientInfo) {
			this.delegate.clientInfo(clientInfo);
			return this;
		}

		public SyncSpec clock(Clock clock) {
			this.delegate.clock(clock);
			return this;
		}

		public SyncSpec objectMapper(ObjectMapper objectMapper) {
			this.delegate.objectMapper(objectMapper);
			return this;
		}

		public SyncSpec transportFactory(TransportFactory transportFactory) {
			this.delegate.transportFactory(transportFactory);
			return this;
		}

		public McpSyncClient build() {
			return new McpSyncClient(this.delegate.build());
		}

	}

	/**
	 * 异步客户端规范。
	 */
	class AsyncSpec {

		private McpClientConfig config;

		private Duration requestTimeout;

		private Implementation clientInfo = DEFAULT_CLIENT_INFO;

		private Clock clock = Clock.systemUTC();

		private ObjectMapper objectMapper;

		private TransportFactory transportFactory;

		private AsyncSpec() {
		}

		/**
		 * 设置客户端配置。未设置时读取类路径上的默认配置。
		 * @param config 客户端配置
		 * @return 当前规范
		 */
		public AsyncSpec config(McpClientConfig config) {
			Assert.notNull(config, "Config must not be null");
			this.config = config;
			return this;
		}

		/**
		 * 覆盖配置中的默认请求超时。单个服务器的超时可以在
		 * {@link io.leaguemcp.client.session.ServerEndpoint}上再次覆盖。
		 * @param requestTimeout 默认请求超时
		 * @return 当前规范
		 */
		public AsyncSpec requestTimeout(Duration requestTimeout) {
			Assert.positive(requestTimeout, "Request timeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public AsyncSpec clientInfo(Implementation clientInfo) {
			Assert.notNull(clientInfo, "Client info must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		public AsyncSpec clock(Clock clock) {
			Assert.notNull(clock, "Clock must not be null");
			this.clock = clock;
			return this;
		}

		public AsyncSpec objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * 替换传输层的创建方式，默认按服务器描述创建HTTP或stdio传输。
		 * @param transportFactory 传输工厂
		 * @return 当前规范
		 */
		public AsyncSpec transportFactory(TransportFactory transportFactory) {
			Assert.notNull(transportFactory, "Transport factory must not be null");
			this.transportFactory = transportFactory;
			return this;
		}

		public McpAsyncClient build() {
			McpClientConfig resolved = this.config != null ? this.config : McpClientConfig.loadDefaults();
			if (this.requestTimeout != null) {
				resolved = resolved.withSession(
						new McpClientConfig.SessionConfig(this.requestTimeout, resolved.session().giveUpAfter()));
			}
			TransportFactory factory = this.transportFactory;
			if (factory == null) {
				factory = TransportFactory
					.defaultFactory(this.objectMapper != null ? this.objectMapper : new ObjectMapper());
			}
			return new McpAsyncClient(resolved, this.clientInfo, this.clock, factory);
		}

	}

}
