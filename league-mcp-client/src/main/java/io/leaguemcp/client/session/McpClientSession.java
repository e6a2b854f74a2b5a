/*
 * Copyright 2024-2024 原始作者保留所有权利。
 */

package io.leaguemcp.client.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.type.TypeReference;
import io.leaguemcp.client.McpClientConfig;
import io.leaguemcp.client.connection.CircuitBreaker;
import io.leaguemcp.client.connection.ConnectionManager;
import io.leaguemcp.client.connection.HeartbeatMonitor;
import io.leaguemcp.client.queue.MessagePriority;
import io.leaguemcp.spec.McpClientTransport;
import io.leaguemcp.spec.McpProtocolError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.SessionClosedError;
import io.leaguemcp.util.Assert;
import io.leaguemcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 与一个远程服务器的逻辑会话。
 *
 * <p>
 * 会话独占一个{@link ConnectionManager}和一个{@link HeartbeatMonitor}。生命周期：
 * <ol>
 * <li>CONNECTING：连接传输层，发送{@code initialize}，随后发送{@code notifications/initialized}</li>
 * <li>ACTIVE：握手完成后启动心跳</li>
 * <li>DEGRADED：连续心跳失败达到阈值，任一次成功心跳恢复为ACTIVE</li>
 * <li>CLOSED：停止心跳，所有在途请求以{@link SessionClosedError}失败</li>
 * </ol>
 */
public class McpClientSession {

	private static final Logger logger = LoggerFactory.getLogger(McpClientSession.class);

	private static final TypeReference<Void> VOID_TYPE_REFERENCE = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.InitializeResult> INITIALIZE_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ListToolsResult> LIST_TOOLS_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.CallToolResult> CALL_TOOL_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ListResourcesResult> LIST_RESOURCES_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ReadResourceResult> READ_RESOURCE_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private final String sessionId = UUID.randomUUID().toString();

	private final ServerEndpoint endpoint;

	private final ConnectionManager connection;

	private final HeartbeatMonitor heartbeat;

	private final McpClientConfig.HeartbeatConfig heartbeatConfig;

	private final McpSchema.Implementation clientInfo;

	private final Duration requestTimeout;

	private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);

	private final Mono<McpSchema.InitializeResult> initialization;

	private volatile McpSchema.InitializeResult initializeResult;

	private volatile Instant lastHeartbeatAt;

	/**
	 * 创建会话。传输层在{@link #initialize()}之前不会被连接。
	 * @param endpoint 服务器描述
	 * @param transport 会话独占的传输层
	 * @param config 客户端配置
	 * @param clientInfo 握手时发送的客户端信息
	 * @param clock 时钟
	 * @param giveUpHandler 熔断器持续未闭合超过放弃窗口时被调用
	 */
	public McpClientSession(ServerEndpoint endpoint, McpClientTransport transport, McpClientConfig config,
			McpSchema.Implementation clientInfo, Clock clock, Consumer<McpClientSession> giveUpHandler) {
		Assert.notNull(endpoint, "The endpoint can not be null");
		Assert.notNull(config, "The config can not be null");
		Assert.notNull(clientInfo, "The clientInfo can not be null");
		Assert.notNull(giveUpHandler, "The giveUpHandler can not be null");

		this.endpoint = endpoint;
		this.clientInfo = clientInfo;
		this.heartbeatConfig = config.heartbeat();
		this.requestTimeout = endpoint.requestTimeout() != null ? endpoint.requestTimeout()
				: config.session().requestTimeout();
		this.connection = new ConnectionManager(endpoint.name(), transport, config, this.requestTimeout, clock);
		this.heartbeat = new HeartbeatMonitor(endpoint.name(),
				() -> this.connection.ping(this.heartbeatConfig.timeout()), this.connection.getCircuitBreaker(),
				this.heartbeatConfig, config.session().giveUpAfter(), clock, new HeartbeatListener(giveUpHandler));
		this.initialization = Mono.defer(this::doInitialize).cache();
	}

	/**
	 * 注册服务器通知的处理器。必须在{@link #initialize()}之前调用，否则握手期间的通知可能丢失。
	 * @param method 通知方法名
	 * @param handler 处理器
	 */
	public void addNotificationHandler(String method, ConnectionManager.NotificationHandler handler) {
		this.connection.addNotificationHandler(method, handler);
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	/**
	 * 执行MCP握手。结果被缓存，重复调用共享同一次握手。
	 * @return 服务器的初始化结果
	 */
	public Mono<McpSchema.InitializeResult> initialize() {
		return this.initialization;
	}

	private Mono<McpSchema.InitializeResult> doInitialize() {
		McpSchema.InitializeRequest initializeRequest = new McpSchema.InitializeRequest(// @formatter:off
				McpSchema.LATEST_PROTOCOL_VERSION,
				McpSchema.ClientCapabilities.withResourceSubscriptions(),
				this.clientInfo); // @formatter:on

		return this.connection.connect()
			.then(this.connection.sendRequest(McpSchema.METHOD_INITIALIZE, initializeRequest,
					INITIALIZE_RESULT_TYPE_REF, MessagePriority.HIGH, this.requestTimeout))
			.flatMap(result -> {
				logger.info("Server '{}' responded with Protocol: {}, Capabilities: {}, Info: {}", getServerName(),
						result.protocolVersion(), result.capabilities(), result.serverInfo());

				if (!McpSchema.LATEST_PROTOCOL_VERSION.equals(result.protocolVersion())) {
					return Mono.error(new McpProtocolError(
							"Unsupported protocol version from '" + getServerName() + "': " + result.protocolVersion()));
				}
				this.initializeResult = result;
				return this.connection.sendNotification(McpSchema.METHOD_NOTIFICATION_INITIALIZED, null)
					.doOnSuccess(v -> activate())
					.thenReturn(result);
			});
	}

	private void activate() {
		if (!this.state.compareAndSet(SessionState.CONNECTING, SessionState.ACTIVE)) {
			return;
		}
		if (this.heartbeatConfig.enabled()) {
			this.heartbeat.start();
		}
		logger.info("Session {} to '{}' is active", this.sessionId, getServerName());
	}

	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			markClosed();
			return this.connection.closeGracefully();
		});
	}

	public void close() {
		markClosed();
		this.connection.close();
	}

	private void markClosed() {
		this.heartbeat.stop();
		SessionState previous = this.state.getAndSet(SessionState.CLOSED);
		if (previous != SessionState.CLOSED) {
			logger.info("Session {} to '{}' closed (was {})", this.sessionId, getServerName(), previous);
		}
	}

	// --------------------------
	// Tools
	// --------------------------

	/**
	 * 获取服务器的全部工具，自动跟随分页游标。
	 * @return 工具列表
	 */
	public Mono<List<McpSchema.Tool>> listTools() {
		return fetchTools(null)
			.expand(page -> Utils.hasText(page.nextCursor()) ? fetchTools(page.nextCursor()) : Mono.empty())
			.concatMapIterable(page -> page.tools() != null ? page.tools() : List.<McpSchema.Tool>of())
			.collectList();
	}

	private Mono<McpSchema.ListToolsResult> fetchTools(String cursor) {
		return this.connection.sendRequest(McpSchema.METHOD_TOOLS_LIST, cursorParams(cursor),
				LIST_TOOLS_RESULT_TYPE_REF);
	}

	/**
	 * 调用工具。{@code name}是服务器内的原始工具名。
	 * @param name 原始工具名
	 * @param arguments 工具参数
	 * @param priority 分发优先级
	 * @param timeout 截止时间，{@code null}表示会话的默认超时
	 * @return 工具调用结果
	 */
	public Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments,
			MessagePriority priority, Duration timeout) {
		return callTool(name, arguments, priority, timeout, CALL_TOOL_RESULT_TYPE_REF);
	}

	public <T> Mono<T> callTool(String name, Map<String, Object> arguments, MessagePriority priority,
			Duration timeout, TypeReference<T> resultType) {
		Assert.hasText(name, "Tool name must not be empty");
		Assert.notNull(priority, "Priority must not be null");
		McpSchema.CallToolRequest request = new McpSchema.CallToolRequest(name,
				arguments != null ? arguments : Map.of());
		return this.connection.sendRequest(McpSchema.METHOD_TOOLS_CALL, request, resultType, priority,
				timeout != null ? timeout : this.requestTimeout);
	}

	// --------------------------
	// Resources
	// --------------------------

	public Mono<List<McpSchema.Resource>> listResources() {
		return fetchResources(null)
			.expand(page -> Utils.hasText(page.nextCursor()) ? fetchResources(page.nextCursor()) : Mono.empty())
			.concatMapIterable(page -> page.resources() != null ? page.resources() : List.<McpSchema.Resource>of())
			.collectList();
	}

	private Mono<McpSchema.ListResourcesResult> fetchResources(String cursor) {
		return this.connection.sendRequest(McpSchema.METHOD_RESOURCES_LIST, cursorParams(cursor),
				LIST_RESOURCES_RESULT_TYPE_REF);
	}

	public Mono<McpSchema.ReadResourceResult> readResource(String uri) {
		Assert.hasText(uri, "Resource uri must not be empty");
		return this.connection.sendRequest(McpSchema.METHOD_RESOURCES_READ, new McpSchema.ReadResourceRequest(uri),
				READ_RESOURCE_RESULT_TYPE_REF);
	}

	public Mono<Void> subscribeResource(String uri) {
		Assert.hasText(uri, "Resource uri must not be empty");
		return this.connection.sendRequest(McpSchema.METHOD_RESOURCES_SUBSCRIBE, new McpSchema.SubscribeRequest(uri),
				VOID_TYPE_REFERENCE);
	}

	public Mono<Void> unsubscribeResource(String uri) {
		Assert.hasText(uri, "Resource uri must not be empty");
		return this.connection.sendRequest(McpSchema.METHOD_RESOURCES_UNSUBSCRIBE,
				new McpSchema.UnsubscribeRequest(uri), VOID_TYPE_REFERENCE);
	}

	private static Map<String, Object> cursorParams(String cursor) {
		return cursor != null ? Map.of("cursor", cursor) : null;
	}

	// --------------------------
	// Inbound and Observability
	// --------------------------

	/**
	 * 把带外收到的原始JSON-RPC消息交给会话的入站分发路径。
	 * @param rawMessage 原始JSON文本
	 */
	public void acceptInbound(String rawMessage) {
		this.connection.acceptInbound(rawMessage);
	}

	public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
		return this.connection.unmarshalFrom(data, typeRef);
	}

	public SessionStatus status() {
		CircuitBreaker.Snapshot breaker = this.connection.getCircuitBreaker().snapshot();
		return new SessionStatus(getServerName(), this.sessionId, this.state.get(), breaker.state(),
				breaker.consecutiveFailures(), this.lastHeartbeatAt, this.connection.getPendingCount(),
				this.connection.getOutboundQueueStats().size(), this.connection.getTotalRequests(),
				this.connection.getTotalErrors(), this.connection.getInboundQueueStats().totalDropped());
	}

	/**
	 * @return 握手信息，握手完成前为{@code null}
	 */
	public SessionHandle handle() {
		McpSchema.InitializeResult result = this.initializeResult;
		if (result == null) {
			return null;
		}
		return new SessionHandle(getServerName(), this.sessionId, result.protocolVersion(), result.serverInfo(),
				result.capabilities());
	}

	public String getServerName() {
		return this.endpoint.name();
	}

	public String getSessionId() {
		return this.sessionId;
	}

	public ServerEndpoint getEndpoint() {
		return this.endpoint;
	}

	public SessionState getState() {
		return this.state.get();
	}

	public Instant getLastHeartbeatAt() {
		return this.lastHeartbeatAt;
	}

	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		McpSchema.InitializeResult result = this.initializeResult;
		return result != null ? result.capabilities() : null;
	}

	ConnectionManager getConnection() {
		return this.connection;
	}

	HeartbeatMonitor getHeartbeat() {
		return this.heartbeat;
	}

	private class HeartbeatListener implements HeartbeatMonitor.Listener {

		private final Consumer<McpClientSession> giveUpHandler;

		HeartbeatListener(Consumer<McpClientSession> giveUpHandler) {
			this.giveUpHandler = giveUpHandler;
		}

		@Override
		public void onHeartbeatSuccess(Instant at) {
			lastHeartbeatAt = at;
			if (state.compareAndSet(SessionState.DEGRADED, SessionState.ACTIVE)) {
				logger.info("Session to '{}' recovered from DEGRADED", getServerName());
			}
		}

		@Override
		public void onHeartbeatFailure(int consecutiveFailures, boolean degraded) {
			if (degraded && state.compareAndSet(SessionState.ACTIVE, SessionState.DEGRADED)) {
				logger.warn("Session to '{}' marked DEGRADED after {} missed heartbeat(s)", getServerName(),
						consecutiveFailures);
			}
		}

		@Override
		public void onGiveUp(Duration unhealthyFor) {
			this.giveUpHandler.accept(McpClientSession.this);
		}

	}

}
