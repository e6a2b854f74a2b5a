/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.type.TypeReference;
import io.leaguemcp.client.queue.MessagePriority;
import io.leaguemcp.client.resources.ResourceManager;
import io.leaguemcp.client.resources.ResourceSubscription;
import io.leaguemcp.client.resources.ResourceUpdate;
import io.leaguemcp.client.session.McpClientSession;
import io.leaguemcp.client.session.ServerEndpoint;
import io.leaguemcp.client.session.SessionHandle;
import io.leaguemcp.client.session.SessionManager;
import io.leaguemcp.client.session.SessionStatus;
import io.leaguemcp.client.session.TransportFactory;
import io.leaguemcp.client.tools.ToolDescriptor;
import io.leaguemcp.client.tools.ToolRegistry;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 联赛智能体使用的MCP客户端核心，基于Project Reactor的Mono提供非阻塞API。
 *
 * <p>
 * 客户端把以下组件组合在一个入口之后：
 * <ul>
 * <li>{@link SessionManager}：每个服务器一个会话，负责握手、心跳和关闭</li>
 * <li>{@link ToolRegistry}：把{@code server.tool}或唯一的原始工具名解析到提供它的服务器</li>
 * <li>{@link ResourceManager}：资源订阅、变更分发和读取缓存</li>
 * </ul>
 *
 * <p>
 * 调用流程：{@link #callTool(String, Map)}解析工具名，取得所属会话，由会话的连接管理器排队、
 * 按熔断和退避策略分发，并把响应按关联ID交回调用方。所有错误都以{@link io.leaguemcp.spec.McpError}
 * 的子类通过Mono的错误信号返回。
 * </p>
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 * @author Jihoon Kim
 * @see McpClient
 * @see McpSyncClient
 */
public class McpAsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(McpAsyncClient.class);

	private static final TypeReference<McpSchema.ResourceUpdatedNotification> RESOURCE_UPDATED_TYPE_REF = new TypeReference<>() {
	};

	private final McpSchema.Implementation clientInfo;

	private final Clock clock;

	private final SessionManager sessionManager;

	private final ToolRegistry toolRegistry = new ToolRegistry();

	private final ResourceManager resourceManager;

	McpAsyncClient(McpClientConfig config, McpSchema.Implementation clientInfo, Clock clock,
			TransportFactory transportFactory) {
		Assert.notNull(config, "Config must not be null");
		Assert.notNull(clientInfo, "Client info must not be null");
		Assert.notNull(clock, "Clock must not be null");
		Assert.notNull(transportFactory, "Transport factory must not be null");
		this.clientInfo = clientInfo;
		this.clock = clock;
		this.sessionManager = new SessionManager(transportFactory, config, clientInfo, clock, new Lifecycle());
		this.resourceManager = new ResourceManager(this.sessionManager, clock, config.resources().cacheTtl());
	}

	// --------------------------
	// Sessions
	// --------------------------

	/**
	 * 连接服务器：握手，然后发现工具和资源。对同一服务器名重复调用返回已有的会话。
	 * @param endpoint 服务器描述
	 * @return 会话信息
	 */
	public Mono<SessionHandle> connect(ServerEndpoint endpoint) {
		return this.sessionManager.connect(endpoint).map(McpClientSession::handle);
	}

	/**
	 * 断开服务器。该会话的在途调用以{@link io.leaguemcp.spec.SessionClosedError}失败，
	 * 其工具和订阅被移除。
	 * @param serverName 服务器名
	 * @return 完成信号
	 */
	public Mono<Void> disconnect(String serverName) {
		return this.sessionManager.disconnect(serverName);
	}

	/**
	 * @param serverName 服务器名
	 * @return 会话状态
	 * @throws io.leaguemcp.spec.McpError 如果没有该服务器的会话
	 */
	public SessionStatus getSessionStatus(String serverName) {
		return this.sessionManager.getSessionStatus(serverName);
	}

	public HealthReport healthReport() {
		return new HealthReport(this.clock.instant(), this.sessionManager.statuses(), this.toolRegistry.size(),
				this.resourceManager.listResources().size(), this.resourceManager.subscriptionCount(),
				this.resourceManager.cacheSize());
	}

	/**
	 * 把对端通过带外渠道（例如智能体自己的HTTP端点）送来的JSON-RPC消息交给对应会话，
	 * 按与传输层入站消息相同的路径路由。
	 * @param serverName 消息所属的服务器
	 * @param rawMessage 原始JSON文本
	 */
	public void handleInboundMessage(String serverName, String rawMessage) {
		Assert.hasText(rawMessage, "Message must not be empty");
		this.sessionManager.requireSession(serverName).acceptInbound(rawMessage);
	}

	// --------------------------
	// Tools
	// --------------------------

	public List<ToolDescriptor> listTools() {
		return this.toolRegistry.listTools();
	}

	public List<ToolDescriptor> listTools(String serverName) {
		return this.toolRegistry.listTools(serverName);
	}

	/**
	 * 重新发现服务器的工具，服务器不再报告的工具被移除。
	 * @param serverName 服务器名
	 * @return 刷新后的工具
	 */
	public Mono<List<ToolDescriptor>> refreshTools(String serverName) {
		return Mono.defer(() -> refreshTools(this.sessionManager.requireSession(serverName)));
	}

	private Mono<List<ToolDescriptor>> refreshTools(McpClientSession session) {
		return session.listTools()
			.map(tools -> this.toolRegistry.replaceServerTools(session.getServerName(), tools));
	}

	/**
	 * 以NORMAL优先级和会话默认超时调用工具。
	 * @param name 命名空间名或唯一的原始工具名
	 * @param arguments 工具参数
	 * @return 工具调用结果
	 */
	public Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments) {
		return callTool(name, arguments, MessagePriority.NORMAL, null);
	}

	/**
	 * 调用工具。
	 * @param name 命名空间名或唯一的原始工具名
	 * @param arguments 工具参数
	 * @param priority 分发优先级
	 * @param timeout 截止时间，{@code null}表示会话的默认超时
	 * @return 工具调用结果
	 */
	public Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments,
			MessagePriority priority, Duration timeout) {
		return Mono.defer(() -> {
			ToolDescriptor tool = this.toolRegistry.resolve(name);
			return this.sessionManager.requireSession(tool.serverName())
				.callTool(tool.rawName(), arguments, priority, timeout);
		});
	}

	/**
	 * 调用工具并把结果反序列化为指定类型。
	 * @param <T> 结果类型
	 * @param name 命名空间名或唯一的原始工具名
	 * @param arguments 工具参数
	 * @param priority 分发优先级
	 * @param timeout 截止时间，{@code null}表示会话的默认超时
	 * @param resultType 结果类型引用
	 * @return 反序列化后的结果
	 */
	public <T> Mono<T> callTool(String name, Map<String, Object> arguments, MessagePriority priority,
			Duration timeout, TypeReference<T> resultType) {
		return Mono.defer(() -> {
			ToolDescriptor tool = this.toolRegistry.resolve(name);
			return this.sessionManager.requireSession(tool.serverName())
				.callTool(tool.rawName(), arguments, priority, timeout, resultType);
		});
	}

	// --------------------------
	// Resources
	// --------------------------

	public List<McpSchema.Resource> listResources() {
		return this.resourceManager.listResources();
	}

	public Mono<List<McpSchema.Resource>> refreshResources(String serverName) {
		return Mono.defer(() -> refreshResources(this.sessionManager.requireSession(serverName)));
	}

	private Mono<List<McpSchema.Resource>> refreshResources(McpClientSession session) {
		return session.listResources().doOnNext(resources -> this.resourceManager
			.registerResources(session.getServerName(), resources));
	}

	/**
	 * 以客户端名作为订阅者ID订阅资源。
	 * @param uri 资源URI
	 * @param callback 变更回调，在会话的入站分发线程上被调用
	 * @return 订阅
	 */
	public Mono<ResourceSubscription> subscribeResource(String uri, Consumer<ResourceUpdate> callback) {
		return subscribeResource(uri, this.clientInfo.name(), callback);
	}

	public Mono<ResourceSubscription> subscribeResource(String uri, String subscriberId,
			Consumer<ResourceUpdate> callback) {
		return this.resourceManager.subscribe(uri, subscriberId, callback);
	}

	/**
	 * 在指定服务器上订阅资源，不依赖资源发现。
	 * @param serverName 服务器名
	 * @param uri 资源URI
	 * @param subscriberId 订阅者ID
	 * @param callback 变更回调
	 * @return 订阅
	 */
	public Mono<ResourceSubscription> subscribeResource(String serverName, String uri, String subscriberId,
			Consumer<ResourceUpdate> callback) {
		return this.resourceManager.subscribe(serverName, uri, subscriberId, callback);
	}

	public Mono<Void> unsubscribeResource(String uri) {
		return unsubscribeResource(uri, this.clientInfo.name());
	}

	public Mono<Void> unsubscribeResource(String uri, String subscriberId) {
		return this.resourceManager.unsubscribe(uri, subscriberId);
	}

	/**
	 * 读取资源，缓存未过期时不访问服务器。
	 * @param uri 资源URI
	 * @return 资源值
	 */
	public Mono<Object> readResource(String uri) {
		return this.resourceManager.readResource(uri);
	}

	public void invalidateResource(String uri) {
		this.resourceManager.invalidate(uri);
	}

	public void clearResourceCache() {
		this.resourceManager.clearCache();
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	public Mono<Void> closeGracefully() {
		return this.sessionManager.closeGracefully();
	}

	public void close() {
		this.sessionManager.close();
	}

	/**
	 * 为新会话注册通知处理器，在握手后执行发现，在会话关闭后清理工具和订阅。
	 */
	private class Lifecycle implements SessionManager.SessionListener {

		@Override
		public void onSessionCreated(McpClientSession session) {
			String serverName = session.getServerName();
			session.addNotificationHandler(McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED,
					params -> Mono.fromRunnable(() -> resourceManager.onResourceUpdated(serverName,
							session.unmarshalFrom(params, RESOURCE_UPDATED_TYPE_REF))));
			// Refreshes run detached so the inbound dispatcher is never blocked on a round trip.
			session.addNotificationHandler(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, params -> {
				refreshTools(session).subscribe(null,
						error -> logger.warn("Refreshing tools of '{}' failed: {}", serverName, error.getMessage()));
				return Mono.empty();
			});
			session.addNotificationHandler(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED, params -> {
				refreshResources(session).subscribe(null, error -> logger
					.warn("Refreshing resources of '{}' failed: {}", serverName, error.getMessage()));
				return Mono.empty();
			});
		}

		@Override
		public Mono<Void> onSessionReady(McpClientSession session) {
			McpSchema.ServerCapabilities capabilities = session.getServerCapabilities();
			Mono<Void> tools = Mono.empty();
			Mono<Void> resources = Mono.empty();
			if (capabilities != null && capabilities.tools() != null) {
				tools = refreshTools(session).then();
			}
			else {
				logger.info("Server '{}' does not provide tools capability, skipping tool discovery",
						session.getServerName());
			}
			if (capabilities != null && capabilities.resources() != null) {
				resources = refreshResources(session).then();
			}
			return tools.then(resources);
		}

		@Override
		public void onSessionClosed(String serverName) {
			toolRegistry.unregisterServer(serverName);
			resourceManager.removeServer(serverName);
		}

	}

}
