/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.type.TypeReference;
import io.leaguemcp.client.queue.MessagePriority;
import io.leaguemcp.client.resources.ResourceSubscription;
import io.leaguemcp.client.resources.ResourceUpdate;
import io.leaguemcp.client.session.ServerEndpoint;
import io.leaguemcp.client.session.SessionHandle;
import io.leaguemcp.client.session.SessionStatus;
import io.leaguemcp.client.tools.ToolDescriptor;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 封装{@link McpAsyncClient}的阻塞式客户端，供不使用响应式编程的智能体代码调用。
 *
 * <p>
 * 每个操作都阻塞到异步结果完成。调用自身的截止时间由会话的连接管理器保证，
 * 因此这里不再叠加额外的阻塞超时。错误以{@link io.leaguemcp.spec.McpError}的子类直接抛出。
 * </p>
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 * @author Jihoon Kim
 * @see McpClient
 * @see McpAsyncClient
 */
public class McpSyncClient implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpSyncClient.class);

	private static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(10);

	private final McpAsyncClient delegate;

	McpSyncClient(McpAsyncClient delegate) {
		Assert.notNull(delegate, "The delegate can not be null");
		this.delegate = delegate;
	}

	public SessionHandle connect(ServerEndpoint endpoint) {
		return this.delegate.connect(endpoint).block();
	}

	public void disconnect(String serverName) {
		this.delegate.disconnect(serverName).block();
	}

	public SessionStatus getSessionStatus(String serverName) {
		return this.delegate.getSessionStatus(serverName);
	}

	public HealthReport healthReport() {
		return this.delegate.healthReport();
	}

	public void handleInboundMessage(String serverName, String rawMessage) {
		this.delegate.handleInboundMessage(serverName, rawMessage);
	}

	// --------------------------
	// Tools
	// --------------------------

	public List<ToolDescriptor> listTools() {
		return this.delegate.listTools();
	}

	public List<ToolDescriptor> listTools(String serverName) {
		return this.delegate.listTools(serverName);
	}

	public List<ToolDescriptor> refreshTools(String serverName) {
		return this.delegate.refreshTools(serverName).block();
	}

	public McpSchema.CallToolResult callTool(String name, Map<String, Object> arguments) {
		return this.delegate.callTool(name, arguments).block();
	}

	public McpSchema.CallToolResult callTool(String name, Map<String, Object> arguments, MessagePriority priority,
			Duration timeout) {
		return this.delegate.callTool(name, arguments, priority, timeout).block();
	}

	public <T> T callTool(String name, Map<String, Object> arguments, MessagePriority priority, Duration timeout,
			TypeReference<T> resultType) {
		return this.delegate.callTool(name, arguments, priority, timeout, resultType).block();
	}

	// --------------------------
	// Resources
	// --------------------------

	public List<McpSchema.Resource> listResources() {
		return this.delegate.listResources();
	}

	public List<McpSchema.Resource> refreshResources(String serverName) {
		return this.delegate.refreshResources(serverName).block();
	}

	public ResourceSubscription subscribeResource(String uri, Consumer<ResourceUpdate> callback) {
		return this.delegate.subscribeResource(uri, callback).block();
	}

	public ResourceSubscription subscribeResource(String uri, String subscriberId, Consumer<ResourceUpdate> callback) {
		return this.delegate.subscribeResource(uri, subscriberId, callback).block();
	}

	public ResourceSubscription subscribeResource(String serverName, String uri, String subscriberId,
			Consumer<ResourceUpdate> callback) {
		return this.delegate.subscribeResource(serverName, uri, subscriberId, callback).block();
	}

	public void unsubscribeResource(String uri) {
		this.delegate.unsubscribeResource(uri).block();
	}

	public void unsubscribeResource(String uri, String subscriberId) {
		this.delegate.unsubscribeResource(uri, subscriberId).block();
	}

	/**
	 * @param uri 资源URI
	 * @return 资源值，服务器没有返回内容时为{@code null}
	 */
	public Object readResource(String uri) {
		return this.delegate.readResource(uri).block();
	}

	public void invalidateResource(String uri) {
		this.delegate.invalidateResource(uri);
	}

	public void clearResourceCache() {
		this.delegate.clearResourceCache();
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	/**
	 * 关闭全部会话并等待完成。
	 * @return 在超时之前关闭完成时为{@code true}
	 */
	public boolean closeGracefully() {
		try {
			this.delegate.closeGracefully().block(DEFAULT_CLOSE_TIMEOUT);
		}
		catch (RuntimeException e) {
			logger.warn("Client didn't close within timeout of {} ms.", DEFAULT_CLOSE_TIMEOUT.toMillis(), e);
			return false;
		}
		return true;
	}

	@Override
	public void close() {
		this.delegate.close();
	}

}
