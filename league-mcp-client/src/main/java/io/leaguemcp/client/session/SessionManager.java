/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.leaguemcp.client.McpClientConfig;
import io.leaguemcp.spec.McpClientTransport;
import io.leaguemcp.spec.McpError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.SessionClosedError;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 以服务器名为键管理会话。
 *
 * <p>
 * 同一服务器名最多只有一个会话：并发的{@link #connect(ServerEndpoint)}共享同一次握手，
 * 握手失败的会话会被移除，下一次连接重新创建。{@link #disconnect(String)}和放弃窗口到期都会移除会话、
 * 停止心跳，并以{@link SessionClosedError}解决该会话的全部在途请求。
 * </p>
 */
public class SessionManager {

	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	/**
	 * 会话生命周期的观察者。
	 */
	public interface SessionListener {

		/**
		 * 会话创建后、握手开始前调用，用于注册通知处理器。
		 * @param session 新会话
		 */
		default void onSessionCreated(McpClientSession session) {
		}

		/**
		 * 握手成功后调用。返回的Mono失败会使连接失败并移除会话。
		 * @param session 已激活的会话
		 * @return 完成信号
		 */
		default Mono<Void> onSessionReady(McpClientSession session) {
			return Mono.empty();
		}

		/**
		 * 会话被移除后调用。
		 * @param serverName 服务器名
		 */
		default void onSessionClosed(String serverName) {
		}

	}

	private record ManagedSession(McpClientSession session, Mono<McpClientSession> ready) {
	}

	private final ConcurrentHashMap<String, ManagedSession> sessions = new ConcurrentHashMap<>();

	private final TransportFactory transportFactory;

	private final McpClientConfig config;

	private final McpSchema.Implementation clientInfo;

	private final Clock clock;

	private final SessionListener listener;

	public SessionManager(TransportFactory transportFactory, McpClientConfig config,
			McpSchema.Implementation clientInfo, Clock clock, SessionListener listener) {
		Assert.notNull(transportFactory, "The transportFactory can not be null");
		Assert.notNull(config, "The config can not be null");
		Assert.notNull(clientInfo, "The clientInfo can not be null");
		Assert.notNull(clock, "The clock can not be null");
		Assert.notNull(listener, "The listener can not be null");
		this.transportFactory = transportFactory;
		this.config = config;
		this.clientInfo = clientInfo;
		this.clock = clock;
		this.listener = listener;
	}

	/**
	 * 连接服务器，或返回已存在的会话。
	 * @param endpoint 服务器描述
	 * @return 握手完成的会话
	 */
	public Mono<McpClientSession> connect(ServerEndpoint endpoint) {
		Assert.notNull(endpoint, "The endpoint can not be null");
		return Mono.defer(() -> {
			ManagedSession managed = this.sessions.computeIfAbsent(endpoint.name(), name -> createSession(endpoint));
			return managed.ready().onErrorResume(error -> {
				if (this.sessions.remove(endpoint.name(), managed)) {
					logger.warn("Failed to connect to '{}': {}", endpoint.name(), error.getMessage());
					return closeSession(managed.session()).then(Mono.<McpClientSession>error(error));
				}
				return Mono.error(error);
			});
		});
	}

	private ManagedSession createSession(ServerEndpoint endpoint) {
		McpClientTransport transport = this.transportFactory.create(endpoint);
		McpClientSession session = new McpClientSession(endpoint, transport, this.config, this.clientInfo,
				this.clock, this::giveUp);
		this.listener.onSessionCreated(session);
		Mono<McpClientSession> ready = session.initialize()
			.then(Mono.defer(() -> this.listener.onSessionReady(session)))
			.thenReturn(session)
			.cache();
		logger.info("Created session {} for '{}' ({})", session.getSessionId(), endpoint.name(), endpoint.kind());
		return new ManagedSession(session, ready);
	}

	/**
	 * 断开并移除会话。未知的服务器名不做任何事。
	 * @param serverName 服务器名
	 * @return 会话关闭后完成的Mono
	 */
	public Mono<Void> disconnect(String serverName) {
		Assert.hasText(serverName, "The serverName can not be empty");
		return Mono.defer(() -> {
			ManagedSession managed = this.sessions.remove(serverName);
			if (managed == null) {
				logger.debug("Disconnect ignored, no session for '{}'", serverName);
				return Mono.empty();
			}
			return closeSession(managed.session());
		});
	}

	private void giveUp(McpClientSession session) {
		ManagedSession managed = this.sessions.get(session.getServerName());
		if (managed == null || managed.session() != session
				|| !this.sessions.remove(session.getServerName(), managed)) {
			return;
		}
		logger.warn("Giving up on '{}', circuit did not close within the configured window", session.getServerName());
		closeSession(session).subscribe(null,
				error -> logger.error("Failed to close abandoned session to '{}'", session.getServerName(), error));
	}

	private Mono<Void> closeSession(McpClientSession session) {
		return session.closeGracefully()
			.onErrorResume(error -> {
				logger.warn("Error closing session to '{}': {}", session.getServerName(), error.getMessage());
				return Mono.empty();
			})
			.then(Mono.fromRunnable(() -> this.listener.onSessionClosed(session.getServerName())));
	}

	/**
	 * @param serverName 服务器名
	 * @return 会话状态
	 * @throws McpError 如果没有该服务器的会话
	 */
	public SessionStatus getSessionStatus(String serverName) {
		ManagedSession managed = this.sessions.get(serverName);
		if (managed == null) {
			throw new McpError("Unknown server: " + serverName);
		}
		return managed.session().status();
	}

	/**
	 * @param serverName 服务器名
	 * @return 会话
	 * @throws SessionClosedError 如果没有该服务器的会话
	 */
	public McpClientSession requireSession(String serverName) {
		ManagedSession managed = this.sessions.get(serverName);
		if (managed == null) {
			throw new SessionClosedError(serverName);
		}
		return managed.session();
	}

	public Optional<McpClientSession> getSession(String serverName) {
		return Optional.ofNullable(this.sessions.get(serverName)).map(ManagedSession::session);
	}

	public List<SessionStatus> statuses() {
		List<SessionStatus> statuses = new ArrayList<>();
		for (ManagedSession managed : this.sessions.values()) {
			statuses.add(managed.session().status());
		}
		statuses.sort(Comparator.comparing(SessionStatus::serverName));
		return statuses;
	}

	public boolean isConnected(String serverName) {
		return this.sessions.containsKey(serverName);
	}

	/**
	 * 断开全部会话。
	 * @return 全部会话关闭后完成的Mono
	 */
	public Mono<Void> closeGracefully() {
		return Flux.fromIterable(new ArrayList<>(this.sessions.keySet())).flatMap(this::disconnect).then();
	}

	public void close() {
		for (String serverName : new ArrayList<>(this.sessions.keySet())) {
			ManagedSession managed = this.sessions.remove(serverName);
			if (managed != null) {
				managed.session().close();
				this.listener.onSessionClosed(serverName);
			}
		}
	}

}
