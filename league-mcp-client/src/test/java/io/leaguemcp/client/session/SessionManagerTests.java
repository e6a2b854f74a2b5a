/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.session;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import io.leaguemcp.client.McpClientConfig;
import io.leaguemcp.client.MockMcpClientTransport;
import io.leaguemcp.client.MutableClock;
import io.leaguemcp.client.queue.MessagePriority;
import io.leaguemcp.spec.McpError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.McpTransportError;
import io.leaguemcp.spec.SessionClosedError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Timeout(15)
class SessionManagerTests {

	private static final ServerEndpoint GAME_SERVER = ServerEndpoint.http("game_server", "http://localhost:9001");

	private static final McpClientConfig QUIET = McpClientConfig.defaults()
		.withHeartbeat(McpClientConfig.HeartbeatConfig.disabled());

	private final List<MockMcpClientTransport> transports = new CopyOnWriteArrayList<>();

	private final List<String> events = new CopyOnWriteArrayList<>();

	private final MutableClock clock = new MutableClock();

	private volatile boolean failFirstHandshake;

	private SessionManager manager;

	private SessionManager manager(McpClientConfig config, SessionManager.SessionListener listener) {
		this.manager = new SessionManager(endpoint -> {
			MockMcpClientTransport transport = new MockMcpClientTransport();
			if (this.failFirstHandshake && this.transports.isEmpty()) {
				transport.replyError(McpSchema.METHOD_INITIALIZE, McpSchema.ErrorCodes.INTERNAL_ERROR, "not ready");
			}
			this.transports.add(transport);
			return transport;
		}, config, new McpSchema.Implementation("referee-R01", "1.0.0"), this.clock, listener);
		return this.manager;
	}

	private SessionManager manager(McpClientConfig config) {
		return manager(config, new RecordingListener());
	}

	@AfterEach
	void tearDown() {
		if (this.manager != null) {
			this.manager.close();
		}
	}

	@Test
	void repeatedConnectReusesSession() {
		SessionManager manager = manager(QUIET);

		McpClientSession first = manager.connect(GAME_SERVER).block();
		McpClientSession second = manager.connect(GAME_SERVER).block();

		assertThat(second).isSameAs(first);
		assertThat(this.transports).hasSize(1);
		assertThat(this.transports.get(0).count(McpSchema.METHOD_INITIALIZE)).isEqualTo(1);
		assertThat(manager.isConnected("game_server")).isTrue();
		assertThat(this.events).containsExactly("created:game_server", "ready:game_server");
	}

	@Test
	void concurrentConnectSharesHandshake() {
		SessionManager manager = manager(QUIET);

		List<McpClientSession> sessions = Mono
			.zip(manager.connect(GAME_SERVER), manager.connect(GAME_SERVER), manager.connect(GAME_SERVER))
			.map(tuple -> List.of(tuple.getT1(), tuple.getT2(), tuple.getT3()))
			.block(Duration.ofSeconds(5));

		assertThat(sessions).hasSize(3).allMatch(session -> session == sessions.get(0));
		assertThat(this.transports).hasSize(1);
	}

	@Test
	void failedHandshakeRemovesSessionSoNextConnectRetries() {
		this.failFirstHandshake = true;
		SessionManager manager = manager(QUIET);

		StepVerifier.create(manager.connect(GAME_SERVER)).verifyError(McpError.class);

		assertThat(manager.isConnected("game_server")).isFalse();
		assertThat(this.transports.get(0).isClosed()).isTrue();
		assertThat(this.events).containsExactly("created:game_server", "closed:game_server");

		StepVerifier.create(manager.connect(GAME_SERVER))
			.assertNext(session -> assertThat(session.getState()).isEqualTo(SessionState.ACTIVE))
			.verifyComplete();
		assertThat(this.transports).hasSize(2);
	}

	@Test
	void failingReadyListenerFailsConnect() {
		SessionManager manager = manager(QUIET, new SessionManager.SessionListener() {
			@Override
			public Mono<Void> onSessionReady(McpClientSession session) {
				return Mono.error(new McpTransportError("discovery failed"));
			}
		});

		StepVerifier.create(manager.connect(GAME_SERVER)).verifyError(McpTransportError.class);

		assertThat(manager.isConnected("game_server")).isFalse();
		assertThat(manager.getSession("game_server")).isEmpty();
	}

	@Test
	void disconnectFailsPendingCallsAndNotifiesListener() {
		SessionManager manager = manager(QUIET);
		McpClientSession session = manager.connect(GAME_SERVER).block();
		this.transports.get(0).neverReply(McpSchema.METHOD_TOOLS_CALL);
		List<Throwable> errors = new CopyOnWriteArrayList<>();
		session.callTool("get_state", Map.of(), MessagePriority.NORMAL, Duration.ofSeconds(30))
			.subscribe(null, errors::add);
		await().atMost(Duration.ofSeconds(2))
			.until(() -> this.transports.get(0).count(McpSchema.METHOD_TOOLS_CALL) == 1);

		manager.disconnect("game_server").block();

		await().atMost(Duration.ofSeconds(2)).until(() -> errors.size() == 1);
		assertThat(errors.get(0)).isInstanceOf(SessionClosedError.class);
		assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
		assertThat(manager.isConnected("game_server")).isFalse();
		assertThat(this.events).endsWith("closed:game_server");
	}

	@Test
	void disconnectOfUnknownServerIsNoOp() {
		SessionManager manager = manager(QUIET);

		StepVerifier.create(manager.disconnect("nobody")).verifyComplete();

		assertThat(this.events).isEmpty();
	}

	@Test
	void lookupsOfUnknownServerFail() {
		SessionManager manager = manager(QUIET);

		assertThatThrownBy(() -> manager.getSessionStatus("nobody")).isInstanceOf(McpError.class)
			.hasMessageContaining("Unknown server: nobody");
		assertThatThrownBy(() -> manager.requireSession("nobody")).isInstanceOf(SessionClosedError.class);
	}

	@Test
	void statusesAreSortedByServerName() {
		SessionManager manager = manager(QUIET);
		manager.connect(ServerEndpoint.http("league_server", "http://localhost:8000")).block();
		manager.connect(GAME_SERVER).block();

		assertThat(manager.statuses()).extracting(SessionStatus::serverName)
			.containsExactly("game_server", "league_server");
	}

	@Test
	void abandonsSessionWhenCircuitStaysOpenPastGiveUpWindow() {
		McpClientConfig config = McpClientConfig.defaults()
			.withHeartbeat(new McpClientConfig.HeartbeatConfig(true, Duration.ofMillis(50), Duration.ofSeconds(1), 3))
			.withCircuitBreaker(new McpClientConfig.CircuitBreakerConfig(1, Duration.ofSeconds(30)))
			.withSession(new McpClientConfig.SessionConfig(Duration.ofSeconds(5), Duration.ofMinutes(1)));
		SessionManager manager = manager(config);
		McpClientSession session = manager.connect(GAME_SERVER).block();
		this.transports.get(0).fail(McpSchema.METHOD_PING, () -> new McpTransportError("connection refused"));

		await().atMost(Duration.ofSeconds(3))
			.until(() -> session.getConnection().getCircuitBreaker().snapshot().openedAt() != null);
		this.clock.advance(Duration.ofMinutes(2));

		await().atMost(Duration.ofSeconds(3)).until(() -> !manager.isConnected("game_server"));
		await().atMost(Duration.ofSeconds(3)).until(() -> this.events.contains("closed:game_server"));
		assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
	}

	private class RecordingListener implements SessionManager.SessionListener {

		@Override
		public void onSessionCreated(McpClientSession session) {
			events.add("created:" + session.getServerName());
		}

		@Override
		public Mono<Void> onSessionReady(McpClientSession session) {
			return Mono.fromRunnable(() -> events.add("ready:" + session.getServerName()));
		}

		@Override
		public void onSessionClosed(String serverName) {
			events.add("closed:" + serverName);
		}

	}

}
