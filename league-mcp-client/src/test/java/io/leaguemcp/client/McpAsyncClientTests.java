/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import io.leaguemcp.client.connection.CircuitBreaker;
import io.leaguemcp.client.queue.MessagePriority;
import io.leaguemcp.client.resources.ResourceUpdate;
import io.leaguemcp.client.session.ServerEndpoint;
import io.leaguemcp.client.session.SessionState;
import io.leaguemcp.client.session.SessionStatus;
import io.leaguemcp.client.tools.ToolDescriptor;
import io.leaguemcp.spec.AmbiguousToolNameError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.McpTimeoutError;
import io.leaguemcp.spec.ToolNotFoundError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * 以内存中的服务器替身对{@link McpAsyncClient}做端到端测试：连接、发现、调用和资源订阅。
 */
@Timeout(30)
class McpAsyncClientTests {

	private static final String STANDINGS = "league://standings";

	private static final McpSchema.Implementation PLAYER = new McpSchema.Implementation("player-P01", "1.0.0");

	private final Map<String, MockMcpClientTransport> servers = new ConcurrentHashMap<>();

	private McpAsyncClient client;

	@BeforeEach
	void setUp() {
		MockMcpClientTransport league = server("league_server", MockMcpClientTransport.FULL_CAPABILITIES);
		tools(league, "get_standings", "register_player");
		league.reply(McpSchema.METHOD_RESOURCES_LIST, params -> new McpSchema.ListResourcesResult(
				List.of(new McpSchema.Resource(STANDINGS, "standings", "League table", "application/json")), null));
		league.reply(McpSchema.METHOD_RESOURCES_SUBSCRIBE, params -> Map.of());
		league.reply(McpSchema.METHOD_TOOLS_CALL, params -> {
			McpSchema.CallToolRequest request = (McpSchema.CallToolRequest) params;
			return new McpSchema.CallToolResult(List.of(McpSchema.Content.text("called " + request.name())), false);
		});

		tools(server("game_server", MockMcpClientTransport.FULL_CAPABILITIES), "get_state", "make_move");
		tools(server("data_server", MockMcpClientTransport.FULL_CAPABILITIES), "get_state");

		this.client = McpClient.async()
			.config(McpClientConfig.defaults().withHeartbeat(McpClientConfig.HeartbeatConfig.disabled()))
			.clientInfo(PLAYER)
			.transportFactory(endpoint -> this.servers.get(endpoint.name()))
			.build();
	}

	@AfterEach
	void tearDown() {
		this.client.close();
	}

	private MockMcpClientTransport server(String name, McpSchema.ServerCapabilities capabilities) {
		MockMcpClientTransport transport = new MockMcpClientTransport(capabilities);
		this.servers.put(name, transport);
		return transport;
	}

	private static void tools(MockMcpClientTransport server, String... names) {
		List<McpSchema.Tool> tools = Arrays.stream(names)
			.map(name -> new McpSchema.Tool(name, "Tool " + name, Map.of("type", "object")))
			.toList();
		server.reply(McpSchema.METHOD_TOOLS_LIST, params -> new McpSchema.ListToolsResult(tools, null));
	}

	private void connect(String name) {
		this.client.connect(ServerEndpoint.http(name, "http://localhost:8000")).block(Duration.ofSeconds(5));
	}

	@Test
	void connectHandshakesAndDiscovers() {
		StepVerifier.create(this.client.connect(ServerEndpoint.http("league_server", "http://localhost:8000")))
			.assertNext(handle -> {
				assertThat(handle.serverName()).isEqualTo("league_server");
				assertThat(handle.protocolVersion()).isEqualTo(McpSchema.LATEST_PROTOCOL_VERSION);
				assertThat(handle.serverInfo().name()).isEqualTo("mock-server");
			})
			.verifyComplete();

		assertThat(this.client.listTools()).extracting(ToolDescriptor::namespacedName)
			.containsExactly("league_server.get_standings", "league_server.register_player");
		assertThat(this.client.listResources()).extracting(McpSchema.Resource::uri).containsExactly(STANDINGS);
		McpSchema.InitializeRequest initialize = (McpSchema.InitializeRequest) this.servers.get("league_server")
			.requests(McpSchema.METHOD_INITIALIZE)
			.get(0)
			.params();
		assertThat(initialize.clientInfo()).isEqualTo(PLAYER);
	}

	@Test
	void callsNamespacedToolWithRawNameOnTheWire() {
		connect("league_server");

		StepVerifier.create(this.client.callTool("league_server.get_standings", Map.of("league_id", "L1")))
			.assertNext(result -> assertThat(result.content().get(0).text()).isEqualTo("called get_standings"))
			.verifyComplete();

		McpSchema.CallToolRequest sent = (McpSchema.CallToolRequest) this.servers.get("league_server")
			.requests(McpSchema.METHOD_TOOLS_CALL)
			.get(0)
			.params();
		assertThat(sent.name()).isEqualTo("get_standings");
		assertThat(sent.arguments()).containsEntry("league_id", "L1");
	}

	@Test
	void rawNameSharedByTwoServersIsAmbiguous() {
		connect("game_server");
		connect("data_server");

		StepVerifier.create(this.client.callTool("get_state", Map.of())).verifyError(AmbiguousToolNameError.class);
		StepVerifier.create(this.client.callTool("make_move", Map.of()))
			.expectErrorSatisfies(error -> assertThat(error).isNotInstanceOf(AmbiguousToolNameError.class))
			.verify();

		assertThat(this.servers.get("game_server").count(McpSchema.METHOD_TOOLS_CALL)).isEqualTo(1);
		assertThat(this.servers.get("data_server").count(McpSchema.METHOD_TOOLS_CALL)).isZero();
	}

	@Test
	void unknownToolFailsWithoutNetworkTraffic() {
		connect("league_server");

		StepVerifier.create(this.client.callTool("league_server.resign", Map.of()))
			.verifyError(ToolNotFoundError.class);

		assertThat(this.servers.get("league_server").count(McpSchema.METHOD_TOOLS_CALL)).isZero();
	}

	@Test
	void timeoutIsReportedAndCountedByCircuitBreaker() {
		connect("league_server");
		this.servers.get("league_server").neverReply(McpSchema.METHOD_TOOLS_CALL);

		StepVerifier
			.create(this.client.callTool("league_server.get_standings", Map.of(), MessagePriority.HIGH,
					Duration.ofMillis(150)))
			.verifyError(McpTimeoutError.class);

		await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
			SessionStatus status = this.client.getSessionStatus("league_server");
			assertThat(status.consecutiveFailures()).isEqualTo(1);
			assertThat(status.circuitState()).isEqualTo(CircuitBreaker.State.CLOSED);
			assertThat(status.totalErrors()).isEqualTo(1);
		});
	}

	@Test
	void resourceUpdatesReachSubscriberThroughInboundMessages() {
		connect("league_server");
		List<ResourceUpdate> updates = new CopyOnWriteArrayList<>();
		this.client.subscribeResource(STANDINGS, updates::add).block(Duration.ofSeconds(5));

		this.client.handleInboundMessage("league_server",
				"{\"jsonrpc\":\"2.0\",\"method\":\"notifications/resources/updated\","
						+ "\"params\":{\"uri\":\"league://standings\",\"contents\":{\"leader\":\"P01\"}}}");

		await().atMost(Duration.ofSeconds(2)).until(() -> updates.size() == 1);
		ResourceUpdate update = updates.get(0);
		assertThat(update.serverName()).isEqualTo("league_server");
		assertThat(update.value()).isEqualTo(Map.of("leader", "P01"));
		StepVerifier.create(this.client.readResource(STANDINGS)).expectNext(Map.of("leader", "P01")).verifyComplete();
		assertThat(this.servers.get("league_server").count(McpSchema.METHOD_RESOURCES_READ)).isZero();
	}

	@Test
	void toolListChangedNotificationTriggersRefresh() {
		connect("game_server");
		MockMcpClientTransport game = this.servers.get("game_server");
		tools(game, "get_state", "make_move", "resign");

		game.pushNotification(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, null);

		await().atMost(Duration.ofSeconds(2))
			.untilAsserted(() -> assertThat(this.client.listTools("game_server")).extracting(ToolDescriptor::rawName)
				.containsExactly("get_state", "make_move", "resign"));
	}

	@Test
	void serverWithoutToolsCapabilitySkipsToolDiscovery() {
		server("referee", new McpSchema.ServerCapabilities(null, null, null));

		connect("referee");

		assertThat(this.servers.get("referee").count(McpSchema.METHOD_TOOLS_LIST)).isZero();
		assertThat(this.servers.get("referee").count(McpSchema.METHOD_RESOURCES_LIST)).isZero();
		assertThat(this.client.getSessionStatus("referee").state()).isEqualTo(SessionState.ACTIVE);
	}

	@Test
	void disconnectDropsToolsAndSubscriptions() {
		connect("league_server");
		this.client.subscribeResource(STANDINGS, update -> {
		}).block(Duration.ofSeconds(5));

		this.client.disconnect("league_server").block(Duration.ofSeconds(5));

		assertThat(this.client.listTools()).isEmpty();
		assertThat(this.client.healthReport().subscriptionCount()).isZero();
		StepVerifier.create(this.client.callTool("league_server.get_standings", Map.of()))
			.verifyError(ToolNotFoundError.class);
		assertThat(this.servers.get("league_server").isClosed()).isTrue();
	}

	@Test
	void healthReportSummarisesSessions() {
		connect("league_server");
		connect("game_server");
		this.client.subscribeResource(STANDINGS, update -> {
		}).block(Duration.ofSeconds(5));

		HealthReport report = this.client.healthReport();

		assertThat(report.isHealthy()).isTrue();
		assertThat(report.sessions()).extracting(SessionStatus::serverName)
			.containsExactly("game_server", "league_server");
		assertThat(report.toolCount()).isEqualTo(4);
		assertThat(report.resourceCount()).isEqualTo(1);
		assertThat(report.subscriptionCount()).isEqualTo(1);
	}

	@Test
	void syncClientBlocksOnEveryOperation() {
		try (McpSyncClient sync = McpClient.sync()
			.config(McpClientConfig.defaults().withHeartbeat(McpClientConfig.HeartbeatConfig.disabled()))
			.clientInfo(PLAYER)
			.transportFactory(endpoint -> this.servers.get(endpoint.name()))
			.build()) {
			sync.connect(ServerEndpoint.http("league_server", "http://localhost:8000"));

			McpSchema.CallToolResult result = sync.callTool("get_standings", Map.of());

			assertThat(result.content().get(0).text()).isEqualTo("called get_standings");
			assertThat(sync.listTools()).hasSize(2);
			assertThat(sync.closeGracefully()).isTrue();
		}
	}

}
