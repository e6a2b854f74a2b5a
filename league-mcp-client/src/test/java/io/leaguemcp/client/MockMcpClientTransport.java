/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leaguemcp.spec.McpClientTransport;
import io.leaguemcp.spec.McpProtocolError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.McpSchema.JSONRPCMessage;
import io.leaguemcp.spec.McpSchema.JSONRPCRequest;
import io.leaguemcp.spec.McpSchema.JSONRPCResponse;
import reactor.core.publisher.Mono;

/**
 * 内存中的MCP服务器替身。每个方法的行为可以单独设置：同步回复结果、回复JSON-RPC错误、
 * 以异常失败或永不回复。默认回复握手和心跳，其余方法回复METHOD_NOT_FOUND。
 */
public class MockMcpClientTransport implements McpClientTransport {

	public static final McpSchema.ServerCapabilities FULL_CAPABILITIES = new McpSchema.ServerCapabilities(null,
			new McpSchema.ResourceCapabilities(true, true), new McpSchema.ToolCapabilities(true));

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final Map<String, Function<JSONRPCRequest, Mono<JSONRPCMessage>>> behaviors = new ConcurrentHashMap<>();

	private final List<JSONRPCMessage> sent = new CopyOnWriteArrayList<>();

	private volatile Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> handler;

	private volatile boolean closed;

	public MockMcpClientTransport() {
		this(FULL_CAPABILITIES);
	}

	public MockMcpClientTransport(McpSchema.ServerCapabilities capabilities) {
		reply(McpSchema.METHOD_INITIALIZE, params -> new McpSchema.InitializeResult(McpSchema.LATEST_PROTOCOL_VERSION,
				capabilities, new McpSchema.Implementation("mock-server", "1.0.0"), null));
		reply(McpSchema.METHOD_PING, params -> Map.of());
		reply(McpSchema.METHOD_TOOLS_LIST, params -> new McpSchema.ListToolsResult(List.of(), null));
		reply(McpSchema.METHOD_RESOURCES_LIST, params -> new McpSchema.ListResourcesResult(List.of(), null));
	}

	public MockMcpClientTransport on(String method, Function<JSONRPCRequest, Mono<JSONRPCMessage>> behavior) {
		this.behaviors.put(method, behavior);
		return this;
	}

	public MockMcpClientTransport reply(String method, Function<Object, Object> result) {
		return on(method, request -> Mono
			.just(new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), result.apply(request.params()), null)));
	}

	public MockMcpClientTransport replyError(String method, int code, String message) {
		return on(method, request -> Mono.just(new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null,
				new JSONRPCResponse.JSONRPCError(code, message, null))));
	}

	public MockMcpClientTransport fail(String method, Supplier<Throwable> error) {
		return on(method, request -> Mono.error(error.get()));
	}

	public MockMcpClientTransport neverReply(String method) {
		return on(method, request -> Mono.empty());
	}

	/**
	 * 模拟服务器主动推送的消息。
	 */
	public void push(JSONRPCMessage message) {
		this.handler.apply(Mono.just(message)).subscribe();
	}

	public void pushNotification(String method, Object params) {
		push(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, method, params));
	}

	public List<JSONRPCMessage> sent() {
		return this.sent;
	}

	public List<JSONRPCRequest> requests(String method) {
		return this.sent.stream()
			.filter(message -> message instanceof JSONRPCRequest request && request.method().equals(method))
			.map(JSONRPCRequest.class::cast)
			.toList();
	}

	public long count(String method) {
		return requests(method).size();
	}

	public boolean isClosed() {
		return this.closed;
	}

	public boolean isConnected() {
		return this.handler != null;
	}

	@Override
	public Mono<Void> connect(Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> handler) {
		this.handler = handler;
		return Mono.empty();
	}

	@Override
	public Mono<JSONRPCMessage> send(JSONRPCMessage message) {
		return Mono.defer(() -> {
			this.sent.add(message);
			if (!(message instanceof JSONRPCRequest request)) {
				return Mono.empty();
			}
			Function<JSONRPCRequest, Mono<JSONRPCMessage>> behavior = this.behaviors.get(request.method());
			if (behavior == null) {
				return Mono.just(new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null,
						new JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.METHOD_NOT_FOUND,
								"Method not found: " + request.method(), null)));
			}
			return behavior.apply(request);
		});
	}

	@Override
	public void acceptInbound(String rawMessage) {
		try {
			push(McpSchema.deserializeJsonRpcMessage(this.objectMapper, rawMessage));
		}
		catch (IOException | IllegalArgumentException e) {
			throw new McpProtocolError("Malformed inbound message", e);
		}
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> this.closed = true);
	}

	@Override
	public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
		return this.objectMapper.convertValue(data, typeRef);
	}

}
