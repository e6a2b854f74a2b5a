/*
 * Copyright 2024 - 2024 the original author or authors.
 */

package io.leaguemcp.client.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leaguemcp.spec.McpClientTransport;
import io.leaguemcp.spec.McpError;
import io.leaguemcp.spec.McpProtocolError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.McpSchema.JSONRPCMessage;
import io.leaguemcp.spec.McpTransportError;
import io.leaguemcp.util.Assert;
import io.leaguemcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 基于HTTP POST的传输实现：每条JSON-RPC消息作为一次POST发往服务器的MCP端点，
 * 响应体即为同步回复。
 *
 * <p>
 * 状态码映射：
 * <ul>
 * <li>2xx 且响应体非空：反序列化为回复消息</li>
 * <li>202、204或空响应体：没有同步回复</li>
 * <li>4xx：{@link McpProtocolError}，永久错误</li>
 * <li>5xx、连接失败、I/O错误：{@link McpTransportError}，瞬时错误</li>
 * </ul>
 *
 * <p>
 * HTTP没有常驻的入站流，服务器主动推送的通知需要由宿主通过{@link #acceptInbound(String)}转交。
 *
 * @author Christian Tzolov
 */
public class HttpClientTransport implements McpClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(HttpClientTransport.class);

	/** 联赛服务器默认的MCP端点 */
	public static final String DEFAULT_ENDPOINT = "/mcp";

	private final URI endpointUri;

	private final HttpClient httpClient;

	private final HttpRequest.Builder requestBuilder;

	protected ObjectMapper objectMapper;

	private volatile Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> inboundHandler;

	private volatile boolean isClosing = false;

	HttpClientTransport(HttpClient httpClient, HttpRequest.Builder requestBuilder, String baseUri, String endpoint,
			ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		Assert.hasText(baseUri, "baseUri must not be empty");
		Assert.hasText(endpoint, "endpoint must not be empty");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(requestBuilder, "requestBuilder must not be null");
		this.endpointUri = Utils.resolveUri(URI.create(baseUri), endpoint);
		this.objectMapper = objectMapper;
		this.httpClient = httpClient;
		this.requestBuilder = requestBuilder;
	}

	/**
	 * 创建新的构建器。
	 * @param baseUri 服务器基础URI，例如 {@code http://localhost:8001}
	 * @return 新的构建器实例
	 */
	public static Builder builder(String baseUri) {
		return new Builder().baseUri(baseUri);
	}

	/**
	 * {@link HttpClientTransport}的构建器。
	 */
	public static class Builder {

		private String baseUri;

		private String endpoint = DEFAULT_ENDPOINT;

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(10));

		private ObjectMapper objectMapper = new ObjectMapper();

		private HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
			.header("Content-Type", "application/json")
			.header("Accept", "application/json");

		Builder() {
		}

		Builder baseUri(String baseUri) {
			Assert.hasText(baseUri, "baseUri must not be empty");
			this.baseUri = baseUri;
			return this;
		}

		/**
		 * 设置MCP端点路径，默认为{@value #DEFAULT_ENDPOINT}。
		 * @param endpoint 端点路径
		 * @return 当前构建器
		 */
		public Builder endpoint(String endpoint) {
			Assert.hasText(endpoint, "endpoint must not be empty");
			this.endpoint = endpoint;
			return this;
		}

		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		public Builder customizeClient(final Consumer<HttpClient.Builder> clientCustomizer) {
			Assert.notNull(clientCustomizer, "clientCustomizer must not be null");
			clientCustomizer.accept(clientBuilder);
			return this;
		}

		public Builder customizeRequest(final Consumer<HttpRequest.Builder> requestCustomizer) {
			Assert.notNull(requestCustomizer, "requestCustomizer must not be null");
			requestCustomizer.accept(requestBuilder);
			return this;
		}

		/**
		 * 为每个请求添加HTTP头，例如携带不透明的认证凭据。
		 * @param name 头名称
		 * @param value 头的值
		 * @return 当前构建器
		 */
		public Builder header(String name, String value) {
			Assert.hasText(name, "header name must not be empty");
			Assert.notNull(value, "header value must not be null");
			this.requestBuilder.header(name, value);
			return this;
		}

		/**
		 * 单次HTTP交换的超时时间。调用级别的截止时间由连接管理器控制，这里只是传输层的上限。
		 * @param timeout 超时时间
		 * @return 当前构建器
		 */
		public Builder requestTimeout(Duration timeout) {
			Assert.positive(timeout, "timeout must be positive");
			this.requestBuilder.timeout(timeout);
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public HttpClientTransport build() {
			return new HttpClientTransport(clientBuilder.build(), requestBuilder, baseUri, endpoint, objectMapper);
		}

	}

	@Override
	public Mono<Void> connect(Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> handler) {
		return Mono.fromRunnable(() -> {
			Assert.notNull(handler, "handler must not be null");
			this.inboundHandler = handler;
			logger.debug("HTTP transport ready for {}", this.endpointUri);
		});
	}

	@Override
	public Mono<JSONRPCMessage> send(JSONRPCMessage message) {
		return Mono.defer(() -> {
			if (this.isClosing) {
				return Mono.error(new McpTransportError("Transport is closed: " + this.endpointUri));
			}

			String jsonText;
			try {
				jsonText = this.objectMapper.writeValueAsString(message);
			}
			catch (JsonProcessingException e) {
				return Mono.error(new McpProtocolError("Failed to serialize message", e));
			}

			HttpRequest request = this.requestBuilder.copy()
				.uri(this.endpointUri)
				.POST(HttpRequest.BodyPublishers.ofString(jsonText))
				.build();

			return Mono.fromFuture(() -> this.httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
				.onErrorMap(error -> !(error instanceof McpError), McpError::classify)
				.flatMap(this::handleResponse);
		});
	}

	private Mono<JSONRPCMessage> handleResponse(HttpResponse<String> response) {
		int status = response.statusCode();
		if (status >= 500) {
			return Mono.error(new McpTransportError("Server " + this.endpointUri + " responded with HTTP " + status));
		}
		if (status >= 400) {
			return Mono.error(new McpProtocolError("Server " + this.endpointUri + " rejected request with HTTP "
					+ status + ": " + response.body()));
		}
		String body = response.body();
		if (status == 202 || status == 204 || !Utils.hasText(body)) {
			return Mono.empty();
		}
		try {
			return Mono.just(McpSchema.deserializeJsonRpcMessage(this.objectMapper, body));
		}
		catch (IOException | IllegalArgumentException e) {
			return Mono.error(new McpProtocolError("Malformed response from " + this.endpointUri, e));
		}
	}

	@Override
	public void acceptInbound(String rawMessage) {
		Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> handler = this.inboundHandler;
		if (handler == null) {
			throw new McpError("Transport is not connected: " + this.endpointUri);
		}
		JSONRPCMessage message;
		try {
			message = McpSchema.deserializeJsonRpcMessage(this.objectMapper, rawMessage);
		}
		catch (IOException | IllegalArgumentException e) {
			throw new McpProtocolError("Malformed inbound message", e);
		}
		handler.apply(Mono.just(message)).subscribe(null,
				error -> logger.error("Error handling inbound message: {}", error.getMessage()));
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			this.isClosing = true;
			this.inboundHandler = null;
		});
	}

	@Override
	public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
		return this.objectMapper.convertValue(data, typeRef);
	}

	URI getEndpointUri() {
		return this.endpointUri;
	}

}
