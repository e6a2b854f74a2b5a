/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leaguemcp.client.transport.HttpClientTransport;
import io.leaguemcp.client.transport.StdioClientTransport;
import io.leaguemcp.spec.McpClientTransport;
import io.leaguemcp.util.Assert;

/**
 * 为服务器描述创建传输层。每个会话独占一个传输实例。
 */
@FunctionalInterface
public interface TransportFactory {

	McpClientTransport create(ServerEndpoint endpoint);

	/**
	 * 按{@link ServerEndpoint#kind()}创建HTTP或stdio传输。
	 * @param objectMapper 用于JSON-RPC序列化的ObjectMapper
	 * @return 默认工厂
	 */
	static TransportFactory defaultFactory(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		return endpoint -> {
			if (endpoint.kind() == ServerEndpoint.Kind.STDIO) {
				return new StdioClientTransport(endpoint.process(), objectMapper);
			}
			HttpClientTransport.Builder builder = HttpClientTransport.builder(endpoint.url())
				.endpoint(endpoint.endpoint())
				.objectMapper(objectMapper);
			endpoint.headers().forEach(builder::header);
			return builder.build();
		};
	}

}
