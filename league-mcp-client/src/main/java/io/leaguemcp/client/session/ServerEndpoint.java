/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.session;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import io.leaguemcp.client.transport.HttpClientTransport;
import io.leaguemcp.client.transport.ServerParameters;
import io.leaguemcp.util.Assert;

/**
 * 一个远程MCP服务器的连接描述。服务器名是会话、工具命名空间和状态查询的键。
 *
 * @param name 服务器名，例如{@code league_server}
 * @param kind 传输方式
 * @param url HTTP服务器的基础URL，仅用于{@link Kind#HTTP}
 * @param endpoint HTTP端点路径，仅用于{@link Kind#HTTP}
 * @param headers 每个HTTP请求附带的额外头部
 * @param process 子进程参数，仅用于{@link Kind#STDIO}
 * @param requestTimeout 覆盖客户端默认请求超时，{@code null}表示使用默认值
 */
public record ServerEndpoint(String name, Kind kind, String url, String endpoint, Map<String, String> headers,
		ServerParameters process, Duration requestTimeout) {

	public enum Kind {

		HTTP, STDIO

	}

	public ServerEndpoint {
		Assert.hasText(name, "Server name must not be empty");
		Assert.isTrue(!name.contains("."), "Server name must not contain '.': " + name);
		Assert.notNull(kind, "Transport kind must not be null");
		if (kind == Kind.HTTP) {
			Assert.hasText(url, "HTTP endpoint requires a url");
			Assert.hasText(endpoint, "HTTP endpoint requires an endpoint path");
		}
		else {
			Assert.notNull(process, "STDIO endpoint requires process parameters");
		}
		if (requestTimeout != null) {
			Assert.positive(requestTimeout, "requestTimeout must be positive");
		}
		headers = headers == null ? Map.of() : Map.copyOf(headers);
	}

	public static ServerEndpoint http(String name, String url) {
		return new ServerEndpoint(name, Kind.HTTP, url, HttpClientTransport.DEFAULT_ENDPOINT, Map.of(), null, null);
	}

	public static ServerEndpoint stdio(String name, ServerParameters process) {
		return new ServerEndpoint(name, Kind.STDIO, null, null, Map.of(), process, null);
	}

	public ServerEndpoint withEndpoint(String endpoint) {
		return new ServerEndpoint(this.name, this.kind, this.url, endpoint, this.headers, this.process,
				this.requestTimeout);
	}

	public ServerEndpoint withHeader(String name, String value) {
		Assert.hasText(name, "Header name must not be empty");
		Map<String, String> copy = new LinkedHashMap<>(this.headers);
		copy.put(name, value);
		return new ServerEndpoint(this.name, this.kind, this.url, this.endpoint, copy, this.process,
				this.requestTimeout);
	}

	public ServerEndpoint withRequestTimeout(Duration requestTimeout) {
		return new ServerEndpoint(this.name, this.kind, this.url, this.endpoint, this.headers, this.process,
				requestTimeout);
	}

}
