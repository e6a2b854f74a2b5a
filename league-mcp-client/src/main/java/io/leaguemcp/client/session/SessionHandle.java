/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.session;

import io.leaguemcp.spec.McpSchema;

/**
 * 握手完成后返回给调用方的会话信息。
 *
 * @param serverName 服务器名
 * @param sessionId 会话ID
 * @param protocolVersion 服务器确认的协议版本
 * @param serverInfo 服务器实现信息
 * @param serverCapabilities 服务器声明的能力
 */
public record SessionHandle(String serverName, String sessionId, String protocolVersion,
		McpSchema.Implementation serverInfo, McpSchema.ServerCapabilities serverCapabilities) {
}
