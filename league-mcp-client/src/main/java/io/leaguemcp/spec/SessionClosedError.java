/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.spec;

/**
 * 调用等待期间会话被关闭，或者目标服务器没有活动会话。
 */
public class SessionClosedError extends McpError {

	private final String serverName;

	public SessionClosedError(String serverName) {
		super("Session closed for server: " + serverName);
		this.serverName = serverName;
	}

	public String getServerName() {
		return this.serverName;
	}

}
