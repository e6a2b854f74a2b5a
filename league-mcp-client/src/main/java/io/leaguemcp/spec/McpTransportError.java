/*
 * Copyright 2024 - 2024 原始作者保留所有权利。
 */

package io.leaguemcp.spec;

/**
 * 连接被拒绝、重置或I/O失败，以及服务器返回5xx。瞬时错误。
 */
public class McpTransportError extends McpError {

	public McpTransportError(String message) {
		super(message);
	}

	public McpTransportError(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public boolean isTransient() {
		return true;
	}

}
