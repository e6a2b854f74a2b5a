/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.spec;

import java.util.List;

/**
 * 未限定的工具名同时匹配多个服务器上的工具。调用方必须改用带服务器前缀的名称。
 */
public class AmbiguousToolNameError extends McpError {

	private final String toolName;

	private final List<String> candidates;

	public AmbiguousToolNameError(String toolName, List<String> candidates) {
		super("Tool name '" + toolName + "' is ambiguous, candidates: " + candidates);
		this.toolName = toolName;
		this.candidates = List.copyOf(candidates);
	}

	public String getToolName() {
		return this.toolName;
	}

	/**
	 * @return 匹配到的全限定工具名
	 */
	public List<String> getCandidates() {
		return this.candidates;
	}

}
