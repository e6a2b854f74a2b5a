/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.util.Assert;

/**
 * 注册表中的一个工具。
 *
 * @param serverName 提供工具的服务器名
 * @param rawName 服务器内的原始工具名，调用时原样发送
 * @param namespacedName {@code serverName.rawName}
 * @param description 工具描述
 * @param inputSchema 参数的JSON Schema，注册时复制为不可变视图
 */
public record ToolDescriptor(String serverName, String rawName, String namespacedName, String description,
		Map<String, Object> inputSchema) {

	public static final char NAMESPACE_SEPARATOR = '.';

	public ToolDescriptor {
		Assert.hasText(serverName, "serverName must not be empty");
		Assert.hasText(rawName, "rawName must not be empty");
		Assert.hasText(namespacedName, "namespacedName must not be empty");
		Assert.isTrue(namespacedName.equals(namespace(serverName, rawName)),
				"namespacedName must be serverName.rawName");
		// Schemas may carry null values, which Map.copyOf rejects.
		inputSchema = inputSchema == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
	}

	public static ToolDescriptor of(String serverName, McpSchema.Tool tool) {
		Assert.notNull(tool, "tool must not be null");
		return new ToolDescriptor(serverName, tool.name(), namespace(serverName, tool.name()), tool.description(),
				tool.inputSchema());
	}

	public static String namespace(String serverName, String rawName) {
		return serverName + NAMESPACE_SEPARATOR + rawName;
	}

}
