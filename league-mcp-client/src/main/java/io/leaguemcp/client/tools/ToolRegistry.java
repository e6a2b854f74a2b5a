/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.tools;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import io.leaguemcp.spec.AmbiguousToolNameError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.ToolNotFoundError;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 所有已连接服务器的工具索引，以{@code serverName.rawName}为键。
 *
 * <p>
 * 名称解析规则：
 * <ul>
 * <li>命名空间名直接查找</li>
 * <li>前缀是已知服务器但工具不存在时抛出{@link ToolNotFoundError}，不会回退到原始名匹配</li>
 * <li>其余按原始名匹配：恰好一个则返回，没有则抛出{@link ToolNotFoundError}，
 * 多个服务器同名则抛出{@link AmbiguousToolNameError}，从不任意挑选</li>
 * </ul>
 * 注册表只在自身的映射上做原子读写，不持有其他组件的锁。
 */
public class ToolRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

	public enum Registration {

		ADDED, UNCHANGED, UPDATED

	}

	private final ConcurrentHashMap<String, ToolDescriptor> tools = new ConcurrentHashMap<>();

	private final Set<String> knownServers = ConcurrentHashMap.newKeySet();

	/**
	 * 注册一个工具。相同命名空间名的不同定义会覆盖旧定义。
	 * @param descriptor 工具描述
	 * @return 注册结果
	 */
	public Registration register(ToolDescriptor descriptor) {
		Assert.notNull(descriptor, "descriptor must not be null");
		this.knownServers.add(descriptor.serverName());
		ToolDescriptor previous = this.tools.put(descriptor.namespacedName(), descriptor);
		if (previous == null) {
			return Registration.ADDED;
		}
		if (previous.equals(descriptor)) {
			return Registration.UNCHANGED;
		}
		logger.info("Tool '{}' re-registered with a different definition, replacing it", descriptor.namespacedName());
		return Registration.UPDATED;
	}

	/**
	 * 用一次发现的结果替换服务器的全部工具，不再报告的工具被移除。
	 * @param serverName 服务器名
	 * @param discovered 服务器报告的工具
	 * @return 替换后该服务器的工具
	 */
	public List<ToolDescriptor> replaceServerTools(String serverName, List<McpSchema.Tool> discovered) {
		Assert.hasText(serverName, "serverName must not be empty");
		Assert.notNull(discovered, "discovered tools must not be null");
		this.knownServers.add(serverName);

		Set<String> current = new HashSet<>();
		int added = 0;
		int updated = 0;
		for (McpSchema.Tool tool : discovered) {
			ToolDescriptor descriptor = ToolDescriptor.of(serverName, tool);
			current.add(descriptor.namespacedName());
			Registration result = register(descriptor);
			if (result == Registration.ADDED) {
				added++;
			}
			else if (result == Registration.UPDATED) {
				updated++;
			}
		}
		int removed = 0;
		for (ToolDescriptor existing : listTools(serverName)) {
			if (!current.contains(existing.namespacedName())
					&& this.tools.remove(existing.namespacedName(), existing)) {
				removed++;
			}
		}
		logger.info("Tools of '{}' refreshed: {} total, {} added, {} updated, {} removed", serverName,
				current.size(), added, updated, removed);
		return listTools(serverName);
	}

	/**
	 * 移除服务器的全部工具。
	 * @param serverName 服务器名
	 * @return 被移除的工具数
	 */
	public int unregisterServer(String serverName) {
		this.knownServers.remove(serverName);
		int removed = 0;
		for (ToolDescriptor descriptor : listTools(serverName)) {
			if (this.tools.remove(descriptor.namespacedName(), descriptor)) {
				removed++;
			}
		}
		if (removed > 0) {
			logger.info("Dropped {} tool(s) of '{}'", removed, serverName);
		}
		return removed;
	}

	/**
	 * 把命名空间名或原始名解析为唯一的工具。
	 * @param name 工具名
	 * @return 工具描述
	 * @throws ToolNotFoundError 如果没有匹配的工具
	 * @throws AmbiguousToolNameError 如果原始名在多个服务器上存在
	 */
	public ToolDescriptor resolve(String name) {
		Assert.hasText(name, "tool name must not be empty");
		ToolDescriptor exact = this.tools.get(name);
		if (exact != null) {
			return exact;
		}

		int separator = name.indexOf(ToolDescriptor.NAMESPACE_SEPARATOR);
		if (separator > 0 && this.knownServers.contains(name.substring(0, separator))) {
			throw new ToolNotFoundError(name);
		}

		List<ToolDescriptor> matches = new ArrayList<>();
		for (ToolDescriptor descriptor : this.tools.values()) {
			if (descriptor.rawName().equals(name)) {
				matches.add(descriptor);
			}
		}
		if (matches.isEmpty()) {
			throw new ToolNotFoundError(name);
		}
		if (matches.size() > 1) {
			List<String> candidates = matches.stream().map(ToolDescriptor::namespacedName).sorted().toList();
			throw new AmbiguousToolNameError(name, candidates);
		}
		return matches.get(0);
	}

	/**
	 * @return 全部工具，按命名空间名排序
	 */
	public List<ToolDescriptor> listTools() {
		List<ToolDescriptor> all = new ArrayList<>(this.tools.values());
		all.sort(Comparator.comparing(ToolDescriptor::namespacedName));
		return all;
	}

	public List<ToolDescriptor> listTools(String serverName) {
		List<ToolDescriptor> result = new ArrayList<>();
		for (ToolDescriptor descriptor : this.tools.values()) {
			if (descriptor.serverName().equals(serverName)) {
				result.add(descriptor);
			}
		}
		result.sort(Comparator.comparing(ToolDescriptor::namespacedName));
		return result;
	}

	/**
	 * @return 在多个服务器上出现的原始名及其命名空间名
	 */
	public Map<String, List<String>> collisions() {
		Map<String, List<String>> byRawName = new TreeMap<>();
		for (ToolDescriptor descriptor : listTools()) {
			byRawName.computeIfAbsent(descriptor.rawName(), key -> new ArrayList<>()).add(descriptor.namespacedName());
		}
		byRawName.values().removeIf(names -> names.size() < 2);
		return byRawName;
	}

	public int size() {
		return this.tools.size();
	}

}
