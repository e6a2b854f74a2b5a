/*
 * Copyright 2024-2024 原始作者保留所有权利。
 */

package io.leaguemcp.util;

import java.net.URI;

import reactor.util.annotation.Nullable;

/**
 * 杂项工具方法。
 *
 * @author Christian Tzolov
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * 检查给定的{@code String}是否包含实际的<em>文本</em>。
	 * @param str 要检查的{@code String}（可能为{@code null}）
	 * @return 不为{@code null}且不只包含空白字符时返回{@code true}
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * 根据基础URL解析端点URL。相对端点基于基础URL解析；绝对端点必须与基础URL的方案、
	 * 权限和路径前缀一致，否则抛出{@link IllegalArgumentException}。
	 * @param baseUrl 基础URL（必须是绝对的）
	 * @param endpointUrl 端点URL（可以是相对的或绝对的）
	 * @return 解析后的端点URI
	 */
	public static URI resolveUri(URI baseUrl, String endpointUrl) {
		URI endpointUri = URI.create(endpointUrl);
		if (endpointUri.isAbsolute() && !isUnderBaseUri(baseUrl, endpointUri)) {
			throw new IllegalArgumentException("Absolute endpoint URL does not match the base URL.");
		}
		else {
			return baseUrl.resolve(endpointUri);
		}
	}

	private static boolean isUnderBaseUri(URI baseUri, URI endpointUri) {
		if (!baseUri.getScheme().equals(endpointUri.getScheme())
				|| !baseUri.getAuthority().equals(endpointUri.getAuthority())) {
			return false;
		}

		String basePath = baseUri.normalize().getPath();
		String endpointPath = endpointUri.normalize().getPath();

		if (basePath.endsWith("/")) {
			basePath = basePath.substring(0, basePath.length() - 1);
		}
		return endpointPath.startsWith(basePath);
	}

}
