/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.resources;

import java.time.Duration;
import java.time.Instant;

/**
 * 资源缓存的一项。
 *
 * @param serverName 提供值的服务器
 * @param value 资源值
 * @param storedAt 写入时间
 */
record CachedResource(String serverName, Object value, Instant storedAt) {

	boolean isFresh(Instant now, Duration ttl) {
		return now.isBefore(this.storedAt.plus(ttl));
	}

}
