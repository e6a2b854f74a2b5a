/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.resources;

import java.time.Instant;

/**
 * 交给订阅回调的一次资源变更。
 *
 * @param uri 资源URI
 * @param serverName 发出通知的服务器
 * @param value 通知携带的新值，服务器只发送URI时为{@code null}
 * @param updatedAt 客户端收到通知的时间
 */
public record ResourceUpdate(String uri, String serverName, Object value, Instant updatedAt) {
}
