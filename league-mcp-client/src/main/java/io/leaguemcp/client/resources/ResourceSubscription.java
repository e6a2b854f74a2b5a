/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.resources;

import java.time.Instant;
import java.util.function.Consumer;

/**
 * 一个订阅者对一个资源URI的订阅。同一{@code (subscriberId, uri)}最多只有一个订阅。
 */
public class ResourceSubscription {

	private final String uri;

	private final String subscriberId;

	private final String serverName;

	private final Consumer<ResourceUpdate> callback;

	private volatile Object lastValue;

	private volatile Instant lastUpdatedAt;

	ResourceSubscription(String uri, String subscriberId, String serverName, Consumer<ResourceUpdate> callback) {
		this.uri = uri;
		this.subscriberId = subscriberId;
		this.serverName = serverName;
		this.callback = callback;
	}

	public String getUri() {
		return this.uri;
	}

	public String getSubscriberId() {
		return this.subscriberId;
	}

	public String getServerName() {
		return this.serverName;
	}

	public Object getLastValue() {
		return this.lastValue;
	}

	public Instant getLastUpdatedAt() {
		return this.lastUpdatedAt;
	}

	void deliver(ResourceUpdate update) {
		this.lastValue = update.value();
		this.lastUpdatedAt = update.updatedAt();
		this.callback.accept(update);
	}

	@Override
	public String toString() {
		return "ResourceSubscription[uri=" + this.uri + ", subscriberId=" + this.subscriberId + ", server="
				+ this.serverName + "]";
	}

}
