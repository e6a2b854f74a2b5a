/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.resources;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import io.leaguemcp.client.session.SessionManager;
import io.leaguemcp.spec.McpError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.SessionClosedError;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 资源订阅、变更分发和读取缓存。
 *
 * <p>
 * 每个URI最多向上游发送一次订阅请求，与订阅者数量无关；最后一个订阅者离开时发送取消订阅。
 * 变更通知在所属会话的入站分发线程上到达，缓存先被整体替换，再按注册顺序把同一通知交给每个回调一次。
 * 回调抛出的异常被记录，不影响其他回调。
 * </p>
 */
public class ResourceManager {

	private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);

	private record OwnedResource(String serverName, McpSchema.Resource resource) {
	}

	private static final class UriSubscriptions {

		final String serverName;

		final Mono<Void> upstream;

		final LinkedHashMap<String, ResourceSubscription> subscribers = new LinkedHashMap<>();

		UriSubscriptions(String serverName, Mono<Void> upstream) {
			this.serverName = serverName;
			this.upstream = upstream;
		}

	}

	private final SessionManager sessionManager;

	private final Clock clock;

	private final Duration cacheTtl;

	private final Object lock = new Object();

	/** URI到提供者的索引，由资源发现维护 */
	private final Map<String, OwnedResource> owners = new HashMap<>();

	private final Map<String, UriSubscriptions> subscriptions = new HashMap<>();

	private final Map<String, CachedResource> cache = new HashMap<>();

	public ResourceManager(SessionManager sessionManager, Clock clock, Duration cacheTtl) {
		Assert.notNull(sessionManager, "The sessionManager can not be null");
		Assert.notNull(clock, "The clock can not be null");
		Assert.positive(cacheTtl, "The cacheTtl must be positive");
		this.sessionManager = sessionManager;
		this.clock = clock;
		this.cacheTtl = cacheTtl;
	}

	// --------------------------
	// Discovery
	// --------------------------

	/**
	 * 用一次发现的结果替换服务器拥有的资源。
	 * @param serverName 服务器名
	 * @param resources 服务器报告的资源
	 */
	public void registerResources(String serverName, List<McpSchema.Resource> resources) {
		Assert.hasText(serverName, "serverName must not be empty");
		Assert.notNull(resources, "resources must not be null");
		synchronized (this.lock) {
			this.owners.values().removeIf(owned -> owned.serverName().equals(serverName));
			for (McpSchema.Resource resource : resources) {
				OwnedResource previous = this.owners.put(resource.uri(), new OwnedResource(serverName, resource));
				if (previous != null && !previous.serverName().equals(serverName)) {
					logger.warn("Resource '{}' is now provided by '{}' instead of '{}'", resource.uri(), serverName,
							previous.serverName());
				}
			}
		}
		logger.debug("Registered {} resource(s) of '{}'", resources.size(), serverName);
	}

	/**
	 * @param uri 资源URI
	 * @return 提供该资源的服务器名，未知时为{@code null}
	 */
	public String ownerOf(String uri) {
		synchronized (this.lock) {
			OwnedResource owned = this.owners.get(uri);
			return owned != null ? owned.serverName() : null;
		}
	}

	public List<McpSchema.Resource> listResources() {
		synchronized (this.lock) {
			List<McpSchema.Resource> all = new ArrayList<>();
			this.owners.values().forEach(owned -> all.add(owned.resource()));
			all.sort(Comparator.comparing(McpSchema.Resource::uri));
			return all;
		}
	}

	/**
	 * 丢弃服务器的资源索引、订阅和缓存。会话关闭后调用，不向上游发送任何请求。
	 * @param serverName 服务器名
	 */
	public void removeServer(String serverName) {
		synchronized (this.lock) {
			this.owners.values().removeIf(owned -> owned.serverName().equals(serverName));
			int before = this.subscriptions.size();
			this.subscriptions.values().removeIf(entry -> entry.serverName.equals(serverName));
			this.cache.values().removeIf(cached -> cached.serverName().equals(serverName));
			int dropped = before - this.subscriptions.size();
			if (dropped > 0) {
				logger.info("Dropped subscriptions to {} resource(s) of '{}'", dropped, serverName);
			}
		}
	}

	// --------------------------
	// Subscriptions
	// --------------------------

	/**
	 * 通过资源索引找到提供者并订阅。
	 * @param uri 资源URI
	 * @param subscriberId 订阅者ID
	 * @param callback 变更回调
	 * @return 订阅
	 */
	public Mono<ResourceSubscription> subscribe(String uri, String subscriberId, Consumer<ResourceUpdate> callback) {
		return Mono.defer(() -> {
			String serverName = ownerOf(uri);
			if (serverName == null) {
				return Mono.error(new McpError("No connected server provides resource: " + uri));
			}
			return subscribe(serverName, uri, subscriberId, callback);
		});
	}

	/**
	 * 订阅资源。同一{@code (subscriberId, uri)}重复订阅返回已有的订阅，回调不会被替换。
	 * @param serverName 提供资源的服务器
	 * @param uri 资源URI
	 * @param subscriberId 订阅者ID
	 * @param callback 变更回调
	 * @return 上游订阅成功后的订阅
	 */
	public Mono<ResourceSubscription> subscribe(String serverName, String uri, String subscriberId,
			Consumer<ResourceUpdate> callback) {
		Assert.hasText(serverName, "serverName must not be empty");
		Assert.hasText(uri, "uri must not be empty");
		Assert.hasText(subscriberId, "subscriberId must not be empty");
		Assert.notNull(callback, "callback must not be null");
		return Mono.defer(() -> {
			UriSubscriptions entry;
			ResourceSubscription subscription;
			synchronized (this.lock) {
				entry = this.subscriptions.computeIfAbsent(uri,
						key -> new UriSubscriptions(serverName, upstreamSubscribe(serverName, key)));
				ResourceSubscription existing = entry.subscribers.get(subscriberId);
				if (existing != null) {
					subscription = existing;
				}
				else {
					subscription = new ResourceSubscription(uri, subscriberId, entry.serverName, callback);
					entry.subscribers.put(subscriberId, subscription);
					logger.debug("'{}' subscribed to '{}'", subscriberId, uri);
				}
			}
			return entry.upstream.thenReturn(subscription).onErrorResume(error -> {
				synchronized (this.lock) {
					this.subscriptions.remove(uri, entry);
				}
				logger.warn("Subscribing to '{}' on '{}' failed: {}", uri, entry.serverName, error.getMessage());
				return Mono.error(error);
			});
		});
	}

	private Mono<Void> upstreamSubscribe(String serverName, String uri) {
		return Mono.defer(() -> this.sessionManager.requireSession(serverName).subscribeResource(uri))
			.doOnSuccess(v -> logger.info("Subscribed to '{}' on '{}'", uri, serverName))
			.cache();
	}

	/**
	 * 取消订阅。最后一个订阅者离开时向上游发送取消订阅；未订阅时不做任何事。
	 * @param uri 资源URI
	 * @param subscriberId 订阅者ID
	 * @return 完成信号
	 */
	public Mono<Void> unsubscribe(String uri, String subscriberId) {
		Assert.hasText(uri, "uri must not be empty");
		Assert.hasText(subscriberId, "subscriberId must not be empty");
		return Mono.defer(() -> {
			String serverName;
			synchronized (this.lock) {
				UriSubscriptions entry = this.subscriptions.get(uri);
				if (entry == null || entry.subscribers.remove(subscriberId) == null) {
					return Mono.empty();
				}
				logger.debug("'{}' unsubscribed from '{}'", subscriberId, uri);
				if (!entry.subscribers.isEmpty()) {
					return Mono.empty();
				}
				this.subscriptions.remove(uri);
				serverName = entry.serverName;
			}
			return Mono.defer(() -> this.sessionManager.requireSession(serverName).unsubscribeResource(uri))
				.doOnSuccess(v -> logger.info("Unsubscribed from '{}' on '{}'", uri, serverName))
				.onErrorResume(SessionClosedError.class, error -> {
					logger.debug("Session to '{}' already closed, skipping upstream unsubscribe", serverName);
					return Mono.empty();
				});
		});
	}

	/**
	 * @param uri 资源URI
	 * @return 该URI当前的订阅，按订阅顺序
	 */
	public List<ResourceSubscription> getSubscriptions(String uri) {
		synchronized (this.lock) {
			UriSubscriptions entry = this.subscriptions.get(uri);
			return entry != null ? new ArrayList<>(entry.subscribers.values()) : List.of();
		}
	}

	public int subscriptionCount() {
		synchronized (this.lock) {
			int count = 0;
			for (UriSubscriptions entry : this.subscriptions.values()) {
				count += entry.subscribers.size();
			}
			return count;
		}
	}

	// --------------------------
	// Notifications
	// --------------------------

	/**
	 * 处理{@code notifications/resources/updated}。
	 * @param serverName 发出通知的服务器
	 * @param notification 通知内容
	 */
	public void onResourceUpdated(String serverName, McpSchema.ResourceUpdatedNotification notification) {
		if (notification == null || notification.uri() == null) {
			logger.warn("Ignoring resource update without uri from '{}'", serverName);
			return;
		}
		String uri = notification.uri();
		Instant now = this.clock.instant();
		List<ResourceSubscription> targets;
		synchronized (this.lock) {
			if (notification.contents() != null) {
				this.cache.put(uri, new CachedResource(serverName, notification.contents(), now));
			}
			else {
				this.cache.remove(uri);
			}
			UriSubscriptions entry = this.subscriptions.get(uri);
			targets = entry != null ? new ArrayList<>(entry.subscribers.values()) : List.of();
		}

		ResourceUpdate update = new ResourceUpdate(uri, serverName, notification.contents(), now);
		for (ResourceSubscription subscription : targets) {
			try {
				subscription.deliver(update);
			}
			catch (RuntimeException e) {
				logger.error("Subscriber '{}' failed handling update of '{}'", subscription.getSubscriberId(), uri, e);
			}
		}
		logger.debug("Delivered update of '{}' from '{}' to {} subscriber(s)", uri, serverName, targets.size());
	}

	// --------------------------
	// Reads
	// --------------------------

	/**
	 * 读取资源，缓存未过期时直接返回缓存值。
	 * @param uri 资源URI
	 * @return 资源值：第一项内容的文本，没有文本时为该内容项本身
	 */
	public Mono<Object> readResource(String uri) {
		return Mono.defer(() -> {
			String serverName = ownerOf(uri);
			if (serverName == null) {
				return Mono.error(new McpError("No connected server provides resource: " + uri));
			}
			return readResource(serverName, uri);
		});
	}

	public Mono<Object> readResource(String serverName, String uri) {
		Assert.hasText(serverName, "serverName must not be empty");
		Assert.hasText(uri, "uri must not be empty");
		return Mono.defer(() -> {
			synchronized (this.lock) {
				CachedResource cached = this.cache.get(uri);
				if (cached != null && cached.isFresh(this.clock.instant(), this.cacheTtl)) {
					return Mono.just(cached.value());
				}
			}
			return this.sessionManager.requireSession(serverName).readResource(uri).flatMap(result -> {
				if (result.contents() == null || result.contents().isEmpty()) {
					return Mono.empty();
				}
				McpSchema.ResourceContents first = result.contents().get(0);
				Object value = first.text() != null ? first.text() : first;
				synchronized (this.lock) {
					this.cache.put(uri, new CachedResource(serverName, value, this.clock.instant()));
				}
				return Mono.just(value);
			});
		});
	}

	public void invalidate(String uri) {
		synchronized (this.lock) {
			this.cache.remove(uri);
		}
	}

	public void clearCache() {
		synchronized (this.lock) {
			this.cache.clear();
		}
	}

	public int cacheSize() {
		synchronized (this.lock) {
			return this.cache.size();
		}
	}

}
