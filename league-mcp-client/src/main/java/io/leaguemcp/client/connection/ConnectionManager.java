/*
 * Copyright 2024-2024 原始作者保留所有权利。
 */

package io.leaguemcp.client.connection;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.type.TypeReference;
import io.leaguemcp.client.McpClientConfig;
import io.leaguemcp.client.queue.MessageDirection;
import io.leaguemcp.client.queue.MessagePriority;
import io.leaguemcp.client.queue.PriorityMessageQueue;
import io.leaguemcp.client.queue.QueueStats;
import io.leaguemcp.client.queue.QueuedMessage;
import io.leaguemcp.spec.CircuitOpenError;
import io.leaguemcp.spec.McpClientTransport;
import io.leaguemcp.spec.McpError;
import io.leaguemcp.spec.McpProtocolError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.McpSession;
import io.leaguemcp.spec.McpTimeoutError;
import io.leaguemcp.spec.SessionClosedError;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 一个远程服务器的连接管理器，是该服务器熔断状态和退避计数的唯一串行化点。
 *
 * <p>
 * 职责：
 * <ul>
 * <li>出站：调用方把请求放入优先级队列，专用的分发线程按优先级取出，向熔断器申请许可后交给传输层</li>
 * <li>入站：读分发路径按关联ID把响应交给等待的{@link PendingRequest}，把通知放入入站队列，
 * 由另一个专用线程按到达顺序交给通知处理器，慢回调不会阻塞读路径</li>
 * <li>失败处理：瞬时错误计入熔断器并在截止时间内按退避重试，永久错误立即返回给调用方</li>
 * <li>截止时间：每个请求在入队时确定绝对截止时间，到期即以{@link McpTimeoutError}解决</li>
 * </ul>
 *
 * <p>
 * 熔断器计数规则：在途尝试的瞬时失败和超时计为失败；收到任何JSON-RPC响应（包括错误响应）计为成功；
 * 本地产生的永久错误、取消和会话关闭只归还许可，不触发状态迁移。
 * </p>
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 */
public class ConnectionManager implements McpSession {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

	/**
	 * 处理服务器主动发来的JSON-RPC请求。
	 *
	 * @param <T> 响应类型
	 */
	@FunctionalInterface
	public interface RequestHandler<T> {

		Mono<T> handle(Object params);

	}

	/**
	 * 处理服务器发来的JSON-RPC通知。处理器在会话的入站分发线程上按到达顺序被调用。
	 */
	@FunctionalInterface
	public interface NotificationHandler {

		Mono<Void> handle(Object params);

	}

	private final String serverName;

	private final McpClientTransport transport;

	private final Clock clock;

	private final Duration defaultTimeout;

	private final Duration pollInterval;

	private final CircuitBreaker circuitBreaker;

	private final RetryPolicy retryPolicy;

	private final PriorityMessageQueue<PendingRequest> outboundQueue;

	private final PriorityMessageQueue<McpSchema.JSONRPCNotification> inboundQueue;

	/** 以关联ID为键的在途请求 */
	private final ConcurrentHashMap<Object, PendingRequest> pendingRequests = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<String, RequestHandler<?>> requestHandlers = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<String, NotificationHandler> notificationHandlers = new ConcurrentHashMap<>();

	/** 请求ID的会话前缀 */
	private final String sessionPrefix = UUID.randomUUID().toString().substring(0, 8);

	private final AtomicLong requestCounter = new AtomicLong(0);

	private final AtomicLong totalRequests = new AtomicLong(0);

	private final AtomicLong totalErrors = new AtomicLong(0);

	private final Scheduler outboundScheduler;

	private final Scheduler inboundScheduler;

	private final Scheduler timerScheduler = Schedulers.parallel();

	private final AtomicBoolean started = new AtomicBoolean(false);

	private final AtomicBoolean closed = new AtomicBoolean(false);

	/**
	 * 创建连接管理器。传输层在{@link #connect()}之前不会被使用。
	 * @param serverName 服务器名
	 * @param transport 传输层实现
	 * @param config 客户端配置
	 * @param defaultTimeout 应用调用的默认截止时间
	 * @param clock 用于截止时间和熔断器的时钟
	 */
	public ConnectionManager(String serverName, McpClientTransport transport, McpClientConfig config,
			Duration defaultTimeout, Clock clock) {
		Assert.hasText(serverName, "The serverName can not be empty");
		Assert.notNull(transport, "The transport can not be null");
		Assert.notNull(config, "The config can not be null");
		Assert.positive(defaultTimeout, "The defaultTimeout must be positive");
		Assert.notNull(clock, "The clock can not be null");

		this.serverName = serverName;
		this.transport = transport;
		this.clock = clock;
		this.defaultTimeout = defaultTimeout;
		this.pollInterval = config.queue().pollInterval();
		this.circuitBreaker = new CircuitBreaker(serverName, config.circuitBreaker(), clock);
		this.retryPolicy = new RetryPolicy(config.retry());
		this.outboundQueue = new PriorityMessageQueue<>(serverName + "-outbound", config.queue().maxSize(),
				PendingRequest::isDone, clock);
		this.inboundQueue = new PriorityMessageQueue<>(serverName + "-inbound", config.queue().maxSize(),
				notification -> false, clock);

		this.requestHandlers.put(McpSchema.METHOD_PING, params -> Mono.just(Map.of()));

		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(),
				"mcp-outbound-" + serverName);
		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(),
				"mcp-inbound-" + serverName);
	}

	/**
	 * 注册通知处理器。同一方法的处理器会被替换。
	 * @param method 通知方法名
	 * @param handler 处理器
	 */
	public void addNotificationHandler(String method, NotificationHandler handler) {
		Assert.hasText(method, "The method can not be empty");
		Assert.notNull(handler, "The handler can not be null");
		this.notificationHandlers.put(method, handler);
	}

	/**
	 * 启动分发线程并连接传输层。重复调用不会重复连接。
	 * @return 传输可用时完成的Mono
	 */
	public Mono<Void> connect() {
		return Mono.defer(() -> {
			if (this.closed.get()) {
				return Mono.error(new SessionClosedError(this.serverName));
			}
			if (!this.started.compareAndSet(false, true)) {
				return Mono.empty();
			}
			this.outboundScheduler.schedule(this::runOutboundLoop);
			this.inboundScheduler.schedule(this::runInboundLoop);
			return this.transport.connect(mono -> mono.doOnNext(this::handleInboundMessage));
		});
	}

	// --------------------------
	// Outbound
	// --------------------------

	@Override
	public <T> Mono<T> sendRequest(String method, Object requestParams, TypeReference<T> typeRef) {
		return sendRequest(method, requestParams, typeRef, MessagePriority.NORMAL, this.defaultTimeout);
	}

	/**
	 * 以给定的优先级和超时发送请求。
	 * @param <T> 期望的响应类型
	 * @param method 方法名
	 * @param requestParams 请求参数
	 * @param typeRef 响应类型引用
	 * @param priority 分发优先级
	 * @param timeout 从现在起算的截止时间
	 * @return 包含响应的Mono
	 */
	public <T> Mono<T> sendRequest(String method, Object requestParams, TypeReference<T> typeRef,
			MessagePriority priority, Duration timeout) {
		return submit(method, requestParams, priority, timeout, this.retryPolicy.getMaxAttempts())
			.handle((jsonRpcResponse, sink) -> {
				if (jsonRpcResponse.error() != null) {
					logger.debug("Server '{}' returned error for {}: {}", this.serverName, method,
							jsonRpcResponse.error());
					sink.error(new McpProtocolError(jsonRpcResponse.error()));
				}
				else if (typeRef.getType().equals(Void.class)) {
					sink.complete();
				}
				else {
					try {
						sink.next(this.transport.unmarshalFrom(jsonRpcResponse.result(), typeRef));
					}
					catch (IllegalArgumentException e) {
						sink.error(new McpProtocolError("Unexpected result for " + method, e));
					}
				}
			});
	}

	/**
	 * 以{@link MessagePriority#URGENT}发送一次心跳，只尝试一次。
	 * @param timeout 心跳截止时间
	 * @return 收到回复时完成的Mono
	 */
	public Mono<Void> ping(Duration timeout) {
		return submit(McpSchema.METHOD_PING, null, MessagePriority.URGENT, timeout, 1).flatMap(response -> {
			if (response.error() != null) {
				return Mono.<Void>error(new McpProtocolError(response.error()));
			}
			return Mono.<Void>empty();
		});
	}

	/**
	 * 登记一个在途请求并放入出站队列。熔断器处于打开状态时同步失败，不会触及传输层。
	 */
	private Mono<McpSchema.JSONRPCResponse> submit(String method, Object params, MessagePriority priority,
			Duration timeout, int maxAttempts) {
		return Mono.defer(() -> {
			Assert.positive(timeout, "The timeout must be positive");
			if (this.closed.get()) {
				return Mono.error(new SessionClosedError(this.serverName));
			}
			if (!this.circuitBreaker.isCallPermitted()) {
				return Mono.error(new CircuitOpenError(this.serverName, this.circuitBreaker.remainingCooldown()));
			}

			String requestId = this.generateRequestId();
			McpSchema.JSONRPCRequest request = new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, method,
					requestId, params);
			PendingRequest pending = new PendingRequest(request, priority, this.clock.instant().plus(timeout),
					maxAttempts);

			this.pendingRequests.put(requestId, pending);
			pending.future().whenComplete((response, error) -> {
				this.pendingRequests.remove(requestId);
				// Only cancellation and session closure get here with a permit still held.
				CircuitBreaker.Permit permit = pending.endAttempt();
				if (permit != null) {
					this.circuitBreaker.release(permit);
				}
			});
			pending.setDeadlineTimer(this.timerScheduler.schedule(() -> expire(pending, timeout), timeout.toNanos(),
					TimeUnit.NANOSECONDS));

			enqueue(pending);
			if (this.closed.get()) {
				pending.fail(new SessionClosedError(this.serverName));
			}
			return Mono.fromFuture(pending.future());
		});
	}

	private void enqueue(PendingRequest pending) {
		try {
			this.outboundQueue.enqueue(pending, pending.priority(), MessageDirection.OUTBOUND);
		}
		catch (McpError e) {
			pending.fail(e);
		}
	}

	private void expire(PendingRequest pending, Duration timeout) {
		CircuitBreaker.Permit permit = pending.endAttempt();
		boolean resolved = pending.fail(new McpTimeoutError("Request " + pending.request().method() + " to '"
				+ this.serverName + "' timed out after " + timeout.toMillis() + " ms"));
		if (permit != null) {
			if (resolved) {
				this.totalErrors.incrementAndGet();
				this.circuitBreaker.onFailure(permit);
			}
			else {
				this.circuitBreaker.release(permit);
			}
		}
		if (resolved) {
			logger.warn("Request {} to '{}' timed out after {} attempt(s)", pending.correlationId(), this.serverName,
					pending.attempts());
		}
	}

	private void runOutboundLoop() {
		logger.debug("Outbound dispatcher for '{}' started", this.serverName);
		while (!this.closed.get()) {
			QueuedMessage<PendingRequest> message;
			try {
				message = this.outboundQueue.dequeue(this.pollInterval);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}
			if (message == null) {
				continue;
			}
			PendingRequest pending = message.payload();
			try {
				dispatch(pending);
			}
			catch (RuntimeException e) {
				logger.error("Failed to dispatch {} to '{}'", pending, this.serverName, e);
				onAttemptError(pending, e);
			}
		}
		logger.debug("Outbound dispatcher for '{}' stopped", this.serverName);
	}

	private void dispatch(PendingRequest pending) {
		if (pending.isDone()) {
			return;
		}
		if (this.closed.get()) {
			pending.fail(new SessionClosedError(this.serverName));
			return;
		}

		CircuitBreaker.Permit permit = this.circuitBreaker.tryAcquirePermission();
		if (permit == CircuitBreaker.Permit.REJECTED) {
			pending.fail(new CircuitOpenError(this.serverName, this.circuitBreaker.remainingCooldown()));
			return;
		}

		pending.beginAttempt(permit);
		if (pending.isDone()) {
			// Resolved between the check above and taking the permit.
			CircuitBreaker.Permit held = pending.endAttempt();
			if (held != null) {
				this.circuitBreaker.release(held);
			}
			return;
		}

		this.totalRequests.incrementAndGet();
		logger.debug("Dispatching {} to '{}' (attempt {}/{}, permit {})", pending.correlationId(), this.serverName,
				pending.attempts(), pending.maxAttempts(), permit);

		this.transport.send(pending.request())
			.subscribe(this::handleInboundMessage, error -> onAttemptError(pending, error));
	}

	private void onAttemptError(PendingRequest pending, Throwable error) {
		McpError mcpError = McpError.classify(error);
		CircuitBreaker.Permit permit = pending.endAttempt();
		if (permit == null) {
			logger.debug("Ignoring late failure of {} to '{}': {}", pending.correlationId(), this.serverName,
					mcpError.getMessage());
			return;
		}
		this.totalErrors.incrementAndGet();

		if (!mcpError.isTransient()) {
			this.circuitBreaker.release(permit);
			pending.fail(mcpError);
			return;
		}

		this.circuitBreaker.onFailure(permit);
		if (this.retryPolicy.shouldRetry(pending.attempts(), pending.maxAttempts(), mcpError) && !this.closed.get()) {
			Duration delay = this.retryPolicy.delay(pending.attempts() - 1);
			if (this.clock.instant().plus(delay).isBefore(pending.deadline())) {
				logger.warn("Attempt {}/{} of {} to '{}' failed ({}), retrying in {} ms", pending.attempts(),
						pending.maxAttempts(), pending.correlationId(), this.serverName, mcpError.getMessage(),
						delay.toMillis());
				this.timerScheduler.schedule(() -> retry(pending), delay.toNanos(), TimeUnit.NANOSECONDS);
				return;
			}
		}
		pending.fail(mcpError);
	}

	private void retry(PendingRequest pending) {
		if (pending.isDone()) {
			return;
		}
		if (this.closed.get()) {
			pending.fail(new SessionClosedError(this.serverName));
			return;
		}
		enqueue(pending);
	}

	/**
	 * 以会话特定前缀加原子计数器生成请求ID。重试沿用同一个ID。
	 * @return 唯一的请求ID
	 */
	private String generateRequestId() {
		return this.sessionPrefix + "-" + this.requestCounter.getAndIncrement();
	}

	@Override
	public Mono<Void> sendNotification(String method, Object params) {
		return Mono.defer(() -> {
			if (this.closed.get()) {
				return Mono.error(new SessionClosedError(this.serverName));
			}
			McpSchema.JSONRPCNotification notification = new McpSchema.JSONRPCNotification(
					McpSchema.JSONRPC_VERSION, method, params);
			return this.transport.sendMessage(notification);
		}).onErrorMap(error -> !(error instanceof McpError), McpError::classify);
	}

	// --------------------------
	// Inbound
	// --------------------------

	/**
	 * 把一条入站消息路由到等待的请求、请求处理器或入站队列。这是会话中唯一处理入站消息的路径。
	 * @param message 入站消息
	 */
	void handleInboundMessage(McpSchema.JSONRPCMessage message) {
		if (message instanceof McpSchema.JSONRPCResponse response) {
			handleResponse(response);
		}
		else if (message instanceof McpSchema.JSONRPCRequest request) {
			logger.debug("Received request from '{}': {}", this.serverName, request);
			handleIncomingRequest(request).flatMap(this.transport::sendMessage)
				.subscribe(null, error -> logger.error("Failed to answer {} from '{}': {}", request.method(),
						this.serverName, error.getMessage()));
		}
		else if (message instanceof McpSchema.JSONRPCNotification notification) {
			logger.debug("Received notification from '{}': {}", this.serverName, notification);
			try {
				this.inboundQueue.enqueue(notification, notificationPriority(notification.method()),
						MessageDirection.INBOUND);
			}
			catch (McpError e) {
				logger.error("Dropping notification {} from '{}' ({} dropped so far): {}", notification.method(),
						this.serverName, this.inboundQueue.stats().totalDropped(), e.getMessage());
			}
		}
	}

	private void handleResponse(McpSchema.JSONRPCResponse response) {
		PendingRequest pending = this.pendingRequests.get(response.id());
		if (pending == null) {
			logger.warn("Unexpected response from '{}' for unknown id {}", this.serverName, response.id());
			return;
		}
		CircuitBreaker.Permit permit = pending.endAttempt();
		if (permit != null) {
			this.circuitBreaker.onSuccess(permit);
		}
		if (!pending.complete(response)) {
			logger.debug("Discarding late response {} from '{}'", response.id(), this.serverName);
		}
	}

	private Mono<McpSchema.JSONRPCResponse> handleIncomingRequest(McpSchema.JSONRPCRequest request) {
		return Mono.defer(() -> {
			var handler = this.requestHandlers.get(request.method());
			if (handler == null) {
				return Mono.just(new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null,
						new McpSchema.JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.METHOD_NOT_FOUND,
								"Method not found: " + request.method(), null)));
			}
			return handler.handle(request.params())
				.map(result -> new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), result, null))
				.onErrorResume(error -> Mono.just(new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION,
						request.id(), null, new McpSchema.JSONRPCResponse.JSONRPCError(
								McpSchema.ErrorCodes.INTERNAL_ERROR, error.getMessage(), null))));
		});
	}

	private static MessagePriority notificationPriority(String method) {
		if (McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED.equals(method)
				|| McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED.equals(method)) {
			return MessagePriority.HIGH;
		}
		return MessagePriority.NORMAL;
	}

	private void runInboundLoop() {
		while (!this.closed.get()) {
			QueuedMessage<McpSchema.JSONRPCNotification> message;
			try {
				message = this.inboundQueue.dequeue(this.pollInterval);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}
			if (message != null) {
				dispatchNotification(message.payload());
			}
		}
	}

	private void dispatchNotification(McpSchema.JSONRPCNotification notification) {
		NotificationHandler handler = this.notificationHandlers.get(notification.method());
		if (handler == null) {
			logger.warn("No handler registered for notification method: {}", notification.method());
			return;
		}
		try {
			handler.handle(notification.params()).block();
		}
		catch (RuntimeException e) {
			logger.error("Error handling notification {} from '{}'", notification.method(), this.serverName, e);
		}
	}

	/**
	 * 把从带外渠道收到的原始JSON交给传输层的入站路径。
	 * @param rawMessage 原始JSON文本
	 */
	public void acceptInbound(String rawMessage) {
		if (this.closed.get()) {
			throw new SessionClosedError(this.serverName);
		}
		this.transport.acceptInbound(rawMessage);
	}

	// --------------------------
	// Lifecycle and Observability
	// --------------------------

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			if (!shutdown()) {
				return Mono.empty();
			}
			return this.transport.closeGracefully().onErrorResume(error -> {
				logger.warn("Error closing transport for '{}': {}", this.serverName, error.getMessage());
				return Mono.empty();
			});
		});
	}

	@Override
	public void close() {
		if (shutdown()) {
			this.transport.close();
		}
	}

	/**
	 * 以{@link SessionClosedError}解决所有排队和在途的请求并停止分发线程。
	 * @return 本次调用执行了关闭时为{@code true}
	 */
	private boolean shutdown() {
		if (!this.closed.compareAndSet(false, true)) {
			return false;
		}
		SessionClosedError error = new SessionClosedError(this.serverName);
		int failed = 0;
		for (QueuedMessage<PendingRequest> queued : this.outboundQueue.drain()) {
			if (queued.payload().fail(error)) {
				failed++;
			}
		}
		List<PendingRequest> inFlight = new ArrayList<>(this.pendingRequests.values());
		for (PendingRequest pending : inFlight) {
			if (pending.fail(error)) {
				failed++;
			}
		}
		int droppedNotifications = this.inboundQueue.drain().size();
		this.outboundScheduler.dispose();
		this.inboundScheduler.dispose();
		logger.info("Connection to '{}' closed, {} pending request(s) failed, {} notification(s) dropped",
				this.serverName, failed, droppedNotifications);
		return true;
	}

	public String getServerName() {
		return this.serverName;
	}

	public CircuitBreaker getCircuitBreaker() {
		return this.circuitBreaker;
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	public int getPendingCount() {
		return this.pendingRequests.size();
	}

	public QueueStats getOutboundQueueStats() {
		return this.outboundQueue.stats();
	}

	/**
	 * @return 入站通知队列的统计，{@link QueueStats#totalDropped()}是因队列已满而丢弃的通知数
	 */
	public QueueStats getInboundQueueStats() {
		return this.inboundQueue.stats();
	}

	public long getTotalRequests() {
		return this.totalRequests.get();
	}

	public long getTotalErrors() {
		return this.totalErrors.get();
	}

	public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
		return this.transport.unmarshalFrom(data, typeRef);
	}

}
