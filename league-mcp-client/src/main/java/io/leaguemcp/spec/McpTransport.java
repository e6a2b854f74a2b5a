/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.spec;

import com.fasterxml.jackson.core.type.TypeReference;
import io.leaguemcp.spec.McpSchema.JSONRPCMessage;
import reactor.core.publisher.Mono;

/**
 * 联赛MCP通信的传输层抽象。
 *
 * <p>
 * 传输层是无状态且可替换的：它只负责把一条消息送达对端并交回对端的同步回复（如果有），
 * 不做重试，也不解释消息内容。重试、熔断和关联都由连接管理器负责。
 * </p>
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 */
public interface McpTransport {

	/**
	 * 关闭传输连接并释放相关资源。
	 */
	default void close() {
		this.closeGracefully().subscribe();
	}

	/**
	 * 异步关闭传输连接并释放相关资源。
	 * @return 连接关闭时完成的 {@link Mono<Void>}
	 */
	Mono<Void> closeGracefully();

	/**
	 * 发送一条不期待同步回复的消息，例如通知或对服务器请求的应答。
	 * @param message 要发送的 {@link JSONRPCMessage}
	 * @return 消息发出后完成的 {@link Mono<Void>}
	 */
	default Mono<Void> sendMessage(JSONRPCMessage message) {
		return this.send(message).then();
	}

	/**
	 * 发送一条消息，并在传输层支持时返回对端的同步回复。
	 *
	 * <p>
	 * HTTP传输以响应体作为回复；流式传输的回复经由入站流到达，因此返回空的Mono。
	 * 连接失败以{@link McpTransportError}结束，畸形回复以{@link McpProtocolError}结束。
	 * </p>
	 * @param message 要发送的消息
	 * @return 同步回复，或者在没有同步回复时为空
	 */
	Mono<JSONRPCMessage> send(JSONRPCMessage message);

	/**
	 * 将给定数据解组为指定类型的对象。
	 * @param <T> 目标类型
	 * @param data 要解组的数据
	 * @param typeRef 目标类型引用
	 * @return 解组后的对象
	 */
	<T> T unmarshalFrom(Object data, TypeReference<T> typeRef);

}
