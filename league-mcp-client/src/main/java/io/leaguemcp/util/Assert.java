/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.util;

import java.time.Duration;

import reactor.util.annotation.Nullable;

/**
 * 参数校验用的断言工具类，校验失败时抛出{@link IllegalArgumentException}。
 *
 * @author Christian Tzolov
 */
public final class Assert {

	private Assert() {
	}

	/**
	 * 断言对象不为 {@code null}。
	 *
	 * <pre class="code">
	 * Assert.notNull(transport, "The transport can not be null");
	 * </pre>
	 * @param object 要检查的对象
	 * @param message 断言失败时使用的异常消息
	 */
	public static void notNull(@Nullable Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言给定的字符串包含有效文本，即不为 {@code null} 且至少包含一个非空白字符。
	 * @param text 要检查的字符串
	 * @param message 断言失败时使用的异常消息
	 */
	public static void hasText(@Nullable String text, String message) {
		if (!Utils.hasText(text)) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言条件为真。
	 * @param condition 要检查的条件
	 * @param message 断言失败时使用的异常消息
	 */
	public static void isTrue(boolean condition, String message) {
		if (!condition) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言时长不为 {@code null} 且严格为正。
	 * @param duration 要检查的时长
	 * @param message 断言失败时使用的异常消息
	 */
	public static void positive(@Nullable Duration duration, String message) {
		if (duration == null || duration.isNegative() || duration.isZero()) {
			throw new IllegalArgumentException(message);
		}
	}

}
