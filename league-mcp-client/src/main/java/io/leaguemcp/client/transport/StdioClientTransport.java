/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leaguemcp.spec.McpClientTransport;
import io.leaguemcp.spec.McpError;
import io.leaguemcp.spec.McpProtocolError;
import io.leaguemcp.spec.McpSchema;
import io.leaguemcp.spec.McpSchema.JSONRPCMessage;
import io.leaguemcp.spec.McpTransportError;
import io.leaguemcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 行分帧的流式传输：启动智能体子进程，通过stdin/stdout交换以换行符分隔的JSON-RPC消息，
 * stderr只用于诊断输出。
 *
 * <p>
 * 该传输没有同步回复，{@link #send(JSONRPCMessage)}在消息进入写队列后即完成，
 * 响应经由入站流交给连接时注册的处理器，由连接管理器按关联ID匹配。
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 */
public class StdioClientTransport implements McpClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(StdioClientTransport.class);

	private final Sinks.Many<JSONRPCMessage> inboundSink;

	private final Sinks.Many<JSONRPCMessage> outboundSink;

	private final Sinks.Many<String> errorSink;

	/** 正在通信的服务器进程 */
	private Process process;

	private final ObjectMapper objectMapper;

	/** 读取进程stdout的线程 */
	private final Scheduler inboundScheduler;

	/** 写入进程stdin的线程 */
	private final Scheduler outboundScheduler;

	/** 读取进程stderr的线程 */
	private final Scheduler errorScheduler;

	private final ServerParameters params;

	private final Object emitLock = new Object();

	private volatile boolean isClosing = false;

	private Consumer<String> stdErrorHandler = error -> logger.info("STDERR Message received: {}", error);

	public StdioClientTransport(ServerParameters params) {
		this(params, new ObjectMapper());
	}

	public StdioClientTransport(ServerParameters params, ObjectMapper objectMapper) {
		Assert.notNull(params, "The params can not be null");
		Assert.notNull(objectMapper, "The ObjectMapper can not be null");

		this.inboundSink = Sinks.many().unicast().onBackpressureBuffer();
		this.outboundSink = Sinks.many().unicast().onBackpressureBuffer();
		this.errorSink = Sinks.many().unicast().onBackpressureBuffer();

		this.params = params;
		this.objectMapper = objectMapper;

		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "stdio-inbound");
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "stdio-outbound");
		this.errorScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "stdio-error");
	}

	/**
	 * 启动服务器进程以及入站、出站和错误处理线程。
	 * @throws McpTransportError 如果进程无法启动
	 */
	@Override
	public Mono<Void> connect(Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> handler) {
		return Mono.<Void>fromRunnable(() -> {
			handleIncomingMessages(handler);
			handleIncomingErrors();

			List<String> fullCommand = new ArrayList<>();
			fullCommand.add(this.params.getCommand());
			fullCommand.addAll(this.params.getArgs());

			ProcessBuilder processBuilder = this.getProcessBuilder();
			processBuilder.command(fullCommand);
			processBuilder.environment().putAll(this.params.getEnv());

			try {
				this.process = processBuilder.start();
			}
			catch (IOException e) {
				throw new McpTransportError("Failed to start process with command: " + fullCommand, e);
			}

			startInboundProcessing();
			startOutboundProcessing();
			startErrorProcessing();
		}).subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * 创建新的ProcessBuilder实例。受保护以便在测试中重写。
	 * @return 新的ProcessBuilder实例
	 */
	protected ProcessBuilder getProcessBuilder() {
		return new ProcessBuilder();
	}

	public void setStdErrorHandler(Consumer<String> errorHandler) {
		Assert.notNull(errorHandler, "The errorHandler can not be null");
		this.stdErrorHandler = errorHandler;
	}

	private void handleIncomingMessages(Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> inboundMessageHandler) {
		this.inboundSink.asFlux()
			.concatMap(message -> Mono.just(message)
				.transform(inboundMessageHandler)
				.onErrorResume(error -> {
					logger.error("Error handling inbound message: {}", error.getMessage());
					return Mono.empty();
				}))
			.subscribe();
	}

	private void handleIncomingErrors() {
		this.errorSink.asFlux().subscribe(e -> this.stdErrorHandler.accept(e));
	}

	private void startErrorProcessing() {
		this.errorScheduler.schedule(() -> {
			try (BufferedReader processErrorReader = new BufferedReader(
					new InputStreamReader(this.process.getErrorStream(), StandardCharsets.UTF_8))) {
				String line;
				while (!this.isClosing && (line = processErrorReader.readLine()) != null) {
					if (!this.errorSink.tryEmitNext(line).isSuccess()) {
						if (!this.isClosing) {
							logger.error("Failed to emit error message");
						}
						break;
					}
				}
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("Error reading from error stream", e);
				}
			}
			finally {
				this.errorSink.tryEmitComplete();
			}
		});
	}

	/**
	 * 从进程stdout逐行读取JSON-RPC消息。无法解析的行被记录并跳过，不会终止读循环。
	 */
	private void startInboundProcessing() {
		this.inboundScheduler.schedule(() -> {
			try (BufferedReader processReader = new BufferedReader(
					new InputStreamReader(this.process.getInputStream(), StandardCharsets.UTF_8))) {
				String line;
				while (!this.isClosing && (line = processReader.readLine()) != null) {
					try {
						emitInbound(McpSchema.deserializeJsonRpcMessage(this.objectMapper, line));
					}
					catch (IOException | IllegalArgumentException e) {
						logger.error("Skipping malformed inbound line: {}", line, e);
					}
				}
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("Error reading from input stream", e);
				}
			}
			finally {
				this.isClosing = true;
				synchronized (this.emitLock) {
					this.inboundSink.tryEmitComplete();
				}
			}
		});
	}

	private void emitInbound(JSONRPCMessage message) {
		synchronized (this.emitLock) {
			if (!this.inboundSink.tryEmitNext(message).isSuccess() && !this.isClosing) {
				logger.error("Failed to enqueue inbound message: {}", message);
			}
		}
	}

	@Override
	public void acceptInbound(String rawMessage) {
		try {
			emitInbound(McpSchema.deserializeJsonRpcMessage(this.objectMapper, rawMessage));
		}
		catch (IOException | IllegalArgumentException e) {
			throw new McpProtocolError("Malformed inbound message", e);
		}
	}

	@Override
	public Mono<JSONRPCMessage> send(JSONRPCMessage message) {
		return Mono.defer(() -> {
			if (this.isClosing) {
				return Mono.error(new McpTransportError("Process stream is closed: " + this.params.getCommand()));
			}
			boolean emitted;
			synchronized (this.outboundSink) {
				emitted = this.outboundSink.tryEmitNext(message).isSuccess();
			}
			if (emitted) {
				return Mono.empty();
			}
			return Mono.error(new McpTransportError("Failed to enqueue message"));
		});
	}

	/**
	 * 将消息序列化为单行JSON写入进程stdin。写入发生在专用线程上。
	 */
	private void startOutboundProcessing() {
		this.handleOutbound(messages -> messages.publishOn(this.outboundScheduler).handle((message, s) -> {
			if (message != null && !this.isClosing) {
				try {
					String jsonMessage = this.objectMapper.writeValueAsString(message);
					// Messages are delimited by newlines and must not contain embedded ones.
					jsonMessage = jsonMessage.replace("\r\n", "\\n").replace("\n", "\\n").replace("\r", "\\n");

					var os = this.process.getOutputStream();
					synchronized (os) {
						os.write(jsonMessage.getBytes(StandardCharsets.UTF_8));
						os.write("\n".getBytes(StandardCharsets.UTF_8));
						os.flush();
					}
					s.next(message);
				}
				catch (IOException e) {
					s.error(new McpTransportError("Failed to write to process", e));
				}
			}
		}));
	}

	protected void handleOutbound(Function<Flux<JSONRPCMessage>, Flux<JSONRPCMessage>> outboundConsumer) {
		outboundConsumer.apply(this.outboundSink.asFlux()).doOnComplete(() -> {
			this.isClosing = true;
			this.outboundSink.tryEmitComplete();
		}).doOnError(e -> {
			if (!this.isClosing) {
				logger.error("Error in outbound processing", e);
				this.isClosing = true;
				this.outboundSink.tryEmitComplete();
			}
		}).onErrorResume(e -> Mono.empty()).subscribe();
	}

	/**
	 * 销毁子进程并释放调度器。
	 * @return 传输关闭后完成的Mono
	 */
	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			this.isClosing = true;
			logger.debug("Initiating graceful shutdown");
		}).then(Mono.defer(() -> {
			synchronized (this.emitLock) {
				this.inboundSink.tryEmitComplete();
			}
			this.outboundSink.tryEmitComplete();
			this.errorSink.tryEmitComplete();
			return Mono.delay(Duration.ofMillis(100));
		})).then(Mono.defer(() -> {
			if (this.process != null) {
				logger.debug("Sending TERM to process");
				this.process.destroy();
				return Mono.fromFuture(this.process.onExit()).doOnNext(exited -> {
					if (exited.exitValue() != 0) {
						logger.warn("Process terminated with code {}", exited.exitValue());
					}
				}).then();
			}
			logger.warn("Process not started");
			return Mono.<Void>empty();
		})).then(Mono.<Void>fromRunnable(() -> {
			// Reader threads block on readLine, so a hard dispose is required.
			this.inboundScheduler.dispose();
			this.errorScheduler.dispose();
			this.outboundScheduler.dispose();
			logger.debug("Graceful shutdown completed");
		})).onErrorMap(error -> !(error instanceof McpError), McpError::classify)
			.subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
		return this.objectMapper.convertValue(data, typeRef);
	}

}
