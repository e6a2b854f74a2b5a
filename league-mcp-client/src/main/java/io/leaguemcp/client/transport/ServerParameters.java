/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.transport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.leaguemcp.util.Assert;

/**
 * 启动以标准输入/输出通信的智能体进程所需的参数。
 */
public class ServerParameters {

	private final String command;

	private final List<String> args;

	private final Map<String, String> env;

	private ServerParameters(String command, List<String> args, Map<String, String> env) {
		Assert.hasText(command, "The command can not be empty");
		this.command = command;
		this.args = List.copyOf(args);
		this.env = Map.copyOf(env);
	}

	public String getCommand() {
		return this.command;
	}

	public List<String> getArgs() {
		return this.args;
	}

	public Map<String, String> getEnv() {
		return this.env;
	}

	public static Builder builder(String command) {
		return new Builder(command);
	}

	@Override
	public String toString() {
		return "ServerParameters[command=" + this.command + ", args=" + this.args + "]";
	}

	public static class Builder {

		private final String command;

		private final List<String> args = new ArrayList<>();

		private final Map<String, String> env = new HashMap<>();

		Builder(String command) {
			Assert.hasText(command, "The command can not be empty");
			this.command = command;
		}

		public Builder args(String... args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(Arrays.asList(args));
			return this;
		}

		public Builder args(List<String> args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(args);
			return this;
		}

		public Builder addEnvVar(String key, String value) {
			Assert.hasText(key, "The key can not be empty");
			Assert.notNull(value, "The value can not be null");
			this.env.put(key, value);
			return this;
		}

		public ServerParameters build() {
			return new ServerParameters(this.command, this.args, this.env);
		}

	}

}
