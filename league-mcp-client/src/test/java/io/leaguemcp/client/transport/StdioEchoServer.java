/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.leaguemcp.client.transport;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 作为子进程运行的行分帧JSON-RPC服务器：把每个请求的参数原样作为结果返回。
 *
 * <p>
 * 方法{@code garbled}先输出一行非JSON文本再回复；通知{@code exit}使进程退出。
 */
public final class StdioEchoServer {

	static final String READY_LINE = "echo server ready";

	private StdioEchoServer() {
	}

	public static void main(String[] args) throws IOException {
		ObjectMapper mapper = new ObjectMapper();
		BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		Writer out = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
		System.err.println(READY_LINE);
		System.err.flush();

		String line;
		while ((line = in.readLine()) != null) {
			JsonNode message = mapper.readTree(line);
			String method = message.path("method").asText();
			if ("exit".equals(method)) {
				break;
			}
			if (!message.has("id")) {
				continue;
			}
			if ("garbled".equals(method)) {
				out.write("this is not json\n");
			}
			ObjectNode reply = mapper.createObjectNode();
			reply.put("jsonrpc", "2.0");
			reply.set("id", message.get("id"));
			reply.set("result", message.has("params") ? message.get("params") : mapper.createObjectNode());
			out.write(mapper.writeValueAsString(reply));
			out.write("\n");
			out.flush();
		}
		out.flush();
	}

}
