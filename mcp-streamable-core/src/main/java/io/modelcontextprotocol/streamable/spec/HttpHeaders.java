/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.spec;

/**
 * Names of HTTP headers in use by MCP streamable HTTP transports.
 */
public interface HttpHeaders {

	/**
	 * Identifies individual MCP sessions.
	 */
	String MCP_SESSION_ID = "Mcp-Session-Id";

	/**
	 * Identifies the last event a reconnecting client has seen on an SSE stream.
	 */
	String LAST_EVENT_ID = "Last-Event-ID";

	/**
	 * The authority the request was addressed to. Validated against DNS rebinding.
	 */
	String HOST = "Host";

	/**
	 * The origin of a browser-initiated request. Validated against DNS rebinding.
	 */
	String ORIGIN = "Origin";

}
