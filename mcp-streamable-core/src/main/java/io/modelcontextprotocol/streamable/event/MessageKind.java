/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.event;

import io.modelcontextprotocol.streamable.spec.McpSchema;

/**
 * The classes of outbound events a resumable stream carries. Retention decisions are
 * made on this tag by a {@link RetentionPolicy}.
 */
public enum MessageKind {

	/** A server-initiated request that the client must answer, e.g. elicitation. */
	REQUEST,

	/** A response to a client request. */
	RESPONSE,

	/** A notification. Delivery is best-effort by protocol design. */
	NOTIFICATION,

	/** The empty event that opens a stream and hands the client its first event id. */
	PRIMING;

	/**
	 * @param message an outbound message, or {@code null} for a priming event
	 * @return the kind of the message
	 */
	public static MessageKind of(McpSchema.JSONRPCMessage message) {
		if (message == null) {
			return PRIMING;
		}
		if (message instanceof McpSchema.JSONRPCRequest) {
			return REQUEST;
		}
		if (message instanceof McpSchema.JSONRPCResponse) {
			return RESPONSE;
		}
		return NOTIFICATION;
	}

}
