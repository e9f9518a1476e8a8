/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.spec;

/**
 * Raised when a session or event store backend (a distributed cache, a remote key-value
 * store) cannot complete an operation. Distinct from protocol errors so callers can tell
 * an unreachable backend apart from a missing session or a malformed request. Stores
 * never retry internally.
 */
public class McpStoreException extends RuntimeException {

	private final String operation;

	public McpStoreException(String operation, Throwable cause) {
		super("Store operation '" + operation + "' failed: " + (cause != null ? cause.getMessage() : "unknown"),
				cause);
		this.operation = operation;
	}

	/**
	 * @return the name of the store operation that failed, for example {@code "get"}
	 */
	public String getOperation() {
		return this.operation;
	}

}
