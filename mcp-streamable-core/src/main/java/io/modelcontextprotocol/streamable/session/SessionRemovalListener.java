/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.session;

/**
 * Callback invoked after a session has been removed from a {@link McpSessionStore}.
 * Invoked once per removed session, outside any store lock.
 */
@FunctionalInterface
public interface SessionRemovalListener {

	void onSessionRemoved(SessionMetadata session, RemovalCause cause);

	/**
	 * Why a session left the store.
	 */
	enum RemovalCause {

		/** Closed by the client or the server. */
		EXPLICIT,

		/** Pruned after exceeding the idle timeout. */
		IDLE,

		/** Dropped by {@link McpSessionStore#clear()}. */
		CLEARED

	}

}
