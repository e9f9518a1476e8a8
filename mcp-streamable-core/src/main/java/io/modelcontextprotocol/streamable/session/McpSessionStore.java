/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.session;

import java.time.Duration;
import java.time.Instant;

import reactor.core.publisher.Mono;

/**
 * Stores the {@link SessionMetadata} of live MCP transport sessions. Implementations
 * are safe for concurrent use without external locking. Backend failures surface as
 * {@link io.modelcontextprotocol.streamable.spec.McpStoreException}.
 */
public interface McpSessionStore {

	/**
	 * Inserts or replaces a session. The last writer wins; fields are never merged.
	 * @param session the session to store
	 * @return a Mono that completes once the session is stored
	 */
	Mono<Void> save(SessionMetadata session);

	/**
	 * @param sessionId the session id
	 * @return the session, or an empty Mono if it does not exist
	 */
	Mono<SessionMetadata> get(String sessionId);

	/**
	 * Records activity on a session. Does nothing if the session does not exist. The
	 * stored activity time only ever moves forward, so reordered calls converge to the
	 * greatest timestamp.
	 * @param sessionId the session id
	 * @param timestamp when the activity happened
	 * @return a Mono that completes once the activity is recorded
	 */
	Mono<Void> updateActivity(String sessionId, Instant timestamp);

	/**
	 * @param sessionId the session id
	 * @return {@code true} if a session was removed
	 */
	Mono<Boolean> remove(String sessionId);

	/**
	 * Removes every session whose last activity is more than {@code idleTimeout} before
	 * {@code now}. A session saved or updated while the prune runs is not lost.
	 * @param idleTimeout maximum allowed inactivity
	 * @param now the current time
	 * @return the number of sessions removed
	 */
	Mono<Integer> pruneIdle(Duration idleTimeout, Instant now);

	/**
	 * Removes all sessions.
	 * @return a Mono that completes once the store is empty
	 */
	Mono<Void> clear();

	/**
	 * @return the number of stored sessions
	 */
	Mono<Integer> count();

	/**
	 * Registers a listener notified of every session leaving the store.
	 * @param listener the listener
	 */
	void addRemovalListener(SessionRemovalListener listener);

}
