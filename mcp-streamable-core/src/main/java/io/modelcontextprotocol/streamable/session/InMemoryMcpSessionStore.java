/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.session;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import io.modelcontextprotocol.streamable.session.SessionRemovalListener.RemovalCause;
import io.modelcontextprotocol.streamable.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * {@link McpSessionStore} backed by a {@link ConcurrentHashMap}. Every mutation is a
 * single atomic map operation, so concurrent callers never observe a torn session.
 */
public class InMemoryMcpSessionStore implements McpSessionStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryMcpSessionStore.class);

	private final ConcurrentHashMap<String, SessionMetadata> sessions = new ConcurrentHashMap<>();

	private final List<SessionRemovalListener> removalListeners = new CopyOnWriteArrayList<>();

	@Override
	public Mono<Void> save(SessionMetadata session) {
		Assert.notNull(session, "session must not be null");
		return Mono.fromRunnable(() -> this.sessions.put(session.sessionId(), session));
	}

	@Override
	public Mono<SessionMetadata> get(String sessionId) {
		return Mono.fromSupplier(() -> sessionId != null ? this.sessions.get(sessionId) : null);
	}

	@Override
	public Mono<Void> updateActivity(String sessionId, Instant timestamp) {
		Assert.notNull(timestamp, "timestamp must not be null");
		return Mono.fromRunnable(() -> {
			if (sessionId != null) {
				this.sessions.computeIfPresent(sessionId, (id, existing) -> existing.withLastActivityAt(timestamp));
			}
		});
	}

	@Override
	public Mono<Boolean> remove(String sessionId) {
		return Mono.fromSupplier(() -> {
			SessionMetadata removed = sessionId != null ? this.sessions.remove(sessionId) : null;
			if (removed == null) {
				return false;
			}
			notifyRemoved(removed, RemovalCause.EXPLICIT);
			return true;
		});
	}

	@Override
	public Mono<Integer> pruneIdle(Duration idleTimeout, Instant now) {
		Assert.isPositive(idleTimeout, "idleTimeout must be positive");
		Assert.notNull(now, "now must not be null");
		return Mono.fromSupplier(() -> {
			List<SessionMetadata> pruned = new ArrayList<>();
			for (Map.Entry<String, SessionMetadata> entry : this.sessions.entrySet()) {
				SessionMetadata candidate = entry.getValue();
				if (Duration.between(candidate.lastActivityAt(), now).compareTo(idleTimeout) > 0
						&& this.sessions.remove(entry.getKey(), candidate)) {
					// a concurrent save or activity update replaces the value and makes
					// the conditional remove fail
					pruned.add(candidate);
				}
			}
			pruned.forEach(session -> notifyRemoved(session, RemovalCause.IDLE));
			if (!pruned.isEmpty()) {
				logger.debug("Pruned {} idle sessions", pruned.size());
			}
			return pruned.size();
		});
	}

	@Override
	public Mono<Void> clear() {
		return Mono.fromRunnable(() -> {
			List<SessionMetadata> cleared = new ArrayList<>();
			for (String sessionId : this.sessions.keySet()) {
				SessionMetadata removed = this.sessions.remove(sessionId);
				if (removed != null) {
					cleared.add(removed);
				}
			}
			cleared.forEach(session -> notifyRemoved(session, RemovalCause.CLEARED));
		});
	}

	@Override
	public Mono<Integer> count() {
		return Mono.fromSupplier(this.sessions::size);
	}

	@Override
	public void addRemovalListener(SessionRemovalListener listener) {
		Assert.notNull(listener, "listener must not be null");
		this.removalListeners.add(listener);
	}

	private void notifyRemoved(SessionMetadata session, RemovalCause cause) {
		for (SessionRemovalListener listener : this.removalListeners) {
			try {
				listener.onSessionRemoved(session, cause);
			}
			catch (Exception e) {
				logger.warn("Session removal listener failed for session {}", session.sessionId(), e);
			}
		}
	}

}
