/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.stream;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.modelcontextprotocol.streamable.event.McpEventStreamStore;
import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.session.SessionMetadata;
import io.modelcontextprotocol.streamable.session.SessionRemovalListener;
import io.modelcontextprotocol.streamable.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Opens and tracks the live {@link McpResumableStream resumable streams} of every
 * session. Registered as a {@link SessionRemovalListener}, it closes the streams of a
 * session and drops their retained events once the session is closed or pruned.
 */
public class McpStreamRegistry implements SessionRemovalListener {

	private static final Logger logger = LoggerFactory.getLogger(McpStreamRegistry.class);

	// sessionId -> (streamId -> stream)
	private final ConcurrentHashMap<String, Map<String, McpResumableStream>> streams = new ConcurrentHashMap<>();

	private final McpEventStreamStore eventStore;

	private final McpJsonMapper jsonMapper;

	private final Duration retryInterval;

	public McpStreamRegistry(McpEventStreamStore eventStore, McpJsonMapper jsonMapper, Duration retryInterval) {
		Assert.notNull(eventStore, "eventStore must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.isPositive(retryInterval, "retryInterval must be positive");
		this.eventStore = eventStore;
		this.jsonMapper = jsonMapper;
		this.retryInterval = retryInterval;
	}

	/**
	 * Opens a stream writing to {@code writer}. A stream already open under the same id
	 * is closed and replaced, which happens when a client reconnects.
	 * @param sessionId the owning session
	 * @param streamId the stream id
	 * @param writer the live response
	 * @return the new stream
	 */
	public McpResumableStream open(String sessionId, String streamId, McpSseWriter writer) {
		McpResumableStream stream = new McpResumableStream(sessionId, streamId, this.eventStore, this.jsonMapper,
				writer, this.retryInterval);
		McpResumableStream previous = this.streams.computeIfAbsent(sessionId, id -> new ConcurrentHashMap<>())
			.put(streamId, stream);
		if (previous != null) {
			logger.debug("Replacing stream {} of session {}", streamId, sessionId);
			previous.close().subscribe(null, error -> logger.warn("Failed to close replaced stream {}", streamId, error));
		}
		return stream;
	}

	/**
	 * @param sessionId the owning session
	 * @param streamId the stream id
	 * @return the open stream, or an empty Mono
	 */
	public Mono<McpResumableStream> get(String sessionId, String streamId) {
		return Mono.fromSupplier(() -> {
			Map<String, McpResumableStream> sessionStreams = this.streams.get(sessionId);
			return sessionStreams != null ? sessionStreams.get(streamId) : null;
		});
	}

	/**
	 * @param sessionId the owning session
	 * @return the open streams of the session
	 */
	public Collection<McpResumableStream> streams(String sessionId) {
		Map<String, McpResumableStream> sessionStreams = this.streams.get(sessionId);
		return sessionStreams != null ? List.copyOf(sessionStreams.values()) : List.of();
	}

	/**
	 * Closes a single stream and forgets it. Its retained events are kept so that the
	 * client can still resume it on a new request.
	 * @param stream the stream to close
	 * @return a Mono that completes once the stream is closed
	 */
	public Mono<Void> close(McpResumableStream stream) {
		Map<String, McpResumableStream> sessionStreams = this.streams.get(stream.sessionId());
		if (sessionStreams != null) {
			sessionStreams.remove(stream.streamId(), stream);
		}
		return stream.close();
	}

	/**
	 * Closes every stream of a session and removes their retained events.
	 * @param sessionId the session
	 * @return a Mono that completes once all streams are closed and removed
	 */
	public Mono<Void> closeSession(String sessionId) {
		return Mono.defer(() -> {
			Map<String, McpResumableStream> sessionStreams = this.streams.remove(sessionId);
			if (sessionStreams == null) {
				return Mono.empty();
			}
			return Flux.fromIterable(sessionStreams.values())
				.flatMap(stream -> stream.close()
					.onErrorResume(error -> {
						logger.warn("Failed to close stream {} of session {}", stream.streamId(), sessionId, error);
						return Mono.empty();
					})
					.then(this.eventStore.removeStream(sessionId, stream.streamId())))
				.then();
		});
	}

	@Override
	public void onSessionRemoved(SessionMetadata session, RemovalCause cause) {
		logger.debug("Closing streams of session {} removed ({})", session.sessionId(), cause);
		closeSession(session.sessionId()).subscribe(null,
				error -> logger.error("Failed to release streams of session {}", session.sessionId(), error));
	}

}
