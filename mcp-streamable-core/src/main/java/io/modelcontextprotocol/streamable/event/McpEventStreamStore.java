/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.event;

import java.time.Instant;
import java.util.function.Function;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Retains outbound events of resumable SSE streams so that a client reconnecting with a
 * {@code Last-Event-ID} receives exactly the events it missed.
 * <p>
 * Implementations are safe for concurrent use. Ordering is guaranteed per
 * {@code (sessionId, streamId)} only. Backend failures surface as
 * {@link io.modelcontextprotocol.streamable.spec.McpStoreException}; implementations do
 * not retry.
 */
public interface McpEventStreamStore {

	/**
	 * Allocates the id of the next event on a stream. Every id returned sorts after all
	 * ids previously allocated for the same stream.
	 * @param sessionId the owning session
	 * @param streamId the stream within the session
	 * @return the allocated id
	 */
	Mono<EventId> nextEventId(String sessionId, String streamId);

	/**
	 * Offers an event for retention. Whether it is kept is decided by the store's
	 * {@link RetentionPolicy}.
	 * @param sessionId the owning session
	 * @param streamId the stream within the session
	 * @param event the event, whose id must belong to the given stream
	 * @return {@code true} if the event was retained
	 */
	Mono<Boolean> storeEvent(String sessionId, String streamId, StoredEvent event);

	/**
	 * Replays the retained events that follow {@code lastEventId} on its stream. Events
	 * with an id equal to or before {@code lastEventId} are not delivered.
	 * <p>
	 * The store finishes its own bookkeeping and releases any internal lock before it
	 * subscribes to the Mono returned by {@code deliver}, which receives a lazy,
	 * single-pass sequence of the events in id order. An unknown, expired or malformed
	 * {@code lastEventId} delivers an empty sequence.
	 * @param lastEventId the last event id the client has seen
	 * @param deliver consumes the events to replay, typically by writing them to an HTTP
	 * response
	 * @return the id of the replayed stream, or an empty Mono if the stream is unknown
	 */
	Mono<String> replayEventsAfter(String lastEventId, Function<Flux<StoredEvent>, Mono<Void>> deliver);

	/**
	 * Removes expired events, and every stream left without events.
	 * @param now the current time
	 * @return the number of events removed
	 */
	Mono<Integer> cleanExpired(Instant now);

	/**
	 * Drops all retained state of a stream, typically once its session is closed.
	 * @param sessionId the owning session
	 * @param streamId the stream within the session
	 * @return a Mono that completes once the stream is removed
	 */
	Mono<Void> removeStream(String sessionId, String streamId);

}
