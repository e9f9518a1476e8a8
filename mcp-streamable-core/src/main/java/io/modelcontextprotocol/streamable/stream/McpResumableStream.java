/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.stream;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import io.modelcontextprotocol.streamable.event.EventId;
import io.modelcontextprotocol.streamable.event.McpEventStreamStore;
import io.modelcontextprotocol.streamable.event.MessageKind;
import io.modelcontextprotocol.streamable.event.StoredEvent;
import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.spec.McpSchema;
import io.modelcontextprotocol.streamable.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One outbound SSE stream of a session that a client can resume after a disconnect.
 * <p>
 * Every outbound message is given an event id, offered to the
 * {@link McpEventStreamStore} and only then written to the live response, so an event
 * the client may miss is already retained when the write is attempted. Operations are
 * executed one at a time in the order they were requested, which keeps writes in event
 * id order.
 * <p>
 * Once {@link #switchToPolling() switched to polling} the live response is ended and
 * messages are only stored; the client collects them with
 * {@link #replayAfter(String)} requests.
 */
public class McpResumableStream {

	private static final Logger logger = LoggerFactory.getLogger(McpResumableStream.class);

	private final String sessionId;

	private final String streamId;

	private final McpEventStreamStore eventStore;

	private final McpJsonMapper jsonMapper;

	private final McpSseWriter writer;

	private final Duration retryInterval;

	private final McpStreamModeController controller;

	private final Sinks.Many<PendingOperation> operations = Sinks.many().unicast().onBackpressureBuffer();

	private final AtomicReference<Throwable> storeFailure = new AtomicReference<>();

	McpResumableStream(String sessionId, String streamId, McpEventStreamStore eventStore, McpJsonMapper jsonMapper,
			McpSseWriter writer, Duration retryInterval) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		Assert.hasText(streamId, "streamId must not be empty");
		Assert.notNull(eventStore, "eventStore must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(writer, "writer must not be null");
		Assert.isPositive(retryInterval, "retryInterval must be positive");
		this.sessionId = sessionId;
		this.streamId = streamId;
		this.eventStore = eventStore;
		this.jsonMapper = jsonMapper;
		this.writer = writer;
		this.retryInterval = retryInterval;
		this.controller = new McpStreamModeController(streamId);
		this.operations.asFlux()
			.concatMap(pending -> pending.operation()
				.doOnSuccess(v -> pending.done().tryEmitEmpty())
				.onErrorResume(error -> {
					pending.done().tryEmitError(error);
					return Mono.empty();
				}))
			.subscribe();
	}

	public String sessionId() {
		return this.sessionId;
	}

	public String streamId() {
		return this.streamId;
	}

	public StreamState state() {
		return this.controller.state();
	}

	/**
	 * Opens the stream with an empty event that hands the client an event id to resume
	 * from, together with the reconnection interval. Priming events are never replayed.
	 * @return the id of the priming event
	 */
	public Mono<EventId> prime() {
		AtomicReference<EventId> allocated = new AtomicReference<>();
		Mono<Void> operation = allocate(allocated)
			.flatMap(eventId -> deliver(StoredEvent.priming(eventId, this.retryInterval)));
		return enqueue(operation).then(Mono.fromSupplier(allocated::get));
	}

	/**
	 * Sends a message on the stream. The message is stored before it is written; while
	 * polling it is only stored.
	 * @param message the outbound message
	 * @return the event id assigned to the message
	 */
	public Mono<EventId> send(McpSchema.JSONRPCMessage message) {
		Assert.notNull(message, "message must not be null");
		return Mono.defer(() -> {
			if (this.controller.mode() == StreamMode.CLOSED) {
				return Mono.error(new IllegalStateException("Stream " + this.streamId + " is closed"));
			}
			AtomicReference<EventId> allocated = new AtomicReference<>();
			Mono<Void> operation = allocate(allocated)
				.flatMap(eventId -> Mono.fromCallable(() -> this.jsonMapper.writeValueAsBytes(message))
					.map(payload -> StoredEvent.message(eventId, MessageKind.of(message), payload)))
				.flatMap(this::deliver);
			return enqueue(operation).then(Mono.fromSupplier(allocated::get));
		});
	}

	/**
	 * Writes the retained events following {@code lastEventId} to the live response.
	 * @param lastEventId the last event id the client has seen
	 * @return the id of the replayed stream, or an empty Mono if nothing is retained for
	 * it
	 */
	public Mono<String> replayAfter(String lastEventId) {
		AtomicReference<String> replayed = new AtomicReference<>();
		Mono<Void> operation = this.eventStore
			.replayEventsAfter(lastEventId, events -> events.concatMap(this.writer::write).then())
			.doOnNext(replayed::set)
			.then();
		return enqueue(operation).then(Mono.fromSupplier(replayed::get));
	}

	/**
	 * Ends the live response and continues in polling mode. Pending messages are stored
	 * first; if storing any of them failed the switch is refused and the stream keeps
	 * streaming. On success the client receives a final event carrying the polling
	 * interval before the response ends.
	 * @return a Mono that completes once the response has ended
	 */
	public Mono<Void> switchToPolling() {
		Mono<Void> flush = enqueue(Mono.defer(() -> {
			Throwable failure = this.storeFailure.getAndSet(null);
			return failure != null ? Mono.error(failure) : Mono.empty();
		}));
		return this.controller.switchToPolling(flush).flatMap(switched -> {
			if (!switched) {
				return Mono.empty();
			}
			AtomicReference<EventId> allocated = new AtomicReference<>();
			return enqueue(allocate(allocated)
				.flatMap(eventId -> this.writer.write(StoredEvent.priming(eventId, this.retryInterval)))
				.then(Mono.defer(this.writer::complete)));
		});
	}

	/**
	 * Closes the stream. Operations already requested still run; later sends fail.
	 * Idempotent.
	 * @return a Mono that completes once the stream is closed
	 */
	public Mono<Void> close() {
		return Mono.defer(() -> {
			StreamMode previous = this.controller.close();
			if (previous == StreamMode.CLOSED) {
				return Mono.empty();
			}
			Mono<Void> drained = emit(
					previous == StreamMode.STREAMING ? Mono.defer(this.writer::complete) : Mono.<Void>empty());
			synchronized (this.operations) {
				this.operations.tryEmitComplete();
			}
			return drained;
		});
	}

	public boolean isClosed() {
		return this.controller.mode() == StreamMode.CLOSED;
	}

	private Mono<EventId> allocate(AtomicReference<EventId> allocated) {
		return this.eventStore.nextEventId(this.sessionId, this.streamId).doOnNext(eventId -> {
			allocated.set(eventId);
			this.controller.recordSequence(eventId.sequence());
		});
	}

	private Mono<Void> deliver(StoredEvent event) {
		Mono<Void> store = this.eventStore.storeEvent(this.sessionId, this.streamId, event)
			.doOnError(this.storeFailure::set)
			.then();
		return store.then(Mono.defer(() -> {
			if (this.controller.mode() != StreamMode.STREAMING) {
				return Mono.empty();
			}
			return this.writer.write(event).onErrorResume(error -> {
				// the event is retained if it needs to be, the client resumes from it
				logger.debug("Failed to write event {} on stream {}: {}", event.eventId(), this.streamId,
						error.getMessage());
				return Mono.empty();
			});
		}));
	}

	private Mono<Void> enqueue(Mono<Void> operation) {
		return Mono.defer(() -> emit(operation));
	}

	private Mono<Void> emit(Mono<Void> operation) {
		Sinks.Empty<Void> done = Sinks.empty();
		Sinks.EmitResult result;
		synchronized (this.operations) {
			result = this.operations.tryEmitNext(new PendingOperation(operation, done));
		}
		if (result.isFailure()) {
			return Mono.error(new IllegalStateException("Stream " + this.streamId + " is closed"));
		}
		return done.asMono();
	}

	private record PendingOperation(Mono<Void> operation, Sinks.Empty<Void> done) {
	}

}
