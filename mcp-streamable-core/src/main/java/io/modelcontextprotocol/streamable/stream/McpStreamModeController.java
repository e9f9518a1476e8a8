/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.stream;

import java.util.concurrent.atomic.AtomicReference;

import io.modelcontextprotocol.streamable.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Forward-only state machine driving a stream through {@link StreamMode}. All
 * transitions are compare-and-set on a single {@link StreamState}, so concurrent callers
 * agree on one winner.
 */
public class McpStreamModeController {

	private static final Logger logger = LoggerFactory.getLogger(McpStreamModeController.class);

	private final AtomicReference<StreamState> state;

	public McpStreamModeController(String streamId) {
		this.state = new AtomicReference<>(StreamState.initial(streamId));
	}

	public StreamState state() {
		return this.state.get();
	}

	public StreamMode mode() {
		return this.state.get().mode();
	}

	/**
	 * Records that an event with the given sequence was allocated on the stream.
	 * @param sequence the allocated sequence
	 */
	public void recordSequence(long sequence) {
		this.state.updateAndGet(current -> current.withLastSequence(sequence));
	}

	/**
	 * Moves the stream from {@code STREAMING} to {@code POLLING}. The transition is
	 * committed only after {@code flush} completes successfully; if it fails the stream
	 * stays in {@code STREAMING} and the error is propagated.
	 * @param flush persists every event the client may still need
	 * @return {@code true} if this call performed the transition, {@code false} if the
	 * stream was already polling or was closed while flushing
	 * @throws IllegalStateException (as an error signal) if the stream is closed
	 */
	public Mono<Boolean> switchToPolling(Mono<Void> flush) {
		Assert.notNull(flush, "flush must not be null");
		return Mono.defer(() -> {
			StreamMode current = mode();
			if (current == StreamMode.POLLING) {
				return Mono.just(false);
			}
			if (current == StreamMode.CLOSED) {
				return Mono.error(new IllegalStateException("Stream " + state().streamId() + " is closed"));
			}
			return flush.then(Mono.fromSupplier(() -> transition(StreamMode.STREAMING, StreamMode.POLLING)));
		});
	}

	/**
	 * Closes the stream. Idempotent.
	 * @return the mode the stream was in before this call, {@link StreamMode#CLOSED} if
	 * it was already closed
	 */
	public StreamMode close() {
		StreamState previous = this.state.getAndUpdate(current -> current.withMode(StreamMode.CLOSED));
		if (previous.mode() != StreamMode.CLOSED) {
			logger.debug("Stream {} closed from {}", previous.streamId(), previous.mode());
		}
		return previous.mode();
	}

	private boolean transition(StreamMode from, StreamMode to) {
		while (true) {
			StreamState current = this.state.get();
			if (current.mode() != from || !from.canTransitionTo(to)) {
				return false;
			}
			if (this.state.compareAndSet(current, current.withMode(to))) {
				logger.debug("Stream {} switched from {} to {}", current.streamId(), from, to);
				return true;
			}
		}
	}

}
