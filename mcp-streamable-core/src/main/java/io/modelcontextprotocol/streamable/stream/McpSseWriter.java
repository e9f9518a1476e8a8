/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.stream;

import io.modelcontextprotocol.streamable.event.StoredEvent;
import reactor.core.publisher.Mono;

/**
 * Sink writing SSE events to a live HTTP response. Calls are never concurrent for a
 * single writer.
 */
public interface McpSseWriter {

	/**
	 * Writes one event, including its {@code id}, {@code event} and {@code retry} fields
	 * when present, and flushes it to the client.
	 * @param event the event to write
	 * @return a Mono that completes once the event is flushed, or fails if the client is
	 * gone
	 */
	Mono<Void> write(StoredEvent event);

	/**
	 * Ends the HTTP response. Calling it more than once has no further effect.
	 * @return a Mono that completes once the response is ended
	 */
	Mono<Void> complete();

}
