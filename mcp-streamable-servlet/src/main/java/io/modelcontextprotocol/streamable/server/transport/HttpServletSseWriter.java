/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server.transport;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.atomic.AtomicBoolean;

import io.modelcontextprotocol.streamable.event.StoredEvent;
import io.modelcontextprotocol.streamable.stream.McpSseWriter;
import io.modelcontextprotocol.streamable.util.Assert;
import jakarta.servlet.AsyncContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Writes SSE events to the response of an asynchronous servlet request.
 * <p>
 * Each event is written as its {@code id}, {@code event}, {@code retry} (milliseconds)
 * and {@code data} lines followed by a blank line, then flushed. A multi-line payload is
 * split into one {@code data} line per line.
 */
public class HttpServletSseWriter implements McpSseWriter {

	private static final Logger logger = LoggerFactory.getLogger(HttpServletSseWriter.class);

	private final AsyncContext asyncContext;

	private final PrintWriter writer;

	private final AtomicBoolean completed = new AtomicBoolean();

	public HttpServletSseWriter(AsyncContext asyncContext, PrintWriter writer) {
		Assert.notNull(asyncContext, "asyncContext must not be null");
		Assert.notNull(writer, "writer must not be null");
		this.asyncContext = asyncContext;
		this.writer = writer;
	}

	@Override
	public Mono<Void> write(StoredEvent event) {
		return Mono.fromRunnable(() -> {
			if (this.completed.get()) {
				throw new IllegalStateException("SSE response already completed");
			}
			this.writer.write(format(event));
			this.writer.flush();
			if (this.writer.checkError()) {
				throw new SseWriteException(new IOException("Client disconnected"));
			}
			logger.debug("Wrote SSE event {}", event.eventId().value());
		});
	}

	@Override
	public Mono<Void> complete() {
		return Mono.fromRunnable(() -> {
			if (this.completed.compareAndSet(false, true)) {
				try {
					this.asyncContext.complete();
				}
				catch (IllegalStateException e) {
					// the container already ended the request
					logger.debug("Async context already completed: {}", e.getMessage());
				}
			}
		});
	}

	public boolean isCompleted() {
		return this.completed.get();
	}

	static String format(StoredEvent event) {
		StringBuilder sb = new StringBuilder();
		sb.append("id: ").append(event.eventId().value()).append('\n');
		if (event.eventType() != null) {
			sb.append("event: ").append(event.eventType()).append('\n');
		}
		if (event.reconnectionInterval() != null) {
			sb.append("retry: ").append(event.reconnectionInterval().toMillis()).append('\n');
		}
		String data = event.data();
		for (String line : data.split("\r\n|\r|\n", -1)) {
			sb.append("data: ").append(line).append('\n');
		}
		sb.append('\n');
		return sb.toString();
	}

	/**
	 * Signals that the client went away while an event was being written.
	 */
	public static class SseWriteException extends RuntimeException {

		public SseWriteException(IOException cause) {
			super(cause.getMessage(), cause);
		}

	}

}
