/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.stream;

/**
 * Delivery mode of a resumable stream. Transitions only move forward:
 * {@code STREAMING -> POLLING -> CLOSED}, or directly {@code STREAMING -> CLOSED}.
 */
public enum StreamMode {

	/** Events are written to a live HTTP response as they are produced. */
	STREAMING,

	/**
	 * The live response has ended. Events are only stored, and the client fetches them
	 * with periodic requests carrying its last event id.
	 */
	POLLING,

	/** Terminal. */
	CLOSED;

	public boolean canTransitionTo(StreamMode next) {
		return next.ordinal() > this.ordinal();
	}

}
