/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.stream;

import io.modelcontextprotocol.streamable.util.Assert;

/**
 * Snapshot of a resumable stream.
 *
 * @param streamId the stream id
 * @param mode the current mode
 * @param lastSequence the highest event sequence allocated on the stream so far
 */
public record StreamState(String streamId, StreamMode mode, long lastSequence) {

	public StreamState {
		Assert.hasText(streamId, "streamId must not be empty");
		Assert.notNull(mode, "mode must not be null");
	}

	public static StreamState initial(String streamId) {
		return new StreamState(streamId, StreamMode.STREAMING, 0);
	}

	StreamState withMode(StreamMode mode) {
		return new StreamState(this.streamId, mode, this.lastSequence);
	}

	StreamState withLastSequence(long sequence) {
		return sequence > this.lastSequence ? new StreamState(this.streamId, this.mode, sequence) : this;
	}

}
