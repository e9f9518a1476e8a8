/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.event;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

import io.modelcontextprotocol.streamable.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * An outbound SSE event as kept by an {@link McpEventStreamStore}.
 *
 * @param eventId the event id, also locating the stream
 * @param kind the message class used for retention decisions
 * @param payload the serialized message, preserved byte for byte. {@code null} for
 * priming events
 * @param eventType the SSE {@code event} field, may be {@code null}
 * @param reconnectionInterval the SSE {@code retry} hint, may be {@code null}
 */
public record StoredEvent(EventId eventId, MessageKind kind, @Nullable byte[] payload, @Nullable String eventType,
		@Nullable Duration reconnectionInterval) {

	/**
	 * SSE event type used for JSON-RPC messages.
	 */
	public static final String MESSAGE_EVENT_TYPE = "message";

	public StoredEvent {
		Assert.notNull(eventId, "eventId must not be null");
		Assert.notNull(kind, "kind must not be null");
		payload = payload != null ? payload.clone() : null;
	}

	/**
	 * @return a copy of the serialized message, {@code null} for priming events
	 */
	@Override
	@Nullable
	public byte[] payload() {
		return this.payload != null ? this.payload.clone() : null;
	}

	public static StoredEvent message(EventId eventId, MessageKind kind, byte[] payload) {
		return new StoredEvent(eventId, kind, payload, MESSAGE_EVENT_TYPE, null);
	}

	public static StoredEvent priming(EventId eventId, @Nullable Duration reconnectionInterval) {
		return new StoredEvent(eventId, MessageKind.PRIMING, null, null, reconnectionInterval);
	}

	/**
	 * @return {@code true} if the event carries a message that can be replayed
	 */
	public boolean hasPayload() {
		return this.payload != null;
	}

	/**
	 * @return the payload decoded as UTF-8, or an empty string for priming events
	 */
	public String data() {
		return this.payload != null ? new String(this.payload, StandardCharsets.UTF_8) : "";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof StoredEvent other)) {
			return false;
		}
		return this.eventId.equals(other.eventId) && this.kind == other.kind
				&& Arrays.equals(this.payload, other.payload) && Objects.equals(this.eventType, other.eventType)
				&& Objects.equals(this.reconnectionInterval, other.reconnectionInterval);
	}

	@Override
	public int hashCode() {
		return 31 * Objects.hash(this.eventId, this.kind, this.eventType, this.reconnectionInterval)
				+ Arrays.hashCode(this.payload);
	}

	@Override
	public String toString() {
		return "StoredEvent[eventId=" + this.eventId.value() + ", kind=" + this.kind + ", payloadLength="
				+ (this.payload != null ? this.payload.length : 0) + ", eventType=" + this.eventType
				+ ", reconnectionInterval=" + this.reconnectionInterval + "]";
	}

}
