/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.event;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

import io.modelcontextprotocol.streamable.util.Assert;

/**
 * Identifier of an event on a resumable SSE stream, sent to the client as the SSE
 * {@code id} field and echoed back in the {@code Last-Event-ID} header.
 * <p>
 * The wire format is {@code <base64url(sessionId)>:<base64url(streamId)>:<sequence>}.
 * The delimiter never occurs in Base64URL, so the stream can be located from an id in
 * constant time even when session or stream ids contain {@code ':'}. The sequence is
 * zero-padded to 19 digits so that, within one stream, the ordinal order of the string
 * values equals the numeric order of the sequences.
 */
public final class EventId implements Comparable<EventId> {

	private static final char DELIMITER = ':';

	private static final int SEQUENCE_WIDTH = 19;

	private static final Comparator<EventId> ORDER = Comparator.comparing(EventId::sessionId)
		.thenComparing(EventId::streamId)
		.thenComparingLong(EventId::sequence);

	private final String sessionId;

	private final String streamId;

	private final long sequence;

	private final String value;

	private EventId(String sessionId, String streamId, long sequence) {
		this.sessionId = sessionId;
		this.streamId = streamId;
		this.sequence = sequence;
		this.value = encode(sessionId) + DELIMITER + encode(streamId) + DELIMITER
				+ String.format("%0" + SEQUENCE_WIDTH + "d", sequence);
	}

	public static EventId of(String sessionId, String streamId, long sequence) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		Assert.hasText(streamId, "streamId must not be empty");
		Assert.isTrue(sequence >= 0, "sequence must not be negative");
		return new EventId(sessionId, streamId, sequence);
	}

	/**
	 * Parses an id previously produced by {@link #value()}.
	 * @param value the raw id, typically the {@code Last-Event-ID} header
	 * @return the parsed id, or empty if the value is not a well-formed event id
	 */
	public static Optional<EventId> parse(String value) {
		if (value == null || value.isEmpty()) {
			return Optional.empty();
		}
		int first = value.indexOf(DELIMITER);
		int second = first < 0 ? -1 : value.indexOf(DELIMITER, first + 1);
		if (second < 0 || value.indexOf(DELIMITER, second + 1) >= 0) {
			return Optional.empty();
		}
		String sequencePart = value.substring(second + 1);
		if (sequencePart.isEmpty() || sequencePart.length() > SEQUENCE_WIDTH
				|| !sequencePart.chars().allMatch(Character::isDigit)) {
			return Optional.empty();
		}
		try {
			String sessionId = decode(value.substring(0, first));
			String streamId = decode(value.substring(first + 1, second));
			if (sessionId.isEmpty() || streamId.isEmpty()) {
				return Optional.empty();
			}
			return Optional.of(new EventId(sessionId, streamId, Long.parseLong(sequencePart)));
		}
		catch (IllegalArgumentException e) {
			// invalid Base64 or a sequence overflowing a long
			return Optional.empty();
		}
	}

	public String sessionId() {
		return this.sessionId;
	}

	public String streamId() {
		return this.streamId;
	}

	public long sequence() {
		return this.sequence;
	}

	public String value() {
		return this.value;
	}

	/**
	 * @param other another id
	 * @return {@code true} if both ids belong to the same session and stream
	 */
	public boolean isSameStream(EventId other) {
		return other != null && this.sessionId.equals(other.sessionId) && this.streamId.equals(other.streamId);
	}

	@Override
	public int compareTo(EventId other) {
		return ORDER.compare(this, other);
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass())
			return false;
		EventId eventId = (EventId) o;
		return Objects.equals(value(), eventId.value());
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value());
	}

	@Override
	public String toString() {
		return this.value;
	}

	private static String encode(String raw) {
		return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
	}

	private static String decode(String encoded) {
		return new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
	}

}
