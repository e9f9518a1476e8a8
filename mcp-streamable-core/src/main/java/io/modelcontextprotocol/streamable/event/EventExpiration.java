/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.event;

import java.time.Duration;
import java.time.Instant;

import io.modelcontextprotocol.streamable.util.Assert;

/**
 * Expiry of retained events. An event expires once it has not been read for
 * {@code sliding}, or once {@code absolute} has passed since it was stored, whichever
 * comes first.
 *
 * @param sliding inactivity window, extended on every read
 * @param absolute hard ceiling measured from the time the event was stored
 */
public record EventExpiration(Duration sliding, Duration absolute) {

	public static final EventExpiration DEFAULT = new EventExpiration(Duration.ofMinutes(10), Duration.ofHours(1));

	public EventExpiration {
		Assert.isPositive(sliding, "sliding expiration must be positive");
		Assert.isPositive(absolute, "absolute expiration must be positive");
		Assert.isTrue(sliding.compareTo(absolute) <= 0, "sliding expiration must not exceed absolute expiration");
	}

	public boolean isExpired(Instant storedAt, Instant lastAccessAt, Instant now) {
		return Duration.between(lastAccessAt, now).compareTo(this.sliding) > 0
				|| Duration.between(storedAt, now).compareTo(this.absolute) > 0;
	}

}
