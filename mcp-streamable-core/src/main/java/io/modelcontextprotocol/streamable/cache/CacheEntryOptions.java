/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.cache;

import java.time.Duration;
import java.time.Instant;

import io.modelcontextprotocol.streamable.event.EventExpiration;
import io.modelcontextprotocol.streamable.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Expiration of a single {@link McpDistributedCache} entry.
 *
 * @param slidingExpiration how long the entry may go unread before it expires,
 * {@code null} for no sliding expiration
 * @param absoluteExpiration how long after it was written the entry expires regardless
 * of reads, {@code null} for no absolute expiration
 */
public record CacheEntryOptions(@Nullable Duration slidingExpiration, @Nullable Duration absoluteExpiration) {

	public static final CacheEntryOptions NONE = new CacheEntryOptions(null, null);

	public CacheEntryOptions {
		Assert.isTrue(slidingExpiration == null || (!slidingExpiration.isNegative() && !slidingExpiration.isZero()),
				"slidingExpiration must be positive");
		Assert.isTrue(absoluteExpiration == null || (!absoluteExpiration.isNegative() && !absoluteExpiration.isZero()),
				"absoluteExpiration must be positive");
	}

	public static CacheEntryOptions of(EventExpiration expiration) {
		return new CacheEntryOptions(expiration.sliding(), expiration.absolute());
	}

	/**
	 * @param writtenAt when the entry was written
	 * @return the absolute deadline of the entry, or {@code null} if it has none
	 */
	@Nullable
	public Instant absoluteDeadline(Instant writtenAt) {
		return this.absoluteExpiration != null ? writtenAt.plus(this.absoluteExpiration) : null;
	}

	/**
	 * Computes how long an entry lives from {@code now}: the sliding window, capped by
	 * the remaining time to the absolute deadline.
	 * @param now the current time
	 * @param absoluteDeadline the deadline of the entry, may be {@code null}
	 * @return the time to live, or {@code null} if the entry never expires
	 */
	@Nullable
	public Duration timeToLive(Instant now, @Nullable Instant absoluteDeadline) {
		Duration remaining = absoluteDeadline != null ? Duration.between(now, absoluteDeadline) : null;
		if (this.slidingExpiration == null) {
			return remaining;
		}
		if (remaining == null || this.slidingExpiration.compareTo(remaining) < 0) {
			return this.slidingExpiration;
		}
		return remaining;
	}

}
