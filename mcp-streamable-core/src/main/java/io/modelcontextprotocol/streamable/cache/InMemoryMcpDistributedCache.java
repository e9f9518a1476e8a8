/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.cache;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

import io.modelcontextprotocol.streamable.util.Assert;
import reactor.core.publisher.Mono;

/**
 * {@link McpDistributedCache} held in the local heap. Intended for tests and single
 * instance deployments. Expired entries are dropped lazily when touched.
 */
public class InMemoryMcpDistributedCache implements McpDistributedCache {

	private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

	private final Clock clock;

	public InMemoryMcpDistributedCache() {
		this(Clock.systemUTC());
	}

	public InMemoryMcpDistributedCache(Clock clock) {
		Assert.notNull(clock, "clock must not be null");
		this.clock = clock;
	}

	@Override
	public Mono<byte[]> get(String key) {
		return Mono.fromSupplier(() -> {
			Instant now = this.clock.instant();
			Entry entry = this.entries.computeIfPresent(key,
					(k, existing) -> existing.isExpired(now) ? null : existing.touch(now));
			return entry != null ? entry.value : null;
		});
	}

	@Override
	public Mono<Void> set(String key, byte[] value, CacheEntryOptions options) {
		Assert.notNull(value, "value must not be null");
		Assert.notNull(options, "options must not be null");
		return Mono.fromRunnable(() -> {
			Instant now = this.clock.instant();
			this.entries.put(key, Entry.create(value, options, now));
		});
	}

	@Override
	public Mono<Void> remove(String key) {
		return Mono.fromRunnable(() -> this.entries.remove(key));
	}

	@Override
	public Mono<Long> increment(String key, CacheEntryOptions options) {
		Assert.notNull(options, "options must not be null");
		return Mono.fromSupplier(() -> {
			Instant now = this.clock.instant();
			Entry entry = this.entries.compute(key, (k, existing) -> {
				long current = existing == null || existing.isExpired(now) ? 0
						: Long.parseLong(new String(existing.value, StandardCharsets.UTF_8));
				byte[] next = Long.toString(current + 1).getBytes(StandardCharsets.UTF_8);
				return Entry.create(next, options, now);
			});
			return Long.parseLong(new String(entry.value, StandardCharsets.UTF_8));
		});
	}

	/**
	 * @return the number of entries, including expired entries not yet touched
	 */
	int size() {
		return this.entries.size();
	}

	private static final class Entry {

		private final byte[] value;

		private final CacheEntryOptions options;

		private final Instant absoluteDeadline;

		private final Instant expiresAt;

		private Entry(byte[] value, CacheEntryOptions options, Instant absoluteDeadline, Instant expiresAt) {
			this.value = value;
			this.options = options;
			this.absoluteDeadline = absoluteDeadline;
			this.expiresAt = expiresAt;
		}

		static Entry create(byte[] value, CacheEntryOptions options, Instant now) {
			Instant deadline = options.absoluteDeadline(now);
			return new Entry(value, options, deadline, expiresAt(options, now, deadline));
		}

		Entry touch(Instant now) {
			if (this.options.slidingExpiration() == null) {
				return this;
			}
			return new Entry(this.value, this.options, this.absoluteDeadline,
					expiresAt(this.options, now, this.absoluteDeadline));
		}

		boolean isExpired(Instant now) {
			return this.expiresAt != null && now.isAfter(this.expiresAt);
		}

		private static Instant expiresAt(CacheEntryOptions options, Instant now, Instant deadline) {
			Duration ttl = options.timeToLive(now, deadline);
			return ttl != null ? now.plus(ttl) : null;
		}

	}

}
