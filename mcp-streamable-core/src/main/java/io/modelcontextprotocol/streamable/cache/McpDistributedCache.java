/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.cache;

import reactor.core.publisher.Mono;

/**
 * Minimal key-value cache contract used by the cache-backed stores, so that retained
 * state can live in a cache shared by several server instances. Implementations report
 * backend failures as {@link io.modelcontextprotocol.streamable.spec.McpStoreException}.
 */
public interface McpDistributedCache {

	/**
	 * Reads an entry and refreshes its sliding expiration.
	 * @param key the key
	 * @return the value, or an empty Mono if the entry is missing or expired
	 */
	Mono<byte[]> get(String key);

	/**
	 * Writes an entry, replacing any previous value and expiration.
	 * @param key the key
	 * @param value the value
	 * @param options expiration of the entry
	 * @return a Mono that completes once the entry is written
	 */
	Mono<Void> set(String key, byte[] value, CacheEntryOptions options);

	/**
	 * @param key the key
	 * @return a Mono that completes once the entry is gone
	 */
	Mono<Void> remove(String key);

	/**
	 * Atomically increments a counter, creating it at {@code 1} when missing. The
	 * counter's expiration is reset to {@code options}. Counters are stored as decimal
	 * text, so {@link #get(String)} reads them back as such.
	 * @param key the counter key
	 * @param options expiration of the counter
	 * @return the incremented value
	 */
	Mono<Long> increment(String key, CacheEntryOptions options);

}
