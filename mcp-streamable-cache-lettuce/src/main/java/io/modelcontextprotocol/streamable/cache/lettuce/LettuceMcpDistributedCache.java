/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.cache.lettuce;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

import io.lettuce.core.RedisClient;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.codec.StringCodec;
import io.modelcontextprotocol.streamable.cache.CacheEntryOptions;
import io.modelcontextprotocol.streamable.cache.McpDistributedCache;
import io.modelcontextprotocol.streamable.spec.McpStoreException;
import io.modelcontextprotocol.streamable.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * {@link McpDistributedCache} stored in Redis through the Lettuce reactive API.
 * <p>
 * Redis only knows a single time to live per key, so entries written by
 * {@link #set(String, byte[], CacheEntryOptions)} carry a small header holding their
 * absolute deadline and sliding window. Every read refreshes the key's time to live to
 * the sliding window, capped by the remaining time to the deadline. Counters are plain
 * Redis integers updated with {@code INCR}, which keeps increments atomic across
 * server instances.
 */
public class LettuceMcpDistributedCache implements McpDistributedCache, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(LettuceMcpDistributedCache.class);

	private static final RedisCodec<String, byte[]> CODEC = RedisCodec.of(StringCodec.UTF8, ByteArrayCodec.INSTANCE);

	// never the first byte of a decimal counter
	private static final byte[] MAGIC = { 0, 'M', 'C', 1 };

	private static final int HEADER_LENGTH = MAGIC.length + 2 * Long.BYTES;

	private static final long NO_EXPIRATION = -1;

	private final RedisReactiveCommands<String, byte[]> commands;

	private final Clock clock;

	@Nullable
	private final StatefulRedisConnection<String, byte[]> ownedConnection;

	public LettuceMcpDistributedCache(RedisReactiveCommands<String, byte[]> commands) {
		this(commands, Clock.systemUTC());
	}

	public LettuceMcpDistributedCache(RedisReactiveCommands<String, byte[]> commands, Clock clock) {
		this(commands, clock, null);
	}

	private LettuceMcpDistributedCache(RedisReactiveCommands<String, byte[]> commands, Clock clock,
			@Nullable StatefulRedisConnection<String, byte[]> ownedConnection) {
		Assert.notNull(commands, "commands must not be null");
		Assert.notNull(clock, "clock must not be null");
		this.commands = commands;
		this.clock = clock;
		this.ownedConnection = ownedConnection;
	}

	/**
	 * Opens a dedicated connection with string keys and binary values. The connection is
	 * closed by {@link #close()}.
	 * @param client the Redis client
	 * @return the cache
	 */
	public static LettuceMcpDistributedCache connect(RedisClient client) {
		Assert.notNull(client, "client must not be null");
		StatefulRedisConnection<String, byte[]> connection = client.connect(CODEC);
		return new LettuceMcpDistributedCache(connection.reactive(), Clock.systemUTC(), connection);
	}

	/**
	 * @return the codec the reactive commands must use
	 */
	public static RedisCodec<String, byte[]> codec() {
		return CODEC;
	}

	@Override
	public Mono<byte[]> get(String key) {
		return this.commands.get(key).flatMap(stored -> {
			if (!hasHeader(stored)) {
				return Mono.just(stored);
			}
			ByteBuffer header = ByteBuffer.wrap(stored, MAGIC.length, 2 * Long.BYTES);
			long deadlineMillis = header.getLong();
			long slidingMillis = header.getLong();
			byte[] value = Arrays.copyOfRange(stored, HEADER_LENGTH, stored.length);
			Instant now = this.clock.instant();
			Instant deadline = deadlineMillis != NO_EXPIRATION ? Instant.ofEpochMilli(deadlineMillis) : null;
			Duration sliding = slidingMillis != NO_EXPIRATION ? Duration.ofMillis(slidingMillis) : null;
			Duration ttl = new CacheEntryOptions(sliding, null).timeToLive(now, deadline);
			if (ttl == null) {
				return Mono.just(value);
			}
			if (ttl.isNegative() || ttl.isZero()) {
				logger.debug("Dropping expired cache entry {}", key);
				return this.commands.del(key).then(Mono.<byte[]>empty());
			}
			if (sliding == null) {
				return Mono.just(value);
			}
			return this.commands.pexpire(key, ttl.toMillis()).thenReturn(value);
		}).onErrorMap(e -> !(e instanceof McpStoreException), e -> new McpStoreException("get", e));
	}

	@Override
	public Mono<Void> set(String key, byte[] value, CacheEntryOptions options) {
		Assert.notNull(value, "value must not be null");
		Assert.notNull(options, "options must not be null");
		return Mono.defer(() -> {
			Instant now = this.clock.instant();
			Instant deadline = options.absoluteDeadline(now);
			Duration ttl = options.timeToLive(now, deadline);
			byte[] stored = withHeader(value, deadline, options.slidingExpiration());
			Mono<String> write = ttl != null ? this.commands.set(key, stored, SetArgs.Builder.px(ttl.toMillis()))
					: this.commands.set(key, stored);
			return write.then();
		}).onErrorMap(e -> !(e instanceof McpStoreException), e -> new McpStoreException("set", e));
	}

	@Override
	public Mono<Void> remove(String key) {
		return this.commands.del(key)
			.then()
			.onErrorMap(e -> !(e instanceof McpStoreException), e -> new McpStoreException("remove", e));
	}

	@Override
	public Mono<Long> increment(String key, CacheEntryOptions options) {
		Assert.notNull(options, "options must not be null");
		return this.commands.incr(key).flatMap(value -> {
			Instant now = this.clock.instant();
			Duration ttl = options.timeToLive(now, options.absoluteDeadline(now));
			Mono<Boolean> expiry = ttl != null ? this.commands.pexpire(key, ttl.toMillis())
					: this.commands.persist(key);
			return expiry.thenReturn(value);
		}).onErrorMap(e -> !(e instanceof McpStoreException), e -> new McpStoreException("increment", e));
	}

	@Override
	public void close() {
		if (this.ownedConnection != null) {
			this.ownedConnection.close();
		}
	}

	static byte[] withHeader(byte[] value, @Nullable Instant deadline, @Nullable Duration sliding) {
		return ByteBuffer.allocate(HEADER_LENGTH + value.length)
			.put(MAGIC)
			.putLong(deadline != null ? deadline.toEpochMilli() : NO_EXPIRATION)
			.putLong(sliding != null ? sliding.toMillis() : NO_EXPIRATION)
			.put(value)
			.array();
	}

	private static boolean hasHeader(byte[] stored) {
		return stored.length >= HEADER_LENGTH && Arrays.equals(stored, 0, MAGIC.length, MAGIC, 0, MAGIC.length);
	}

}
