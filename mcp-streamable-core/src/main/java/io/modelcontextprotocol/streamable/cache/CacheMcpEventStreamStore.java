/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.cache;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Function;
import java.util.stream.LongStream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.modelcontextprotocol.streamable.event.EventExpiration;
import io.modelcontextprotocol.streamable.event.EventId;
import io.modelcontextprotocol.streamable.event.McpEventStreamStore;
import io.modelcontextprotocol.streamable.event.MessageKind;
import io.modelcontextprotocol.streamable.event.RetentionPolicy;
import io.modelcontextprotocol.streamable.event.RetentionPolicy.Retention;
import io.modelcontextprotocol.streamable.event.StoredEvent;
import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.spec.McpStoreException;
import io.modelcontextprotocol.streamable.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link McpEventStreamStore} backed by a {@link McpDistributedCache}, so that a client
 * can resume a stream on any server instance sharing the cache.
 * <p>
 * Every event is written under its own key and event ids come from an atomic per-stream
 * counter, so no shared value is ever read, modified and written back. The cache layout
 * is:
 * <ul>
 * <li>{@code mcp:sse:seq:<stream>} - the last allocated sequence of the stream</li>
 * <li>{@code mcp:sse:retained:<stream>} - present once the stream holds a retained
 * event</li>
 * <li>{@code mcp:sse:event:<eventId>} - one retained event</li>
 * </ul>
 * where {@code <stream>} is the stream portion of the event id. Expiration is delegated
 * to the cache, so {@link #cleanExpired(Instant)} has nothing to do.
 */
public class CacheMcpEventStreamStore implements McpEventStreamStore {

	private static final Logger logger = LoggerFactory.getLogger(CacheMcpEventStreamStore.class);

	private static final String KEY_PREFIX = "mcp:sse:";

	private static final byte[] RETAINED_MARKER = "1".getBytes(StandardCharsets.UTF_8);

	private final McpDistributedCache cache;

	private final McpJsonMapper jsonMapper;

	private final RetentionPolicy retentionPolicy;

	private final CacheEntryOptions eventOptions;

	private final CacheEntryOptions streamOptions;

	private CacheMcpEventStreamStore(McpDistributedCache cache, McpJsonMapper jsonMapper,
			RetentionPolicy retentionPolicy, EventExpiration expiration) {
		this.cache = cache;
		this.jsonMapper = jsonMapper;
		this.retentionPolicy = retentionPolicy;
		this.eventOptions = CacheEntryOptions.of(expiration);
		// stream bookkeeping is refreshed on every write and must outlive the events
		this.streamOptions = new CacheEntryOptions(expiration.absolute(), null);
	}

	public static Builder builder(McpDistributedCache cache) {
		return new Builder(cache);
	}

	@Override
	public Mono<EventId> nextEventId(String sessionId, String streamId) {
		EventId probe = EventId.of(sessionId, streamId, 0);
		return guard("increment", this.cache.increment(sequenceKey(probe), this.streamOptions))
			.map(sequence -> EventId.of(sessionId, streamId, sequence));
	}

	@Override
	public Mono<Boolean> storeEvent(String sessionId, String streamId, StoredEvent event) {
		Assert.notNull(event, "event must not be null");
		EventId eventId = event.eventId();
		Assert.isTrue(sessionId.equals(eventId.sessionId()) && streamId.equals(eventId.streamId()),
				"event id does not belong to stream " + streamId);
		Retention retention = this.retentionPolicy.retentionOf(event.kind());
		if (retention == Retention.NEVER || !event.hasPayload()) {
			return Mono.just(false);
		}
		Mono<Boolean> retainable = retention == Retention.ALWAYS ? Mono.just(true)
				: guard("get", this.cache.get(retainedKey(eventId))).hasElement();
		return retainable.flatMap(retain -> {
			if (!retain) {
				return Mono.just(false);
			}
			return Mono.fromCallable(() -> this.jsonMapper.writeValueAsBytes(CachedEvent.from(event)))
				.flatMap(bytes -> guard("set", this.cache.set(eventKey(eventId), bytes, this.eventOptions)))
				.then(guard("set", this.cache.set(retainedKey(eventId), RETAINED_MARKER, this.streamOptions)))
				.thenReturn(true);
		});
	}

	@Override
	public Mono<String> replayEventsAfter(String lastEventId, Function<Flux<StoredEvent>, Mono<Void>> deliver) {
		Assert.notNull(deliver, "deliver must not be null");
		return Mono.defer(() -> {
			EventId watermark = EventId.parse(lastEventId).orElse(null);
			if (watermark == null) {
				logger.debug("Ignoring malformed last event id {}", lastEventId);
				return deliver.apply(Flux.<StoredEvent>empty()).then(Mono.<String>empty());
			}
			return guard("get", this.cache.get(sequenceKey(watermark)))
				.map(bytes -> Long.parseLong(new String(bytes, StandardCharsets.UTF_8)))
				.zipWith(guard("get", this.cache.get(retainedKey(watermark))).hasElement())
				.filter(state -> state.getT2())
				.flatMap(state -> deliver.apply(eventsBetween(watermark, state.getT1()))
					.thenReturn(watermark.streamId()))
				.switchIfEmpty(Mono.defer(() -> deliver.apply(Flux.<StoredEvent>empty()).then(Mono.<String>empty())));
		});
	}

	private Flux<StoredEvent> eventsBetween(EventId watermark, long lastSequence) {
		if (lastSequence <= watermark.sequence()) {
			return Flux.empty();
		}
		return Flux.fromStream(() -> LongStream.rangeClosed(watermark.sequence() + 1, lastSequence).boxed())
			.concatMap(sequence -> guard("get", this.cache
				.get(eventKey(EventId.of(watermark.sessionId(), watermark.streamId(), sequence)))))
			.concatMap(bytes -> Mono.fromCallable(() -> this.jsonMapper.readValue(bytes, CachedEvent.class)))
			.map(CachedEvent::toStoredEvent)
			.filter(StoredEvent::hasPayload);
	}

	@Override
	public Mono<Integer> cleanExpired(Instant now) {
		return Mono.just(0);
	}

	@Override
	public Mono<Void> removeStream(String sessionId, String streamId) {
		EventId probe = EventId.of(sessionId, streamId, 0);
		// events become unreachable without the counter and expire on their own
		return guard("remove", this.cache.remove(retainedKey(probe)))
			.then(guard("remove", this.cache.remove(sequenceKey(probe))));
	}

	private static String streamKey(EventId eventId) {
		String value = eventId.value();
		return value.substring(0, value.lastIndexOf(':'));
	}

	static String sequenceKey(EventId eventId) {
		return KEY_PREFIX + "seq:" + streamKey(eventId);
	}

	static String retainedKey(EventId eventId) {
		return KEY_PREFIX + "retained:" + streamKey(eventId);
	}

	static String eventKey(EventId eventId) {
		return KEY_PREFIX + "event:" + eventId.value();
	}

	private static <T> Mono<T> guard(String operation, Mono<T> source) {
		return source.onErrorMap(e -> !(e instanceof McpStoreException), e -> new McpStoreException(operation, e));
	}

	/**
	 * Cached form of a {@link StoredEvent}.
	 *
	 * @param eventId the event id
	 * @param kind the message kind
	 * @param data the payload, Base64 encoded by Jackson
	 * @param eventType the SSE event type
	 * @param retryMillis the SSE retry hint in milliseconds
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record CachedEvent( // @formatter:off
		@JsonProperty("eventId") String eventId,
		@JsonProperty("kind") MessageKind kind,
		@JsonProperty("data") byte[] data,
		@JsonProperty("eventType") String eventType,
		@JsonProperty("retryMillis") Long retryMillis) { // @formatter:on

		static CachedEvent from(StoredEvent event) {
			Duration retry = event.reconnectionInterval();
			return new CachedEvent(event.eventId().value(), event.kind(), event.payload(), event.eventType(),
					retry != null ? retry.toMillis() : null);
		}

		StoredEvent toStoredEvent() {
			EventId id = EventId.parse(this.eventId)
				.orElseThrow(() -> new IllegalStateException("Corrupt cached event id " + this.eventId));
			return new StoredEvent(id, this.kind, this.data, this.eventType,
					this.retryMillis != null ? Duration.ofMillis(this.retryMillis) : null);
		}
	}

	public static class Builder {

		private final McpDistributedCache cache;

		private McpJsonMapper jsonMapper;

		private RetentionPolicy retentionPolicy = RetentionPolicy.DEFAULT;

		private EventExpiration expiration = EventExpiration.DEFAULT;

		private Builder(McpDistributedCache cache) {
			Assert.notNull(cache, "cache must not be null");
			this.cache = cache;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public Builder retentionPolicy(RetentionPolicy retentionPolicy) {
			Assert.notNull(retentionPolicy, "retentionPolicy must not be null");
			this.retentionPolicy = retentionPolicy;
			return this;
		}

		public Builder expiration(EventExpiration expiration) {
			Assert.notNull(expiration, "expiration must not be null");
			this.expiration = expiration;
			return this;
		}

		public CacheMcpEventStreamStore build() {
			return new CacheMcpEventStreamStore(this.cache,
					this.jsonMapper != null ? this.jsonMapper : McpJsonMapper.createDefault(), this.retentionPolicy,
					this.expiration);
		}

	}

}
