/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.event;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import io.modelcontextprotocol.streamable.event.RetentionPolicy.Retention;
import io.modelcontextprotocol.streamable.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link McpEventStreamStore} keeping retained events in memory.
 * <p>
 * Each stream holds its events in a list guarded by the stream's own monitor, so
 * concurrent writers on different streams never contend. Event ids come from a single
 * store-wide counter and are therefore unique across streams.
 */
public class InMemoryMcpEventStreamStore implements McpEventStreamStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryMcpEventStreamStore.class);

	// stream key -> retained events
	private final ConcurrentHashMap<StreamKey, EventStream> streams = new ConcurrentHashMap<>();

	private final AtomicLong sequence = new AtomicLong();

	private final RetentionPolicy retentionPolicy;

	private final EventExpiration expiration;

	private final Integer maxEventsPerStream;

	private final Clock clock;

	private InMemoryMcpEventStreamStore(RetentionPolicy retentionPolicy, EventExpiration expiration,
			Integer maxEventsPerStream, Clock clock) {
		this.retentionPolicy = retentionPolicy;
		this.expiration = expiration;
		this.maxEventsPerStream = maxEventsPerStream;
		this.clock = clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Mono<EventId> nextEventId(String sessionId, String streamId) {
		return Mono.fromSupplier(() -> EventId.of(sessionId, streamId, this.sequence.incrementAndGet()));
	}

	@Override
	public Mono<Boolean> storeEvent(String sessionId, String streamId, StoredEvent event) {
		Assert.notNull(event, "event must not be null");
		StreamKey key = new StreamKey(sessionId, streamId);
		Assert.isTrue(key.matches(event.eventId()), "event id does not belong to stream " + key);
		return Mono.fromSupplier(() -> {
			Retention retention = this.retentionPolicy.retentionOf(event.kind());
			if (retention == Retention.NEVER || !event.hasPayload()) {
				return false;
			}
			Instant now = this.clock.instant();
			if (retention == Retention.IF_STREAM_RETAINED) {
				EventStream existing = this.streams.get(key);
				return existing != null && existing.append(event, now, this.maxEventsPerStream);
			}
			while (true) {
				EventStream stream = this.streams.computeIfAbsent(key, k -> new EventStream());
				if (stream.append(event, now, this.maxEventsPerStream)) {
					return true;
				}
				// the stream was emptied and unlinked by a concurrent cleanup
				this.streams.remove(key, stream);
			}
		});
	}

	@Override
	public Mono<String> replayEventsAfter(String lastEventId, Function<Flux<StoredEvent>, Mono<Void>> deliver) {
		Assert.notNull(deliver, "deliver must not be null");
		return Mono.defer(() -> {
			EventId watermark = EventId.parse(lastEventId).orElse(null);
			EventStream stream = watermark != null ? this.streams.get(StreamKey.of(watermark)) : null;
			if (stream == null) {
				logger.debug("No retained events for last event id {}", lastEventId);
				return deliver.apply(Flux.<StoredEvent>empty()).then(Mono.<String>empty());
			}
			List<StoredEvent> replay = stream.eventsAfter(watermark, this.clock.instant(), this.expiration);
			// the stream lock is released at this point
			return deliver.apply(Flux.fromIterable(replay)).thenReturn(watermark.streamId());
		});
	}

	@Override
	public Mono<Integer> cleanExpired(Instant now) {
		Assert.notNull(now, "now must not be null");
		return Mono.fromSupplier(() -> {
			int removed = 0;
			for (Map.Entry<StreamKey, EventStream> entry : this.streams.entrySet()) {
				EventStream stream = entry.getValue();
				removed += stream.removeExpired(now, this.expiration);
				if (stream.closeIfEmpty()) {
					this.streams.remove(entry.getKey(), stream);
				}
			}
			if (removed > 0) {
				logger.debug("Removed {} expired events", removed);
			}
			return removed;
		});
	}

	@Override
	public Mono<Void> removeStream(String sessionId, String streamId) {
		return Mono.fromRunnable(() -> {
			EventStream removed = this.streams.remove(new StreamKey(sessionId, streamId));
			if (removed != null) {
				removed.close();
			}
		});
	}

	/**
	 * @return the number of streams currently holding retained events
	 */
	int streamCount() {
		return this.streams.size();
	}

	record StreamKey(String sessionId, String streamId) {

		static StreamKey of(EventId eventId) {
			return new StreamKey(eventId.sessionId(), eventId.streamId());
		}

		boolean matches(EventId eventId) {
			return Objects.equals(this.sessionId, eventId.sessionId())
					&& Objects.equals(this.streamId, eventId.streamId());
		}

	}

	private static final class RetainedEvent {

		private final StoredEvent event;

		private final Instant storedAt;

		private Instant lastAccessAt;

		private RetainedEvent(StoredEvent event, Instant storedAt) {
			this.event = event;
			this.storedAt = storedAt;
			this.lastAccessAt = storedAt;
		}

	}

	/**
	 * Retained events of one stream. All access goes through the instance monitor; a
	 * closed stream accepts no further events so a writer racing with cleanup retries on
	 * a fresh instance.
	 */
	private static final class EventStream {

		private final List<RetainedEvent> events = new ArrayList<>();

		private boolean closed;

		synchronized boolean append(StoredEvent event, Instant now, Integer maxEvents) {
			if (this.closed) {
				return false;
			}
			this.events.add(new RetainedEvent(event, now));
			if (maxEvents != null) {
				while (this.events.size() > maxEvents) {
					this.events.remove(0);
				}
			}
			return true;
		}

		synchronized List<StoredEvent> eventsAfter(EventId watermark, Instant now, EventExpiration expiration) {
			List<RetainedEvent> candidates = new ArrayList<>();
			for (RetainedEvent retained : this.events) {
				if (retained.event.hasPayload() && retained.event.eventId().compareTo(watermark) > 0
						&& !expiration.isExpired(retained.storedAt, retained.lastAccessAt, now)) {
					candidates.add(retained);
				}
			}
			candidates.sort((a, b) -> a.event.eventId().compareTo(b.event.eventId()));
			List<StoredEvent> result = new ArrayList<>(candidates.size());
			for (RetainedEvent retained : candidates) {
				retained.lastAccessAt = now;
				result.add(retained.event);
			}
			return Collections.unmodifiableList(result);
		}

		synchronized int removeExpired(Instant now, EventExpiration expiration) {
			int removed = 0;
			Iterator<RetainedEvent> it = this.events.iterator();
			while (it.hasNext()) {
				RetainedEvent retained = it.next();
				if (expiration.isExpired(retained.storedAt, retained.lastAccessAt, now)) {
					it.remove();
					removed++;
				}
			}
			return removed;
		}

		synchronized boolean closeIfEmpty() {
			if (this.events.isEmpty()) {
				this.closed = true;
			}
			return this.closed;
		}

		synchronized void close() {
			this.closed = true;
			this.events.clear();
		}

	}

	public static class Builder {

		private RetentionPolicy retentionPolicy = RetentionPolicy.DEFAULT;

		private EventExpiration expiration = EventExpiration.DEFAULT;

		private Integer maxEventsPerStream;

		private Clock clock = Clock.systemUTC();

		private Builder() {
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

		/**
		 * Bounds the number of events retained per stream; the oldest events are evicted
		 * first. Unbounded by default.
		 * @param maxEventsPerStream the bound, or {@code null} for no bound
		 * @return this builder
		 */
		public Builder maxEventsPerStream(Integer maxEventsPerStream) {
			Assert.isTrue(maxEventsPerStream == null || maxEventsPerStream > 0, "maxEventsPerStream must be positive");
			this.maxEventsPerStream = maxEventsPerStream;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public InMemoryMcpEventStreamStore build() {
			return new InMemoryMcpEventStreamStore(this.retentionPolicy, this.expiration, this.maxEventsPerStream,
					this.clock);
		}

	}

}
