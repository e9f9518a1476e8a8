/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.modelcontextprotocol.streamable.event.McpEventStreamStore;
import io.modelcontextprotocol.streamable.session.McpSessionStore;
import io.modelcontextprotocol.streamable.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Periodically removes idle sessions and expired events.
 * <p>
 * Each sweep prunes the sessions idle for longer than the idle timeout and then drops
 * expired events from the event store. Streams of pruned sessions are released by the
 * session store's removal listeners. A failing sweep is logged and the next one runs on
 * schedule. Sweeps never overlap; a tick that arrives while one is still running is
 * skipped.
 */
public class McpIdleReaper implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpIdleReaper.class);

	private final McpSessionStore sessionStore;

	private final McpEventStreamStore eventStore;

	private final Duration idleTimeout;

	private final Duration interval;

	private final Clock clock;

	private final Scheduler scheduler;

	private Disposable task;

	/**
	 * Summary of one sweep.
	 *
	 * @param prunedSessions the number of idle sessions removed
	 * @param expiredEvents the number of expired events removed
	 */
	public record Sweep(int prunedSessions, int expiredEvents) {
	}

	private McpIdleReaper(Builder builder) {
		this.sessionStore = builder.sessionStore;
		this.eventStore = builder.eventStore;
		this.idleTimeout = builder.idleTimeout;
		this.interval = builder.interval;
		this.clock = builder.clock;
		this.scheduler = builder.scheduler;
	}

	/**
	 * Starts sweeping every interval. Calling it on a running reaper has no effect.
	 */
	public synchronized void start() {
		if (this.task != null && !this.task.isDisposed()) {
			return;
		}
		logger.debug("Starting idle reaper: idle timeout {}, interval {}", this.idleTimeout, this.interval);
		this.task = Flux.interval(this.interval, this.interval, this.scheduler)
			.onBackpressureDrop(tick -> logger.debug("Skipping reaper tick {}, previous sweep still running", tick))
			.concatMap(tick -> runOnce().onErrorResume(error -> {
				logger.error("Idle reaper sweep failed", error);
				return Mono.empty();
			}), 1)
			.subscribe();
	}

	/**
	 * Runs a single sweep.
	 * @return the sweep summary
	 */
	public Mono<Sweep> runOnce() {
		return Mono.defer(() -> {
			Instant now = this.clock.instant();
			return this.sessionStore.pruneIdle(this.idleTimeout, now)
				.defaultIfEmpty(0)
				.flatMap(pruned -> this.eventStore.cleanExpired(now)
					.defaultIfEmpty(0)
					.map(expired -> new Sweep(pruned, expired)));
		}).doOnNext(sweep -> {
			if (sweep.prunedSessions() > 0 || sweep.expiredEvents() > 0) {
				logger.info("Idle reaper removed {} idle session(s) and {} expired event(s)", sweep.prunedSessions(),
						sweep.expiredEvents());
			}
		});
	}

	public synchronized boolean isRunning() {
		return this.task != null && !this.task.isDisposed();
	}

	/**
	 * Stops sweeping. A sweep in progress is cancelled.
	 */
	@Override
	public synchronized void close() {
		if (this.task != null) {
			this.task.dispose();
			this.task = null;
			logger.debug("Idle reaper stopped");
		}
	}

	public static Builder builder(McpSessionStore sessionStore, McpEventStreamStore eventStore) {
		return new Builder(sessionStore, eventStore);
	}

	public static class Builder {

		private final McpSessionStore sessionStore;

		private final McpEventStreamStore eventStore;

		private Duration idleTimeout = McpStreamableTransportOptions.DEFAULT_IDLE_TIMEOUT;

		private Duration interval = McpStreamableTransportOptions.DEFAULT_REAPER_INTERVAL;

		private Clock clock = Clock.systemUTC();

		private Scheduler scheduler = Schedulers.parallel();

		private Builder(McpSessionStore sessionStore, McpEventStreamStore eventStore) {
			Assert.notNull(sessionStore, "sessionStore must not be null");
			Assert.notNull(eventStore, "eventStore must not be null");
			this.sessionStore = sessionStore;
			this.eventStore = eventStore;
		}

		public Builder idleTimeout(Duration idleTimeout) {
			Assert.isPositive(idleTimeout, "idleTimeout must be positive");
			this.idleTimeout = idleTimeout;
			return this;
		}

		public Builder interval(Duration interval) {
			Assert.isPositive(interval, "interval must be positive");
			this.interval = interval;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public Builder scheduler(Scheduler scheduler) {
			Assert.notNull(scheduler, "scheduler must not be null");
			this.scheduler = scheduler;
			return this;
		}

		public Builder options(McpStreamableTransportOptions options) {
			Assert.notNull(options, "options must not be null");
			return idleTimeout(options.idleTimeout()).interval(options.reaperInterval());
		}

		public McpIdleReaper build() {
			return new McpIdleReaper(this);
		}

	}

}
