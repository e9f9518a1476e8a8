/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server;

import java.time.Duration;

import io.modelcontextprotocol.streamable.event.EventExpiration;
import io.modelcontextprotocol.streamable.server.transport.DnsRebindingProtection;
import io.modelcontextprotocol.streamable.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Settings of the streamable HTTP session layer.
 * <p>
 * Defaults: sessions idle for two hours are pruned by a reaper running every five
 * seconds; events expire ten minutes after their last replay and at most one hour after
 * they were stored; clients switched to polling are told to reconnect after one second;
 * streams keep an unbounded number of events; Host and Origin headers must name the
 * loopback interface.
 */
public final class McpStreamableTransportOptions {

	public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofHours(2);

	public static final Duration DEFAULT_REAPER_INTERVAL = Duration.ofSeconds(5);

	public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(1);

	private final Duration idleTimeout;

	private final Duration reaperInterval;

	private final EventExpiration eventExpiration;

	private final Duration retryInterval;

	private final Integer maxEventsPerStream;

	private final DnsRebindingProtection dnsRebindingProtection;

	private McpStreamableTransportOptions(Builder builder) {
		this.idleTimeout = builder.idleTimeout;
		this.reaperInterval = builder.reaperInterval;
		this.eventExpiration = new EventExpiration(builder.slidingExpiration, builder.absoluteExpiration);
		this.retryInterval = builder.retryInterval;
		this.maxEventsPerStream = builder.maxEventsPerStream;
		this.dnsRebindingProtection = builder.dnsRebindingProtection;
	}

	public static McpStreamableTransportOptions defaults() {
		return builder().build();
	}

	public Duration idleTimeout() {
		return this.idleTimeout;
	}

	public Duration reaperInterval() {
		return this.reaperInterval;
	}

	public EventExpiration eventExpiration() {
		return this.eventExpiration;
	}

	public Duration retryInterval() {
		return this.retryInterval;
	}

	/**
	 * @return the per-stream event cap, or {@code null} when unbounded
	 */
	@Nullable
	public Integer maxEventsPerStream() {
		return this.maxEventsPerStream;
	}

	public DnsRebindingProtection dnsRebindingProtection() {
		return this.dnsRebindingProtection;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;

		private Duration reaperInterval = DEFAULT_REAPER_INTERVAL;

		private Duration slidingExpiration = EventExpiration.DEFAULT.sliding();

		private Duration absoluteExpiration = EventExpiration.DEFAULT.absolute();

		private Duration retryInterval = DEFAULT_RETRY_INTERVAL;

		private Integer maxEventsPerStream;

		private DnsRebindingProtection dnsRebindingProtection = DnsRebindingProtection.loopback();

		private Builder() {
		}

		/**
		 * How long a session may go without activity before the reaper removes it.
		 * @param idleTimeout the idle timeout
		 * @return this builder
		 */
		public Builder idleTimeout(Duration idleTimeout) {
			this.idleTimeout = idleTimeout;
			return this;
		}

		public Builder reaperInterval(Duration reaperInterval) {
			this.reaperInterval = reaperInterval;
			return this;
		}

		/**
		 * How long a retained event survives without being replayed.
		 * @param slidingExpiration the sliding expiration
		 * @return this builder
		 */
		public Builder slidingExpiration(Duration slidingExpiration) {
			this.slidingExpiration = slidingExpiration;
			return this;
		}

		/**
		 * How long a retained event survives after it was stored, replayed or not.
		 * @param absoluteExpiration the absolute expiration
		 * @return this builder
		 */
		public Builder absoluteExpiration(Duration absoluteExpiration) {
			this.absoluteExpiration = absoluteExpiration;
			return this;
		}

		/**
		 * The reconnection delay sent to clients in priming events.
		 * @param retryInterval the retry interval
		 * @return this builder
		 */
		public Builder retryInterval(Duration retryInterval) {
			this.retryInterval = retryInterval;
			return this;
		}

		public Builder maxEventsPerStream(Integer maxEventsPerStream) {
			this.maxEventsPerStream = maxEventsPerStream;
			return this;
		}

		public Builder dnsRebindingProtection(DnsRebindingProtection dnsRebindingProtection) {
			this.dnsRebindingProtection = dnsRebindingProtection;
			return this;
		}

		/**
		 * @return the options
		 * @throws IllegalArgumentException if a duration is not positive, the sliding
		 * expiration exceeds the absolute one or the event cap is not positive
		 */
		public McpStreamableTransportOptions build() {
			Assert.isPositive(this.idleTimeout, "idleTimeout must be positive");
			Assert.isPositive(this.reaperInterval, "reaperInterval must be positive");
			Assert.isPositive(this.slidingExpiration, "slidingExpiration must be positive");
			Assert.isPositive(this.absoluteExpiration, "absoluteExpiration must be positive");
			Assert.isTrue(this.slidingExpiration.compareTo(this.absoluteExpiration) <= 0,
					"slidingExpiration must not exceed absoluteExpiration");
			Assert.isPositive(this.retryInterval, "retryInterval must be positive");
			Assert.isTrue(this.maxEventsPerStream == null || this.maxEventsPerStream > 0,
					"maxEventsPerStream must be positive");
			Assert.notNull(this.dnsRebindingProtection, "dnsRebindingProtection must not be null");
			return new McpStreamableTransportOptions(this);
		}

	}

}
