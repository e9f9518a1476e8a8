/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server;

import java.time.Duration;

import io.modelcontextprotocol.streamable.server.transport.DnsRebindingProtection;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link McpStreamableTransportOptions}.
 */
class McpStreamableTransportOptionsTests {

	@Test
	void defaults() {
		McpStreamableTransportOptions options = McpStreamableTransportOptions.defaults();

		assertThat(options.idleTimeout()).isEqualTo(Duration.ofHours(2));
		assertThat(options.reaperInterval()).isEqualTo(Duration.ofSeconds(5));
		assertThat(options.eventExpiration().sliding()).isEqualTo(Duration.ofMinutes(10));
		assertThat(options.eventExpiration().absolute()).isEqualTo(Duration.ofHours(1));
		assertThat(options.retryInterval()).isEqualTo(Duration.ofSeconds(1));
		assertThat(options.maxEventsPerStream()).isNull();
		assertThat(options.dnsRebindingProtection().isValid("localhost:8080", null)).isTrue();
		assertThat(options.dnsRebindingProtection().isValid("evil.com", null)).isFalse();
	}

	@Test
	void customValues() {
		DnsRebindingProtection open = DnsRebindingProtection.builder().enableDnsRebindingProtection(false).build();

		McpStreamableTransportOptions options = McpStreamableTransportOptions.builder()
			.idleTimeout(Duration.ofMinutes(5))
			.reaperInterval(Duration.ofSeconds(1))
			.slidingExpiration(Duration.ofMinutes(1))
			.absoluteExpiration(Duration.ofMinutes(2))
			.retryInterval(Duration.ofMillis(250))
			.maxEventsPerStream(100)
			.dnsRebindingProtection(open)
			.build();

		assertThat(options.idleTimeout()).isEqualTo(Duration.ofMinutes(5));
		assertThat(options.eventExpiration().absolute()).isEqualTo(Duration.ofMinutes(2));
		assertThat(options.retryInterval()).isEqualTo(Duration.ofMillis(250));
		assertThat(options.maxEventsPerStream()).isEqualTo(100);
		assertThat(options.dnsRebindingProtection()).isSameAs(open);
	}

	@Test
	void rejectsInvalidValues() {
		assertThatThrownBy(() -> McpStreamableTransportOptions.builder().idleTimeout(Duration.ZERO).build())
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> McpStreamableTransportOptions.builder().retryInterval(null).build())
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> McpStreamableTransportOptions.builder()
			.slidingExpiration(Duration.ofHours(2))
			.absoluteExpiration(Duration.ofHours(1))
			.build()).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> McpStreamableTransportOptions.builder().maxEventsPerStream(0).build())
			.isInstanceOf(IllegalArgumentException.class);
	}

}
