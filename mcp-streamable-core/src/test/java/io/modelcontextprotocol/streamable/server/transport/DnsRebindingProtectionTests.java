/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server.transport;

import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.spec.McpSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for DNS rebinding protection.
 */
class DnsRebindingProtectionTests {

	private final DnsRebindingProtection loopback = DnsRebindingProtection.loopback();

	@ParameterizedTest
	@ValueSource(strings = { "localhost", "localhost:8080", "LOCALHOST:3000", "127.0.0.1", "127.0.0.1:8080", "[::1]",
			"[::1]:8080", "127.0.0.2", "127.1.2.3:9000", "[0:0:0:0:0:0:0:1]" })
	void loopbackHostsAreAllowed(String host) {
		assertThat(loopback.isValid(host, null)).isTrue();
	}

	@ParameterizedTest
	@ValueSource(strings = { "evil.com", "evil.com:8080", "evil.localhost", "localhost.evil.com", "localhost:abc",
			"localhost:", "127.0.0.1.evil.com", "10.0.0.1", "::1", "[::1", "[::1]x", "0.0.0.0", "[::2]" })
	void otherHostsAreRejected(String host) {
		assertThat(loopback.isValid(host, null)).isFalse();
	}

	@ParameterizedTest
	@NullAndEmptySource
	void missingHostIsRejected(String host) {
		assertThat(loopback.isValid(host, null)).isFalse();
	}

	@Test
	void originIsCheckedByItsHost() {
		assertThat(loopback.isValid("localhost:8080", "http://localhost:3000")).isTrue();
		assertThat(loopback.isValid("localhost:8080", "http://127.0.0.1")).isTrue();
		assertThat(loopback.isValid("localhost:8080", "https://[::1]:8443")).isTrue();
		assertThat(loopback.isValid("localhost:8080", "http://evil.com")).isFalse();
		assertThat(loopback.isValid("localhost:8080", "http://localhost.evil.com")).isFalse();
		assertThat(loopback.isValid("localhost:8080", "null")).isFalse();
	}

	@Test
	void rejectionReasonNamesTheHeader() {
		assertThat(loopback.rejectionReason("localhost", null)).isNull();
		assertThat(loopback.rejectionReason("evil.com", null)).isEqualTo("Forbidden: Invalid Host header 'evil.com'");
		assertThat(loopback.rejectionReason("localhost", "http://evil.com"))
			.isEqualTo("Forbidden: Invalid Origin header 'http://evil.com'");
	}

	@Test
	void explicitAllowListExtendsLoopback() {
		DnsRebindingProtection protection = DnsRebindingProtection.builder()
			.allowedHost("mcp.example.com")
			.allowedOrigin("https://app.example.com")
			.build();

		assertThat(protection.isValid("mcp.example.com", null)).isTrue();
		assertThat(protection.isValid("MCP.example.com:443", "https://app.example.com")).isTrue();
		assertThat(protection.isValid("localhost", null)).isTrue();
		assertThat(protection.isValid("mcp.example.com", "https://other.example.com")).isFalse();
		assertThat(protection.isValid("evil.mcp.example.com", null)).isFalse();
	}

	@Test
	void allowListOnlyMode() {
		DnsRebindingProtection protection = DnsRebindingProtection.builder()
			.allowLoopback(false)
			.allowedHost("mcp.example.com:8443")
			.build();

		assertThat(protection.isValid("mcp.example.com:8443", null)).isTrue();
		assertThat(protection.isValid("mcp.example.com:9999", null)).isFalse();
		assertThat(protection.isValid("localhost", null)).isFalse();
		assertThat(protection.isValid("mcp.example.com:8443", "http://localhost")).isFalse();
	}

	@Test
	void disabledProtectionAllowsEverything() {
		DnsRebindingProtection protection = DnsRebindingProtection.builder()
			.enableDnsRebindingProtection(false)
			.build();

		assertThat(protection.isValid("evil.com", "http://evil.com")).isTrue();
		assertThat(protection.isValid(null, null)).isTrue();
	}

	@Test
	void forbiddenResponseIsJsonRpcErrorWithNullId() throws Exception {
		McpSchema.JSONRPCResponse response = DnsRebindingProtection
			.forbiddenResponse("Forbidden: Invalid Host header 'evil.com'");

		String json = McpJsonMapper.createDefault().writeValueAsString(response);

		assertThat(json).isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":null,"
				+ "\"error\":{\"code\":-32000,\"message\":\"Forbidden: Invalid Host header 'evil.com'\"}}");
	}

}
