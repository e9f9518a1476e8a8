/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server.transport;

import java.io.PrintWriter;
import java.io.StringWriter;

import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link DnsRebindingProtectionFilter}.
 */
class DnsRebindingProtectionFilterTests {

	private DnsRebindingProtectionFilter filter;

	private HttpServletRequest request;

	private HttpServletResponse response;

	private FilterChain chain;

	private StringWriter body;

	@BeforeEach
	void setUp() throws Exception {
		filter = new DnsRebindingProtectionFilter(DnsRebindingProtection.loopback(), McpJsonMapper.createDefault());
		request = mock(HttpServletRequest.class);
		response = mock(HttpServletResponse.class);
		chain = mock(FilterChain.class);
		body = new StringWriter();
		when(request.getMethod()).thenReturn("POST");
		when(request.getRequestURI()).thenReturn("/mcp");
		when(response.getWriter()).thenReturn(new PrintWriter(body));
	}

	@Test
	void loopbackRequestPassesThrough() throws Exception {
		when(request.getHeader("Host")).thenReturn("localhost:8080");
		when(request.getHeader("Origin")).thenReturn("http://localhost:3000");

		filter.doFilter(request, response, chain);

		verify(chain).doFilter(request, response);
		verify(response, never()).setStatus(403);
		assertThat(body.toString()).isEmpty();
	}

	@Test
	void rebindingHostIsForbidden() throws Exception {
		when(request.getHeader("Host")).thenReturn("evil.com");

		filter.doFilter(request, response, chain);

		verify(chain, never()).doFilter(any(), any());
		verify(response).setStatus(HttpServletResponse.SC_FORBIDDEN);
		verify(response).setContentType("application/json");
		assertThat(body.toString()).isEqualTo(
				"{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32000,\"message\":\"Forbidden: Invalid Host header 'evil.com'\"}}");
	}

	@Test
	void foreignOriginIsForbidden() throws Exception {
		when(request.getHeader("Host")).thenReturn("127.0.0.1:8080");
		when(request.getHeader("Origin")).thenReturn("https://evil.com");

		filter.doFilter(request, response, chain);

		verify(chain, never()).doFilter(any(), any());
		verify(response).setStatus(HttpServletResponse.SC_FORBIDDEN);
		assertThat(body.toString()).contains("Invalid Origin header 'https://evil.com'").contains("\"id\":null");
	}

	@Test
	void disabledProtectionPassesEverything() throws Exception {
		DnsRebindingProtectionFilter disabled = new DnsRebindingProtectionFilter(
				DnsRebindingProtection.builder().enableDnsRebindingProtection(false).build(),
				McpJsonMapper.createDefault());
		when(request.getHeader("Host")).thenReturn("evil.com");

		disabled.doFilter(request, response, chain);

		verify(chain).doFilter(request, response);
	}

	@Test
	void nonHttpRequestsAreNotInspected() throws Exception {
		ServletRequest plainRequest = mock(ServletRequest.class);
		ServletResponse plainResponse = mock(ServletResponse.class);

		filter.doFilter(plainRequest, plainResponse, chain);

		verify(chain).doFilter(plainRequest, plainResponse);
	}

}
