/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server.transport;

import java.io.IOException;

import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.spec.HttpHeaders;
import io.modelcontextprotocol.streamable.util.Assert;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Servlet filter rejecting requests whose {@code Host} or {@code Origin} header fails
 * {@link DnsRebindingProtection}. Rejected requests receive HTTP 403 with a JSON-RPC
 * error body and never reach the filter chain.
 */
public class DnsRebindingProtectionFilter implements Filter {

	private static final Logger logger = LoggerFactory.getLogger(DnsRebindingProtectionFilter.class);

	private static final String APPLICATION_JSON = "application/json";

	private final DnsRebindingProtection protection;

	private final McpJsonMapper jsonMapper;

	public DnsRebindingProtectionFilter(DnsRebindingProtection protection, McpJsonMapper jsonMapper) {
		Assert.notNull(protection, "protection must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.protection = protection;
		this.jsonMapper = jsonMapper;
	}

	@Override
	public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
			throws IOException, ServletException {
		if (!(request instanceof HttpServletRequest httpRequest)
				|| !(response instanceof HttpServletResponse httpResponse)) {
			chain.doFilter(request, response);
			return;
		}

		String host = httpRequest.getHeader(HttpHeaders.HOST);
		String origin = httpRequest.getHeader(HttpHeaders.ORIGIN);
		String reason = this.protection.rejectionReason(host, origin);
		if (reason == null) {
			chain.doFilter(request, response);
			return;
		}

		logger.warn("Rejected {} {} from {}: {}", httpRequest.getMethod(), httpRequest.getRequestURI(),
				httpRequest.getRemoteAddr(), reason);
		httpResponse.setStatus(HttpServletResponse.SC_FORBIDDEN);
		httpResponse.setContentType(APPLICATION_JSON);
		httpResponse.setCharacterEncoding("UTF-8");
		String body = this.jsonMapper.writeValueAsString(DnsRebindingProtection.forbiddenResponse(reason));
		httpResponse.getWriter().write(body);
		httpResponse.getWriter().flush();
	}

}
