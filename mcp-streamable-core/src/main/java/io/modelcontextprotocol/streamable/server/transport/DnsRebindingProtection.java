/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server.transport;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import io.modelcontextprotocol.streamable.spec.McpSchema;
import io.modelcontextprotocol.streamable.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import reactor.util.annotation.Nullable;

/**
 * Host and Origin validation against DNS rebinding attacks.
 * <p>
 * DNS rebinding lets a malicious web page reach a server bound to the loopback
 * interface by pointing its own domain at {@code 127.0.0.1}. The browser then sends the
 * attacker's host name in the {@code Host} header and the attacker's page in the
 * {@code Origin} header, which is what this check rejects.
 * <p>
 * <strong>Loopback mode</strong> (the default) accepts a {@code Host} of
 * {@code localhost}, {@code 127.0.0.1}, {@code [::1]} or any other literal loopback
 * address, with or without a port. Host names are matched exactly, so
 * {@code evil.localhost} and {@code localhost.evil.com} are rejected. An {@code Origin}
 * header is optional; when present its host must pass the same test.
 * <p>
 * <strong>Allow-list mode</strong> adds explicit values. A host entry matches either the
 * full header value or the host name without its port; an origin entry matches the full
 * origin. Disabling loopback mode leaves only the allow-lists. <pre>{@code
 * DnsRebindingProtection protection = DnsRebindingProtection.builder()
 *     .allowedHost("mcp.internal.example.com")
 *     .allowedOrigin("https://console.internal.example.com")
 *     .build();
 * }</pre>
 *
 * @see <a href="https://en.wikipedia.org/wiki/DNS_rebinding">DNS Rebinding Attack</a>
 */
public class DnsRebindingProtection {

	private static final Pattern IPV4_LITERAL = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

	private static final Pattern IPV6_LITERAL = Pattern.compile("[0-9a-f:.]*:[0-9a-f:.]*");

	private static final Set<String> LOOPBACK_NAMES = Set.of("localhost", "127.0.0.1", "[::1]");

	private final Set<String> allowedHosts;

	private final Set<String> allowedOrigins;

	private final boolean allowLoopback;

	private final boolean enable;

	private DnsRebindingProtection(Set<String> allowedHosts, Set<String> allowedOrigins, boolean allowLoopback,
			boolean enable) {
		this.allowedHosts = Collections.unmodifiableSet(new HashSet<>(allowedHosts));
		this.allowedOrigins = Collections.unmodifiableSet(new HashSet<>(allowedOrigins));
		this.allowLoopback = allowLoopback;
		this.enable = enable;
	}

	/**
	 * Protection in loopback mode with no additional allowed values.
	 * @return the default protection
	 */
	public static DnsRebindingProtection loopback() {
		return builder().build();
	}

	/**
	 * Validates the Host and Origin headers of a request.
	 * @param hostHeader the Host header, may be null
	 * @param originHeader the Origin header, may be null
	 * @return {@code true} if the request may proceed
	 */
	public boolean isValid(@Nullable String hostHeader, @Nullable String originHeader) {
		return rejectionReason(hostHeader, originHeader) == null;
	}

	/**
	 * Validates the Host and Origin headers of a request and describes the failure.
	 * @param hostHeader the Host header, may be null
	 * @param originHeader the Origin header, may be null
	 * @return a message naming the rejected header, or {@code null} if the request may
	 * proceed
	 */
	@Nullable
	public String rejectionReason(@Nullable String hostHeader, @Nullable String originHeader) {
		if (!this.enable) {
			return null;
		}
		if (!isAllowedHost(hostHeader)) {
			return "Forbidden: Invalid Host header '" + hostHeader + "'";
		}
		if (originHeader != null && !isAllowedOrigin(originHeader)) {
			return "Forbidden: Invalid Origin header '" + originHeader + "'";
		}
		return null;
	}

	/**
	 * Builds the JSON-RPC body sent with a 403 response. The offending request is not
	 * parsed, so the id is {@code null}.
	 * @param reason the rejection reason
	 * @return the error response
	 */
	public static McpSchema.JSONRPCResponse forbiddenResponse(String reason) {
		return McpSchema.JSONRPCResponse.error(null,
				new JSONRPCError(McpSchema.ErrorCodes.SERVER_ERROR, reason, null));
	}

	private boolean isAllowedHost(@Nullable String hostHeader) {
		if (hostHeader == null || hostHeader.isBlank()) {
			// HTTP/1.1 requires Host; without it only a disabled check can pass
			return false;
		}
		String host = hostHeader.trim().toLowerCase(Locale.ROOT);
		String hostName = stripPort(host);
		if (hostName == null) {
			return false;
		}
		if (this.allowedHosts.contains(host) || this.allowedHosts.contains(hostName)) {
			return true;
		}
		return this.allowLoopback && isLoopback(hostName);
	}

	private boolean isAllowedOrigin(String originHeader) {
		String origin = originHeader.trim().toLowerCase(Locale.ROOT);
		if (this.allowedOrigins.contains(origin)) {
			return true;
		}
		if (!this.allowLoopback) {
			return false;
		}
		try {
			URI uri = new URI(origin);
			String host = uri.getHost();
			return uri.getScheme() != null && host != null && isLoopback(host);
		}
		catch (URISyntaxException e) {
			return false;
		}
	}

	/**
	 * Removes an optional {@code :port} suffix, keeping IPv6 brackets.
	 * @return the host name, or {@code null} if the value is malformed
	 */
	@Nullable
	static String stripPort(String host) {
		String name;
		String port;
		if (host.startsWith("[")) {
			int end = host.indexOf(']');
			if (end < 0) {
				return null;
			}
			name = host.substring(0, end + 1);
			String rest = host.substring(end + 1);
			if (rest.isEmpty()) {
				return name;
			}
			if (!rest.startsWith(":")) {
				return null;
			}
			port = rest.substring(1);
		}
		else {
			int colon = host.indexOf(':');
			if (colon < 0) {
				return host;
			}
			if (host.indexOf(':', colon + 1) >= 0) {
				// bare IPv6 is not a valid Host header
				return null;
			}
			name = host.substring(0, colon);
			port = host.substring(colon + 1);
		}
		if (port.isEmpty() || port.length() > 5 || !port.chars().allMatch(Character::isDigit)) {
			return null;
		}
		return name.isEmpty() ? null : name;
	}

	static boolean isLoopback(String hostName) {
		if (LOOPBACK_NAMES.contains(hostName)) {
			return true;
		}
		String literal = null;
		if (hostName.startsWith("[") && hostName.endsWith("]")) {
			String candidate = hostName.substring(1, hostName.length() - 1);
			literal = IPV6_LITERAL.matcher(candidate).matches() ? candidate : null;
		}
		else if (IPV4_LITERAL.matcher(hostName).matches()) {
			literal = hostName;
		}
		if (literal == null) {
			return false;
		}
		try {
			// literals only, so no name resolution happens here
			return InetAddress.getByName(literal).isLoopbackAddress();
		}
		catch (UnknownHostException e) {
			return false;
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link DnsRebindingProtection}. Protection is enabled in loopback mode
	 * by default. Not thread-safe.
	 */
	public static class Builder {

		private final Set<String> allowedHosts = new HashSet<>();

		private final Set<String> allowedOrigins = new HashSet<>();

		private boolean allowLoopback = true;

		private boolean enable = true;

		private Builder() {
		}

		/**
		 * Adds an allowed host header value, with or without port.
		 * @param host the host to allow (case-insensitive, may be null)
		 * @return this builder
		 */
		public Builder allowedHost(String host) {
			if (host != null) {
				this.allowedHosts.add(host.trim().toLowerCase(Locale.ROOT));
			}
			return this;
		}

		public Builder allowedHosts(Set<String> hosts) {
			if (hosts != null) {
				hosts.forEach(this::allowedHost);
			}
			return this;
		}

		/**
		 * Adds an allowed origin, e.g. {@code https://app.example.com}.
		 * @param origin the origin to allow (case-insensitive, may be null)
		 * @return this builder
		 */
		public Builder allowedOrigin(String origin) {
			if (origin != null) {
				this.allowedOrigins.add(origin.trim().toLowerCase(Locale.ROOT));
			}
			return this;
		}

		public Builder allowedOrigins(Set<String> origins) {
			if (origins != null) {
				origins.forEach(this::allowedOrigin);
			}
			return this;
		}

		/**
		 * Whether loopback hosts and origins are accepted without being listed.
		 * @param allowLoopback {@code false} to rely on the allow-lists only
		 * @return this builder
		 */
		public Builder allowLoopback(boolean allowLoopback) {
			this.allowLoopback = allowLoopback;
			return this;
		}

		public Builder enableDnsRebindingProtection(boolean enable) {
			this.enable = enable;
			return this;
		}

		public DnsRebindingProtection build() {
			return new DnsRebindingProtection(this.allowedHosts, this.allowedOrigins, this.allowLoopback, this.enable);
		}

	}

}
