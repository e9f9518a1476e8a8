/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.session;

import java.time.Instant;

import io.modelcontextprotocol.streamable.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Identity and liveness of a single MCP transport session. Instances are immutable;
 * activity updates produce a copy through {@link #withLastActivityAt(Instant)}.
 *
 * @param sessionId opaque, unique identifier. Never reused after removal
 * @param userIdentity the authenticated principal that owns the session, {@code null}
 * for anonymous sessions
 * @param createdAt when the session was created
 * @param lastActivityAt the latest activity observed on the session, never before
 * {@code createdAt}
 * @param customData opaque application data, stored and returned unchanged
 */
public record SessionMetadata(String sessionId, @Nullable UserIdentity userIdentity, Instant createdAt,
		Instant lastActivityAt, @Nullable String customData) {

	public SessionMetadata {
		Assert.hasText(sessionId, "sessionId must not be empty");
		Assert.notNull(createdAt, "createdAt must not be null");
		Assert.notNull(lastActivityAt, "lastActivityAt must not be null");
		Assert.isTrue(!lastActivityAt.isBefore(createdAt), "lastActivityAt must not be before createdAt");
	}

	/**
	 * Creates metadata for a session that has just been established.
	 * @param sessionId the session id
	 * @param userIdentity the owner, or {@code null} for an anonymous session
	 * @param now the creation time, also used as the initial activity time
	 * @return the new metadata
	 */
	public static SessionMetadata create(String sessionId, @Nullable UserIdentity userIdentity, Instant now) {
		return new SessionMetadata(sessionId, userIdentity, now, now, null);
	}

	/**
	 * @return {@code true} if the session is not bound to an authenticated user
	 */
	public boolean isAnonymous() {
		return this.userIdentity == null;
	}

	/**
	 * Returns a copy whose last activity is the later of the current value and the
	 * given timestamp.
	 * @param timestamp observed activity time
	 * @return this instance when the timestamp is not newer, otherwise an updated copy
	 */
	public SessionMetadata withLastActivityAt(Instant timestamp) {
		if (!timestamp.isAfter(this.lastActivityAt)) {
			return this;
		}
		return new SessionMetadata(this.sessionId, this.userIdentity, this.createdAt, timestamp, this.customData);
	}

	public SessionMetadata withCustomData(@Nullable String customData) {
		return new SessionMetadata(this.sessionId, this.userIdentity, this.createdAt, this.lastActivityAt,
				customData);
	}

	/**
	 * The authenticated principal bound to a session. A request presenting a different
	 * principal must not be allowed to use the session.
	 *
	 * @param claimType the type of the identifying claim, e.g. {@code sub}
	 * @param claimValue the value of the identifying claim
	 * @param claimIssuer the issuer of the claim
	 */
	public record UserIdentity(String claimType, String claimValue, @Nullable String claimIssuer) {

		public UserIdentity {
			Assert.hasText(claimType, "claimType must not be empty");
			Assert.hasText(claimValue, "claimValue must not be empty");
		}

	}

}
