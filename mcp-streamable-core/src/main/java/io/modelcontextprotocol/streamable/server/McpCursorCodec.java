/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import io.modelcontextprotocol.streamable.spec.McpError;
import io.modelcontextprotocol.streamable.util.Assert;

/**
 * Encodes list positions as opaque pagination cursors. A cursor is the Base64URL form of
 * the offset of the next item; clients must treat it as an opaque token.
 */
public final class McpCursorCodec {

	private static final String PREFIX = "o:";

	private McpCursorCodec() {
	}

	/**
	 * @param offset the offset of the first item of the next page
	 * @return the cursor for that page
	 */
	public static String encode(int offset) {
		Assert.isTrue(offset >= 0, "offset must not be negative");
		return Base64.getUrlEncoder()
			.withoutPadding()
			.encodeToString((PREFIX + offset).getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Decodes a cursor received from a client.
	 * @param cursor the cursor, {@code null} for the first page
	 * @return the offset the cursor points at
	 * @throws McpError with {@code INVALID_PARAMS} if the cursor was not produced by
	 * {@link #encode(int)}
	 */
	public static int decode(String cursor) {
		if (cursor == null) {
			return 0;
		}
		String decoded;
		try {
			decoded = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
		}
		catch (IllegalArgumentException e) {
			throw McpError.INVALID_CURSOR.apply(cursor);
		}
		if (!decoded.startsWith(PREFIX)) {
			throw McpError.INVALID_CURSOR.apply(cursor);
		}
		String digits = decoded.substring(PREFIX.length());
		if (digits.isEmpty() || digits.length() > 10 || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
			throw McpError.INVALID_CURSOR.apply(cursor);
		}
		long offset = Long.parseLong(digits);
		if (offset > Integer.MAX_VALUE) {
			throw McpError.INVALID_CURSOR.apply(cursor);
		}
		return (int) offset;
	}

}
