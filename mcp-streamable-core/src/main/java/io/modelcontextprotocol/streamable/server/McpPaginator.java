/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server;

import java.util.List;

import io.modelcontextprotocol.streamable.spec.McpError;
import io.modelcontextprotocol.streamable.spec.McpSchema;
import io.modelcontextprotocol.streamable.util.Assert;

/**
 * Splits list results into pages addressed by opaque cursors.
 *
 * @param <T> the item type
 * @see McpCursorCodec
 */
public class McpPaginator<T> {

	private final int pageSize;

	public McpPaginator(int pageSize) {
		Assert.isTrue(pageSize > 0, "pageSize must be positive");
		this.pageSize = pageSize;
	}

	/**
	 * Returns the page of {@code items} the cursor points at.
	 * @param items the complete list, in a stable order
	 * @param cursor the cursor from the request, {@code null} for the first page
	 * @return the page, with a {@code null} next cursor if it is the last one
	 * @throws McpError with {@code INVALID_PARAMS} for a malformed cursor or one past
	 * the end of the list
	 */
	public McpPage<T> page(List<T> items, String cursor) {
		Assert.notNull(items, "items must not be null");
		int offset = McpCursorCodec.decode(cursor);
		if (offset > items.size()) {
			throw McpError.INVALID_CURSOR.apply(cursor);
		}
		int end = (int) Math.min((long) offset + this.pageSize, items.size());
		String nextCursor = end < items.size() ? McpCursorCodec.encode(end) : null;
		return new McpPage<>(items.subList(offset, end), nextCursor);
	}

	public McpPage<T> page(List<T> items, McpSchema.PaginatedRequest request) {
		return page(items, request != null ? request.cursor() : McpSchema.FIRST_PAGE);
	}

	public int pageSize() {
		return this.pageSize;
	}

}
