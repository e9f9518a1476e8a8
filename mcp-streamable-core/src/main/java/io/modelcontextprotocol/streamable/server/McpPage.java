/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server;

import java.util.List;

import io.modelcontextprotocol.streamable.spec.McpSchema;
import io.modelcontextprotocol.streamable.util.Assert;

/**
 * One page of a paginated list result.
 *
 * @param items the items of the page
 * @param nextCursor the cursor of the following page, {@code null} on the last page and
 * never empty
 * @param <T> the item type
 */
public record McpPage<T>(List<T> items, String nextCursor) {

	public McpPage {
		Assert.notNull(items, "items must not be null");
		Assert.isTrue(nextCursor == null || !nextCursor.isEmpty(), "nextCursor must be null on the last page");
		items = List.copyOf(items);
	}

	public boolean isLast() {
		return this.nextCursor == null;
	}

	public McpSchema.PaginatedResult toPaginatedResult() {
		return new McpSchema.PaginatedResult(this.nextCursor);
	}

}
