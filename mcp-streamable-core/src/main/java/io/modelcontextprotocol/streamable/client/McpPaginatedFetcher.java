/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.client;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import io.modelcontextprotocol.streamable.spec.McpError;
import io.modelcontextprotocol.streamable.spec.McpSchema;
import io.modelcontextprotocol.streamable.util.Assert;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Follows {@code nextCursor} through every page of a paginated list operation.
 * <p>
 * Fetching continues for as long as the server returns a cursor. An empty string is a
 * cursor like any other; only an absent one ends the list. A server that answers with
 * the cursor it was just sent would loop forever, so that is reported as an error.
 *
 * @param <R> the page result type
 * @param <T> the item type
 */
public class McpPaginatedFetcher<R, T> {

	private final Function<String, Mono<R>> pageFetcher;

	private final Function<R, List<T>> itemsExtractor;

	private final Function<R, String> cursorExtractor;

	/**
	 * @param pageFetcher fetches the page for a cursor, {@code null} meaning the first
	 * page
	 * @param itemsExtractor the items of a page
	 * @param cursorExtractor the next cursor of a page
	 */
	public McpPaginatedFetcher(Function<String, Mono<R>> pageFetcher, Function<R, List<T>> itemsExtractor,
			Function<R, String> cursorExtractor) {
		Assert.notNull(pageFetcher, "pageFetcher must not be null");
		Assert.notNull(itemsExtractor, "itemsExtractor must not be null");
		Assert.notNull(cursorExtractor, "cursorExtractor must not be null");
		this.pageFetcher = pageFetcher;
		this.itemsExtractor = itemsExtractor;
		this.cursorExtractor = cursorExtractor;
	}

	/**
	 * @return every page, in order, starting from the first
	 */
	public Flux<R> pages() {
		return fetch(McpSchema.FIRST_PAGE).expand(fetched -> {
			String next = this.cursorExtractor.apply(fetched.result());
			if (next == null) {
				return Mono.empty();
			}
			if (Objects.equals(next, fetched.cursor())) {
				return Mono.error(McpError.builder(McpSchema.ErrorCodes.INTERNAL_ERROR)
					.message("Server returned the cursor it was given, pagination cannot advance")
					.data(next)
					.build());
			}
			return fetch(next);
		}).map(Fetched::result);
	}

	/**
	 * @return every item of every page, in order
	 */
	public Flux<T> items() {
		return pages().concatMapIterable(this.itemsExtractor);
	}

	/**
	 * @return every item collected into an unmodifiable list
	 */
	public Mono<List<T>> collectAll() {
		return items().collectList().map(List::copyOf);
	}

	private Mono<Fetched<R>> fetch(String cursor) {
		return Mono.defer(() -> this.pageFetcher.apply(cursor)).map(result -> new Fetched<>(cursor, result));
	}

	private record Fetched<R>(String cursor, R result) {
	}

}
