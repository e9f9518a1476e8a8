/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.modelcontextprotocol.streamable.spec.McpError;
import io.modelcontextprotocol.streamable.spec.McpSchema;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link McpPaginatedFetcher}.
 */
class McpPaginatedFetcherTests {

	record Page(List<String> items, String nextCursor) {
	}

	private final List<String> requestedCursors = new ArrayList<>();

	private McpPaginatedFetcher<Page, String> fetcher(Map<String, Page> pagesByCursor, Page first) {
		return new McpPaginatedFetcher<>(cursor -> {
			this.requestedCursors.add(cursor);
			return Mono.just(cursor == null ? first : pagesByCursor.get(cursor));
		}, Page::items, Page::nextCursor);
	}

	@Test
	void followsCursorsUntilAbsent() {
		McpPaginatedFetcher<Page, String> fetcher = fetcher(
				Map.of("c1", new Page(List.of("c", "d"), "c2"), "c2", new Page(List.of("e"), null)),
				new Page(List.of("a", "b"), "c1"));

		StepVerifier.create(fetcher.collectAll()).expectNext(List.of("a", "b", "c", "d", "e")).verifyComplete();
		assertThat(this.requestedCursors).containsExactly(null, "c1", "c2");
	}

	@Test
	void singlePageIsFetchedOnce() {
		McpPaginatedFetcher<Page, String> fetcher = fetcher(Map.of(), new Page(List.of("only"), null));

		StepVerifier.create(fetcher.pages()).expectNextCount(1).verifyComplete();
		assertThat(this.requestedCursors).containsExactly((String) null);
	}

	@Test
	void emptyStringCursorMeansMorePages() {
		McpPaginatedFetcher<Page, String> fetcher = fetcher(Map.of("", new Page(List.of("b"), null)),
				new Page(List.of("a"), ""));

		StepVerifier.create(fetcher.items()).expectNext("a", "b").verifyComplete();
		assertThat(this.requestedCursors).containsExactly(null, "");
	}

	@Test
	void repeatedCursorIsReportedInsteadOfLooping() {
		McpPaginatedFetcher<Page, String> fetcher = fetcher(Map.of("c1", new Page(List.of("b"), "c1")),
				new Page(List.of("a"), "c1"));

		StepVerifier.create(fetcher.items())
			.expectNext("a", "b")
			.verifyErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.satisfies(e -> assertThat(((McpError) e).getJsonRpcError().code())
					.isEqualTo(McpSchema.ErrorCodes.INTERNAL_ERROR)));
		assertThat(this.requestedCursors).containsExactly(null, "c1");
	}

	@Test
	void fetchErrorsPropagate() {
		McpPaginatedFetcher<Page, String> fetcher = new McpPaginatedFetcher<>(
				cursor -> Mono.error(new IllegalStateException("offline")), Page::items, Page::nextCursor);

		StepVerifier.create(fetcher.collectAll()).verifyErrorMessage("offline");
	}

}
