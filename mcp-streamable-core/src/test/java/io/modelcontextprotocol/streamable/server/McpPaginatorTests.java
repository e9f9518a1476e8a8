/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.spec.McpError;
import io.modelcontextprotocol.streamable.spec.McpSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link McpPaginator}.
 */
class McpPaginatorTests {

	private final List<String> items = IntStream.rangeClosed(1, 7).mapToObj(i -> "item-" + i).toList();

	private final McpPaginator<String> paginator = new McpPaginator<>(3);

	@Test
	void walksAllPagesAndEndsWithNullCursor() {
		List<String> collected = new ArrayList<>();
		List<String> cursors = new ArrayList<>();
		String cursor = McpSchema.FIRST_PAGE;
		do {
			McpPage<String> page = paginator.page(items, cursor);
			collected.addAll(page.items());
			cursor = page.nextCursor();
			cursors.add(cursor);
		}
		while (cursor != null);

		assertThat(collected).isEqualTo(items);
		assertThat(cursors).hasSize(3).last().isNull();
	}

	@Test
	void exactMultipleOfPageSizeHasNoTrailingEmptyPage() {
		McpPage<String> last = paginator.page(items.subList(0, 6), McpCursorCodec.encode(3));

		assertThat(last.items()).containsExactly("item-4", "item-5", "item-6");
		assertThat(last.isLast()).isTrue();
	}

	@Test
	void emptyListIsSingleLastPage() {
		McpPage<String> page = paginator.page(List.of(), (String) null);

		assertThat(page.items()).isEmpty();
		assertThat(page.nextCursor()).isNull();
	}

	@Test
	void lastPageSerializesWithoutNextCursor() throws Exception {
		McpPage<String> page = paginator.page(items, McpCursorCodec.encode(6));

		String json = McpJsonMapper.createDefault().writeValueAsString(page.toPaginatedResult());

		assertThat(json).isEqualTo("{}");
	}

	@Test
	void acceptsPaginatedRequest() {
		McpPage<String> page = paginator.page(items, new McpSchema.PaginatedRequest());

		assertThat(page.items()).containsExactly("item-1", "item-2", "item-3");
	}

	@Test
	void rejectsCursorPastTheEnd() {
		assertThatThrownBy(() -> paginator.page(items, McpCursorCodec.encode(8))).isInstanceOf(McpError.class);
	}

	@Test
	void pageNeverCarriesEmptyCursor() {
		assertThatThrownBy(() -> new McpPage<>(List.of("a"), "")).isInstanceOf(IllegalArgumentException.class);
	}

}
