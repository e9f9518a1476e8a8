/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.stream;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import io.modelcontextprotocol.streamable.event.EventId;
import io.modelcontextprotocol.streamable.event.InMemoryMcpEventStreamStore;
import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.session.InMemoryMcpSessionStore;
import io.modelcontextprotocol.streamable.session.SessionMetadata;
import io.modelcontextprotocol.streamable.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link McpStreamRegistry}.
 */
class McpStreamRegistryTests {

	private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

	private InMemoryMcpEventStreamStore eventStore;

	private McpStreamRegistry registry;

	@BeforeEach
	void setUp() {
		eventStore = InMemoryMcpEventStreamStore.builder().build();
		registry = new McpStreamRegistry(eventStore, McpJsonMapper.createDefault(), Duration.ofSeconds(1));
	}

	private static McpSchema.JSONRPCRequest request(String id) {
		return new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, McpSchema.METHOD_ELICITATION_CREATE, id,
				Map.of());
	}

	@Test
	void openedStreamsAreTrackedPerSession() {
		McpResumableStream a = registry.open("s-1", "a", new RecordingSseWriter());
		McpResumableStream b = registry.open("s-1", "b", new RecordingSseWriter());
		registry.open("s-2", "a", new RecordingSseWriter());

		assertThat(registry.streams("s-1")).containsExactlyInAnyOrder(a, b);
		StepVerifier.create(registry.get("s-1", "a")).expectNext(a).verifyComplete();
		StepVerifier.create(registry.get("s-1", "missing")).verifyComplete();
		assertThat(registry.streams("unknown")).isEmpty();
	}

	@Test
	void reopeningStreamClosesPreviousInstance() {
		RecordingSseWriter first = new RecordingSseWriter();
		McpResumableStream previous = registry.open("s-1", "a", first);

		McpResumableStream current = registry.open("s-1", "a", new RecordingSseWriter());

		assertThat(previous.isClosed()).isTrue();
		assertThat(first.completions).hasValue(1);
		assertThat(registry.streams("s-1")).containsExactly(current);
	}

	@Test
	void closingSingleStreamKeepsItsEvents() {
		McpResumableStream stream = registry.open("s-1", "a", new RecordingSseWriter());
		EventId seen = stream.send(request("r1")).block();
		stream.send(request("r2")).block();

		registry.close(stream).block();

		assertThat(registry.streams("s-1")).isEmpty();
		RecordingSseWriter reconnected = new RecordingSseWriter();
		registry.open("s-1", "a", reconnected).replayAfter(seen.value()).block();
		assertThat(reconnected.payloads()).hasSize(1);
	}

	@Test
	void removingSessionClosesStreamsAndDropsEvents() {
		InMemoryMcpSessionStore sessionStore = new InMemoryMcpSessionStore();
		sessionStore.addRemovalListener(registry);
		sessionStore.save(SessionMetadata.create("s-1", null, T0)).block();
		RecordingSseWriter writer = new RecordingSseWriter();
		McpResumableStream stream = registry.open("s-1", "a", writer);
		EventId seen = stream.send(request("r1")).block();
		stream.send(request("r2")).block();

		sessionStore.remove("s-1").block();

		assertThat(stream.isClosed()).isTrue();
		assertThat(writer.completions).hasValue(1);
		assertThat(registry.streams("s-1")).isEmpty();
		StepVerifier.create(eventStore.replayEventsAfter(seen.value(), events -> events.then())).verifyComplete();
	}

	@Test
	void closingUnknownSessionIsNoOp() {
		StepVerifier.create(registry.closeSession("unknown")).verifyComplete();
	}

	@Test
	void rejectsInvalidConfiguration() {
		assertThatThrownBy(() -> new McpStreamRegistry(eventStore, McpJsonMapper.createDefault(), Duration.ZERO))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
