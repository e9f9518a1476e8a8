/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server.transport;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import io.modelcontextprotocol.streamable.event.EventId;
import io.modelcontextprotocol.streamable.event.McpEventStreamStore;
import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.server.McpStreamableTransportOptions;
import io.modelcontextprotocol.streamable.session.McpSessionStore;
import io.modelcontextprotocol.streamable.session.SessionMetadata;
import io.modelcontextprotocol.streamable.spec.HttpHeaders;
import io.modelcontextprotocol.streamable.spec.McpError;
import io.modelcontextprotocol.streamable.spec.McpSchema;
import io.modelcontextprotocol.streamable.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.modelcontextprotocol.streamable.stream.McpResumableStream;
import io.modelcontextprotocol.streamable.stream.McpStreamRegistry;
import io.modelcontextprotocol.streamable.util.Assert;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Serves the server-to-client side of the Streamable HTTP transport over SSE.
 * <p>
 * {@code GET} opens the session's standalone stream. When the client sends
 * {@code Last-Event-ID} the events it missed are replayed first. If that id belongs to
 * a request stream rather than the standalone one, the replay is the whole response
 * and the response ends after it. {@code DELETE} ends the session, which closes its
 * streams and drops their retained events.
 * <p>
 * Messages are pushed through the streams held by {@link #streamRegistry()}. The servlet
 * must be registered with async support enabled.
 */
public class McpResumableSseServlet extends HttpServlet {

	private static final Logger logger = LoggerFactory.getLogger(McpResumableSseServlet.class);

	/**
	 * Stream id of the standalone stream opened by {@code GET}.
	 */
	public static final String GET_STREAM_ID = "__get__";

	private static final String ACCEPT = "Accept";

	private static final String TEXT_EVENT_STREAM = "text/event-stream";

	private static final String APPLICATION_JSON = "application/json";

	private static final String UTF_8 = "UTF-8";

	private final McpSessionStore sessionStore;

	private final McpEventStreamStore eventStore;

	private final McpStreamRegistry streamRegistry;

	private final McpJsonMapper jsonMapper;

	private final Clock clock;

	private McpResumableSseServlet(McpSessionStore sessionStore, McpEventStreamStore eventStore,
			McpJsonMapper jsonMapper, Duration retryInterval, Clock clock) {
		this.sessionStore = sessionStore;
		this.eventStore = eventStore;
		this.jsonMapper = jsonMapper;
		this.clock = clock;
		this.streamRegistry = new McpStreamRegistry(eventStore, jsonMapper, retryInterval);
		this.sessionStore.addRemovalListener(this.streamRegistry);
	}

	/**
	 * @return the registry of the streams opened by this servlet
	 */
	public McpStreamRegistry streamRegistry() {
		return this.streamRegistry;
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String accept = request.getHeader(ACCEPT);
		if (accept == null || !accept.toLowerCase(Locale.ROOT).contains(TEXT_EVENT_STREAM)) {
			sendError(response, HttpServletResponse.SC_NOT_ACCEPTABLE, new JSONRPCError(
					McpSchema.ErrorCodes.SERVER_ERROR, "Not Acceptable: Client must accept text/event-stream", null));
			return;
		}

		String sessionId = request.getHeader(HttpHeaders.MCP_SESSION_ID);
		if (sessionId == null || sessionId.isBlank()) {
			sendError(response, HttpServletResponse.SC_BAD_REQUEST, new JSONRPCError(
					McpSchema.ErrorCodes.SERVER_ERROR, "Bad Request: Mcp-Session-Id header is required", null));
			return;
		}

		SessionMetadata session = this.sessionStore.get(sessionId).block();
		if (session == null) {
			sendError(response, HttpServletResponse.SC_NOT_FOUND,
					McpError.SESSION_NOT_FOUND.apply(sessionId).getJsonRpcError());
			return;
		}

		String lastEventId = request.getHeader(HttpHeaders.LAST_EVENT_ID);
		if (lastEventId != null && lastEventId.isBlank()) {
			lastEventId = null;
		}
		Optional<EventId> resumeFrom = lastEventId != null ? EventId.parse(lastEventId) : Optional.empty();
		if (resumeFrom.isPresent() && !resumeFrom.get().sessionId().equals(sessionId)) {
			sendError(response, HttpServletResponse.SC_BAD_REQUEST, new JSONRPCError(
					McpSchema.ErrorCodes.SERVER_ERROR, "Bad Request: Last-Event-ID belongs to another session", null));
			return;
		}

		this.sessionStore.updateActivity(sessionId, this.clock.instant()).block();

		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType(TEXT_EVENT_STREAM);
		response.setCharacterEncoding(UTF_8);
		response.setHeader("Cache-Control", "no-cache");
		response.setHeader("Connection", "keep-alive");
		response.setHeader(HttpHeaders.MCP_SESSION_ID, sessionId);

		AsyncContext asyncContext = request.startAsync();
		asyncContext.setTimeout(0);
		HttpServletSseWriter writer = new HttpServletSseWriter(asyncContext, response.getWriter());

		if (resumeFrom.isPresent() && !GET_STREAM_ID.equals(resumeFrom.get().streamId())) {
			String replayFrom = lastEventId;
			this.eventStore.replayEventsAfter(replayFrom, events -> events.concatMap(writer::write).then())
				.doOnNext(streamId -> logger.debug("Replayed stream {} of session {}", streamId, sessionId))
				.onErrorResume(error -> {
					logger.warn("Failed to replay events after {}: {}", replayFrom, error.getMessage());
					return Mono.empty();
				})
				.then(Mono.defer(writer::complete))
				.subscribe();
			return;
		}

		McpResumableStream stream = this.streamRegistry.open(sessionId, GET_STREAM_ID, writer);
		asyncContext.addListener(new StreamClosingListener(stream));

		Mono<String> replay = lastEventId != null ? stream.replayAfter(lastEventId) : Mono.empty();
		replay.then(Mono.defer(stream::prime))
			.subscribe(primingId -> logger.debug("Opened stream {} of session {} at {}", GET_STREAM_ID, sessionId,
					primingId.value()), error -> {
						logger.warn("Failed to open stream {} of session {}: {}", GET_STREAM_ID, sessionId,
								error.getMessage());
						this.streamRegistry.close(stream)
							.subscribe(null, closeError -> logger.debug("Failed to close stream: {}",
									closeError.getMessage()));
					});
	}

	@Override
	protected void doDelete(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String sessionId = request.getHeader(HttpHeaders.MCP_SESSION_ID);
		if (sessionId == null || sessionId.isBlank()) {
			sendError(response, HttpServletResponse.SC_BAD_REQUEST, new JSONRPCError(
					McpSchema.ErrorCodes.SERVER_ERROR, "Bad Request: Mcp-Session-Id header is required", null));
			return;
		}

		Boolean removed = this.sessionStore.remove(sessionId).block();
		if (!Boolean.TRUE.equals(removed)) {
			sendError(response, HttpServletResponse.SC_NOT_FOUND,
					McpError.SESSION_NOT_FOUND.apply(sessionId).getJsonRpcError());
			return;
		}
		logger.debug("Session {} deleted by client", sessionId);
		response.setStatus(HttpServletResponse.SC_OK);
	}

	private void sendError(HttpServletResponse response, int status, JSONRPCError error) throws IOException {
		response.setStatus(status);
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		response.getWriter().write(this.jsonMapper.writeValueAsString(McpSchema.JSONRPCResponse.error(null, error)));
		response.getWriter().flush();
	}

	/**
	 * Forgets the stream once the container ends the response, whatever the reason.
	 */
	private final class StreamClosingListener implements AsyncListener {

		private final McpResumableStream stream;

		private StreamClosingListener(McpResumableStream stream) {
			this.stream = stream;
		}

		@Override
		public void onComplete(AsyncEvent event) {
			release();
		}

		@Override
		public void onTimeout(AsyncEvent event) {
			release();
		}

		@Override
		public void onError(AsyncEvent event) {
			logger.debug("Stream {} of session {} failed: {}", this.stream.streamId(), this.stream.sessionId(),
					event.getThrowable() != null ? event.getThrowable().getMessage() : "unknown error");
			release();
		}

		@Override
		public void onStartAsync(AsyncEvent event) {
		}

		private void release() {
			streamRegistry.close(this.stream)
				.subscribe(null, error -> logger.debug("Failed to close stream {}: {}", this.stream.streamId(),
						error.getMessage()));
		}

	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link McpResumableSseServlet}.
	 */
	public static class Builder {

		private McpSessionStore sessionStore;

		private McpEventStreamStore eventStore;

		private McpJsonMapper jsonMapper;

		private Duration retryInterval = McpStreamableTransportOptions.DEFAULT_RETRY_INTERVAL;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		public Builder sessionStore(McpSessionStore sessionStore) {
			Assert.notNull(sessionStore, "sessionStore must not be null");
			this.sessionStore = sessionStore;
			return this;
		}

		public Builder eventStore(McpEventStreamStore eventStore) {
			Assert.notNull(eventStore, "eventStore must not be null");
			this.eventStore = eventStore;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		/**
		 * Applies the retry interval of the transport options.
		 * @param options the transport options
		 * @return this builder
		 */
		public Builder options(McpStreamableTransportOptions options) {
			Assert.notNull(options, "options must not be null");
			this.retryInterval = options.retryInterval();
			return this;
		}

		public Builder retryInterval(Duration retryInterval) {
			Assert.isPositive(retryInterval, "retryInterval must be positive");
			this.retryInterval = retryInterval;
			return this;
		}

		/**
		 * Sets the clock used to record session activity.
		 * @param clock the clock
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public McpResumableSseServlet build() {
			Assert.notNull(this.sessionStore, "sessionStore must be set");
			Assert.notNull(this.eventStore, "eventStore must be set");
			return new McpResumableSseServlet(this.sessionStore, this.eventStore,
					this.jsonMapper != null ? this.jsonMapper : McpJsonMapper.createDefault(), this.retryInterval,
					this.clock);
		}

	}

}
