/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.server;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.spec.McpSchema;
import io.modelcontextprotocol.streamable.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Correlates inbound {@code notifications/cancelled} messages with the handlers of the
 * requests they name.
 * <p>
 * A handler is {@link #track(Object, Mono) tracked} while it runs. Cancelling its
 * request id stops the handler cooperatively: the tracked Mono completes empty and no
 * response is sent. Cancellation fires at most once per request; ids that are unknown
 * or already finished are ignored, as the protocol expects of racing cancellations.
 */
public class McpRequestCancellationRegistry {

	private static final Logger logger = LoggerFactory.getLogger(McpRequestCancellationRegistry.class);

	private final Map<Object, Sinks.Empty<Void>> inFlight = new ConcurrentHashMap<>();

	private final McpJsonMapper jsonMapper;

	public McpRequestCancellationRegistry(McpJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Wraps the handler of a request so that it can be cancelled by id. The id is
	 * registered on subscription and released once the handler terminates.
	 * @param <T> the handler result type
	 * @param requestId the id of the request being handled
	 * @param handler the handler
	 * @return the handler, completing empty if it was cancelled
	 */
	public <T> Mono<T> track(Object requestId, Mono<T> handler) {
		Assert.notNull(requestId, "requestId must not be null");
		Assert.notNull(handler, "handler must not be null");
		return Mono.defer(() -> {
			Sinks.Empty<Void> cancellation = Sinks.empty();
			Sinks.Empty<Void> existing = this.inFlight.putIfAbsent(key(requestId), cancellation);
			if (existing != null) {
				return Mono.error(new IllegalStateException("Request " + requestId + " is already in flight"));
			}
			return handler.takeUntilOther(cancellation.asMono())
				.doFinally(signal -> this.inFlight.remove(key(requestId), cancellation));
		});
	}

	/**
	 * Cancels the handler of a request.
	 * @param requestId the request id
	 * @param reason the reason given by the peer, may be null
	 * @return {@code true} if a running handler was cancelled, {@code false} for an
	 * unknown or finished request
	 */
	public boolean cancel(Object requestId, String reason) {
		if (requestId == null) {
			return false;
		}
		Sinks.Empty<Void> cancellation = this.inFlight.remove(key(requestId));
		if (cancellation == null) {
			logger.debug("Ignoring cancellation of unknown request {}", requestId);
			return false;
		}
		logger.debug("Cancelling request {}: {}", requestId, reason);
		return cancellation.tryEmitEmpty().isSuccess();
	}

	/**
	 * Handles an inbound notification. Notifications other than
	 * {@code notifications/cancelled} and malformed params are ignored.
	 * @param notification the inbound notification
	 * @return {@code true} if a running handler was cancelled
	 */
	public boolean handleNotification(McpSchema.JSONRPCNotification notification) {
		if (notification == null || !McpSchema.METHOD_NOTIFICATION_CANCELLED.equals(notification.method())
				|| notification.params() == null) {
			return false;
		}
		McpSchema.CancelledNotification cancelled;
		try {
			cancelled = this.jsonMapper.convertValue(notification.params(), McpSchema.CancelledNotification.class);
		}
		catch (IllegalArgumentException e) {
			logger.warn("Ignoring malformed cancellation notification: {}", e.getMessage());
			return false;
		}
		return cancel(cancelled.requestId(), cancelled.reason());
	}

	public int inFlightCount() {
		return this.inFlight.size();
	}

	// JSON numbers arrive as Integer or Long depending on magnitude
	private static Object key(Object requestId) {
		if (requestId instanceof Number number) {
			return number.longValue();
		}
		return requestId;
	}

}
