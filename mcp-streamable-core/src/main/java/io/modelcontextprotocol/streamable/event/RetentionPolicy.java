/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.event;

/**
 * Decides which outbound events an event stream store keeps for replay.
 * <p>
 * The {@link #DEFAULT} policy keeps exactly what a reconnecting client needs to rebuild
 * its request/response pairs: server-initiated requests are always kept, a response is
 * kept only once its stream already holds retained events, and notifications are never
 * kept, so high-frequency notification streams do not grow the store.
 */
@FunctionalInterface
public interface RetentionPolicy {

	RetentionPolicy DEFAULT = kind -> switch (kind) {
		case REQUEST -> Retention.ALWAYS;
		case RESPONSE -> Retention.IF_STREAM_RETAINED;
		case NOTIFICATION, PRIMING -> Retention.NEVER;
	};

	/**
	 * Keeps every message. Priming events carry no payload and are still dropped.
	 */
	RetentionPolicy RETAIN_ALL = kind -> kind == MessageKind.PRIMING ? Retention.NEVER : Retention.ALWAYS;

	Retention retentionOf(MessageKind kind);

	enum Retention {

		ALWAYS,

		/** Kept only if the stream already has retained events. */
		IF_STREAM_RETAINED,

		NEVER

	}

}
