/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.json;

import java.util.function.Supplier;

/**
 * Strategy interface for resolving a {@link McpJsonMapper} through
 * {@link java.util.ServiceLoader}.
 */
public interface McpJsonMapperSupplier extends Supplier<McpJsonMapper> {

}
