/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.modelcontextprotocol.streamable.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import io.modelcontextprotocol.streamable.json.McpJsonMapper;
import io.modelcontextprotocol.streamable.json.McpJsonMapperSupplier;

/**
 * A supplier of {@link McpJsonMapper} instances backed by Jackson. Registered through
 * {@code META-INF/services} so {@link McpJsonMapper#createDefault()} finds it.
 */
public class JacksonMcpJsonMapperSupplier implements McpJsonMapperSupplier {

	@Override
	public McpJsonMapper get() {
		return new JacksonMcpJsonMapper(createJpmsCompatibleMapper());
	}

	/**
	 * Creates an ObjectMapper that does not call {@code setAccessible()} and discovers
	 * record constructor parameter names from bytecode through the
	 * {@link ParameterNamesModule}.
	 * @return a JPMS-compatible ObjectMapper
	 */
	private static ObjectMapper createJpmsCompatibleMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
