package org.springaicommunity.github.contributors;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating a consistently configured {@link ObjectMapper}.
 *
 * <p>
 * Commit pages are read as trees, where binding features have no effect. The mapper
 * rejects content after the root value, so a body with trailing garbage is reported as
 * malformed instead of being silently truncated to its first value.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
		return mapper;
	}

}
