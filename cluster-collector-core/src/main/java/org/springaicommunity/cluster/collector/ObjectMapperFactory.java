package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for consistently configured Jackson mappers.
 *
 * <p>
 * Both mappers use {@link PropertyNamingStrategies#SNAKE_CASE} so that report records
 * (summary, analysis) are serialized with snake_case keys (e.g.&nbsp;{@code startedAt}
 * &rarr; {@code started_at}). Resource documents are {@code JsonNode} trees, whose field
 * names are written untouched by either mapper.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new JSON {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		return configure(new ObjectMapper());
	}

	/**
	 * Create a new YAML mapper with the same configuration as {@link #create()}. Used for
	 * YAML output and for reading kubeconfig files.
	 * @return configured YAMLMapper
	 */
	public static YAMLMapper createYaml() {
		YAMLFactory factory = YAMLFactory.builder().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER).build();
		YAMLMapper mapper = new YAMLMapper(factory);
		configure(mapper);
		return mapper;
	}

	private static <T extends ObjectMapper> T configure(T mapper) {
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

}
