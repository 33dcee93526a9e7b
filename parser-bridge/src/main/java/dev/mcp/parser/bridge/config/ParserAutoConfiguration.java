package dev.mcp.parser.bridge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.mcp.parser.FastRejectFilter;
import dev.mcp.parser.JsonRpcCodec;
import dev.mcp.parser.bridge.McpParser;

/**
 * Spring Boot auto-configuration that assembles the JSON-RPC codec, the fast-reject filter and
 * the {@link McpParser} facade from {@link ParserProperties}. Every bean backs off when the
 * application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(ParserProperties.class)
public class ParserAutoConfiguration {

	private static final Logger logger = LoggerFactory.getLogger(ParserAutoConfiguration.class);

	/**
	 * Create the codec shared by every decode call. Its {@link ObjectMapper} stays private to the
	 * codec and is not registered as a bean.
	 * @param properties parser configuration
	 * @return thread-safe codec
	 */
	@Bean
	@ConditionalOnMissingBean
	public JsonRpcCodec jsonRpcCodec(ParserProperties properties) {
		ObjectMapper mapper = JsonRpcCodec.defaultMapper();
		mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, properties.isFailOnTrailingTokens());
		mapper.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, properties.isUseBigDecimalForFloats());
		logger.info("JSON-RPC codec initialized (failOnTrailingTokens={}, useBigDecimalForFloats={})",
				properties.isFailOnTrailingTokens(), properties.isUseBigDecimalForFloats());
		return new JsonRpcCodec(mapper, properties.getLogPayloadLimit());
	}

	/**
	 * Create the admission filter sharing the codec's mapper.
	 * @param codec configured codec
	 * @return fast-reject filter
	 */
	@Bean
	@ConditionalOnMissingBean
	public FastRejectFilter fastRejectFilter(JsonRpcCodec codec) {
		return new FastRejectFilter(codec);
	}

	/**
	 * Create the host-facing parser facade.
	 * @param codec configured codec
	 * @param filter admission filter
	 * @return parser facade
	 */
	@Bean
	@ConditionalOnMissingBean
	public McpParser mcpParser(JsonRpcCodec codec, FastRejectFilter filter) {
		return new McpParser(codec, filter);
	}

}
