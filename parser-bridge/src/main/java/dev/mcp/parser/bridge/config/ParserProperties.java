package dev.mcp.parser.bridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import dev.mcp.parser.JsonRpcCodec;

/**
 * Configuration options for the JSON-RPC parser. Defaults give strict standard JSON and short
 * log lines.
 */
@ConfigurationProperties(prefix = "mcp.parser")
public class ParserProperties {

	/**
	 * Whether text following the top-level JSON value is rejected as invalid JSON.
	 */
	private boolean failOnTrailingTokens = true;

	/**
	 * Whether fractional numbers inside payloads are read as exact decimals instead of doubles.
	 */
	private boolean useBigDecimalForFloats = false;

	/**
	 * Maximum number of payload characters written to decode log lines.
	 */
	private int logPayloadLimit = JsonRpcCodec.DEFAULT_LOG_PAYLOAD_LIMIT;

	/**
	 * Determine whether trailing content after the top-level value is rejected.
	 * @return {@code true} when trailing tokens fail the parse
	 */
	public boolean isFailOnTrailingTokens() {
		return failOnTrailingTokens;
	}

	/**
	 * Enable or disable rejection of trailing content.
	 * @param failOnTrailingTokens {@code true} to reject trailing tokens
	 */
	public void setFailOnTrailingTokens(boolean failOnTrailingTokens) {
		this.failOnTrailingTokens = failOnTrailingTokens;
	}

	/**
	 * Determine whether fractional numbers are kept as exact decimals.
	 * @return {@code true} when {@link java.math.BigDecimal} is used for fractional numbers
	 */
	public boolean isUseBigDecimalForFloats() {
		return useBigDecimalForFloats;
	}

	/**
	 * Choose how fractional numbers are represented.
	 * @param useBigDecimalForFloats {@code true} to keep exact decimals
	 */
	public void setUseBigDecimalForFloats(boolean useBigDecimalForFloats) {
		this.useBigDecimalForFloats = useBigDecimalForFloats;
	}

	/**
	 * Retrieve the payload truncation length used in log lines.
	 * @return maximum number of characters logged per payload
	 */
	public int getLogPayloadLimit() {
		return logPayloadLimit;
	}

	/**
	 * Update the payload truncation length used in log lines.
	 * @param logPayloadLimit maximum number of characters, not negative
	 */
	public void setLogPayloadLimit(int logPayloadLimit) {
		if (logPayloadLimit < 0) {
			throw new IllegalArgumentException("logPayloadLimit must not be negative: " + logPayloadLimit);
		}
		this.logPayloadLimit = logPayloadLimit;
	}

}
