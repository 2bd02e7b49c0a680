package dev.civitai.dl.util;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User settings as stored in the JSON config file. Every value is optional; absent values fall back
 * to the engine defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AppConfig(
		@JsonProperty("api_key") String apiKey,
		@JsonProperty("timeout") Integer timeout,
		@JsonProperty("max_retries") Integer maxRetries,
		@JsonProperty("retry_delay") Double retryDelay,
		@JsonProperty("concurrent_downloads") Integer concurrentDownloads,
		@JsonProperty("chunk_size") Integer chunkSize,
		@JsonProperty("output_dir") String outputDir,
		@JsonProperty("min_request_interval") Double minRequestInterval,
		@JsonProperty("proxy") String proxy) {

	public static AppConfig empty() {
		return new AppConfig(null, null, null, null, null, null, null, null, null);
	}

	public AppConfig withApiKey(String apiKey) {
		return new AppConfig(
				apiKey,
				timeout,
				maxRetries,
				retryDelay,
				concurrentDownloads,
				chunkSize,
				outputDir,
				minRequestInterval,
				proxy);
	}
}
