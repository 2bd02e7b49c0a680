package dev.civitai.dl.download;

import dev.civitai.dl.api.HttpClientTransport;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration record for the download engine and the client it drives. Values are validated on
 * construction and never change afterwards.
 */
public record EngineConfig(
		int maxWorkers,
		int chunkSize,
		int retryTimes,
		Duration retryDelay,
		Duration minRequestInterval,
		Duration timeout,
		Duration throttleDelay,
		int maxThrottleRetries,
		Duration progressInterval,
		Duration schedulerTick,
		int maxPages,
		Path outputDir,
		String apiKey,
		String proxy) {

	public EngineConfig {
		requireAtLeast("maxWorkers", maxWorkers, 1);
		requireAtLeast("chunkSize", chunkSize, 1);
		requireAtLeast("retryTimes", retryTimes, 0);
		requireAtLeast("maxThrottleRetries", maxThrottleRetries, 0);
		requireAtLeast("maxPages", maxPages, 1);
		requireNonNegative("retryDelay", retryDelay);
		requireNonNegative("minRequestInterval", minRequestInterval);
		requireNonNegative("throttleDelay", throttleDelay);
		requireNonNegative("progressInterval", progressInterval);
		requirePositive("timeout", timeout);
		requirePositive("schedulerTick", schedulerTick);
		if (outputDir == null) {
			throw new IllegalArgumentException("outputDir must not be null");
		}
		if (proxy != null && proxy.isBlank()) {
			proxy = null;
		}
		if (proxy != null) {
			HttpClientTransport.proxyAddress(proxy);
		}
	}

	public static EngineConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.maxWorkers(maxWorkers)
				.chunkSize(chunkSize)
				.retryTimes(retryTimes)
				.retryDelay(retryDelay)
				.minRequestInterval(minRequestInterval)
				.timeout(timeout)
				.throttleDelay(throttleDelay)
				.maxThrottleRetries(maxThrottleRetries)
				.progressInterval(progressInterval)
				.schedulerTick(schedulerTick)
				.maxPages(maxPages)
				.outputDir(outputDir)
				.apiKey(apiKey)
				.proxy(proxy);
	}

	private static void requireAtLeast(String name, int value, int min) {
		if (value < min) {
			throw new IllegalArgumentException(name + " must be >= " + min + " but was " + value);
		}
	}

	private static void requireNonNegative(String name, Duration value) {
		if (value == null || value.isNegative()) {
			throw new IllegalArgumentException(name + " must be >= 0");
		}
	}

	private static void requirePositive(String name, Duration value) {
		if (value == null || value.isNegative() || value.isZero()) {
			throw new IllegalArgumentException(name + " must be > 0");
		}
	}

	public static class Builder {
		private int maxWorkers = 3;
		private int chunkSize = 8192;
		private int retryTimes = 3;
		private Duration retryDelay = Duration.ofSeconds(5);
		private Duration minRequestInterval = Duration.ofSeconds(1);
		private Duration timeout = Duration.ofSeconds(30);
		private Duration throttleDelay = Duration.ofSeconds(5);
		private int maxThrottleRetries = 3;
		private Duration progressInterval = Duration.ofMillis(500);
		private Duration schedulerTick = Duration.ofMillis(100);
		private int maxPages = 1000;
		private Path outputDir = Path.of("downloads");
		private String apiKey;
		private String proxy;

		public Builder maxWorkers(int maxWorkers) {
			this.maxWorkers = maxWorkers;
			return this;
		}

		public Builder chunkSize(int chunkSize) {
			this.chunkSize = chunkSize;
			return this;
		}

		public Builder retryTimes(int retryTimes) {
			this.retryTimes = retryTimes;
			return this;
		}

		public Builder retryDelay(Duration retryDelay) {
			this.retryDelay = retryDelay;
			return this;
		}

		public Builder minRequestInterval(Duration minRequestInterval) {
			this.minRequestInterval = minRequestInterval;
			return this;
		}

		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public Builder throttleDelay(Duration throttleDelay) {
			this.throttleDelay = throttleDelay;
			return this;
		}

		public Builder maxThrottleRetries(int maxThrottleRetries) {
			this.maxThrottleRetries = maxThrottleRetries;
			return this;
		}

		public Builder progressInterval(Duration progressInterval) {
			this.progressInterval = progressInterval;
			return this;
		}

		public Builder schedulerTick(Duration schedulerTick) {
			this.schedulerTick = schedulerTick;
			return this;
		}

		public Builder maxPages(int maxPages) {
			this.maxPages = maxPages;
			return this;
		}

		public Builder outputDir(Path outputDir) {
			this.outputDir = outputDir;
			return this;
		}

		public Builder apiKey(String apiKey) {
			this.apiKey = apiKey;
			return this;
		}

		/** Proxy URL for every request, or null to connect directly */
		public Builder proxy(String proxy) {
			this.proxy = proxy;
			return this;
		}

		public EngineConfig build() {
			return new EngineConfig(
					maxWorkers,
					chunkSize,
					retryTimes,
					retryDelay,
					minRequestInterval,
					timeout,
					throttleDelay,
					maxThrottleRetries,
					progressInterval,
					schedulerTick,
					maxPages,
					outputDir,
					apiKey,
					proxy);
		}
	}
}
