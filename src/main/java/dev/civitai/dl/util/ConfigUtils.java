package dev.civitai.dl.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.civitai.dl.download.EngineConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads the optional JSON config file and turns it into an {@link EngineConfig} */
public class ConfigUtils {
	private static final Logger logger = LoggerFactory.getLogger(ConfigUtils.class);

	public static final String CONFIG_PATH_ENV = "CIVITAI_CONFIG_PATH";
	public static final String API_KEY_ENV = "CIVITAI_API_KEY";

	private static final ObjectMapper readMapper = new ObjectMapper();

	/** The config file named by {@value #CONFIG_PATH_ENV}, else {@code ~/.civitai-downloader/config.json} */
	public static Path configPath(Map<String, String> env) {
		String override = env.get(CONFIG_PATH_ENV);
		if (override != null && !override.isBlank()) {
			return Path.of(override);
		}
		return Path.of(System.getProperty("user.home"), ".civitai-downloader", "config.json");
	}

	/** Load the config for this process, with {@value #API_KEY_ENV} taking precedence for the key */
	public static AppConfig load() {
		return load(System.getenv());
	}

	static AppConfig load(Map<String, String> env) {
		AppConfig config = readConfig(configPath(env));
		String apiKey = env.get(API_KEY_ENV);
		if (apiKey != null && !apiKey.isBlank()) {
			config = config.withApiKey(apiKey);
		}
		return config;
	}

	/**
	 * Read a config file. A missing or unreadable file yields an empty config.
	 *
	 * @param file The JSON file
	 * @return The parsed config, never null
	 */
	public static AppConfig readConfig(Path file) {
		if (!Files.isRegularFile(file)) {
			logger.debug("No config file at {}, using defaults", file);
			return AppConfig.empty();
		}
		try {
			AppConfig config = readMapper.readValue(file.toFile(), AppConfig.class);
			logger.debug("Loaded config from {}", file);
			return config != null ? config : AppConfig.empty();
		} catch (IOException e) {
			logger.warn("Failed to read config file {}, using defaults: {}", file, e.getMessage());
			return AppConfig.empty();
		}
	}

	/** Overlay the values present in the config onto the engine defaults */
	public static EngineConfig toEngineConfig(AppConfig config) {
		EngineConfig.Builder builder = EngineConfig.builder();
		if (config.apiKey() != null && !config.apiKey().isBlank()) {
			builder.apiKey(config.apiKey());
		}
		if (config.timeout() != null) {
			builder.timeout(Duration.ofSeconds(config.timeout()));
		}
		if (config.maxRetries() != null) {
			builder.retryTimes(config.maxRetries());
		}
		if (config.retryDelay() != null) {
			builder.retryDelay(seconds(config.retryDelay()));
		}
		if (config.concurrentDownloads() != null) {
			builder.maxWorkers(config.concurrentDownloads());
		}
		if (config.chunkSize() != null) {
			builder.chunkSize(config.chunkSize());
		}
		if (config.outputDir() != null && !config.outputDir().isBlank()) {
			builder.outputDir(Path.of(config.outputDir()));
		}
		if (config.minRequestInterval() != null) {
			builder.minRequestInterval(seconds(config.minRequestInterval()));
		}
		if (config.proxy() != null && !config.proxy().isBlank()) {
			builder.proxy(config.proxy());
		}
		return builder.build();
	}

	private static Duration seconds(double value) {
		return Duration.ofMillis(Math.round(value * 1000));
	}
}
