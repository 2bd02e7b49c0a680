package dev.civitai.dl.util;

import static org.assertj.core.api.Assertions.*;

import dev.civitai.dl.download.EngineConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigUtilsTest {

	@TempDir
	Path tempDir;

	@Test
	void testReadConfigFile() throws Exception {
		// Given
		Path file = tempDir.resolve("config.json");
		Files.writeString(
				file,
				"""
				{
				  "api_key": "abc",
				  "timeout": 60,
				  "max_retries": 5,
				  "retry_delay": 2.5,
				  "concurrent_downloads": 4,
				  "chunk_size": 4096,
				  "output_dir": "/data/models",
				  "min_request_interval": 0.5,
				  "proxy": "http://127.0.0.1:7890",
				  "theme": "dark"
				}
				""");

		// When
		AppConfig config = ConfigUtils.readConfig(file);
		EngineConfig engineConfig = ConfigUtils.toEngineConfig(config);

		// Then
		assertThat(engineConfig.apiKey()).isEqualTo("abc");
		assertThat(engineConfig.timeout()).isEqualTo(Duration.ofSeconds(60));
		assertThat(engineConfig.retryTimes()).isEqualTo(5);
		assertThat(engineConfig.retryDelay()).isEqualTo(Duration.ofMillis(2500));
		assertThat(engineConfig.maxWorkers()).isEqualTo(4);
		assertThat(engineConfig.chunkSize()).isEqualTo(4096);
		assertThat(engineConfig.outputDir()).isEqualTo(Path.of("/data/models"));
		assertThat(engineConfig.minRequestInterval()).isEqualTo(Duration.ofMillis(500));
		assertThat(engineConfig.proxy()).isEqualTo("http://127.0.0.1:7890");
	}

	@Test
	void testMissingFileGivesDefaults() {
		// When
		AppConfig config = ConfigUtils.readConfig(tempDir.resolve("missing.json"));

		// Then
		assertThat(config).isEqualTo(AppConfig.empty());
		assertThat(ConfigUtils.toEngineConfig(config)).isEqualTo(EngineConfig.defaults());
	}

	@Test
	void testInvalidFileGivesDefaults() throws Exception {
		// Given
		Path file = Files.writeString(tempDir.resolve("config.json"), "{ not json");

		// When
		AppConfig config = ConfigUtils.readConfig(file);

		// Then
		assertThat(config).isEqualTo(AppConfig.empty());
	}

	@Test
	void testEnvironmentOverrides() throws Exception {
		// Given
		Path file = Files.writeString(tempDir.resolve("custom.json"), "{\"api_key\": \"from-file\", \"timeout\": 10}");
		Map<String, String> env = Map.of(
				ConfigUtils.CONFIG_PATH_ENV, file.toString(),
				ConfigUtils.API_KEY_ENV, "from-env");

		// When
		AppConfig config = ConfigUtils.load(env);

		// Then
		assertThat(ConfigUtils.configPath(env)).isEqualTo(file);
		assertThat(config.apiKey()).isEqualTo("from-env");
		assertThat(config.timeout()).isEqualTo(10);
	}

	@Test
	void testDefaultConfigPath() {
		assertThat(ConfigUtils.configPath(Map.of()))
				.isEqualTo(Path.of(System.getProperty("user.home"), ".civitai-downloader", "config.json"));
	}
}
