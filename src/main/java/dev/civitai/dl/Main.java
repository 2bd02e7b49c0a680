package dev.civitai.dl;

import dev.civitai.dl.api.HttpClientTransport;
import dev.civitai.dl.api.RateLimitedClient;
import dev.civitai.dl.api.RateLimiter;
import dev.civitai.dl.download.EngineConfig;
import dev.civitai.dl.util.ConfigUtils;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "civitai-dl",
		version = "1.0.0",
		description = "Downloads models and images from Civitai",
		mixinStandardHelpOptions = true,
		subcommands = {DownloadCommand.class, ImagesCommand.class, ModelCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	private CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	/** Engine settings from the config file, with the key given on the command line winning */
	static EngineConfig loadConfig(String apiKey) {
		EngineConfig config = ConfigUtils.toEngineConfig(ConfigUtils.load());
		if (apiKey != null && !apiKey.isBlank()) {
			config = config.toBuilder().apiKey(apiKey).build();
		}
		return config;
	}

	static RateLimitedClient createClient(EngineConfig config) {
		return new RateLimitedClient(
				new HttpClientTransport(config.timeout(), config.proxy()),
				config.apiKey(),
				new RateLimiter(config.minRequestInterval()),
				config.timeout(),
				config.throttleDelay(),
				config.maxThrottleRetries());
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
