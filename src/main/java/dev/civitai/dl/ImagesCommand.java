package dev.civitai.dl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.civitai.dl.api.ApiException;
import dev.civitai.dl.api.CivitaiApi;
import dev.civitai.dl.api.PaginatedFetcher;
import dev.civitai.dl.download.EngineConfig;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Images command that lists every image matching a filter, one JSON object per line */
@Command(
		name = "images",
		description = "List all images of a model, model version or user as JSON lines",
		mixinStandardHelpOptions = true)
public class ImagesCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");
	private static final ObjectMapper writeMapper = new ObjectMapper();

	@Option(
			names = {"-m", "--model-id"},
			description = "Only images of this model")
	private Long modelId;

	@Option(
			names = {"-v", "--model-version-id"},
			description = "Only images of this model version")
	private Long modelVersionId;

	@Option(
			names = {"-u", "--username"},
			description = "Only images posted by this user")
	private String username;

	@Option(
			names = {"-l", "--limit"},
			description = "Page size requested from the API (default: server default)")
	private Integer limit;

	@Option(
			names = {"--nsfw"},
			description = "NSFW filter passed to the API (None, Soft, Mature, X)")
	private String nsfw;

	@Option(
			names = {"--api-key"},
			description = "Civitai API key (default: CIVITAI_API_KEY or api_key from the config file)")
	private String apiKey;

	@Override
	public Integer call() throws Exception {
		if (modelId == null && modelVersionId == null && username == null) {
			logger.error("Give at least one of --model-id, --model-version-id or --username");
			return 1;
		}
		EngineConfig config = Main.loadConfig(apiKey);
		var client = Main.createClient(config);
		var api = new CivitaiApi(
				client,
				new PaginatedFetcher(client, config.maxPages()),
				CivitaiApi.DEFAULT_BASE_URL,
				CivitaiApi.DEFAULT_DOWNLOAD_BASE_URL);
		try {
			List<JsonNode> images = api.getAllImages(params());
			for (JsonNode image : images) {
				System.out.println(writeMapper.writeValueAsString(image));
			}
			logger.info("Fetched {} images", images.size());
			return 0;
		} catch (ApiException e) {
			logger.error(e.describe());
			return 1;
		}
	}

	Map<String, String> params() {
		Map<String, String> params = new LinkedHashMap<>();
		if (modelId != null) {
			params.put("modelId", String.valueOf(modelId));
		}
		if (modelVersionId != null) {
			params.put("modelVersionId", String.valueOf(modelVersionId));
		}
		if (username != null) {
			params.put("username", username);
		}
		if (limit != null) {
			params.put("limit", String.valueOf(limit));
		}
		if (nsfw != null) {
			params.put("nsfw", nsfw);
		}
		return params;
	}
}
