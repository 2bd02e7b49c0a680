package dev.civitai.dl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.civitai.dl.api.ApiException;
import dev.civitai.dl.api.CivitaiApi;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Model command to show the catalog entry of one model or model version */
@Command(
		name = "model",
		description = "Print the JSON description of a model or model version",
		mixinStandardHelpOptions = true)
public class ModelCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");
	private static final ObjectMapper writeMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	@Parameters(index = "0", paramLabel = "ID", description = "Model id, or model version id with --model-version")
	private long id;

	@Option(
			names = {"-r", "--model-version"},
			description = "Treat the id as a model version id")
	private boolean modelVersion;

	@Option(
			names = {"--api-key"},
			description = "Civitai API key (default: CIVITAI_API_KEY or api_key from the config file)")
	private String apiKey;

	@Override
	public Integer call() throws Exception {
		var api = new CivitaiApi(Main.createClient(Main.loadConfig(apiKey)));
		try {
			JsonNode json = modelVersion ? api.getModelVersion(id) : api.getModel(id);
			System.out.println(writeMapper.writeValueAsString(json));
			return 0;
		} catch (ApiException e) {
			logger.error(e.describe());
			return 1;
		}
	}
}
