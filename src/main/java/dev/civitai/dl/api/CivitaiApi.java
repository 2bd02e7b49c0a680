package dev.civitai.dl.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** Endpoints of the Civitai REST API used by the downloader */
public class CivitaiApi {
	public static final String DEFAULT_BASE_URL = "https://civitai.com/api/v1";
	public static final String DEFAULT_DOWNLOAD_BASE_URL = "https://civitai.com/api/download/models";

	private final RateLimitedClient client;
	private final PaginatedFetcher fetcher;
	private final String baseUrl;
	private final String downloadBaseUrl;

	public CivitaiApi(RateLimitedClient client) {
		this(client, new PaginatedFetcher(client), DEFAULT_BASE_URL, DEFAULT_DOWNLOAD_BASE_URL);
	}

	public CivitaiApi(RateLimitedClient client, PaginatedFetcher fetcher, String baseUrl, String downloadBaseUrl) {
		this.client = client;
		this.fetcher = fetcher;
		this.baseUrl = stripTrailingSlash(baseUrl);
		this.downloadBaseUrl = stripTrailingSlash(downloadBaseUrl);
	}

	/** GET an endpoint relative to the API base URL */
	public JsonNode get(String endpoint, Map<String, String> params) throws ApiException, InterruptedException {
		return client.getJson(url(endpoint), params);
	}

	/** One page of the model listing */
	public JsonNode getModels(Map<String, String> params) throws ApiException, InterruptedException {
		return get("models", params);
	}

	/** Every model matching the parameters, following cursors */
	public Iterator<JsonNode> getAllModels(Map<String, String> params) {
		return fetcher.fetchAll(url("models"), params);
	}

	public JsonNode getModel(long modelId) throws ApiException, InterruptedException {
		return get("models/" + modelId, null);
	}

	public JsonNode getModelVersion(long versionId) throws ApiException, InterruptedException {
		return get("model-versions/" + versionId, null);
	}

	/** One page of the image listing */
	public JsonNode getImages(Map<String, String> params) throws ApiException, InterruptedException {
		return get("images", params);
	}

	/** Every image matching the parameters, following cursors */
	public List<JsonNode> getAllImages(Map<String, String> params) throws ApiException, InterruptedException {
		return fetcher.fetchAllItems(url("images"), params);
	}

	/** Download URL of a model version's primary file. The API key is passed as a query token. */
	public String getDownloadUrl(long versionId) {
		String url = downloadBaseUrl + "/" + versionId;
		if (client.hasApiKey()) {
			url += "?token=" + URLEncoder.encode(client.getApiKey(), StandardCharsets.UTF_8);
		}
		return url;
	}

	private String url(String endpoint) {
		String path = endpoint.startsWith("/") ? endpoint.substring(1) : endpoint;
		return baseUrl + "/" + path;
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}
}
