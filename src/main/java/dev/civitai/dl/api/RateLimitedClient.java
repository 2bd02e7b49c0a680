package dev.civitai.dl.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends every outbound call through a shared {@link RateLimiter}, absorbs throttling answers with
 * a bounded number of retries and maps error statuses to the {@link ApiException} taxonomy.
 */
public class RateLimitedClient {
	private static final Logger logger = LoggerFactory.getLogger(RateLimitedClient.class);

	public static final int DEFAULT_MAX_THROTTLE_RETRIES = 3;
	public static final Duration DEFAULT_THROTTLE_DELAY = Duration.ofSeconds(5);

	private final Transport transport;
	private final RateLimiter rateLimiter;
	private final String apiKey;
	private final Duration timeout;
	private final Duration throttleDelay;
	private final int maxThrottleRetries;

	public RateLimitedClient(Transport transport, String apiKey, Duration minInterval, Duration timeout) {
		this(
				transport,
				apiKey,
				new RateLimiter(minInterval),
				timeout,
				DEFAULT_THROTTLE_DELAY,
				DEFAULT_MAX_THROTTLE_RETRIES);
	}

	/**
	 * Create a new RateLimitedClient.
	 *
	 * @param transport The transport that performs the actual HTTP calls
	 * @param apiKey Static credential sent as a bearer token (null or blank for anonymous access)
	 * @param rateLimiter Pacing state shared by every call made through this client
	 * @param timeout Per-call timeout
	 * @param throttleDelay Extra pause after each HTTP 429 answer
	 * @param maxThrottleRetries How many HTTP 429 answers are retried before giving up
	 */
	public RateLimitedClient(
			Transport transport,
			String apiKey,
			RateLimiter rateLimiter,
			Duration timeout,
			Duration throttleDelay,
			int maxThrottleRetries) {
		if (maxThrottleRetries < 0) {
			throw new IllegalArgumentException("maxThrottleRetries must be >= 0");
		}
		this.transport = Objects.requireNonNull(transport, "transport");
		this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
		this.apiKey = apiKey;
		this.timeout = timeout;
		this.throttleDelay = Objects.requireNonNull(throttleDelay, "throttleDelay");
		this.maxThrottleRetries = maxThrottleRetries;
	}

	public RateLimiter getRateLimiter() {
		return rateLimiter;
	}

	public boolean hasApiKey() {
		return apiKey != null && !apiKey.isBlank();
	}

	String getApiKey() {
		return apiKey;
	}

	/**
	 * Issue a paced request and return the response whatever its status, except that HTTP 429 is
	 * retried and turned into a {@link RateLimitException} once the retries are used up.
	 *
	 * @param method HTTP method
	 * @param url Absolute URL, may already contain a query string
	 * @param headers Extra request headers (may be null)
	 * @param params Query parameters appended to the URL (may be null; null values are skipped)
	 * @return The response; the caller must close it
	 * @throws ApiException on transport failure or exhausted throttle retries
	 * @throws InterruptedException if interrupted while pacing or backing off
	 */
	public ClientResponse send(String method, String url, Map<String, String> headers, Map<String, String> params)
			throws ApiException, InterruptedException {
		URI uri = buildUri(url, params);
		TransportRequest request = new TransportRequest(method, uri, withAuthorization(headers), timeout);

		int throttled = 0;
		while (true) {
			rateLimiter.acquire();
			TransportResponse response;
			try {
				response = transport.execute(request);
			} catch (IOException e) {
				logger.error("{} {} failed: {}", method, uri, e.toString());
				throw transportFailure(uri, e);
			}

			if (response.statusCode() != 429) {
				return new ClientResponse(response, throttled);
			}

			closeQuietly(response);
			Duration interval = rateLimiter.onThrottled();
			if (throttled >= maxThrottleRetries) {
				logger.error("Rate limit still hit for {} after {} retries, giving up", uri, throttled);
				throw new RateLimitException(uri.toString(), throttled + 1);
			}
			throttled++;
			logger.warn(
					"Rate limit hit for {}, min interval now {} ms, retrying in {} ms ({}/{})",
					uri,
					interval.toMillis(),
					throttleDelay.toMillis(),
					throttled,
					maxThrottleRetries);
			Thread.sleep(throttleDelay.toMillis());
		}
	}

	/** Same as {@link #send} but error statuses are mapped to exceptions */
	public ClientResponse request(String method, String url, Map<String, String> headers, Map<String, String> params)
			throws ApiException, InterruptedException {
		return send(method, url, headers, params).raiseForStatus();
	}

	/** GET a URL and parse the body as JSON */
	public JsonNode getJson(String url, Map<String, String> params) throws ApiException, InterruptedException {
		try (ClientResponse response = request("GET", url, null, params)) {
			return response.readJson();
		} catch (ApiException e) {
			throw e;
		} catch (IOException e) {
			throw new ApiException("Failed to read response from " + url, e);
		}
	}

	private Map<String, String> withAuthorization(Map<String, String> headers) {
		Map<String, String> result = new LinkedHashMap<>();
		if (headers != null) {
			result.putAll(headers);
		}
		boolean hasAuthorization = result.keySet().stream().anyMatch(k -> k.equalsIgnoreCase("Authorization"));
		if (hasApiKey() && !hasAuthorization) {
			result.put("Authorization", "Bearer " + apiKey);
		}
		return result;
	}

	static URI buildUri(String url, Map<String, String> params) throws ApiException {
		if (url == null || url.isBlank()) {
			throw new ApiException("Request URL is empty");
		}
		StringBuilder sb = new StringBuilder(url);
		if (params != null && !params.isEmpty()) {
			StringJoiner query = new StringJoiner("&");
			for (Map.Entry<String, String> param : params.entrySet()) {
				if (param.getValue() == null) {
					continue;
				}
				query.add(encode(param.getKey()) + "=" + encode(param.getValue()));
			}
			if (query.length() > 0) {
				sb.append(url.contains("?") ? '&' : '?').append(query);
			}
		}
		try {
			return URI.create(sb.toString());
		} catch (IllegalArgumentException e) {
			throw new ApiException("Invalid request URL: " + url, e);
		}
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private static ApiException transportFailure(URI uri, IOException e) {
		String message;
		if (e instanceof HttpTimeoutException) {
			message = "Request timeout: " + e.getMessage();
		} else if (e instanceof ConnectException) {
			message = "Unable to connect to API server: " + e.getMessage();
		} else {
			message = "Request failed: " + e;
		}
		return new ApiException(message, ApiException.NO_STATUS, uri.toString(), e);
	}

	private static void closeQuietly(TransportResponse response) {
		try {
			response.close();
		} catch (IOException e) {
			logger.debug("Failed to close throttled response", e);
		}
	}
}
