package dev.civitai.dl.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A response obtained through {@link RateLimitedClient}. Wraps the transport response and records
 * how many throttling retries it took to get it.
 */
public class ClientResponse implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(ClientResponse.class);
	private static final ObjectMapper readMapper = new ObjectMapper();

	private final TransportResponse response;
	private final int throttleRetries;

	public ClientResponse(TransportResponse response, int throttleRetries) {
		this.response = response;
		this.throttleRetries = throttleRetries;
	}

	public int statusCode() {
		return response.statusCode();
	}

	public Optional<String> header(String name) {
		return response.header(name);
	}

	public long contentLength() {
		return response.contentLength();
	}

	public InputStream body() {
		return response.body();
	}

	public String url() {
		return response.uri() != null ? response.uri().toString() : null;
	}

	/** Number of HTTP 429 answers that were absorbed before this response arrived */
	public int throttleRetries() {
		return throttleRetries;
	}

	public boolean isSuccessful() {
		return statusCode() >= 200 && statusCode() < 300;
	}

	/**
	 * Map an error status to the API exception taxonomy. Successful responses are returned as is;
	 * on error the response is closed before the exception is thrown.
	 */
	public ClientResponse raiseForStatus() throws ApiException {
		int status = statusCode();
		if (status < 400) {
			return this;
		}
		String url = url();
		ApiException error =
				switch (status) {
					case 404 -> new ResourceNotFoundException(url);
					case 401 -> new AuthenticationException(url);
					case 429 -> new RateLimitException(url, throttleRetries + 1);
					default -> new ApiException(errorMessage(status), status, url);
				};
		closeQuietly();
		throw error;
	}

	/** Read the whole body as JSON */
	public JsonNode readJson() throws ApiException {
		JsonNode json;
		try (InputStream in = body()) {
			json = readMapper.readTree(in);
		} catch (IOException e) {
			throw new ApiException("Invalid JSON response", statusCode(), url(), e);
		}
		if (json == null || json.isMissingNode()) {
			throw new ApiException("Invalid JSON response", statusCode(), url());
		}
		return json;
	}

	private String errorMessage(int status) {
		String message = "HTTP error " + status;
		try {
			String text = new String(body().readAllBytes(), StandardCharsets.UTF_8);
			if (text.isBlank()) {
				return message;
			}
			try {
				JsonNode json = readMapper.readTree(text);
				if (json.hasNonNull("message")) {
					return message + ": " + json.get("message").asText();
				}
				return message;
			} catch (IOException e) {
				return message + ": " + text.strip();
			}
		} catch (IOException e) {
			return message;
		}
	}

	private void closeQuietly() {
		try {
			close();
		} catch (IOException e) {
			logger.debug("Failed to close response body for {}", url(), e);
		}
	}

	@Override
	public void close() throws IOException {
		response.close();
	}
}
