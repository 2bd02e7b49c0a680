package dev.civitai.dl.api;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Failure talking to the catalog API. Carries the HTTP status code when the server answered, and
 * a list of suggestions for the user derived from the kind of failure.
 */
public class ApiException extends IOException {
	/** Status code used when no HTTP response was received */
	public static final int NO_STATUS = -1;

	private final int statusCode;
	private final String url;
	private final List<String> solutions;

	public ApiException(String message) {
		this(message, NO_STATUS, null, null);
	}

	public ApiException(String message, Throwable cause) {
		this(message, NO_STATUS, null, cause);
	}

	public ApiException(String message, int statusCode, String url) {
		this(message, statusCode, url, null);
	}

	public ApiException(String message, int statusCode, String url, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.url = url;
		this.solutions = solutionsFor(message, statusCode);
	}

	public int getStatusCode() {
		return statusCode;
	}

	public boolean hasStatusCode() {
		return statusCode != NO_STATUS;
	}

	public String getUrl() {
		return url;
	}

	public List<String> getSolutions() {
		return solutions;
	}

	/** The message followed by numbered suggestions, for display on a console */
	public String describe() {
		StringBuilder sb = new StringBuilder(getMessage());
		if (!solutions.isEmpty()) {
			sb.append("\nPossible solutions:");
			for (int i = 0; i < solutions.size(); i++) {
				sb.append("\n").append(i + 1).append(". ").append(solutions.get(i));
			}
		}
		return sb.toString();
	}

	private static List<String> solutionsFor(String message, int statusCode) {
		List<String> result = new ArrayList<>();
		String lower = message != null ? message.toLowerCase() : "";
		if (lower.contains("proxy")) {
			result.add("Check if the proxy server is running");
			result.add("Verify the proxy address and port");
		} else if (lower.contains("timeout") || lower.contains("timed out")) {
			result.add("Check your internet connection");
			result.add("Try again later, the server might be busy");
			result.add("Increase the timeout value");
		} else if (statusCode == 401) {
			result.add("Check your API key");
			result.add("Ensure your API key has the necessary permissions");
		} else if (statusCode == 403) {
			result.add("You don't have permission to access this resource");
			result.add("Ensure your API key is correct");
		} else if (statusCode == 404) {
			result.add("The requested resource does not exist");
			result.add("Check the ID or endpoint URL");
		} else if (statusCode == 429) {
			result.add("Wait a while before retrying");
			result.add("Reduce the number of concurrent downloads");
		} else if (statusCode >= 500) {
			result.add("The server encountered an error");
			result.add("Try again later");
		}
		if (result.isEmpty()) {
			result.add("Check your internet connection");
			result.add("Verify the API endpoint is correct");
		}
		return List.copyOf(result);
	}
}
