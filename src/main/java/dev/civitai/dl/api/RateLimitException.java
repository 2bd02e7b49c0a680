package dev.civitai.dl.api;

/** The server kept answering HTTP 429 after all throttle retries were used up */
public class RateLimitException extends ApiException {
	private final int attempts;

	public RateLimitException(String url, int attempts) {
		super("API rate limit exceeded after " + attempts + " attempts", 429, url);
		this.attempts = attempts;
	}

	public int getAttempts() {
		return attempts;
	}
}
