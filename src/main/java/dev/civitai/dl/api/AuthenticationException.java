package dev.civitai.dl.api;

/** The server rejected the credentials (HTTP 401) */
public class AuthenticationException extends ApiException {
	public AuthenticationException(String url) {
		super("API authentication failed", 401, url);
	}
}
