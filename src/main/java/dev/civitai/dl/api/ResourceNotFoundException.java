package dev.civitai.dl.api;

/** The requested resource does not exist (HTTP 404) */
public class ResourceNotFoundException extends ApiException {
	public ResourceNotFoundException(String url) {
		super("Resource not found: " + url, 404, url);
	}
}
