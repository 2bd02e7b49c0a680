package dev.civitai.dl.api;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/** Immutable description of one outbound HTTP call */
public record TransportRequest(String method, URI uri, Map<String, String> headers, Duration timeout) {

	public TransportRequest {
		Objects.requireNonNull(method, "method");
		Objects.requireNonNull(uri, "uri");
		headers = headers == null ? Map.of() : Map.copyOf(headers);
	}

	public static TransportRequest get(URI uri, Map<String, String> headers, Duration timeout) {
		return new TransportRequest("GET", uri, headers, timeout);
	}

	/** Case-insensitive header lookup */
	public String header(String name) {
		for (Map.Entry<String, String> e : headers.entrySet()) {
			if (e.getKey().equalsIgnoreCase(name)) {
				return e.getValue();
			}
		}
		return null;
	}
}
