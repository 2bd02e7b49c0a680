package dev.civitai.dl.api;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Response of a {@link Transport} call. The body is a live stream and must be closed. */
public class TransportResponse implements Closeable {
	private final URI uri;
	private final int statusCode;
	private final Map<String, List<String>> headers;
	private final InputStream body;

	public TransportResponse(URI uri, int statusCode, Map<String, List<String>> headers, InputStream body) {
		this.uri = uri;
		this.statusCode = statusCode;
		this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		if (headers != null) {
			this.headers.putAll(headers);
		}
		this.body = body != null ? body : InputStream.nullInputStream();
	}

	public URI uri() {
		return uri;
	}

	public int statusCode() {
		return statusCode;
	}

	public Map<String, List<String>> headers() {
		return headers;
	}

	/** First value of a header, matched case-insensitively */
	public Optional<String> header(String name) {
		List<String> values = headers.get(name);
		if (values == null || values.isEmpty()) {
			return Optional.empty();
		}
		return Optional.ofNullable(values.get(0));
	}

	/** Value of the Content-Length header, or -1 when absent or malformed */
	public long contentLength() {
		return header("Content-Length")
				.map(value -> {
					try {
						return Long.parseLong(value.trim());
					} catch (NumberFormatException e) {
						return -1L;
					}
				})
				.orElse(-1L);
	}

	public InputStream body() {
		return body;
	}

	@Override
	public void close() throws IOException {
		body.close();
	}
}
