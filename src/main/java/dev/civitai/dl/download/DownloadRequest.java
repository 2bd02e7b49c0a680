package dev.civitai.dl.download;

import java.nio.file.Path;
import java.util.Map;

/**
 * What a caller hands to {@link DownloadEngine#submit(DownloadRequest)}.
 *
 * @param url Source URL (http or https)
 * @param outputPath Directory the file is written to
 * @param filename Explicit filename, or null to derive it from the response or the URL
 * @param headers Extra request headers, may be null but must not contain null names or values
 * @param priority Lower values are dispatched first
 */
public record DownloadRequest(String url, Path outputPath, String filename, Map<String, String> headers, int priority) {

	public DownloadRequest {
		if (headers == null) {
			headers = Map.of();
		} else {
			for (Map.Entry<String, String> header : headers.entrySet()) {
				if (header.getKey() == null || header.getValue() == null) {
					throw new IllegalArgumentException("Header names and values must not be null: " + header);
				}
			}
			headers = Map.copyOf(headers);
		}
	}

	public static DownloadRequest of(String url, Path outputPath) {
		return new DownloadRequest(url, outputPath, null, null, 0);
	}

	public DownloadRequest withFilename(String filename) {
		return new DownloadRequest(url, outputPath, filename, headers, priority);
	}

	public DownloadRequest withPriority(int priority) {
		return new DownloadRequest(url, outputPath, filename, headers, priority);
	}
}
