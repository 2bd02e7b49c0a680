package dev.civitai.dl.download;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One transfer known to a {@link DownloadEngine}. Callers only get read access; every mutation
 * goes through the engine, under the engine lock, either from the owning worker or from an
 * explicit pause/resume/cancel call.
 */
public class DownloadTask {
	/** Value of {@link #eta()} when no estimate is available */
	public static final long UNKNOWN_ETA = -1;

	private final String id;
	private final String url;
	private final Path outputPath;
	private final String explicitFilename;
	private final Map<String, String> headers;
	private final int priority;
	private final Instant createdAt;

	private volatile String filename;
	private volatile DownloadStatus status = DownloadStatus.PENDING;
	private volatile long downloadedSize;
	private volatile long totalSize;
	private volatile double speed;
	private volatile long eta = UNKNOWN_ETA;
	private volatile int retryCount;
	private volatile String error;
	private volatile Instant completedAt;

	// owned by the engine: true while a worker holds the task
	private boolean active;

	DownloadTask(
			String id,
			String url,
			Path outputPath,
			String explicitFilename,
			String initialFilename,
			Map<String, String> headers,
			int priority) {
		this.id = Objects.requireNonNull(id, "id");
		this.url = Objects.requireNonNull(url, "url");
		this.outputPath = Objects.requireNonNull(outputPath, "outputPath");
		this.explicitFilename = explicitFilename;
		this.filename = Objects.requireNonNull(initialFilename, "initialFilename");
		this.headers = headers == null ? Map.of() : Map.copyOf(headers);
		this.priority = priority;
		this.createdAt = Instant.now();
	}

	public String id() {
		return id;
	}

	public String url() {
		return url;
	}

	public Path outputPath() {
		return outputPath;
	}

	/** The filename the caller asked for, or null if it is derived from the server or the URL */
	public String explicitFilename() {
		return explicitFilename;
	}

	public String filename() {
		return filename;
	}

	/** Where the file is (or will be) written */
	public Path filePath() {
		return outputPath.resolve(filename);
	}

	public Map<String, String> headers() {
		return headers;
	}

	/** Lower values are more urgent */
	public int priority() {
		return priority;
	}

	public DownloadStatus status() {
		return status;
	}

	public long downloadedSize() {
		return downloadedSize;
	}

	/** Total size in bytes, or 0 when unknown */
	public long totalSize() {
		return totalSize;
	}

	/** Bytes per second measured over the last progress interval */
	public double speed() {
		return speed;
	}

	/** Estimated seconds remaining, or {@link #UNKNOWN_ETA} */
	public long eta() {
		return eta;
	}

	public int retryCount() {
		return retryCount;
	}

	/** Human-readable failure reason, present only when the task failed */
	public String error() {
		return error;
	}

	public Instant createdAt() {
		return createdAt;
	}

	public Instant completedAt() {
		return completedAt;
	}

	/** Downloaded fraction between 0.0 and 1.0, or 0.0 when the total size is unknown */
	public double progress() {
		long total = totalSize;
		if (total <= 0) {
			return 0.0;
		}
		return Math.min(1.0, (double) downloadedSize / (double) total);
	}

	public boolean isTerminal() {
		return status.isTerminal();
	}

	void transitionTo(DownloadStatus next) {
		if (!status.canTransitionTo(next)) {
			throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + next);
		}
		status = next;
		if (next.isTerminal()) {
			completedAt = Instant.now();
		}
		if (next != DownloadStatus.DOWNLOADING) {
			speed = 0.0;
			eta = UNKNOWN_ETA;
		}
	}

	void fail(String message) {
		error = message != null && !message.isBlank() ? message : "Unknown error";
		transitionTo(DownloadStatus.FAILED);
	}

	void filename(String filename) {
		this.filename = filename;
	}

	void sizes(long downloadedSize, long totalSize) {
		this.downloadedSize = downloadedSize;
		this.totalSize = totalSize > 0 && downloadedSize > totalSize ? downloadedSize : Math.max(totalSize, 0);
	}

	void throughput(double speed) {
		this.speed = speed;
		long total = totalSize;
		if (speed > 0 && total > 0 && total > downloadedSize) {
			this.eta = (long) ((total - downloadedSize) / speed);
		} else {
			this.eta = UNKNOWN_ETA;
		}
	}

	void incrementRetryCount(int by) {
		retryCount += by;
	}

	boolean isActive() {
		return active;
	}

	void active(boolean active) {
		this.active = active;
	}

	@Override
	public String toString() {
		return "%s [%s] %s -> %s (%d/%d bytes)".formatted(id, status, url, filePath(), downloadedSize, totalSize);
	}
}
