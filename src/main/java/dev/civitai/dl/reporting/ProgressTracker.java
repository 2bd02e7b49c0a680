package dev.civitai.dl.reporting;

import dev.civitai.dl.download.DownloadStatus;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Keeps the latest event of every task and aggregates them into an overall view */
public class ProgressTracker {
	private final Map<String, ProgressEvent> latest = new ConcurrentHashMap<>();

	/**
	 * Overall progress across all tracked tasks.
	 *
	 * @param activeTasks Tasks currently downloading
	 * @param downloadedBytes Bytes on disk across all tasks
	 * @param totalBytes Sum of the known total sizes
	 * @param speed Aggregate bytes per second of the active tasks
	 * @param completed Tasks that completed
	 * @param failed Tasks that failed
	 * @param cancelled Tasks that were cancelled
	 */
	public record Overall(
			int activeTasks,
			long downloadedBytes,
			long totalBytes,
			double speed,
			int completed,
			int failed,
			int cancelled) {
		public double progress() {
			return totalBytes > 0 ? Math.min(1.0, (double) downloadedBytes / totalBytes) : 0.0;
		}
	}

	/** Record an event, ignoring events older than the one already held for the task */
	public void update(ProgressEvent event) {
		latest.merge(event.taskId(), event, (current, incoming) -> {
			boolean settled = current.status() != null && current.status().isTerminal();
			if (settled && incoming.eventType() != ProgressEvent.EventType.COMPLETED) {
				return current;
			}
			return incoming.timestamp().isBefore(current.timestamp()) ? current : incoming;
		});
	}

	public Optional<ProgressEvent> get(String taskId) {
		return Optional.ofNullable(latest.get(taskId));
	}

	public void forget(String taskId) {
		latest.remove(taskId);
	}

	public Overall overall() {
		int active = 0;
		int completed = 0;
		int failed = 0;
		int cancelled = 0;
		long downloaded = 0;
		long total = 0;
		double speed = 0;
		for (ProgressEvent event : latest.values()) {
			downloaded += event.downloadedSize();
			total += event.totalSize();
			DownloadStatus status = event.status();
			if (status == null) {
				continue;
			}
			switch (status) {
				case DOWNLOADING -> {
					active++;
					speed += event.speed();
				}
				case COMPLETED -> completed++;
				case FAILED -> failed++;
				case CANCELLED -> cancelled++;
				default -> {}
			}
		}
		return new Overall(active, downloaded, total, speed, completed, failed, cancelled);
	}
}
