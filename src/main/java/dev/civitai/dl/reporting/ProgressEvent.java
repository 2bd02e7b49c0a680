package dev.civitai.dl.reporting;

import dev.civitai.dl.download.DownloadStatus;
import dev.civitai.dl.download.DownloadTask;
import java.time.Instant;

/** Snapshot of a task published to observers */
public record ProgressEvent(
		String taskId,
		EventType eventType,
		DownloadStatus status,
		long downloadedSize,
		long totalSize,
		double speed,
		long eta,
		Instant timestamp,
		DownloadTask task) {
	public enum EventType {
		PROGRESS,
		COMPLETED
	}

	public static ProgressEvent progress(DownloadTask task) {
		return of(task, EventType.PROGRESS);
	}

	/** Emitted once per task when it reaches COMPLETED, FAILED or CANCELLED */
	public static ProgressEvent completed(DownloadTask task) {
		return of(task, EventType.COMPLETED);
	}

	private static ProgressEvent of(DownloadTask task, EventType type) {
		return new ProgressEvent(
				task.id(),
				type,
				task.status(),
				task.downloadedSize(),
				task.totalSize(),
				task.speed(),
				task.eta(),
				Instant.now(),
				task);
	}

	public double progress() {
		return totalSize > 0 ? Math.min(1.0, (double) downloadedSize / totalSize) : 0.0;
	}

	@Override
	public String toString() {
		return "[%s] %s: %s %s %d/%d".formatted(timestamp, taskId, eventType, status, downloadedSize, totalSize);
	}
}
