package dev.civitai.dl.reporting;

import static org.assertj.core.api.Assertions.*;

import dev.civitai.dl.download.DownloadStatus;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ProgressTrackerTest {

	private static ProgressEvent event(
			String id, ProgressEvent.EventType type, DownloadStatus status, long downloaded, long total, double speed) {
		return new ProgressEvent(id, type, status, downloaded, total, speed, -1, Instant.now(), null);
	}

	@Test
	void testOverallAggregatesTasks() {
		// Given
		ProgressTracker tracker = new ProgressTracker();
		tracker.update(event("a", ProgressEvent.EventType.PROGRESS, DownloadStatus.DOWNLOADING, 50, 100, 10));
		tracker.update(event("b", ProgressEvent.EventType.PROGRESS, DownloadStatus.DOWNLOADING, 25, 100, 5));
		tracker.update(event("c", ProgressEvent.EventType.COMPLETED, DownloadStatus.COMPLETED, 200, 200, 0));
		tracker.update(event("d", ProgressEvent.EventType.COMPLETED, DownloadStatus.FAILED, 0, 0, 0));

		// When
		ProgressTracker.Overall overall = tracker.overall();

		// Then
		assertThat(overall.activeTasks()).isEqualTo(2);
		assertThat(overall.downloadedBytes()).isEqualTo(275);
		assertThat(overall.totalBytes()).isEqualTo(400);
		assertThat(overall.speed()).isEqualTo(15.0);
		assertThat(overall.completed()).isEqualTo(1);
		assertThat(overall.failed()).isEqualTo(1);
		assertThat(overall.cancelled()).isZero();
		assertThat(overall.progress()).isEqualTo(275.0 / 400.0);
	}

	@Test
	void testLatestEventWins() {
		// Given
		ProgressTracker tracker = new ProgressTracker();
		tracker.update(event("a", ProgressEvent.EventType.PROGRESS, DownloadStatus.DOWNLOADING, 10, 100, 1));

		// When
		tracker.update(event("a", ProgressEvent.EventType.PROGRESS, DownloadStatus.DOWNLOADING, 60, 100, 1));

		// Then
		assertThat(tracker.get("a")).get().extracting(ProgressEvent::downloadedSize).isEqualTo(60L);
	}

	@Test
	void testTerminalStateIsKept() {
		// Given
		ProgressTracker tracker = new ProgressTracker();
		tracker.update(event("a", ProgressEvent.EventType.COMPLETED, DownloadStatus.CANCELLED, 30, 100, 0));

		// When
		tracker.update(event("a", ProgressEvent.EventType.PROGRESS, DownloadStatus.DOWNLOADING, 40, 100, 1));

		// Then
		assertThat(tracker.get("a")).get().extracting(ProgressEvent::status).isEqualTo(DownloadStatus.CANCELLED);
		tracker.forget("a");
		assertThat(tracker.get("a")).isEmpty();
	}
}
