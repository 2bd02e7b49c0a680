package dev.civitai.dl.download;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle states of a {@link DownloadTask} */
public enum DownloadStatus {
	PENDING,
	DOWNLOADING,
	PAUSED,
	COMPLETED,
	FAILED,
	CANCELLED;

	/** States this one may move to. Terminal states have none. */
	public Set<DownloadStatus> successors() {
		return switch (this) {
			case PENDING -> EnumSet.of(DOWNLOADING, PAUSED, CANCELLED);
			case DOWNLOADING -> EnumSet.of(COMPLETED, FAILED, PAUSED, CANCELLED);
			case PAUSED -> EnumSet.of(PENDING, CANCELLED);
			case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(DownloadStatus.class);
		};
	}

	public boolean canTransitionTo(DownloadStatus next) {
		return successors().contains(next);
	}

	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED || this == CANCELLED;
	}
}
