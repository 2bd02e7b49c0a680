package dev.civitai.dl.reporting;

import dev.civitai.dl.download.DownloadTask;

/** Notified once when a task ends up COMPLETED, FAILED or CANCELLED */
@FunctionalInterface
public interface CompletionListener {
	void onCompletion(DownloadTask task);
}
