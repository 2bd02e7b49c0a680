package dev.civitai.dl.reporting;

@FunctionalInterface
public interface ProgressListener {
	void onProgress(ProgressEvent event);
}
