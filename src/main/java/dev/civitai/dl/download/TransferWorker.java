package dev.civitai.dl.download;

import dev.civitai.dl.api.ApiException;
import dev.civitai.dl.api.ClientResponse;
import dev.civitai.dl.api.RateLimitException;
import dev.civitai.dl.api.RateLimitedClient;
import dev.civitai.dl.util.FileUtils;
import dev.civitai.dl.util.FilenameUtils;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the transfer of one task on a pool thread. Each attempt resumes from whatever is already on
 * disk, so retries and pause/resume cycles never lose or duplicate bytes.
 */
class TransferWorker implements Runnable {
	private static final Logger logger = LoggerFactory.getLogger(TransferWorker.class);
	private static final Pattern UNSATISFIED_RANGE = Pattern.compile("bytes\\s+\\*/(\\d+)");

	private static final OpenOption[] APPEND =
			{StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND};
	private static final OpenOption[] OVERWRITE =
			{StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING};

	private enum Outcome {
		FINISHED,
		STOPPED,
		RESTART
	}

	private final DownloadEngine engine;
	private final DownloadTask task;
	private final RateLimitedClient client;
	private final EngineConfig config;

	private boolean restartedAfterUnsatisfiedRange;
	private boolean targetResolved;
	private long remoteSize = -1;

	TransferWorker(DownloadEngine engine, DownloadTask task) {
		this.engine = engine;
		this.task = task;
		this.client = engine.client();
		this.config = engine.config();
	}

	@Override
	public void run() {
		try {
			transferWithRetries();
		} catch (RuntimeException e) {
			logger.error("Unexpected error downloading {}", task.url(), e);
			engine.fail(task, "Unexpected error: " + e);
		} finally {
			engine.release(task);
		}
	}

	private void transferWithRetries() {
		int retries = 0;
		boolean incompleteRetried = false;
		while (engine.isDownloading(task)) {
			try {
				Outcome outcome = transferOnce();
				switch (outcome) {
					case FINISHED -> {
						engine.complete(task);
						return;
					}
					case STOPPED -> {
						logger.debug("Transfer of {} stopped, task is {}", task.id(), task.status());
						return;
					}
					case RESTART -> logger.info("Restarting transfer of {} from zero", task.filename());
				}
			} catch (IncompleteTransferException e) {
				if (incompleteRetried) {
					fail(e);
					return;
				}
				incompleteRetried = true;
				engine.addRetries(task, 1);
				logger.warn("{} for {}, retrying once", e.getMessage(), task.filename());
			} catch (TransferException e) {
				if (!e.isRetryable() || retries >= config.retryTimes()) {
					fail(e);
					return;
				}
				retries++;
				engine.addRetries(task, 1);
				Duration delay = backoff(retries);
				logger.warn(
						"Download of {} failed: {}, retrying in {} ms ({}/{})",
						task.filename(),
						e.getMessage(),
						delay.toMillis(),
						retries,
						config.retryTimes());
				try {
					engine.sleepWhileDownloading(task, delay);
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					return;
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.debug("Transfer of {} interrupted", task.id());
				return;
			}
		}
	}

	private void fail(TransferException e) {
		logger.error("Download of {} failed: {}", task.url(), e.getMessage());
		engine.fail(task, e.getMessage());
	}

	/** {@code retryDelay * 2^(n-1)} for the n-th retry */
	Duration backoff(int retry) {
		int shift = Math.min(retry - 1, 20);
		return config.retryDelay().multipliedBy(1L << shift);
	}

	private Outcome transferOnce() throws TransferException, InterruptedException {
		try {
			FileUtils.ensureDirectory(task.outputPath());
		} catch (IOException e) {
			throw new FilesystemException("Cannot prepare " + task.outputPath() + ": " + e.getMessage(), e);
		}
		if (!targetResolved && task.explicitFilename() == null) {
			resolveTarget();
		}
		targetResolved = true;

		long offset;
		try {
			offset = FileUtils.existingSize(task.filePath());
			if (remoteSize > 0 && offset > remoteSize) {
				logger.warn("Local file {} is larger than the remote file, downloading again", task.filename());
				FileUtils.truncate(task.filePath());
				offset = 0;
			}
		} catch (IOException e) {
			throw new FilesystemException("Cannot prepare " + task.filePath() + ": " + e.getMessage(), e);
		}
		if (remoteSize > 0 && offset == remoteSize) {
			logger.info("{} already exists with the expected size, skipping", task.filename());
			engine.recordProgress(task, offset, offset, true, 0);
			return Outcome.FINISHED;
		}

		Map<String, String> headers = new LinkedHashMap<>(task.headers());
		if (offset > 0) {
			headers.put("Range", "bytes=" + offset + "-");
			logger.info("Resuming {} from byte {}", task.filename(), offset);
		}
		engine.recordProgress(task, offset, remoteSize > 0 ? remoteSize : task.totalSize(), false, 0);

		ClientResponse response;
		try {
			response = client.send("GET", task.url(), headers, null);
		} catch (RateLimitException e) {
			engine.addRetries(task, e.getAttempts() - 1);
			throw new NetworkException(e.getMessage(), e);
		} catch (ApiException e) {
			throw new NetworkException(e.getMessage(), e);
		}
		engine.addRetries(task, response.throttleRetries());

		try {
			int status = response.statusCode();
			if (status == 416 && offset > 0) {
				return rangeNotSatisfiable(response, offset);
			}
			if (status >= 500) {
				throw new NetworkException("Server error: HTTP " + status);
			}
			if (status >= 400) {
				try {
					response.raiseForStatus();
				} catch (ApiException e) {
					throw new TransferException(e.getMessage(), e);
				}
			}
			if (!response.isSuccessful()) {
				throw new TransferException("Unexpected HTTP status " + status);
			}

			boolean resuming = offset > 0 && status == 206;
			if (offset > 0 && !resuming) {
				logger.info("Server ignored range request for {}, downloading from the start", task.filename());
				offset = 0;
			}
			if (!resuming && task.explicitFilename() == null) {
				Optional<String> name =
						response.header("Content-Disposition").flatMap(FilenameUtils::fromContentDisposition);
				if (name.isPresent() && !name.get().equals(task.filename())) {
					logger.info("Using server filename {} instead of {}", name.get(), task.filename());
					engine.rename(task, name.get());
				}
			}

			long length = response.contentLength();
			long total = length >= 0 ? (resuming ? length + offset : length) : 0;
			engine.recordProgress(task, offset, total, false, 0);
			return stream(response.body(), task.filePath(), resuming, offset, total);
		} finally {
			closeQuietly(response);
		}
	}

	/**
	 * Ask the server for the file name and size before touching the local file, so a partial file
	 * saved under a server-assigned name is found and resumed. Failures are not fatal; the GET that
	 * follows reports them properly.
	 */
	private void resolveTarget() throws InterruptedException {
		ClientResponse response;
		try {
			response = client.send("HEAD", task.url(), task.headers(), null);
		} catch (RateLimitException e) {
			engine.addRetries(task, e.getAttempts() - 1);
			logger.debug("HEAD request for {} was throttled: {}", task.url(), e.getMessage());
			return;
		} catch (ApiException e) {
			logger.debug("HEAD request for {} failed: {}", task.url(), e.getMessage());
			return;
		}
		try {
			engine.addRetries(task, response.throttleRetries());
			if (!response.isSuccessful()) {
				logger.debug("HEAD request for {} answered HTTP {}", task.url(), response.statusCode());
				return;
			}
			Optional<String> name =
					response.header("Content-Disposition").flatMap(FilenameUtils::fromContentDisposition);
			if (name.isPresent() && !name.get().equals(task.filename())) {
				logger.info("Using server filename {} instead of {}", name.get(), task.filename());
				engine.rename(task, name.get());
			}
			remoteSize = response.contentLength();
		} finally {
			closeQuietly(response);
		}
	}

	private void closeQuietly(ClientResponse response) {
		try {
			response.close();
		} catch (IOException e) {
			logger.debug("Failed to close response for {}", task.url(), e);
		}
	}

	private Outcome rangeNotSatisfiable(ClientResponse response, long offset) throws TransferException {
		long remote = response.header("Content-Range")
				.map(UNSATISFIED_RANGE::matcher)
				.filter(Matcher::find)
				.map(m -> Long.parseLong(m.group(1)))
				.orElse(-1L);
		if (remote >= 0 && offset >= remote) {
			logger.info("{} is already complete ({} bytes)", task.filename(), offset);
			engine.recordProgress(task, offset, offset, true, 0);
			return Outcome.FINISHED;
		}
		if (restartedAfterUnsatisfiedRange) {
			throw new TransferException("Range not satisfiable for " + task.filename() + " at byte " + offset);
		}
		restartedAfterUnsatisfiedRange = true;
		logger.warn("Local file {} does not match the remote size, discarding {} bytes", task.filename(), offset);
		try {
			FileUtils.truncate(task.filePath());
		} catch (IOException e) {
			throw new FilesystemException("Cannot truncate " + task.filePath() + ": " + e.getMessage(), e);
		}
		engine.recordProgress(task, 0, 0, false, 0);
		return Outcome.RESTART;
	}

	private Outcome stream(InputStream in, Path file, boolean resuming, long offset, long total)
			throws TransferException {
		byte[] buffer = new byte[config.chunkSize()];
		long intervalNanos = config.progressInterval().toNanos();
		long downloaded = offset;
		long lastUpdate = System.nanoTime();
		long sinceUpdate = 0;

		try (OutputStream out = open(file, resuming)) {
			while (true) {
				int read;
				try {
					read = in.readNBytes(buffer, 0, buffer.length);
				} catch (IOException e) {
					throw new NetworkException(
							"Connection lost after " + downloaded + " bytes: " + e.getMessage(), e);
				}
				if (read == 0) {
					break;
				}
				if (!engine.isDownloading(task)) {
					return Outcome.STOPPED;
				}
				try {
					out.write(buffer, 0, read);
				} catch (IOException e) {
					throw new FilesystemException("Cannot write " + file + ": " + e.getMessage(), e);
				}
				downloaded += read;
				sinceUpdate += read;

				long now = System.nanoTime();
				long elapsed = now - lastUpdate;
				if (elapsed >= intervalNanos) {
					double speed = elapsed > 0 ? sinceUpdate * 1_000_000_000.0 / elapsed : 0;
					engine.recordProgress(task, downloaded, total, true, speed);
					lastUpdate = now;
					sinceUpdate = 0;
				} else {
					engine.recordProgress(task, downloaded, total, false, 0);
				}
			}
		} catch (IOException e) {
			throw new FilesystemException("Cannot close " + file + ": " + e.getMessage(), e);
		}

		if (total > 0 && downloaded < total) {
			throw new IncompleteTransferException(downloaded, total);
		}
		long elapsed = System.nanoTime() - lastUpdate;
		double speed = elapsed > 0 && sinceUpdate > 0 ? sinceUpdate * 1_000_000_000.0 / elapsed : task.speed();
		engine.recordProgress(task, downloaded, total, true, speed);
		return Outcome.FINISHED;
	}

	private static OutputStream open(Path file, boolean append) throws FilesystemException {
		try {
			return Files.newOutputStream(file, append ? APPEND : OVERWRITE);
		} catch (IOException e) {
			throw new FilesystemException("Cannot open " + file + ": " + e.getMessage(), e);
		}
	}
}
