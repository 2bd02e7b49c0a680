package dev.civitai.dl.download;

import dev.civitai.dl.api.HttpClientTransport;
import dev.civitai.dl.api.RateLimitedClient;
import dev.civitai.dl.api.RateLimiter;
import dev.civitai.dl.api.Transport;
import dev.civitai.dl.reporting.CallbackBus;
import dev.civitai.dl.reporting.CompletionListener;
import dev.civitai.dl.reporting.ProgressEvent;
import dev.civitai.dl.reporting.ProgressListener;
import dev.civitai.dl.reporting.ProgressTracker;
import dev.civitai.dl.util.FilenameUtils;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queues download tasks, dispatches them by priority to a bounded pool of transfer workers and
 * lets callers pause, resume and cancel them. A dedicated scheduler thread owns dispatching; the
 * task registry and the queue are guarded by one lock that is never held across network or file
 * I/O. Observers are notified through a {@link CallbackBus}, never on a worker thread.
 */
public class DownloadEngine implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(DownloadEngine.class);
	private static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(1);

	private final EngineConfig config;
	private final RateLimitedClient client;
	private final Object lock = new Object();
	private final Map<String, DownloadTask> tasks = new LinkedHashMap<>();
	private final TaskQueue queue = new TaskQueue();
	private final ExecutorService workers;
	private final CallbackBus callbackBus;
	private final ProgressTracker progressTracker = new ProgressTracker();
	private final AtomicInteger completedDownloads = new AtomicInteger(0);
	private final AtomicInteger failedDownloads = new AtomicInteger(0);

	// guarded by lock
	private int activeWorkers;
	private boolean started;
	private boolean shutdownRequested;
	private Thread scheduler;

	public DownloadEngine(EngineConfig config) {
		this(config, new HttpClientTransport(config.timeout(), config.proxy()));
	}

	public DownloadEngine(EngineConfig config, Transport transport) {
		this(
				config,
				new RateLimitedClient(
						transport,
						config.apiKey(),
						new RateLimiter(config.minRequestInterval()),
						config.timeout(),
						config.throttleDelay(),
						config.maxThrottleRetries()));
	}

	/**
	 * Create a new DownloadEngine.
	 *
	 * @param config Engine settings, read once here
	 * @param client Client every transfer goes through; share it with catalog calls so they are
	 *     paced together
	 */
	public DownloadEngine(EngineConfig config, RateLimitedClient client) {
		this.config = Objects.requireNonNull(config, "config");
		this.client = Objects.requireNonNull(client, "client");
		this.workers = Executors.newFixedThreadPool(config.maxWorkers(), namedThreads("download-worker"));
		this.callbackBus = new CallbackBus("download-callbacks");
	}

	/** Start the scheduler and callback threads. Called implicitly by the first submit. */
	public void start() {
		synchronized (lock) {
			if (started || shutdownRequested) {
				return;
			}
			started = true;
			callbackBus.start();
			scheduler = new Thread(this::schedule, "download-scheduler");
			scheduler.setDaemon(true);
			scheduler.start();
		}
		logger.info("Started DownloadEngine with {} workers", config.maxWorkers());
	}

	public String submit(String url, Path outputPath) {
		return submit(new DownloadRequest(url, outputPath, null, null, 0));
	}

	public String submit(String url, Path outputPath, String filename, Map<String, String> headers, int priority) {
		return submit(new DownloadRequest(url, outputPath, filename, headers, priority));
	}

	/**
	 * Queue a download.
	 *
	 * @param request What to download and where
	 * @return The id of the new task
	 * @throws IllegalArgumentException if the URL is empty or not an http(s) URL, or the filename is
	 *     unusable
	 * @throws IllegalStateException if the engine has been shut down
	 */
	public String submit(DownloadRequest request) {
		Objects.requireNonNull(request, "request");
		String url = validateUrl(request.url());
		String explicitFilename = null;
		if (request.filename() != null) {
			explicitFilename = FilenameUtils.sanitize(request.filename())
					.orElseThrow(() -> new IllegalArgumentException("Invalid filename: " + request.filename()));
		}
		Path outputPath = request.outputPath() != null ? request.outputPath() : config.outputDir();
		String initialFilename = explicitFilename != null ? explicitFilename : FilenameUtils.fromUrl(url);

		DownloadTask task = new DownloadTask(
				UUID.randomUUID().toString(),
				url,
				outputPath,
				explicitFilename,
				initialFilename,
				request.headers(),
				request.priority());
		start();
		synchronized (lock) {
			if (shutdownRequested) {
				throw new IllegalStateException("Cannot submit downloads after shutdown");
			}
			tasks.put(task.id(), task);
			queue.add(task);
			progressTracker.update(ProgressEvent.progress(task));
		}
		logger.info("Queued {} as {} (priority {})", url, task.filePath(), task.priority());
		return task.id();
	}

	/** Queue several URLs into the same directory with default priority */
	public List<String> submitBatch(List<String> urls, Path outputPath) {
		List<String> ids = new ArrayList<>();
		for (String url : urls) {
			ids.add(submit(url, outputPath));
		}
		return ids;
	}

	public Optional<DownloadTask> get(String taskId) {
		synchronized (lock) {
			return Optional.ofNullable(tasks.get(taskId));
		}
	}

	/** All tasks in submission order */
	public List<DownloadTask> getAllTasks() {
		synchronized (lock) {
			return List.copyOf(tasks.values());
		}
	}

	/** Tasks that are currently downloading */
	public List<DownloadTask> getActiveTasks() {
		synchronized (lock) {
			return tasks.values().stream()
					.filter(t -> t.status() == DownloadStatus.DOWNLOADING)
					.toList();
		}
	}

	/**
	 * Cancel a task. A running transfer stops within one chunk, since the chunk already being
	 * written still lands, and the partial file is left on disk.
	 *
	 * @return false if the task is unknown or already finished
	 */
	public boolean cancel(String taskId) {
		synchronized (lock) {
			DownloadTask task = tasks.get(taskId);
			if (task == null || task.isTerminal()) {
				return false;
			}
			queue.remove(taskId);
			task.transitionTo(DownloadStatus.CANCELLED);
			publishCompletion(task);
		}
		logger.info("Cancelled task {}", taskId);
		return true;
	}

	/** Cancel every task that has not finished yet, returning how many were cancelled */
	public int cancelAll() {
		int cancelled = 0;
		for (DownloadTask task : getAllTasks()) {
			if (cancel(task.id())) {
				cancelled++;
			}
		}
		return cancelled;
	}

	/**
	 * Pause a pending or downloading task. The partial file and the downloaded size are kept.
	 *
	 * @return false if the task is unknown or cannot be paused
	 */
	public boolean pause(String taskId) {
		synchronized (lock) {
			DownloadTask task = tasks.get(taskId);
			if (task == null || !task.status().canTransitionTo(DownloadStatus.PAUSED)) {
				return false;
			}
			queue.remove(taskId);
			task.transitionTo(DownloadStatus.PAUSED);
			publishProgress(task);
		}
		logger.info("Paused task {}", taskId);
		return true;
	}

	/**
	 * Put a paused task back in the queue. If its previous worker has not let go of it yet, it is
	 * queued as soon as that worker finishes.
	 *
	 * @return false if the task is unknown or not paused
	 */
	public boolean resume(String taskId) {
		synchronized (lock) {
			DownloadTask task = tasks.get(taskId);
			if (task == null || task.status() != DownloadStatus.PAUSED) {
				return false;
			}
			task.transitionTo(DownloadStatus.PENDING);
			if (!task.isActive()) {
				queue.add(task);
			}
			publishProgress(task);
		}
		logger.info("Resumed task {}", taskId);
		return true;
	}

	public void registerProgressCallback(ProgressListener listener) {
		callbackBus.addProgressListener(Objects.requireNonNull(listener, "listener"));
	}

	public void registerCompletionCallback(CompletionListener listener) {
		callbackBus.addCompletionListener(Objects.requireNonNull(listener, "listener"));
	}

	/**
	 * Wait until no task is pending or downloading. Paused tasks do not hold this up.
	 *
	 * @param timeout How long to wait at most
	 * @return true if everything settled in time
	 * @throws InterruptedException if interrupted while waiting
	 */
	public boolean awaitAll(Duration timeout) throws InterruptedException {
		long deadline = System.nanoTime() + timeout.toNanos();
		while (true) {
			synchronized (lock) {
				boolean busy = activeWorkers > 0
						|| tasks.values().stream()
								.anyMatch(t -> t.status() == DownloadStatus.PENDING
										|| t.status() == DownloadStatus.DOWNLOADING);
				if (!busy) {
					return true;
				}
			}
			if (System.nanoTime() >= deadline) {
				return false;
			}
			Thread.sleep(Math.min(config.schedulerTick().toMillis(), 100));
		}
	}

	public int getCompletedCount() {
		return completedDownloads.get();
	}

	public int getFailedCount() {
		return failedDownloads.get();
	}

	public ProgressTracker getProgressTracker() {
		return progressTracker;
	}

	public RateLimitedClient getClient() {
		return client;
	}

	/**
	 * Stop accepting work, cancel everything that has not finished and stop all threads.
	 *
	 * @param wait Whether to wait for the workers to stop and queued callbacks to be delivered
	 */
	public void shutdown(boolean wait) {
		Thread schedulerThread;
		synchronized (lock) {
			if (shutdownRequested) {
				return;
			}
			shutdownRequested = true;
			schedulerThread = scheduler;
		}
		logger.info("Shutting down DownloadEngine");
		if (schedulerThread != null) {
			schedulerThread.interrupt();
		}
		int cancelled = cancelAll();
		if (cancelled > 0) {
			logger.info("Cancelled {} unfinished downloads", cancelled);
		}
		if (wait) {
			workers.shutdown();
			try {
				if (schedulerThread != null) {
					schedulerThread.join(SHUTDOWN_TIMEOUT.toMillis());
				}
				if (!workers.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
					logger.warn("Download workers did not stop within {}", SHUTDOWN_TIMEOUT);
					workers.shutdownNow();
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				workers.shutdownNow();
			}
		} else {
			workers.shutdownNow();
		}
		callbackBus.close();
		logger.info(
				"Download summary: {} completed, {} failed, {} total",
				completedDownloads.get(),
				failedDownloads.get(),
				getAllTasks().size());
	}

	@Override
	public void close() {
		shutdown(true);
	}

	private void schedule() {
		long tickMillis = Math.max(1, config.schedulerTick().toMillis());
		while (true) {
			synchronized (lock) {
				if (shutdownRequested) {
					break;
				}
				dispatch();
			}
			try {
				Thread.sleep(tickMillis);
			} catch (InterruptedException e) {
				break;
			}
		}
		logger.debug("Scheduler stopped");
	}

	// called with lock held
	private void dispatch() {
		while (activeWorkers < config.maxWorkers()) {
			Optional<DownloadTask> next = queue.next();
			if (next.isEmpty()) {
				return;
			}
			DownloadTask task = next.get();
			if (task.status() != DownloadStatus.PENDING || task.isActive()) {
				continue;
			}
			task.transitionTo(DownloadStatus.DOWNLOADING);
			task.active(true);
			activeWorkers++;
			try {
				workers.execute(new TransferWorker(this, task));
			} catch (RejectedExecutionException e) {
				activeWorkers--;
				task.active(false);
				task.fail("Download engine is shutting down");
				failedDownloads.incrementAndGet();
				publishCompletion(task);
				return;
			}
			logger.debug("Dispatched {} ({} active)", task.id(), activeWorkers);
			publishProgress(task);
		}
	}

	// called with lock held
	private void publishProgress(DownloadTask task) {
		ProgressEvent event = ProgressEvent.progress(task);
		progressTracker.update(event);
		callbackBus.publish(event);
	}

	// called with lock held
	private void publishCompletion(DownloadTask task) {
		ProgressEvent event = ProgressEvent.completed(task);
		progressTracker.update(event);
		callbackBus.publish(event);
	}

	EngineConfig config() {
		return config;
	}

	RateLimitedClient client() {
		return client;
	}

	boolean isDownloading(DownloadTask task) {
		return task.status() == DownloadStatus.DOWNLOADING;
	}

	void recordProgress(DownloadTask task, long downloaded, long total, boolean publish, double speed) {
		synchronized (lock) {
			task.sizes(downloaded, total);
			if (publish && task.status() == DownloadStatus.DOWNLOADING) {
				task.throughput(speed);
				publishProgress(task);
			}
		}
	}

	void rename(DownloadTask task, String filename) {
		synchronized (lock) {
			task.filename(filename);
		}
	}

	void addRetries(DownloadTask task, int retries) {
		if (retries <= 0) {
			return;
		}
		synchronized (lock) {
			task.incrementRetryCount(retries);
		}
	}

	void complete(DownloadTask task) {
		synchronized (lock) {
			if (task.status() != DownloadStatus.DOWNLOADING) {
				return;
			}
			task.transitionTo(DownloadStatus.COMPLETED);
			completedDownloads.incrementAndGet();
			publishCompletion(task);
		}
		logger.info("Completed {} ({} bytes)", task.filePath(), task.downloadedSize());
	}

	void fail(DownloadTask task, String message) {
		synchronized (lock) {
			if (task.status() != DownloadStatus.DOWNLOADING) {
				return;
			}
			task.fail(message);
			failedDownloads.incrementAndGet();
			publishCompletion(task);
		}
	}

	/** Give the worker slot back and re-queue the task if it was resumed while still held */
	void release(DownloadTask task) {
		synchronized (lock) {
			task.active(false);
			activeWorkers--;
			if (task.status() == DownloadStatus.PENDING && !shutdownRequested) {
				queue.add(task);
			}
		}
	}

	/** Sleep for a retry delay, waking early when the task stops downloading */
	void sleepWhileDownloading(DownloadTask task, Duration delay) throws InterruptedException {
		long deadline = System.nanoTime() + delay.toNanos();
		long slice = Math.max(1, config.schedulerTick().toMillis());
		while (isDownloading(task)) {
			long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
			if (remaining <= 0) {
				return;
			}
			Thread.sleep(Math.min(slice, remaining));
		}
	}

	private static String validateUrl(String url) {
		if (url == null || url.isBlank()) {
			throw new IllegalArgumentException("URL must not be empty");
		}
		String trimmed = url.strip();
		URI uri;
		try {
			uri = URI.create(trimmed);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid URL: " + url, e);
		}
		String scheme = uri.getScheme();
		if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
			throw new IllegalArgumentException("Only http and https URLs are supported: " + url);
		}
		if (uri.getHost() == null) {
			throw new IllegalArgumentException("URL has no host: " + url);
		}
		return trimmed;
	}

	private static ThreadFactory namedThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger(0);
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
