package dev.civitai.dl.reporting;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers progress and completion events to registered listeners on a single dispatcher thread,
 * so listeners never run on a transfer worker and may call back into the engine freely.
 */
public class CallbackBus implements Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(CallbackBus.class);
	private static final ProgressEvent POISON_PILL =
			new ProgressEvent("SHUTDOWN", ProgressEvent.EventType.PROGRESS, null, 0, 0, 0, -1, Instant.EPOCH, null);

	private final BlockingQueue<ProgressEvent> eventQueue = new LinkedBlockingQueue<>();
	private final List<ProgressListener> progressListeners = new CopyOnWriteArrayList<>();
	private final List<CompletionListener> completionListeners = new CopyOnWriteArrayList<>();
	private final AtomicBoolean running = new AtomicBoolean(false);
	private final String threadName;
	private Thread dispatcherThread;

	public CallbackBus() {
		this("CallbackBus");
	}

	public CallbackBus(String threadName) {
		this.threadName = threadName;
	}

	/** Start the dispatcher thread */
	public void start() {
		if (running.compareAndSet(false, true)) {
			dispatcherThread = new Thread(this, threadName);
			dispatcherThread.setDaemon(true);
			dispatcherThread.start();
			logger.debug("Callback dispatcher started");
		}
	}

	public void addProgressListener(ProgressListener listener) {
		progressListeners.add(listener);
	}

	public void addCompletionListener(CompletionListener listener) {
		completionListeners.add(listener);
	}

	/** Queue an event for delivery. Events published after {@link #close()} are dropped. */
	public void publish(ProgressEvent event) {
		if (!running.get()) {
			logger.debug("Dropping event after shutdown: {}", event);
			return;
		}
		try {
			eventQueue.put(event);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while publishing event for {}", event.taskId(), e);
		}
	}

	public boolean isRunning() {
		return running.get();
	}

	@Override
	public void run() {
		while (true) {
			ProgressEvent event;
			try {
				event = eventQueue.take();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Callback dispatcher interrupted");
				break;
			}
			if (event == POISON_PILL) {
				break;
			}
			dispatch(event);
		}
		logger.debug("Callback dispatcher stopped");
	}

	private void dispatch(ProgressEvent event) {
		switch (event.eventType()) {
			case PROGRESS -> {
				for (ProgressListener listener : progressListeners) {
					try {
						listener.onProgress(event);
					} catch (Exception e) {
						logger.error("Progress callback failed for task {}", event.taskId(), e);
					}
				}
			}
			case COMPLETED -> {
				for (CompletionListener listener : completionListeners) {
					try {
						listener.onCompletion(event.task());
					} catch (Exception e) {
						logger.error("Completion callback failed for task {}", event.taskId(), e);
					}
				}
			}
		}
	}

	/** Deliver every queued event, then stop the dispatcher thread */
	@Override
	public void close() {
		if (running.compareAndSet(true, false)) {
			try {
				eventQueue.put(POISON_PILL);
				if (dispatcherThread != null && dispatcherThread != Thread.currentThread()) {
					dispatcherThread.join(5000);
				}
				logger.debug("Callback dispatcher shutdown complete");
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while shutting down callback dispatcher", e);
			}
		}
	}
}
