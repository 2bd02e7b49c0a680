package dev.civitai.dl.reporting;

import static org.assertj.core.api.Assertions.*;

import dev.civitai.dl.download.DownloadStatus;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class CallbackBusTest {

	private static ProgressEvent event(String taskId, ProgressEvent.EventType type, long downloaded) {
		return new ProgressEvent(taskId, type, DownloadStatus.DOWNLOADING, downloaded, 100, 0, -1, Instant.now(), null);
	}

	@Test
	void testDeliversEventsInOrderOnDispatcherThread() {
		// Given
		CallbackBus bus = new CallbackBus("test-callbacks");
		List<Long> received = new CopyOnWriteArrayList<>();
		List<String> threads = new CopyOnWriteArrayList<>();
		bus.addProgressListener(e -> {
			received.add(e.downloadedSize());
			threads.add(Thread.currentThread().getName());
		});
		bus.start();

		// When
		for (int i = 1; i <= 5; i++) {
			bus.publish(event("t", ProgressEvent.EventType.PROGRESS, i * 10));
		}
		bus.close();

		// Then
		assertThat(received).containsExactly(10L, 20L, 30L, 40L, 50L);
		assertThat(threads).containsOnly("test-callbacks");
	}

	@Test
	void testFailingListenerDoesNotStopOthers() {
		// Given
		CallbackBus bus = new CallbackBus();
		List<String> completed = new CopyOnWriteArrayList<>();
		bus.addCompletionListener(task -> {
			throw new IllegalStateException("boom");
		});
		bus.addCompletionListener(task -> completed.add("called"));
		bus.start();

		// When
		bus.publish(event("a", ProgressEvent.EventType.COMPLETED, 100));
		bus.publish(event("b", ProgressEvent.EventType.COMPLETED, 100));
		bus.close();

		// Then
		assertThat(completed).hasSize(2);
	}

	@Test
	void testProgressAndCompletionListenersAreSeparate() {
		// Given
		CallbackBus bus = new CallbackBus();
		List<String> progress = new CopyOnWriteArrayList<>();
		List<String> completion = new CopyOnWriteArrayList<>();
		bus.addProgressListener(e -> progress.add(e.taskId()));
		bus.addCompletionListener(t -> completion.add("done"));
		bus.start();

		// When
		bus.publish(event("a", ProgressEvent.EventType.PROGRESS, 1));
		bus.publish(event("a", ProgressEvent.EventType.COMPLETED, 100));
		bus.close();

		// Then
		assertThat(progress).containsExactly("a");
		assertThat(completion).containsExactly("done");
	}

	@Test
	void testEventsAfterCloseAreDropped() {
		// Given
		CallbackBus bus = new CallbackBus();
		List<String> progress = new CopyOnWriteArrayList<>();
		bus.addProgressListener(e -> progress.add(e.taskId()));
		bus.start();
		bus.close();

		// When
		bus.publish(event("late", ProgressEvent.EventType.PROGRESS, 1));

		// Then
		assertThat(bus.isRunning()).isFalse();
		assertThat(progress).isEmpty();
	}
}
