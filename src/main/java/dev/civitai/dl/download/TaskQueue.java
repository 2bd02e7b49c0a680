package dev.civitai.dl.download;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Priority queue of pending tasks. Lower priority values come out first and equal priorities keep
 * their insertion order. Removal only marks the entry; {@link #next()} skips marked entries and
 * entries superseded by a later {@link #add}.
 *
 * <p>Not thread-safe, the engine guards it with its own lock.
 */
class TaskQueue {
	private static final Comparator<Entry> ORDER =
			Comparator.comparingInt(Entry::priority).thenComparingLong(Entry::sequence);

	private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
	private final Map<String, Entry> live = new HashMap<>();
	private long sequence;

	void add(DownloadTask task) {
		Entry previous = live.get(task.id());
		if (previous != null) {
			previous.removed = true;
		}
		Entry entry = new Entry(task.priority(), sequence++, task);
		live.put(task.id(), entry);
		heap.add(entry);
	}

	Optional<DownloadTask> next() {
		Entry entry;
		while ((entry = heap.poll()) != null) {
			if (!entry.removed) {
				live.remove(entry.task.id());
				return Optional.of(entry.task);
			}
		}
		return Optional.empty();
	}

	boolean remove(String taskId) {
		Entry entry = live.remove(taskId);
		if (entry == null) {
			return false;
		}
		entry.removed = true;
		return true;
	}

	boolean contains(String taskId) {
		return live.containsKey(taskId);
	}

	/** Number of entries that {@link #next()} would still return */
	int size() {
		return live.size();
	}

	boolean isEmpty() {
		return live.isEmpty();
	}

	private static final class Entry {
		private final int priority;
		private final long sequence;
		private final DownloadTask task;
		private boolean removed;

		private Entry(int priority, long sequence, DownloadTask task) {
			this.priority = priority;
			this.sequence = sequence;
			this.task = task;
		}

		int priority() {
			return priority;
		}

		long sequence() {
			return sequence;
		}
	}
}
