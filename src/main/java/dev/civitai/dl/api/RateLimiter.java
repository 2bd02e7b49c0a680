package dev.civitai.dl.api;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paces outbound requests so that no two are issued less than the minimum interval apart. The
 * interval only ever grows: every throttling response doubles it for the rest of the process.
 *
 * <p>The pacing lock is held while waiting for the next slot so issue order matches arrival
 * order, but it is released before the request itself goes out.
 */
public class RateLimiter {
	private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

	/** Floor applied when doubling an interval that started out at zero */
	static final Duration MIN_THROTTLED_INTERVAL = Duration.ofMillis(100);

	private final ReentrantLock lock = new ReentrantLock(true);
	private long lastRequestNanos;
	private boolean hasRequested;
	private long minIntervalNanos;

	public RateLimiter(Duration minInterval) {
		if (minInterval == null || minInterval.isNegative()) {
			throw new IllegalArgumentException("minInterval must be >= 0");
		}
		this.minIntervalNanos = minInterval.toNanos();
	}

	/**
	 * Block until the caller may issue its request, then record the issue time.
	 *
	 * @throws InterruptedException if interrupted while waiting for the slot
	 */
	public void acquire() throws InterruptedException {
		lock.lockInterruptibly();
		try {
			if (hasRequested) {
				long wait = minIntervalNanos - (System.nanoTime() - lastRequestNanos);
				if (wait > 0) {
					logger.debug("Rate limit: waiting {} ms", TimeUnit.NANOSECONDS.toMillis(wait));
					TimeUnit.NANOSECONDS.sleep(wait);
				}
			}
			lastRequestNanos = System.nanoTime();
			hasRequested = true;
		} finally {
			lock.unlock();
		}
	}

	/** Double the minimum interval after a throttling response */
	public Duration onThrottled() {
		lock.lock();
		try {
			minIntervalNanos = Math.max(minIntervalNanos * 2, MIN_THROTTLED_INTERVAL.toNanos());
			return Duration.ofNanos(minIntervalNanos);
		} finally {
			lock.unlock();
		}
	}

	public Duration getMinInterval() {
		lock.lock();
		try {
			return Duration.ofNanos(minIntervalNanos);
		} finally {
			lock.unlock();
		}
	}
}
