package dev.civitai.dl.api;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Abstract base class for cursor-paginated iteration over API results. Pages are fetched lazily as
 * the iterator is consumed; an absent next cursor ends the iteration.
 */
public abstract class PaginatedIterator<T> implements Iterator<T> {
	private String cursor = null;
	private Iterator<T> currentBatch = null;
	private boolean hasMore = true;
	private int pagesFetched = 0;

	/** One page of results together with the cursor for the following page */
	public record Page<T>(List<T> items, String nextCursor) {
		public Page {
			items = items == null ? List.of() : items;
		}
	}

	@Override
	public boolean hasNext() {
		while (currentBatch == null || !currentBatch.hasNext()) {
			if (!hasMore) {
				return false;
			}
			fetchNextBatch();
		}
		return true;
	}

	@Override
	public T next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		return currentBatch.next();
	}

	public int getPagesFetched() {
		return pagesFetched;
	}

	private void fetchNextBatch() {
		Page<T> page;
		try {
			page = fetchPage(cursor);
		} catch (Exception e) {
			hasMore = false;
			currentBatch = null;
			handleFetchError(e);
			return;
		}
		pagesFetched++;
		currentBatch = page.items().iterator();

		String next = page.nextCursor();
		if (next == null || next.isBlank() || !shouldContinue(next, pagesFetched)) {
			hasMore = false;
		} else {
			cursor = next;
		}
	}

	/**
	 * Fetch a page of results from an API.
	 * @param cursor The cursor returned with the previous page, or null for the first page
	 * @return The page of items and the cursor of the next page, if any
	 */
	protected abstract Page<T> fetchPage(String cursor) throws Exception;

	/**
	 * Decide whether to follow a next cursor. Called after every page that carries one.
	 * @param nextCursor The cursor the server returned
	 * @param pagesFetched Number of pages fetched so far
	 * @return false to end the iteration
	 */
	protected boolean shouldContinue(String nextCursor, int pagesFetched) {
		return true;
	}

	/**
	 * Handle errors that occur during page fetching. The iteration is already ended when this is
	 * called; implementations may rethrow.
	 * @param e The exception that occurred
	 */
	protected abstract void handleFetchError(Exception e);
}
