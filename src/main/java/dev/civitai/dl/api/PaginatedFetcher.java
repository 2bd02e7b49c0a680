package dev.civitai.dl.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates a cursor-paginated listing. Each page is expected to look like
 * {@code {"items": [...], "metadata": {"nextCursor": "..."}}}; the cursor is sent back in the
 * {@code cursor} query parameter.
 */
public class PaginatedFetcher {
	private static final Logger logger = LoggerFactory.getLogger(PaginatedFetcher.class);

	public static final String CURSOR_PARAM = "cursor";
	public static final int DEFAULT_MAX_PAGES = 1000;

	private final RateLimitedClient client;
	private final int maxPages;

	public PaginatedFetcher(RateLimitedClient client) {
		this(client, DEFAULT_MAX_PAGES);
	}

	public PaginatedFetcher(RateLimitedClient client, int maxPages) {
		if (maxPages < 1) {
			throw new IllegalArgumentException("maxPages must be >= 1");
		}
		this.client = client;
		this.maxPages = maxPages;
	}

	/**
	 * Lazily iterate over every item of a listing. The iterator is single-use. Failures surface as
	 * {@link UncheckedIOException} wrapping the {@link ApiException}.
	 *
	 * @param url Listing URL
	 * @param baseParams Query parameters for the first page; never modified
	 */
	public Iterator<JsonNode> fetchAll(String url, Map<String, String> baseParams) {
		return new CursorIterator(url, baseParams);
	}

	/**
	 * Fetch every item of a listing eagerly.
	 *
	 * @throws ApiException if any page fails
	 * @throws InterruptedException if interrupted while pacing
	 */
	public List<JsonNode> fetchAllItems(String url, Map<String, String> baseParams)
			throws ApiException, InterruptedException {
		List<JsonNode> results = new ArrayList<>();
		try {
			fetchAll(url, baseParams).forEachRemaining(results::add);
		} catch (UncheckedIOException e) {
			IOException cause = e.getCause();
			if (cause instanceof InterruptedIOException) {
				Thread.interrupted();
				throw new InterruptedException(cause.getMessage());
			}
			if (cause instanceof ApiException apiException) {
				throw apiException;
			}
			throw new ApiException("Failed to fetch " + url, cause);
		}
		return results;
	}

	private class CursorIterator extends PaginatedIterator<JsonNode> {
		private final String url;
		private final Map<String, String> params;
		private final Set<String> seenCursors = new HashSet<>();

		CursorIterator(String url, Map<String, String> baseParams) {
			this.url = url;
			this.params = new LinkedHashMap<>();
			if (baseParams != null) {
				this.params.putAll(baseParams);
			}
		}

		@Override
		protected Page<JsonNode> fetchPage(String cursor) throws Exception {
			if (cursor != null) {
				params.put(CURSOR_PARAM, cursor);
			}
			JsonNode response = client.getJson(url, params);

			List<JsonNode> items = new ArrayList<>();
			JsonNode itemsNode = response.get("items");
			if (itemsNode != null && itemsNode.isArray()) {
				itemsNode.forEach(items::add);
			}
			JsonNode nextCursor = response.path("metadata").get("nextCursor");
			String next = nextCursor == null || nextCursor.isNull() ? null : nextCursor.asText();
			logger.debug("Fetched page {} of {} with {} items", getPagesFetched() + 1, url, items.size());
			return new Page<>(items, next);
		}

		@Override
		protected boolean shouldContinue(String nextCursor, int pagesFetched) {
			if (!seenCursors.add(nextCursor)) {
				logger.warn("Server repeated cursor {} for {}, stopping after {} pages", nextCursor, url, pagesFetched);
				return false;
			}
			if (pagesFetched >= maxPages) {
				logger.warn("Reached page limit of {} for {}, stopping", maxPages, url);
				return false;
			}
			return true;
		}

		@Override
		protected void handleFetchError(Exception e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
				throw new UncheckedIOException(new InterruptedIOException("Interrupted while fetching " + url));
			}
			if (e instanceof IOException ioException) {
				throw new UncheckedIOException(ioException);
			}
			throw new UncheckedIOException(new ApiException("Failed to fetch " + url, e));
		}
	}
}
