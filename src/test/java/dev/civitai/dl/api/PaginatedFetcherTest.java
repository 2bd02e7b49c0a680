package dev.civitai.dl.api;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.junit.jupiter.api.Test;

class PaginatedFetcherTest {
	private static final String URL = "https://api.test/v1/images";

	private final FakeTransport transport = new FakeTransport();
	private final RateLimitedClient client =
			new RateLimitedClient(transport, null, Duration.ZERO, Duration.ofSeconds(5));

	private static String page(int firstId, int count, String nextCursor) {
		StringJoiner items = new StringJoiner(",", "[", "]");
		for (int i = 0; i < count; i++) {
			items.add("{\"id\":" + (firstId + i) + "}");
		}
		String metadata = nextCursor == null ? "{}" : "{\"nextCursor\":\"" + nextCursor + "\"}";
		return "{\"items\":" + items + ",\"metadata\":" + metadata + "}";
	}

	@Test
	void testAggregatesAllPages() throws Exception {
		// Given
		transport.enqueueJson(URL, page(0, 10, "A"));
		transport.enqueueJson(URL, page(10, 10, "B"));
		transport.enqueueJson(URL, page(20, 5, null));
		PaginatedFetcher fetcher = new PaginatedFetcher(client);

		// When
		List<JsonNode> items = fetcher.fetchAllItems(URL, Map.of("modelId", "7"));

		// Then
		assertThat(items).hasSize(25);
		assertThat(items.stream().map(n -> n.get("id").asInt()).distinct().count()).isEqualTo(25);
		List<FakeTransport.Recorded> requests = transport.getRequests();
		assertThat(requests).hasSize(3);
		assertThat(requests.get(0).url()).isEqualTo(URL + "?modelId=7");
		assertThat(requests.get(1).url()).isEqualTo(URL + "?modelId=7&cursor=A");
		assertThat(requests.get(2).url()).isEqualTo(URL + "?modelId=7&cursor=B");
	}

	@Test
	void testIterationIsLazy() {
		// Given
		transport.enqueueJson(URL, page(0, 2, "A"));
		transport.enqueueJson(URL, page(2, 2, null));
		PaginatedFetcher fetcher = new PaginatedFetcher(client);

		// When
		Iterator<JsonNode> it = fetcher.fetchAll(URL, null);
		it.next();
		it.next();

		// Then
		assertThat(transport.getRequestCount()).isEqualTo(1);
		assertThat(it.hasNext()).isTrue();
		assertThat(transport.getRequestCount()).isEqualTo(2);
	}

	@Test
	void testSkipsEmptyPages() throws Exception {
		// Given
		transport.enqueueJson(URL, page(0, 0, "A"));
		transport.enqueueJson(URL, page(0, 3, null));
		PaginatedFetcher fetcher = new PaginatedFetcher(client);

		// When
		List<JsonNode> items = fetcher.fetchAllItems(URL, null);

		// Then
		assertThat(items).hasSize(3);
	}

	@Test
	void testStopsOnRepeatedCursor() throws Exception {
		// Given
		transport.enqueueJson(URL, page(0, 2, "A"));
		transport.enqueueJson(URL, page(2, 2, "A"));
		transport.enqueueJson(URL, page(4, 2, "A"));
		PaginatedFetcher fetcher = new PaginatedFetcher(client);

		// When
		List<JsonNode> items = fetcher.fetchAllItems(URL, null);

		// Then
		assertThat(items).hasSize(4);
		assertThat(transport.getRequestCount()).isEqualTo(2);
	}

	@Test
	void testStopsAtMaxPages() throws Exception {
		// Given
		transport.enqueueJson(URL, page(0, 1, "A"));
		transport.enqueueJson(URL, page(1, 1, "B"));
		transport.enqueueJson(URL, page(2, 1, "C"));
		PaginatedFetcher fetcher = new PaginatedFetcher(client, 2);

		// When
		List<JsonNode> items = fetcher.fetchAllItems(URL, null);

		// Then
		assertThat(items).hasSize(2);
		assertThat(transport.getRequestCount()).isEqualTo(2);
	}

	@Test
	void testPageErrorIsThrown() {
		// Given
		transport.enqueueJson(URL, page(0, 2, "A"));
		transport.enqueue(URL, 500);
		PaginatedFetcher fetcher = new PaginatedFetcher(client);

		// When/Then
		assertThatThrownBy(() -> fetcher.fetchAllItems(URL, null))
				.isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(500));
	}

	@Test
	void testBaseParamsAreNotModified() throws Exception {
		// Given
		transport.enqueueJson(URL, page(0, 1, "A"));
		transport.enqueueJson(URL, page(1, 1, null));
		Map<String, String> params = new HashMap<>(Map.of("limit", "1"));

		// When
		new PaginatedFetcher(client).fetchAllItems(URL, params);

		// Then
		assertThat(params).containsOnlyKeys("limit");
	}
}
