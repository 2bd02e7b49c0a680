package dev.civitai.dl.api;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.ConnectException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RateLimitedClientTest {
	private static final String URL = "https://api.test/v1/models";

	private final FakeTransport transport = new FakeTransport();

	private RateLimitedClient createClient(String apiKey, Duration minInterval, int maxThrottleRetries) {
		return new RateLimitedClient(
				transport,
				apiKey,
				new RateLimiter(minInterval),
				Duration.ofSeconds(5),
				Duration.ofMillis(10),
				maxThrottleRetries);
	}

	@Test
	void testGetJsonParsesBody() throws Exception {
		// Given
		transport.enqueueJson(URL, "{\"items\":[{\"id\":1}]}");
		RateLimitedClient client = createClient(null, Duration.ZERO, 3);

		// When
		JsonNode json = client.getJson(URL, null);

		// Then
		assertThat(json.get("items").get(0).get("id").asInt()).isEqualTo(1);
	}

	@Test
	void testRequestsAreSpacedByMinInterval() throws Exception {
		// Given
		for (int i = 0; i < 3; i++) {
			transport.enqueueJson(URL, "{}");
		}
		RateLimitedClient client = createClient(null, Duration.ofMillis(60), 3);

		// When
		for (int i = 0; i < 3; i++) {
			client.getJson(URL, null);
		}

		// Then
		List<FakeTransport.Recorded> requests = transport.getRequests();
		assertThat(requests).hasSize(3);
		for (int i = 1; i < requests.size(); i++) {
			long gap = requests.get(i).nanoTime() - requests.get(i - 1).nanoTime();
			assertThat(gap).isGreaterThanOrEqualTo(Duration.ofMillis(60).toNanos());
		}
	}

	@Test
	void testThrottledOnceThenSucceeds() throws Exception {
		// Given
		transport.enqueue(URL, 429).enqueueJson(URL, "{\"ok\":true}");
		RateLimitedClient client = createClient(null, Duration.ofMillis(20), 3);

		// When
		ClientResponse response = client.request("GET", URL, null, null);

		// Then
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.throttleRetries()).isEqualTo(1);
		assertThat(client.getRateLimiter().getMinInterval()).isGreaterThanOrEqualTo(Duration.ofMillis(40));
		assertThat(transport.getRequestCount()).isEqualTo(2);
		response.close();
	}

	@Test
	void testIntervalStaysDoubledForLaterRequests() throws Exception {
		// Given
		transport.enqueue(URL, 429).enqueueJson(URL, "{}").enqueueJson(URL, "{}");
		RateLimitedClient client = createClient(null, Duration.ofMillis(50), 3);

		// When
		client.getJson(URL, null);
		client.getJson(URL, null);

		// Then
		List<FakeTransport.Recorded> requests = transport.getRequests();
		long gap = requests.get(2).nanoTime() - requests.get(1).nanoTime();
		assertThat(gap).isGreaterThanOrEqualTo(Duration.ofMillis(100).toNanos());
	}

	@Test
	void testThrottlingExhaustsRetries() {
		// Given
		for (int i = 0; i < 4; i++) {
			transport.enqueue(URL, 429);
		}
		RateLimitedClient client = createClient(null, Duration.ZERO, 2);

		// When/Then
		assertThatThrownBy(() -> client.request("GET", URL, null, null))
				.isInstanceOfSatisfying(RateLimitException.class, e -> {
					assertThat(e.getStatusCode()).isEqualTo(429);
					assertThat(e.getAttempts()).isEqualTo(3);
				});
		assertThat(transport.getRequestCount()).isEqualTo(3);
	}

	@Test
	void testStatusMapping() {
		// Given
		transport.enqueue(URL, 404);
		transport.enqueue(URL, 401);
		transport.enqueue(URL, 500, Map.of(), "{\"message\":\"boom\"}");
		RateLimitedClient client = createClient(null, Duration.ZERO, 0);

		// When/Then
		assertThatThrownBy(() -> client.getJson(URL, null)).isInstanceOf(ResourceNotFoundException.class);
		assertThatThrownBy(() -> client.getJson(URL, null)).isInstanceOf(AuthenticationException.class);
		assertThatThrownBy(() -> client.getJson(URL, null))
				.isExactlyInstanceOf(ApiException.class)
				.hasMessageContaining("500")
				.hasMessageContaining("boom");
	}

	@Test
	void testSendReturnsErrorResponsesUnmapped() throws Exception {
		// Given
		transport.enqueue(URL, 404);
		RateLimitedClient client = createClient(null, Duration.ZERO, 0);

		// When
		try (ClientResponse response = client.send("GET", URL, null, null)) {
			// Then
			assertThat(response.statusCode()).isEqualTo(404);
			assertThat(response.isSuccessful()).isFalse();
		}
	}

	@Test
	void testTransportFailureBecomesApiException() {
		// Given
		transport.failConnections(new ConnectException("refused"));
		RateLimitedClient client = createClient(null, Duration.ZERO, 0);

		// When/Then
		assertThatThrownBy(() -> client.getJson(URL, null))
				.isInstanceOfSatisfying(ApiException.class, e -> {
					assertThat(e.hasStatusCode()).isFalse();
					assertThat(e.getMessage()).contains("Unable to connect");
					assertThat(e.getSolutions()).isNotEmpty();
				});
	}

	@Test
	void testInvalidJsonIsReported() {
		// Given
		transport.enqueue(URL, 200, Map.of(), "<html>not json</html>");
		RateLimitedClient client = createClient(null, Duration.ZERO, 0);

		// When/Then
		assertThatThrownBy(() -> client.getJson(URL, null)).hasMessage("Invalid JSON response");
	}

	@Test
	void testAuthorizationHeaderAdded() throws Exception {
		// Given
		transport.enqueueJson(URL, "{}");
		transport.enqueueJson(URL, "{}");
		RateLimitedClient client = createClient("secret", Duration.ZERO, 0);

		// When
		client.getJson(URL, null);
		client.request("GET", URL, Map.of("authorization", "Bearer other"), null).close();

		// Then
		assertThat(transport.getRequests().get(0).header("Authorization")).isEqualTo("Bearer secret");
		assertThat(transport.getRequests().get(1).header("Authorization")).isEqualTo("Bearer other");
	}

	@Test
	void testNoAuthorizationWithoutKey() throws Exception {
		// Given
		transport.enqueueJson(URL, "{}");
		RateLimitedClient client = createClient(" ", Duration.ZERO, 0);

		// When
		client.getJson(URL, null);

		// Then
		assertThat(client.hasApiKey()).isFalse();
		assertThat(transport.getRequests().get(0).header("Authorization")).isNull();
	}

	@Test
	void testBuildUriEncodesParams() throws Exception {
		// Given
		Map<String, String> params = new LinkedHashMap<>();
		params.put("query", "a b&c");
		params.put("skipped", null);
		params.put("limit", "10");

		// When
		String plain = RateLimitedClient.buildUri(URL, params).toString();
		String withQuery = RateLimitedClient.buildUri(URL + "?sort=new", Map.of("limit", "5")).toString();

		// Then
		assertThat(plain).isEqualTo(URL + "?query=a+b%26c&limit=10");
		assertThat(withQuery).isEqualTo(URL + "?sort=new&limit=5");
	}

	@Test
	void testBuildUriRejectsEmptyUrl() {
		assertThatThrownBy(() -> RateLimitedClient.buildUri("", null)).isInstanceOf(ApiException.class);
	}
}
