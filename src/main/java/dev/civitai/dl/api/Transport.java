package dev.civitai.dl.api;

import java.io.IOException;

/**
 * A single HTTP call primitive. Implementations issue exactly one request per call and hand back
 * the response with its body still unread, so callers can stream large payloads.
 */
public interface Transport {

	/**
	 * Execute a request.
	 *
	 * @param request the request to send
	 * @return the response; the caller must close it
	 * @throws IOException on connection, timeout or protocol failures
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	TransportResponse execute(TransportRequest request) throws IOException, InterruptedException;
}
