package dev.civitai.dl.download;

/** Transient network failure: connection problems, timeouts, server errors. Retried with backoff. */
public class NetworkException extends TransferException {
	public NetworkException(String message) {
		super(message);
	}

	public NetworkException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public boolean isRetryable() {
		return true;
	}
}
