package dev.civitai.dl.download;

/** The response body ended before the declared size was reached. */
public class IncompleteTransferException extends TransferException {
	private final long received;
	private final long expected;

	public IncompleteTransferException(long received, long expected) {
		super("Incomplete transfer: received " + received + " of " + expected + " bytes");
		this.received = received;
		this.expected = expected;
	}

	public long getReceived() {
		return received;
	}

	public long getExpected() {
		return expected;
	}

	@Override
	public boolean isRetryable() {
		return true;
	}
}
