package dev.civitai.dl.download;

/** A transfer attempt failed. Subclasses tell the worker whether another attempt makes sense. */
public class TransferException extends Exception {
	public TransferException(String message) {
		super(message);
	}

	public TransferException(String message, Throwable cause) {
		super(message, cause);
	}

	/** Whether the worker may try the transfer again */
	public boolean isRetryable() {
		return false;
	}
}
