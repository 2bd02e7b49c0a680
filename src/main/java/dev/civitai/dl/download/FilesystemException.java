package dev.civitai.dl.download;

/** The destination could not be created, opened or written. Never retried. */
public class FilesystemException extends TransferException {
	public FilesystemException(String message, Throwable cause) {
		super(message, cause);
	}
}
