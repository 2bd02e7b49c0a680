package dev.civitai.dl.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Utility class for file operations */
public class FileUtils {

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.isDirectory(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Size of a regular file, or 0 if there is none */
	public static long existingSize(Path file) throws IOException {
		if (!Files.isRegularFile(file)) {
			return 0;
		}
		return Files.size(file);
	}

	/** Cut a partial file back to zero bytes, creating it when missing */
	public static void truncate(Path file) throws IOException {
		Files.write(file, new byte[0]);
	}
}
