package dev.civitai.dl.util;

import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Works out local filenames for downloads */
public class FilenameUtils {
	private static final Pattern INVALID_CHARS = Pattern.compile("[\\\\/*?:\"<>|]");
	private static final Pattern EXTENDED_FILENAME =
			Pattern.compile("filename\\*\\s*=\\s*([^';]*)'[^']*'([^;]+)", Pattern.CASE_INSENSITIVE);
	private static final Pattern QUOTED_FILENAME =
			Pattern.compile("filename\\s*=\\s*\"((?:[^\"\\\\]|\\\\.)*)\"", Pattern.CASE_INSENSITIVE);
	private static final Pattern PLAIN_FILENAME =
			Pattern.compile("filename\\s*=\\s*([^;\\s]+)", Pattern.CASE_INSENSITIVE);

	/**
	 * Extract the filename from a Content-Disposition header value. An RFC 5987 {@code filename*}
	 * parameter wins over a plain {@code filename}.
	 *
	 * @param header The raw header value, may be null
	 * @return The sanitized filename, or empty if the header names none
	 */
	public static Optional<String> fromContentDisposition(String header) {
		if (header == null || header.isBlank()) {
			return Optional.empty();
		}
		Matcher extended = EXTENDED_FILENAME.matcher(header);
		if (extended.find()) {
			String charset = extended.group(1).isBlank() ? "UTF-8" : extended.group(1).strip();
			String value = extended.group(2).strip();
			try {
				return sanitize(URLDecoder.decode(value.replace("+", "%2B"), charset));
			} catch (IllegalArgumentException | UnsupportedEncodingException e) {
				return sanitize(value);
			}
		}
		Matcher quoted = QUOTED_FILENAME.matcher(header);
		if (quoted.find()) {
			return sanitize(quoted.group(1).replaceAll("\\\\(.)", "$1"));
		}
		Matcher plain = PLAIN_FILENAME.matcher(header);
		if (plain.find()) {
			return sanitize(plain.group(1));
		}
		return Optional.empty();
	}

	/** Extension given to derived names that have none; most Civitai downloads are model weights */
	public static final String DEFAULT_EXTENSION = ".safetensors";

	/**
	 * Derive a filename from a URL: the percent-decoded last path segment, or when that has no
	 * extension a {@code filename} query parameter, then {@code download_<id>} from an {@code id}
	 * query parameter, then {@code download_} plus a short hash of the URL. A result without an
	 * extension gets {@link #DEFAULT_EXTENSION}.
	 */
	public static String fromUrl(String url) {
		return withExtension(nameFromUrl(url));
	}

	private static String nameFromUrl(String url) {
		URI uri;
		try {
			uri = URI.create(url);
		} catch (IllegalArgumentException e) {
			return hashedName(url);
		}
		String basename = basename(uri.getPath());
		if (basename != null && hasExtension(basename)) {
			Optional<String> name = sanitize(basename);
			if (name.isPresent()) {
				return name.get();
			}
		}
		Optional<String> filenameParam = queryParam(uri, "filename").flatMap(FilenameUtils::sanitize);
		if (filenameParam.isPresent()) {
			return filenameParam.get();
		}
		Optional<String> idParam = queryParam(uri, "id").flatMap(FilenameUtils::sanitize);
		if (idParam.isPresent()) {
			return "download_" + idParam.get();
		}
		if (basename != null) {
			Optional<String> name = sanitize(basename);
			if (name.isPresent()) {
				return name.get();
			}
		}
		return hashedName(url);
	}

	private static String withExtension(String name) {
		return hasExtension(name) ? name : name + DEFAULT_EXTENSION;
	}

	// a dot that is neither the first nor the last character
	private static boolean hasExtension(String name) {
		int dot = name.lastIndexOf('.');
		return dot > 0 && dot < name.length() - 1;
	}

	/** Replace characters that are not allowed in filenames, or empty if nothing usable is left */
	public static Optional<String> sanitize(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String cleaned = INVALID_CHARS.matcher(name).replaceAll("_").strip();
		if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) {
			return Optional.empty();
		}
		return Optional.of(cleaned);
	}

	private static String basename(String path) {
		if (path == null || path.isEmpty()) {
			return null;
		}
		String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
		int slash = trimmed.lastIndexOf('/');
		String name = trimmed.substring(slash + 1);
		return name.isEmpty() ? null : name;
	}

	private static Optional<String> queryParam(URI uri, String name) {
		String query = uri.getRawQuery();
		if (query == null) {
			return Optional.empty();
		}
		for (String pair : query.split("&")) {
			int eq = pair.indexOf('=');
			String key = eq >= 0 ? pair.substring(0, eq) : pair;
			if (key.equals(name) && eq >= 0) {
				try {
					return Optional.of(URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
				} catch (IllegalArgumentException e) {
					return Optional.of(pair.substring(eq + 1));
				}
			}
		}
		return Optional.empty();
	}

	private static String hashedName(String url) {
		try {
			byte[] digest = MessageDigest.getInstance("MD5").digest(url.getBytes(StandardCharsets.UTF_8));
			return "download_" + HexFormat.of().formatHex(digest).substring(0, 8);
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("MD5 not available", e);
		}
	}
}
