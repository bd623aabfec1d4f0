package org.springaicommunity.github.contributors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the GitHub {@code Link} pagination header into a map of relation name to URL.
 *
 * <p>
 * Example input:
 *
 * <pre>
 * &lt;https://api.github.com/repositories/1/commits?page=2&gt;; rel="next",
 * &lt;https://api.github.com/repositories/1/commits?page=5&gt;; rel="last"
 * </pre>
 *
 * yields {@code {next=...page=2, last=...page=5}}. A missing {@code next} relation means
 * the current page is the last one.
 */
public final class LinkHeaderParser {

	public static final String NEXT = "next";

	private LinkHeaderParser() {
	}

	/**
	 * Parse a raw {@code Link} header value.
	 * @param header comma-separated {@code <url>; rel="name"} segments
	 * @return relation name to URL, in header order
	 * @throws MalformedLinkHeaderException if a segment lacks the {@code <url>} part, the
	 * {@code ;} separator or a {@code rel=} parameter
	 */
	public static Map<String, String> parse(String header) {
		Map<String, String> links = new LinkedHashMap<>();
		if (header.isBlank()) {
			return links;
		}

		for (String segment : header.split(",")) {
			String[] parts = segment.split(";");
			if (parts.length < 2) {
				throw new MalformedLinkHeaderException("Missing ';' in link segment: " + segment.trim());
			}

			String target = parts[0].trim();
			if (!target.startsWith("<") || !target.endsWith(">")) {
				throw new MalformedLinkHeaderException("Link target not enclosed in <>: " + target);
			}
			String url = target.substring(1, target.length() - 1);

			String rel = null;
			for (int i = 1; i < parts.length; i++) {
				String param = parts[i].trim();
				if (param.startsWith("rel=")) {
					rel = unquote(param.substring("rel=".length()).trim());
					break;
				}
			}
			if (rel == null || rel.isEmpty()) {
				throw new MalformedLinkHeaderException("Missing rel= in link segment: " + segment.trim());
			}

			links.put(rel, url);
		}
		return Collections.unmodifiableMap(links);
	}

	private static String unquote(String value) {
		if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
			return value.substring(1, value.length() - 1);
		}
		return value;
	}

	/**
	 * Thrown when a {@code Link} header does not follow RFC 8288 as used by GitHub.
	 */
	public static class MalformedLinkHeaderException extends IllegalArgumentException {

		public MalformedLinkHeaderException(String message) {
			super(message);
		}

	}

}
