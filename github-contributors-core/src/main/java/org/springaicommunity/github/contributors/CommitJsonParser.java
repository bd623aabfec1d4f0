package org.springaicommunity.github.contributors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts a page of the {@code GET /repos/{owner}/{repo}/commits} response into
 * {@link CommitRecord}s at the client boundary.
 */
public class CommitJsonParser {

	private final ObjectMapper objectMapper;

	public CommitJsonParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Parse one page of commits, preserving API order (newest first).
	 * @param body the response body
	 * @return the commits on the page
	 * @throws IOException if the body is not valid JSON, not a JSON array, or has content
	 * after the array
	 */
	public List<CommitRecord> parsePage(String body) throws IOException {
		JsonNode root = objectMapper.readTree(body);
		if (root == null || !root.isArray()) {
			throw new IOException("Expected a JSON array of commits but got "
					+ (root == null ? "an empty body" : root.getNodeType().toString().toLowerCase(Locale.ROOT)));
		}

		List<CommitRecord> commits = new ArrayList<>(root.size());
		for (JsonNode node : root) {
			commits.add(parseCommit(node));
		}
		return commits;
	}

	private CommitRecord parseCommit(JsonNode node) {
		String sha = node.path("sha").isTextual() ? node.path("sha").asText() : null;
		return new CommitRecord(sha, parseAccount(node.path("author")),
				parseGitAuthor(node.path("commit").path("author")));
	}

	private CommitRecord.@Nullable Account parseAccount(JsonNode node) {
		if (node.isMissingNode() || node.isNull() || node.isEmpty()) {
			return null;
		}
		return new CommitRecord.Account(node.path("login").asText(""), node.path("type").asText(""));
	}

	private CommitRecord.@Nullable GitAuthor parseGitAuthor(JsonNode node) {
		if (node.isMissingNode() || node.isNull() || node.isEmpty()) {
			return null;
		}
		return new CommitRecord.GitAuthor(text(node, "name"), text(node, "email"), text(node, "date"));
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.path(field);
		if (value.isMissingNode() || value.isNull()) {
			return CommitRecord.NOT_AVAILABLE;
		}
		return value.asText();
	}

}
