package org.springaicommunity.github.contributors.cli;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the CLI against a local HTTP server standing in for the GitHub API.
 */
@DisplayName("ContributorCountCli Tests")
class ContributorCountCliTest {

	@TempDir
	Path tempDir;

	private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

	private final PrintStream console = new PrintStream(buffer, true, StandardCharsets.UTF_8);

	private String output() {
		return buffer.toString(StandardCharsets.UTF_8);
	}

	@Nested
	@DisplayName("Argument handling")
	class ArgumentHandlingTest {

		@Test
		@DisplayName("Should print help and exit 0")
		void shouldPrintHelp() {
			int exitCode = ContributorCountCli.run(new String[] { "--help" }, console);

			assertThat(exitCode).isZero();
			assertThat(output()).startsWith("Usage: github-contributors REPO_FILE [OPTIONS]");
		}

		@Test
		@DisplayName("Should exit 1 when the repository file argument is missing")
		void shouldFailWithoutRepoFile() {
			int exitCode = ContributorCountCli.run(new String[0], console);

			assertThat(exitCode).isEqualTo(1);
			assertThat(output()).contains("Repository file is required").contains("--help");
		}

		@Test
		@DisplayName("Should exit 1 when the repository file cannot be read")
		void shouldFailForUnreadableRepoFile() {
			String missing = tempDir.resolve("missing.txt").toString();

			int exitCode = ContributorCountCli.run(new String[] { missing, "--token", "test" }, console);

			assertThat(exitCode).isEqualTo(1);
			assertThat(output()).contains("Cannot read repository file");
		}

	}

	@Nested
	@DisplayName("Full run")
	class FullRunTest {

		private HttpServer server;

		private String apiUrl;

		@BeforeEach
		void startServer() throws IOException {
			server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
			server.createContext("/repos/acme/app/commits", exchange -> {
				byte[] body = ("[" + commit("1", "alice", "User", "Alice", "alice@example.com", "2024-01-05T00:00:00Z")
						+ "," + commit("2", "renovate[bot]", "Bot", "renovate[bot]", "bot@renovateapp.com",
								"2024-01-04T00:00:00Z")
						+ "," + commit("3", "bob", "User", "Bob", "bob@example.com", "2024-01-03T00:00:00Z") + ","
						+ commit("4", "alice", "User", "Alice", "alice@example.com", "2024-01-02T00:00:00Z") + "]")
					.getBytes(StandardCharsets.UTF_8);
				exchange.sendResponseHeaders(200, body.length);
				try (OutputStream out = exchange.getResponseBody()) {
					out.write(body);
				}
			});
			server.start();
			apiUrl = "http://127.0.0.1:" + server.getAddress().getPort();
		}

		@AfterEach
		void stopServer() {
			server.stop(0);
		}

		private String commit(String sha, String login, String type, String name, String email, String date) {
			return "{\"sha\":\"" + sha + "\",\"author\":{\"login\":\"" + login + "\",\"type\":\"" + type
					+ "\"},\"commit\":{\"author\":{\"name\":\"" + name + "\",\"email\":\"" + email
					+ "\",\"date\":\"" + date + "\"}}}";
		}

		private String[] args(Path repoFile, Path csv) {
			return new String[] { repoFile.toString(), "--api-url", apiUrl, "--token", "test", "--days", "0", "-o",
					csv.toString(), "-p", "2" };
		}

		@Test
		@DisplayName("Should write the CSV and print the summary for a clean run")
		void shouldWriteReport() throws IOException {
			Path repoFile = Files.writeString(tempDir.resolve("repos.txt"), "acme/app\n");
			Path csv = tempDir.resolve("out/contributors.csv");

			int exitCode = ContributorCountCli.run(args(repoFile, csv), console);

			assertThat(exitCode).isZero();
			assertThat(Files.readAllLines(csv, StandardCharsets.UTF_8)).containsExactly(
					"Repository,Contributor Email,Contributor Name,Last Commit Timestamp",
					"acme/app,alice@example.com,Alice,2024-01-05T00:00:00Z",
					"acme/app,bob@example.com,Bob,2024-01-03T00:00:00Z");
			assertThat(output()).contains("Contributor Summary:")
				.contains("Detailed data written to " + csv)
				.doesNotContain("Process completed with errors or warnings");
		}

		@Test
		@DisplayName("Should still exit 0 but advise checking the logs when a repository fails")
		void shouldAdviseOnProblems() throws IOException {
			Path repoFile = Files.writeString(tempDir.resolve("repos.txt"), "acme/app\nacme/missing\nbroken\n");
			Path csv = tempDir.resolve("contributors.csv");

			int exitCode = ContributorCountCli.run(args(repoFile, csv), console);

			assertThat(exitCode).isZero();
			assertThat(Files.readAllLines(csv, StandardCharsets.UTF_8)).hasSize(3);
			assertThat(output())
				.contains("Process completed with errors or warnings. Check the logs for details.");
		}

	}

}
