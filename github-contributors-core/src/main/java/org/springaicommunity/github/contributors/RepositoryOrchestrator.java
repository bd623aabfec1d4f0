package org.springaicommunity.github.contributors;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the walk-and-extract pipeline for many repositories concurrently and merges the
 * results.
 *
 * <p>
 * One task per repository is submitted to a fixed-size pool. Each task allocates its own
 * commit list, contributor map and {@link RepositoryDiagnostics}; nothing is shared
 * between tasks. The calling thread takes results in completion order and is the only
 * writer of the merged rows, counts and {@link RunDiagnostics}. A task that throws is
 * logged, recorded as a failure and left out of the report; its siblings are unaffected.
 */
public class RepositoryOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryOrchestrator.class);

	private final CommitWalker walker;

	private final ContributorExtractor extractor;

	private final int parallelism;

	public RepositoryOrchestrator(CommitWalker walker, ContributorExtractor extractor, int parallelism) {
		if (parallelism <= 0) {
			throw new IllegalArgumentException("Parallelism must be positive (got: " + parallelism + ")");
		}
		this.walker = walker;
		this.extractor = extractor;
		this.parallelism = parallelism;
	}

	public ContributorReport run(List<String> repositories, @Nullable String since) {
		return run(repositories, since, RepositoryCompletionListener.NONE);
	}

	/**
	 * Process every repository and merge the results.
	 * @param repositories {@code owner/name} coordinates
	 * @param since inclusive lower bound on commit dates (ISO-8601), or null
	 * @param listener notified once per finished repository
	 * @return the merged report; always returned, degraded by failed repositories
	 */
	public ContributorReport run(List<String> repositories, @Nullable String since,
			RepositoryCompletionListener listener) {
		logger.info("Processing {} repositories with {} workers", repositories.size(), parallelism);

		List<ContributorRow> rows = new ArrayList<>();
		Map<String, Integer> counts = new LinkedHashMap<>();
		RunDiagnostics runDiagnostics = new RunDiagnostics();
		if (repositories.isEmpty()) {
			return new ContributorReport(rows, counts, runDiagnostics);
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, repositories.size()),
				new WorkerThreadFactory());
		try {
			CompletionService<RepositoryResult> completionService = new ExecutorCompletionService<>(executor);
			Map<Future<RepositoryResult>, String> futureToRepository = new HashMap<>();
			for (String repository : repositories) {
				futureToRepository.put(completionService.submit(() -> processRepository(repository, since)),
						repository);
			}

			int total = repositories.size();
			for (int completed = 1; completed <= total; completed++) {
				Future<RepositoryResult> future = completionService.take();
				String repository = futureToRepository.get(future);
				try {
					RepositoryResult result = future.get();
					runDiagnostics.addAll(result.diagnostics());
					for (Contributor contributor : result.contributors()) {
						rows.add(ContributorRow.of(repository, contributor));
					}
					counts.put(repository, result.contributorCount());
					logger.info("Completed {} ({}/{}): {} commits, {} contributors", repository, completed, total,
							result.commitCount(), result.contributorCount());
				}
				catch (ExecutionException e) {
					Throwable cause = e.getCause() != null ? e.getCause() : e;
					logger.error("Error processing repository {}: {}", repository, cause.getMessage(), cause);
					runDiagnostics.recordFailure(repository,
							"Error processing repository " + repository + ": " + cause.getMessage());
				}
				listener.onRepositoryCompleted(repository, completed, total);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while waiting for repository jobs; returning partial results");
			for (String repository : repositories) {
				if (!counts.containsKey(repository) && !runDiagnostics.getFailedRepositories().contains(repository)) {
					runDiagnostics.recordFailure(repository, "Interrupted before " + repository + " completed");
				}
			}
		}
		finally {
			executor.shutdownNow();
		}

		logger.info("Processed {} repositories: {} contributor rows, {} failed", repositories.size(), rows.size(),
				runDiagnostics.getFailedRepositories().size());
		return new ContributorReport(rows, counts, runDiagnostics);
	}

	/**
	 * Walk and extract a single repository. Runs on a worker thread.
	 * @param repository {@code owner/name}
	 * @param since lower bound on commit dates, or null
	 * @return the repository's contributors and diagnostics
	 * @throws IllegalArgumentException if the coordinate is not {@code owner/name}
	 */
	RepositoryResult processRepository(String repository, @Nullable String since) {
		RepositoryId id = RepositoryId.parse(repository);
		RepositoryDiagnostics diagnostics = new RepositoryDiagnostics();
		diagnostics.info(repository, "Processing repository: " + repository);

		List<CommitRecord> commits = walker.walk(id, since, diagnostics);
		Map<String, Contributor> contributors = extractor.extract(repository, commits, diagnostics);

		return new RepositoryResult(repository, List.copyOf(contributors.values()), commits.size(),
				diagnostics.getDiagnostics());
	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger(0);

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "contributors-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
