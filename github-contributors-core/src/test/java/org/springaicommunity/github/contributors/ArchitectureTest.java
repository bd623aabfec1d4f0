package org.springaicommunity.github.contributors;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for GitHub API</li>
 * <li>{@link DiagnosticSink} - Per-job event reporting</li>
 * <li>{@link ReportWriter} - Report persistence</li>
 * <li>{@link Sleeper} - Waiting for rate limit resets and backoff</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Pipeline (fetcher, walker, extractor, orchestrator) → GitHubClient (NOT GitHubHttpClient)
 *   Pipeline → DiagnosticSink (NOT RunDiagnostics)
 *   Only ContributorCountBuilder wires concrete implementations
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.contributors",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule pipeline_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Fetcher")
		.or()
		.haveSimpleNameEndingWith("Walker")
		.or()
		.haveSimpleNameEndingWith("Extractor")
		.or()
		.haveSimpleNameEndingWith("Orchestrator")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("The pipeline should depend on the GitHubClient interface, not the concrete GitHubHttpClient");

	@ArchTest
	static final ArchRule pipeline_steps_should_report_through_sink = noClasses().that()
		.haveSimpleNameEndingWith("Fetcher")
		.or()
		.haveSimpleNameEndingWith("Walker")
		.or()
		.haveSimpleNameEndingWith("Extractor")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("RunDiagnostics")
		.because("Pipeline steps report to a per-job DiagnosticSink; only the orchestrator merges run state");

	@ArchTest
	static final ArchRule pipeline_should_not_write_reports = noClasses().that()
		.haveSimpleNameEndingWith("Orchestrator")
		.or()
		.haveSimpleNameEndingWith("Walker")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("CsvReportWriter")
		.because("Collecting contributors is independent of how the report is written");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule github_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("GitHubClient")
		.and()
		.doNotHaveSimpleName("GitHubClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *GitHubClient classes should implement the GitHubClient interface");

	@ArchTest
	static final ArchRule report_writers_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("ReportWriter")
		.and()
		.doNotHaveSimpleName("ReportWriter")
		.should()
		.implement(ReportWriter.class)
		.because("All *ReportWriter classes should implement the ReportWriter interface");

	@ArchTest
	static final ArchRule diagnostics_should_implement_sink = classes().that()
		.haveSimpleName("RepositoryDiagnostics")
		.should()
		.implement(DiagnosticSink.class)
		.because("Per-job diagnostics are handed to pipeline steps as a DiagnosticSink");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_pipeline = noClasses().that()
		.haveSimpleNameEndingWith("Record")
		.or()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("Row")
		.or()
		.haveSimpleNameEndingWith("Page")
		.or()
		.haveSimpleName("Contributor")
		.or()
		.haveSimpleName("RepositoryId")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Fetcher")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Walker")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Orchestrator")
		.because("Model classes should be pure data without pipeline dependencies");

	@ArchTest
	static final ArchRule parsers_should_not_depend_on_pipeline = noClasses().that()
		.haveSimpleNameEndingWith("Parser")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Fetcher")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Orchestrator")
		.because("Parsers are lower-level than the pipeline that uses them");

	// ========== Builder/Configuration Rules ==========

	@ArchTest
	static final ArchRule only_builder_should_instantiate_http_client = noClasses().that()
		.doNotHaveSimpleName("ContributorCountBuilder")
		.and()
		.doNotHaveSimpleName("GitHubHttpClient")
		.and()
		.doNotHaveSimpleName("ContributorCountProperties")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Only ContributorCountBuilder should create the concrete HTTP client");

}
