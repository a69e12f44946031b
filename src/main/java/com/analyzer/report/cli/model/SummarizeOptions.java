package com.analyzer.report.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.analyzer.report.report.ReportFormat;
import com.analyzer.report.reporter.NoCurrentUnitPolicy;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the summarize command. No validation, no execution logic, no
 * printing.
 */
@Getter
public class SummarizeOptions {

	@Parameters(arity = "1..*", paramLabel = "LOG", description = "Diagnostics log files to replay")
	private List<Path> logFiles = new ArrayList<>();

	@Option(names = { "--format" }, defaultValue = "TABLE", description = "Report format: TABLE or CSV")
	private ReportFormat format;

	@Option(names = { "--min-level",
			"-l" }, defaultValue = "ALL", description = "Messages below this level are not summarized (ALL, FINEST ... SHOUT)")
	private String minimumLevel;

	@Option(names = {
			"--on-orphan-message" }, defaultValue = "FAIL", description = "Messages logged outside any unit: FAIL or DROP")
	private NoCurrentUnitPolicy noCurrentUnitPolicy;

	@Option(names = {
			"--fail-on-replay-errors" }, description = "Exit with code 1 when a log line could not be replayed")
	private boolean failOnReplayErrors;

}
