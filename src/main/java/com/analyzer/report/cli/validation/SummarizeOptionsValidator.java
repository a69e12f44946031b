package com.analyzer.report.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.analyzer.report.cli.exception.OptionsValidationException;
import com.analyzer.report.cli.model.SummarizeOptions;
import com.analyzer.report.cli.model.ValidatedSummarizeOptions;
import com.analyzer.report.report.ReportFormat;
import com.analyzer.report.reporter.Level;
import com.analyzer.report.reporter.NoCurrentUnitPolicy;
import com.analyzer.report.reporter.ReporterConfig;

public class SummarizeOptionsValidator {

	public ValidatedSummarizeOptions validate(SummarizeOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> logFiles = o.getLogFiles() == null ? List.of() : o.getLogFiles();
		if (logFiles.isEmpty()) {
			errors.add("At least one diagnostics log file is required.");
		}
		for (Path logFile : logFiles) {
			if (!Files.isRegularFile(logFile)) {
				errors.add("Diagnostics log does not exist or is not a file: " + logFile);
			} else if (!Files.isReadable(logFile)) {
				errors.add("Diagnostics log is not readable: " + logFile);
			}
		}

		Optional<Level> level = Level.parse(o.getMinimumLevel());
		if (level.isEmpty()) {
			errors.add("Unknown level for --min-level: " + o.getMinimumLevel());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ReporterConfig config = ReporterConfig.builder()
				.minimumLevel(level.get())
				.noCurrentUnitPolicy(o.getNoCurrentUnitPolicy() == null ? NoCurrentUnitPolicy.FAIL : o.getNoCurrentUnitPolicy())
				.build();

		ReportFormat format = o.getFormat() == null ? ReportFormat.TABLE : o.getFormat();

		return new ValidatedSummarizeOptions(config, List.copyOf(logFiles), format, o.isFailOnReplayErrors());
	}
}
