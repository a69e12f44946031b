package com.analyzer.report.report;

public enum ReportFormat {
    TABLE,
    CSV
}
