package com.analyzer.report.model;

/**
 * Visitor pattern interface for traversing a summary tree.
 */
public interface SummaryVisitor {
    void visit(GlobalSummary global);
    void visit(PackageSummary pkg);
    void visit(LibrarySummary library);
    void visit(HtmlSummary html);
    void visit(MessageSummary message);
}
