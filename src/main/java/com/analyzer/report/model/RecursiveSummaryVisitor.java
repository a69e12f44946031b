package com.analyzer.report.model;

/**
 * Visits every node of a summary tree, depth-first and parents before children.
 *
 * Order: system libraries, then packages (and their libraries), then loose units.
 * Subclasses override the nodes they care about and call {@code super} to keep descending.
 */
public class RecursiveSummaryVisitor implements SummaryVisitor {

    @Override
    public void visit(GlobalSummary global) {
        for (LibrarySummary library : global.getSystem().values()) {
            library.accept(this);
        }
        for (PackageSummary pkg : global.getPackages().values()) {
            pkg.accept(this);
        }
        for (IndividualSummary unit : global.getLoose().values()) {
            unit.accept(this);
        }
    }

    @Override
    public void visit(PackageSummary pkg) {
        for (LibrarySummary library : pkg.getLibraries().values()) {
            library.accept(this);
        }
    }

    @Override
    public void visit(LibrarySummary library) {
        visitMessages(library);
    }

    @Override
    public void visit(HtmlSummary html) {
        visitMessages(html);
    }

    @Override
    public void visit(MessageSummary message) {
        // leaf
    }

    protected void visitMessages(IndividualSummary unit) {
        for (MessageSummary message : unit.getMessages()) {
            message.accept(this);
        }
    }
}
