package com.analyzer.report.reporter;

import com.analyzer.report.source.SourceFile;
import com.analyzer.report.source.SourceSpan;

/**
 * Lifecycle notifications sent by the compiler driver around checker messages.
 *
 * The driver enters a library or HTML file, optionally enters its compilation units, logs
 * messages and leaves again. The clear hooks are used when a unit is re-analyzed.
 */
public abstract class CompilerReporter implements CheckerReporter {

    private SourceFile unitSource;

    /** Called when starting to process a library. */
    public abstract void enterLibrary(String uri);

    public abstract void leaveLibrary();

    /** Called when starting to process an HTML source file. */
    public abstract void enterHtml(String uri);

    public abstract void leaveHtml();

    /**
     * Called when starting to process a compilation unit. All subsequent messages belong to this
     * source until the next call.
     */
    public void enterCompilationUnit(SourceFile source) {
        this.unitSource = source;
    }

    public void leaveCompilationUnit() {
        this.unitSource = null;
    }

    public abstract void clearLibrary(String uri);

    public abstract void clearHtml(String uri);

    public abstract void clearAll();

    protected SourceFile getUnitSource() {
        return unitSource;
    }

    /**
     * Adds {@code count} lines of code to the current unit. Reporters that do not count lines
     * ignore it.
     */
    public void recordLineCount(int count) {
    }

    /**
     * Span of {@code [begin, end)} in the current compilation unit. Outside a compilation unit
     * the span only carries the offsets and {@code fallbackUrl}.
     */
    protected SourceSpan createSpan(int begin, int end, String fallbackUrl) {
        return unitSource != null ? unitSource.span(begin, end) : SourceSpan.ofOffsets(fallbackUrl, begin, end);
    }
}
