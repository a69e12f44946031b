package com.analyzer.report.reporter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.analyzer.report.identity.UnitIdentity;
import com.analyzer.report.identity.UnitIdentityResolver;
import com.analyzer.report.model.GlobalSummary;
import com.analyzer.report.model.HtmlSummary;
import com.analyzer.report.model.IndividualSummary;
import com.analyzer.report.model.LibrarySummary;
import com.analyzer.report.model.MessageSummary;
import com.analyzer.report.source.SourceFile;
import com.analyzer.report.source.SourceSpan;

import lombok.Getter;
import lombok.NonNull;

/**
 * A reporter that gathers all the information in a {@link GlobalSummary}.
 *
 * Not thread-safe: one analysis pass drives one reporter.
 */
public class SummaryReporter extends CompilerReporter {

    private static final Logger log = LoggerFactory.getLogger(SummaryReporter.class);

    @Getter
    private final ReporterConfig config;

    @Getter
    private GlobalSummary result = new GlobalSummary();

    private UnitHandle current;

    public SummaryReporter() {
        this(ReporterConfig.defaults());
    }

    public SummaryReporter(@NonNull ReporterConfig config) {
        this.config = config;
    }

    /**
     * Get-or-creates the library for {@code uri} in the container its scope selects and
     * returns a handle on it. Does not change the current unit.
     */
    public UnitHandle openLibrary(String uri) {
        return new UnitHandle(this, result, resolveLibrary(uri));
    }

    /**
     * Get-or-creates the loose HTML unit for {@code uri}. Does not change the current unit.
     */
    public UnitHandle openHtml(String uri) {
        return new UnitHandle(this, result, result.getOrCreateHtml(uri));
    }

    @Override
    public void enterLibrary(String uri) {
        enter(openLibrary(uri));
    }

    @Override
    public void leaveLibrary() {
        leave();
    }

    @Override
    public void enterHtml(String uri) {
        enter(openHtml(uri));
    }

    @Override
    public void leaveHtml() {
        leave();
    }

    /**
     * Also adds the unit's line count to the current library.
     */
    @Override
    public void enterCompilationUnit(SourceFile source) {
        super.enterCompilationUnit(source);
        if (current != null && source != null) {
            current.recordLineCount(source.getLineCount());
        }
    }

    /**
     * Adds {@code count} to the current library's lines. No-op when no library is entered.
     */
    @Override
    public void recordLineCount(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Line count must be >= 0. Got: " + count);
        }
        if (current != null) {
            current.recordLineCount(count);
        }
    }

    @Override
    public void log(Message message) {
        if (current != null) {
            current.log(message);
            return;
        }
        if (isFiltered(message)) {
            return;
        }
        if (config.getNoCurrentUnitPolicy() == NoCurrentUnitPolicy.FAIL) {
            throw new NoCurrentUnitException(message);
        }
        log.debug("Dropping [{}] message logged outside of any unit: {}", message.getKind(), message.getText());
    }

    @Override
    public void clearLibrary(String uri) {
        LibrarySummary library = resolveLibrary(uri);
        library.getMessages().clear();
        library.resetLines();
        log.debug("Cleared library {}", uri);
    }

    @Override
    public void clearHtml(String uri) {
        IndividualSummary unit = result.getLoose().get(uri);
        if (unit instanceof HtmlSummary html) {
            html.getMessages().clear();
            log.debug("Cleared HTML unit {}", uri);
        }
    }

    @Override
    public void clearAll() {
        current = null;
        result = new GlobalSummary();
        log.debug("Cleared all summaries");
    }

    public IndividualSummary getCurrentUnit() {
        return current == null ? null : current.getSummary();
    }

    void record(IndividualSummary target, Message message) {
        if (isFiltered(message)) {
            return;
        }
        SourceSpan span = current != null && current.getSummary() == target
                ? createSpan(message.getBegin(), message.getEnd(), target.getName())
                : SourceSpan.ofOffsets(target.getName(), message.getBegin(), message.getEnd());
        target.getMessages().add(new MessageSummary(
                message.getKind(), message.getLevel().displayName(), span, message.getText()));
    }

    void release(UnitHandle handle) {
        if (current == handle) {
            current = null;
        }
    }

    private boolean isFiltered(Message message) {
        return message.getLevel().isBelow(config.getMinimumLevel());
    }

    private void enter(UnitHandle handle) {
        if (current != null) {
            current.close();
        }
        current = handle;
        log.trace("Entered {}", handle.getSummary().getName());
    }

    private void leave() {
        if (current != null) {
            current.close();
        }
    }

    private LibrarySummary resolveLibrary(String uri) {
        UnitIdentity identity = UnitIdentityResolver.resolve(uri);
        return switch (identity.getScope()) {
            case SYSTEM -> result.getOrCreateSystemLibrary(identity.getId());
            case PACKAGE -> result.getOrCreatePackage(identity.getPackageName()).getOrCreateLibrary(identity.getId());
            case LOOSE -> result.getOrCreateLooseLibrary(identity.getId());
        };
    }
}
