package com.analyzer.report.reporter;

import com.analyzer.report.source.SourceSpan;

import lombok.NonNull;

/**
 * Simple reporter that forwards checker messages to a {@link MessageSink} as they are seen.
 * Nothing is aggregated, so the lifecycle calls are ignored.
 */
public class LogReporter extends CompilerReporter {

    private final MessageSink sink;

    public LogReporter() {
        this(new Slf4jMessageSink());
    }

    public LogReporter(@NonNull MessageSink sink) {
        this.sink = sink;
    }

    @Override
    public void log(Message message) {
        String url = getUnitSource() != null ? getUnitSource().getUrl() : "";
        SourceSpan span = createSpan(message.getBegin(), message.getEnd(), url);
        sink.emit(message.getLevel(), span.message("[" + message.getKind() + "] " + message.getText()));
    }

    @Override
    public void enterLibrary(String uri) {
    }

    @Override
    public void leaveLibrary() {
    }

    @Override
    public void enterHtml(String uri) {
    }

    @Override
    public void leaveHtml() {
    }

    @Override
    public void clearLibrary(String uri) {
    }

    @Override
    public void clearHtml(String uri) {
    }

    @Override
    public void clearAll() {
    }
}
