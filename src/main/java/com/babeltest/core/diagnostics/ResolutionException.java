package com.babeltest.core.diagnostics;

/**
 * Thrown when a dotted target path cannot be navigated to an invocable.
 * The message includes the full diagnostic trail.
 */
public class ResolutionException extends BabelTestException {

    private final transient DiagnosticContext context;

    public ResolutionException(String summary, DiagnosticContext context) {
        super(context != null ? context.format(summary) : summary);
        this.context = context;
    }

    public DiagnosticContext context() {
        return context;
    }
}
