package com.babeltest.core.diagnostics;

/**
 * Thrown when no factory or constructor can produce a receiver instance.
 */
public class ConstructionException extends BabelTestException {

    private final transient DiagnosticContext context;

    public ConstructionException(String summary, DiagnosticContext context) {
        super(context != null ? context.format(summary) : summary);
        this.context = context;
    }

    public ConstructionException(String summary, DiagnosticContext context, Throwable cause) {
        super(context != null ? context.format(summary) : summary, cause);
        this.context = context;
    }

    public DiagnosticContext context() {
        return context;
    }
}
