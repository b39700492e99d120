package com.babeltest.core.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the diagnostic trail of a resolution or construction attempt:
 * every location tried, why it failed, and remediation suggestions.
 */
public class DiagnosticContext {

    private final String target;
    private final List<SearchAttempt> searches = new ArrayList<>();
    private final List<String> suggestions = new ArrayList<>();

    public DiagnosticContext(String target) {
        this.target = target;
    }

    public String target() {
        return target;
    }

    public DiagnosticContext found(String location) {
        searches.add(new SearchAttempt(location, true, null));
        return this;
    }

    public DiagnosticContext missed(String location, String reason) {
        searches.add(new SearchAttempt(location, false, reason));
        return this;
    }

    public DiagnosticContext suggest(String suggestion) {
        if (!suggestions.contains(suggestion)) {
            suggestions.add(suggestion);
        }
        return this;
    }

    /** Appends another context's trail, e.g. the construction trail of a type met during resolution. */
    public DiagnosticContext merge(DiagnosticContext other) {
        if (other != null && other != this) {
            searches.addAll(other.searches);
            other.suggestions.forEach(this::suggest);
        }
        return this;
    }

    public List<SearchAttempt> searches() {
        return Collections.unmodifiableList(searches);
    }

    public List<String> suggestions() {
        return Collections.unmodifiableList(suggestions);
    }

    /**
     * Formats the summary followed by the search trail and numbered suggestions.
     */
    public String format(String summary) {
        var sb = new StringBuilder(summary);
        if (!searches.isEmpty()) {
            sb.append("\n\nSearched:");
            for (SearchAttempt attempt : searches) {
                sb.append("\n  ").append(attempt.found() ? "+ " : "x ").append(attempt.location());
                if (attempt.reason() != null) {
                    sb.append(" (").append(attempt.reason()).append(')');
                }
            }
        }
        if (!suggestions.isEmpty()) {
            sb.append("\n\nSuggestions:");
            for (int i = 0; i < suggestions.size(); i++) {
                sb.append("\n  ").append(i + 1).append(". ").append(suggestions.get(i));
            }
        }
        return sb.toString();
    }
}
