package com.babeltest.core.model;

/**
 * Output captured from one stream while a test ran.
 *
 * @param stream {@code stdout} or {@code stderr}
 * @param text   everything written to the stream
 */
public record OutputBlock(
    String stream,
    String text
) {
    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";

    /** Rendered form used in console reports, e.g. {@code [stdout]\nhello}. */
    public String render() {
        return "[" + stream + "]\n" + text;
    }
}
