package com.babeltest.runtime;

/**
 * Keeps the last few kilobytes a child wrote to stderr, for crash diagnostics.
 */
class StderrTail {

    static final int DEFAULT_CAPACITY = 8 * 1024;

    private final int capacity;
    private final StringBuilder buffer = new StringBuilder();

    StderrTail() {
        this(DEFAULT_CAPACITY);
    }

    StderrTail(int capacity) {
        this.capacity = capacity;
    }

    synchronized void append(String line) {
        buffer.append(line).append('\n');
        if (buffer.length() > capacity) {
            buffer.delete(0, buffer.length() - capacity);
        }
    }

    synchronized String text() {
        return buffer.toString().strip();
    }

    synchronized void clear() {
        buffer.setLength(0);
    }
}
