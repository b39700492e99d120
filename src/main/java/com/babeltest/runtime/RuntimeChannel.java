package com.babeltest.runtime;

/**
 * Half-duplex request/response link to a child runtime: one outstanding command at a time.
 */
public interface RuntimeChannel extends AutoCloseable {

    /**
     * Sends one command and waits for its response line.
     *
     * @throws ProtocolException        when the child crashed, timed out or answered garbage
     * @throws RuntimeStartupException  when the child cannot be launched
     */
    RuntimeResponse send(RuntimeCommand command);

    /** Asks the child to exit, then terminates it. Repeated calls are no-ops. */
    @Override
    void close();
}
