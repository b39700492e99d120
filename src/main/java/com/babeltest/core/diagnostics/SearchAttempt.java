package com.babeltest.core.diagnostics;

/**
 * One place that was searched while resolving a target or constructing an instance.
 *
 * @param location what was searched (module path, factory class, constructor, ...)
 * @param found    whether the search succeeded
 * @param reason   why it failed; {@code null} on success
 */
public record SearchAttempt(
    String location,
    boolean found,
    String reason
) {}
