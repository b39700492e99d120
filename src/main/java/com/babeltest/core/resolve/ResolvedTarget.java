package com.babeltest.core.resolve;

/**
 * Outcome of resolving a dotted target.
 *
 * @param receiver   the module, class or instance the method belongs to
 * @param methodName Java name of the function or method
 * @param invocable  callable bound to the receiver
 */
public record ResolvedTarget(Object receiver, String methodName, Invocable invocable) {}
