package com.babeltest.core.resolve;

import java.util.List;
import java.util.Map;

/**
 * One call flowing through the interceptor chain of a {@link MethodOverrides} entry.
 * {@link #proceed()} hands the call to the next interceptor, or to the real method.
 */
public final class InterceptedCall {

    private final String location;
    private final Map<String, Object> arguments;
    private final List<CallInterceptor> chain;
    private final int position;
    private final Invocable terminal;

    InterceptedCall(String location, Map<String, Object> arguments,
                    List<CallInterceptor> chain, int position, Invocable terminal) {
        this.location = location;
        this.arguments = arguments;
        this.chain = chain;
        this.position = position;
        this.terminal = terminal;
    }

    /** {@code owner#member}, see {@link MethodOverrides#key(String, String)}. */
    public String location() {
        return location;
    }

    public Map<String, Object> arguments() {
        return arguments;
    }

    public Object proceed() throws Exception {
        if (position + 1 < chain.size()) {
            return chain.get(position + 1)
                    .intercept(new InterceptedCall(location, arguments, chain, position + 1, terminal));
        }
        return terminal.invoke(arguments);
    }
}
