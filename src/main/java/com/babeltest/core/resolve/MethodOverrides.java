package com.babeltest.core.resolve;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-method override table consulted by every collaborator proxy handed out by the
 * {@link InstanceRegistry}. An installed interceptor affects all instances of the type
 * until its registration is closed.
 *
 * <p>The most recently installed interceptor runs first.
 */
public class MethodOverrides {

    private final Map<String, CopyOnWriteArrayList<Entry>> table = new ConcurrentHashMap<>();

    public static String key(String owner, String member) {
        return owner + "#" + member;
    }

    public Registration install(String key, CallInterceptor interceptor) {
        Entry entry = new Entry(interceptor);
        table.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(0, entry);
        return () -> {
            List<Entry> entries = table.get(key);
            if (entries != null) {
                entries.remove(entry);
            }
        };
    }

    public boolean isOverridden(String key) {
        List<Entry> entries = table.get(key);
        return entries != null && !entries.isEmpty();
    }

    /**
     * Runs the call through the installed interceptors, ending at {@code terminal}.
     */
    public Object call(String key, Map<String, Object> arguments, Invocable terminal) throws Exception {
        List<Entry> entries = table.get(key);
        if (entries == null || entries.isEmpty()) {
            return terminal.invoke(arguments);
        }
        List<CallInterceptor> chain = entries.stream().map(Entry::interceptor).toList();
        return chain.get(0).intercept(new InterceptedCall(key, arguments, chain, 0, terminal));
    }

    /**
     * Handle removing one installed interceptor. Closing twice is harmless.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    // Identity wrapper so the same interceptor can be installed twice and removed once.
    private static final class Entry {
        private final CallInterceptor interceptor;

        Entry(CallInterceptor interceptor) {
            this.interceptor = interceptor;
        }

        CallInterceptor interceptor() {
            return interceptor;
        }
    }
}
