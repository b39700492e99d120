package com.babeltest.core.mock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Calls observed by spies during one test, keyed by canonical collaborator path.
 */
public class CallRecorder {

    private final Map<String, List<Map<String, Object>>> calls = new ConcurrentHashMap<>();

    public void record(String path, Map<String, Object> arguments) {
        calls.computeIfAbsent(path, p -> Collections.synchronizedList(new ArrayList<>()))
                .add(Collections.unmodifiableMap(new LinkedHashMap<>(arguments)));
    }

    public List<Map<String, Object>> calls(String path) {
        List<Map<String, Object>> recorded = calls.get(path);
        if (recorded == null) {
            return List.of();
        }
        synchronized (recorded) {
            return List.copyOf(recorded);
        }
    }

    public int count(String path) {
        return calls(path).size();
    }
}
