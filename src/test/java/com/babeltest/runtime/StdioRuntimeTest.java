package com.babeltest.runtime;

import com.babeltest.core.ir.IrJson;
import com.babeltest.fixtures.FixtureRegistrar;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StdioRuntimeTest {

    private final ObjectMapper mapper = IrJson.newMapper();

    private List<JsonNode> serve(String... lines) throws IOException {
        var bytes = new ByteArrayOutputStream();
        var out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        var in = new BufferedReader(new StringReader(String.join("\n", lines) + "\n"));

        new StdioRuntime(FixtureRegistrar.registry(), mapper).serve(in, out);

        List<JsonNode> responses = new ArrayList<>();
        for (String line : bytes.toString(StandardCharsets.UTF_8).split("\n")) {
            if (!line.isBlank()) {
                responses.add(mapper.readTree(line));
            }
        }
        return responses;
    }

    @Test
    @DisplayName("answers one line per command")
    void runCommands() throws IOException {
        List<JsonNode> responses = serve(
                "{\"action\":\"run\",\"test\":{\"target\":\"math.add\",\"given\":{\"a\":2,\"b\":3},"
                        + "\"expect\":{\"type\":\"exact\",\"value\":5}},\"config\":{\"factories\":\"babel.factories\"}}",
                "{\"action\":\"run\",\"test\":{\"target\":\"math.add\",\"given\":{\"a\":2,\"b\":2},"
                        + "\"expect\":{\"value\":5}}}",
                "{\"action\":\"exit\"}");

        assertEquals(3, responses.size());
        assertEquals("passed", responses.get(0).get("status").asText());
        assertEquals(5, responses.get(0).get("actual").asInt());
        assertTrue(responses.get(0).has("duration_ms"));
        assertEquals("failed", responses.get(1).get("status").asText());
        assertEquals("Expected 5, got 4", responses.get(1).get("message").asText());
        assertEquals("ok", responses.get(2).get("status").asText());
    }

    @Test
    @DisplayName("lifecycle commands follow the configured instance lifecycle")
    void lifecycle() throws IOException {
        String increment = "{\"action\":\"run\",\"test\":{\"target\":\"state.Counter.increment\"}}";
        List<JsonNode> responses = serve(
                "{\"action\":\"lifecycle\",\"lifecycle\":\"suite_start\",\"data\":{\"name\":\"s\"},"
                        + "\"config\":{\"lifecycle\":\"per_suite\"}}",
                increment,
                increment,
                "{\"action\":\"lifecycle\",\"lifecycle\":\"suite_start\",\"data\":{\"name\":\"t\"}}",
                increment);

        assertEquals("ok", responses.get(0).get("status").asText());
        assertEquals(2, responses.get(2).get("actual").asInt());
        assertEquals(1, responses.get(4).get("actual").asInt());
    }

    @Test
    @DisplayName("malformed and unknown commands get error responses")
    void badCommands() throws IOException {
        List<JsonNode> responses = serve("not json", "{\"action\":\"dance\"}", "{\"action\":\"run\"}");

        assertEquals(3, responses.size());
        assertTrue(responses.get(0).get("message").asText().startsWith("Invalid command"));
        assertEquals("Unknown action: dance", responses.get(1).get("message").asText());
        assertEquals("run command without a test", responses.get(2).get("message").asText());
    }

    @Test
    @DisplayName("stops at end of input without exit")
    void endOfInput() throws IOException {
        assertTrue(serve("").isEmpty());
    }
}
