package com.babeltest.core.ir;

import com.babeltest.core.model.IrDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads persisted IR documents (JSON) into {@link IrDocument}s.
 */
public class IrLoader {

    private static final Logger log = LoggerFactory.getLogger(IrLoader.class);

    private final ObjectMapper objectMapper;

    public IrLoader() {
        this(IrJson.newMapper());
    }

    public IrLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public IrDocument load(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (NoSuchFileException e) {
            throw new IrLoadException("IR file not found: " + file);
        } catch (IOException e) {
            throw new IrLoadException("Cannot read IR file " + file + ": " + e.getMessage(), e);
        }
        IrDocument document = parse(json, file.toString());
        log.debug("Loaded IR {} (version {}, {} test(s))", file, document.version(), document.testCount());
        return document;
    }

    public IrDocument parse(String json) {
        return parse(json, "<string>");
    }

    private IrDocument parse(String json, String source) {
        if (json == null || json.isBlank()) {
            throw new IrLoadException("IR document " + source + " is empty");
        }
        try {
            IrDocument document = objectMapper.readValue(json, IrDocument.class);
            if (document == null) {
                throw new IrLoadException("IR document " + source + " is empty");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new IrLoadException("Invalid IR document " + source + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            // enum creators reject unknown wire names this way
            throw new IrLoadException("Invalid IR document " + source + ": " + e.getMessage(), e);
        }
    }

    public String write(IrDocument document) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IrLoadException("Cannot serialize IR document: " + e.getOriginalMessage(), e);
        }
    }
}
