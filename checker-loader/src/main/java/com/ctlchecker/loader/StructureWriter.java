package com.ctlchecker.loader;

import com.ctlchecker.core.model.KripkeStructure;
import com.ctlchecker.loader.config.LoaderConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a structure to the JSON literal form read by {@link StructureLoader}.
 * Labels are always written as integer bitmasks.
 */
public class StructureWriter {

    private static final Logger log = LoggerFactory.getLogger(StructureWriter.class);

    private final ObjectMapper objectMapper;

    public StructureWriter(LoaderConfig config) {
        this.objectMapper = config.objectMapper();
    }

    public String toJson(KripkeStructure ks) {
        try {
            return objectMapper.writeValueAsString(ks.toDefinition());
        } catch (JsonProcessingException e) {
            throw new StructureIoException("inline", "Failed to serialize structure", e);
        }
    }

    public void write(KripkeStructure ks, Path path) {
        try {
            Files.writeString(path, toJson(ks), StandardCharsets.UTF_8);
            log.info("Structure written. path={} states={}", path, ks.size());
        } catch (IOException e) {
            throw new StructureIoException(path.toString(), "Failed to write structure document", e);
        }
    }
}
