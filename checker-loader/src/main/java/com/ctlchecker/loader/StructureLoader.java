package com.ctlchecker.loader;

import com.ctlchecker.core.model.KripkeStructure;
import com.ctlchecker.core.model.StructureDefinition;
import com.ctlchecker.loader.config.LoaderConfig;
import com.ctlchecker.loader.dto.StructureDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link KripkeStructure} from its JSON literal form.
 *
 * <pre>
 * {
 *   "atoms":  ["p", "q"],
 *   "states": {"s0": ["p"], "s1": 2},
 *   "starts": ["s0"],
 *   "trans":  {"s0": ["s1"], "s1": ["s0"]}
 * }
 * </pre>
 *
 * <p>A label is an integer bitmask or a list of atom names. In the integer form the first
 * declared atom is the least significant bit: with atoms {@code ["a", "b", "c", "d"]} the label
 * {@code 1} is {@code {a}} and {@code 8} is {@code {d}}. Documents that put the first atom in the
 * most significant bit must be converted, or written with atom-name labels. Labels are unsigned
 * 64-bit values; with 64 atoms a label with the top bit set may be given either unsigned
 * ({@code 18446744073709551615}) or as its signed {@code long} equivalent ({@code -1}).
 *
 * <p>Document shape problems raise {@link StructureIoException}; invariant violations in an
 * otherwise well-formed document raise
 * {@link com.ctlchecker.core.exception.KripkeStructureException} unchanged.
 */
public class StructureLoader {

    private static final Logger log = LoggerFactory.getLogger(StructureLoader.class);

    private final ObjectMapper objectMapper;

    public StructureLoader(LoaderConfig config) {
        this.objectMapper = config.objectMapper();
    }

    public KripkeStructure fromJson(String json) {
        try {
            return build(objectMapper.readValue(json, StructureDocument.class), "inline");
        } catch (JsonProcessingException e) {
            throw new StructureIoException("inline", "Malformed structure document: " + e.getOriginalMessage(), e);
        }
    }

    public KripkeStructure fromStream(InputStream in, String source) {
        try {
            return build(objectMapper.readValue(in, StructureDocument.class), source);
        } catch (IOException e) {
            throw new StructureIoException(source, "Failed to read structure document", e);
        }
    }

    public KripkeStructure fromPath(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromStream(in, path.toString());
        } catch (IOException e) {
            throw new StructureIoException(path.toString(), "Failed to open structure document", e);
        }
    }

    public KripkeStructure fromResource(String resource) {
        try (InputStream in = StructureLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new StructureIoException(resource, "Classpath resource not found");
            }
            return fromStream(in, resource);
        } catch (IOException e) {
            throw new StructureIoException(resource, "Failed to close classpath resource", e);
        }
    }

    // ── Document → structure ───────────────────────────────────────

    private KripkeStructure build(StructureDocument document, String source) {
        if (document == null) {
            throw new StructureIoException(source, "Structure document is empty");
        }
        List<String> atoms = document.getAtoms() == null ? List.of() : document.getAtoms();
        requireNoNulls(atoms, "atoms", source);
        if (document.getStarts() != null) {
            requireNoNulls(document.getStarts(), "starts", source);
        }
        if (document.getTrans() != null) {
            document.getTrans().forEach((from, targets) -> {
                if (targets == null) {
                    throw new StructureIoException(source, "Transitions of state " + from + " must be an array, got null");
                }
                requireNoNulls(targets, "trans of state " + from, source);
            });
        }

        // Resolves atom-name labels against the declared atoms.
        KripkeStructure atomTable = new KripkeStructure();
        atomTable.setAtoms(atoms);

        Map<String, Long> labels = new LinkedHashMap<>();
        if (document.getStates() != null) {
            document.getStates().forEach((state, node) -> labels.put(state, resolveLabel(atomTable, state, node, source)));
        }

        KripkeStructure ks = KripkeStructure.fromDefinition(new StructureDefinition(
            atoms, labels, document.getStarts(), document.getTrans()));

        log.info("Structure loaded. source={} atoms={} states={} starts={}",
            source, ks.atoms().size(), ks.size(), ks.starts().size());
        return ks;
    }

    private long resolveLabel(KripkeStructure atomTable, String state, JsonNode node, String source) {
        if (node != null && node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node != null && node.isBigInteger()
                && node.bigIntegerValue().signum() > 0 && node.bigIntegerValue().bitLength() <= Long.SIZE) {
            return node.bigIntegerValue().longValue();
        }
        if (node != null && node.isArray()) {
            List<String> names = new ArrayList<>();
            for (JsonNode element : node) {
                if (!element.isTextual()) {
                    throw new StructureIoException(source,
                        "Label of state " + state + " lists a non-string atom: " + element);
                }
                names.add(element.textValue());
            }
            return atomTable.labelFor(names);
        }
        throw new StructureIoException(source,
            "Label of state " + state + " must be an integer below 2^64 or an array of atom names, got: " + node);
    }

    private static void requireNoNulls(List<String> names, String field, String source) {
        if (names.contains(null)) {
            throw new StructureIoException(source, "Field " + field + " lists a null name: " + names);
        }
    }
}
