package com.ctlchecker.loader.report;

import com.ctlchecker.core.checking.CtlChecker;
import com.ctlchecker.core.model.KripkeStructure;
import com.ctlchecker.loader.StructureIoException;
import com.ctlchecker.loader.config.LoaderConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns satisfaction sets into SAT / NOT SAT verdicts and renders them.
 *
 * <p>A structure satisfies a formula iff its start set is non-empty and contained in the
 * formula's satisfaction set ({@link CtlChecker#satisfies}). The reporter only reads the
 * structure and the set; it never evaluates CTL itself beyond the optional formula function
 * handed to {@link #check(KripkeStructure, String, Function)}.
 */
public class VerdictReporter {

    private static final Logger log = LoggerFactory.getLogger(VerdictReporter.class);

    private final LoaderConfig config;
    private final ObjectMapper objectMapper;

    public VerdictReporter(LoaderConfig config) {
        this.config = config;
        this.objectMapper = config.objectMapper();
    }

    /**
     * Evaluates {@code formula} against {@code ks} and reports on the result.
     *
     * @param description human-readable form of the formula, e.g. {@code "EX p"}
     * @param formula     composition of {@link CtlChecker} calls
     */
    public Verdict check(KripkeStructure ks, String description, Function<KripkeStructure, Set<String>> formula) {
        return verdict(ks, description, formula.apply(ks));
    }

    public Verdict verdict(KripkeStructure ks, String description, Set<String> sat) {
        boolean satisfied = CtlChecker.satisfies(ks, sat);
        List<String> failing = ks.starts().stream()
            .filter(start -> !sat.contains(start))
            .sorted()
            .collect(Collectors.toList());

        Verdict verdict = new Verdict(description, satisfied, sorted(sat), sorted(ks.starts()), failing);

        if (ks.starts().isEmpty()) {
            log.warn("Structure has no start states, formula cannot hold. formula={}", description);
        }
        log.info("Formula checked. formula={} verdict={} satisfying={} failingStarts={}",
            description, verdict.label(), sat.size(), failing.size());
        return verdict;
    }

    /** One line: {@code SAT     EX p  sat=[s1] starts=[s0]}, with long lists truncated. */
    public String render(Verdict verdict) {
        StringBuilder line = new StringBuilder()
            .append(String.format("%-8s", verdict.label()))
            .append(verdict.formula())
            .append("  sat=").append(abbreviate(verdict.satisfyingStates()))
            .append(" starts=").append(abbreviate(verdict.startStates()));
        if (!verdict.failingStarts().isEmpty()) {
            line.append(" failing=").append(abbreviate(verdict.failingStarts()));
        }
        return line.toString();
    }

    public String toJson(Verdict verdict) {
        try {
            return objectMapper.writeValueAsString(verdict);
        } catch (JsonProcessingException e) {
            throw new StructureIoException("verdict", "Failed to serialize verdict for " + verdict.formula(), e);
        }
    }

    // ── Helpers ────────────────────────────────────────────────────

    private String abbreviate(List<String> states) {
        int limit = config.maxListedStates();
        if (states.size() <= limit) {
            return states.toString();
        }
        String shown = String.join(", ", states.subList(0, limit));
        return "[" + shown + ", ... +" + (states.size() - limit) + " more]";
    }

    private static List<String> sorted(Collection<String> states) {
        return states.stream().sorted().collect(Collectors.toList());
    }
}
