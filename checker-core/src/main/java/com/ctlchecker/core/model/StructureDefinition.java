package com.ctlchecker.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Literal form of a Kripke structure: everything needed to build one in a single call.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code atoms}: atom names; atom {@code i} is bit {@code i} of every label</li>
 *   <li>{@code states}: state name → label bitmask, in declaration order</li>
 *   <li>{@code starts}: start state names</li>
 *   <li>{@code trans}: source state → ordered destination names</li>
 * </ul>
 *
 * <p>Missing fields are treated as empty. This record is pure data; validation happens in
 * {@link KripkeStructure#fromDefinition(StructureDefinition)}.
 */
@JsonPropertyOrder({"atoms", "states", "starts", "trans"})
public record StructureDefinition(
    @JsonProperty("atoms") List<String> atoms,
    @JsonProperty("states") Map<String, Long> states,
    @JsonProperty("starts") List<String> starts,
    @JsonProperty("trans") Map<String, List<String>> trans
) {
    public StructureDefinition {
        atoms = atoms == null ? List.of() : List.copyOf(atoms);
        states = states == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(states));
        starts = starts == null ? List.of() : List.copyOf(starts);
        trans = trans == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(trans));
    }
}
