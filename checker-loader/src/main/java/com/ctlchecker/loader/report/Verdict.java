package com.ctlchecker.loader.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of checking one formula against a structure.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code formula}: caller-supplied description of the formula</li>
 *   <li>{@code satisfied}: true iff the start set is non-empty and inside the satisfaction set</li>
 *   <li>{@code satisfyingStates}: the satisfaction set, sorted</li>
 *   <li>{@code startStates}: the structure's start states, sorted</li>
 *   <li>{@code failingStarts}: start states outside the satisfaction set, sorted</li>
 * </ul>
 */
public record Verdict(
    @JsonProperty("formula") String formula,
    @JsonProperty("satisfied") boolean satisfied,
    @JsonProperty("satisfyingStates") List<String> satisfyingStates,
    @JsonProperty("startStates") List<String> startStates,
    @JsonProperty("failingStarts") List<String> failingStarts
) {
    @JsonIgnore
    public String label() {
        return satisfied ? "SAT" : "NOT SAT";
    }
}
