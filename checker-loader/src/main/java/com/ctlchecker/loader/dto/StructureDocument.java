package com.ctlchecker.loader.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Raw JSON shape of a structure document, before labels are resolved.
 *
 * <p>A state label is kept as a {@link JsonNode} because the document may give it either as
 * an integer bitmask ({@code "s1": 5}) or as a list of atom names ({@code "s1": ["a", "c"]}).
 * Capitalised field names are accepted as aliases.
 */
@Data
@NoArgsConstructor
public class StructureDocument {

    @JsonAlias("Atoms")
    private List<String> atoms;

    @JsonAlias("States")
    private Map<String, JsonNode> states;

    @JsonAlias("Starts")
    private List<String> starts;

    @JsonAlias("Trans")
    private Map<String, List<String>> trans;
}
