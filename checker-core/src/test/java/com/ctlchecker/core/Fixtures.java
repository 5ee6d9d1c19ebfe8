package com.ctlchecker.core;

import com.ctlchecker.core.model.KripkeStructure;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Structures shared by the core tests.
 */
public final class Fixtures {

    private Fixtures() {}

    /**
     * Seven states over atoms a, b, c, d:
     * <pre>
     *   s1{a} → s2{a,b} → s3{b,c} → s4{b,c,d} → s7{d} → s5{b} ⇄ s6{c} → s7
     *                   ↘────────→ s4
     * </pre>
     */
    public static KripkeStructure sevenStates() {
        KripkeStructure ks = new KripkeStructure();
        ks.setAtoms(List.of("a", "b", "c", "d"));
        ks.addState("s1", List.of("a"));
        ks.addState("s2", List.of("a", "b"));
        ks.addState("s3", List.of("b", "c"));
        ks.addState("s4", List.of("b", "c", "d"));
        ks.addState("s5", List.of("b"));
        ks.addState("s6", List.of("c"));
        ks.addState("s7", List.of("d"));
        ks.setStarts(List.of("s1"));
        ks.addTransitions(Map.of(
            "s1", List.of("s2"),
            "s2", List.of("s3", "s4"),
            "s3", List.of("s4"),
            "s4", List.of("s7"),
            "s5", List.of("s6"),
            "s6", List.of("s7", "s5"),
            "s7", List.of("s5")));
        return ks;
    }

    /** s0{p} ⇄ s1{q}, start s0. */
    public static KripkeStructure ring() {
        KripkeStructure ks = new KripkeStructure();
        ks.setAtoms(List.of("p", "q"));
        ks.addState("s0", List.of("p"));
        ks.addState("s1", List.of("q"));
        ks.setStarts(List.of("s0"));
        ks.addTransition("s0", "s1");
        ks.addTransition("s1", "s0");
        return ks;
    }

    /**
     * Seeded random structure: {@code size} states over atoms p, q, r, each state with zero to
     * three successors, so deadlocks, self loops and duplicate edges all occur.
     */
    public static KripkeStructure random(long seed, int size) {
        Random random = new Random(seed);
        KripkeStructure ks = new KripkeStructure();
        ks.setAtoms(List.of("p", "q", "r"));
        List<String> names = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            String name = "n" + i;
            names.add(name);
            ks.addState(name, random.nextInt(8));
        }
        for (String from : names) {
            int degree = random.nextInt(4);
            for (int i = 0; i < degree; i++) {
                ks.addTransition(from, names.get(random.nextInt(size)));
            }
        }
        ks.setStarts(List.of(names.get(0)));
        return ks;
    }
}
