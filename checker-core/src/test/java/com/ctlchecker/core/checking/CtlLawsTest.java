package com.ctlchecker.core.checking;

import com.ctlchecker.core.Fixtures;
import com.ctlchecker.core.graph.StronglyConnectedComponents;
import com.ctlchecker.core.model.KripkeStructure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static com.ctlchecker.core.checking.CtlChecker.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Algebraic laws that must hold on every structure, checked on the fixed fixtures plus a set
 * of seeded random graphs.
 */
class CtlLawsTest {

    static Stream<KripkeStructure> structures() {
        Stream<KripkeStructure> fixed = Stream.of(Fixtures.sevenStates(), Fixtures.ring(), new KripkeStructure());
        Stream<KripkeStructure> random = LongStream.range(1, 25)
            .mapToObj(seed -> Fixtures.random(seed, 3 + (int) (seed % 12)));
        return Stream.concat(fixed, random);
    }

    private static List<Set<String>> atomSets(KripkeStructure ks) {
        List<Set<String>> sets = new ArrayList<>();
        for (String atom : ks.atoms()) {
            sets.add(satAtom(ks, atom));
        }
        sets.add(truth(ks));
        sets.add(falsity());
        return sets;
    }

    @ParameterizedTest
    @MethodSource("structures")
    @DisplayName("double negation and idempotent connectives")
    void propositionalLaws(KripkeStructure ks) {
        for (Set<String> s : atomSets(ks)) {
            assertEquals(s, not(ks, not(ks, s)));
            assertEquals(s, and(s, s));
            assertEquals(s, or(s, s));
        }
    }

    @ParameterizedTest
    @MethodSource("structures")
    @DisplayName("ex() only contains states with a successor")
    void exNeedsSuccessor(KripkeStructure ks) {
        for (String state : ex(ks, truth(ks))) {
            assertFalse(ks.successors(state).isEmpty(), state);
        }
        for (String state : ks.stateNames()) {
            if (!ks.successors(state).isEmpty()) {
                assertTrue(ex(ks, truth(ks)).contains(state), state);
            }
        }
    }

    @ParameterizedTest
    @MethodSource("structures")
    @DisplayName("eu() is monotone in both arguments")
    void euMonotone(KripkeStructure ks) {
        List<Set<String>> sets = atomSets(ks);
        for (Set<String> left : sets) {
            for (Set<String> right : sets) {
                Set<String> base = eu(ks, left, right);
                for (Set<String> extra : sets) {
                    assertTrue(eu(ks, or(left, extra), right).containsAll(base));
                    assertTrue(eu(ks, left, or(right, extra)).containsAll(base));
                }
            }
        }
    }

    @ParameterizedTest
    @MethodSource("structures")
    @DisplayName("fixpoints are idempotent")
    void fixpointIdempotence(KripkeStructure ks) {
        for (Set<String> s : atomSets(ks)) {
            Set<String> globally = eg(ks, s);
            assertEquals(globally, eg(ks, globally));

            Set<String> until = eu(ks, truth(ks), s);
            assertEquals(until, eu(ks, truth(ks), until));
            Set<String> restricted = eu(ks, s, s);
            assertEquals(restricted, eu(ks, restricted, restricted));
        }
    }

    @ParameterizedTest
    @MethodSource("structures")
    @DisplayName("duality laws hold exactly")
    void duality(KripkeStructure ks) {
        for (Set<String> s : atomSets(ks)) {
            assertEquals(ag(ks, s), not(ks, ef(ks, not(ks, s))));
            assertEquals(af(ks, s), not(ks, eg(ks, not(ks, s))));
            assertEquals(ax(ks, s), not(ks, ex(ks, not(ks, s))));
            assertEquals(ef(ks, s), eu(ks, truth(ks), s));
        }
    }

    @ParameterizedTest
    @MethodSource("structures")
    @DisplayName("au() matches its expansion and implies af()")
    void allUntil(KripkeStructure ks) {
        List<Set<String>> sets = atomSets(ks);
        for (Set<String> left : sets) {
            for (Set<String> right : sets) {
                Set<String> expected = not(ks, or(
                    eu(ks, not(ks, right), and(not(ks, left), not(ks, right))),
                    eg(ks, not(ks, right))));
                Set<String> until = au(ks, left, right);
                assertEquals(expected, until);
                assertTrue(until.containsAll(right));
                assertTrue(af(ks, right).containsAll(until));
            }
        }
    }

    @ParameterizedTest
    @MethodSource("structures")
    @DisplayName("eg() agrees with the SCC characterisation")
    void egMatchesScc(KripkeStructure ks) {
        for (Set<String> s : atomSets(ks)) {
            assertEquals(egBySccs(ks, s), eg(ks, s));
        }
    }

    @ParameterizedTest
    @MethodSource("structures")
    @DisplayName("literal and incremental builds answer identically")
    void literalEqualsIncremental(KripkeStructure ks) {
        KripkeStructure literal = KripkeStructure.fromDefinition(ks.toDefinition());
        for (String atom : ks.atoms()) {
            assertEquals(satAtom(ks, atom), satAtom(literal, atom));
            assertEquals(eg(ks, satAtom(ks, atom)), eg(literal, satAtom(literal, atom)));
            assertEquals(af(ks, satAtom(ks, atom)), af(literal, satAtom(literal, atom)));
            assertEquals(au(ks, satAtom(ks, atom), ex(ks, satAtom(ks, atom))),
                au(literal, satAtom(literal, atom), ex(literal, satAtom(literal, atom))));
        }
    }

    /**
     * EG s via SCCs: restrict to s, keep every non-trivial component, then add the states of
     * the restriction that can reach one of them.
     */
    private static Set<String> egBySccs(KripkeStructure ks, Set<String> s) {
        KripkeStructure sub = ks.restrictTo(s);
        Set<String> result = new HashSet<>();
        for (Set<String> component : sub.stronglyConnectedComponents()) {
            if (StronglyConnectedComponents.isNonTrivial(component, sub::successors)) {
                result.addAll(component);
            }
        }
        Deque<String> pending = new ArrayDeque<>(result);
        while (!pending.isEmpty()) {
            for (String previous : sub.predecessors(pending.pop())) {
                if (result.add(previous)) {
                    pending.push(previous);
                }
            }
        }
        return result;
    }
}
