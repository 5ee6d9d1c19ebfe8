package com.ctlchecker.core.checking;

import com.ctlchecker.core.model.KripkeStructure;

import java.util.HashSet;
import java.util.Set;

/**
 * Explicit-state CTL satisfaction engine.
 *
 * <p>Every operator takes a {@link KripkeStructure} plus zero, one or two satisfaction sets
 * (sets of state names) and returns a <strong>new</strong> satisfaction set. Formulas are
 * built by nesting calls:
 * <pre>
 *     Set&lt;String&gt; sat = CtlChecker.ex(ks, CtlChecker.and(
 *         CtlChecker.satAtom(ks, "p"),
 *         CtlChecker.ex(ks, CtlChecker.satAtom(ks, "q"))));
 * </pre>
 *
 * <h3>Operators</h3>
 * <ul>
 *   <li><b>Primitive</b>: {@link #ex}, {@link #eu} (least fixpoint), {@link #eg} (greatest fixpoint)</li>
 *   <li><b>Derived</b>: {@link #ef}, {@link #ax}, {@link #ag}, {@link #af}, {@link #au},
 *       each a fixed composition of the primitives and the connectives</li>
 * </ul>
 *
 * <p>Neither the structure nor the argument sets are ever modified. There is no state between
 * calls, so independent sub-formulas can be evaluated on different threads against the same
 * structure.
 */
public final class CtlChecker {

    private CtlChecker() { /* utility class */ }

    // ── Atomic propositions ────────────────────────────────────────

    /**
     * States whose label has the bit of {@code atom} set.
     *
     * @throws com.ctlchecker.core.exception.KripkeStructureException {@code UNKNOWN_ATOM}
     *         if the atom was never registered
     */
    public static Set<String> satAtom(KripkeStructure ks, String atom) {
        long mask = ks.atomMask(atom);
        Set<String> sat = new HashSet<>();
        ks.labels().forEach((state, label) -> {
            if ((label & mask) != 0) {
                sat.add(state);
            }
        });
        return sat;
    }

    /** Every state of the structure. */
    public static Set<String> truth(KripkeStructure ks) {
        return new HashSet<>(ks.stateNames());
    }

    /** The empty set. */
    public static Set<String> falsity() {
        return new HashSet<>();
    }

    // ── Propositional connectives ──────────────────────────────────

    /** Complement with respect to all states of {@code ks}. */
    public static Set<String> not(KripkeStructure ks, Set<String> sat) {
        Set<String> result = truth(ks);
        result.removeAll(sat);
        return result;
    }

    public static Set<String> and(Set<String> left, Set<String> right) {
        Set<String> result = new HashSet<>(left);
        result.retainAll(right);
        return result;
    }

    public static Set<String> or(Set<String> left, Set<String> right) {
        Set<String> result = new HashSet<>(left);
        result.addAll(right);
        return result;
    }

    /** {@code NOT(left) OR right}. */
    public static Set<String> implies(KripkeStructure ks, Set<String> left, Set<String> right) {
        return or(not(ks, left), right);
    }

    /** {@code (left AND right) OR (NOT left AND NOT right)}. */
    public static Set<String> iff(KripkeStructure ks, Set<String> left, Set<String> right) {
        return or(and(left, right), and(not(ks, left), not(ks, right)));
    }

    // ── Primitive temporal operators ───────────────────────────────

    /**
     * EX: states with at least one direct successor in {@code sat}. A deadlock state is never
     * included.
     */
    public static Set<String> ex(KripkeStructure ks, Set<String> sat) {
        Set<String> result = new HashSet<>();
        for (String state : ks.stateNames()) {
            for (String successor : ks.successors(state)) {
                if (sat.contains(successor)) {
                    result.add(state);
                    break;
                }
            }
        }
        return result;
    }

    /**
     * E[left U right]: states from which some finite path stays in {@code left} until it
     * reaches {@code right}.
     *
     * <p>Least fixpoint of {@code R0 = right}, {@code Rn+1 = Rn ∪ (left ∩ EX(Rn))}. The sequence
     * only grows and is bounded by the state set, so it stops after at most {@code |states|}
     * rounds.
     */
    public static Set<String> eu(KripkeStructure ks, Set<String> left, Set<String> right) {
        Set<String> current = new HashSet<>(right);
        while (true) {
            Set<String> next = or(current, and(left, ex(ks, current)));
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    /**
     * EG: states from which some infinite path stays in {@code sat} forever.
     *
     * <p>Greatest fixpoint of {@code R0 = sat}, {@code Rn+1 = Rn ∩ EX(Rn)}: each round drops the
     * states left without a successor inside the current set, so deadlock states go in the
     * first round that reaches them. Stops after at most {@code |sat|} rounds.
     */
    public static Set<String> eg(KripkeStructure ks, Set<String> sat) {
        Set<String> current = new HashSet<>(sat);
        while (true) {
            Set<String> next = and(current, ex(ks, current));
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    // ── Derived operators ──────────────────────────────────────────

    /** EF p = E[true U p]. */
    public static Set<String> ef(KripkeStructure ks, Set<String> sat) {
        return eu(ks, truth(ks), sat);
    }

    /** AX p = NOT EX NOT p. Deadlock states satisfy AX of anything. */
    public static Set<String> ax(KripkeStructure ks, Set<String> sat) {
        return not(ks, ex(ks, not(ks, sat)));
    }

    /** AG p = NOT EF NOT p. */
    public static Set<String> ag(KripkeStructure ks, Set<String> sat) {
        return not(ks, ef(ks, not(ks, sat)));
    }

    /** AF p = NOT EG NOT p. */
    public static Set<String> af(KripkeStructure ks, Set<String> sat) {
        return not(ks, eg(ks, not(ks, sat)));
    }

    /**
     * A[left U right] = NOT (E[NOT right U (NOT left AND NOT right)] OR EG NOT right).
     */
    public static Set<String> au(KripkeStructure ks, Set<String> left, Set<String> right) {
        Set<String> notRight = not(ks, right);
        Set<String> blocked = and(not(ks, left), notRight);
        return not(ks, or(eu(ks, notRight, blocked), eg(ks, notRight)));
    }

    // ── Satisfaction query ─────────────────────────────────────────

    /**
     * Whether the structure as a whole satisfies a formula: the start set is non-empty and
     * every start state is in {@code sat}.
     */
    public static boolean satisfies(KripkeStructure ks, Set<String> sat) {
        return !ks.starts().isEmpty() && sat.containsAll(ks.starts());
    }
}
