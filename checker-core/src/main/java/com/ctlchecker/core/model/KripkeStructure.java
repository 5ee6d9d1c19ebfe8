package com.ctlchecker.core.model;

import com.ctlchecker.core.exception.KripkeStructureException;
import com.ctlchecker.core.exception.KripkeStructureException.ErrorKind;
import com.ctlchecker.core.graph.StronglyConnectedComponents;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A finite Kripke structure: named states labelled with Boolean atoms, a start set and a
 * successor relation.
 *
 * <h3>Invariants</h3>
 * <ul>
 *   <li>State names are unique.</li>
 *   <li>A label never sets a bit at or beyond {@code atoms().size()}; atom {@code i} is bit
 *       {@code 1L << i}.</li>
 *   <li>Atoms are frozen once the first state exists.</li>
 *   <li>Every start state and every transition endpoint is a declared state.</li>
 * </ul>
 * All invariants are enforced by the mutators; the accessors never validate.
 *
 * <p>The structure is mutable while it is being built and is then treated as read-only input
 * by {@link com.ctlchecker.core.checking.CtlChecker}. It is not synchronized: build it on one
 * thread, then share it freely for queries.
 */
public final class KripkeStructure {

    /** Labels are {@code long} bitmasks. */
    public static final int MAX_ATOMS = Long.SIZE;

    private final List<String> atoms = new ArrayList<>();
    private final Map<String, Integer> atomIndex = new HashMap<>();
    private final Map<String, Long> states = new LinkedHashMap<>();
    private final Set<String> starts = new LinkedHashSet<>();
    private final Map<String, List<String>> trans = new LinkedHashMap<>();
    private final Map<String, List<String>> transInverted = new LinkedHashMap<>();

    public KripkeStructure() {
    }

    /**
     * Builds a structure in one shot from its literal form. Atoms, states, starts and
     * transitions are applied in that order, so any invariant violation in the literal is
     * reported exactly as the equivalent mutator call would report it.
     */
    public static KripkeStructure fromDefinition(StructureDefinition definition) {
        KripkeStructure ks = new KripkeStructure();
        ks.setAtoms(definition.atoms());
        ks.addStates(definition.states());
        ks.setStarts(definition.starts());
        ks.addTransitions(definition.trans());
        return ks;
    }

    /** Inverse of {@link #fromDefinition(StructureDefinition)}. */
    public StructureDefinition toDefinition() {
        return new StructureDefinition(atoms, states, new ArrayList<>(starts), transitions());
    }

    // ── Atoms ──────────────────────────────────────────────────────

    public void setAtoms(List<String> newAtoms) {
        if (!states.isEmpty()) {
            throw new KripkeStructureException(ErrorKind.ATOMS_FROZEN,
                "Can't reset atoms after states are created");
        }
        if (newAtoms.size() > MAX_ATOMS) {
            throw new KripkeStructureException(ErrorKind.TOO_MANY_ATOMS,
                "At most " + MAX_ATOMS + " atoms are supported, got " + newAtoms.size());
        }
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < newAtoms.size(); i++) {
            if (index.putIfAbsent(newAtoms.get(i), i) != null) {
                throw new KripkeStructureException(ErrorKind.DUPLICATE_ATOM,
                    "Atom declared twice: " + newAtoms.get(i));
            }
        }
        atoms.clear();
        atoms.addAll(newAtoms);
        atomIndex.clear();
        atomIndex.putAll(index);
    }

    public List<String> atoms() {
        return Collections.unmodifiableList(atoms);
    }

    public boolean hasAtom(String atom) {
        return atomIndex.containsKey(atom);
    }

    /**
     * Bit mask for a single atom.
     *
     * @throws KripkeStructureException {@code UNKNOWN_ATOM} if the atom was never registered
     */
    public long atomMask(String atom) {
        Integer index = atomIndex.get(atom);
        if (index == null) {
            throw new KripkeStructureException(ErrorKind.UNKNOWN_ATOM,
                "Can't check on an atom that's not in the Kripke structure: " + atom);
        }
        return 1L << index;
    }

    /** Converts atom names to a label bitmask. */
    public long labelFor(Collection<String> atomNames) {
        long label = 0L;
        for (String atom : atomNames) {
            label |= atomMask(atom);
        }
        return label;
    }

    // ── States ─────────────────────────────────────────────────────

    public void addState(String name, long label) {
        if (states.containsKey(name)) {
            throw new KripkeStructureException(ErrorKind.DUPLICATE_STATE,
                "Can't add an existing state name again: " + name);
        }
        checkLabel(name, label);
        states.put(name, label);
    }

    public void addState(String name, Collection<String> atomNames) {
        addState(name, labelFor(atomNames));
    }

    public void addStates(Map<String, Long> labelled) {
        labelled.forEach(this::addState);
    }

    public void setLabel(String name, long label) {
        requireState(name, "Can't set the label of a non-existing state");
        checkLabel(name, label);
        states.put(name, label);
    }

    public void setLabel(String name, Collection<String> atomNames) {
        setLabel(name, labelFor(atomNames));
    }

    public long labelOf(String name) {
        requireState(name, "Can't get the label of a non-existing state");
        return states.get(name);
    }

    /** Atom names holding in {@code name}, in atom order. */
    public List<String> atomsOf(String name) {
        long label = labelOf(name);
        List<String> holding = new ArrayList<>();
        for (int i = 0; i < atoms.size(); i++) {
            if ((label & (1L << i)) != 0) {
                holding.add(atoms.get(i));
            }
        }
        return holding;
    }

    public boolean hasState(String name) {
        return states.containsKey(name);
    }

    /** State names in declaration order. */
    public Set<String> stateNames() {
        return Collections.unmodifiableSet(states.keySet());
    }

    /** State name → label, in declaration order. */
    public Map<String, Long> labels() {
        return Collections.unmodifiableMap(states);
    }

    public int size() {
        return states.size();
    }

    /**
     * Removes a state together with every transition into or out of it and its start
     * membership.
     */
    public void removeState(String name) {
        requireState(name, "Can't remove a non-existing state");
        states.remove(name);
        starts.remove(name);

        List<String> next = trans.remove(name);
        if (next != null) {
            for (String to : next) {
                List<String> back = transInverted.get(to);
                if (back != null) {
                    back.removeIf(name::equals);
                }
            }
        }
        List<String> previous = transInverted.remove(name);
        if (previous != null) {
            for (String from : previous) {
                List<String> forward = trans.get(from);
                if (forward != null) {
                    forward.removeIf(name::equals);
                }
            }
        }
    }

    public void removeStates(Collection<String> names) {
        for (String name : List.copyOf(names)) {
            removeState(name);
        }
    }

    // ── Start states ───────────────────────────────────────────────

    /** Replaces the start set. Nothing changes if any name is undeclared. */
    public void setStarts(Collection<String> newStarts) {
        for (String start : newStarts) {
            requireState(start, "Can't set a non-existing state as start state");
        }
        starts.clear();
        starts.addAll(newStarts);
    }

    public Set<String> starts() {
        return Collections.unmodifiableSet(starts);
    }

    // ── Transitions ────────────────────────────────────────────────

    public void addTransition(String from, String to) {
        requireState(from, "Can't add transition from a non-existing source state");
        requireState(to, "Can't add transition to a non-existing target state");
        trans.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
        transInverted.computeIfAbsent(to, k -> new ArrayList<>()).add(from);
    }

    /**
     * Appends every listed edge. Endpoints are validated before any edge is added, so a
     * rejected batch leaves the relation untouched.
     */
    public void addTransitions(Map<String, List<String>> edges) {
        edges.forEach((from, targets) -> {
            requireState(from, "Can't add transition from a non-existing source state");
            for (String to : targets) {
                requireState(to, "Can't add transition to a non-existing target state");
            }
        });
        edges.forEach((from, targets) -> targets.forEach(to -> addTransition(from, to)));
    }

    /**
     * Removes one occurrence of every listed edge. Edges are checked before any is removed.
     */
    public void removeTransitions(Map<String, List<String>> edges) {
        Map<String, List<String>> remaining = transitions();
        edges.forEach((from, targets) -> {
            List<String> available = new ArrayList<>(remaining.getOrDefault(from, List.of()));
            for (String to : targets) {
                if (!available.remove(to)) {
                    throw new KripkeStructureException(ErrorKind.UNKNOWN_TRANSITION,
                        "Can't remove a non-existing transition: " + from + " -> " + to);
                }
            }
            remaining.put(from, available);
        });
        edges.forEach((from, targets) -> {
            for (String to : targets) {
                trans.get(from).remove(to);
                transInverted.get(to).remove(from);
            }
        });
    }

    /** Ordered successors of {@code name}; empty for a deadlock or unknown state. */
    public List<String> successors(String name) {
        List<String> next = trans.get(name);
        return next == null ? List.of() : Collections.unmodifiableList(next);
    }

    /** Ordered predecessors of {@code name}; empty when nothing leads to it. */
    public List<String> predecessors(String name) {
        List<String> previous = transInverted.get(name);
        return previous == null ? List.of() : Collections.unmodifiableList(previous);
    }

    /** Snapshot of the successor relation. Sources whose edges were all removed are kept. */
    public Map<String, List<String>> transitions() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        trans.forEach((from, targets) -> copy.put(from, new ArrayList<>(targets)));
        return copy;
    }

    // ── Derived structures ─────────────────────────────────────────

    /** A new structure with the same atoms, states and starts and every edge reversed. */
    public KripkeStructure reverseTransitions() {
        KripkeStructure reversed = new KripkeStructure();
        reversed.setAtoms(atoms);
        reversed.addStates(states);
        reversed.setStarts(starts);
        transInverted.forEach((to, sources) -> sources.forEach(from -> reversed.addTransition(to, from)));
        return reversed;
    }

    /**
     * The sub-structure induced by {@code keep}: states outside it are dropped together with
     * their edges and start membership. Unknown names in {@code keep} are ignored.
     */
    public KripkeStructure restrictTo(Set<String> keep) {
        KripkeStructure sub = new KripkeStructure();
        sub.setAtoms(atoms);
        states.forEach((name, label) -> {
            if (keep.contains(name)) {
                sub.addState(name, label);
            }
        });
        List<String> keptStarts = new ArrayList<>();
        for (String start : starts) {
            if (keep.contains(start)) {
                keptStarts.add(start);
            }
        }
        sub.setStarts(keptStarts);
        trans.forEach((from, targets) -> {
            if (keep.contains(from)) {
                for (String to : targets) {
                    if (keep.contains(to)) {
                        sub.addTransition(from, to);
                    }
                }
            }
        });
        return sub;
    }

    public KripkeStructure copy() {
        return fromDefinition(toDefinition());
    }

    public Set<Set<String>> stronglyConnectedComponents() {
        return StronglyConnectedComponents.of(states.keySet(), this::successors);
    }

    // ── Helpers ────────────────────────────────────────────────────

    private void requireState(String name, String message) {
        if (!states.containsKey(name)) {
            throw new KripkeStructureException(ErrorKind.UNKNOWN_STATE, message + ": " + name);
        }
    }

    private void checkLabel(String name, long label) {
        if (atoms.size() < MAX_ATOMS && (label >>> atoms.size()) != 0) {
            throw new KripkeStructureException(ErrorKind.LABEL_OUT_OF_RANGE,
                "Label of state " + name + " uses bits beyond the " + atoms.size() + " declared atoms: "
                    + Long.toBinaryString(label));
        }
    }

    @Override
    public String toString() {
        return "Atoms: " + atoms + "\n"
            + "States: " + states + "\n"
            + "Starts: " + starts + "\n"
            + "Trans: " + trans;
    }
}
