package com.ctlchecker.core.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Strongly connected components of a directed graph given as a node collection plus a
 * successor function.
 *
 * <p>Iterative Tarjan: an explicit work stack replaces recursion, so graph depth never
 * reaches the thread stack. Successors outside {@code nodes} are ignored, which lets callers
 * pass the successor function of a larger graph together with a subset of its nodes.
 *
 * <p>Stateless and thread-safe.
 */
public final class StronglyConnectedComponents {

    private StronglyConnectedComponents() {}

    public static Set<Set<String>> of(Collection<String> nodes, Function<String, List<String>> successors) {
        Set<String> domain = new HashSet<>(nodes);
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        Set<Set<String>> components = new LinkedHashSet<>();
        int counter = 0;

        for (String root : nodes) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            work.push(new Frame(root, successors.apply(root).iterator()));

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.next().hasNext()) {
                    String to = frame.next().next();
                    if (!domain.contains(to)) {
                        continue;
                    }
                    if (!index.containsKey(to)) {
                        index.put(to, counter);
                        lowLink.put(to, counter);
                        counter++;
                        stack.push(to);
                        onStack.add(to);
                        work.push(new Frame(to, successors.apply(to).iterator()));
                    } else if (onStack.contains(to)) {
                        lowLink.put(frame.node(), Math.min(lowLink.get(frame.node()), index.get(to)));
                    }
                    continue;
                }

                work.pop();
                if (!work.isEmpty()) {
                    String parent = work.peek().node();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.node())));
                }
                if (lowLink.get(frame.node()).equals(index.get(frame.node()))) {
                    Set<String> component = new LinkedHashSet<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node()));
                    components.add(Set.copyOf(component));
                }
            }
        }
        return components;
    }

    /**
     * A component that can carry an infinite path: more than one node, or a single node with
     * a self loop.
     */
    public static boolean isNonTrivial(Set<String> component, Function<String, List<String>> successors) {
        if (component.size() > 1) {
            return true;
        }
        String only = component.iterator().next();
        return successors.apply(only).contains(only);
    }

    private record Frame(String node, Iterator<String> next) {}
}
