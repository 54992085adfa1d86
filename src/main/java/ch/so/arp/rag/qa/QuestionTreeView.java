package ch.so.arp.rag.qa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the question forest. Children, depth and descendant
 * counts are derived from the parent references when the snapshot is created
 * and are never stored alongside the nodes.
 */
public final class QuestionTreeView {

    private final Map<Long, QuestionNode> nodes;
    private final Map<Long, List<QuestionNode>> children;
    private final List<QuestionNode> roots;
    private final Map<Long, Integer> depths;
    private final Map<Long, Integer> descendantCounts;

    private QuestionTreeView(Map<Long, QuestionNode> nodes, Map<Long, List<QuestionNode>> children,
            List<QuestionNode> roots) {
        this.nodes = nodes;
        this.children = children;
        this.roots = roots;
        this.depths = computeDepths(nodes);
        this.descendantCounts = computeDescendantCounts(nodes, children, roots);
    }

    /**
     * Index the given nodes. The iteration order of the collection defines the
     * order of children and roots.
     *
     * @throws QuestionReferenceException if a parent reference is dangling or
     *                                    part of a cycle
     */
    public static QuestionTreeView of(Collection<QuestionNode> questions) {
        Map<Long, QuestionNode> nodes = new LinkedHashMap<>();
        questions.forEach(node -> nodes.put(node.id(), node));

        Map<Long, List<QuestionNode>> children = new HashMap<>();
        List<QuestionNode> roots = new ArrayList<>();
        for (QuestionNode node : nodes.values()) {
            if (node.isRoot()) {
                roots.add(node);
            } else if (!nodes.containsKey(node.parentId())) {
                throw new QuestionReferenceException(
                        "Question " + node.id() + " references missing parent " + node.parentId());
            } else {
                children.computeIfAbsent(node.parentId(), key -> new ArrayList<>()).add(node);
            }
        }
        return new QuestionTreeView(Collections.unmodifiableMap(nodes), children, List.copyOf(roots));
    }

    public Collection<QuestionNode> nodes() {
        return nodes.values();
    }

    public Optional<QuestionNode> find(long id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<QuestionNode> roots() {
        return roots;
    }

    public List<QuestionNode> children(long id) {
        return List.copyOf(children.getOrDefault(id, List.of()));
    }

    /**
     * Distance from the root of the node's tree; roots have depth zero.
     */
    public int depth(long id) {
        return require(depths, id);
    }

    /**
     * Number of transitive children below the node.
     */
    public int descendantCount(long id) {
        return require(descendantCounts, id);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    private static int require(Map<Long, Integer> values, long id) {
        Integer value = values.get(id);
        if (value == null) {
            throw QuestionNotFoundException.forId(id);
        }
        return value;
    }

    private static Map<Long, Integer> computeDepths(Map<Long, QuestionNode> nodes) {
        Map<Long, Integer> depths = new HashMap<>();
        for (QuestionNode start : nodes.values()) {
            Deque<QuestionNode> path = new ArrayDeque<>();
            Set<Long> onPath = new LinkedHashSet<>();
            QuestionNode current = start;
            while (current != null && !depths.containsKey(current.id())) {
                if (!onPath.add(current.id())) {
                    throw new QuestionReferenceException("Parent chain of question " + start.id()
                            + " contains a cycle through " + onPath);
                }
                path.push(current);
                current = current.isRoot() ? null : nodes.get(current.parentId());
            }
            int depth = current == null ? -1 : depths.get(current.id());
            while (!path.isEmpty()) {
                depth++;
                depths.put(path.pop().id(), depth);
            }
        }
        return depths;
    }

    private static Map<Long, Integer> computeDescendantCounts(Map<Long, QuestionNode> nodes,
            Map<Long, List<QuestionNode>> children, List<QuestionNode> roots) {
        Map<Long, Integer> counts = new HashMap<>();
        // post-order walk without recursion, deep chains must not overflow the stack
        Deque<QuestionNode> pending = new ArrayDeque<>(roots);
        List<QuestionNode> visitOrder = new ArrayList<>(nodes.size());
        while (!pending.isEmpty()) {
            QuestionNode node = pending.pop();
            visitOrder.add(node);
            children.getOrDefault(node.id(), List.of()).forEach(pending::push);
        }
        for (int i = visitOrder.size() - 1; i >= 0; i--) {
            QuestionNode node = visitOrder.get(i);
            int count = 0;
            for (QuestionNode child : children.getOrDefault(node.id(), List.of())) {
                count += counts.get(child.id()) + 1;
            }
            counts.put(node.id(), count);
        }
        return counts;
    }
}
