package info.isaksson.erland.metatree.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Read-only traversal helpers over meta-trees.
 */
public final class MetaNodes {

    private MetaNodes() {}

    /** Pre-order walk (node before its children, children in payload order). */
    public static void walk(MetaNode root, Consumer<MetaNode> visitor) {
        if (root == null || visitor == null) return;
        Deque<MetaNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            MetaNode n = stack.pop();
            visitor.accept(n);
            List<MetaNode> children = n.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    public static List<MetaNode> preorder(MetaNode root) {
        List<MetaNode> out = new ArrayList<>();
        walk(root, out::add);
        return Collections.unmodifiableList(out);
    }

    public static List<MetaNode> findAll(MetaNode root, Predicate<MetaNode> filter) {
        List<MetaNode> out = new ArrayList<>();
        walk(root, n -> {
            if (filter.test(n)) out.add(n);
        });
        return Collections.unmodifiableList(out);
    }

    public static boolean anyMatch(MetaNode root, Predicate<MetaNode> filter) {
        Deque<MetaNode> stack = new ArrayDeque<>();
        if (root != null) stack.push(root);
        while (!stack.isEmpty()) {
            MetaNode n = stack.pop();
            if (filter.test(n)) return true;
            n.children().forEach(stack::push);
        }
        return false;
    }

    /** Distinct variable names referenced anywhere under {@code root}, sorted. */
    public static SortedSet<String> variables(MetaNode root) {
        TreeSet<String> names = new TreeSet<>();
        walk(root, n -> {
            if (n instanceof Variable v && v.name() != null) names.add(v.name());
        });
        return Collections.unmodifiableSortedSet(names);
    }

    public static List<NativeEscape> nativeEscapes(MetaNode root) {
        List<NativeEscape> out = new ArrayList<>();
        walk(root, n -> {
            if (n instanceof NativeEscape e) out.add(e);
        });
        return Collections.unmodifiableList(out);
    }

    public static boolean containsNative(MetaNode root) {
        return anyMatch(root, n -> n.tag() == NodeTag.LANGUAGE_SPECIFIC);
    }

    public static boolean isLeaf(MetaNode node) {
        return node != null && node.tag().hasScalarPayload();
    }

    /** Boundary context of this node itself; never looked up from ancestors. */
    public static BoundaryContext contextOf(MetaNode node) {
        if (node instanceof Container c) return c.context();
        if (node instanceof FunctionDef f) return f.context();
        return BoundaryContext.EMPTY;
    }
}
