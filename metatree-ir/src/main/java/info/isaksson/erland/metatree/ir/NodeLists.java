package info.isaksson.erland.metatree.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** List plumbing shared by the node records. */
final class NodeLists {

    private NodeLists() {}

    /**
     * Immutable copy that keeps null elements, so a malformed payload survives construction and is
     * reported by {@link Conformance} instead of failing with a bare NullPointerException.
     */
    static <T> List<T> freeze(List<T> in) {
        if (in == null || in.isEmpty()) return List.of();
        return Collections.unmodifiableList(new ArrayList<>(in));
    }

    /** Present slots, in order. */
    static List<MetaNode> slots(MetaNode... nodes) {
        List<MetaNode> out = new ArrayList<>(nodes.length);
        for (MetaNode n : nodes) {
            if (n != null) out.add(n);
        }
        return Collections.unmodifiableList(out);
    }

    static List<MetaNode> slotsThen(List<? extends MetaNode> head, List<? extends MetaNode> tail, MetaNode... last) {
        List<MetaNode> out = new ArrayList<>();
        for (MetaNode n : head) {
            if (n != null) out.add(n);
        }
        for (MetaNode n : tail) {
            if (n != null) out.add(n);
        }
        for (MetaNode n : last) {
            if (n != null) out.add(n);
        }
        return Collections.unmodifiableList(out);
    }

    static List<MetaNode> present(List<? extends MetaNode> in) {
        return slotsThen(in, List.of());
    }

    static NodeMeta meta(NodeMeta meta) {
        return meta == null ? NodeMeta.EMPTY : meta;
    }
}
