package info.isaksson.erland.metatree.ir;

/** Thrown when a {@link Document} is built over a tree that does not conform to the grammar. */
public class NonConformingTreeException extends IllegalArgumentException {

    private final NodeTag rootTag;

    public NonConformingTreeException(NodeTag rootTag) {
        super("Tree rooted at " + (rootTag == null ? "null" : rootTag.wireName()) + " does not conform to the meta-tree grammar");
        this.rootTag = rootTag;
    }

    public NodeTag rootTag() {
        return rootTag;
    }
}
