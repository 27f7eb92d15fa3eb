package info.isaksson.erland.metatree.binding;

import info.isaksson.erland.metatree.ir.NodeTag;

/** A meta-tree node has no native form in the target language. */
public class ReificationException extends MetaTreeException {

    private final NodeTag tag;
    private final String targetLanguage;

    public ReificationException(NodeTag tag, String targetLanguage, String message) {
        super("Cannot reify " + (tag == null ? "tree" : tag.wireName()) + " as " + targetLanguage + ": " + message);
        this.tag = tag;
        this.targetLanguage = targetLanguage;
    }

    public NodeTag tag() {
        return tag;
    }

    public String targetLanguage() {
        return targetLanguage;
    }
}
