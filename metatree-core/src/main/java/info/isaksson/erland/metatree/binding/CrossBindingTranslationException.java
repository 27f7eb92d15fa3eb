package info.isaksson.erland.metatree.binding;

import info.isaksson.erland.metatree.ir.NodeTag;

/**
 * Raised before reification when a tree abstracted from one language is sent to another binding
 * but still contains opaque escape nodes.
 */
public class CrossBindingTranslationException extends ReificationException {

    private final String sourceLanguage;
    private final int nativeCount;

    public CrossBindingTranslationException(String sourceLanguage, String targetLanguage, int nativeCount) {
        super(NodeTag.LANGUAGE_SPECIFIC, targetLanguage,
                nativeCount + " " + sourceLanguage + "-specific construct(s) cannot be translated");
        this.sourceLanguage = sourceLanguage;
        this.nativeCount = nativeCount;
    }

    public String sourceLanguage() {
        return sourceLanguage;
    }

    public int nativeCount() {
        return nativeCount;
    }
}
