package info.isaksson.erland.metatree.binding;

/** No binding is registered for the requested language tag or file name. */
public class UnsupportedLanguageException extends MetaTreeException {

    private final String language;

    public UnsupportedLanguageException(String language) {
        super("No binding registered for language '" + language + "'");
        this.language = language;
    }

    public String language() {
        return language;
    }
}
