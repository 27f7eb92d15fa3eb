package info.isaksson.erland.metatree.java;

import java.util.Locale;
import java.util.Optional;

/**
 * Syntactic position an escaped Java fragment belongs to. Encoded as the suffix of the escape
 * node's hint, e.g. {@code switch_statement} or {@code field_member}.
 */
public enum EscapeCategory {
    EXPRESSION("_expression"),
    STATEMENT("_statement"),
    MEMBER("_member"),
    TYPE("_type"),
    IMPORT("_import");

    private final String suffix;

    EscapeCategory(String suffix) {
        this.suffix = suffix;
    }

    public String hint(String construct) {
        return construct + suffix;
    }

    /** Hint for a JavaParser node class, e.g. {@code SwitchStmt -> switch_statement}. */
    public String hintFor(Class<?> nodeClass) {
        String name = nodeClass.getSimpleName();
        for (String s : new String[]{"Expr", "Stmt", "Declaration"}) {
            if (name.endsWith(s) && name.length() > s.length()) {
                name = name.substring(0, name.length() - s.length());
                break;
            }
        }
        return hint(name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT));
    }

    public static Optional<EscapeCategory> ofHint(String hint) {
        if (hint == null) return Optional.empty();
        for (EscapeCategory c : values()) {
            if (hint.endsWith(c.suffix)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
