package info.isaksson.erland.metatree.java;

import com.github.javaparser.ast.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Native tree of the Java binding: a JavaParser node plus the kind of source unit it came from.
 *
 * <p>Trees produced by reification may contain marker identifiers standing in for escaped
 * fragments; {@link #escapes()} maps each marker to the fragment's original text, which
 * {@link JavaBinding#unparse} writes back in place of the marker.</p>
 */
public record JavaNativeTree(Unit unit, Node node, Map<String, EscapedFragment> escapes) {

    /** What the source text was parsed as. Recorded in document metadata under {@link #METADATA_KEY}. */
    public enum Unit {
        EXPRESSION,
        STATEMENTS,
        COMPILATION_UNIT;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Unit fromWire(String wire) {
            for (Unit u : values()) {
                if (u.wireName().equals(wire)) return u;
            }
            throw new IllegalArgumentException("Unknown java unit: " + wire);
        }
    }

    /** A fragment kept as source text; {@code category} says where it may appear. */
    public record EscapedFragment(EscapeCategory category, String text) {}

    public static final String METADATA_KEY = "java.unit";

    public JavaNativeTree {
        if (unit == null) throw new IllegalArgumentException("unit is null");
        if (node == null) throw new IllegalArgumentException("node is null");
        escapes = escapes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(escapes));
    }

    public static JavaNativeTree parsed(Unit unit, Node node) {
        return new JavaNativeTree(unit, node, Map.of());
    }
}
