package info.isaksson.erland.metatree.validate;

import info.isaksson.erland.metatree.ir.WireNames;

/** How strictly escape nodes and advisory findings are treated. */
public enum ValidationMode {
    /** Any {@code language_specific} node fails validation. */
    STRICT,
    /** Escape nodes are allowed and reported with one {@code native_constructs_present} warning. */
    STANDARD,
    /** Escape nodes are allowed silently; no warnings of any kind. */
    PERMISSIVE;

    public String wireName() {
        return WireNames.of(this);
    }

    public static ValidationMode fromWire(String wire) {
        return WireNames.parse(ValidationMode.class, wire);
    }
}
