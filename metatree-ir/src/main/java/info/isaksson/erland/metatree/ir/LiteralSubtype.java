package info.isaksson.erland.metatree.ir;

/** Semantic subtype of a literal value. */
public enum LiteralSubtype {
    INTEGER,
    FLOAT,
    STRING,
    BOOLEAN,
    NULL,
    SYMBOL,
    REGEX;

    public String wireName() {
        return WireNames.of(this);
    }

    public static LiteralSubtype fromWire(String wire) {
        return WireNames.parse(LiteralSubtype.class, wire);
    }
}
