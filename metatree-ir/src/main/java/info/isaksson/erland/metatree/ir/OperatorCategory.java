package info.isaksson.erland.metatree.ir;

/** Category of a unary, binary or augmented operator. */
public enum OperatorCategory {
    ARITHMETIC,
    COMPARISON,
    BOOLEAN;

    public String wireName() {
        return WireNames.of(this);
    }

    public static OperatorCategory fromWire(String wire) {
        return WireNames.parse(OperatorCategory.class, wire);
    }
}
