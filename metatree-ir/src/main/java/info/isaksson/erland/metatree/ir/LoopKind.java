package info.isaksson.erland.metatree.ir;

/** Loop shapes. {@code WHILE} carries (condition, body); the others (iterator, collection, body). */
public enum LoopKind {
    WHILE,
    FOR,
    FOR_EACH;

    public String wireName() {
        return WireNames.of(this);
    }

    public static LoopKind fromWire(String wire) {
        return WireNames.parse(LoopKind.class, wire);
    }
}
