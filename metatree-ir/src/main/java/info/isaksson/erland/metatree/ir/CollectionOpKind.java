package info.isaksson.erland.metatree.ir;

/** Collection transforms. {@code REDUCE} additionally carries an initial value. */
public enum CollectionOpKind {
    MAP,
    FILTER,
    REDUCE;

    public String wireName() {
        return WireNames.of(this);
    }

    public static CollectionOpKind fromWire(String wire) {
        return WireNames.parse(CollectionOpKind.class, wire);
    }
}
