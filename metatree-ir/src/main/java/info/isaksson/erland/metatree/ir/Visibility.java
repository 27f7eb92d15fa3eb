package info.isaksson.erland.metatree.ir;

public enum Visibility {
    PUBLIC,
    PRIVATE,
    PROTECTED;

    public String wireName() {
        return WireNames.of(this);
    }

    public static Visibility fromWire(String wire) {
        return WireNames.parse(Visibility.class, wire);
    }
}
