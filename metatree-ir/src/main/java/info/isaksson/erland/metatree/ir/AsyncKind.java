package info.isaksson.erland.metatree.ir;

public enum AsyncKind {
    AWAIT,
    ASYNC;

    public String wireName() {
        return WireNames.of(this);
    }

    public static AsyncKind fromWire(String wire) {
        return WireNames.parse(AsyncKind.class, wire);
    }
}
