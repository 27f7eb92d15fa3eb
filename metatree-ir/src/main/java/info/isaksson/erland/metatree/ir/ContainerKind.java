package info.isaksson.erland.metatree.ir;

/** Organizational container classification. */
public enum ContainerKind {
    MODULE,
    CLASS,
    NAMESPACE;

    public String wireName() {
        return WireNames.of(this);
    }

    public static ContainerKind fromWire(String wire) {
        return WireNames.parse(ContainerKind.class, wire);
    }
}
