package info.isaksson.erland.metatree.ir;

import java.util.Locale;

/**
 * Lower snake case names used for enum constants in the serialized form ({@code BINARY_OP -> "binary_op"}).
 */
public final class WireNames {

    private WireNames() {}

    public static String of(Enum<?> e) {
        if (e == null) return null;
        return e.name().toLowerCase(Locale.ROOT);
    }

    public static <E extends Enum<E>> E parse(Class<E> type, String wire) {
        if (type == null) throw new IllegalArgumentException("type is null");
        if (wire == null || wire.isBlank()) {
            throw new IllegalArgumentException("Missing " + type.getSimpleName() + " value");
        }
        String constant = wire.trim().toUpperCase(Locale.ROOT);
        for (E e : type.getEnumConstants()) {
            if (e.name().equals(constant)) return e;
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + wire);
    }
}
