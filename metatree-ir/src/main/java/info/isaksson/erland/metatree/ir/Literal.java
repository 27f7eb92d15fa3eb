package info.isaksson.erland.metatree.ir;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Scalar constant. Integral values are held as {@link Long} (or {@link BigInteger} when they do not
 * fit), floating values as {@link Double} (or {@link BigDecimal}), so equal constants compare equal
 * regardless of the boxed type a binding produced.
 */
public record Literal(LiteralSubtype subtype, Object value, NodeMeta meta) implements MetaNode {

    public Literal {
        value = canonicalValue(value);
        meta = NodeLists.meta(meta);
    }

    public static Literal integer(long value) {
        return new Literal(LiteralSubtype.INTEGER, value, NodeMeta.EMPTY);
    }

    public static Literal floating(double value) {
        return new Literal(LiteralSubtype.FLOAT, value, NodeMeta.EMPTY);
    }

    public static Literal string(String value) {
        return new Literal(LiteralSubtype.STRING, value, NodeMeta.EMPTY);
    }

    public static Literal bool(boolean value) {
        return new Literal(LiteralSubtype.BOOLEAN, value, NodeMeta.EMPTY);
    }

    public static Literal nullValue() {
        return new Literal(LiteralSubtype.NULL, null, NodeMeta.EMPTY);
    }

    public static Literal symbol(String name) {
        return new Literal(LiteralSubtype.SYMBOL, name, NodeMeta.EMPTY);
    }

    @Override public NodeTag tag() {
        return NodeTag.LITERAL;
    }

    @Override public List<MetaNode> children() {
        return List.of();
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    /** True when {@link #value()} has the Java type its subtype requires. */
    public boolean valueMatchesSubtype() {
        if (subtype == null) return false;
        switch (subtype) {
            case INTEGER:
                return value instanceof Long || value instanceof BigInteger;
            case FLOAT:
                return value instanceof Double || value instanceof BigDecimal;
            case STRING:
            case SYMBOL:
            case REGEX:
                return value instanceof String;
            case BOOLEAN:
                return value instanceof Boolean;
            case NULL:
                return value == null;
            default:
                return false;
        }
    }

    private static Object canonicalValue(Object v) {
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigInteger) {
            BigInteger b = (BigInteger) v;
            return b.bitLength() < 64 ? (Object) b.longValue() : b;
        }
        if (v instanceof Float) {
            return ((Float) v).doubleValue();
        }
        if (v instanceof Character) {
            return v.toString();
        }
        return v;
    }
}
