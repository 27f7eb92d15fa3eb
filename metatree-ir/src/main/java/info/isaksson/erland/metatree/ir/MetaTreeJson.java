package info.isaksson.erland.metatree.ir;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON form of meta-trees and documents.
 *
 * <p>A node is {@code {"tag": ..., "meta": {...}, "payload": ...}}. {@code meta} holds the node's
 * typed metadata (location, operator, names, kinds, boundary context, parameter lists); {@code payload}
 * is a scalar for leaf tags and an array of children otherwise. Fixed slots keep their position and
 * are written as {@code null} when absent, so the array length identifies the shape:</p>
 * <ul>
 *   <li>{@code loop}: {@code [condition, body]} for while, {@code [iterator, collection, body]} otherwise</li>
 *   <li>{@code collection_op}: {@code [function, collection]}, plus {@code initial} for reduce</li>
 *   <li>{@code exception_handling}: {@code [body, handler..., finally]}</li>
 *   <li>{@code pattern_match}: {@code [scrutinee, arm...]}</li>
 * </ul>
 *
 * <p>Writing is deterministic: fixed field order, key-ordered document metadata, two-space indent
 * and a trailing newline.</p>
 */
public final class MetaTreeJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);
    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private MetaTreeJson() {}

    // ---------------------------------------------------------------------------------------------
    // Writing
    // ---------------------------------------------------------------------------------------------

    public static String toJsonString(MetaNode node) {
        if (node == null) throw new IllegalArgumentException("node is null");
        return print(encode(node));
    }

    public static String toJsonString(Document document) {
        if (document == null) throw new IllegalArgumentException("document is null");
        return print(encodeDocument(document));
    }

    public static void write(Document document, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, toJsonString(document), StandardCharsets.UTF_8);
    }

    public static ObjectNode encode(MetaNode node) {
        return node.accept(new Encoder());
    }

    public static ObjectNode encodeDocument(Document document) {
        ObjectNode out = NODES.objectNode();
        out.put("language", document.language());
        ObjectNode md = out.putObject("metadata");
        document.metadata().forEach(md::put);
        out.put("originalSource", document.originalSource().orElse(null));
        out.set("tree", encode(document.tree()));
        return out;
    }

    private static String print(JsonNode node) {
        try {
            return MAPPER.writer(PRETTY).writeValueAsString(node) + "\n";
        } catch (JsonProcessingException e) {
            // A tree model of plain scalars always serializes.
            throw new IllegalStateException("Failed to serialize meta-tree", e);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Reading
    // ---------------------------------------------------------------------------------------------

    public static MetaNode readNode(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return decode(parse(json), "$");
    }

    public static Document readDocument(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return decodeDocument(parse(json));
    }

    public static Document read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        return readDocument(Files.readString(path, StandardCharsets.UTF_8));
    }

    private static JsonNode parse(String json) throws IOException {
        try {
            JsonNode root = MAPPER.readTree(json);
            if (root == null || root.isMissingNode()) throw new MetaTreeFormatException("$", "empty input");
            return root;
        } catch (JsonProcessingException e) {
            throw new MetaTreeFormatException("$", "not JSON: " + e.getOriginalMessage());
        }
    }

    public static Document decodeDocument(JsonNode json) throws MetaTreeFormatException {
        requireObject(json, "$");
        String language = text(json, "language", "$", true);
        Map<String, String> metadata = new TreeMap<>();
        JsonNode md = json.get("metadata");
        if (md != null && !md.isNull()) {
            requireObject(md, "$.metadata");
            Iterator<Map.Entry<String, JsonNode>> it = md.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isTextual()) {
                    throw new MetaTreeFormatException("$.metadata." + e.getKey(), "metadata values must be strings");
                }
                metadata.put(e.getKey(), e.getValue().asText());
            }
        }
        String source = text(json, "originalSource", "$", false);
        MetaNode tree = decode(json.get("tree"), "$.tree");
        try {
            return Document.of(tree, language, metadata, source);
        } catch (IllegalArgumentException e) {
            throw new MetaTreeFormatException("$.tree", e.getMessage());
        }
    }

    public static MetaNode decode(JsonNode json, String path) throws MetaTreeFormatException {
        requireObject(json, path);
        String wire = text(json, "tag", path, true);
        NodeTag tag = NodeTag.fromWire(wire)
                .orElseThrow(() -> new MetaTreeFormatException(path + ".tag", "unknown tag '" + wire + "'"));
        JsonNode meta = json.get("meta");
        if (meta == null || meta.isNull()) meta = NODES.objectNode();
        requireObject(meta, path + ".meta");
        JsonNode payload = json.get("payload");
        if (payload == null) payload = NODES.nullNode();
        NodeMeta nodeMeta = decodeNodeMeta(meta, path + ".meta");
        String m = path + ".meta";
        String p = path + ".payload";

        switch (tag) {
            case LITERAL: {
                LiteralSubtype subtype = enumValue(LiteralSubtype.class, meta, "subtype", m);
                return new Literal(subtype, literalValue(subtype, payload, p), nodeMeta);
            }
            case VARIABLE:
                return new Variable(scalarText(payload, p), nodeMeta);
            case LIST:
                return new ListNode(children(payload, p, 0, -1), nodeMeta);
            case TUPLE:
                return new TupleNode(children(payload, p, 0, -1), nodeMeta);
            case MAP: {
                List<MetaNode> entries = children(payload, p, 0, -1);
                return new MapNode(typed(entries, Pair.class, p), nodeMeta);
            }
            case PAIR: {
                List<MetaNode> kv = children(payload, p, 2, 2);
                return new Pair(kv.get(0), kv.get(1), nodeMeta);
            }
            case BINARY_OP: {
                List<MetaNode> lr = children(payload, p, 2, 2);
                return new BinaryOp(enumValue(OperatorCategory.class, meta, "category", m),
                        text(meta, "operator", m, true), lr.get(0), lr.get(1), nodeMeta);
            }
            case UNARY_OP: {
                List<MetaNode> o = children(payload, p, 1, 1);
                return new UnaryOp(enumValue(OperatorCategory.class, meta, "category", m),
                        text(meta, "operator", m, true), o.get(0), nodeMeta);
            }
            case FUNCTION_CALL:
                return new FunctionCall(text(meta, "name", m, true), children(payload, p, 0, -1), nodeMeta);
            case CONDITIONAL: {
                List<MetaNode> c = children(payload, p, 3, 3);
                return new Conditional(c.get(0), c.get(1), c.get(2), nodeMeta);
            }
            case EARLY_RETURN:
                return new EarlyReturn(children(payload, p, 1, 1).get(0), nodeMeta);
            case BLOCK:
                return new Block(children(payload, p, 0, -1), nodeMeta);
            case ASSIGNMENT: {
                List<MetaNode> tv = children(payload, p, 2, 2);
                return new Assignment(tv.get(0), tv.get(1), text(meta, "declaredType", m, false), nodeMeta);
            }
            case INLINE_MATCH: {
                List<MetaNode> pv = children(payload, p, 2, 2);
                return new InlineMatch(pv.get(0), pv.get(1), nodeMeta);
            }
            case LOOP: {
                LoopKind kind = enumValue(LoopKind.class, meta, "kind", m);
                if (kind == LoopKind.WHILE) {
                    List<MetaNode> cb = children(payload, p, 2, 2);
                    return new Loop(kind, null, cb.get(0), cb.get(1), nodeMeta);
                }
                List<MetaNode> icb = children(payload, p, 3, 3);
                return new Loop(kind, icb.get(0), icb.get(1), icb.get(2), nodeMeta);
            }
            case LAMBDA:
                return new Lambda(params(meta, m), children(payload, p, 0, -1), nodeMeta);
            case COLLECTION_OP: {
                CollectionOpKind kind = enumValue(CollectionOpKind.class, meta, "kind", m);
                int n = kind == CollectionOpKind.REDUCE ? 3 : 2;
                List<MetaNode> c = children(payload, p, n, n);
                return new CollectionOp(kind, c.get(0), c.get(1), n == 3 ? c.get(2) : null, nodeMeta);
            }
            case PATTERN_MATCH: {
                List<MetaNode> c = children(payload, p, 1, -1);
                return new PatternMatch(c.get(0), typed(c.subList(1, c.size()), MatchArm.class, p), nodeMeta);
            }
            case MATCH_ARM:
                return new MatchArm(optionalNode(meta, "pattern", m), optionalNode(meta, "guard", m),
                        children(payload, p, 0, -1), nodeMeta);
            case EXCEPTION_HANDLING: {
                List<MetaNode> c = children(payload, p, 2, -1);
                List<MatchArm> handlers = typed(c.subList(1, c.size() - 1), MatchArm.class, p);
                return new ExceptionHandling(c.get(0), handlers, c.get(c.size() - 1), nodeMeta);
            }
            case ASYNC_OPERATION:
                return new AsyncOperation(enumValue(AsyncKind.class, meta, "kind", m),
                        children(payload, p, 1, 1).get(0), nodeMeta);
            case CONTAINER:
                return new Container(enumValue(ContainerKind.class, meta, "kind", m), text(meta, "name", m, true),
                        children(payload, p, 0, -1), context(meta, m), nodeMeta);
            case FUNCTION_DEF: {
                String vis = text(meta, "visibility", m, false);
                return new FunctionDef(text(meta, "name", m, true), params(meta, m), children(payload, p, 0, -1),
                        text(meta, "returnType", m, false), vis == null ? null : parseEnum(Visibility.class, vis, m),
                        context(meta, m), nodeMeta);
            }
            case PARAM:
                return new Param(scalarText(payload, p), text(meta, "typeHint", m, false),
                        optionalNode(meta, "default", m), optionalNode(meta, "pattern", m), nodeMeta);
            case ATTRIBUTE_ACCESS:
                return new AttributeAccess(children(payload, p, 1, 1).get(0), text(meta, "attribute", m, true), nodeMeta);
            case AUGMENTED_ASSIGNMENT: {
                List<MetaNode> tv = children(payload, p, 2, 2);
                return new AugmentedAssignment(enumValue(OperatorCategory.class, meta, "category", m),
                        text(meta, "operator", m, true), tv.get(0), tv.get(1), nodeMeta);
            }
            case PROPERTY: {
                List<MetaNode> gs = children(payload, p, 2, 2);
                return new Property(text(meta, "name", m, true), gs.get(0), gs.get(1), nodeMeta);
            }
            case LANGUAGE_SPECIFIC:
                return new NativeEscape(text(meta, "language", m, true), text(meta, "hint", m, true),
                        scalarText(payload, p), nodeMeta);
            default:
                throw new MetaTreeFormatException(path + ".tag", "unsupported tag '" + wire + "'");
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Decoding helpers
    // ---------------------------------------------------------------------------------------------

    private static NodeMeta decodeNodeMeta(JsonNode meta, String path) throws MetaTreeFormatException {
        JsonNode loc = meta.get("location");
        if (loc == null || loc.isNull()) return NodeMeta.EMPTY;
        requireObject(loc, path + ".location");
        try {
            return NodeMeta.of(new Location(loc.path("line").asInt(0), loc.path("column").asInt(0),
                    loc.path("endLine").asInt(0), loc.path("endColumn").asInt(0)));
        } catch (IllegalArgumentException e) {
            throw new MetaTreeFormatException(path + ".location", e.getMessage());
        }
    }

    private static BoundaryContext context(JsonNode meta, String path) throws MetaTreeFormatException {
        JsonNode ctx = meta.get("context");
        if (ctx == null || ctx.isNull()) return BoundaryContext.EMPTY;
        String p = path + ".context";
        requireObject(ctx, p);
        Integer arity = null;
        JsonNode a = ctx.get("arity");
        if (a != null && !a.isNull()) {
            if (!a.canConvertToInt() || !a.isIntegralNumber()) throw new MetaTreeFormatException(p + ".arity", "arity must be an integer");
            arity = a.intValue();
        }
        List<String> modifiers = new ArrayList<>();
        JsonNode mods = ctx.get("modifiers");
        if (mods != null && !mods.isNull()) {
            if (!mods.isArray()) throw new MetaTreeFormatException(p + ".modifiers", "expected array");
            for (JsonNode mod : mods) {
                if (!mod.isTextual()) throw new MetaTreeFormatException(p + ".modifiers", "modifiers must be strings");
                modifiers.add(mod.asText());
            }
        }
        return new BoundaryContext(text(ctx, "module", p, false), text(ctx, "function", p, false), arity, modifiers);
    }

    private static List<Param> params(JsonNode meta, String path) throws MetaTreeFormatException {
        JsonNode ps = meta.get("params");
        if (ps == null || ps.isNull()) return List.of();
        return typed(children(ps, path + ".params", 0, -1), Param.class, path + ".params");
    }

    private static MetaNode optionalNode(JsonNode meta, String field, String path) throws MetaTreeFormatException {
        JsonNode n = meta.get(field);
        if (n == null || n.isNull()) return null;
        return decode(n, path + "." + field);
    }

    /** Decodes an array of child slots; {@code max < 0} means unbounded. Null entries stay null. */
    private static List<MetaNode> children(JsonNode payload, String path, int min, int max) throws MetaTreeFormatException {
        if (payload == null || !payload.isArray()) throw new MetaTreeFormatException(path, "expected an array of children");
        int size = payload.size();
        if (size < min || (max >= 0 && size > max)) {
            String expected = max < 0 ? "at least " + min : (min == max ? String.valueOf(min) : min + ".." + max);
            throw new MetaTreeFormatException(path, "expected " + expected + " children but found " + size);
        }
        List<MetaNode> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            JsonNode child = payload.get(i);
            out.add(child.isNull() ? null : decode(child, path + "[" + i + "]"));
        }
        return out;
    }

    private static <T extends MetaNode> List<T> typed(List<MetaNode> nodes, Class<T> type, String path)
            throws MetaTreeFormatException {
        List<T> out = new ArrayList<>(nodes.size());
        for (MetaNode n : nodes) {
            if (n != null && !type.isInstance(n)) {
                throw new MetaTreeFormatException(path, "expected " + type.getSimpleName() + " but found " + n.tag().wireName());
            }
            out.add(type.cast(n));
        }
        return out;
    }

    private static Object literalValue(LiteralSubtype subtype, JsonNode v, String path) throws MetaTreeFormatException {
        switch (subtype) {
            case INTEGER:
                if (!v.isIntegralNumber()) throw new MetaTreeFormatException(path, "integer literal expects an integral number");
                return v.canConvertToLong() ? (Object) v.longValue() : v.bigIntegerValue();
            case FLOAT:
                if (!v.isNumber()) throw new MetaTreeFormatException(path, "float literal expects a number");
                return v.isBigDecimal() ? (Object) v.decimalValue() : v.doubleValue();
            case BOOLEAN:
                if (!v.isBoolean()) throw new MetaTreeFormatException(path, "boolean literal expects true/false");
                return v.booleanValue();
            case NULL:
                if (!v.isNull()) throw new MetaTreeFormatException(path, "null literal expects null");
                return null;
            default:
                return scalarText(v, path);
        }
    }

    private static String scalarText(JsonNode v, String path) throws MetaTreeFormatException {
        if (v == null || !v.isTextual()) throw new MetaTreeFormatException(path, "expected a string");
        return v.asText();
    }

    private static String text(JsonNode obj, String field, String path, boolean required) throws MetaTreeFormatException {
        JsonNode v = obj.get(field);
        if (v == null || v.isNull()) {
            if (required) throw new MetaTreeFormatException(path + "." + field, "missing");
            return null;
        }
        if (!v.isTextual()) throw new MetaTreeFormatException(path + "." + field, "expected a string");
        return v.asText();
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, JsonNode meta, String field, String path)
            throws MetaTreeFormatException {
        return parseEnum(type, text(meta, field, path, true), path + "." + field);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String wire, String path) throws MetaTreeFormatException {
        try {
            return WireNames.parse(type, wire);
        } catch (IllegalArgumentException e) {
            throw new MetaTreeFormatException(path, e.getMessage());
        }
    }

    private static void requireObject(JsonNode n, String path) throws MetaTreeFormatException {
        if (n == null || !n.isObject()) throw new MetaTreeFormatException(path, "expected an object");
    }

    // ---------------------------------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------------------------------

    private static final class Encoder implements MetaNodeVisitor<ObjectNode> {

        private ObjectNode node(MetaNode n) {
            ObjectNode out = NODES.objectNode();
            out.put("tag", n.tag().wireName());
            ObjectNode meta = out.putObject("meta");
            Location loc = n.meta().location();
            if (loc != null) {
                ObjectNode l = meta.putObject("location");
                l.put("line", loc.line());
                l.put("column", loc.column());
                l.put("endLine", loc.endLine());
                l.put("endColumn", loc.endColumn());
            }
            return out;
        }

        private ObjectNode meta(ObjectNode out) {
            return (ObjectNode) out.get("meta");
        }

        private JsonNode child(MetaNode n) {
            return n == null ? NODES.nullNode() : n.accept(this);
        }

        private ObjectNode slots(ObjectNode out, MetaNode... slots) {
            ArrayNode arr = out.putArray("payload");
            for (MetaNode s : slots) arr.add(child(s));
            return out;
        }

        private ObjectNode list(ObjectNode out, List<? extends MetaNode> items) {
            ArrayNode arr = out.putArray("payload");
            for (MetaNode s : items) arr.add(child(s));
            return out;
        }

        private void putParams(ObjectNode meta, List<Param> params) {
            if (params.isEmpty()) return;
            ArrayNode arr = meta.putArray("params");
            for (Param p : params) arr.add(child(p));
        }

        private void putContext(ObjectNode meta, BoundaryContext ctx) {
            if (ctx == null || ctx.isEmpty()) return;
            ObjectNode c = meta.putObject("context");
            if (ctx.module() != null) c.put("module", ctx.module());
            if (ctx.function() != null) c.put("function", ctx.function());
            if (ctx.arity() != null) c.put("arity", ctx.arity());
            if (!ctx.modifiers().isEmpty()) {
                ArrayNode mods = c.putArray("modifiers");
                ctx.modifiers().forEach(mods::add);
            }
        }

        private void putOptional(ObjectNode meta, String field, String value) {
            if (value != null) meta.put(field, value);
        }

        private void putOptional(ObjectNode meta, String field, MetaNode value) {
            if (value != null) meta.set(field, child(value));
        }

        @Override public ObjectNode visitLiteral(Literal n) {
            ObjectNode out = node(n);
            meta(out).put("subtype", WireNames.of(n.subtype()));
            Object v = n.value();
            if (v == null) out.putNull("payload");
            else if (v instanceof Long) out.put("payload", (Long) v);
            else if (v instanceof BigInteger) out.put("payload", (BigInteger) v);
            else if (v instanceof Double) out.put("payload", (Double) v);
            else if (v instanceof BigDecimal) out.put("payload", (BigDecimal) v);
            else if (v instanceof Boolean) out.put("payload", (Boolean) v);
            else out.put("payload", v.toString());
            return out;
        }

        @Override public ObjectNode visitVariable(Variable n) {
            ObjectNode out = node(n);
            out.put("payload", n.name());
            return out;
        }

        @Override public ObjectNode visitList(ListNode n) {
            return list(node(n), n.elements());
        }

        @Override public ObjectNode visitMap(MapNode n) {
            return list(node(n), n.entries());
        }

        @Override public ObjectNode visitPair(Pair n) {
            return slots(node(n), n.key(), n.value());
        }

        @Override public ObjectNode visitTuple(TupleNode n) {
            return list(node(n), n.elements());
        }

        @Override public ObjectNode visitBinaryOp(BinaryOp n) {
            ObjectNode out = node(n);
            meta(out).put("category", WireNames.of(n.category()));
            meta(out).put("operator", n.operator());
            return slots(out, n.left(), n.right());
        }

        @Override public ObjectNode visitUnaryOp(UnaryOp n) {
            ObjectNode out = node(n);
            meta(out).put("category", WireNames.of(n.category()));
            meta(out).put("operator", n.operator());
            return slots(out, n.operand());
        }

        @Override public ObjectNode visitFunctionCall(FunctionCall n) {
            ObjectNode out = node(n);
            meta(out).put("name", n.name());
            return list(out, n.args());
        }

        @Override public ObjectNode visitConditional(Conditional n) {
            return slots(node(n), n.condition(), n.thenBranch(), n.elseBranch());
        }

        @Override public ObjectNode visitEarlyReturn(EarlyReturn n) {
            return slots(node(n), n.value());
        }

        @Override public ObjectNode visitBlock(Block n) {
            return list(node(n), n.statements());
        }

        @Override public ObjectNode visitAssignment(Assignment n) {
            ObjectNode out = node(n);
            putOptional(meta(out), "declaredType", n.declaredType());
            return slots(out, n.target(), n.value());
        }

        @Override public ObjectNode visitInlineMatch(InlineMatch n) {
            return slots(node(n), n.pattern(), n.value());
        }

        @Override public ObjectNode visitLoop(Loop n) {
            ObjectNode out = node(n);
            meta(out).put("kind", WireNames.of(n.kind()));
            if (n.kind() == LoopKind.WHILE) return slots(out, n.source(), n.body());
            return slots(out, n.iterator(), n.source(), n.body());
        }

        @Override public ObjectNode visitLambda(Lambda n) {
            ObjectNode out = node(n);
            putParams(meta(out), n.params());
            return list(out, n.body());
        }

        @Override public ObjectNode visitCollectionOp(CollectionOp n) {
            ObjectNode out = node(n);
            meta(out).put("kind", WireNames.of(n.kind()));
            if (n.kind() == CollectionOpKind.REDUCE) return slots(out, n.function(), n.collection(), n.initial());
            return slots(out, n.function(), n.collection());
        }

        @Override public ObjectNode visitPatternMatch(PatternMatch n) {
            List<MetaNode> all = new ArrayList<>();
            all.add(n.scrutinee());
            all.addAll(n.arms());
            return list(node(n), all);
        }

        @Override public ObjectNode visitMatchArm(MatchArm n) {
            ObjectNode out = node(n);
            putOptional(meta(out), "pattern", n.pattern());
            putOptional(meta(out), "guard", n.guard());
            return list(out, n.body());
        }

        @Override public ObjectNode visitExceptionHandling(ExceptionHandling n) {
            List<MetaNode> all = new ArrayList<>();
            all.add(n.body());
            all.addAll(n.handlers());
            all.add(n.finallyBlock());
            return list(node(n), all);
        }

        @Override public ObjectNode visitAsyncOperation(AsyncOperation n) {
            ObjectNode out = node(n);
            meta(out).put("kind", WireNames.of(n.kind()));
            return slots(out, n.operation());
        }

        @Override public ObjectNode visitContainer(Container n) {
            ObjectNode out = node(n);
            meta(out).put("kind", WireNames.of(n.kind()));
            meta(out).put("name", n.name());
            putContext(meta(out), n.context());
            return list(out, n.body());
        }

        @Override public ObjectNode visitFunctionDef(FunctionDef n) {
            ObjectNode out = node(n);
            ObjectNode meta = meta(out);
            meta.put("name", n.name());
            putParams(meta, n.params());
            putOptional(meta, "returnType", n.returnType());
            putOptional(meta, "visibility", WireNames.of(n.visibility()));
            putContext(meta, n.context());
            return list(out, n.body());
        }

        @Override public ObjectNode visitParam(Param n) {
            ObjectNode out = node(n);
            putOptional(meta(out), "typeHint", n.typeHint());
            putOptional(meta(out), "default", n.defaultValue());
            putOptional(meta(out), "pattern", n.pattern());
            out.put("payload", n.name());
            return out;
        }

        @Override public ObjectNode visitAttributeAccess(AttributeAccess n) {
            ObjectNode out = node(n);
            meta(out).put("attribute", n.attribute());
            return slots(out, n.receiver());
        }

        @Override public ObjectNode visitAugmentedAssignment(AugmentedAssignment n) {
            ObjectNode out = node(n);
            meta(out).put("category", WireNames.of(n.category()));
            meta(out).put("operator", n.operator());
            return slots(out, n.target(), n.value());
        }

        @Override public ObjectNode visitProperty(Property n) {
            ObjectNode out = node(n);
            meta(out).put("name", n.name());
            return slots(out, n.getter(), n.setter());
        }

        @Override public ObjectNode visitNativeEscape(NativeEscape n) {
            ObjectNode out = node(n);
            meta(out).put("language", n.language());
            meta(out).put("hint", n.hint());
            out.put("payload", n.payload());
            return out;
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
