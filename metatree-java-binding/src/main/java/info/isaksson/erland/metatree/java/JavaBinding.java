package info.isaksson.erland.metatree.java;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import info.isaksson.erland.metatree.binding.Abstraction;
import info.isaksson.erland.metatree.binding.AbstractionException;
import info.isaksson.erland.metatree.binding.LanguageBinding;
import info.isaksson.erland.metatree.binding.MutationRejectedException;
import info.isaksson.erland.metatree.binding.ParseException;
import info.isaksson.erland.metatree.binding.ReificationException;
import info.isaksson.erland.metatree.binding.UnparseException;
import info.isaksson.erland.metatree.ir.Assignment;
import info.isaksson.erland.metatree.ir.AugmentedAssignment;
import info.isaksson.erland.metatree.ir.EarlyReturn;
import info.isaksson.erland.metatree.ir.FunctionDef;
import info.isaksson.erland.metatree.ir.Lambda;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.MetaNodes;
import info.isaksson.erland.metatree.ir.Param;
import info.isaksson.erland.metatree.ir.Variable;

import javax.lang.model.SourceVersion;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language binding for Java source, backed by JavaParser.
 *
 * <p>Source text may be a single expression, a sequence of statements or a whole compilation unit;
 * the kind is recorded in the abstraction's metadata under {@code java.unit} so reification can
 * rebuild the same shape. Output is JavaParser's pretty-printed form, except for escaped fragments,
 * which are written back exactly as they appeared in the input.</p>
 *
 * <p>Instances are immutable and safe for concurrent use.</p>
 */
public final class JavaBinding implements LanguageBinding<JavaNativeTree> {

    public static final String LANGUAGE = "java";

    private final JavaSourceParser parser = new JavaSourceParser();

    @Override public String language() {
        return LANGUAGE;
    }

    @Override public Set<String> fileExtensions() {
        return Set.of(".java");
    }

    @Override public JavaNativeTree parse(String source) throws ParseException {
        return parser.parse(source);
    }

    @Override public Abstraction abstractTree(JavaNativeTree nativeTree) throws AbstractionException {
        return JavaAbstractor.abstractTree(nativeTree);
    }

    @Override public JavaNativeTree reify(MetaNode tree, Map<String, String> metadata) throws ReificationException {
        if (tree == null) throw new IllegalArgumentException("tree is null");
        return new JavaReifier(parser.newParser()).reify(tree, metadata);
    }

    @Override public String unparse(JavaNativeTree nativeTree) throws UnparseException {
        if (nativeTree == null) throw new IllegalArgumentException("nativeTree is null");
        Node node = nativeTree.node();
        String printed;
        if (nativeTree.unit() == JavaNativeTree.Unit.STATEMENTS) {
            if (!(node instanceof BlockStmt block)) {
                throw new UnparseException("statement unit must hold a block, got " + node.getClass().getSimpleName());
            }
            StringJoiner lines = new StringJoiner("\n");
            for (Statement s : block.getStatements()) lines.add(s.toString());
            printed = lines.toString();
        } else {
            printed = node.toString();
        }
        return replayEscapes(printed, nativeTree.escapes());
    }

    /**
     * Rejects edits Java cannot express: a {@code return} outside any method or lambda of a
     * compilation unit, names that are not Java identifiers, and anything reification refuses.
     */
    @Override public void validateMutation(MetaNode tree, Map<String, String> metadata)
            throws MutationRejectedException {
        JavaNativeTree.Unit unit;
        try {
            unit = JavaReifier.unitFor(tree, metadata);
        } catch (ReificationException e) {
            throw new MutationRejectedException(e.getMessage());
        }
        if (unit == JavaNativeTree.Unit.COMPILATION_UNIT) {
            checkReturns(tree, false);
        }
        for (MetaNode n : MetaNodes.preorder(tree)) {
            if (n instanceof Assignment a && a.target() instanceof Variable v) {
                checkIdentifier(v.name());
            } else if (n instanceof AugmentedAssignment a && a.target() instanceof Variable v) {
                checkIdentifier(v.name());
            } else if (n instanceof Param p) {
                checkIdentifier(p.name());
            } else if (n instanceof FunctionDef f) {
                checkIdentifier(f.name());
            }
        }
        try {
            reify(tree, metadata);
        } catch (ReificationException e) {
            throw new MutationRejectedException(e.getMessage());
        }
    }

    private static void checkReturns(MetaNode node, boolean insideFunction) throws MutationRejectedException {
        if (node instanceof EarlyReturn && !insideFunction) {
            throw new MutationRejectedException("return outside a method or lambda");
        }
        boolean inside = insideFunction || node instanceof FunctionDef || node instanceof Lambda;
        for (MetaNode child : node.children()) {
            checkReturns(child, inside);
        }
    }

    private static void checkIdentifier(String name) throws MutationRejectedException {
        if (name == null || !SourceVersion.isIdentifier(name) || SourceVersion.isKeyword(name)) {
            throw new MutationRejectedException("not a valid Java identifier: " + name);
        }
    }

    private static String replayEscapes(String printed, Map<String, JavaNativeTree.EscapedFragment> escapes) {
        String out = printed;
        for (Map.Entry<String, JavaNativeTree.EscapedFragment> e : escapes.entrySet()) {
            String marker = e.getKey();
            String text = e.getValue().text();
            switch (e.getValue().category()) {
                case EXPRESSION:
                    out = out.replace(marker, text);
                    break;
                case STATEMENT:
                    out = out.replace(marker + ";", text);
                    break;
                case MEMBER:
                    out = out.replace(marker + " " + marker + ";", text);
                    break;
                case IMPORT:
                    out = out.replace("import " + marker + ";", text);
                    break;
                case TYPE:
                    Pattern empty = Pattern.compile("class " + Pattern.quote(marker) + " \\{\\s*}");
                    out = empty.matcher(out).replaceFirst(Matcher.quoteReplacement(text));
                    break;
                default:
                    throw new IllegalStateException("Unhandled escape category " + e.getValue().category());
            }
        }
        return out;
    }
}
