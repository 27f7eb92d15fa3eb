package info.isaksson.erland.metatree.binding;

import info.isaksson.erland.metatree.ir.Assignment;
import info.isaksson.erland.metatree.ir.BinaryOp;
import info.isaksson.erland.metatree.ir.Block;
import info.isaksson.erland.metatree.ir.FunctionCall;
import info.isaksson.erland.metatree.ir.Literal;
import info.isaksson.erland.metatree.ir.LiteralSubtype;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.NativeEscape;
import info.isaksson.erland.metatree.ir.OperatorCategory;
import info.isaksson.erland.metatree.ir.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tiny arithmetic language used to exercise the binding contract without an external parser.
 *
 * <pre>
 * program   := statement (SEP statement)* [TERMINATOR]
 * statement := NAME '=' expr | expr
 * expr      := term (('+' | '-') term)*
 * term      := factor (('*' | '/') factor)*
 * factor    := INT | NAME | NAME '(' [expr (',' expr)*] ')' | '(' expr ')' | 'native{' ... '}'
 * </pre>
 *
 * <p>Two dialects: {@link Style#LOWER} ({@code a = 1; b = a + a}) with lower-case variables, and
 * {@link Style#CAPITALIZED} ({@code A = 1, B = A + A.}) with capitalized variables, comma separators
 * and a terminating dot. Both abstract to the same trees once names are folded.</p>
 */
public class MiniExprBinding implements LanguageBinding<MiniExprBinding.Program> {

    public enum Style { LOWER, CAPITALIZED }

    sealed interface Ast permits Num, Name, Bin, Call, Assign, Raw {}

    record Num(long value) implements Ast {}

    record Name(String name) implements Ast {}

    record Bin(char op, Ast left, Ast right) implements Ast {}

    record Call(String name, List<Ast> args) implements Ast {}

    record Assign(String name, Ast value) implements Ast {}

    record Raw(String text) implements Ast {}

    public record Program(List<Ast> statements) {}

    private final String language;
    private final Style style;
    private final String extension;

    /** Service-loader entry point: the lower-case dialect. */
    public MiniExprBinding() {
        this("mini", Style.LOWER, ".mini");
    }

    public MiniExprBinding(String language, Style style, String extension) {
        this.language = language;
        this.style = style;
        this.extension = extension;
    }

    public static MiniExprBinding lower() {
        return new MiniExprBinding();
    }

    public static MiniExprBinding capitalized() {
        return new Capitalized();
    }

    /** Service-loader entry point for the capitalized dialect. */
    public static final class Capitalized extends MiniExprBinding {
        public Capitalized() {
            super("erlmini", Style.CAPITALIZED, ".emini");
        }
    }

    @Override public String language() {
        return language;
    }

    @Override public Set<String> fileExtensions() {
        return Set.of(extension);
    }

    @Override public Program parse(String source) throws ParseException {
        if (source == null) throw new ParseException(0, 0, "source is null");
        return new Parser(source).program();
    }

    @Override public Abstraction abstractTree(Program program) {
        List<MetaNode> statements = new ArrayList<>();
        for (Ast a : program.statements()) statements.add(toMeta(a));
        return Abstraction.of(statements.size() == 1 ? statements.get(0) : Block.of(statements));
    }

    @Override public Program reify(MetaNode tree, Map<String, String> metadata) throws ReificationException {
        List<Ast> out = new ArrayList<>();
        if (tree instanceof Block) {
            for (MetaNode s : ((Block) tree).statements()) out.add(toAst(s));
        } else {
            out.add(toAst(tree));
        }
        return new Program(out);
    }

    @Override public String unparse(Program program) {
        List<String> parts = new ArrayList<>();
        for (Ast a : program.statements()) parts.add(print(a, 0));
        return style == Style.CAPITALIZED ? String.join(", ", parts) + "." : String.join("; ", parts);
    }

    @Override public void validateMutation(MetaNode tree, Map<String, String> metadata) throws MutationRejectedException {
        try {
            reify(tree, metadata);
        } catch (ReificationException e) {
            throw new MutationRejectedException(e.getMessage());
        }
    }

    private MetaNode toMeta(Ast a) {
        if (a instanceof Num) return Literal.integer(((Num) a).value());
        if (a instanceof Name) return Variable.named(((Name) a).name());
        if (a instanceof Bin) {
            Bin b = (Bin) a;
            return BinaryOp.of(OperatorCategory.ARITHMETIC, String.valueOf(b.op()), toMeta(b.left()), toMeta(b.right()));
        }
        if (a instanceof Call) {
            List<MetaNode> args = new ArrayList<>();
            for (Ast x : ((Call) a).args()) args.add(toMeta(x));
            return FunctionCall.of(((Call) a).name(), args);
        }
        if (a instanceof Assign) {
            return Assignment.of(Variable.named(((Assign) a).name()), toMeta(((Assign) a).value()));
        }
        return NativeEscape.of(language, "native_block", ((Raw) a).text());
    }

    private Ast toAst(MetaNode n) throws ReificationException {
        if (n instanceof Literal) {
            Literal l = (Literal) n;
            if (l.subtype() == LiteralSubtype.INTEGER && l.value() instanceof Long) return new Num((Long) l.value());
            throw new ReificationException(n.tag(), language, "only 64-bit integer literals");
        }
        if (n instanceof Variable) return new Name(styled(((Variable) n).name()));
        if (n instanceof BinaryOp) {
            BinaryOp b = (BinaryOp) n;
            if (b.category() != OperatorCategory.ARITHMETIC || b.operator().length() != 1 || "+-*/".indexOf(b.operator().charAt(0)) < 0) {
                throw new ReificationException(n.tag(), language, "operator " + b.operator());
            }
            return new Bin(b.operator().charAt(0), toAst(b.left()), toAst(b.right()));
        }
        if (n instanceof FunctionCall) {
            List<Ast> args = new ArrayList<>();
            for (MetaNode x : ((FunctionCall) n).args()) args.add(toAst(x));
            return new Call(((FunctionCall) n).name(), args);
        }
        if (n instanceof Assignment && ((Assignment) n).target() instanceof Variable) {
            Assignment as = (Assignment) n;
            return new Assign(styled(((Variable) as.target()).name()), toAst(as.value()));
        }
        if (n instanceof NativeEscape) {
            NativeEscape e = (NativeEscape) n;
            if (!language.equals(e.language())) {
                throw new ReificationException(n.tag(), language, "escape node belongs to " + e.language());
            }
            return new Raw(e.payload());
        }
        throw new ReificationException(n.tag(), language, "no native form");
    }

    private String styled(String name) {
        if (name.isEmpty()) return name;
        char first = style == Style.CAPITALIZED ? Character.toUpperCase(name.charAt(0)) : Character.toLowerCase(name.charAt(0));
        return first + name.substring(1);
    }

    private static int precedence(Ast a) {
        if (a instanceof Bin) {
            char op = ((Bin) a).op();
            return op == '+' || op == '-' ? 1 : 2;
        }
        return 3;
    }

    private static String print(Ast a, int minPrecedence) {
        if (a instanceof Num) return Long.toString(((Num) a).value());
        if (a instanceof Name) return ((Name) a).name();
        if (a instanceof Raw) return ((Raw) a).text();
        if (a instanceof Assign) return ((Assign) a).name() + " = " + print(((Assign) a).value(), 0);
        if (a instanceof Call) {
            List<String> args = new ArrayList<>();
            for (Ast x : ((Call) a).args()) args.add(print(x, 0));
            return ((Call) a).name() + "(" + String.join(", ", args) + ")";
        }
        Bin b = (Bin) a;
        int p = precedence(b);
        String s = print(b.left(), p) + " " + b.op() + " " + print(b.right(), p + 1);
        return p < minPrecedence ? "(" + s + ")" : s;
    }

    private final class Parser {
        private final String src;
        private int pos;

        Parser(String src) {
            this.src = src;
        }

        Program program() throws ParseException {
            List<Ast> statements = new ArrayList<>();
            skipWs();
            if (atEnd()) throw error("empty input");
            statements.add(statement());
            char separator = style == Style.CAPITALIZED ? ',' : ';';
            skipWs();
            while (!atEnd() && peek() == separator) {
                pos++;
                statements.add(statement());
                skipWs();
            }
            if (style == Style.CAPITALIZED) expect('.');
            skipWs();
            if (!atEnd()) throw error("unexpected '" + peek() + "'");
            return new Program(statements);
        }

        private Ast statement() throws ParseException {
            skipWs();
            int start = pos;
            if (!atEnd() && isIdentStart(peek())) {
                String name = ident();
                skipWs();
                if (!atEnd() && peek() == '=') {
                    pos++;
                    checkVariable(name, start);
                    return new Assign(name, expr());
                }
                pos = start;
            }
            return expr();
        }

        private Ast expr() throws ParseException {
            Ast left = term();
            skipWs();
            while (!atEnd() && (peek() == '+' || peek() == '-')) {
                char op = src.charAt(pos++);
                left = new Bin(op, left, term());
                skipWs();
            }
            return left;
        }

        private Ast term() throws ParseException {
            Ast left = factor();
            skipWs();
            while (!atEnd() && (peek() == '*' || peek() == '/')) {
                char op = src.charAt(pos++);
                left = new Bin(op, left, factor());
                skipWs();
            }
            return left;
        }

        private Ast factor() throws ParseException {
            skipWs();
            if (atEnd()) throw error("unexpected end of input");
            char c = peek();
            int start = pos;
            if (Character.isDigit(c)) {
                while (!atEnd() && Character.isDigit(peek())) pos++;
                try {
                    return new Num(Long.parseLong(src.substring(start, pos)));
                } catch (NumberFormatException e) {
                    throw errorAt(start, "integer out of range");
                }
            }
            if (c == '(') {
                pos++;
                Ast inner = expr();
                expect(')');
                return inner;
            }
            if (isIdentStart(c)) {
                String name = ident();
                if (name.equals("native") && !atEnd() && peek() == '{') return raw(start);
                skipWs();
                if (!atEnd() && peek() == '(') {
                    pos++;
                    List<Ast> args = new ArrayList<>();
                    skipWs();
                    if (!atEnd() && peek() == ')') {
                        pos++;
                        return new Call(name, args);
                    }
                    args.add(expr());
                    skipWs();
                    while (!atEnd() && peek() == ',') {
                        pos++;
                        args.add(expr());
                        skipWs();
                    }
                    expect(')');
                    return new Call(name, args);
                }
                checkVariable(name, start);
                return new Name(name);
            }
            throw error("unexpected '" + c + "'");
        }

        private Ast raw(int start) throws ParseException {
            int depth = 0;
            while (!atEnd()) {
                char c = src.charAt(pos++);
                if (c == '{') depth++;
                else if (c == '}' && --depth == 0) return new Raw(src.substring(start, pos));
            }
            throw errorAt(start, "unterminated native block");
        }

        private void checkVariable(String name, int at) throws ParseException {
            boolean upper = Character.isUpperCase(name.charAt(0));
            if (style == Style.CAPITALIZED && !upper) throw errorAt(at, "variables must be capitalized: " + name);
            if (style == Style.LOWER && upper) throw errorAt(at, "variables must start lower-case: " + name);
        }

        private String ident() {
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) pos++;
            return src.substring(start, pos);
        }

        private boolean isIdentStart(char c) {
            return Character.isLetter(c) || c == '_';
        }

        private void expect(char c) throws ParseException {
            skipWs();
            if (atEnd() || peek() != c) throw error("expected '" + c + "'");
            pos++;
        }

        private void skipWs() {
            while (!atEnd() && Character.isWhitespace(peek())) pos++;
        }

        private boolean atEnd() {
            return pos >= src.length();
        }

        private char peek() {
            return src.charAt(pos);
        }

        private ParseException error(String message) {
            return errorAt(pos, message);
        }

        private ParseException errorAt(int offset, String message) {
            int line = 1;
            int col = 1;
            for (int i = 0; i < offset && i < src.length(); i++) {
                if (src.charAt(i) == '\n') {
                    line++;
                    col = 1;
                } else {
                    col++;
                }
            }
            return new ParseException(line, col, message);
        }
    }
}
