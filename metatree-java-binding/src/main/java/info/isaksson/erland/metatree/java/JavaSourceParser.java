package info.isaksson.erland.metatree.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
import info.isaksson.erland.metatree.binding.ParseException;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns source text into a {@link JavaNativeTree}. Tries an expression first, then a statement
 * list, then a compilation unit; text that opens with a package, import or type declaration is
 * tried as a compilation unit first.
 *
 * <p>Statement lists are parsed wrapped in a block whose opening brace sits on the first line, so
 * columns reported for line 1 are shifted back by one.</p>
 */
final class JavaSourceParser {

    private static final Pattern DECLARATION_START = Pattern.compile(
            "^(?:\\s*(?://[^\n]*|/\\*.*?\\*/))*\\s*"
                    + "(?:package|import|@|(?:(?:public|protected|private|abstract|final|static|sealed|non-sealed|strictfp)\\s+)*"
                    + "(?:class|interface|enum|record)\\b)", Pattern.DOTALL);

    private final ParserConfiguration configuration;

    JavaSourceParser() {
        ParserConfiguration cfg = new ParserConfiguration();
        cfg.setCharacterEncoding(StandardCharsets.UTF_8);
        cfg.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.configuration = cfg;
    }

    JavaNativeTree parse(String source) throws ParseException {
        if (source == null) throw new ParseException(0, 0, "source is null");
        JavaParser parser = newParser();
        String trimmed = source.strip();
        boolean declaration = DECLARATION_START.matcher(trimmed).find();

        // A lone class also parses as a local class statement; read it as a compilation unit.
        ParseResult<CompilationUnit> unit = null;
        if (declaration) {
            unit = parser.parse(source);
            if (unit.isSuccessful() && unit.getResult().isPresent()) {
                return JavaNativeTree.parsed(JavaNativeTree.Unit.COMPILATION_UNIT, unit.getResult().get());
            }
        }

        ParseResult<Expression> expression = parser.parseExpression(source);
        if (expression.isSuccessful() && expression.getResult().isPresent()) {
            return JavaNativeTree.parsed(JavaNativeTree.Unit.EXPRESSION, expression.getResult().get());
        }
        ParseResult<BlockStmt> block = parser.parseBlock("{" + source + "\n}");
        if (block.isSuccessful() && block.getResult().isPresent()) {
            return JavaNativeTree.parsed(JavaNativeTree.Unit.STATEMENTS, block.getResult().get());
        }
        if (unit == null) {
            unit = parser.parse(source);
            if (unit.isSuccessful() && unit.getResult().isPresent()) {
                return JavaNativeTree.parsed(JavaNativeTree.Unit.COMPILATION_UNIT, unit.getResult().get());
            }
        }

        if (declaration) {
            throw toParseException(unit, false);
        }
        if (trimmed.contains(";") || trimmed.contains("{")) {
            throw toParseException(block, true);
        }
        throw toParseException(expression, false);
    }

    /** Parser for re-reading escaped fragments during reification. */
    JavaParser newParser() {
        return new JavaParser(configuration);
    }

    private static ParseException toParseException(ParseResult<? extends Node> result, boolean blockWrapped) {
        Optional<Problem> first = result.getProblems().stream().findFirst();
        if (first.isEmpty()) {
            return new ParseException(0, 0, "unparseable Java source");
        }
        Problem problem = first.get();
        Optional<Position> at = problem.getLocation()
                .flatMap(TokenRange::toRange)
                .map(r -> r.begin);
        if (at.isEmpty()) {
            return new ParseException(0, 0, problem.getMessage());
        }
        int line = at.get().line;
        int column = at.get().column;
        if (blockWrapped && line == 1) {
            column = Math.max(1, column - 1);
        }
        return new ParseException(line, column, problem.getMessage());
    }
}
