package info.isaksson.erland.metatree.java;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import info.isaksson.erland.metatree.ir.OperatorCategory;

import java.util.Optional;

/** Operator tables: meta-tree categories and Java precedence levels. */
final class JavaOperators {

    /** Lowest level: assignment and lambda. */
    static final int ASSIGNMENT = 0;
    static final int TERNARY = 1;
    static final int LOGICAL_OR = 2;
    static final int PREFIX = 12;
    /** Postfix operators and primaries: never need parentheses. */
    static final int PRIMARY = 13;

    private JavaOperators() {
    }

    /** Category of a binary operator, or null when it has no structural counterpart (bitwise, shifts). */
    static OperatorCategory categoryOf(BinaryExpr.Operator op) {
        switch (op) {
            case PLUS:
            case MINUS:
            case MULTIPLY:
            case DIVIDE:
            case REMAINDER:
                return OperatorCategory.ARITHMETIC;
            case EQUALS:
            case NOT_EQUALS:
            case LESS:
            case GREATER:
            case LESS_EQUALS:
            case GREATER_EQUALS:
                return OperatorCategory.COMPARISON;
            case AND:
            case OR:
                return OperatorCategory.BOOLEAN;
            default:
                return null;
        }
    }

    static OperatorCategory categoryOf(UnaryExpr.Operator op) {
        switch (op) {
            case LOGICAL_COMPLEMENT:
                return OperatorCategory.BOOLEAN;
            case MINUS:
            case PLUS:
                return OperatorCategory.ARITHMETIC;
            default:
                return null;
        }
    }

    /** {@code +} for {@code +=} and so on; null for the bitwise and shift compound operators. */
    static String arithmeticPartOf(AssignExpr.Operator op) {
        switch (op) {
            case PLUS:
                return "+";
            case MINUS:
                return "-";
            case MULTIPLY:
                return "*";
            case DIVIDE:
                return "/";
            case REMAINDER:
                return "%";
            default:
                return null;
        }
    }

    static Optional<BinaryExpr.Operator> binary(String symbol) {
        for (BinaryExpr.Operator op : BinaryExpr.Operator.values()) {
            if (op.asString().equals(symbol)) return Optional.of(op);
        }
        return Optional.empty();
    }

    static Optional<UnaryExpr.Operator> prefix(String symbol) {
        for (UnaryExpr.Operator op : UnaryExpr.Operator.values()) {
            if (op.isPrefix() && op.asString().equals(symbol)) return Optional.of(op);
        }
        return Optional.empty();
    }

    static Optional<AssignExpr.Operator> compound(String binarySymbol) {
        for (AssignExpr.Operator op : AssignExpr.Operator.values()) {
            if (op != AssignExpr.Operator.ASSIGN && op.asString().equals(binarySymbol + "=")) return Optional.of(op);
        }
        return Optional.empty();
    }

    static int precedence(BinaryExpr.Operator op) {
        switch (op) {
            case OR:
                return 2;
            case AND:
                return 3;
            case BINARY_OR:
                return 4;
            case XOR:
                return 5;
            case BINARY_AND:
                return 6;
            case EQUALS:
            case NOT_EQUALS:
                return 7;
            case LESS:
            case GREATER:
            case LESS_EQUALS:
            case GREATER_EQUALS:
                return 8;
            case LEFT_SHIFT:
            case SIGNED_RIGHT_SHIFT:
            case UNSIGNED_RIGHT_SHIFT:
                return 9;
            case PLUS:
            case MINUS:
                return 10;
            default:
                return 11;
        }
    }

    static int precedence(Expression e) {
        if (e instanceof AssignExpr || e instanceof LambdaExpr || e instanceof SwitchExpr) return ASSIGNMENT;
        if (e instanceof ConditionalExpr) return TERNARY;
        if (e instanceof BinaryExpr b) return precedence(b.getOperator());
        if (e instanceof InstanceOfExpr) return 8;
        if (e instanceof UnaryExpr u) return u.getOperator().isPostfix() ? PRIMARY : PREFIX;
        if (e instanceof CastExpr) return PREFIX;
        return PRIMARY;
    }
}
