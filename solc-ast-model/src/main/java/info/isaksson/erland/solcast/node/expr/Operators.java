package info.isaksson.erland.solcast.node.expr;

import java.util.Set;

/** Operator spellings accepted by the expression nodes. */
public final class Operators {

    public static final Set<String> BINARY = Set.of(
            "+", "-", "*", "/", "%", "**", "<<", ">>", ">>>", "&", "|", "^",
            "<", ">", "<=", ">=", "==", "!=", "&&", "||");

    public static final Set<String> UNARY = Set.of("!", "~", "-", "+", "++", "--", "delete");

    public static final Set<String> ASSIGNMENT = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "|=", "&=", "^=", "<<=", ">>=", ">>>=");

    private Operators() {
    }

    static void requireBinary(String op) {
        require(op, BINARY, "binary");
    }

    static void requireUnary(String op) {
        require(op, UNARY, "unary");
    }

    static void requireAssignment(String op) {
        require(op, ASSIGNMENT, "assignment");
    }

    private static void require(String op, Set<String> allowed, String what) {
        if (op == null) throw new IllegalArgumentException("operator must not be null");
        if (!allowed.contains(op)) {
            throw new IllegalArgumentException("Unknown " + what + " operator: '" + op + "'");
        }
    }
}
