package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.expr.Assignment;
import info.isaksson.erland.solcast.node.expr.BinaryOperation;
import info.isaksson.erland.solcast.node.expr.Conditional;
import info.isaksson.erland.solcast.node.expr.UnaryOperation;

/**
 * Operator binding strength, higher binds tighter. The compiler drops source parentheses except
 * as single-element tuples, so the writer adds parentheses wherever the tree shape would
 * otherwise re-associate.
 */
final class Precedence {

    static final int ASSIGNMENT = 1;
    static final int CONDITIONAL = 2;
    static final int OR = 3;
    static final int AND = 4;
    static final int EQUALITY = 5;
    static final int RELATIONAL = 6;
    static final int BIT_OR = 7;
    static final int BIT_XOR = 8;
    static final int BIT_AND = 9;
    static final int SHIFT = 10;
    static final int ADDITIVE = 11;
    static final int MULTIPLICATIVE = 12;
    static final int EXPONENT = 13;
    static final int PREFIX = 14;
    static final int POSTFIX = 15;
    /** Identifiers, literals, calls, member and index access, tuples. */
    static final int PRIMARY = 16;

    private Precedence() {}

    static int ofBinary(String operator) {
        switch (operator) {
            case "||": return OR;
            case "&&": return AND;
            case "==":
            case "!=": return EQUALITY;
            case "<":
            case ">":
            case "<=":
            case ">=": return RELATIONAL;
            case "|": return BIT_OR;
            case "^": return BIT_XOR;
            case "&": return BIT_AND;
            case "<<":
            case ">>":
            case ">>>": return SHIFT;
            case "+":
            case "-": return ADDITIVE;
            case "*":
            case "/":
            case "%": return MULTIPLICATIVE;
            case "**": return EXPONENT;
            default:
                throw new IllegalArgumentException("Unknown binary operator: '" + operator + "'");
        }
    }

    static int of(AstNode expression) {
        if (expression instanceof BinaryOperation) return ofBinary(((BinaryOperation) expression).getOperator());
        if (expression instanceof Assignment) return ASSIGNMENT;
        if (expression instanceof Conditional) return CONDITIONAL;
        if (expression instanceof UnaryOperation) return ((UnaryOperation) expression).isPrefix() ? PREFIX : POSTFIX;
        return PRIMARY;
    }
}
