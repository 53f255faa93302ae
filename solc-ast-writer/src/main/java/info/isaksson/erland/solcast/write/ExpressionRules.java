package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.LiteralKind;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.expr.Assignment;
import info.isaksson.erland.solcast.node.expr.BinaryOperation;
import info.isaksson.erland.solcast.node.expr.Conditional;
import info.isaksson.erland.solcast.node.expr.ElementaryTypeNameExpression;
import info.isaksson.erland.solcast.node.expr.Expression;
import info.isaksson.erland.solcast.node.expr.FunctionCall;
import info.isaksson.erland.solcast.node.expr.FunctionCallOptions;
import info.isaksson.erland.solcast.node.expr.Identifier;
import info.isaksson.erland.solcast.node.expr.IndexAccess;
import info.isaksson.erland.solcast.node.expr.IndexRangeAccess;
import info.isaksson.erland.solcast.node.expr.Literal;
import info.isaksson.erland.solcast.node.expr.MemberAccess;
import info.isaksson.erland.solcast.node.expr.NewExpression;
import info.isaksson.erland.solcast.node.expr.TupleExpression;
import info.isaksson.erland.solcast.node.expr.UnaryOperation;
import info.isaksson.erland.solcast.node.type.ElementaryTypeName;

import java.util.List;
import java.util.Map;

/**
 * Expressions. Operands are parenthesized from {@link Precedence} when the tree shape needs it.
 * The left operand of {@code **} is always parenthesized unless it is primary or postfix, since
 * the operator's associativity changed in 0.8.0.
 */
final class ExpressionRules {

    private ExpressionRules() {}

    static void register(Map<NodeKind, NodeRenderer<?>> m) {
        m.put(NodeKind.ASSIGNMENT, (NodeRenderer<Assignment>) ExpressionRules::assignment);
        m.put(NodeKind.CONDITIONAL, (NodeRenderer<Conditional>) ExpressionRules::conditional);
        m.put(NodeKind.TUPLE_EXPRESSION, (NodeRenderer<TupleExpression>) ExpressionRules::tuple);
        m.put(NodeKind.UNARY_OPERATION, (NodeRenderer<UnaryOperation>) ExpressionRules::unary);
        m.put(NodeKind.BINARY_OPERATION, (NodeRenderer<BinaryOperation>) ExpressionRules::binary);
        m.put(NodeKind.FUNCTION_CALL, (NodeRenderer<FunctionCall>) ExpressionRules::call);
        m.put(NodeKind.FUNCTION_CALL_OPTIONS, (NodeRenderer<FunctionCallOptions>) ExpressionRules::callOptions);
        m.put(NodeKind.NEW_EXPRESSION, (NodeRenderer<NewExpression>) (n, ctx) -> "new " + ctx.render(n.getTypeName()));
        m.put(NodeKind.MEMBER_ACCESS, (NodeRenderer<MemberAccess>) ExpressionRules::memberAccess);
        m.put(NodeKind.INDEX_ACCESS, (NodeRenderer<IndexAccess>) ExpressionRules::indexAccess);
        m.put(NodeKind.INDEX_RANGE_ACCESS, (NodeRenderer<IndexRangeAccess>) ExpressionRules::indexRangeAccess);
        m.put(NodeKind.IDENTIFIER, (NodeRenderer<Identifier>) (i, ctx) -> i.getName());
        m.put(NodeKind.ELEMENTARY_TYPE_NAME_EXPRESSION,
                (NodeRenderer<ElementaryTypeNameExpression>) ExpressionRules::elementaryTypeNameExpression);
        m.put(NodeKind.LITERAL, (NodeRenderer<Literal>) ExpressionRules::literal);
    }

    /** Renders the operand, wrapped in parentheses when it binds looser than {@code min}. */
    static String operand(Expression e, int min, RenderContext ctx) {
        String text = ctx.render(e);
        return Precedence.of(e) < min ? "(" + text + ")" : text;
    }

    static String assignment(Assignment a, RenderContext ctx) {
        return operand(a.getLeftHandSide(), Precedence.CONDITIONAL, ctx) + " " + a.getOperator() + " "
                + operand(a.getRightHandSide(), Precedence.ASSIGNMENT, ctx);
    }

    static String conditional(Conditional c, RenderContext ctx) {
        return operand(c.getCondition(), Precedence.OR, ctx)
                + " ? " + operand(c.getTrueExpression(), Precedence.CONDITIONAL, ctx)
                + " : " + operand(c.getFalseExpression(), Precedence.CONDITIONAL, ctx);
    }

    static String tuple(TupleExpression t, RenderContext ctx) {
        String inner = Syntax.join(t.getComponents(), ctx);
        return t.isInlineArray() ? "[" + inner + "]" : "(" + inner + ")";
    }

    static String unary(UnaryOperation u, RenderContext ctx) {
        String op = u.getOperator();
        if (!u.isPrefix()) return operand(u.getSubExpression(), Precedence.POSTFIX, ctx) + op;
        if ("delete".equals(op)) return "delete " + operand(u.getSubExpression(), Precedence.PREFIX, ctx);
        String sub = operand(u.getSubExpression(), Precedence.PREFIX, ctx);
        // - -x must not collapse into --x
        if (!sub.isEmpty() && (sub.charAt(0) == '-' || sub.charAt(0) == '+') && op.endsWith(String.valueOf(sub.charAt(0)))) {
            sub = "(" + sub + ")";
        }
        return op + sub;
    }

    static String binary(BinaryOperation b, RenderContext ctx) {
        int p = Precedence.ofBinary(b.getOperator());
        boolean exponent = p == Precedence.EXPONENT;
        // -x ** 2 is read differently before and after 0.8.0
        String left = operand(b.getLeftExpression(), exponent ? Precedence.POSTFIX : p, ctx);
        String right = operand(b.getRightExpression(), p + 1, ctx);
        return left + " " + b.getOperator() + " " + right;
    }

    static String call(FunctionCall c, RenderContext ctx) {
        StringBuilder sb = new StringBuilder(operand(c.getExpression(), Precedence.PRIMARY, ctx)).append('(');
        List<String> names = c.getNames();
        if (names.isEmpty()) {
            sb.append(Syntax.join(c.getArguments(), ctx));
        } else {
            if (names.size() != c.getArguments().size()) {
                throw new IllegalStateException("Function call " + RenderContext.pathOf(c) + " has " + names.size()
                        + " argument names for " + c.getArguments().size() + " arguments");
            }
            sb.append('{');
            for (int i = 0; i < c.getArguments().size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(names.get(i)).append(": ").append(ctx.render(c.getArguments().get(i)));
            }
            sb.append('}');
        }
        return sb.append(')').toString();
    }

    /** {@code f{value: 1}} from 0.6.2 on, {@code f.value(1)} before; {@code salt} has no older form. */
    static String callOptions(FunctionCallOptions o, RenderContext ctx) {
        String callee = operand(o.getExpression(), Precedence.PRIMARY, ctx);
        List<String> names = o.getNames();
        if (ctx.supports(VersionGates.CALL_OPTIONS)) {
            StringBuilder sb = new StringBuilder(callee).append('{');
            for (int i = 0; i < names.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(names.get(i)).append(": ").append(ctx.render(o.getOptions().get(i)));
            }
            return sb.append('}').toString();
        }
        ctx.fellBack(VersionGates.CALL_OPTIONS, o);
        StringBuilder sb = new StringBuilder(callee);
        for (int i = 0; i < names.size(); i++) {
            if ("salt".equals(names.get(i))) ctx.require(VersionGates.CREATE2_SALT, o);
            sb.append('.').append(names.get(i)).append('(').append(ctx.render(o.getOptions().get(i))).append(')');
        }
        return sb.toString();
    }

    static String memberAccess(MemberAccess m, RenderContext ctx) {
        return operand(m.getExpression(), Precedence.PRIMARY, ctx) + "." + m.getMemberName();
    }

    static String indexAccess(IndexAccess i, RenderContext ctx) {
        String base = operand(i.getBaseExpression(), Precedence.PRIMARY, ctx);
        return base + "[" + (i.getIndexExpression() == null ? "" : ctx.render(i.getIndexExpression())) + "]";
    }

    static String indexRangeAccess(IndexRangeAccess r, RenderContext ctx) {
        ctx.require(VersionGates.INDEX_RANGE, r);
        String base = operand(r.getBaseExpression(), Precedence.PRIMARY, ctx);
        String start = r.getStartExpression() == null ? "" : ctx.render(r.getStartExpression());
        String end = r.getEndExpression() == null ? "" : ctx.render(r.getEndExpression());
        return base + "[" + start + ":" + end + "]";
    }

    /**
     * Type used as an expression. A conversion to {@code address payable} is written
     * {@code payable(x)} from 0.6.0 on and {@code address(x)} before.
     */
    static String elementaryTypeNameExpression(ElementaryTypeNameExpression e, RenderContext ctx) {
        ElementaryTypeName t = e.getTypeName();
        String name = t != null ? t.getName() : e.getTypeNameText();
        boolean payable = "address payable".equals(name)
                || ("address".equals(name) && t != null && t.getStateMutability() == StateMutability.PAYABLE);
        if (!payable) return t != null ? ctx.render(t) : name;
        AstNode parent = e.getParent().orElse(null);
        boolean conversion = parent instanceof FunctionCall && ((FunctionCall) parent).getExpression() == e;
        if (!conversion) return TypeNameRules.address(true, e, ctx);
        if (ctx.supports(VersionGates.PAYABLE_CONVERSION)) return "payable";
        ctx.fellBack(VersionGates.PAYABLE_CONVERSION, e);
        return "address";
    }

    static String literal(Literal l, RenderContext ctx) {
        LiteralKind kind = l.getLiteralKind() == null ? LiteralKind.NUMBER : l.getLiteralKind();
        switch (kind) {
            case BOOL:
                return l.getValue();
            case HEX_STRING:
                return "hex\"" + hexOf(l) + "\"";
            case UNICODE_STRING:
                ctx.require(VersionGates.UNICODE_LITERALS, l);
                return "unicode" + Syntax.quote(l.getValue());
            case STRING:
                if (l.getValue() != null && Syntax.isPrintable(l.getValue())) return Syntax.quote(l.getValue());
                return "hex\"" + hexOf(l) + "\"";
            case NUMBER:
            default:
                String sub = l.getSubdenomination();
                return sub == null || sub.isEmpty() ? l.getValue() : l.getValue() + " " + sub;
        }
    }

    private static String hexOf(Literal l) {
        if (l.getHexValue() == null) {
            throw new IllegalStateException("Literal " + RenderContext.pathOf(l) + " has no printable value and no hex value");
        }
        return l.getHexValue();
    }
}
