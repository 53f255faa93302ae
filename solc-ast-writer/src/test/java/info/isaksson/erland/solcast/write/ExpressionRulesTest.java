package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.error.UnsupportedForTargetVersionException;
import info.isaksson.erland.solcast.node.LiteralKind;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.expr.Assignment;
import info.isaksson.erland.solcast.node.expr.Conditional;
import info.isaksson.erland.solcast.node.expr.ElementaryTypeNameExpression;
import info.isaksson.erland.solcast.node.expr.Expression;
import info.isaksson.erland.solcast.node.expr.FunctionCall;
import info.isaksson.erland.solcast.node.expr.FunctionCallOptions;
import info.isaksson.erland.solcast.node.expr.IndexAccess;
import info.isaksson.erland.solcast.node.expr.IndexRangeAccess;
import info.isaksson.erland.solcast.node.expr.Literal;
import info.isaksson.erland.solcast.node.expr.TupleExpression;
import info.isaksson.erland.solcast.node.type.ElementaryTypeName;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.solcast.write.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionRulesTest {

    private static String write(Expression e) {
        return SourceWriter.write(e, SolcVersion.LATEST);
    }

    @Test
    void parenthesizesLooserOperands() {
        assertEquals("(a + b) * c", write(binary(binary(id("a"), "+", id("b")), "*", id("c"))));
        assertEquals("a * b + c", write(binary(binary(id("a"), "*", id("b")), "+", id("c"))));
        assertEquals("a - b - c", write(binary(binary(id("a"), "-", id("b")), "-", id("c"))));
        assertEquals("a - (b - c)", write(binary(id("a"), "-", binary(id("b"), "-", id("c")))));
        assertEquals("(a || b) && c", write(binary(binary(id("a"), "||", id("b")), "&&", id("c"))));
    }

    @Test
    void exponentOperandsAreAlwaysUnambiguous() {
        assertEquals("(-x) ** 2", write(binary(prefix("-", id("x")), "**", number("2"))));
        assertEquals("(a ** b) ** c", write(binary(binary(id("a"), "**", id("b")), "**", id("c"))));
        assertEquals("a ** (b ** c)", write(binary(id("a"), "**", binary(id("b"), "**", id("c")))));
        assertEquals("x++ ** 2", write(binary(postfix(id("x"), "++"), "**", number("2"))));
    }

    @Test
    void unaryOperators() {
        assertEquals("!done", write(prefix("!", id("done"))));
        assertEquals("-(-x)", write(prefix("-", prefix("-", id("x")))));
        assertEquals("-(a + b)", write(prefix("-", binary(id("a"), "+", id("b")))));

        IndexAccess entry = new IndexAccess(nextId(), null);
        entry.setBaseExpression(id("m"));
        entry.setIndexExpression(id("k"));
        assertEquals("delete m[k]", write(prefix("delete", entry)));
    }

    @Test
    void assignmentsAndConditionals() {
        Conditional c = new Conditional(nextId(), null);
        c.setCondition(binary(id("a"), ">", id("b")));
        c.setTrueExpression(id("a"));
        c.setFalseExpression(id("b"));
        Assignment max = new Assignment(nextId(), null);
        max.setLeftHandSide(id("m"));
        max.setOperator("=");
        max.setRightHandSide(c);
        assertEquals("m = a > b ? a : b", write(max));

        Assignment inner = new Assignment(nextId(), null);
        inner.setLeftHandSide(id("x"));
        inner.setOperator("+=");
        inner.setRightHandSide(number("1"));
        assertEquals("(x += 1) + y", write(binary(inner, "+", id("y"))));
    }

    @Test
    void memberAccessOnCompoundExpressions() {
        assertEquals("(a + b).length", write(member(binary(id("a"), "+", id("b")), "length")));
        assertEquals("msg.sender", write(member(id("msg"), "sender")));
    }

    @Test
    void namedArguments() {
        FunctionCall c = call(id("send"), id("to"), number("1"));
        c.setNames(List.of("to", "amount"));
        assertEquals("send({to: to, amount: 1})", write(c));
    }

    @Test
    void namesOutOfStepWithArgumentsAreAnError() {
        FunctionCall c = call(id("send"), id("to"), number("1"));
        c.setNames(List.of("to", "amount"));
        c.getArguments().remove(1);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> write(c));
        assertTrue(e.getMessage().contains("FunctionCall#" + c.getId()), e.getMessage());
        assertTrue(e.getMessage().contains("2 argument names for 1 arguments"), e.getMessage());
    }

    @Test
    void callOptionsFallBackToMemberCallsBefore062() {
        FunctionCallOptions o = new FunctionCallOptions(nextId(), null);
        o.setExpression(member(id("target"), "call"));
        o.setNames(List.of("value", "gas"));
        o.getOptions().add(number("1"));
        o.getOptions().add(number("5000"));
        FunctionCall c = call(o, literal(LiteralKind.STRING, "", ""));

        assertEquals("target.call{value: 1, gas: 5000}(\"\")", SourceWriter.write(c, SolcVersion.V0_6_2));
        assertEquals("target.call.value(1).gas(5000)(\"\")", SourceWriter.write(c, SolcVersion.V0_5_0));
    }

    @Test
    void saltHasNoOlderSpelling() {
        FunctionCallOptions o = new FunctionCallOptions(nextId(), null);
        o.setExpression(id("Pair"));
        o.setNames(List.of("salt"));
        o.getOptions().add(id("s"));

        assertEquals("Pair{salt: s}", SourceWriter.write(o, SolcVersion.V0_6_2));
        assertThrows(UnsupportedForTargetVersionException.class, () -> SourceWriter.write(o, SolcVersion.V0_6_0));
    }

    @Test
    void payableConversion() {
        ElementaryTypeName address = type("address");
        address.setStateMutability(StateMutability.PAYABLE);
        ElementaryTypeNameExpression e = new ElementaryTypeNameExpression(nextId(), null);
        e.setTypeName(address);
        FunctionCall conversion = call(e, id("owner"));

        assertEquals("payable(owner)", SourceWriter.write(conversion, SolcVersion.V0_6_0));
        assertEquals("address(owner)", SourceWriter.write(conversion, SolcVersion.V0_5_0));

        ElementaryTypeNameExpression plain = new ElementaryTypeNameExpression(nextId(), null);
        plain.setTypeNameText("uint8");
        assertEquals("uint8(x)", write(call(plain, id("x"))));
    }

    @Test
    void indexAndRangeAccess() {
        IndexAccess arrayType = new IndexAccess(nextId(), null);
        arrayType.setBaseExpression(id("uint256"));
        assertEquals("uint256[]", write(arrayType));

        IndexRangeAccess slice = new IndexRangeAccess(nextId(), null);
        slice.setBaseExpression(id("data"));
        slice.setStartExpression(number("4"));
        assertEquals("data[4:]", SourceWriter.write(slice, SolcVersion.V0_6_0));
        assertThrows(UnsupportedForTargetVersionException.class, () -> SourceWriter.write(slice, SolcVersion.V0_5_0));
    }

    @Test
    void tuplesAndInlineArrays() {
        TupleExpression t = new TupleExpression(nextId(), null);
        t.getComponents().add(id("a"));
        t.getComponents().add(null);
        t.getComponents().add(id("b"));
        assertEquals("(a, , b)", write(t));

        TupleExpression array = new TupleExpression(nextId(), null);
        array.setInlineArray(true);
        array.getComponents().add(number("1"));
        array.getComponents().add(number("2"));
        assertEquals("[1, 2]", write(array));
    }

    @Test
    void literals() {
        assertEquals("true", write(literal(LiteralKind.BOOL, "true", "74727565")));
        assertEquals("\"a\\\"b\\n\"", write(literal(LiteralKind.STRING, "a\"b\n", "6122620a")));
        assertEquals("hex\"c3a9\"", write(literal(LiteralKind.STRING, "é", "c3a9")));
        assertEquals("hex\"00ff\"", write(literal(LiteralKind.HEX_STRING, null, "00ff")));

        Literal ether = number("1");
        ether.setSubdenomination("ether");
        assertEquals("1 ether", write(ether));

        Literal unicode = literal(LiteralKind.UNICODE_STRING, "❤", "e29da4");
        assertEquals("unicode\"❤\"", SourceWriter.write(unicode, SolcVersion.V0_7_0));
        assertThrows(UnsupportedForTargetVersionException.class, () -> SourceWriter.write(unicode, SolcVersion.of(0, 6, 12)));
    }

    @Test
    void unprintableStringWithoutHexValueIsAnError() {
        Literal broken = literal(LiteralKind.STRING, "\u0001", null);
        assertThrows(IllegalStateException.class, () -> write(broken));
    }
}
