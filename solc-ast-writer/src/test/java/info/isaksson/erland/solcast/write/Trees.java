package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.ContractKind;
import info.isaksson.erland.solcast.node.FunctionKind;
import info.isaksson.erland.solcast.node.LiteralKind;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;
import info.isaksson.erland.solcast.node.expr.BinaryOperation;
import info.isaksson.erland.solcast.node.expr.Expression;
import info.isaksson.erland.solcast.node.expr.FunctionCall;
import info.isaksson.erland.solcast.node.expr.Identifier;
import info.isaksson.erland.solcast.node.expr.Literal;
import info.isaksson.erland.solcast.node.expr.MemberAccess;
import info.isaksson.erland.solcast.node.expr.UnaryOperation;
import info.isaksson.erland.solcast.node.meta.ParameterList;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.node.stmt.Block;
import info.isaksson.erland.solcast.node.stmt.ExpressionStatement;
import info.isaksson.erland.solcast.node.stmt.Statement;
import info.isaksson.erland.solcast.node.type.ElementaryTypeName;

import java.util.concurrent.atomic.AtomicLong;

/** Small builders for hand-made trees; nodes are free-standing and never registered. */
final class Trees {

    private static final AtomicLong IDS = new AtomicLong(1000);

    private Trees() {}

    static long nextId() {
        return IDS.incrementAndGet();
    }

    static Identifier id(String name) {
        Identifier i = new Identifier(nextId(), null);
        i.setName(name);
        return i;
    }

    static Literal number(String value) {
        Literal l = new Literal(nextId(), null);
        l.setLiteralKind(LiteralKind.NUMBER);
        l.setValue(value);
        return l;
    }

    static Literal literal(LiteralKind kind, String value, String hexValue) {
        Literal l = new Literal(nextId(), null);
        l.setLiteralKind(kind);
        l.setValue(value);
        l.setHexValue(hexValue);
        return l;
    }

    static BinaryOperation binary(Expression left, String op, Expression right) {
        BinaryOperation b = new BinaryOperation(nextId(), null);
        b.setLeftExpression(left);
        b.setOperator(op);
        b.setRightExpression(right);
        return b;
    }

    static UnaryOperation prefix(String op, Expression sub) {
        UnaryOperation u = new UnaryOperation(nextId(), null);
        u.setOperator(op);
        u.setPrefix(true);
        u.setSubExpression(sub);
        return u;
    }

    static UnaryOperation postfix(Expression sub, String op) {
        UnaryOperation u = new UnaryOperation(nextId(), null);
        u.setOperator(op);
        u.setPrefix(false);
        u.setSubExpression(sub);
        return u;
    }

    static MemberAccess member(Expression base, String name) {
        MemberAccess m = new MemberAccess(nextId(), null);
        m.setExpression(base);
        m.setMemberName(name);
        return m;
    }

    static FunctionCall call(Expression callee, Expression... args) {
        FunctionCall c = new FunctionCall(nextId(), null);
        c.setExpression(callee);
        for (Expression a : args) c.getArguments().add(a);
        return c;
    }

    static ExpressionStatement stmt(Expression e) {
        ExpressionStatement s = new ExpressionStatement(nextId(), null);
        s.setExpression(e);
        return s;
    }

    static Block block(Statement... statements) {
        Block b = new Block(nextId(), null);
        for (Statement s : statements) b.getStatements().add(s);
        return b;
    }

    static ElementaryTypeName type(String name) {
        ElementaryTypeName t = new ElementaryTypeName(nextId(), null);
        t.setName(name);
        return t;
    }

    static VariableDeclaration variable(String typeName, String name) {
        VariableDeclaration v = new VariableDeclaration(nextId(), null);
        if (typeName != null) v.setTypeName(type(typeName));
        v.setName(name);
        return v;
    }

    static ParameterList params(VariableDeclaration... parameters) {
        ParameterList p = new ParameterList(nextId(), null);
        for (VariableDeclaration v : parameters) p.getParameters().add(v);
        return p;
    }

    static FunctionDefinition function(String name, FunctionKind kind, Visibility visibility,
                                       StateMutability mutability) {
        FunctionDefinition f = new FunctionDefinition(nextId(), null);
        f.setName(name);
        f.setFunctionKind(kind);
        f.setVisibility(visibility);
        f.setStateMutability(mutability);
        f.setParameters(params());
        f.setReturnParameters(params());
        f.setBody(block());
        return f;
    }

    static ContractDefinition contract(String name, AstNode... members) {
        ContractDefinition c = new ContractDefinition(nextId(), null);
        c.setName(name);
        c.setContractKind(ContractKind.CONTRACT);
        for (AstNode m : members) c.getNodes().add(m);
        return c;
    }

    static SourceUnit unit(AstNode... nodes) {
        SourceUnit u = new SourceUnit(nextId(), null);
        for (AstNode n : nodes) u.getNodes().add(n);
        return u;
    }
}
