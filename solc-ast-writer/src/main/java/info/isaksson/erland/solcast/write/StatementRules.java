package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;
import info.isaksson.erland.solcast.node.meta.TryCatchClause;
import info.isaksson.erland.solcast.node.stmt.Block;
import info.isaksson.erland.solcast.node.stmt.Break;
import info.isaksson.erland.solcast.node.stmt.Continue;
import info.isaksson.erland.solcast.node.stmt.DoWhileStatement;
import info.isaksson.erland.solcast.node.stmt.EmitStatement;
import info.isaksson.erland.solcast.node.stmt.ExpressionStatement;
import info.isaksson.erland.solcast.node.stmt.ForStatement;
import info.isaksson.erland.solcast.node.stmt.IfStatement;
import info.isaksson.erland.solcast.node.stmt.InlineAssembly;
import info.isaksson.erland.solcast.node.stmt.PlaceholderStatement;
import info.isaksson.erland.solcast.node.stmt.Return;
import info.isaksson.erland.solcast.node.stmt.RevertStatement;
import info.isaksson.erland.solcast.node.stmt.Statement;
import info.isaksson.erland.solcast.node.stmt.Throw;
import info.isaksson.erland.solcast.node.stmt.TryStatement;
import info.isaksson.erland.solcast.node.stmt.UncheckedBlock;
import info.isaksson.erland.solcast.node.stmt.VariableDeclarationStatement;
import info.isaksson.erland.solcast.node.stmt.WhileStatement;

import java.util.List;
import java.util.Map;

final class StatementRules {

    private StatementRules() {}

    static void register(Map<NodeKind, NodeRenderer<?>> m) {
        m.put(NodeKind.BLOCK, (NodeRenderer<Block>) (b, ctx) -> Syntax.statementBlock(b.getStatements(), ctx));
        m.put(NodeKind.UNCHECKED_BLOCK, (NodeRenderer<UncheckedBlock>) StatementRules::unchecked);
        m.put(NodeKind.PLACEHOLDER_STATEMENT, (NodeRenderer<PlaceholderStatement>) (s, ctx) -> "_;");
        m.put(NodeKind.IF_STATEMENT, (NodeRenderer<IfStatement>) StatementRules::ifStatement);
        m.put(NodeKind.TRY_STATEMENT, (NodeRenderer<TryStatement>) StatementRules::tryStatement);
        m.put(NodeKind.WHILE_STATEMENT, (NodeRenderer<WhileStatement>) StatementRules::whileStatement);
        m.put(NodeKind.DO_WHILE_STATEMENT, (NodeRenderer<DoWhileStatement>) StatementRules::doWhile);
        m.put(NodeKind.FOR_STATEMENT, (NodeRenderer<ForStatement>) StatementRules::forStatement);
        m.put(NodeKind.CONTINUE, (NodeRenderer<Continue>) (s, ctx) -> "continue;");
        m.put(NodeKind.BREAK, (NodeRenderer<Break>) (s, ctx) -> "break;");
        m.put(NodeKind.RETURN, (NodeRenderer<Return>) StatementRules::returnStatement);
        m.put(NodeKind.THROW, (NodeRenderer<Throw>) StatementRules::throwStatement);
        m.put(NodeKind.EMIT_STATEMENT, (NodeRenderer<EmitStatement>) StatementRules::emit);
        m.put(NodeKind.REVERT_STATEMENT, (NodeRenderer<RevertStatement>) StatementRules::revert);
        m.put(NodeKind.VARIABLE_DECLARATION_STATEMENT,
                (NodeRenderer<VariableDeclarationStatement>) StatementRules::variableDeclarationStatement);
        m.put(NodeKind.EXPRESSION_STATEMENT,
                (NodeRenderer<ExpressionStatement>) (s, ctx) -> ctx.render(s.getExpression()) + ";");
        m.put(NodeKind.INLINE_ASSEMBLY, (NodeRenderer<InlineAssembly>) StatementRules::inlineAssembly);
    }

    static String unchecked(UncheckedBlock b, RenderContext ctx) {
        ctx.require(VersionGates.UNCHECKED, b);
        return "unchecked " + Syntax.statementBlock(b.getStatements(), ctx);
    }

    static String ifStatement(IfStatement s, RenderContext ctx) {
        StringBuilder sb = new StringBuilder("if (").append(ctx.render(s.getCondition())).append(')');
        Statement otherwise = s.getFalseBody();
        // an unbraced body ending in an open if would capture our else
        boolean braced = otherwise != null && endsInOpenIf(s.getTrueBody());
        if (braced) {
            sb.append(" {\n").append(ctx.indent(1)).append(ctx.renderNested(s.getTrueBody()))
                    .append('\n').append(ctx.indent()).append('}');
        } else {
            sb.append(body(s.getTrueBody(), ctx));
        }
        if (otherwise != null) {
            if (braced || s.getTrueBody() instanceof Block) {
                sb.append(" else");
            } else {
                sb.append('\n').append(ctx.indent()).append("else");
            }
            // else-if chains stay on one line
            sb.append(otherwise instanceof IfStatement ? " " + ctx.render(otherwise) : body(otherwise, ctx));
        }
        return sb.toString();
    }

    static String tryStatement(TryStatement t, RenderContext ctx) {
        ctx.require(VersionGates.TRY_CATCH, t);
        StringBuilder sb = new StringBuilder("try ").append(ctx.render(t.getExternalCall()));
        for (TryCatchClause c : t.getClauses()) sb.append(' ').append(ctx.render(c));
        return sb.toString();
    }

    static String whileStatement(WhileStatement s, RenderContext ctx) {
        return "while (" + ctx.render(s.getCondition()) + ")" + body(s.getBody(), ctx);
    }

    static String doWhile(DoWhileStatement s, RenderContext ctx) {
        String body = body(s.getBody(), ctx);
        String separator = s.getBody() instanceof Block ? " " : "\n" + ctx.indent();
        return "do" + body + separator + "while (" + ctx.render(s.getCondition()) + ");";
    }

    static String forStatement(ForStatement s, RenderContext ctx) {
        StringBuilder sb = new StringBuilder("for (");
        if (s.getInitializationExpression() != null) sb.append(stripSemicolon(ctx.render(s.getInitializationExpression())));
        sb.append(';');
        if (s.getCondition() != null) sb.append(' ').append(ctx.render(s.getCondition()));
        sb.append(';');
        if (s.getLoopExpression() != null) sb.append(' ').append(ctx.render(s.getLoopExpression().getExpression()));
        return sb.append(')').append(body(s.getBody(), ctx)).toString();
    }

    static String returnStatement(Return r, RenderContext ctx) {
        return r.getExpression() == null ? "return;" : "return " + ctx.render(r.getExpression()) + ";";
    }

    static String throwStatement(Throw t, RenderContext ctx) {
        ctx.require(VersionGates.THROW, t);
        return "throw;";
    }

    /** Before 0.4.21 an event is raised by calling it like a function. */
    static String emit(EmitStatement e, RenderContext ctx) {
        String call = ctx.render(e.getEventCall());
        if (ctx.supports(VersionGates.EMIT)) return "emit " + call + ";";
        ctx.fellBack(VersionGates.EMIT, e);
        return call + ";";
    }

    static String revert(RevertStatement r, RenderContext ctx) {
        ctx.require(VersionGates.CUSTOM_ERRORS, r);
        return "revert " + ctx.render(r.getErrorCall()) + ";";
    }

    static String variableDeclarationStatement(VariableDeclarationStatement s, RenderContext ctx) {
        List<VariableDeclaration> decls = s.getDeclarations();
        String lhs;
        if (decls.size() == 1 && decls.get(0) != null) {
            lhs = ctx.render(decls.get(0));
        } else if (allUntyped(decls)) {
            // var (a, , b) = ...
            ctx.require(VersionGates.VAR, s);
            StringBuilder names = new StringBuilder("var (");
            for (int i = 0; i < decls.size(); i++) {
                if (i > 0) names.append(", ");
                if (decls.get(i) != null) names.append(decls.get(i).getName());
            }
            lhs = names.append(')').toString();
        } else {
            lhs = "(" + Syntax.join(decls, ctx) + ")";
        }
        if (s.getInitialValue() == null) return lhs + ";";
        return lhs + " = " + ctx.render(s.getInitialValue()) + ";";
    }

    private static boolean allUntyped(List<VariableDeclaration> decls) {
        boolean any = false;
        for (VariableDeclaration d : decls) {
            if (d == null) continue;
            if (d.getTypeName() != null) return false;
            any = true;
        }
        return any;
    }

    /** Legacy and pre-0.6 output carries the block as text; later output carries a Yul tree. */
    static String inlineAssembly(InlineAssembly a, RenderContext ctx) {
        StringBuilder sb = new StringBuilder("assembly ");
        if (!a.getFlags().isEmpty()) {
            sb.append('(');
            for (int i = 0; i < a.getFlags().size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(Syntax.quote(a.getFlags().get(i)));
            }
            sb.append(") ");
        }
        if (a.getYulAst() != null) return sb.append(YulRenderer.render(a, ctx)).toString();
        if (a.getOperations() == null) {
            throw new IllegalStateException("Inline assembly " + RenderContext.pathOf(a) + " has neither operations nor a Yul AST");
        }
        return sb.append(a.getOperations().strip()).toString();
    }

    /** Blocks follow on the same line, other statements on the next line one level deeper. */
    private static String body(Statement body, RenderContext ctx) {
        if (body instanceof Block) return " " + ctx.render(body);
        return "\n" + ctx.indent(1) + ctx.renderNested(body);
    }

    private static boolean endsInOpenIf(Statement s) {
        if (s instanceof IfStatement) {
            IfStatement i = (IfStatement) s;
            return i.getFalseBody() == null || endsInOpenIf(i.getFalseBody());
        }
        if (s instanceof WhileStatement) return endsInOpenIf(((WhileStatement) s).getBody());
        if (s instanceof ForStatement) return endsInOpenIf(((ForStatement) s).getBody());
        return false;
    }

    private static String stripSemicolon(String statement) {
        return statement.endsWith(";") ? statement.substring(0, statement.length() - 1) : statement;
    }
}
