package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.decl.Declaration;
import info.isaksson.erland.solcast.node.stmt.Statement;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Layout helpers shared by the rule classes. */
final class Syntax {

    /** Kinds whose consecutive members are not separated by a blank line. */
    private static final Set<NodeKind> GROUPED = EnumSet.of(
            NodeKind.PRAGMA_DIRECTIVE,
            NodeKind.IMPORT_DIRECTIVE,
            NodeKind.USING_FOR_DIRECTIVE,
            NodeKind.VARIABLE_DECLARATION,
            NodeKind.EVENT_DEFINITION,
            NodeKind.ERROR_DEFINITION,
            NodeKind.USER_DEFINED_VALUE_TYPE_DEFINITION);

    private Syntax() {}

    /** Members one level deeper, each on its own line, without the enclosing braces. */
    static String members(List<? extends AstNode> members, RenderContext ctx) {
        StringBuilder sb = new StringBuilder();
        AstNode previous = null;
        for (AstNode m : members) {
            if (previous != null) {
                boolean grouped = previous.getKind() == m.getKind() && GROUPED.contains(m.getKind());
                sb.append(grouped ? "\n" : ctx.memberSeparator());
            }
            sb.append(ctx.indent()).append(ctx.render(m));
            previous = m;
        }
        return sb.toString();
    }

    /** {@code { members }} with the closing brace at the current depth. */
    static String memberBlock(List<? extends AstNode> members, RenderContext ctx) {
        if (members.isEmpty()) return "{}";
        String body = ctx.nested(() -> members(members, ctx));
        return "{\n" + body + "\n" + ctx.indent() + "}";
    }

    /** {@code { statements }}; statement documentation is emitted as {@code ///} lines. */
    static String statementBlock(List<? extends Statement> statements, RenderContext ctx) {
        if (statements.isEmpty()) return "{}";
        String body = ctx.nested(() -> {
            StringBuilder sb = new StringBuilder();
            for (Statement s : statements) {
                sb.append('\n').append(ctx.indent());
                sb.append(docComment(s.getDocumentation(), ctx));
                sb.append(ctx.render(s));
            }
            return sb.toString();
        });
        return "{" + body + "\n" + ctx.indent() + "}";
    }

    /** NatSpec text of a declaration, from the documentation node when there is one. */
    static String documentationOf(Declaration d) {
        if (d.getDocumentationNode() != null && d.getDocumentationNode().getText() != null) {
            return d.getDocumentationNode().getText();
        }
        return d.getDocumentation();
    }

    /** {@code ///} lines followed by a line break at the current depth, or empty. */
    static String docComment(String text, RenderContext ctx) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            String l = line.stripTrailing();
            sb.append("///");
            if (!l.isEmpty()) sb.append(l.startsWith(" ") ? "" : " ").append(l);
            sb.append('\n').append(ctx.indent());
        }
        return sb.toString();
    }

    static String join(List<? extends AstNode> nodes, RenderContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) sb.append(", ");
            AstNode n = nodes.get(i);
            if (n != null) sb.append(ctx.render(n));
        }
        return sb.toString();
    }

    /** Double-quoted string literal with the escapes the lexer understands. */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /** True when every character can appear unescaped (or with a simple escape) in a literal. */
    static boolean isPrintable(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\n' || c == '\r' || c == '\t') continue;
            if (c < 0x20 || c > 0x7e) return false;
        }
        return true;
    }
}
