package info.isaksson.erland.solcast.write;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.solcast.error.UnsupportedNodeShapeException;
import info.isaksson.erland.solcast.node.stmt.InlineAssembly;

/**
 * Renders the Yul AST the compiler attaches to inline assembly (0.6.0+). Yul nodes are not part
 * of the model; they stay raw JSON and are rendered here directly.
 */
final class YulRenderer {

    private final InlineAssembly owner;
    private final RenderContext ctx;

    private YulRenderer(InlineAssembly owner, RenderContext ctx) {
        this.owner = owner;
        this.ctx = ctx;
    }

    static String render(InlineAssembly owner, RenderContext ctx) {
        return new YulRenderer(owner, ctx).node(owner.getYulAst());
    }

    private String node(JsonNode n) {
        String type = n.path("nodeType").asText("");
        switch (type) {
            case "YulBlock":
                return block(n);
            case "YulVariableDeclaration": {
                StringBuilder sb = new StringBuilder("let ").append(typedNames(n.path("variables")));
                if (present(n, "value")) sb.append(" := ").append(node(n.get("value")));
                return sb.toString();
            }
            case "YulAssignment": {
                StringBuilder sb = new StringBuilder();
                JsonNode names = n.path("variableNames");
                for (int i = 0; i < names.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(node(names.get(i)));
                }
                return sb.append(" := ").append(node(n.get("value"))).toString();
            }
            case "YulExpressionStatement":
                return node(n.get("expression"));
            case "YulFunctionCall": {
                StringBuilder sb = new StringBuilder(node(n.get("functionName"))).append('(');
                JsonNode args = n.path("arguments");
                for (int i = 0; i < args.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(node(args.get(i)));
                }
                return sb.append(')').toString();
            }
            case "YulIdentifier":
                return n.path("name").asText();
            case "YulLiteral":
                return literal(n);
            case "YulIf":
                return "if " + node(n.get("condition")) + " " + node(n.get("body"));
            case "YulSwitch":
                return switchStatement(n);
            case "YulForLoop":
                return "for " + node(n.get("pre")) + " " + node(n.get("condition")) + " "
                        + node(n.get("post")) + " " + node(n.get("body"));
            case "YulFunctionDefinition": {
                StringBuilder sb = new StringBuilder("function ").append(n.path("name").asText())
                        .append('(').append(typedNames(n.path("parameters"))).append(')');
                if (n.path("returnVariables").size() > 0) {
                    sb.append(" -> ").append(typedNames(n.path("returnVariables")));
                }
                return sb.append(' ').append(node(n.get("body"))).toString();
            }
            case "YulBreak":
                return "break";
            case "YulContinue":
                return "continue";
            case "YulLeave":
                return "leave";
            default:
                throw new UnsupportedNodeShapeException("Unknown Yul node '" + type + "'", type, "yul",
                        RenderContext.pathOf(owner), n.toString());
        }
    }

    private String block(JsonNode n) {
        JsonNode statements = n.path("statements");
        if (statements.size() == 0) return "{}";
        String body = ctx.nested(() -> {
            StringBuilder sb = new StringBuilder();
            for (JsonNode s : statements) sb.append('\n').append(ctx.indent()).append(node(s));
            return sb.toString();
        });
        return "{" + body + "\n" + ctx.indent() + "}";
    }

    private String switchStatement(JsonNode n) {
        StringBuilder sb = new StringBuilder("switch ").append(node(n.get("expression")));
        for (JsonNode c : n.path("cases")) {
            sb.append('\n').append(ctx.indent());
            JsonNode value = c.get("value");
            if (value == null || value.isTextual()) {
                sb.append("default");
            } else {
                sb.append("case ").append(node(value));
            }
            sb.append(' ').append(node(c.get("body")));
        }
        return sb.toString();
    }

    private static String literal(JsonNode n) {
        String kind = n.path("kind").asText("number");
        String text;
        if ("string".equals(kind)) {
            JsonNode value = n.get("value");
            if (value != null && !value.isNull() && Syntax.isPrintable(value.asText())) {
                text = Syntax.quote(value.asText());
            } else {
                text = "hex\"" + n.path("hexValue").asText() + "\"";
            }
        } else {
            text = n.path("value").asText();
        }
        String type = n.path("type").asText("");
        return type.isEmpty() ? text : text + ":" + type;
    }

    private static String typedNames(JsonNode names) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) sb.append(", ");
            JsonNode t = names.get(i);
            sb.append(t.path("name").asText());
            String type = t.path("type").asText("");
            if (!type.isEmpty()) sb.append(':').append(type);
        }
        return sb.toString();
    }

    private static boolean present(JsonNode n, String field) {
        return n.has(field) && !n.get(field).isNull();
    }
}
