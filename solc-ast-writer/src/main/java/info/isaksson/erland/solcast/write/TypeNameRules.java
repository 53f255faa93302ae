package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.decl.Declaration;
import info.isaksson.erland.solcast.node.type.ArrayTypeName;
import info.isaksson.erland.solcast.node.type.ElementaryTypeName;
import info.isaksson.erland.solcast.node.type.FunctionTypeName;
import info.isaksson.erland.solcast.node.type.Mapping;
import info.isaksson.erland.solcast.node.type.UserDefinedTypeName;

import java.util.Map;

final class TypeNameRules {

    private TypeNameRules() {}

    static void register(Map<NodeKind, NodeRenderer<?>> m) {
        m.put(NodeKind.ELEMENTARY_TYPE_NAME, (NodeRenderer<ElementaryTypeName>) TypeNameRules::elementary);
        m.put(NodeKind.USER_DEFINED_TYPE_NAME, (NodeRenderer<UserDefinedTypeName>) TypeNameRules::userDefined);
        m.put(NodeKind.FUNCTION_TYPE_NAME, (NodeRenderer<FunctionTypeName>) TypeNameRules::function);
        m.put(NodeKind.MAPPING, (NodeRenderer<Mapping>) TypeNameRules::mapping);
        m.put(NodeKind.ARRAY_TYPE_NAME, (NodeRenderer<ArrayTypeName>) TypeNameRules::array);
    }

    static String elementary(ElementaryTypeName t, RenderContext ctx) {
        String name = t.getName();
        if ("address payable".equals(name)) return address(true, t, ctx);
        if ("address".equals(name)) return address(t.getStateMutability() == StateMutability.PAYABLE, t, ctx);
        return name;
    }

    /** {@code address payable} only exists from 0.5.0 on; plain addresses are payable before. */
    static String address(boolean payable, AstNode node, RenderContext ctx) {
        if (!payable) return "address";
        if (ctx.supports(VersionGates.ADDRESS_PAYABLE)) return "address payable";
        ctx.fellBack(VersionGates.ADDRESS_PAYABLE, node);
        return "address";
    }

    static String userDefined(UserDefinedTypeName t, RenderContext ctx) {
        if (t.getPathNode() != null) return ctx.render(t.getPathNode());
        if (t.getName() != null) return t.getName();
        NodeRef ref = t.getReferencedDeclaration();
        if (ref != null) {
            return ref.target(Declaration.class).map(Declaration::getName)
                    .orElseThrow(() -> new IllegalStateException("Cannot name type " + RenderContext.pathOf(t)
                            + ": " + ref + " does not resolve to a declaration"));
        }
        throw new IllegalStateException("User-defined type name " + RenderContext.pathOf(t) + " has no name");
    }

    static String function(FunctionTypeName t, RenderContext ctx) {
        StringBuilder sb = new StringBuilder("function ").append(ctx.render(t.getParameterTypes()));
        Visibility v = t.getVisibility();
        if (v != null && v != Visibility.DEFAULT && v != Visibility.INTERNAL) sb.append(' ').append(v.raw());
        String mutability = DeclarationRules.stateMutability(t.getStateMutability(), t, ctx);
        if (mutability != null) sb.append(' ').append(mutability);
        if (!t.getReturnParameterTypes().getParameters().isEmpty()) {
            sb.append(" returns ").append(ctx.render(t.getReturnParameterTypes()));
        }
        return sb.toString();
    }

    /** Key and value names are dropped below 0.8.18; they carry no meaning for the compiler. */
    static String mapping(Mapping m, RenderContext ctx) {
        boolean named = ctx.supports(VersionGates.NAMED_MAPPING_KEYS);
        if (!named && (hasText(m.getKeyName()) || hasText(m.getValueName()))) {
            ctx.fellBack(VersionGates.NAMED_MAPPING_KEYS, m);
        }
        StringBuilder sb = new StringBuilder("mapping(").append(ctx.render(m.getKeyType()));
        if (named && hasText(m.getKeyName())) sb.append(' ').append(m.getKeyName());
        sb.append(" => ").append(ctx.render(m.getValueType()));
        if (named && hasText(m.getValueName())) sb.append(' ').append(m.getValueName());
        return sb.append(')').toString();
    }

    static String array(ArrayTypeName a, RenderContext ctx) {
        String length = a.getLength() == null ? "" : ctx.render(a.getLength());
        return ctx.render(a.getBaseType()) + "[" + length + "]";
    }

    private static boolean hasText(String s) {
        return s != null && !s.isEmpty();
    }
}
