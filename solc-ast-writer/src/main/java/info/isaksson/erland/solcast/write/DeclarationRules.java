package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.ContractKind;
import info.isaksson.erland.solcast.node.FunctionKind;
import info.isaksson.erland.solcast.node.Mutability;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.StorageLocation;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.node.decl.EnumDefinition;
import info.isaksson.erland.solcast.node.decl.EnumValue;
import info.isaksson.erland.solcast.node.decl.ErrorDefinition;
import info.isaksson.erland.solcast.node.decl.EventDefinition;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.decl.ModifierDefinition;
import info.isaksson.erland.solcast.node.decl.StructDefinition;
import info.isaksson.erland.solcast.node.decl.UserDefinedValueTypeDefinition;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;
import info.isaksson.erland.solcast.node.meta.ParameterList;
import info.isaksson.erland.solcast.node.meta.SourceUnit;

import java.util.Map;

/** Contracts, callables, structs, enums and variable declarations. */
final class DeclarationRules {

    private DeclarationRules() {}

    static void register(Map<NodeKind, NodeRenderer<?>> m) {
        m.put(NodeKind.CONTRACT_DEFINITION, (NodeRenderer<ContractDefinition>) DeclarationRules::contract);
        m.put(NodeKind.FUNCTION_DEFINITION, (NodeRenderer<FunctionDefinition>) DeclarationRules::function);
        m.put(NodeKind.MODIFIER_DEFINITION, (NodeRenderer<ModifierDefinition>) DeclarationRules::modifier);
        m.put(NodeKind.EVENT_DEFINITION, (NodeRenderer<EventDefinition>) DeclarationRules::event);
        m.put(NodeKind.ERROR_DEFINITION, (NodeRenderer<ErrorDefinition>) DeclarationRules::error);
        m.put(NodeKind.STRUCT_DEFINITION, (NodeRenderer<StructDefinition>) DeclarationRules::struct);
        m.put(NodeKind.ENUM_DEFINITION, (NodeRenderer<EnumDefinition>) DeclarationRules::enumeration);
        m.put(NodeKind.ENUM_VALUE, (NodeRenderer<EnumValue>) (v, ctx) -> v.getName());
        m.put(NodeKind.VARIABLE_DECLARATION, (NodeRenderer<VariableDeclaration>) DeclarationRules::variable);
        m.put(NodeKind.USER_DEFINED_VALUE_TYPE_DEFINITION,
                (NodeRenderer<UserDefinedValueTypeDefinition>) DeclarationRules::userDefinedValueType);
    }

    static String contract(ContractDefinition c, RenderContext ctx) {
        StringBuilder sb = new StringBuilder(Syntax.docComment(Syntax.documentationOf(c), ctx));
        ContractKind kind = c.getContractKind() == null ? ContractKind.CONTRACT : c.getContractKind();
        if (kind == ContractKind.CONTRACT && Boolean.TRUE.equals(c.getAbstractContract())) {
            if (ctx.supports(VersionGates.ABSTRACT)) {
                sb.append("abstract ");
            } else {
                ctx.fellBack(VersionGates.ABSTRACT, c);
            }
        }
        sb.append(kind.raw()).append(' ').append(c.getName());
        if (!c.getBaseContracts().isEmpty()) {
            sb.append(" is ").append(Syntax.join(c.getBaseContracts(), ctx));
        }
        return sb.append(' ').append(Syntax.memberBlock(c.getNodes(), ctx)).toString();
    }

    /** Function kind, falling back to the legacy constructor flag when postprocessing did not run. */
    static FunctionKind kindOf(FunctionDefinition f) {
        if (f.getFunctionKind() != null) return f.getFunctionKind();
        return Boolean.TRUE.equals(f.getConstructorFlag()) ? FunctionKind.CONSTRUCTOR : FunctionKind.FUNCTION;
    }

    static String function(FunctionDefinition f, RenderContext ctx) {
        FunctionKind kind = kindOf(f);
        StringBuilder sb = new StringBuilder(Syntax.docComment(Syntax.documentationOf(f), ctx));
        switch (kind) {
            case CONSTRUCTOR:
                if (ctx.supports(VersionGates.CONSTRUCTOR_KEYWORD)) {
                    sb.append("constructor");
                } else {
                    ctx.fellBack(VersionGates.CONSTRUCTOR_KEYWORD, f);
                    sb.append("function ").append(f.nearestAncestor(ContractDefinition.class)
                            .map(ContractDefinition::getName).orElse(f.getName()));
                }
                break;
            case FALLBACK:
                if (ctx.supports(VersionGates.FALLBACK_KEYWORD)) {
                    sb.append("fallback");
                } else {
                    ctx.fellBack(VersionGates.FALLBACK_KEYWORD, f);
                    sb.append("function");
                }
                break;
            case RECEIVE:
                ctx.require(VersionGates.RECEIVE, f);
                sb.append("receive");
                break;
            case FREE_FUNCTION:
                ctx.require(VersionGates.FREE_FUNCTIONS, f);
                sb.append("function ").append(f.getName());
                break;
            default:
                sb.append("function ").append(f.getName());
                break;
        }
        sb.append(parameters(f.getParameters(), ctx));

        String visibility = functionVisibility(f, kind, ctx);
        if (visibility != null) sb.append(' ').append(visibility);
        String mutability = stateMutability(f.getStateMutability(), f, ctx);
        if (mutability != null) sb.append(' ').append(mutability);
        if (f.isVirtual() && ctx.supports(VersionGates.VIRTUAL)) sb.append(" virtual");
        if (f.getOverrides() != null && ctx.supports(VersionGates.OVERRIDE)) {
            sb.append(' ').append(ctx.render(f.getOverrides()));
        }
        for (AstNode modifier : f.getModifiers()) sb.append(' ').append(ctx.render(modifier));
        if (f.getReturnParameters() != null && !f.getReturnParameters().getParameters().isEmpty()) {
            sb.append(" returns ").append(ctx.render(f.getReturnParameters()));
        }
        return sb.append(body(f.getBody(), ctx)).toString();
    }

    private static String functionVisibility(FunctionDefinition f, FunctionKind kind, RenderContext ctx) {
        Visibility v = f.getVisibility() == Visibility.DEFAULT ? null : f.getVisibility();
        switch (kind) {
            case FREE_FUNCTION:
                return null;
            case CONSTRUCTOR:
                if (!ctx.supports(VersionGates.CONSTRUCTOR_VISIBILITY)) return null;
                if (v != null) return v.raw();
                return ctx.supports(VersionGates.EXPLICIT_VISIBILITY) ? Visibility.PUBLIC.raw() : null;
            case RECEIVE:
                return Visibility.EXTERNAL.raw();
            case FALLBACK:
                if (ctx.supports(VersionGates.FALLBACK_KEYWORD)) return Visibility.EXTERNAL.raw();
                break;
            default:
                break;
        }
        if (v != null) return v.raw();
        return ctx.supports(VersionGates.EXPLICIT_VISIBILITY) ? Visibility.PUBLIC.raw() : null;
    }

    /** {@code view} and {@code pure} are both spelled {@code constant} before 0.4.17. */
    static String stateMutability(StateMutability m, AstNode node, RenderContext ctx) {
        if (m == null || m == StateMutability.NONPAYABLE) return null;
        if (m == StateMutability.PAYABLE) return m.raw();
        if (ctx.supports(VersionGates.VIEW_PURE_KEYWORDS)) return m.raw();
        ctx.fellBack(VersionGates.VIEW_PURE_KEYWORDS, node);
        return "constant";
    }

    static String modifier(ModifierDefinition m, RenderContext ctx) {
        StringBuilder sb = new StringBuilder(Syntax.docComment(Syntax.documentationOf(m), ctx));
        sb.append("modifier ").append(m.getName()).append(parameters(m.getParameters(), ctx));
        if (m.isVirtual() && ctx.supports(VersionGates.VIRTUAL)) sb.append(" virtual");
        if (m.getOverrides() != null && ctx.supports(VersionGates.OVERRIDE)) {
            sb.append(' ').append(ctx.render(m.getOverrides()));
        }
        return sb.append(body(m.getBody(), ctx)).toString();
    }

    static String event(EventDefinition e, RenderContext ctx) {
        StringBuilder sb = new StringBuilder(Syntax.docComment(Syntax.documentationOf(e), ctx));
        sb.append("event ").append(e.getName()).append(parameters(e.getParameters(), ctx));
        if (e.isAnonymous()) sb.append(" anonymous");
        return sb.append(';').toString();
    }

    static String error(ErrorDefinition e, RenderContext ctx) {
        ctx.require(VersionGates.CUSTOM_ERRORS, e);
        return Syntax.docComment(Syntax.documentationOf(e), ctx)
                + "error " + e.getName() + parameters(e.getParameters(), ctx) + ";";
    }

    static String struct(StructDefinition s, RenderContext ctx) {
        return Syntax.docComment(Syntax.documentationOf(s), ctx)
                + "struct " + s.getName() + " " + Syntax.memberBlock(s.getMembers(), ctx);
    }

    static String enumeration(EnumDefinition e, RenderContext ctx) {
        StringBuilder sb = new StringBuilder(Syntax.docComment(Syntax.documentationOf(e), ctx));
        sb.append("enum ").append(e.getName()).append(" {");
        String values = ctx.nested(() -> {
            StringBuilder v = new StringBuilder();
            for (int i = 0; i < e.getMembers().size(); i++) {
                v.append(i == 0 ? "\n" : ",\n").append(ctx.indent()).append(ctx.render(e.getMembers().get(i)));
            }
            return v.toString();
        });
        return sb.append(values).append('\n').append(ctx.indent()).append('}').toString();
    }

    static String userDefinedValueType(UserDefinedValueTypeDefinition t, RenderContext ctx) {
        ctx.require(VersionGates.USER_DEFINED_VALUE_TYPES, t);
        return "type " + t.getName() + " is " + ctx.render(t.getUnderlyingType()) + ";";
    }

    /**
     * Parameters ({@code uint256 indexed amount}), members of contracts and source units
     * ({@code uint256 public constant X = 1;}), struct members and local variables.
     */
    static String variable(VariableDeclaration v, RenderContext ctx) {
        AstNode parent = v.getParent().orElse(null);
        StringBuilder sb = new StringBuilder();
        boolean member = parent instanceof ContractDefinition || parent instanceof SourceUnit;
        if (member) sb.append(Syntax.docComment(Syntax.documentationOf(v), ctx));

        if (v.getTypeName() == null) {
            ctx.require(VersionGates.VAR, v);
            sb.append("var");
        } else {
            sb.append(ctx.render(v.getTypeName()));
        }

        if (parent instanceof ParameterList) {
            if (v.isIndexed()) sb.append(" indexed");
            appendLocation(v, sb, ctx);
            appendName(v, sb);
            return sb.toString();
        }
        if (!member) {
            appendLocation(v, sb, ctx);
            appendName(v, sb);
            if (parent instanceof StructDefinition) sb.append(';');
            return sb.toString();
        }

        if (parent instanceof ContractDefinition && v.getVisibility() != null && v.getVisibility() != Visibility.DEFAULT) {
            sb.append(' ').append(v.getVisibility().raw());
        }
        Mutability mutability = v.getMutability();
        if (mutability == null) mutability = v.isConstantFlag() ? Mutability.CONSTANT : Mutability.MUTABLE;
        if (mutability == Mutability.CONSTANT) {
            sb.append(" constant");
        } else if (mutability == Mutability.IMMUTABLE) {
            ctx.require(VersionGates.IMMUTABLE, v);
            sb.append(" immutable");
        }
        if (v.getStorageLocation() == StorageLocation.TRANSIENT) {
            ctx.require(VersionGates.TRANSIENT_STORAGE, v);
            sb.append(" transient");
        }
        if (v.getOverrides() != null && ctx.supports(VersionGates.OVERRIDE)) {
            sb.append(' ').append(ctx.render(v.getOverrides()));
        }
        appendName(v, sb);
        if (v.getValue() != null) sb.append(" = ").append(ctx.render(v.getValue()));
        return sb.append(';').toString();
    }

    private static void appendLocation(VariableDeclaration v, StringBuilder sb, RenderContext ctx) {
        StorageLocation loc = v.getStorageLocation();
        if (loc == null || loc == StorageLocation.DEFAULT) return;
        if (loc == StorageLocation.CALLDATA && !ctx.supports(VersionGates.CALLDATA)) {
            ctx.fellBack(VersionGates.CALLDATA, v);
            return;
        }
        if (loc == StorageLocation.TRANSIENT) ctx.require(VersionGates.TRANSIENT_STORAGE, v);
        sb.append(' ').append(loc.raw());
    }

    private static void appendName(VariableDeclaration v, StringBuilder sb) {
        if (v.getName() != null && !v.getName().isEmpty()) sb.append(' ').append(v.getName());
    }

    private static String parameters(ParameterList list, RenderContext ctx) {
        return list == null ? "()" : ctx.render(list);
    }

    private static String body(AstNode body, RenderContext ctx) {
        return body == null ? ";" : " " + ctx.render(body);
    }
}
