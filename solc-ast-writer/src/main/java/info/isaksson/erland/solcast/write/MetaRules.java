package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.decl.Declaration;
import info.isaksson.erland.solcast.node.meta.IdentifierPath;
import info.isaksson.erland.solcast.node.meta.ImportDirective;
import info.isaksson.erland.solcast.node.meta.InheritanceSpecifier;
import info.isaksson.erland.solcast.node.meta.ModifierInvocation;
import info.isaksson.erland.solcast.node.meta.OverrideSpecifier;
import info.isaksson.erland.solcast.node.meta.ParameterList;
import info.isaksson.erland.solcast.node.meta.PragmaDirective;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.node.meta.StructuredDocumentation;
import info.isaksson.erland.solcast.node.meta.SymbolAlias;
import info.isaksson.erland.solcast.node.meta.TryCatchClause;
import info.isaksson.erland.solcast.node.meta.UsingForDirective;
import info.isaksson.erland.solcast.node.stmt.TryStatement;

import java.util.List;
import java.util.Map;

/** Source units, directives and the helper nodes that hang off declarations. */
final class MetaRules {

    private MetaRules() {}

    static void register(Map<NodeKind, NodeRenderer<?>> m) {
        m.put(NodeKind.SOURCE_UNIT, (NodeRenderer<SourceUnit>) MetaRules::sourceUnit);
        m.put(NodeKind.PRAGMA_DIRECTIVE, (NodeRenderer<PragmaDirective>) MetaRules::pragma);
        m.put(NodeKind.IMPORT_DIRECTIVE, (NodeRenderer<ImportDirective>) MetaRules::importDirective);
        m.put(NodeKind.USING_FOR_DIRECTIVE, (NodeRenderer<UsingForDirective>) MetaRules::usingFor);
        m.put(NodeKind.INHERITANCE_SPECIFIER, (NodeRenderer<InheritanceSpecifier>) MetaRules::inheritanceSpecifier);
        m.put(NodeKind.MODIFIER_INVOCATION, (NodeRenderer<ModifierInvocation>) MetaRules::modifierInvocation);
        m.put(NodeKind.OVERRIDE_SPECIFIER, (NodeRenderer<OverrideSpecifier>) MetaRules::overrideSpecifier);
        m.put(NodeKind.STRUCTURED_DOCUMENTATION, (NodeRenderer<StructuredDocumentation>) MetaRules::documentation);
        m.put(NodeKind.PARAMETER_LIST, (NodeRenderer<ParameterList>) MetaRules::parameterList);
        m.put(NodeKind.IDENTIFIER_PATH, (NodeRenderer<IdentifierPath>) (p, ctx) -> p.getName());
        m.put(NodeKind.TRY_CATCH_CLAUSE, (NodeRenderer<TryCatchClause>) MetaRules::catchClause);
    }

    static String sourceUnit(SourceUnit u, RenderContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (u.getLicense() != null && !u.getLicense().isEmpty()) {
            sb.append("// SPDX-License-Identifier: ").append(u.getLicense()).append('\n');
            if (!u.getNodes().isEmpty()) sb.append('\n');
        }
        sb.append(Syntax.members(u.getNodes(), ctx));
        return sb.toString();
    }

    /**
     * {@code pragma solidity ^0.8.0;}. The compiler splits the version expression into tokens
     * such as {@code ^}, {@code 0.8}, {@code .0}; a space is kept between two constraints.
     */
    static String pragma(PragmaDirective p, RenderContext ctx) {
        List<String> literals = p.getLiterals();
        if (literals.isEmpty()) return "pragma;";
        StringBuilder sb = new StringBuilder("pragma ").append(literals.get(0));
        if (literals.size() > 1) sb.append(' ');
        String previous = null;
        for (String lit : literals.subList(1, literals.size())) {
            if (previous != null && startsConstraint(lit) && !startsConstraint(previous)) sb.append(' ');
            sb.append(lit);
            previous = lit;
        }
        return sb.append(';').toString();
    }

    private static boolean startsConstraint(String token) {
        if (token.isEmpty()) return false;
        char c = token.charAt(0);
        return c == '<' || c == '>' || c == '=' || c == '^' || c == '~' || c == '|';
    }

    static String importDirective(ImportDirective d, RenderContext ctx) {
        String file = Syntax.quote(d.getFile() == null ? d.getAbsolutePath() : d.getFile());
        if (!d.getSymbolAliases().isEmpty()) {
            StringBuilder sb = new StringBuilder("import {");
            List<SymbolAlias> aliases = d.getSymbolAliases();
            for (int i = 0; i < aliases.size(); i++) {
                if (i > 0) sb.append(", ");
                SymbolAlias a = aliases.get(i);
                sb.append(foreignName(a, d));
                if (a.hasLocal()) sb.append(" as ").append(a.local);
            }
            return sb.append("} from ").append(file).append(';').toString();
        }
        if (d.getUnitAlias() != null && !d.getUnitAlias().isEmpty()) {
            return "import " + file + " as " + d.getUnitAlias() + ";";
        }
        return "import " + file + ";";
    }

    private static String foreignName(SymbolAlias a, ImportDirective d) {
        if (a.foreignName != null) return a.foreignName;
        return a.foreign.target(Declaration.class)
                .map(Declaration::getName)
                .orElseThrow(() -> new IllegalStateException("Cannot name imported symbol " + a.foreign
                        + " of " + RenderContext.pathOf(d) + ": the declaration is not part of the tree"));
    }

    static String usingFor(UsingForDirective u, RenderContext ctx) {
        if (u.getParent().orElse(null) instanceof SourceUnit) ctx.require(VersionGates.FILE_LEVEL_USING_FOR, u);
        StringBuilder sb = new StringBuilder("using ");
        if (u.getLibraryName() != null) {
            sb.append(ctx.render(u.getLibraryName()));
        } else {
            ctx.require(VersionGates.USING_FOR_FUNCTION_LIST, u);
            sb.append('{');
            List<IdentifierPath> functions = u.getFunctionList();
            List<String> operators = u.getOperators();
            for (int i = 0; i < functions.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(ctx.render(functions.get(i)));
                String op = i < operators.size() ? operators.get(i) : null;
                if (op != null) {
                    ctx.require(VersionGates.USER_DEFINED_OPERATORS, u);
                    sb.append(" as ").append(op);
                }
            }
            sb.append('}');
        }
        sb.append(" for ").append(u.getTypeName() == null ? "*" : ctx.render(u.getTypeName()));
        if (u.isGlobal()) {
            ctx.require(VersionGates.GLOBAL_USING_FOR, u);
            sb.append(" global");
        }
        return sb.append(';').toString();
    }

    static String inheritanceSpecifier(InheritanceSpecifier s, RenderContext ctx) {
        String base = ctx.render(s.getBaseName());
        if (!s.isArgumentsPresent() && s.getArguments().isEmpty()) return base;
        return base + "(" + Syntax.join(s.getArguments(), ctx) + ")";
    }

    static String modifierInvocation(ModifierInvocation m, RenderContext ctx) {
        String name = ctx.render(m.getModifierName());
        if (!m.isArgumentsPresent() && m.getArguments().isEmpty()) return name;
        return name + "(" + Syntax.join(m.getArguments(), ctx) + ")";
    }

    static String overrideSpecifier(OverrideSpecifier o, RenderContext ctx) {
        if (o.getOverrides().isEmpty()) return "override";
        return "override(" + Syntax.join(o.getOverrides(), ctx) + ")";
    }

    static String documentation(StructuredDocumentation d, RenderContext ctx) {
        String doc = Syntax.docComment(d.getText(), ctx);
        if (doc.isEmpty()) return "";
        // strip the break that would precede the documented item
        return doc.substring(0, doc.length() - 1 - ctx.indent().length());
    }

    static String parameterList(ParameterList p, RenderContext ctx) {
        return "(" + Syntax.join(p.getParameters(), ctx) + ")";
    }

    /** The success clause renders as {@code returns (...) {...}}, the others as {@code catch ...}. */
    static String catchClause(TryCatchClause c, RenderContext ctx) {
        StringBuilder sb = new StringBuilder();
        AstNode parent = c.getParent().orElse(null);
        boolean success = parent instanceof TryStatement && ((TryStatement) parent).getClauses().indexOf(c) == 0;
        if (success) {
            if (c.getParameters() != null) sb.append("returns ").append(ctx.render(c.getParameters())).append(' ');
        } else {
            sb.append("catch ");
            if (c.getErrorName() != null && !c.getErrorName().isEmpty()) sb.append(c.getErrorName());
            if (c.getParameters() != null) sb.append(ctx.render(c.getParameters()));
            if (sb.charAt(sb.length() - 1) != ' ') sb.append(' ');
        }
        return sb.append(ctx.render(c.getBlock())).toString();
    }
}
