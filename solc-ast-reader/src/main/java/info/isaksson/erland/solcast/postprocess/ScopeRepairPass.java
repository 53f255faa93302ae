package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.decl.Declaration;
import info.isaksson.erland.solcast.node.meta.ImportDirective;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.version.SolcVersion;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Fills missing {@code scope} links with the nearest enclosing scope-opening node. */
public final class ScopeRepairPass implements Postprocessor {

    static final Set<NodeKind> SCOPE_KINDS = EnumSet.of(
            NodeKind.SOURCE_UNIT, NodeKind.CONTRACT_DEFINITION, NodeKind.FUNCTION_DEFINITION,
            NodeKind.MODIFIER_DEFINITION, NodeKind.EVENT_DEFINITION, NodeKind.ERROR_DEFINITION,
            NodeKind.STRUCT_DEFINITION, NodeKind.ENUM_DEFINITION, NodeKind.BLOCK, NodeKind.UNCHECKED_BLOCK,
            NodeKind.FOR_STATEMENT, NodeKind.TRY_CATCH_CLAUSE);

    @Override
    public String name() {
        return "scope-repair";
    }

    @Override
    public void apply(List<SourceUnit> units, AstContext context, SolcVersion version) {
        for (SourceUnit unit : units) {
            for (AstNode n : unit.descendants(n -> n instanceof Declaration || n instanceof ImportDirective)) {
                AstNode scope = n.nearestAncestor(a -> SCOPE_KINDS.contains(a.getKind())).orElse(null);
                if (scope == null) continue;
                if (n instanceof Declaration) {
                    Declaration d = (Declaration) n;
                    if (d.getScope() == null) d.setScope(context.reference(scope.getId()));
                } else {
                    ImportDirective i = (ImportDirective) n;
                    if (i.getScope() == null) i.setScope(context.reference(scope.getId()));
                }
            }
        }
    }
}
