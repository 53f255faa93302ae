package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.expr.Identifier;
import info.isaksson.erland.solcast.node.expr.MemberAccess;
import info.isaksson.erland.solcast.node.meta.IdentifierPath;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.node.type.UserDefinedTypeName;
import info.isaksson.erland.solcast.version.SolcVersion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the declaration-to-usages index of the context from the resolved references of
 * identifiers, member accesses, identifier paths and user-defined type names, in tree order.
 */
public final class UsageIndexPass implements Postprocessor {

    @Override
    public String name() {
        return "usage-index";
    }

    @Override
    public void apply(List<SourceUnit> units, AstContext context, SolcVersion version) {
        Map<Long, List<AstNode>> index = new LinkedHashMap<>();
        for (SourceUnit unit : units) {
            for (AstNode n : unit.descendants(n -> true)) {
                NodeRef ref = referenceOf(n);
                if (ref == null || !ref.isResolved()) continue;
                index.computeIfAbsent(ref.getId(), k -> new ArrayList<>()).add(n);
            }
        }
        context.replaceUsages(index);
    }

    static NodeRef referenceOf(AstNode n) {
        if (n instanceof Identifier) return ((Identifier) n).getReferencedDeclaration();
        if (n instanceof MemberAccess) return ((MemberAccess) n).getReferencedDeclaration();
        if (n instanceof IdentifierPath) return ((IdentifierPath) n).getReferencedDeclaration();
        if (n instanceof UserDefinedTypeName) return ((UserDefinedTypeName) n).getReferencedDeclaration();
        return null;
    }
}
