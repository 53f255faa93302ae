package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.FunctionCallKind;
import info.isaksson.erland.solcast.node.expr.FunctionCall;
import info.isaksson.erland.solcast.node.meta.IdentifierPath;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.node.type.UserDefinedTypeName;
import info.isaksson.erland.solcast.version.SolcVersion;

import java.util.List;

/**
 * Gives both schemas the same shape for user-defined type names (name and reference always set,
 * also when 0.8+ output only carries them on the {@code pathNode}) and for the kind of function
 * calls (legacy output only has boolean flags).
 */
public final class TypeNameHarmonizationPass implements Postprocessor {

    @Override
    public String name() {
        return "type-name-harmonization";
    }

    @Override
    public void apply(List<SourceUnit> units, AstContext context, SolcVersion version) {
        for (SourceUnit unit : units) {
            for (UserDefinedTypeName t : unit.descendants(UserDefinedTypeName.class)) {
                IdentifierPath path = t.getPathNode();
                if (path == null) continue;
                if (t.getName() == null) t.setName(path.getName());
                if (t.getReferencedDeclaration() == null && path.getReferencedDeclaration() != null) {
                    NodeRef source = path.getReferencedDeclaration();
                    NodeRef copy = context.reference(source.getId());
                    if (source.isExternal()) copy.markExternal();
                    t.setReferencedDeclaration(copy);
                }
            }
            for (FunctionCall call : unit.descendants(FunctionCall.class)) {
                if (call.getCallKind() != null) continue;
                if (Boolean.TRUE.equals(call.getTypeConversionFlag())) {
                    call.setCallKind(FunctionCallKind.TYPE_CONVERSION);
                } else if (Boolean.TRUE.equals(call.getStructConstructorCallFlag())) {
                    call.setCallKind(FunctionCallKind.STRUCT_CONSTRUCTOR_CALL);
                } else {
                    call.setCallKind(FunctionCallKind.FUNCTION_CALL);
                }
            }
        }
    }
}
