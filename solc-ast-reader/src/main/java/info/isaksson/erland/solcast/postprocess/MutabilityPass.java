package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.node.Mutability;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.node.type.FunctionTypeName;
import info.isaksson.erland.solcast.version.SolcVersion;

import java.util.List;

/**
 * Synthesizes {@link StateMutability} from the pre-0.4.16 {@code constant}/{@code payable} flags
 * and {@link Mutability} (absent before 0.6.5) from the {@code constant} flag of variables.
 */
public final class MutabilityPass implements Postprocessor {

    @Override
    public String name() {
        return "mutability";
    }

    @Override
    public void apply(List<SourceUnit> units, AstContext context, SolcVersion version) {
        for (SourceUnit unit : units) {
            for (FunctionDefinition f : unit.descendants(FunctionDefinition.class)) {
                if (f.getStateMutability() == null) {
                    f.setStateMutability(fromFlags(f.getPayableFlag(), f.getConstantFlag()));
                }
            }
            for (FunctionTypeName t : unit.descendants(FunctionTypeName.class)) {
                if (t.getStateMutability() == null) {
                    t.setStateMutability(fromFlags(t.getPayableFlag(), t.getConstantFlag()));
                }
            }
            for (VariableDeclaration v : unit.descendants(VariableDeclaration.class)) {
                if (v.getMutability() == null) {
                    v.setMutability(v.isConstantFlag() ? Mutability.CONSTANT : Mutability.MUTABLE);
                }
            }
        }
    }

    static StateMutability fromFlags(Boolean payable, Boolean constant) {
        if (Boolean.TRUE.equals(payable)) return StateMutability.PAYABLE;
        if (Boolean.TRUE.equals(constant)) return StateMutability.VIEW;
        return StateMutability.NONPAYABLE;
    }
}
