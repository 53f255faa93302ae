package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.node.FunctionKind;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.version.SolcVersion;

import java.util.List;

/**
 * Synthesizes {@link FunctionKind} for output that predates the {@code kind} field (before 0.5):
 * the constructor flag wins, then file-level functions are free functions, unnamed functions are
 * fallbacks, and a function named like its contract is the old-style constructor (before 0.5 or
 * when the version is unknown). Also settles the {@code abstract} flag of contracts, which only
 * exists from 0.6.
 */
public final class FunctionKindPass implements Postprocessor {

    @Override
    public String name() {
        return "function-kind";
    }

    @Override
    public void apply(List<SourceUnit> units, AstContext context, SolcVersion version) {
        for (SourceUnit unit : units) {
            for (FunctionDefinition f : unit.descendants(FunctionDefinition.class)) {
                if (f.getFunctionKind() == null) f.setFunctionKind(infer(f, version));
            }
            for (ContractDefinition c : unit.descendants(ContractDefinition.class)) {
                if (c.getAbstractContract() == null) c.setAbstractContract(false);
            }
        }
    }

    static FunctionKind infer(FunctionDefinition f, SolcVersion version) {
        if (Boolean.TRUE.equals(f.getConstructorFlag())) return FunctionKind.CONSTRUCTOR;
        ContractDefinition contract = f.getParent()
                .filter(ContractDefinition.class::isInstance)
                .map(ContractDefinition.class::cast)
                .orElse(null);
        if (contract == null) return FunctionKind.FREE_FUNCTION;
        String name = f.getName();
        if (name == null || name.isEmpty()) return FunctionKind.FALLBACK;
        boolean oldStyleConstructors = version == null || version.isBefore(SolcVersion.V0_5_0);
        if (oldStyleConstructors && name.equals(contract.getName())) return FunctionKind.CONSTRUCTOR;
        return FunctionKind.FUNCTION;
    }
}
