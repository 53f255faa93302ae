package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.node.FunctionKind;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionKindPassTest {

    private static FunctionDefinition memberOf(ContractDefinition contract, long id, String name) {
        FunctionDefinition f = new FunctionDefinition(id, null);
        f.setName(name);
        contract.getNodes().add(f);
        return f;
    }

    private static ContractDefinition contract(String name) {
        ContractDefinition c = new ContractDefinition(1, null);
        c.setName(name);
        return c;
    }

    @Test
    void functionNamedLikeItsContractIsConstructorOnlyBefore050() {
        FunctionDefinition f = memberOf(contract("Token"), 2, "Token");

        assertEquals(FunctionKind.CONSTRUCTOR, FunctionKindPass.infer(f, SolcVersion.of(0, 4, 24)));
        assertEquals(FunctionKind.CONSTRUCTOR, FunctionKindPass.infer(f, null));
        assertEquals(FunctionKind.FUNCTION, FunctionKindPass.infer(f, SolcVersion.V0_5_0));
    }

    @Test
    void constructorFlagWinsOverName() {
        FunctionDefinition f = memberOf(contract("Token"), 2, "");
        f.setConstructorFlag(true);

        assertEquals(FunctionKind.CONSTRUCTOR, FunctionKindPass.infer(f, SolcVersion.V0_6_0));
    }

    @Test
    void unnamedMemberIsFallback() {
        FunctionDefinition f = memberOf(contract("Token"), 2, "");

        assertEquals(FunctionKind.FALLBACK, FunctionKindPass.infer(f, SolcVersion.of(0, 4, 24)));
    }

    @Test
    void fileLevelFunctionIsFree() {
        SourceUnit unit = new SourceUnit(1, null);
        FunctionDefinition f = new FunctionDefinition(2, null);
        f.setName("helper");
        unit.getNodes().add(f);

        assertEquals(FunctionKind.FREE_FUNCTION, FunctionKindPass.infer(f, SolcVersion.V0_7_0));
    }

    @Test
    void applyKeepsKindsTheCompilerReported() {
        SourceUnit unit = new SourceUnit(1, null);
        ContractDefinition c = contract("Token");
        unit.getNodes().add(c);
        FunctionDefinition receive = memberOf(c, 2, "");
        receive.setFunctionKind(FunctionKind.RECEIVE);

        new FunctionKindPass().apply(List.of(unit), null, SolcVersion.V0_6_0);

        assertEquals(FunctionKind.RECEIVE, receive.getFunctionKind());
        assertEquals(Boolean.FALSE, c.getAbstractContract());
    }

    @Test
    void stateMutabilityFollowsLegacyFlags() {
        assertEquals(StateMutability.PAYABLE, MutabilityPass.fromFlags(true, false));
        assertEquals(StateMutability.VIEW, MutabilityPass.fromFlags(false, true));
        assertEquals(StateMutability.NONPAYABLE, MutabilityPass.fromFlags(null, null));
    }
}
