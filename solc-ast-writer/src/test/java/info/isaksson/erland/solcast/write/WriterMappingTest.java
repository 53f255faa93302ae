package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.FunctionKind;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.expr.Assignment;
import info.isaksson.erland.solcast.node.expr.Identifier;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.junit.jupiter.api.Test;

import static info.isaksson.erland.solcast.write.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class WriterMappingTest {

    @Test
    void standardMappingCoversEveryNodeKind() {
        for (NodeKind kind : NodeKind.values()) {
            assertTrue(WriterMapping.standard().hasRule(kind), "no rule for " + kind.rawName());
        }
    }

    @Test
    void overridingOneKindLeavesTheOthersAlone() {
        WriterMapping upper = WriterMapping.standard().<Identifier>withRule(NodeKind.IDENTIFIER,
                (i, ctx) -> i.getName().toUpperCase());

        assertEquals("A + B", SourceWriter.write(binary(id("a"), "+", id("b")), SolcVersion.LATEST,
                FormatPolicy.defaults(), upper));
        assertEquals("a + b", SourceWriter.write(binary(id("a"), "+", id("b")), SolcVersion.LATEST));
    }

    @Test
    void customRulesCanDelegateBackToTheContext() {
        WriterMapping annotated = WriterMapping.standard().<FunctionDefinition>withRule(NodeKind.FUNCTION_DEFINITION,
                (f, ctx) -> "// " + f.getName() + "\n" + ctx.indent() + DeclarationRules.function(f, ctx));
        ContractDefinition c = contract("C",
                function("f", FunctionKind.FUNCTION, Visibility.PUBLIC, StateMutability.NONPAYABLE));

        assertEquals("contract C {\n    // f\n    function f() public {}\n}",
                SourceWriter.write(c, SolcVersion.LATEST, null, annotated));
    }

    @Test
    void rejectsNullRules() {
        assertThrows(IllegalArgumentException.class, () -> WriterMapping.standard().withRule(null, (n, ctx) -> ""));
        assertThrows(IllegalArgumentException.class, () -> WriterMapping.standard().withRule(NodeKind.BLOCK, null));
    }

    @Test
    void formatPolicyIndentation() {
        assertEquals("", FormatPolicy.defaults().indent(0));
        assertEquals("        ", FormatPolicy.defaults().indent(2));
        assertEquals("\t\t", FormatPolicy.defaults().withTabs(true).indent(2));
        assertThrows(IllegalArgumentException.class, () -> FormatPolicy.defaults().withIndentWidth(-1));
    }

    @Test
    void versionGateBounds() {
        assertTrue(VersionGates.UNCHECKED.allows(SolcVersion.V0_8_0));
        assertFalse(VersionGates.UNCHECKED.allows(SolcVersion.of(0, 7, 6)));
        assertTrue(VersionGates.THROW.allows(SolcVersion.of(0, 4, 26)));
        assertFalse(VersionGates.THROW.allows(SolcVersion.V0_5_0));
        assertEquals("requires solc >= 0.8.0", VersionGates.UNCHECKED.requirement());
        assertEquals("removed in solc 0.5.0", VersionGates.THROW.requirement());
    }

    @Test
    void printUsesTheRegisteredWriter() {
        Assignment a = new Assignment(nextId(), null);
        a.setLeftHandSide(id("x"));
        a.setOperator("+=");
        a.setRightHandSide(number("1"));

        assertEquals("x += 1", a.print());
        assertEquals("contract C {}", contract("C").print());
    }
}
