package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.error.UnsupportedForTargetVersionException;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.read.AstReader;
import info.isaksson.erland.solcast.read.CompilerOutputJson;
import info.isaksson.erland.solcast.read.ReadResult;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SourceWriterTest {

    private static final String COUNTER_0_4_11 = """
            pragma solidity ^0.4.11;

            /// Simple counter.
            contract Counter {
                uint public count;

                function Counter() public {
                    count = 0;
                }

                function increment() public {
                    require(count < 100);
                    count++;
                }

                function current() public constant returns (uint) {
                    return count;
                }
            }
            """;

    private static final String COUNTER_LATEST = """
            pragma solidity ^0.4.11;

            /// Simple counter.
            contract Counter {
                uint public count;

                constructor() {
                    count = 0;
                }

                function increment() public {
                    require(count < 100);
                    count++;
                }

                function current() public view returns (uint) {
                    return count;
                }
            }
            """;

    private static final String VAULT = """
            // SPDX-License-Identifier: MIT

            pragma solidity ^0.8.19;

            import {IToken} from "./IToken.sol";

            /// @title Vault
            contract Vault {
                error Insufficient(uint256 needed);

                mapping(address => uint256) private balances;
                IToken public immutable token;

                function withdraw(uint256 amount) external {
                    if (balances[msg.sender] < amount)
                        revert Insufficient(amount);
                    unchecked {
                        balances[msg.sender] -= amount;
                    }
                }
            }
            """;

    @Test
    void writesLegacyOutputWithOldSpellings() throws Exception {
        SourceUnit unit = read("fixtures/legacy-counter.json").units.get(0);
        assertEquals(COUNTER_0_4_11, SourceWriter.write(unit, SolcVersion.V0_4_11));
    }

    @Test
    void writesLegacyOutputForTheLatestCompiler() throws Exception {
        SourceUnit unit = read("fixtures/legacy-counter.json").units.get(0);
        assertEquals(COUNTER_LATEST, SourceWriter.write(unit, SolcVersion.LATEST));
    }

    @Test
    void legacyTupleHolesAndTextualAssemblySurviveWriting() throws Exception {
        ReadResult result = read("fixtures/legacy-tuple.json");
        String text = SourceWriter.write(result.units.get(0), result.compilerVersion);

        assertTrue(text.contains("function pair() internal pure returns (uint, uint) {\n        return (1, 2);\n"), text);
        assertTrue(text.contains("\n        (, x) = pair();\n"), text);
        assertTrue(text.contains("\n        assembly { mstore(0, 1) }\n"), text);
    }

    @Test
    void writesCompactOutputForItsOwnCompilerVersion() throws Exception {
        ReadResult result = read("fixtures/compact-vault.json");
        SourceUnit unit = result.units.get(0);
        assertEquals(VAULT, SourceWriter.write(unit, result.compilerVersion));
    }

    @Test
    void writingTwiceYieldsIdenticalText() throws Exception {
        SourceUnit unit = read("fixtures/compact-vault.json").units.get(0);
        String first = SourceWriter.write(unit, SolcVersion.LATEST);
        String second = SourceWriter.write(unit, SolcVersion.LATEST);
        assertEquals(first, second, "Writing twice must produce identical output.");
    }

    @Test
    void failsWholeCallWhenATargetCannotExpressTheTree() throws Exception {
        SourceUnit unit = read("fixtures/compact-vault.json").units.get(0);

        UnsupportedForTargetVersionException ex = assertThrows(UnsupportedForTargetVersionException.class,
                () -> SourceWriter.write(unit, SolcVersion.V0_8_0));
        assertEquals("custom errors", ex.getFeature());
        assertEquals(SolcVersion.V0_8_0, ex.getTargetVersion());
        assertEquals("ErrorDefinition", ex.getNodeKind());
        assertEquals("/SourceUnit#40/ContractDefinition#39/ErrorDefinition#30", ex.getNodePath());
        assertTrue(ex.getMessage().contains("requires solc >= 0.8.4"), ex.getMessage());
    }

    @Test
    void formatPolicyChangesLayoutOnly() throws Exception {
        SourceUnit unit = read("fixtures/legacy-counter.json").units.get(0);

        String tabs = SourceWriter.write(unit, SolcVersion.LATEST, FormatPolicy.defaults().withTabs(true));
        assertTrue(tabs.contains("\n\tuint public count;\n"));
        assertTrue(tabs.contains("\n\t\tcount = 0;\n"));

        String compact = SourceWriter.write(unit, SolcVersion.LATEST,
                FormatPolicy.defaults().withCompact(true).withIndentWidth(2).withFinalNewline(false));
        assertEquals("""
                pragma solidity ^0.4.11;
                /// Simple counter.
                contract Counter {
                  uint public count;
                  constructor() {
                    count = 0;
                  }
                  function increment() public {
                    require(count < 100);
                    count++;
                  }
                  function current() public view returns (uint) {
                    return count;
                  }
                }""", compact);
    }

    @Test
    void writesSubtreesWithoutTrailingNewline() throws Exception {
        ReadResult result = read("fixtures/compact-vault.json");
        assertEquals("mapping(address => uint256)",
                SourceWriter.write(result.context.resolve(7), SolcVersion.LATEST));
        assertEquals("balances[msg.sender] < amount",
                SourceWriter.write(result.context.resolve(15), SolcVersion.LATEST));
    }

    @Test
    void writesMutatedTrees() throws Exception {
        ReadResult result = read("fixtures/legacy-counter.json");
        SourceUnit unit = result.units.get(0);

        // drop the require(...) statement from increment()
        result.context.resolve(33).remove();

        String text = SourceWriter.write(unit, SolcVersion.LATEST);
        assertFalse(text.contains("require"));
        assertTrue(text.contains("function increment() public {\n        count++;\n    }"));
    }

    @Test
    void rejectsMissingArguments() {
        assertThrows(IllegalArgumentException.class, () -> SourceWriter.write(null, SolcVersion.LATEST));
        assertThrows(IllegalArgumentException.class, () -> SourceWriter.write(Trees.id("x"), null));
        assertEquals("x", SourceWriter.write(Trees.id("x"), SolcVersion.LATEST, null, null));
    }

    static ReadResult read(String resource) throws Exception {
        Path path = Path.of(SourceWriterTest.class.getClassLoader().getResource(resource).toURI());
        return new AstReader().read(CompilerOutputJson.read(path));
    }
}
