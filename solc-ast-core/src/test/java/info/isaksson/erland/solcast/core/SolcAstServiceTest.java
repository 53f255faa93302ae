package info.isaksson.erland.solcast.core;

import info.isaksson.erland.solcast.error.MalformedTypeStringException;
import info.isaksson.erland.solcast.error.UnsupportedForTargetVersionException;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.read.CompilerOutput;
import info.isaksson.erland.solcast.read.ReadResult;
import info.isaksson.erland.solcast.version.SolcVersion;
import info.isaksson.erland.solcast.write.FormatPolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SolcAstServiceTest {

    private static final String EMPTY_UNITS = """
            { "sources": {
              "A.sol": { "id": 0, "ast": { "id": 1, "nodeType": "SourceUnit", "src": "0:0:0",
                "absolutePath": "A.sol", "license": "MIT", "nodes": [] } },
              "B.sol": { "id": 1, "ast": { "id": 2, "nodeType": "SourceUnit", "src": "0:0:1",
                "absolutePath": "B.sol", "nodes": [] } } } }
            """;

    private static final String BAD_TYPE = """
            { "sources": { "A.sol": { "id": 0, "ast": {
              "id": 1, "nodeType": "SourceUnit", "src": "0:0:0", "absolutePath": "A.sol",
              "nodes": [
                { "id": 2, "nodeType": "VariableDeclaration", "src": "0:0:0", "name": "m",
                  "constant": true, "mutability": "constant", "stateVariable": false,
                  "storageLocation": "default", "visibility": "internal",
                  "typeDescriptions": { "typeIdentifier": "t_bad", "typeString": "mapping(address =>" } }
              ] } } } }
            """;

    private final SolcAstService service = new SolcAstService();

    @Test
    void regeneratesLegacyOutputForItsOwnCompilerVersion() throws Exception {
        SolcAstResult result = service.regenerate(fixture("fixtures/legacy-counter.json"), null);

        assertEquals(SolcVersion.V0_4_11, result.targetVersion);
        assertEquals(1, result.sources.size());
        String text = result.text("Counter.sol").orElseThrow();
        assertTrue(text.contains("function Counter() public {"), text);
        assertTrue(text.contains("public constant returns (uint)"), text);
        assertSame(result.readResult.units.get(0), result.readResult.unit("Counter.sol").orElseThrow());
    }

    @Test
    void targetVersionOverridesTheCompilerVersion() throws Exception {
        SolcAstOptions options = new SolcAstOptions();
        options.targetVersion = SolcVersion.LATEST;

        SolcAstResult result = service.regenerate(fixture("fixtures/legacy-counter.json"), options);

        String text = result.text("Counter.sol").orElseThrow();
        assertTrue(text.contains("constructor() {"), text);
        assertTrue(text.contains("public view returns (uint)"), text);
    }

    @Test
    void targetThatCannotExpressTheTreeFailsTheWholeCall() throws Exception {
        SolcAstOptions options = new SolcAstOptions();
        options.targetVersion = SolcVersion.V0_8_0;

        UnsupportedForTargetVersionException ex = assertThrows(UnsupportedForTargetVersionException.class,
                () -> service.regenerate(fixture("fixtures/compact-vault.json"), options));
        assertEquals("custom errors", ex.getFeature());
    }

    @Test
    void writesSingleNodesForTheLatestVersionByDefault() throws Exception {
        ReadResult read = service.readJson(fixture("fixtures/compact-vault.json"), null);
        ContractDefinition vault = read.context.resolve(39, ContractDefinition.class);

        String text = service.write(vault, null);
        assertTrue(text.startsWith("/// @title Vault\ncontract Vault {\n"), text);

        SolcAstOptions options = new SolcAstOptions();
        options.formatPolicy = FormatPolicy.defaults().withTabs(true);
        assertTrue(service.write(vault, options).contains("\n\terror Insufficient(uint256 needed);\n"));
    }

    @Test
    void unitsAreKeyedByPathInSourceOrder() throws Exception {
        SolcAstResult result = service.writeAll(service.readJson(EMPTY_UNITS, null), null);

        assertEquals(SolcVersion.LATEST, result.targetVersion);
        assertArrayEquals(new String[]{"A.sol", "B.sol"}, result.sources.keySet().toArray());
        assertEquals("// SPDX-License-Identifier: MIT\n", result.text("A.sol").orElseThrow());
        assertTrue(result.text("C.sol").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> result.sources.put("C.sol", ""));
    }

    @Test
    void assumedVersionDrivesTheTargetWhenOutputHasNone() throws Exception {
        SolcAstOptions options = new SolcAstOptions();
        options.assumedVersion = SolcVersion.V0_5_0;

        SolcAstResult result = service.writeAll(service.readJson(EMPTY_UNITS, options), options);

        assertEquals(SolcVersion.V0_5_0, result.readResult.compilerVersion);
        assertEquals(SolcVersion.V0_5_0, result.targetVersion);
    }

    @Test
    void typeStringToleranceIsPassedToTheReader() throws Exception {
        assertThrows(MalformedTypeStringException.class, () -> service.readJson(BAD_TYPE, null));

        SolcAstOptions options = new SolcAstOptions();
        options.tolerateMalformedTypeStrings = true;
        assertEquals(1, service.readJson(BAD_TYPE, options).toleratedTypeStrings);
    }

    @Test
    void rejectsNullInputs() {
        assertThrows(IllegalArgumentException.class, () -> service.read((CompilerOutput) null, null));
        assertThrows(IllegalArgumentException.class, () -> service.readJson((String) null, null));
        assertThrows(IllegalArgumentException.class, () -> service.readJson((Path) null, null));
        assertThrows(IllegalArgumentException.class, () -> service.writeAll(null, null));
        assertThrows(IllegalArgumentException.class, () -> service.write(null, null));
        assertThrows(IllegalArgumentException.class, () -> service.regenerate(null, null));
    }

    private static Path fixture(String resource) throws Exception {
        return Path.of(SolcAstServiceTest.class.getClassLoader().getResource(resource).toURI());
    }
}
