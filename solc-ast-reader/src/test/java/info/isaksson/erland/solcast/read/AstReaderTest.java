package info.isaksson.erland.solcast.read;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.solcast.error.CompileDataMalformedException;
import info.isaksson.erland.solcast.error.DuplicateIdentityException;
import info.isaksson.erland.solcast.error.MalformedTypeStringException;
import info.isaksson.erland.solcast.error.UnsupportedNodeShapeException;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;
import info.isaksson.erland.solcast.node.meta.ImportDirective;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.node.type.UserDefinedTypeName;
import info.isaksson.erland.solcast.types.TypeKind;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AstReaderTest {

    private static final String TWO_UNITS = """
            {
              "version": "0.8.4",
              "sources": {
                "B.sol": {
                  "id": 1,
                  "ast": {
                    "id": 10, "nodeType": "SourceUnit", "src": "0:40:1", "absolutePath": "B.sol",
                    "nodes": [
                      { "id": 11, "nodeType": "ImportDirective", "src": "0:16:1", "file": "./A.sol",
                        "absolutePath": "A.sol", "sourceUnit": 1, "scope": 10, "symbolAliases": [], "unitAlias": "" },
                      { "id": 12, "nodeType": "VariableDeclaration", "src": "17:20:1", "name": "a",
                        "constant": true, "mutability": "constant", "stateVariable": false,
                        "storageLocation": "default", "visibility": "internal",
                        "typeDescriptions": { "typeIdentifier": "t_contract$_A_$2", "typeString": "contract A" },
                        "typeName": { "id": 13, "nodeType": "UserDefinedTypeName", "src": "17:1:1",
                          "name": "A", "referencedDeclaration": 2,
                          "typeDescriptions": { "typeIdentifier": "t_contract$_A_$2", "typeString": "contract A" } } }
                    ]
                  }
                },
                "A.sol": {
                  "id": 0,
                  "ast": {
                    "id": 1, "nodeType": "SourceUnit", "src": "0:14:0", "absolutePath": "A.sol",
                    "nodes": [
                      { "id": 2, "nodeType": "ContractDefinition", "src": "0:13:0", "name": "A",
                        "abstract": false, "contractKind": "contract", "linearizedBaseContracts": [2],
                        "baseContracts": [], "nodes": [], "scope": 1 }
                    ]
                  }
                }
              }
            }
            """;

    @Test
    void ordersUnitsBySourceIdAndResolvesAcrossSources() throws Exception {
        ReadResult result = new AstReader().read(CompilerOutputJson.readFromString(TWO_UNITS));

        assertEquals("A.sol", result.units.get(0).getAbsolutePath());
        assertEquals("B.sol", result.units.get(1).getAbsolutePath());

        ContractDefinition a = result.context.resolve(2, ContractDefinition.class);
        UserDefinedTypeName type = result.context.resolve(13, UserDefinedTypeName.class);
        assertSame(a, type.getReferencedDeclaration().target().orElseThrow());
        assertSame(result.units.get(0), result.context.resolve(11, ImportDirective.class).getSourceUnit().target().orElseThrow());
        assertFalse(type.getReferencedDeclaration().isExternal());
        assertEquals(1, result.context.usagesOf(a).size());
    }

    @Test
    void fillsSourceHashFromSuppliedContent() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString(TWO_UNITS);
        output.addSource(output.getSources().get("A.sol").withContent("contract A {}\n"));

        ReadResult result = new AstReader().read(output);

        SourceUnit a = result.unit("A.sol").orElseThrow();
        assertEquals("557a38667feac8bbe1a52d5cf82270fdcc2ed3d874cf4af6e70d2032743df0c7", a.getSourceHash());
        assertNull(result.unit("B.sol").orElseThrow().getSourceHash());
    }

    @Test
    void fallsBackToAssumedVersionWhenOutputHasNone() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString(TWO_UNITS).setCompilerVersion(null);
        ReadOptions options = ReadOptions.defaults();
        options.assumedVersion = SolcVersion.V0_8_0;

        ReadResult result = new AstReader(options).read(output);

        assertEquals(SolcVersion.V0_8_0, result.compilerVersion);
        assertNull(result.compilerVersionText);
    }

    @Test
    void compilerVersionIsWrittenBackOnce() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString("""
                { "compiler": { "version": "0.8.19" }, "errors": [],
                  "sources": { "A.sol": { "id": 0, "ast": { "id": 1, "nodeType": "SourceUnit", "src": "0:0:0", "nodes": [] } } } }
                """);

        assertEquals("0.8.19", output.getCompilerVersion());
        assertFalse(output.getAuxiliary().containsKey("compiler"));
        assertTrue(output.getAuxiliary().containsKey("errors"));

        JsonNode written = CompilerOutputJson.readAst(CompilerOutputJson.toJsonString(output));
        assertFalse(written.has("compiler"));
        assertEquals("0.8.19", written.get("version").asText());
    }

    @Test
    void otherCompilerDetailsStayAuxiliary() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString("""
                { "compiler": { "version": "0.8.19", "name": "solc" },
                  "sources": { "A.sol": { "id": 0, "ast": { "id": 1, "nodeType": "SourceUnit", "src": "0:0:0", "nodes": [] } } } }
                """);

        JsonNode compiler = output.getAuxiliary().get("compiler");
        assertEquals("solc", compiler.get("name").asText());
        assertFalse(compiler.has("version"));
    }

    @Test
    void rejectsOutputWithoutSources() throws Exception {
        CompilerOutput empty = CompilerOutputJson.readFromString("{\"sources\": {}}");
        assertThrows(CompileDataMalformedException.class, () -> new AstReader().read(empty));

        assertThrows(CompileDataMalformedException.class, () -> CompilerOutputJson.readFromString("{\"errors\": []}"));
        assertThrows(CompileDataMalformedException.class, () -> CompilerOutputJson.readFromString("[1, 2]"));
    }

    @Test
    void rejectsSourceUnitWithoutNodeListAsMalformedCompileData() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString("""
                { "sources": { "A.sol": { "id": 0, "ast": { "id": 1, "nodeType": "SourceUnit", "src": "0:0:0" } } } }
                """);

        CompileDataMalformedException e = assertThrows(CompileDataMalformedException.class,
                () -> new AstReader().read(output));
        assertEquals("/sources/A.sol/ast", e.getNodePath());
    }

    @Test
    void rejectsUntaggedRoot() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString("""
                { "sources": { "A.sol": { "id": 0, "ast": { "id": 1, "src": "0:0:0", "nodes": [] } } } }
                """);

        assertThrows(CompileDataMalformedException.class, () -> new AstReader().read(output));
    }

    @Test
    void reportsUnknownNodeKindWithItsPath() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString("""
                { "sources": { "A.sol": { "id": 0, "ast": {
                  "id": 1, "nodeType": "SourceUnit", "src": "0:0:0",
                  "nodes": [ { "id": 2, "nodeType": "Frobnicate", "src": "0:0:0" } ] } } } }
                """);

        UnsupportedNodeShapeException e = assertThrows(UnsupportedNodeShapeException.class,
                () -> new AstReader().read(output));
        assertEquals("Frobnicate", e.getNodeKind());
        assertEquals("compact", e.getSchemaVariant());
        assertEquals("/sources/A.sol/ast/nodes/0", e.getNodePath());
        assertTrue(e.getRawFragment().contains("Frobnicate"));
    }

    @Test
    void reportsMissingRequiredChild() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString("""
                { "sources": { "A.sol": { "id": 0, "ast": {
                  "id": 1, "nodeType": "SourceUnit", "src": "0:0:0",
                  "nodes": [ { "id": 2, "nodeType": "ContractDefinition", "src": "0:0:0", "name": "C",
                               "contractKind": "contract", "baseContracts": [] } ] } } } }
                """);

        UnsupportedNodeShapeException e = assertThrows(UnsupportedNodeShapeException.class,
                () -> new AstReader().read(output));
        assertEquals("ContractDefinition", e.getNodeKind());
    }

    @Test
    void rejectsDuplicateIdentities() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString("""
                { "sources": { "A.sol": { "id": 0, "ast": {
                  "id": 1, "nodeType": "SourceUnit", "src": "0:0:0",
                  "nodes": [
                    { "id": 2, "nodeType": "PragmaDirective", "src": "0:0:0", "literals": ["solidity"] },
                    { "id": 2, "nodeType": "PragmaDirective", "src": "1:0:0", "literals": ["abicoder", "v2"] }
                  ] } } } }
                """);

        DuplicateIdentityException e = assertThrows(DuplicateIdentityException.class,
                () -> new AstReader().read(output));
        assertEquals(2, e.getIdentity());
        assertEquals("/sources/A.sol/ast/nodes/1", e.getNodePath());
    }

    private static final String BAD_TYPE = """
            { "sources": { "A.sol": { "id": 0, "ast": {
              "id": 1, "nodeType": "SourceUnit", "src": "0:0:0",
              "nodes": [
                { "id": 2, "nodeType": "VariableDeclaration", "src": "0:0:0", "name": "m",
                  "constant": true, "mutability": "constant", "stateVariable": false,
                  "storageLocation": "default", "visibility": "internal",
                  "typeDescriptions": { "typeIdentifier": "t_bad", "typeString": "mapping(address =>" } }
              ] } } } }
            """;

    @Test
    void malformedTypeStringFailsTheReadByDefault() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString(BAD_TYPE);

        MalformedTypeStringException e = assertThrows(MalformedTypeStringException.class,
                () -> new AstReader().read(output));
        assertEquals("mapping(address =>", e.getTypeString());
        assertEquals("VariableDeclaration", e.getNodeKind());
        assertEquals("/sources/A.sol/ast/nodes/0", e.getNodePath());
    }

    @Test
    void tolerantModeKeepsMalformedTypeStringOpaque() throws Exception {
        ReadOptions options = ReadOptions.defaults();
        options.tolerateMalformedTypeStrings = true;

        ReadResult result = new AstReader(options).read(CompilerOutputJson.readFromString(BAD_TYPE));

        assertEquals(1, result.toleratedTypeStrings);
        VariableDeclaration m = result.context.resolve(2, VariableDeclaration.class);
        assertEquals(TypeKind.OPAQUE, m.getTypeDescriptions().descriptor.kind);
        assertEquals("mapping(address =>", m.getTypeDescriptions().typeString);
    }

    @Test
    void compactSchemaWinsWhenBothAstsArePresent() throws Exception {
        CompilerOutput output = CompilerOutputJson.readFromString("""
                { "sources": { "A.sol": { "id": 0,
                  "ast": { "id": 1, "nodeType": "SourceUnit", "src": "0:0:0", "nodes": [] },
                  "legacyAST": { "id": 1, "name": "SourceUnit", "src": "0:0:0", "children": [] } } } }
                """);

        ReadResult result = new AstReader().read(output);
        assertEquals(SchemaVariant.MODERN, result.variants.get("A.sol"));

        JsonNode ast = output.getSources().get("A.sol").ast;
        assertTrue(ast.has("nodeType"));
    }
}
