package info.isaksson.erland.solcast.read.legacy;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.error.UnsupportedNodeShapeException;
import info.isaksson.erland.solcast.node.LiteralKind;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.expr.Literal;
import info.isaksson.erland.solcast.node.expr.TupleExpression;
import info.isaksson.erland.solcast.node.stmt.ForStatement;
import info.isaksson.erland.solcast.node.stmt.VariableDeclarationStatement;
import info.isaksson.erland.solcast.read.AstReader;
import info.isaksson.erland.solcast.read.CompilerOutputJson;
import info.isaksson.erland.solcast.read.ReadResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LegacyProcessorsTest {

    private static final String WRAPPER = """
            { "version": "0.4.24", "sources": { "L.sol": { "id": 0, "legacyAST": {
              "id": 1, "name": "SourceUnit", "src": "0:0:0", "attributes": { "absolutePath": "L.sol" },
              "children": [
                { "id": 3, "name": "ContractDefinition", "src": "0:0:0",
                  "attributes": { "name": "L", "contractKind": "contract", "linearizedBaseContracts": [3] },
                  "children": [
                    { "id": 50, "name": "VariableDeclaration", "src": "0:0:0",
                      "attributes": { "name": "i", "type": "uint256", "stateVariable": true, "constant": false,
                                      "visibility": "internal", "storageLocation": "default" },
                      "children": [ { "id": 51, "name": "ElementaryTypeName", "src": "0:0:0",
                                      "attributes": { "name": "uint", "type": "uint256" } } ] },
                    { "id": 4, "name": "FunctionDefinition", "src": "0:0:0",
                      "attributes": { "name": "f", "visibility": "public", "constant": false, "payable": false,
                                      "implemented": true },
                      "children": [
                        { "id": 5, "name": "ParameterList", "src": "0:0:0", "children": [] },
                        { "id": 6, "name": "ParameterList", "src": "0:0:0", "children": [] },
                        { "id": 7, "name": "Block", "src": "0:0:0", "children": [ $BODY ] }
                      ] }
                  ] }
              ] } } } }
            """;

    private static ReadResult read(String body) throws Exception {
        return new AstReader().read(CompilerOutputJson.readFromString(WRAPPER.replace("$BODY", body)));
    }

    private static String ident(int id, String name, int ref) {
        return "{ \"id\": " + id + ", \"name\": \"Identifier\", \"src\": \"0:1:0\", \"attributes\": "
                + "{ \"value\": \"" + name + "\", \"referencedDeclaration\": " + ref + ", \"type\": \"uint256\" } }";
    }

    private static String number(int id, String value) {
        return "{ \"id\": " + id + ", \"name\": \"Literal\", \"src\": \"0:1:0\", \"attributes\": "
                + "{ \"token\": \"number\", \"type\": \"int_const " + value + "\", \"value\": \"" + value + "\" } }";
    }

    private static String increment(int statementId, int identId) {
        return "{ \"id\": " + statementId + ", \"name\": \"ExpressionStatement\", \"src\": \"0:1:0\", \"children\": ["
                + "{ \"id\": " + (statementId + 1) + ", \"name\": \"UnaryOperation\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"operator\": \"++\", \"prefix\": false, \"type\": \"uint256\" }, "
                + "\"children\": [" + ident(identId, "i", 50) + "] } ] }";
    }

    private static String assign(int statementId, String operator, int identId, int literalId, String value) {
        return "{ \"id\": " + statementId + ", \"name\": \"ExpressionStatement\", \"src\": \"0:1:0\", \"children\": ["
                + "{ \"id\": " + (statementId + 1) + ", \"name\": \"Assignment\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"operator\": \"" + operator + "\", \"type\": \"uint256\" }, "
                + "\"children\": [" + ident(identId, "i", 50) + ", " + number(literalId, value) + "] } ] }";
    }

    private static String lessThan(int id, int identId, int literalId) {
        return "{ \"id\": " + id + ", \"name\": \"BinaryOperation\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"operator\": \"<\", \"type\": \"bool\", \"commonType\": { \"typeString\": \"uint256\" } }, "
                + "\"children\": [" + ident(identId, "i", 50) + ", " + number(literalId, "10") + "] }";
    }

    private static final String EMPTY_BLOCK = "{ \"id\": %d, \"name\": \"Block\", \"src\": \"0:1:0\", \"children\": [] }";

    @Test
    void forWithAllFourPartsIsReadPositionally() throws Exception {
        String body = "{ \"id\": 100, \"name\": \"ForStatement\", \"src\": \"0:1:0\", \"children\": ["
                + assign(101, "=", 103, 104, "0") + ", "
                + lessThan(105, 106, 107) + ", "
                + increment(108, 110) + ", "
                + String.format(EMPTY_BLOCK, 111) + "] }";

        AstContext ctx = read(body).context;
        ForStatement f = ctx.resolve(100, ForStatement.class);
        assertEquals(101, f.getInitializationExpression().getId());
        assertEquals(105, f.getCondition().getId());
        assertEquals(108, f.getLoopExpression().getId());
        assertEquals(111, f.getBody().getId());
    }

    @Test
    void forWithAnnouncedMissingInitializer() throws Exception {
        String body = "{ \"id\": 120, \"name\": \"ForStatement\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"initializationExpression\": null }, \"children\": ["
                + lessThan(121, 122, 123) + ", "
                + increment(124, 126) + ", "
                + String.format(EMPTY_BLOCK, 127) + "] }";

        ReadResult result = read(body);
        ForStatement f = result.context.resolve(120, ForStatement.class);
        assertNull(f.getInitializationExpression());
        assertEquals(121, f.getCondition().getId());
        assertEquals(124, f.getLoopExpression().getId());
        assertFalse(f.getExtras().containsKey("initializationExpression"));
    }

    @Test
    void forWithoutMarkersClassifiesPlainAssignmentAsInitializer() throws Exception {
        String body = "{ \"id\": 130, \"name\": \"ForStatement\", \"src\": \"0:1:0\", \"children\": ["
                + assign(131, "=", 133, 134, "0") + ", "
                + assign(135, "+=", 137, 138, "1") + ", "
                + String.format(EMPTY_BLOCK, 139) + "] }";

        ForStatement f = read(body).context.resolve(130, ForStatement.class);
        assertEquals(131, f.getInitializationExpression().getId());
        assertNull(f.getCondition());
        assertEquals(135, f.getLoopExpression().getId());
    }

    @Test
    void forWithoutMarkersTreatsLoneIncrementAsLoopExpression() throws Exception {
        String body = "{ \"id\": 140, \"name\": \"ForStatement\", \"src\": \"0:1:0\", \"children\": ["
                + increment(141, 143) + ", "
                + String.format(EMPTY_BLOCK, 144) + "] }";

        ForStatement f = read(body).context.resolve(140, ForStatement.class);
        assertNull(f.getInitializationExpression());
        assertNull(f.getCondition());
        assertEquals(141, f.getLoopExpression().getId());
        assertEquals(NodeKind.BLOCK, f.getBody().getKind());
    }

    @Test
    void declarationStatementRebuildsEmptyTupleSlots() throws Exception {
        String body = "{ \"id\": 150, \"name\": \"VariableDeclarationStatement\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"assignments\": [null, 151] }, \"children\": ["
                + "{ \"id\": 151, \"name\": \"VariableDeclaration\", \"src\": \"0:1:0\", \"attributes\": "
                + "{ \"name\": \"b\", \"type\": \"uint256\", \"constant\": false, \"stateVariable\": false, "
                + "\"storageLocation\": \"default\", \"visibility\": \"internal\" }, \"children\": ["
                + "{ \"id\": 152, \"name\": \"ElementaryTypeName\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"name\": \"uint\", \"type\": \"uint256\" } } ] }, "
                + "{ \"id\": 153, \"name\": \"Identifier\", \"src\": \"0:1:0\", \"attributes\": "
                + "{ \"value\": \"pair\", \"referencedDeclaration\": 50, \"type\": \"tuple(uint256,uint256)\" } } ] }";

        VariableDeclarationStatement v = read(body).context.resolve(150, VariableDeclarationStatement.class);
        assertEquals(2, v.getDeclarations().size());
        assertNull(v.getDeclarations().get(0));
        assertEquals(151, v.getDeclarations().get(1).getId());
        assertEquals(153, v.getInitialValue().getId());
    }

    @Test
    void infersLiteralKindWhenOutputNamesNone() throws Exception {
        String body = "{ \"id\": 160, \"name\": \"ExpressionStatement\", \"src\": \"0:1:0\", \"children\": ["
                + "{ \"id\": 161, \"name\": \"Literal\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"type\": \"bool\", \"value\": \"true\" } } ] }, "
                + "{ \"id\": 162, \"name\": \"ExpressionStatement\", \"src\": \"0:1:0\", \"children\": ["
                + "{ \"id\": 163, \"name\": \"Literal\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"type\": \"literal_string \\\"abc\\\"\", \"value\": \"abc\" } } ] }, "
                + "{ \"id\": 164, \"name\": \"ExpressionStatement\", \"src\": \"0:1:0\", \"children\": ["
                + "{ \"id\": 165, \"name\": \"Literal\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"token\": \"hexString\", \"value\": \"ab\" } } ] }";

        AstContext ctx = read(body).context;
        assertEquals(LiteralKind.BOOL, ctx.resolve(161, Literal.class).getLiteralKind());
        assertEquals(LiteralKind.STRING, ctx.resolve(163, Literal.class).getLiteralKind());
        assertEquals(LiteralKind.HEX_STRING, ctx.resolve(165, Literal.class).getLiteralKind());
    }

    @Test
    void kindsOnlyKnownToCompactOutputAreRejected() throws Exception {
        String body = "{ \"id\": 170, \"name\": \"UncheckedBlock\", \"src\": \"0:1:0\", \"children\": [] }";

        UnsupportedNodeShapeException e = assertThrows(UnsupportedNodeShapeException.class, () -> read(body));
        assertEquals("UncheckedBlock", e.getNodeKind());
        assertEquals("legacy", e.getSchemaVariant());
        assertEquals("/sources/L.sol/legacyAST/children/0/children/1/children/2/children/0", e.getNodePath());
    }

    @Test
    void tupleKeepsLeadingHoles() throws Exception {
        String body = "{ \"id\": 180, \"name\": \"ExpressionStatement\", \"src\": \"0:1:0\", \"children\": ["
                + "{ \"id\": 181, \"name\": \"Assignment\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"operator\": \"=\", \"type\": \"tuple()\" }, \"children\": ["
                + "{ \"id\": 182, \"name\": \"TupleExpression\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"type\": \"tuple(,uint256)\" }, \"children\": [ null, " + ident(183, "i", 50) + " ] }, "
                + "{ \"id\": 184, \"name\": \"TupleExpression\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"type\": \"tuple(int_const 1,int_const 2)\" }, \"children\": [ "
                + number(185, "1") + ", " + number(186, "2") + " ] } ] } ] }";

        AstContext ctx = read(body).context;
        TupleExpression holed = ctx.resolve(182, TupleExpression.class);
        assertEquals(2, holed.getComponents().size());
        assertNull(holed.getComponents().get(0));
        assertEquals(183, holed.getComponents().get(1).getId());
        assertEquals(2, ctx.resolve(184, TupleExpression.class).getComponents().size());
    }

    @Test
    void assemblyWithoutOperationsOrAstIsRejected() throws Exception {
        String body = "{ \"id\": 190, \"name\": \"InlineAssembly\", \"src\": \"0:1:0\", "
                + "\"attributes\": { \"externalReferences\": [null] } }";

        UnsupportedNodeShapeException e = assertThrows(UnsupportedNodeShapeException.class, () -> read(body));
        assertEquals("InlineAssembly", e.getNodeKind());
    }
}
