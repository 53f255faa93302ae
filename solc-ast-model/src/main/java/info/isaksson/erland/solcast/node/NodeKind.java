package info.isaksson.erland.solcast.node;

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of node variants. {@link #rawName()} is the discriminant used by both raw
 * schemas ({@code nodeType} in the compact schema, {@code name} in the legacy one).
 */
public enum NodeKind {
    SOURCE_UNIT("SourceUnit", NodeCategory.META),
    PRAGMA_DIRECTIVE("PragmaDirective", NodeCategory.META),
    IMPORT_DIRECTIVE("ImportDirective", NodeCategory.META),
    USING_FOR_DIRECTIVE("UsingForDirective", NodeCategory.META),
    INHERITANCE_SPECIFIER("InheritanceSpecifier", NodeCategory.META),
    MODIFIER_INVOCATION("ModifierInvocation", NodeCategory.META),
    OVERRIDE_SPECIFIER("OverrideSpecifier", NodeCategory.META),
    STRUCTURED_DOCUMENTATION("StructuredDocumentation", NodeCategory.META),
    PARAMETER_LIST("ParameterList", NodeCategory.META),
    IDENTIFIER_PATH("IdentifierPath", NodeCategory.META),

    CONTRACT_DEFINITION("ContractDefinition", NodeCategory.DECLARATION),
    FUNCTION_DEFINITION("FunctionDefinition", NodeCategory.DECLARATION),
    MODIFIER_DEFINITION("ModifierDefinition", NodeCategory.DECLARATION),
    EVENT_DEFINITION("EventDefinition", NodeCategory.DECLARATION),
    ERROR_DEFINITION("ErrorDefinition", NodeCategory.DECLARATION),
    STRUCT_DEFINITION("StructDefinition", NodeCategory.DECLARATION),
    ENUM_DEFINITION("EnumDefinition", NodeCategory.DECLARATION),
    ENUM_VALUE("EnumValue", NodeCategory.DECLARATION),
    VARIABLE_DECLARATION("VariableDeclaration", NodeCategory.DECLARATION),
    USER_DEFINED_VALUE_TYPE_DEFINITION("UserDefinedValueTypeDefinition", NodeCategory.DECLARATION),

    BLOCK("Block", NodeCategory.STATEMENT),
    UNCHECKED_BLOCK("UncheckedBlock", NodeCategory.STATEMENT),
    PLACEHOLDER_STATEMENT("PlaceholderStatement", NodeCategory.STATEMENT),
    IF_STATEMENT("IfStatement", NodeCategory.STATEMENT),
    TRY_STATEMENT("TryStatement", NodeCategory.STATEMENT),
    TRY_CATCH_CLAUSE("TryCatchClause", NodeCategory.META),
    WHILE_STATEMENT("WhileStatement", NodeCategory.STATEMENT),
    DO_WHILE_STATEMENT("DoWhileStatement", NodeCategory.STATEMENT),
    FOR_STATEMENT("ForStatement", NodeCategory.STATEMENT),
    CONTINUE("Continue", NodeCategory.STATEMENT),
    BREAK("Break", NodeCategory.STATEMENT),
    RETURN("Return", NodeCategory.STATEMENT),
    THROW("Throw", NodeCategory.STATEMENT),
    EMIT_STATEMENT("EmitStatement", NodeCategory.STATEMENT),
    REVERT_STATEMENT("RevertStatement", NodeCategory.STATEMENT),
    VARIABLE_DECLARATION_STATEMENT("VariableDeclarationStatement", NodeCategory.STATEMENT),
    EXPRESSION_STATEMENT("ExpressionStatement", NodeCategory.STATEMENT),
    INLINE_ASSEMBLY("InlineAssembly", NodeCategory.STATEMENT),

    ASSIGNMENT("Assignment", NodeCategory.EXPRESSION),
    CONDITIONAL("Conditional", NodeCategory.EXPRESSION),
    TUPLE_EXPRESSION("TupleExpression", NodeCategory.EXPRESSION),
    UNARY_OPERATION("UnaryOperation", NodeCategory.EXPRESSION),
    BINARY_OPERATION("BinaryOperation", NodeCategory.EXPRESSION),
    FUNCTION_CALL("FunctionCall", NodeCategory.EXPRESSION),
    FUNCTION_CALL_OPTIONS("FunctionCallOptions", NodeCategory.EXPRESSION),
    NEW_EXPRESSION("NewExpression", NodeCategory.EXPRESSION),
    MEMBER_ACCESS("MemberAccess", NodeCategory.EXPRESSION),
    INDEX_ACCESS("IndexAccess", NodeCategory.EXPRESSION),
    INDEX_RANGE_ACCESS("IndexRangeAccess", NodeCategory.EXPRESSION),
    IDENTIFIER("Identifier", NodeCategory.EXPRESSION),
    ELEMENTARY_TYPE_NAME_EXPRESSION("ElementaryTypeNameExpression", NodeCategory.EXPRESSION),
    LITERAL("Literal", NodeCategory.EXPRESSION),

    ELEMENTARY_TYPE_NAME("ElementaryTypeName", NodeCategory.TYPE_NAME),
    USER_DEFINED_TYPE_NAME("UserDefinedTypeName", NodeCategory.TYPE_NAME),
    FUNCTION_TYPE_NAME("FunctionTypeName", NodeCategory.TYPE_NAME),
    MAPPING("Mapping", NodeCategory.TYPE_NAME),
    ARRAY_TYPE_NAME("ArrayTypeName", NodeCategory.TYPE_NAME);

    private static final Map<String, NodeKind> BY_RAW = new HashMap<>();

    static {
        for (NodeKind k : values()) BY_RAW.put(k.rawName, k);
    }

    private final String rawName;
    private final NodeCategory category;

    NodeKind(String rawName, NodeCategory category) {
        this.rawName = rawName;
        this.category = category;
    }

    public String rawName() {
        return rawName;
    }

    public NodeCategory category() {
        return category;
    }

    /** Kind for a raw discriminant, or {@code null} when the discriminant is unknown. */
    public static NodeKind fromRawName(String rawName) {
        return rawName == null ? null : BY_RAW.get(rawName);
    }
}
