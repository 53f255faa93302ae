package info.isaksson.erland.solcast.read.modern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.ContractKind;
import info.isaksson.erland.solcast.node.FunctionCallKind;
import info.isaksson.erland.solcast.node.FunctionKind;
import info.isaksson.erland.solcast.node.LiteralKind;
import info.isaksson.erland.solcast.node.Mutability;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.StorageLocation;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.decl.CallableDeclaration;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.node.decl.Declaration;
import info.isaksson.erland.solcast.node.decl.EnumDefinition;
import info.isaksson.erland.solcast.node.decl.EnumValue;
import info.isaksson.erland.solcast.node.decl.ErrorDefinition;
import info.isaksson.erland.solcast.node.decl.EventDefinition;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.decl.ModifierDefinition;
import info.isaksson.erland.solcast.node.decl.StructDefinition;
import info.isaksson.erland.solcast.node.decl.UserDefinedValueTypeDefinition;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;
import info.isaksson.erland.solcast.node.expr.Assignment;
import info.isaksson.erland.solcast.node.expr.BinaryOperation;
import info.isaksson.erland.solcast.node.expr.Conditional;
import info.isaksson.erland.solcast.node.expr.ElementaryTypeNameExpression;
import info.isaksson.erland.solcast.node.expr.Expression;
import info.isaksson.erland.solcast.node.expr.FunctionCall;
import info.isaksson.erland.solcast.node.expr.FunctionCallOptions;
import info.isaksson.erland.solcast.node.expr.Identifier;
import info.isaksson.erland.solcast.node.expr.IndexAccess;
import info.isaksson.erland.solcast.node.expr.IndexRangeAccess;
import info.isaksson.erland.solcast.node.expr.Literal;
import info.isaksson.erland.solcast.node.expr.MemberAccess;
import info.isaksson.erland.solcast.node.expr.NewExpression;
import info.isaksson.erland.solcast.node.expr.TupleExpression;
import info.isaksson.erland.solcast.node.expr.UnaryOperation;
import info.isaksson.erland.solcast.node.meta.IdentifierPath;
import info.isaksson.erland.solcast.node.meta.ImportDirective;
import info.isaksson.erland.solcast.node.meta.InheritanceSpecifier;
import info.isaksson.erland.solcast.node.meta.ModifierInvocation;
import info.isaksson.erland.solcast.node.meta.OverrideSpecifier;
import info.isaksson.erland.solcast.node.meta.ParameterList;
import info.isaksson.erland.solcast.node.meta.PragmaDirective;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.node.meta.StructuredDocumentation;
import info.isaksson.erland.solcast.node.meta.TryCatchClause;
import info.isaksson.erland.solcast.node.meta.UsingForDirective;
import info.isaksson.erland.solcast.node.stmt.Block;
import info.isaksson.erland.solcast.node.stmt.Break;
import info.isaksson.erland.solcast.node.stmt.Continue;
import info.isaksson.erland.solcast.node.stmt.DoWhileStatement;
import info.isaksson.erland.solcast.node.stmt.EmitStatement;
import info.isaksson.erland.solcast.node.stmt.ExpressionStatement;
import info.isaksson.erland.solcast.node.stmt.ForStatement;
import info.isaksson.erland.solcast.node.stmt.IfStatement;
import info.isaksson.erland.solcast.node.stmt.InlineAssembly;
import info.isaksson.erland.solcast.node.stmt.PlaceholderStatement;
import info.isaksson.erland.solcast.node.stmt.Return;
import info.isaksson.erland.solcast.node.stmt.RevertStatement;
import info.isaksson.erland.solcast.node.stmt.Statement;
import info.isaksson.erland.solcast.node.stmt.Throw;
import info.isaksson.erland.solcast.node.stmt.TryStatement;
import info.isaksson.erland.solcast.node.stmt.UncheckedBlock;
import info.isaksson.erland.solcast.node.stmt.VariableDeclarationStatement;
import info.isaksson.erland.solcast.node.stmt.WhileStatement;
import info.isaksson.erland.solcast.node.type.ArrayTypeName;
import info.isaksson.erland.solcast.node.type.ElementaryTypeName;
import info.isaksson.erland.solcast.node.type.FunctionTypeName;
import info.isaksson.erland.solcast.node.type.Mapping;
import info.isaksson.erland.solcast.node.type.TypeName;
import info.isaksson.erland.solcast.node.type.UserDefinedTypeName;
import info.isaksson.erland.solcast.read.NodeProcessor;
import info.isaksson.erland.solcast.read.ProcessingSession;
import info.isaksson.erland.solcast.read.RawFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Processors for the compact schema, covering every field shape solc has emitted from 0.4.12 to
 * the current release. Version-dependent fields are recognised by shape rather than by the
 * reported compiler version, so output with a missing or odd version string still reads.
 */
public final class ModernProcessors {

    private static final Map<NodeKind, NodeProcessor<ModernRawNode>> TABLE = buildTable();

    private ModernProcessors() {
    }

    public static Map<NodeKind, NodeProcessor<ModernRawNode>> table() {
        return TABLE;
    }

    private static Map<NodeKind, NodeProcessor<ModernRawNode>> buildTable() {
        Map<NodeKind, NodeProcessor<ModernRawNode>> m = new EnumMap<>(NodeKind.class);
        m.put(NodeKind.SOURCE_UNIT, ModernProcessors::sourceUnit);
        m.put(NodeKind.PRAGMA_DIRECTIVE, ModernProcessors::pragma);
        m.put(NodeKind.IMPORT_DIRECTIVE, ModernProcessors::importDirective);
        m.put(NodeKind.USING_FOR_DIRECTIVE, ModernProcessors::usingFor);
        m.put(NodeKind.INHERITANCE_SPECIFIER, ModernProcessors::inheritanceSpecifier);
        m.put(NodeKind.MODIFIER_INVOCATION, ModernProcessors::modifierInvocation);
        m.put(NodeKind.OVERRIDE_SPECIFIER, ModernProcessors::overrideSpecifier);
        m.put(NodeKind.STRUCTURED_DOCUMENTATION, ModernProcessors::structuredDocumentation);
        m.put(NodeKind.PARAMETER_LIST, ModernProcessors::parameterList);
        m.put(NodeKind.IDENTIFIER_PATH, ModernProcessors::identifierPath);

        m.put(NodeKind.CONTRACT_DEFINITION, ModernProcessors::contract);
        m.put(NodeKind.FUNCTION_DEFINITION, ModernProcessors::function);
        m.put(NodeKind.MODIFIER_DEFINITION, ModernProcessors::modifier);
        m.put(NodeKind.EVENT_DEFINITION, ModernProcessors::event);
        m.put(NodeKind.ERROR_DEFINITION, ModernProcessors::error);
        m.put(NodeKind.STRUCT_DEFINITION, ModernProcessors::struct);
        m.put(NodeKind.ENUM_DEFINITION, ModernProcessors::enumDefinition);
        m.put(NodeKind.ENUM_VALUE, ModernProcessors::enumValue);
        m.put(NodeKind.VARIABLE_DECLARATION, ModernProcessors::variable);
        m.put(NodeKind.USER_DEFINED_VALUE_TYPE_DEFINITION, ModernProcessors::userDefinedValueType);

        m.put(NodeKind.BLOCK, ModernProcessors::block);
        m.put(NodeKind.UNCHECKED_BLOCK, ModernProcessors::uncheckedBlock);
        m.put(NodeKind.PLACEHOLDER_STATEMENT, (r, s) -> statement(s.open(r, PlaceholderStatement::new), r));
        m.put(NodeKind.IF_STATEMENT, ModernProcessors::ifStatement);
        m.put(NodeKind.TRY_STATEMENT, ModernProcessors::tryStatement);
        m.put(NodeKind.TRY_CATCH_CLAUSE, ModernProcessors::tryCatchClause);
        m.put(NodeKind.WHILE_STATEMENT, ModernProcessors::whileStatement);
        m.put(NodeKind.DO_WHILE_STATEMENT, ModernProcessors::doWhileStatement);
        m.put(NodeKind.FOR_STATEMENT, ModernProcessors::forStatement);
        m.put(NodeKind.CONTINUE, (r, s) -> statement(s.open(r, Continue::new), r));
        m.put(NodeKind.BREAK, (r, s) -> statement(s.open(r, Break::new), r));
        m.put(NodeKind.RETURN, ModernProcessors::returnStatement);
        m.put(NodeKind.THROW, (r, s) -> statement(s.open(r, Throw::new), r));
        m.put(NodeKind.EMIT_STATEMENT, ModernProcessors::emit);
        m.put(NodeKind.REVERT_STATEMENT, ModernProcessors::revert);
        m.put(NodeKind.VARIABLE_DECLARATION_STATEMENT, ModernProcessors::variableDeclarationStatement);
        m.put(NodeKind.EXPRESSION_STATEMENT, ModernProcessors::expressionStatement);
        m.put(NodeKind.INLINE_ASSEMBLY, ModernProcessors::inlineAssembly);

        m.put(NodeKind.ASSIGNMENT, ModernProcessors::assignment);
        m.put(NodeKind.CONDITIONAL, ModernProcessors::conditional);
        m.put(NodeKind.TUPLE_EXPRESSION, ModernProcessors::tuple);
        m.put(NodeKind.UNARY_OPERATION, ModernProcessors::unary);
        m.put(NodeKind.BINARY_OPERATION, ModernProcessors::binary);
        m.put(NodeKind.FUNCTION_CALL, ModernProcessors::functionCall);
        m.put(NodeKind.FUNCTION_CALL_OPTIONS, ModernProcessors::functionCallOptions);
        m.put(NodeKind.NEW_EXPRESSION, ModernProcessors::newExpression);
        m.put(NodeKind.MEMBER_ACCESS, ModernProcessors::memberAccess);
        m.put(NodeKind.INDEX_ACCESS, ModernProcessors::indexAccess);
        m.put(NodeKind.INDEX_RANGE_ACCESS, ModernProcessors::indexRangeAccess);
        m.put(NodeKind.IDENTIFIER, ModernProcessors::identifier);
        m.put(NodeKind.ELEMENTARY_TYPE_NAME_EXPRESSION, ModernProcessors::elementaryTypeNameExpression);
        m.put(NodeKind.LITERAL, ModernProcessors::literal);

        m.put(NodeKind.ELEMENTARY_TYPE_NAME, ModernProcessors::elementaryTypeName);
        m.put(NodeKind.USER_DEFINED_TYPE_NAME, ModernProcessors::userDefinedTypeName);
        m.put(NodeKind.FUNCTION_TYPE_NAME, ModernProcessors::functionTypeName);
        m.put(NodeKind.MAPPING, ModernProcessors::mapping);
        m.put(NodeKind.ARRAY_TYPE_NAME, ModernProcessors::arrayTypeName);
        return Collections.unmodifiableMap(m);
    }

    private static <T extends AstNode> void addAll(NodeList<T> target, List<ModernRawNode> raws, Class<T> type,
                                                   ProcessingSession<ModernRawNode> s) {
        for (ModernRawNode r : raws) {
            if (r == null && !target.allowsEmptySlots()) continue;
            target.add(s.buildOrNull(r, type));
        }
    }

    private static Visibility visibility(ModernRawNode r) {
        String v = r.string("visibility");
        return v == null ? null : Visibility.fromRaw(v);
    }

    private static StateMutability stateMutability(ModernRawNode r) {
        String v = r.string("stateMutability");
        return v == null ? null : StateMutability.fromRaw(v);
    }

    // ---- meta

    private static AstNode sourceUnit(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        SourceUnit u = s.open(r, SourceUnit::new);
        u.setAbsolutePath(r.string("absolutePath"));
        u.setLicense(r.string("license"));
        u.setExportedSymbols(RawFields.exportedSymbols(r));
        addAll(u.getNodes(), r.requireChildren("nodes"), AstNode.class, s);
        return u;
    }

    private static AstNode pragma(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        PragmaDirective p = s.open(r, PragmaDirective::new);
        p.setLiterals(r.strings("literals"));
        return p;
    }

    private static AstNode importDirective(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ImportDirective d = s.open(r, ImportDirective::new);
        d.setFile(r.string("file"));
        d.setAbsolutePath(r.string("absolutePath"));
        d.setUnitAlias(r.string("unitAlias"));
        d.setSourceUnit(s.ref(r.longOrNull("sourceUnit")));
        d.setScope(s.ref(r.longOrNull("scope")));
        d.setSymbolAliases(RawFields.symbolAliases(r, s));
        return d;
    }

    /**
     * {@code functionList} entries are {@code {"function": path}} or, for user-defined operators
     * (0.8.19+), {@code {"definition": path, "operator": op}}.
     */
    private static AstNode usingFor(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        UsingForDirective u = s.open(r, UsingForDirective::new);
        ModernRawNode library = r.child("libraryName");
        if (library != null) u.setLibraryName(s.build(library));
        JsonNode list = r.field("functionList");
        List<String> operators = new ArrayList<>();
        if (list != null) {
            if (!list.isArray()) throw r.shapeError("'functionList' is not a list");
            for (int i = 0; i < list.size(); i++) {
                JsonNode entry = list.get(i);
                String base = ModernRawNode.pointer(r.path(), "functionList", i);
                JsonNode fn = entry.has("function") ? entry.get("function") : entry.get("definition");
                if (fn == null || !fn.isObject()) throw r.shapeError("functionList entry " + i + " has no function");
                String field = entry.has("function") ? "function" : "definition";
                ModernRawNode path = new ModernRawNode((ObjectNode) fn, ModernRawNode.pointer(base, field));
                u.getFunctionList().add(s.build(path, IdentifierPath.class));
                JsonNode op = entry.get("operator");
                operators.add(op == null || op.isNull() ? null : op.asText());
            }
        }
        u.setOperators(operators);
        if (u.getLibraryName() == null && u.getFunctionList().isEmpty()) {
            throw r.shapeError("UsingForDirective without library or function list");
        }
        u.setTypeName(s.buildOrNull(r.child("typeName"), TypeName.class));
        u.setGlobal(r.bool("global", false));
        return u;
    }

    private static AstNode inheritanceSpecifier(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        InheritanceSpecifier i = s.open(r, InheritanceSpecifier::new);
        i.setBaseName(s.build(r.requireChild("baseName")));
        i.setArgumentsPresent(r.isList("arguments"));
        addAll(i.getArguments(), r.children("arguments"), Expression.class, s);
        return i;
    }

    private static AstNode modifierInvocation(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ModifierInvocation m = s.open(r, ModifierInvocation::new);
        m.setModifierName(s.build(r.requireChild("modifierName")));
        m.setArgumentsPresent(r.isList("arguments"));
        addAll(m.getArguments(), r.children("arguments"), Expression.class, s);
        m.setInvocationKind(r.string("kind"));
        return m;
    }

    private static AstNode overrideSpecifier(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        OverrideSpecifier o = s.open(r, OverrideSpecifier::new);
        addAll(o.getOverrides(), r.children("overrides"), AstNode.class, s);
        return o;
    }

    private static AstNode structuredDocumentation(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        StructuredDocumentation d = s.open(r, StructuredDocumentation::new);
        d.setText(r.string("text"));
        return d;
    }

    private static AstNode parameterList(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ParameterList p = s.open(r, ParameterList::new);
        addAll(p.getParameters(), r.children("parameters"), VariableDeclaration.class, s);
        return p;
    }

    private static AstNode identifierPath(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        IdentifierPath p = s.open(r, IdentifierPath::new);
        p.setName(r.requireString("name"));
        p.setReferencedDeclaration(s.ref(r.longOrNull("referencedDeclaration")));
        return p;
    }

    // ---- declarations

    /** Name, scope and documentation, which is a string before 0.6.3 and a node after. */
    private static void declaration(Declaration d, ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        d.setName(r.string("name"));
        d.setNameLocation(RawFields.range(r, "nameLocation"));
        d.setScope(s.ref(r.longOrNull("scope")));
        JsonNode doc = r.json().get("documentation");
        if (doc != null && doc.isObject()) {
            d.setDocumentationNode(s.build(r.child("documentation"), StructuredDocumentation.class));
        } else {
            d.setDocumentation(r.string("documentation"));
        }
    }

    private static void callable(CallableDeclaration d, ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        declaration(d, r, s);
        d.setVisibility(visibility(r));
        d.setVirtual(r.bool("virtual", false));
    }

    private static AstNode contract(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ContractDefinition d = s.open(r, ContractDefinition::new);
        declaration(d, r, s);
        String kind = r.string("contractKind");
        d.setContractKind(kind == null ? ContractKind.CONTRACT : ContractKind.fromRaw(kind));
        d.setAbstractContract(r.boolOrNull("abstract"));
        d.setFullyImplemented(r.boolOrNull("fullyImplemented"));
        d.setLinearizedBaseContracts(s.refs(r.ids("linearizedBaseContracts")));
        addAll(d.getBaseContracts(), r.children("baseContracts"), InheritanceSpecifier.class, s);
        addAll(d.getNodes(), r.requireChildren("nodes"), AstNode.class, s);
        return d;
    }

    private static AstNode function(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        FunctionDefinition f = s.open(r, FunctionDefinition::new);
        callable(f, r, s);
        String kind = r.string("kind");
        if (kind != null) f.setFunctionKind(FunctionKind.fromRaw(kind));
        f.setConstructorFlag(r.boolOrNull("isConstructor"));
        f.setStateMutability(stateMutability(r));
        f.setConstantFlag(r.boolOrNull("constant"));
        f.setPayableFlag(r.boolOrNull("payable"));
        f.setImplemented(r.boolOrNull("implemented"));
        f.setFunctionSelector(r.string("functionSelector"));
        f.setBaseFunctions(s.refs(r.ids("baseFunctions")));
        f.setParameters(s.build(r.requireChild("parameters"), ParameterList.class));
        f.setOverrides(s.buildOrNull(r.child("overrides"), OverrideSpecifier.class));
        addAll(f.getModifiers(), r.children("modifiers"), ModifierInvocation.class, s);
        f.setReturnParameters(s.buildOrNull(r.child("returnParameters"), ParameterList.class));
        f.setBody(s.buildOrNull(r.child("body"), Block.class));
        return f;
    }

    private static AstNode modifier(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ModifierDefinition m = s.open(r, ModifierDefinition::new);
        callable(m, r, s);
        m.setParameters(s.build(r.requireChild("parameters"), ParameterList.class));
        m.setOverrides(s.buildOrNull(r.child("overrides"), OverrideSpecifier.class));
        m.setBody(s.buildOrNull(r.child("body"), Block.class));
        return m;
    }

    private static AstNode event(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        EventDefinition e = s.open(r, EventDefinition::new);
        callable(e, r, s);
        e.setAnonymous(r.bool("anonymous", false));
        e.setParameters(s.build(r.requireChild("parameters"), ParameterList.class));
        return e;
    }

    private static AstNode error(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ErrorDefinition e = s.open(r, ErrorDefinition::new);
        callable(e, r, s);
        e.setParameters(s.build(r.requireChild("parameters"), ParameterList.class));
        return e;
    }

    private static AstNode struct(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        StructDefinition d = s.open(r, StructDefinition::new);
        declaration(d, r, s);
        d.setCanonicalName(r.string("canonicalName"));
        d.setVisibility(visibility(r));
        addAll(d.getMembers(), r.children("members"), VariableDeclaration.class, s);
        return d;
    }

    private static AstNode enumDefinition(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        EnumDefinition d = s.open(r, EnumDefinition::new);
        declaration(d, r, s);
        d.setCanonicalName(r.string("canonicalName"));
        addAll(d.getMembers(), r.children("members"), EnumValue.class, s);
        return d;
    }

    private static AstNode enumValue(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        EnumValue v = s.open(r, EnumValue::new);
        declaration(v, r, s);
        return v;
    }

    private static AstNode variable(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        VariableDeclaration v = s.open(r, VariableDeclaration::new);
        declaration(v, r, s);
        v.setTypeName(s.buildOrNull(r.child("typeName"), TypeName.class));
        v.setOverrides(s.buildOrNull(r.child("overrides"), OverrideSpecifier.class));
        v.setValue(s.buildOrNull(r.child("value"), Expression.class));
        v.setTypeDescriptions(RawFields.descriptions(r.field("typeDescriptions"), r, s));
        v.setConstantFlag(r.bool("constant", false));
        String mutability = r.string("mutability");
        if (mutability != null) v.setMutability(Mutability.fromRaw(mutability));
        v.setStateVariable(r.bool("stateVariable", false));
        String location = r.string("storageLocation");
        v.setStorageLocation(location == null ? StorageLocation.DEFAULT : StorageLocation.fromRaw(location));
        v.setVisibility(visibility(r));
        v.setIndexed(r.bool("indexed", false));
        v.setFunctionSelector(r.string("functionSelector"));
        v.setBaseFunctions(s.refs(r.ids("baseFunctions")));
        return v;
    }

    private static AstNode userDefinedValueType(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        UserDefinedValueTypeDefinition d = s.open(r, UserDefinedValueTypeDefinition::new);
        declaration(d, r, s);
        d.setCanonicalName(r.string("canonicalName"));
        d.setUnderlyingType(s.build(r.requireChild("underlyingType"), TypeName.class));
        return d;
    }

    // ---- statements

    private static <T extends Statement> T statement(T st, ModernRawNode r) {
        st.setDocumentation(r.string("documentation"));
        return st;
    }

    private static AstNode block(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        Block b = statement(s.open(r, Block::new), r);
        addAll(b.getStatements(), r.children("statements"), Statement.class, s);
        return b;
    }

    private static AstNode uncheckedBlock(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        UncheckedBlock b = statement(s.open(r, UncheckedBlock::new), r);
        addAll(b.getStatements(), r.children("statements"), Statement.class, s);
        return b;
    }

    private static AstNode ifStatement(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        IfStatement i = statement(s.open(r, IfStatement::new), r);
        i.setCondition(s.build(r.requireChild("condition"), Expression.class));
        i.setTrueBody(s.build(r.requireChild("trueBody"), Statement.class));
        i.setFalseBody(s.buildOrNull(r.child("falseBody"), Statement.class));
        return i;
    }

    private static AstNode tryStatement(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        TryStatement t = statement(s.open(r, TryStatement::new), r);
        t.setExternalCall(s.build(r.requireChild("externalCall"), Expression.class));
        addAll(t.getClauses(), r.requireChildren("clauses"), TryCatchClause.class, s);
        return t;
    }

    private static AstNode tryCatchClause(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        TryCatchClause t = s.open(r, TryCatchClause::new);
        t.setErrorName(r.string("errorName"));
        t.setParameters(s.buildOrNull(r.child("parameters"), ParameterList.class));
        t.setBlock(s.build(r.requireChild("block"), Block.class));
        return t;
    }

    private static AstNode whileStatement(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        WhileStatement w = statement(s.open(r, WhileStatement::new), r);
        w.setCondition(s.build(r.requireChild("condition"), Expression.class));
        w.setBody(s.build(r.requireChild("body"), Statement.class));
        return w;
    }

    private static AstNode doWhileStatement(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        DoWhileStatement d = statement(s.open(r, DoWhileStatement::new), r);
        d.setBody(s.build(r.requireChild("body"), Statement.class));
        d.setCondition(s.build(r.requireChild("condition"), Expression.class));
        return d;
    }

    private static AstNode forStatement(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ForStatement f = statement(s.open(r, ForStatement::new), r);
        f.setInitializationExpression(s.buildOrNull(r.child("initializationExpression"), Statement.class));
        f.setCondition(s.buildOrNull(r.child("condition"), Expression.class));
        f.setLoopExpression(s.buildOrNull(r.child("loopExpression"), ExpressionStatement.class));
        f.setBody(s.build(r.requireChild("body"), Statement.class));
        return f;
    }

    private static AstNode returnStatement(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        Return ret = statement(s.open(r, Return::new), r);
        ret.setExpression(s.buildOrNull(r.child("expression"), Expression.class));
        ret.setFunctionReturnParameters(s.ref(r.longOrNull("functionReturnParameters")));
        return ret;
    }

    private static AstNode emit(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        EmitStatement e = statement(s.open(r, EmitStatement::new), r);
        e.setEventCall(s.build(r.requireChild("eventCall"), FunctionCall.class));
        return e;
    }

    private static AstNode revert(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        RevertStatement e = statement(s.open(r, RevertStatement::new), r);
        e.setErrorCall(s.build(r.requireChild("errorCall"), FunctionCall.class));
        return e;
    }

    private static AstNode variableDeclarationStatement(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        VariableDeclarationStatement v = statement(s.open(r, VariableDeclarationStatement::new), r);
        r.ignore("assignments");
        addAll(v.getDeclarations(), r.requireChildren("declarations"), VariableDeclaration.class, s);
        v.setInitialValue(s.buildOrNull(r.child("initialValue"), Expression.class));
        return v;
    }

    private static AstNode expressionStatement(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ExpressionStatement e = statement(s.open(r, ExpressionStatement::new), r);
        e.setExpression(s.build(r.requireChild("expression"), Expression.class));
        return e;
    }

    /** Before 0.6.0 only {@code operations} text is present; later output carries a Yul {@code AST}. */
    private static AstNode inlineAssembly(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        InlineAssembly a = statement(s.open(r, InlineAssembly::new), r);
        a.setOperations(r.string("operations"));
        a.setYulAst(r.field("AST"));
        a.setEvmVersion(r.string("evmVersion"));
        a.setExternalReferences(r.field("externalReferences"));
        a.setFlags(r.strings("flags"));
        if (a.getOperations() == null && a.getYulAst() == null) {
            throw r.shapeError("InlineAssembly without operations or AST");
        }
        return a;
    }

    // ---- expressions

    private static <T extends Expression> T expression(T e, ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        e.setTypeDescriptions(RawFields.descriptions(r.field("typeDescriptions"), r, s));
        e.setArgumentTypes(RawFields.argumentTypes(r, s));
        e.setConstant(r.boolOrNull("isConstant"));
        e.setPure(r.boolOrNull("isPure"));
        e.setLValue(r.boolOrNull("isLValue"));
        e.setLValueRequested(r.boolOrNull("lValueRequested"));
        return e;
    }

    private static AstNode assignment(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        Assignment a = expression(s.open(r, Assignment::new), r, s);
        a.setOperator(r.requireString("operator"));
        a.setLeftHandSide(s.build(r.requireChild("leftHandSide"), Expression.class));
        a.setRightHandSide(s.build(r.requireChild("rightHandSide"), Expression.class));
        return a;
    }

    private static AstNode conditional(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        Conditional c = expression(s.open(r, Conditional::new), r, s);
        c.setCondition(s.build(r.requireChild("condition"), Expression.class));
        c.setTrueExpression(s.build(r.requireChild("trueExpression"), Expression.class));
        c.setFalseExpression(s.build(r.requireChild("falseExpression"), Expression.class));
        return c;
    }

    private static AstNode tuple(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        TupleExpression t = expression(s.open(r, TupleExpression::new), r, s);
        t.setInlineArray(r.bool("isInlineArray", false));
        addAll(t.getComponents(), r.children("components"), Expression.class, s);
        return t;
    }

    private static AstNode unary(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        UnaryOperation u = expression(s.open(r, UnaryOperation::new), r, s);
        u.setOperator(r.requireString("operator"));
        u.setPrefix(r.bool("prefix", true));
        u.setSubExpression(s.build(r.requireChild("subExpression"), Expression.class));
        return u;
    }

    private static AstNode binary(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        BinaryOperation b = expression(s.open(r, BinaryOperation::new), r, s);
        b.setOperator(r.requireString("operator"));
        b.setLeftExpression(s.build(r.requireChild("leftExpression"), Expression.class));
        b.setRightExpression(s.build(r.requireChild("rightExpression"), Expression.class));
        b.setCommonType(RawFields.descriptions(r.field("commonType"), r, s));
        return b;
    }

    private static AstNode functionCall(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        FunctionCall f = expression(s.open(r, FunctionCall::new), r, s);
        f.setExpression(s.build(r.requireChild("expression"), Expression.class));
        addAll(f.getArguments(), r.children("arguments"), Expression.class, s);
        f.setNames(r.strings("names"));
        String kind = r.string("kind");
        if (kind != null) f.setCallKind(FunctionCallKind.fromRaw(kind));
        f.setTypeConversionFlag(r.boolOrNull("isTypeConversion"));
        f.setStructConstructorCallFlag(r.boolOrNull("isStructConstructorCall"));
        f.setTryCall(r.bool("tryCall", false));
        return f;
    }

    private static AstNode functionCallOptions(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        FunctionCallOptions f = expression(s.open(r, FunctionCallOptions::new), r, s);
        f.setExpression(s.build(r.requireChild("expression"), Expression.class));
        f.setNames(r.strings("names"));
        addAll(f.getOptions(), r.children("options"), Expression.class, s);
        if (f.getNames().size() != f.getOptions().size()) {
            throw r.shapeError("FunctionCallOptions names and options differ in length");
        }
        return f;
    }

    private static AstNode newExpression(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        NewExpression n = expression(s.open(r, NewExpression::new), r, s);
        n.setTypeName(s.build(r.requireChild("typeName"), TypeName.class));
        return n;
    }

    private static AstNode memberAccess(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        MemberAccess m = expression(s.open(r, MemberAccess::new), r, s);
        m.setExpression(s.build(r.requireChild("expression"), Expression.class));
        m.setMemberName(r.requireString("memberName"));
        m.setReferencedDeclaration(s.ref(r.longOrNull("referencedDeclaration")));
        return m;
    }

    private static AstNode indexAccess(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        IndexAccess i = expression(s.open(r, IndexAccess::new), r, s);
        i.setBaseExpression(s.build(r.requireChild("baseExpression"), Expression.class));
        i.setIndexExpression(s.buildOrNull(r.child("indexExpression"), Expression.class));
        return i;
    }

    private static AstNode indexRangeAccess(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        IndexRangeAccess i = expression(s.open(r, IndexRangeAccess::new), r, s);
        i.setBaseExpression(s.build(r.requireChild("baseExpression"), Expression.class));
        i.setStartExpression(s.buildOrNull(r.child("startExpression"), Expression.class));
        i.setEndExpression(s.buildOrNull(r.child("endExpression"), Expression.class));
        return i;
    }

    private static AstNode identifier(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        Identifier i = expression(s.open(r, Identifier::new), r, s);
        i.setName(r.requireString("name"));
        i.setReferencedDeclaration(s.ref(r.longOrNull("referencedDeclaration")));
        i.setOverloadedDeclarations(s.refs(r.ids("overloadedDeclarations")));
        return i;
    }

    /** {@code typeName} is a plain string before 0.6.0 and an ElementaryTypeName node after. */
    private static AstNode elementaryTypeNameExpression(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ElementaryTypeNameExpression e = expression(s.open(r, ElementaryTypeNameExpression::new), r, s);
        JsonNode typeName = r.json().get("typeName");
        if (typeName != null && typeName.isObject()) {
            ElementaryTypeName t = s.build(r.child("typeName"), ElementaryTypeName.class);
            e.setTypeName(t);
            e.setTypeNameText(t.getName());
        } else {
            e.setTypeNameText(r.requireString("typeName"));
        }
        return e;
    }

    private static AstNode literal(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        Literal l = expression(s.open(r, Literal::new), r, s);
        l.setLiteralKind(LiteralKind.fromRaw(r.requireString("kind")));
        l.setValue(r.string("value"));
        l.setHexValue(r.string("hexValue"));
        l.setSubdenomination(r.string("subdenomination"));
        return l;
    }

    // ---- type names

    private static <T extends TypeName> T typeName(T t, ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        t.setTypeDescriptions(RawFields.descriptions(r.field("typeDescriptions"), r, s));
        return t;
    }

    private static AstNode elementaryTypeName(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ElementaryTypeName t = typeName(s.open(r, ElementaryTypeName::new), r, s);
        t.setName(r.requireString("name"));
        t.setStateMutability(stateMutability(r));
        return t;
    }

    /** Before 0.8.0 the name is a string field; from 0.8.0 it is an IdentifierPath in {@code pathNode}. */
    private static AstNode userDefinedTypeName(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        UserDefinedTypeName t = typeName(s.open(r, UserDefinedTypeName::new), r, s);
        t.setName(r.string("name"));
        t.setPathNode(s.buildOrNull(r.child("pathNode"), IdentifierPath.class));
        t.setReferencedDeclaration(s.ref(r.longOrNull("referencedDeclaration")));
        t.setContractScope(s.ref(r.longOrNull("contractScope")));
        if (t.getName() == null && t.getPathNode() == null) {
            throw r.shapeError("UserDefinedTypeName without name or path");
        }
        return t;
    }

    private static AstNode functionTypeName(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        FunctionTypeName t = typeName(s.open(r, FunctionTypeName::new), r, s);
        t.setVisibility(visibility(r));
        t.setStateMutability(stateMutability(r));
        t.setConstantFlag(r.boolOrNull("constant"));
        t.setPayableFlag(r.boolOrNull("payable"));
        t.setParameterTypes(s.build(r.requireChild("parameterTypes"), ParameterList.class));
        t.setReturnParameterTypes(s.build(r.requireChild("returnParameterTypes"), ParameterList.class));
        return t;
    }

    private static AstNode mapping(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        Mapping m = typeName(s.open(r, Mapping::new), r, s);
        m.setKeyType(s.build(r.requireChild("keyType"), TypeName.class));
        m.setValueType(s.build(r.requireChild("valueType"), TypeName.class));
        String keyName = r.string("keyName");
        String valueName = r.string("valueName");
        m.setKeyName(keyName == null || keyName.isEmpty() ? null : keyName);
        m.setValueName(valueName == null || valueName.isEmpty() ? null : valueName);
        return m;
    }

    private static AstNode arrayTypeName(ModernRawNode r, ProcessingSession<ModernRawNode> s) {
        ArrayTypeName a = typeName(s.open(r, ArrayTypeName::new), r, s);
        a.setBaseType(s.build(r.requireChild("baseType"), TypeName.class));
        a.setLength(s.buildOrNull(r.child("length"), Expression.class));
        return a;
    }
}
