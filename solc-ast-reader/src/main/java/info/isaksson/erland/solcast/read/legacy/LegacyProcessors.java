package info.isaksson.erland.solcast.read.legacy;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.ContractKind;
import info.isaksson.erland.solcast.node.FunctionCallKind;
import info.isaksson.erland.solcast.node.FunctionKind;
import info.isaksson.erland.solcast.node.LiteralKind;
import info.isaksson.erland.solcast.node.Mutability;
import info.isaksson.erland.solcast.node.NodeCategory;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.StorageLocation;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.node.decl.Declaration;
import info.isaksson.erland.solcast.node.decl.EnumDefinition;
import info.isaksson.erland.solcast.node.decl.EnumValue;
import info.isaksson.erland.solcast.node.decl.EventDefinition;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.decl.ModifierDefinition;
import info.isaksson.erland.solcast.node.decl.StructDefinition;
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
import info.isaksson.erland.solcast.node.stmt.Statement;
import info.isaksson.erland.solcast.node.stmt.Throw;
import info.isaksson.erland.solcast.node.stmt.TryStatement;
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
 * Processors for the legacy schema.
 *
 * <p>Children are consumed positionally. Where a child is optional the processor either relies on
 * the null-attribute convention ({@link ChildCursor#optional(String)}) or classifies children by
 * their kind, which is unambiguous for every field except the header of a {@code for} loop.</p>
 *
 * <p>Kinds introduced after the legacy schema was retired (0.8.0) have no processor here.</p>
 */
public final class LegacyProcessors {

    private static final Map<NodeKind, NodeProcessor<LegacyRawNode>> TABLE = buildTable();

    private LegacyProcessors() {
    }

    /** Immutable kind-to-processor table. */
    public static Map<NodeKind, NodeProcessor<LegacyRawNode>> table() {
        return TABLE;
    }

    private static Map<NodeKind, NodeProcessor<LegacyRawNode>> buildTable() {
        Map<NodeKind, NodeProcessor<LegacyRawNode>> m = new EnumMap<>(NodeKind.class);
        m.put(NodeKind.SOURCE_UNIT, LegacyProcessors::sourceUnit);
        m.put(NodeKind.PRAGMA_DIRECTIVE, LegacyProcessors::pragma);
        m.put(NodeKind.IMPORT_DIRECTIVE, LegacyProcessors::importDirective);
        m.put(NodeKind.USING_FOR_DIRECTIVE, LegacyProcessors::usingFor);
        m.put(NodeKind.INHERITANCE_SPECIFIER, LegacyProcessors::inheritanceSpecifier);
        m.put(NodeKind.MODIFIER_INVOCATION, LegacyProcessors::modifierInvocation);
        m.put(NodeKind.OVERRIDE_SPECIFIER, LegacyProcessors::overrideSpecifier);
        m.put(NodeKind.STRUCTURED_DOCUMENTATION, LegacyProcessors::structuredDocumentation);
        m.put(NodeKind.PARAMETER_LIST, LegacyProcessors::parameterList);

        m.put(NodeKind.CONTRACT_DEFINITION, LegacyProcessors::contract);
        m.put(NodeKind.FUNCTION_DEFINITION, LegacyProcessors::function);
        m.put(NodeKind.MODIFIER_DEFINITION, LegacyProcessors::modifier);
        m.put(NodeKind.EVENT_DEFINITION, LegacyProcessors::event);
        m.put(NodeKind.STRUCT_DEFINITION, LegacyProcessors::struct);
        m.put(NodeKind.ENUM_DEFINITION, LegacyProcessors::enumDefinition);
        m.put(NodeKind.ENUM_VALUE, LegacyProcessors::enumValue);
        m.put(NodeKind.VARIABLE_DECLARATION, LegacyProcessors::variable);

        m.put(NodeKind.BLOCK, LegacyProcessors::block);
        m.put(NodeKind.PLACEHOLDER_STATEMENT, (r, s) -> s.open(r, PlaceholderStatement::new));
        m.put(NodeKind.IF_STATEMENT, LegacyProcessors::ifStatement);
        m.put(NodeKind.TRY_STATEMENT, LegacyProcessors::tryStatement);
        m.put(NodeKind.TRY_CATCH_CLAUSE, LegacyProcessors::tryCatchClause);
        m.put(NodeKind.WHILE_STATEMENT, LegacyProcessors::whileStatement);
        m.put(NodeKind.DO_WHILE_STATEMENT, LegacyProcessors::doWhileStatement);
        m.put(NodeKind.FOR_STATEMENT, LegacyProcessors::forStatement);
        m.put(NodeKind.CONTINUE, (r, s) -> s.open(r, Continue::new));
        m.put(NodeKind.BREAK, (r, s) -> s.open(r, Break::new));
        m.put(NodeKind.RETURN, LegacyProcessors::returnStatement);
        m.put(NodeKind.THROW, (r, s) -> s.open(r, Throw::new));
        m.put(NodeKind.EMIT_STATEMENT, LegacyProcessors::emit);
        m.put(NodeKind.VARIABLE_DECLARATION_STATEMENT, LegacyProcessors::variableDeclarationStatement);
        m.put(NodeKind.EXPRESSION_STATEMENT, LegacyProcessors::expressionStatement);
        m.put(NodeKind.INLINE_ASSEMBLY, LegacyProcessors::inlineAssembly);

        m.put(NodeKind.ASSIGNMENT, LegacyProcessors::assignment);
        m.put(NodeKind.CONDITIONAL, LegacyProcessors::conditional);
        m.put(NodeKind.TUPLE_EXPRESSION, LegacyProcessors::tuple);
        m.put(NodeKind.UNARY_OPERATION, LegacyProcessors::unary);
        m.put(NodeKind.BINARY_OPERATION, LegacyProcessors::binary);
        m.put(NodeKind.FUNCTION_CALL, LegacyProcessors::functionCall);
        m.put(NodeKind.FUNCTION_CALL_OPTIONS, LegacyProcessors::functionCallOptions);
        m.put(NodeKind.NEW_EXPRESSION, LegacyProcessors::newExpression);
        m.put(NodeKind.MEMBER_ACCESS, LegacyProcessors::memberAccess);
        m.put(NodeKind.INDEX_ACCESS, LegacyProcessors::indexAccess);
        m.put(NodeKind.INDEX_RANGE_ACCESS, LegacyProcessors::indexRangeAccess);
        m.put(NodeKind.IDENTIFIER, LegacyProcessors::identifier);
        m.put(NodeKind.ELEMENTARY_TYPE_NAME_EXPRESSION, LegacyProcessors::elementaryTypeNameExpression);
        m.put(NodeKind.LITERAL, LegacyProcessors::literal);

        m.put(NodeKind.ELEMENTARY_TYPE_NAME, LegacyProcessors::elementaryTypeName);
        m.put(NodeKind.USER_DEFINED_TYPE_NAME, LegacyProcessors::userDefinedTypeName);
        m.put(NodeKind.FUNCTION_TYPE_NAME, LegacyProcessors::functionTypeName);
        m.put(NodeKind.MAPPING, LegacyProcessors::mapping);
        m.put(NodeKind.ARRAY_TYPE_NAME, LegacyProcessors::arrayTypeName);
        return Collections.unmodifiableMap(m);
    }

    // ---- meta

    private static AstNode sourceUnit(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        SourceUnit u = s.open(r, SourceUnit::new);
        u.setAbsolutePath(r.string("absolutePath"));
        u.setLicense(r.string("license"));
        u.setExportedSymbols(RawFields.exportedSymbols(r));
        r.ignore("nodes");
        for (LegacyRawNode c : r.children()) u.getNodes().add(s.build(c));
        return u;
    }

    private static AstNode pragma(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        PragmaDirective p = s.open(r, PragmaDirective::new);
        p.setLiterals(r.strings("literals"));
        return p;
    }

    private static AstNode importDirective(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ImportDirective d = s.open(r, ImportDirective::new);
        d.setFile(r.string("file"));
        d.setAbsolutePath(r.string("absolutePath"));
        d.setUnitAlias(r.string("unitAlias"));
        d.setSourceUnit(s.ref(r.longOrNull("SourceUnit")));
        d.setScope(s.ref(r.longOrNull("scope")));
        d.setSymbolAliases(RawFields.symbolAliases(r, s));
        return d;
    }

    private static AstNode usingFor(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        UsingForDirective u = s.open(r, UsingForDirective::new);
        ChildCursor c = r.cursor();
        r.ignore("libraryName");
        u.setLibraryName(s.build(c.next("libraryName")));
        u.setTypeName(s.buildOrNull(c.optional("typeName"), TypeName.class));
        c.expectEnd();
        return u;
    }

    private static AstNode inheritanceSpecifier(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        InheritanceSpecifier i = s.open(r, InheritanceSpecifier::new);
        ChildCursor c = r.cursor();
        r.ignore("baseName", "arguments");
        i.setBaseName(s.build(c.next("baseName")));
        for (LegacyRawNode a : c.rest()) i.getArguments().add(s.build(a, Expression.class));
        i.setArgumentsPresent(!i.getArguments().isEmpty());
        return i;
    }

    private static AstNode modifierInvocation(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ModifierInvocation m = s.open(r, ModifierInvocation::new);
        ChildCursor c = r.cursor();
        r.ignore("modifierName", "arguments");
        m.setModifierName(s.build(c.next("modifierName")));
        for (LegacyRawNode a : c.rest()) m.getArguments().add(s.build(a, Expression.class));
        m.setArgumentsPresent(!m.getArguments().isEmpty());
        m.setInvocationKind(r.string("kind"));
        return m;
    }

    private static AstNode overrideSpecifier(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        OverrideSpecifier o = s.open(r, OverrideSpecifier::new);
        r.ignore("overrides");
        for (LegacyRawNode c : r.children()) o.getOverrides().add(s.build(c));
        return o;
    }

    private static AstNode structuredDocumentation(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        StructuredDocumentation d = s.open(r, StructuredDocumentation::new);
        d.setText(r.string("text"));
        return d;
    }

    private static AstNode parameterList(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ParameterList p = s.open(r, ParameterList::new);
        r.ignore("parameters");
        for (LegacyRawNode c : r.children()) p.getParameters().add(s.build(c, VariableDeclaration.class));
        return p;
    }

    // ---- declarations

    private static void declaration(Declaration d, LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        d.setName(r.string("name"));
        d.setScope(s.ref(r.longOrNull("scope")));
        JsonNode doc = r.field("documentation");
        if (doc != null && doc.isTextual()) d.setDocumentation(doc.asText());
    }

    /** Takes a leading {@code StructuredDocumentation} child (0.6.3+ legacy output). */
    private static void documentationChild(Declaration d, ChildCursor c, ProcessingSession<LegacyRawNode> s) {
        LegacyRawNode doc = c.nextIf(NodeKind.STRUCTURED_DOCUMENTATION);
        if (doc != null) d.setDocumentationNode(s.build(doc, StructuredDocumentation.class));
    }

    private static AstNode contract(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ContractDefinition d = s.open(r, ContractDefinition::new);
        declaration(d, r, s);
        String kind = r.string("contractKind");
        d.setContractKind(kind == null ? ContractKind.CONTRACT : ContractKind.fromRaw(kind));
        d.setAbstractContract(r.boolOrNull("abstract"));
        d.setFullyImplemented(r.boolOrNull("fullyImplemented"));
        d.setLinearizedBaseContracts(s.refs(r.ids("linearizedBaseContracts")));
        r.ignore("baseContracts", "nodes");
        ChildCursor c = r.cursor();
        documentationChild(d, c, s);
        for (LegacyRawNode child : c.rest()) {
            if (child.is(NodeKind.INHERITANCE_SPECIFIER)) {
                d.getBaseContracts().add(s.build(child, InheritanceSpecifier.class));
            } else {
                d.getNodes().add(s.build(child));
            }
        }
        return d;
    }

    private static AstNode function(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        FunctionDefinition f = s.open(r, FunctionDefinition::new);
        declaration(f, r, s);
        String kind = r.string("kind");
        if (kind != null) f.setFunctionKind(FunctionKind.fromRaw(kind));
        f.setConstructorFlag(r.boolOrNull("isConstructor"));
        String visibility = r.string("visibility");
        if (visibility != null) f.setVisibility(Visibility.fromRaw(visibility));
        String mutability = r.string("stateMutability");
        if (mutability != null) f.setStateMutability(StateMutability.fromRaw(mutability));
        f.setConstantFlag(r.boolOrNull("constant"));
        f.setPayableFlag(r.boolOrNull("payable"));
        f.setImplemented(r.boolOrNull("implemented"));
        f.setVirtual(r.bool("virtual", false));
        f.setFunctionSelector(r.string("functionSelector"));
        f.setBaseFunctions(s.refs(r.ids("baseFunctions")));
        r.ignore("parameters", "returnParameters", "modifiers", "body", "overrides");

        ChildCursor c = r.cursor();
        documentationChild(f, c, s);
        int parameterLists = 0;
        for (LegacyRawNode child : c.rest()) {
            NodeKind k = child.nodeKind();
            if (k == NodeKind.PARAMETER_LIST) {
                ParameterList p = s.build(child, ParameterList.class);
                if (parameterLists++ == 0) f.setParameters(p);
                else f.setReturnParameters(p);
            } else if (k == NodeKind.OVERRIDE_SPECIFIER) {
                f.setOverrides(s.build(child, OverrideSpecifier.class));
            } else if (k == NodeKind.MODIFIER_INVOCATION) {
                f.getModifiers().add(s.build(child, ModifierInvocation.class));
            } else if (k == NodeKind.BLOCK) {
                f.setBody(s.build(child, Block.class));
            } else {
                throw child.shapeError("unexpected child of FunctionDefinition");
            }
        }
        if (f.getParameters() == null) throw r.shapeError("FunctionDefinition without parameter list");
        return f;
    }

    private static AstNode modifier(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ModifierDefinition m = s.open(r, ModifierDefinition::new);
        declaration(m, r, s);
        String visibility = r.string("visibility");
        if (visibility != null) m.setVisibility(Visibility.fromRaw(visibility));
        m.setVirtual(r.bool("virtual", false));
        r.ignore("parameters", "body", "overrides");
        ChildCursor c = r.cursor();
        documentationChild(m, c, s);
        m.setParameters(s.build(c.next("parameters"), ParameterList.class));
        LegacyRawNode overrides = c.nextIf(NodeKind.OVERRIDE_SPECIFIER);
        if (overrides != null) m.setOverrides(s.build(overrides, OverrideSpecifier.class));
        if (c.hasNext()) m.setBody(s.build(c.next("body"), Block.class));
        c.expectEnd();
        return m;
    }

    private static AstNode event(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        EventDefinition e = s.open(r, EventDefinition::new);
        declaration(e, r, s);
        e.setAnonymous(r.bool("anonymous", false));
        r.ignore("parameters");
        ChildCursor c = r.cursor();
        documentationChild(e, c, s);
        e.setParameters(s.build(c.next("parameters"), ParameterList.class));
        c.expectEnd();
        return e;
    }

    private static AstNode struct(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        StructDefinition d = s.open(r, StructDefinition::new);
        declaration(d, r, s);
        d.setCanonicalName(r.string("canonicalName"));
        String visibility = r.string("visibility");
        if (visibility != null) d.setVisibility(Visibility.fromRaw(visibility));
        r.ignore("members");
        ChildCursor c = r.cursor();
        documentationChild(d, c, s);
        for (LegacyRawNode m : c.rest()) d.getMembers().add(s.build(m, VariableDeclaration.class));
        return d;
    }

    private static AstNode enumDefinition(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        EnumDefinition d = s.open(r, EnumDefinition::new);
        declaration(d, r, s);
        d.setCanonicalName(r.string("canonicalName"));
        r.ignore("members");
        ChildCursor c = r.cursor();
        documentationChild(d, c, s);
        for (LegacyRawNode m : c.rest()) d.getMembers().add(s.build(m, EnumValue.class));
        return d;
    }

    private static AstNode enumValue(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        EnumValue v = s.open(r, EnumValue::new);
        declaration(v, r, s);
        return v;
    }

    private static AstNode variable(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        VariableDeclaration v = s.open(r, VariableDeclaration::new);
        declaration(v, r, s);
        v.setTypeDescriptions(s.types(r, r.string("type"), null));
        v.setConstantFlag(r.bool("constant", false));
        String mutability = r.string("mutability");
        if (mutability != null) v.setMutability(Mutability.fromRaw(mutability));
        v.setStateVariable(r.bool("stateVariable", false));
        String location = r.string("storageLocation");
        v.setStorageLocation(location == null ? StorageLocation.DEFAULT : StorageLocation.fromRaw(location));
        String visibility = r.string("visibility");
        if (visibility != null) v.setVisibility(Visibility.fromRaw(visibility));
        v.setIndexed(r.bool("indexed", false));
        v.setFunctionSelector(r.string("functionSelector"));
        v.setBaseFunctions(s.refs(r.ids("baseFunctions")));
        r.ignore("typeName", "value", "overrides");

        ChildCursor c = r.cursor();
        documentationChild(v, c, s);
        for (LegacyRawNode child : c.rest()) {
            if (child.category() == NodeCategory.TYPE_NAME) {
                v.setTypeName(s.build(child, TypeName.class));
            } else if (child.is(NodeKind.OVERRIDE_SPECIFIER)) {
                v.setOverrides(s.build(child, OverrideSpecifier.class));
            } else {
                v.setValue(s.build(child, Expression.class));
            }
        }
        return v;
    }

    // ---- statements

    private static AstNode block(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        Block b = s.open(r, Block::new);
        r.ignore("statements");
        for (LegacyRawNode c : r.children()) b.getStatements().add(s.build(c, Statement.class));
        return b;
    }

    private static AstNode ifStatement(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        IfStatement i = s.open(r, IfStatement::new);
        ChildCursor c = r.cursor();
        r.ignore("condition", "trueBody");
        i.setCondition(s.build(c.next("condition"), Expression.class));
        i.setTrueBody(s.build(c.next("trueBody"), Statement.class));
        i.setFalseBody(s.buildOrNull(c.optional("falseBody"), Statement.class));
        c.expectEnd();
        return i;
    }

    private static AstNode tryStatement(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        TryStatement t = s.open(r, TryStatement::new);
        ChildCursor c = r.cursor();
        r.ignore("externalCall", "clauses");
        t.setExternalCall(s.build(c.next("externalCall"), Expression.class));
        for (LegacyRawNode clause : c.rest()) t.getClauses().add(s.build(clause, TryCatchClause.class));
        return t;
    }

    private static AstNode tryCatchClause(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        TryCatchClause t = s.open(r, TryCatchClause::new);
        t.setErrorName(r.string("errorName"));
        r.ignore("parameters", "block");
        ChildCursor c = r.cursor();
        LegacyRawNode params = c.nextIf(NodeKind.PARAMETER_LIST);
        if (params != null) t.setParameters(s.build(params, ParameterList.class));
        t.setBlock(s.build(c.next("block"), Block.class));
        c.expectEnd();
        return t;
    }

    private static AstNode whileStatement(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        WhileStatement w = s.open(r, WhileStatement::new);
        ChildCursor c = r.cursor();
        r.ignore("condition", "body");
        w.setCondition(s.build(c.next("condition"), Expression.class));
        w.setBody(s.build(c.next("body"), Statement.class));
        c.expectEnd();
        return w;
    }

    /** Legacy output lists the condition first, like a plain while loop. */
    private static AstNode doWhileStatement(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        DoWhileStatement d = s.open(r, DoWhileStatement::new);
        r.ignore("condition", "body");
        for (LegacyRawNode child : r.children()) {
            if (child.category() == NodeCategory.EXPRESSION) d.setCondition(s.build(child, Expression.class));
            else d.setBody(s.build(child, Statement.class));
        }
        if (d.getCondition() == null) throw r.shapeError("DoWhileStatement without condition");
        if (d.getBody() == null) throw r.shapeError("DoWhileStatement without body");
        return d;
    }

    /**
     * Header parts are announced absent by null attributes. When the output carries no such
     * markers and fewer than four children, the parts are classified by kind: an expression is
     * the condition, a declaration statement is the initializer, and an expression statement is
     * the initializer when it comes before the condition or is a plain assignment, otherwise the
     * loop expression.
     */
    private static AstNode forStatement(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ForStatement f = s.open(r, ForStatement::new);
        ChildCursor c = r.cursor();
        boolean announced = r.has("initializationExpression") || r.has("condition") || r.has("loopExpression");
        r.ignore("body");
        if (announced || c.remaining() == 4) {
            f.setInitializationExpression(s.buildOrNull(c.optional("initializationExpression"), Statement.class));
            f.setCondition(s.buildOrNull(c.optional("condition"), Expression.class));
            f.setLoopExpression(s.buildOrNull(c.optional("loopExpression"), ExpressionStatement.class));
            f.setBody(s.build(c.next("body"), Statement.class));
            c.expectEnd();
            return f;
        }

        List<LegacyRawNode> parts = c.rest();
        if (parts.isEmpty()) throw r.shapeError("ForStatement without body");
        LegacyRawNode body = parts.remove(parts.size() - 1);
        boolean seenCondition = false;
        for (LegacyRawNode part : parts) {
            if (part.category() == NodeCategory.EXPRESSION) {
                f.setCondition(s.build(part, Expression.class));
                seenCondition = true;
            } else if (part.is(NodeKind.EXPRESSION_STATEMENT)
                    && (seenCondition || f.getInitializationExpression() != null || looksLikeLoopStep(part))) {
                f.setLoopExpression(s.build(part, ExpressionStatement.class));
            } else {
                f.setInitializationExpression(s.build(part, Statement.class));
            }
        }
        f.setBody(s.build(body, Statement.class));
        return f;
    }

    private static boolean looksLikeLoopStep(LegacyRawNode expressionStatement) {
        List<LegacyRawNode> kids = expressionStatement.children();
        if (kids.isEmpty()) return false;
        LegacyRawNode e = kids.get(0);
        if (e.is(NodeKind.UNARY_OPERATION)) return true;
        if (e.is(NodeKind.ASSIGNMENT)) {
            JsonNode attrs = e.json().get("attributes");
            JsonNode op = attrs == null ? null : attrs.get("operator");
            return op != null && !"=".equals(op.asText());
        }
        return false;
    }

    private static AstNode returnStatement(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        Return ret = s.open(r, Return::new);
        ret.setFunctionReturnParameters(s.ref(r.longOrNull("functionReturnParameters")));
        ChildCursor c = r.cursor();
        ret.setExpression(s.buildOrNull(c.optional("expression"), Expression.class));
        c.expectEnd();
        return ret;
    }

    private static AstNode emit(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        EmitStatement e = s.open(r, EmitStatement::new);
        ChildCursor c = r.cursor();
        r.ignore("eventCall");
        e.setEventCall(s.build(c.next("eventCall"), FunctionCall.class));
        c.expectEnd();
        return e;
    }

    /**
     * Empty tuple slots are not present as children; {@code assignments} lists one entry per
     * slot with {@code null} for the empty ones.
     */
    private static AstNode variableDeclarationStatement(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        VariableDeclarationStatement v = s.open(r, VariableDeclarationStatement::new);
        List<Long> assignments = r.ids("assignments");
        r.ignore("declarations", "initialValue");
        List<LegacyRawNode> declarations = new ArrayList<>();
        LegacyRawNode initialValue = null;
        for (LegacyRawNode child : r.children()) {
            if (child.is(NodeKind.VARIABLE_DECLARATION) && initialValue == null) declarations.add(child);
            else if (initialValue == null) initialValue = child;
            else throw child.shapeError("unexpected extra child of VariableDeclarationStatement");
        }
        boolean hasEmptySlots = assignments.contains(null) && assignments.size() > declarations.size();
        if (hasEmptySlots) {
            int next = 0;
            for (Long id : assignments) {
                if (id == null || next >= declarations.size()) {
                    v.getDeclarations().add(null);
                } else {
                    v.getDeclarations().add(s.build(declarations.get(next++), VariableDeclaration.class));
                }
            }
        } else {
            for (LegacyRawNode d : declarations) v.getDeclarations().add(s.build(d, VariableDeclaration.class));
        }
        v.setInitialValue(s.buildOrNull(initialValue, Expression.class));
        return v;
    }

    private static AstNode expressionStatement(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ExpressionStatement e = s.open(r, ExpressionStatement::new);
        ChildCursor c = r.cursor();
        r.ignore("expression");
        e.setExpression(s.build(c.next("expression"), Expression.class));
        c.expectEnd();
        return e;
    }

    private static AstNode inlineAssembly(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        InlineAssembly a = s.open(r, InlineAssembly::new);
        a.setOperations(r.string("operations"));
        a.setYulAst(r.field("AST"));
        a.setEvmVersion(r.string("evmVersion"));
        a.setExternalReferences(r.field("externalReferences"));
        if (a.getOperations() == null && a.getYulAst() == null) {
            throw r.shapeError("InlineAssembly without operations or AST");
        }
        return a;
    }

    // ---- expressions

    private static <T extends Expression> T expression(T e, LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        e.setTypeDescriptions(s.types(r, r.string("type"), null));
        e.setArgumentTypes(RawFields.argumentTypes(r, s));
        e.setConstant(r.boolOrNull("isConstant"));
        e.setPure(r.boolOrNull("isPure"));
        e.setLValue(r.boolOrNull("isLValue"));
        e.setLValueRequested(r.boolOrNull("lValueRequested"));
        return e;
    }

    private static AstNode assignment(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        Assignment a = expression(s.open(r, Assignment::new), r, s);
        a.setOperator(r.requireString("operator"));
        ChildCursor c = r.cursor();
        a.setLeftHandSide(s.build(c.next("leftHandSide"), Expression.class));
        a.setRightHandSide(s.build(c.next("rightHandSide"), Expression.class));
        c.expectEnd();
        return a;
    }

    private static AstNode conditional(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        Conditional e = expression(s.open(r, Conditional::new), r, s);
        ChildCursor c = r.cursor();
        e.setCondition(s.build(c.next("condition"), Expression.class));
        e.setTrueExpression(s.build(c.next("trueExpression"), Expression.class));
        e.setFalseExpression(s.build(c.next("falseExpression"), Expression.class));
        c.expectEnd();
        return e;
    }

    private static AstNode tuple(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        TupleExpression t = expression(s.open(r, TupleExpression::new), r, s);
        t.setInlineArray(r.bool("isInlineArray", false));
        r.ignore("components");
        for (LegacyRawNode c : r.childrenWithHoles()) {
            t.getComponents().add(c == null ? null : s.build(c, Expression.class));
        }
        return t;
    }

    private static AstNode unary(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        UnaryOperation u = expression(s.open(r, UnaryOperation::new), r, s);
        u.setOperator(r.requireString("operator"));
        u.setPrefix(r.bool("prefix", true));
        ChildCursor c = r.cursor();
        u.setSubExpression(s.build(c.next("subExpression"), Expression.class));
        c.expectEnd();
        return u;
    }

    private static AstNode binary(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        BinaryOperation b = expression(s.open(r, BinaryOperation::new), r, s);
        b.setOperator(r.requireString("operator"));
        b.setCommonType(RawFields.descriptions(r.field("commonType"), r, s));
        ChildCursor c = r.cursor();
        b.setLeftExpression(s.build(c.next("leftExpression"), Expression.class));
        b.setRightExpression(s.build(c.next("rightExpression"), Expression.class));
        c.expectEnd();
        return b;
    }

    private static AstNode functionCall(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        FunctionCall f = expression(s.open(r, FunctionCall::new), r, s);
        List<String> names = r.strings("names");
        names.removeIf(n -> n == null);
        f.setNames(names);
        f.setTypeConversionFlag(r.boolOrNull("type_conversion"));
        f.setStructConstructorCallFlag(r.boolOrNull("isStructConstructorCall"));
        String kind = r.string("kind");
        if (kind != null) f.setCallKind(FunctionCallKind.fromRaw(kind));
        f.setTryCall(r.bool("tryCall", false));
        r.ignore("expression", "arguments");
        ChildCursor c = r.cursor();
        f.setExpression(s.build(c.next("expression"), Expression.class));
        for (LegacyRawNode a : c.rest()) f.getArguments().add(s.build(a, Expression.class));
        return f;
    }

    private static AstNode functionCallOptions(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        FunctionCallOptions f = expression(s.open(r, FunctionCallOptions::new), r, s);
        f.setNames(r.strings("names"));
        r.ignore("expression", "options");
        ChildCursor c = r.cursor();
        f.setExpression(s.build(c.next("expression"), Expression.class));
        for (LegacyRawNode o : c.rest()) f.getOptions().add(s.build(o, Expression.class));
        return f;
    }

    private static AstNode newExpression(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        NewExpression n = expression(s.open(r, NewExpression::new), r, s);
        ChildCursor c = r.cursor();
        r.ignore("typeName");
        n.setTypeName(s.build(c.next("typeName"), TypeName.class));
        c.expectEnd();
        return n;
    }

    private static AstNode memberAccess(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        MemberAccess m = expression(s.open(r, MemberAccess::new), r, s);
        m.setMemberName(r.requireString("member_name"));
        m.setReferencedDeclaration(s.ref(r.longOrNull("referencedDeclaration")));
        ChildCursor c = r.cursor();
        m.setExpression(s.build(c.next("expression"), Expression.class));
        c.expectEnd();
        return m;
    }

    private static AstNode indexAccess(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        IndexAccess i = expression(s.open(r, IndexAccess::new), r, s);
        ChildCursor c = r.cursor();
        r.ignore("baseExpression");
        i.setBaseExpression(s.build(c.next("baseExpression"), Expression.class));
        i.setIndexExpression(s.buildOrNull(c.optional("indexExpression"), Expression.class));
        c.expectEnd();
        return i;
    }

    private static AstNode indexRangeAccess(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        IndexRangeAccess i = expression(s.open(r, IndexRangeAccess::new), r, s);
        ChildCursor c = r.cursor();
        r.ignore("baseExpression");
        i.setBaseExpression(s.build(c.next("baseExpression"), Expression.class));
        i.setStartExpression(s.buildOrNull(c.optional("startExpression"), Expression.class));
        i.setEndExpression(s.buildOrNull(c.optional("endExpression"), Expression.class));
        c.expectEnd();
        return i;
    }

    /** The legacy schema spells the identifier's name as {@code value}. */
    private static AstNode identifier(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        Identifier i = expression(s.open(r, Identifier::new), r, s);
        String name = r.string("value");
        i.setName(name != null ? name : r.requireString("name"));
        i.setReferencedDeclaration(s.ref(r.longOrNull("referencedDeclaration")));
        i.setOverloadedDeclarations(s.refs(r.ids("overloadedDeclarations")));
        return i;
    }

    private static AstNode elementaryTypeNameExpression(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ElementaryTypeNameExpression e = expression(s.open(r, ElementaryTypeNameExpression::new), r, s);
        e.setTypeNameText(r.string("value"));
        r.ignore("typeName");
        ChildCursor c = r.cursor();
        LegacyRawNode typeName = c.nextIf(NodeKind.ELEMENTARY_TYPE_NAME);
        if (typeName != null) e.setTypeName(s.build(typeName, ElementaryTypeName.class));
        c.expectEnd();
        if (e.getTypeName() == null && e.getTypeNameText() == null) {
            throw r.shapeError("ElementaryTypeNameExpression without a type name");
        }
        return e;
    }

    private static AstNode literal(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        Literal l = expression(s.open(r, Literal::new), r, s);
        l.setValue(r.string("value"));
        l.setHexValue(r.string("hexvalue"));
        l.setSubdenomination(r.string("subdenomination"));
        String kind = r.string("kind");
        String token = r.string("token");
        l.setLiteralKind(kind != null ? LiteralKind.fromRaw(kind) : literalKind(token, l));
        return l;
    }

    /** Older output names the lexer token instead of the literal kind, or nothing at all. */
    private static LiteralKind literalKind(String token, Literal l) {
        if (token != null) {
            switch (token) {
                case "number":
                    return LiteralKind.NUMBER;
                case "string":
                    return LiteralKind.STRING;
                case "bool":
                case "true":
                case "false":
                    return LiteralKind.BOOL;
                case "hexString":
                    return LiteralKind.HEX_STRING;
                default:
                    break;
            }
        }
        String type = l.getTypeDescriptions() == null ? null : l.getTypeDescriptions().typeString;
        if (type != null) {
            if (type.startsWith("int_const") || type.startsWith("rational_const")) return LiteralKind.NUMBER;
            if (type.equals("bool")) return LiteralKind.BOOL;
            if (type.startsWith("literal_string")) return LiteralKind.STRING;
        }
        String value = l.getValue();
        if ("true".equals(value) || "false".equals(value)) return LiteralKind.BOOL;
        if (value != null && !value.isEmpty() && Character.isDigit(value.charAt(0))) return LiteralKind.NUMBER;
        return LiteralKind.STRING;
    }

    // ---- type names

    private static AstNode elementaryTypeName(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ElementaryTypeName t = s.open(r, ElementaryTypeName::new);
        t.setName(r.requireString("name"));
        String mutability = r.string("stateMutability");
        if (mutability != null) t.setStateMutability(StateMutability.fromRaw(mutability));
        t.setTypeDescriptions(s.types(r, r.string("type"), null));
        return t;
    }

    private static AstNode userDefinedTypeName(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        UserDefinedTypeName t = s.open(r, UserDefinedTypeName::new);
        t.setName(r.string("name"));
        t.setReferencedDeclaration(s.ref(r.longOrNull("referencedDeclaration")));
        t.setContractScope(s.ref(r.longOrNull("contractScope")));
        t.setTypeDescriptions(s.types(r, r.string("type"), null));
        return t;
    }

    private static AstNode functionTypeName(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        FunctionTypeName t = s.open(r, FunctionTypeName::new);
        String visibility = r.string("visibility");
        if (visibility != null) t.setVisibility(Visibility.fromRaw(visibility));
        String mutability = r.string("stateMutability");
        if (mutability != null) t.setStateMutability(StateMutability.fromRaw(mutability));
        t.setConstantFlag(r.boolOrNull("constant"));
        t.setPayableFlag(r.boolOrNull("payable"));
        t.setTypeDescriptions(s.types(r, r.string("type"), null));
        r.ignore("parameterTypes", "returnParameterTypes");
        ChildCursor c = r.cursor();
        t.setParameterTypes(s.build(c.next("parameterTypes"), ParameterList.class));
        t.setReturnParameterTypes(s.build(c.next("returnParameterTypes"), ParameterList.class));
        c.expectEnd();
        return t;
    }

    private static AstNode mapping(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        Mapping m = s.open(r, Mapping::new);
        m.setTypeDescriptions(s.types(r, r.string("type"), null));
        r.ignore("keyType", "valueType");
        ChildCursor c = r.cursor();
        m.setKeyType(s.build(c.next("keyType"), TypeName.class));
        m.setValueType(s.build(c.next("valueType"), TypeName.class));
        c.expectEnd();
        return m;
    }

    private static AstNode arrayTypeName(LegacyRawNode r, ProcessingSession<LegacyRawNode> s) {
        ArrayTypeName a = s.open(r, ArrayTypeName::new);
        a.setTypeDescriptions(s.types(r, r.string("type"), null));
        r.ignore("baseType");
        ChildCursor c = r.cursor();
        a.setBaseType(s.build(c.next("baseType"), TypeName.class));
        a.setLength(s.buildOrNull(c.optional("length"), Expression.class));
        c.expectEnd();
        return a;
    }
}
