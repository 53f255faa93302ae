package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.error.UnsupportedForTargetVersionException;
import info.isaksson.erland.solcast.node.FunctionKind;
import info.isaksson.erland.solcast.node.Mutability;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.StorageLocation;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.decl.ContractDefinition;
import info.isaksson.erland.solcast.node.decl.EnumDefinition;
import info.isaksson.erland.solcast.node.decl.EnumValue;
import info.isaksson.erland.solcast.node.decl.ErrorDefinition;
import info.isaksson.erland.solcast.node.decl.EventDefinition;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.decl.StructDefinition;
import info.isaksson.erland.solcast.node.decl.UserDefinedValueTypeDefinition;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;
import info.isaksson.erland.solcast.node.meta.OverrideSpecifier;
import info.isaksson.erland.solcast.node.type.ElementaryTypeName;
import info.isaksson.erland.solcast.node.type.Mapping;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;

import static info.isaksson.erland.solcast.write.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class DeclarationRulesTest {

    @Test
    void constructorSpellingFollowsTheTarget() {
        FunctionDefinition ctor = function("", FunctionKind.CONSTRUCTOR, Visibility.PUBLIC, StateMutability.NONPAYABLE);
        ContractDefinition c = contract("Token", ctor);

        assertEquals("contract Token {\n    function Token() public {}\n}",
                SourceWriter.write(c, SolcVersion.of(0, 4, 21)));
        assertEquals("contract Token {\n    constructor() public {}\n}",
                SourceWriter.write(c, SolcVersion.V0_4_22));
        assertEquals("contract Token {\n    constructor() {}\n}",
                SourceWriter.write(c, SolcVersion.V0_7_0));
    }

    @Test
    void legacyConstructorFlagIsHonouredWithoutAFunctionKind() {
        FunctionDefinition ctor = function("", null, Visibility.PUBLIC, null);
        ctor.setConstructorFlag(true);
        contract("Token", ctor);

        assertEquals("constructor() public {}", SourceWriter.write(ctor, SolcVersion.of(0, 6, 12)));
    }

    @Test
    void viewIsSpelledConstantBefore0417() {
        FunctionDefinition f = function("total", FunctionKind.FUNCTION, Visibility.PUBLIC, StateMutability.VIEW);

        assertEquals("function total() public constant {}", SourceWriter.write(f, SolcVersion.of(0, 4, 16)));
        assertEquals("function total() public view {}", SourceWriter.write(f, SolcVersion.V0_4_17));
    }

    @Test
    void defaultVisibilityBecomesPublicFrom050() {
        FunctionDefinition f = function("f", FunctionKind.FUNCTION, Visibility.DEFAULT, StateMutability.NONPAYABLE);

        assertEquals("function f() {}", SourceWriter.write(f, SolcVersion.of(0, 4, 26)));
        assertEquals("function f() public {}", SourceWriter.write(f, SolcVersion.V0_5_0));
    }

    @Test
    void fallbackAndReceiveFunctions() {
        FunctionDefinition fallback = function("", FunctionKind.FALLBACK, Visibility.EXTERNAL, StateMutability.PAYABLE);
        assertEquals("function() external payable {}", SourceWriter.write(fallback, SolcVersion.V0_5_0));
        assertEquals("fallback() external payable {}", SourceWriter.write(fallback, SolcVersion.V0_6_0));

        FunctionDefinition receive = function("", FunctionKind.RECEIVE, Visibility.EXTERNAL, StateMutability.PAYABLE);
        assertEquals("receive() external payable {}", SourceWriter.write(receive, SolcVersion.V0_6_0));
        UnsupportedForTargetVersionException ex = assertThrows(UnsupportedForTargetVersionException.class,
                () -> SourceWriter.write(receive, SolcVersion.of(0, 5, 17)));
        assertEquals("receive function", ex.getFeature());
        assertEquals("FunctionDefinition", ex.getNodeKind());
    }

    @Test
    void virtualOverrideAndAbstractAreDroppedBefore060() {
        FunctionDefinition f = function("f", FunctionKind.FUNCTION, Visibility.PUBLIC, StateMutability.NONPAYABLE);
        f.setVirtual(true);
        f.setOverrides(new OverrideSpecifier(nextId(), null));
        ContractDefinition c = contract("Base", f);
        c.setAbstractContract(true);

        assertEquals("abstract contract Base {\n    function f() public virtual override {}\n}",
                SourceWriter.write(c, SolcVersion.V0_6_0));
        assertEquals("contract Base {\n    function f() public {}\n}",
                SourceWriter.write(c, SolcVersion.V0_5_0));
    }

    @Test
    void functionSignatureParts() {
        FunctionDefinition f = function("transfer", FunctionKind.FUNCTION, Visibility.EXTERNAL, StateMutability.NONPAYABLE);
        f.getParameters().getParameters().add(variable("address", "to"));
        f.getParameters().getParameters().add(variable("uint256", "amount"));
        f.getReturnParameters().getParameters().add(variable("bool", ""));
        f.setBody(null);

        assertEquals("function transfer(address to, uint256 amount) external returns (bool);",
                SourceWriter.write(f, SolcVersion.LATEST));
    }

    @Test
    void customErrorsNeed084() {
        ErrorDefinition e = new ErrorDefinition(nextId(), null);
        e.setName("Denied");
        e.setParameters(params(variable("uint256", "code")));

        assertEquals("error Denied(uint256 code);", SourceWriter.write(e, SolcVersion.V0_8_4));
        assertThrows(UnsupportedForTargetVersionException.class, () -> SourceWriter.write(e, SolcVersion.of(0, 8, 3)));
    }

    @Test
    void eventsWithIndexedParameters() {
        VariableDeclaration from = variable("address", "from");
        from.setIndexed(true);
        EventDefinition e = new EventDefinition(nextId(), null);
        e.setName("Transfer");
        e.setParameters(params(from, variable("uint256", "value")));

        assertEquals("event Transfer(address indexed from, uint256 value);", SourceWriter.write(e, SolcVersion.LATEST));
        e.setAnonymous(true);
        assertEquals("event Transfer(address indexed from, uint256 value) anonymous;",
                SourceWriter.write(e, SolcVersion.LATEST));
    }

    @Test
    void membersOfTheSameKindAreGrouped() {
        EventDefinition e = new EventDefinition(nextId(), null);
        e.setName("Changed");
        e.setParameters(params());
        ContractDefinition c = contract("C",
                variable("uint256", "a"),
                variable("uint256", "b"),
                e,
                function("f", FunctionKind.FUNCTION, Visibility.PUBLIC, StateMutability.NONPAYABLE));

        assertEquals("contract C {\n"
                + "    uint256 a;\n"
                + "    uint256 b;\n"
                + "\n"
                + "    event Changed();\n"
                + "\n"
                + "    function f() public {}\n"
                + "}", SourceWriter.write(c, SolcVersion.LATEST));
    }

    @Test
    void stateVariableModifiers() {
        VariableDeclaration max = variable("uint256", "MAX");
        max.setVisibility(Visibility.PUBLIC);
        max.setMutability(Mutability.CONSTANT);
        max.setValue(number("100"));
        VariableDeclaration owner = variable("address", "owner");
        owner.setVisibility(Visibility.INTERNAL);
        owner.setMutability(Mutability.IMMUTABLE);
        ContractDefinition c = contract("C", max, owner);

        assertEquals("contract C {\n    uint256 public constant MAX = 100;\n    address internal immutable owner;\n}",
                SourceWriter.write(c, SolcVersion.V0_6_5));
        UnsupportedForTargetVersionException ex = assertThrows(UnsupportedForTargetVersionException.class,
                () -> SourceWriter.write(c, SolcVersion.of(0, 6, 4)));
        assertEquals("immutable variables", ex.getFeature());
    }

    @Test
    void legacyConstantFlagIsUsedWhenMutabilityIsMissing() {
        VariableDeclaration v = variable("uint256", "X");
        v.setConstantFlag(true);
        v.setValue(number("1"));
        contract("C", v);

        assertEquals("uint256 constant X = 1;", SourceWriter.write(v, SolcVersion.of(0, 4, 24)));
    }

    @Test
    void transientStorageNeeds0827() {
        VariableDeclaration lock = variable("bool", "locked");
        lock.setStorageLocation(StorageLocation.TRANSIENT);
        contract("C", lock);

        assertEquals("bool transient locked;", SourceWriter.write(lock, SolcVersion.of(0, 8, 27)));
        assertThrows(UnsupportedForTargetVersionException.class, () -> SourceWriter.write(lock, SolcVersion.of(0, 8, 26)));
    }

    @Test
    void transientStorageWritesWithDefaultOptions() {
        VariableDeclaration lock = variable("bool", "locked");
        lock.setStorageLocation(StorageLocation.TRANSIENT);
        contract("C", lock);

        assertEquals("bool transient locked;", SourceWriter.write(lock, SolcVersion.LATEST));
        assertEquals("bool transient locked;", lock.print());
    }

    @Test
    void latestPassesEveryAdditionGate() throws Exception {
        for (Field field : VersionGates.class.getFields()) {
            VersionGate gate = (VersionGate) field.get(null);
            if (gate.removedIn == null) assertTrue(gate.allows(SolcVersion.LATEST), gate.toString());
        }
    }

    @Test
    void calldataIsDroppedBefore050() {
        VariableDeclaration data = variable("bytes", "data");
        data.setStorageLocation(StorageLocation.CALLDATA);
        params(data);

        assertEquals("bytes data", SourceWriter.write(data, SolcVersion.of(0, 4, 24)));
        assertEquals("bytes calldata data", SourceWriter.write(data, SolcVersion.V0_5_0));
    }

    @Test
    void addressPayableNeeds050() {
        VariableDeclaration to = new VariableDeclaration(nextId(), null);
        ElementaryTypeName address = type("address");
        address.setStateMutability(StateMutability.PAYABLE);
        to.setTypeName(address);
        to.setName("to");
        params(to);

        assertEquals("address to", SourceWriter.write(to, SolcVersion.of(0, 4, 24)));
        assertEquals("address payable to", SourceWriter.write(to, SolcVersion.V0_5_0));
    }

    @Test
    void namedMappingParametersNeed0818() {
        Mapping m = new Mapping(nextId(), null);
        m.setKeyType(type("address"));
        m.setKeyName("owner");
        m.setValueType(type("uint256"));
        m.setValueName("balance");

        assertEquals("mapping(address owner => uint256 balance)", SourceWriter.write(m, SolcVersion.V0_8_18));
        assertEquals("mapping(address => uint256)", SourceWriter.write(m, SolcVersion.of(0, 8, 17)));
    }

    @Test
    void structsAndEnums() {
        StructDefinition s = new StructDefinition(nextId(), null);
        s.setName("Position");
        s.getMembers().add(variable("uint256", "size"));
        s.getMembers().add(variable("bool", "open"));
        assertEquals("struct Position {\n    uint256 size;\n    bool open;\n}", SourceWriter.write(s, SolcVersion.LATEST));

        EnumDefinition e = new EnumDefinition(nextId(), null);
        e.setName("Color");
        for (String name : new String[]{"Red", "Green"}) {
            EnumValue v = new EnumValue(nextId(), null);
            v.setName(name);
            e.getMembers().add(v);
        }
        assertEquals("enum Color {\n    Red,\n    Green\n}", SourceWriter.write(e, SolcVersion.LATEST));
    }

    @Test
    void userDefinedValueTypesNeed088() {
        UserDefinedValueTypeDefinition t = new UserDefinedValueTypeDefinition(nextId(), null);
        t.setName("Price");
        t.setUnderlyingType(type("uint128"));

        assertEquals("type Price is uint128;", SourceWriter.write(t, SolcVersion.V0_8_8));
        assertThrows(UnsupportedForTargetVersionException.class, () -> SourceWriter.write(t, SolcVersion.of(0, 8, 7)));
    }

    @Test
    void documentationIsWrittenAsTripleSlashLines() {
        ContractDefinition c = contract("T");
        c.setDocumentation("@title T\n@notice Does things");

        assertEquals("/// @title T\n/// @notice Does things\ncontract T {}", SourceWriter.write(c, SolcVersion.LATEST));
    }
}
