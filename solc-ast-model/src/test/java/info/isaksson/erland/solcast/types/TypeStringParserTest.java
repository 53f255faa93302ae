package info.isaksson.erland.solcast.types;

import info.isaksson.erland.solcast.error.MalformedTypeStringException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeStringParserTest {

    /** Type strings as solc 0.4 through 0.8 print them. */
    private static final List<String> CORPUS = List.of(
            "uint256",
            "address payable",
            "bytes32",
            "uint256[] storage ref",
            "uint8[3] memory",
            "bytes storage pointer",
            "string calldata",
            "struct Lib.Point memory",
            "enum Color",
            "library SafeMath",
            "contract IERC20",
            "contract super Base",
            "type(contract IERC20)",
            "mapping(address => uint256)",
            "mapping(address owner => mapping(address spender => uint256) allowance)",
            "function (uint256,bool) pure returns (bytes32)",
            "function () payable external returns (uint256)",
            "function (address,uint256) external returns (bool)",
            "modifier (uint256)",
            "tuple(uint256,,bool)",
            "tuple()",
            "int_const 1000",
            "int_const -5",
            "int_const 1157...(70 digits omitted)...9935",
            "rational_const 1 / 2",
            "literal_string \"hello\"",
            "literal_string hex\"00ff\"",
            "module \"lib/A.sol\"",
            "msg",
            "Lib.Price");

    @Test
    void corpusReserializesToTheSameText() {
        for (String s : CORPUS) {
            TypeDescriptor d = TypeStringParser.parse(s);
            assertEquals(s, d.toTypeString(), s);
            assertEquals(d, TypeStringParser.parse(d.toTypeString()), s);
        }
    }

    @Test
    void readsLocationsAndPointerness() {
        TypeDescriptor ref = TypeStringParser.parse("uint256[] storage ref");
        assertEquals(TypeKind.ARRAY, ref.kind);
        assertTrue(ref.isDynamicArray());
        assertEquals(DataLocation.STORAGE, ref.getLocation());
        assertFalse(ref.isPointer());

        TypeDescriptor ptr = TypeStringParser.parse("bytes storage pointer");
        assertTrue(ptr.isPointer());

        TypeDescriptor fixed = TypeStringParser.parse("uint8[3] memory");
        assertEquals("3", fixed.arrayLength);
        assertEquals(DataLocation.MEMORY, fixed.getLocation());
        assertEquals(DataLocation.NONE, TypeStringParser.parse("uint256").getLocation());
    }

    @Test
    void readsNamedMappingSlots() {
        TypeDescriptor m = TypeStringParser.parse(
                "mapping(address owner => mapping(address spender => uint256) allowance)");
        assertEquals(TypeKind.MAPPING, m.kind);
        assertEquals("owner", m.keyName);
        assertEquals("allowance", m.valueName);
        assertEquals(TypeKind.MAPPING, m.value.kind);
        assertEquals("spender", m.value.keyName);
        assertNull(m.value.valueName);
        assertEquals("address", m.element.name);
    }

    @Test
    void readsFunctionSignatures() {
        TypeDescriptor f = TypeStringParser.parse("function (uint256,bool) pure returns (bytes32)");
        assertEquals(TypeKind.FUNCTION, f.kind);
        assertEquals(2, f.parameters.size());
        assertEquals(List.of("pure"), f.modifiers);
        assertEquals("bytes32", f.returns.get(0).name);
    }

    @Test
    void keepsEmptyTupleSlots() {
        TypeDescriptor t = TypeStringParser.parse("tuple(uint256,,bool)");
        assertEquals(3, t.parameters.size());
        assertEquals(TypeKind.EMPTY, t.parameters.get(1).kind);
    }

    @Test
    void distinguishesSpecialNames() {
        assertTrue(TypeStringParser.parse("address payable").isPayableAddress());
        assertTrue(TypeStringParser.parse("contract super Base").isSuperContract());
        assertEquals(TypeKind.MAGIC, TypeStringParser.parse("msg").kind);
        assertEquals(TypeKind.NAMED, TypeStringParser.parse("Lib.Price").kind);
        assertEquals(TypeKind.TYPE, TypeStringParser.parse("type(contract IERC20)").kind);
        assertEquals(TypeKind.INT_CONST, TypeStringParser.parse("int_const 1157...(70 digits omitted)...9935").kind);
    }

    @Test
    void keepsUnknownTrailingWordsAsQualifiers() {
        TypeDescriptor d = TypeStringParser.parse("uint256 slice");
        assertEquals(List.of("slice"), d.qualifiers);
        TypeDescriptor unknown = TypeStringParser.parse("bytes memory frozen");
        assertEquals(List.of("memory", "frozen"), unknown.qualifiers);
        assertEquals("bytes memory frozen", unknown.toTypeString());
    }

    @Test
    void reportsPositionOfMalformedInput() {
        MalformedTypeStringException e = assertThrows(MalformedTypeStringException.class,
                () -> TypeStringParser.parse("uint256)"));
        assertEquals(7, e.getPosition());
        assertEquals(")", e.getOffendingText());

        e = assertThrows(MalformedTypeStringException.class, () -> TypeStringParser.parse("uint256["));
        assertEquals(8, e.getPosition());

        e = assertThrows(MalformedTypeStringException.class, () -> TypeStringParser.parse("(uint256)"));
        assertEquals(0, e.getPosition());

        assertThrows(MalformedTypeStringException.class, () -> TypeStringParser.parse(""));
        assertThrows(MalformedTypeStringException.class, () -> TypeStringParser.parse("mapping(address =>"));
        assertThrows(MalformedTypeStringException.class, () -> TypeStringParser.parse("literal_string \"open"));
        assertNull(e.getNodePath());
    }

    @Test
    void descriptionsParseEagerly() {
        TypeDescriptions d = TypeDescriptions.parse("bool", "t_bool");
        assertEquals(TypeKind.ELEMENTARY, d.descriptor.kind);
        assertNull(TypeDescriptions.parse(null, "t_bool").descriptor);
        assertThrows(MalformedTypeStringException.class, () -> TypeDescriptions.parse("bool[", null));
    }
}
