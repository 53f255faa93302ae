package info.isaksson.erland.solcast.types;

import info.isaksson.erland.solcast.error.MalformedTypeStringException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for compiler type strings.
 *
 * <p>Stateless: each {@link #parse(String)} call works on its own cursor, so the parser can be
 * shared freely. Unknown trailing words are kept as opaque qualifiers instead of being
 * rejected.</p>
 */
public final class TypeStringParser {

    private static final Pattern ELEMENTARY = Pattern.compile(
            "address|bool|string|bytes|byte|var|uint\\d*|int\\d*|bytes\\d+|u?fixed(\\d+x\\d+)?");
    private static final Set<String> MAGIC = Set.of("msg", "block", "tx", "abi");
    private static final String OMITTED = "(?:\\.\\.\\.\\(\\d+ digits omitted\\)\\.\\.\\.\\d+)?";
    private static final Pattern INT_CONST = Pattern.compile("-?\\d+" + OMITTED);
    private static final Pattern RATIONAL_CONST = Pattern.compile("-?\\d+" + OMITTED + " / \\d+" + OMITTED);

    private TypeStringParser() {}

    public static TypeDescriptor parse(String typeString) {
        if (typeString == null) throw new IllegalArgumentException("typeString is null");
        Cursor c = new Cursor(typeString);
        c.skipSpaces();
        if (c.atEnd()) throw c.error("empty type string");
        TypeDescriptor t = c.parseType(false);
        c.skipSpaces();
        if (!c.atEnd()) throw c.error("unexpected trailing input");
        return t;
    }

    /** True if the word is a recognised data location or pointer qualifier. */
    public static boolean isKnownQualifier(String word) {
        switch (word) {
            case "storage":
            case "memory":
            case "calldata":
            case "transient":
            case "ref":
            case "pointer":
            case "slice":
                return true;
            default:
                return false;
        }
    }

    private static final class Cursor {
        private final String s;
        private int pos;

        Cursor(String s) {
            this.s = s;
        }

        TypeDescriptor parseType(boolean namedSlot) {
            TypeDescriptor t = parseBase();
            while (true) {
                skipSpaces();
                if (peek() == '[') {
                    pos++;
                    int start = pos;
                    while (!atEnd() && Character.isDigit(peek())) pos++;
                    String len = start == pos ? null : s.substring(start, pos);
                    expect(']');
                    t = TypeDescriptor.arrayOf(t, len);
                    continue;
                }
                if (!isWordStart(peek())) break;
                int mark = pos;
                String word = word();
                if (isKnownQualifier(word)) {
                    t = t.withQualifier(word);
                    continue;
                }
                if (namedSlot && followedBySlotEnd()) {
                    pos = mark;
                    break;
                }
                if ("returns".equals(word)) {
                    pos = mark;
                    break;
                }
                t = t.withQualifier(word);
            }
            return t;
        }

        private TypeDescriptor parseBase() {
            skipSpaces();
            int start = pos;
            if (!isWordStart(peek())) throw error("expected a type");
            String word = word();
            switch (word) {
                case "mapping":
                    return parseMapping();
                case "function":
                    return parseFunction();
                case "modifier":
                    return TypeDescriptor.modifier(parseList());
                case "tuple":
                    if (peek() != '(') break;
                    return TypeDescriptor.tuple(parseList());
                case "type":
                    if (peekAfterSpaces() != '(') break;
                    skipSpaces();
                    expect('(');
                    TypeDescriptor inner = parseType(false);
                    skipSpaces();
                    expect(')');
                    return TypeDescriptor.typeOf(inner);
                case "contract": {
                    String next = nextWord("contract name");
                    if ("super".equals(next)) {
                        return TypeDescriptor.contract(nextWord("contract name"), true);
                    }
                    return TypeDescriptor.contract(next, false);
                }
                case "library":
                    return TypeDescriptor.named(TypeKind.LIBRARY, nextWord("library name"));
                case "struct":
                    return TypeDescriptor.named(TypeKind.STRUCT, nextWord("struct name"));
                case "enum":
                    return TypeDescriptor.named(TypeKind.ENUM, nextWord("enum name"));
                case "module":
                    skipSpaces();
                    return TypeDescriptor.named(TypeKind.MODULE, quoted());
                case "int_const":
                    return TypeDescriptor.named(TypeKind.INT_CONST, match(INT_CONST, "integer constant"));
                case "rational_const":
                    return TypeDescriptor.named(TypeKind.RATIONAL_CONST, match(RATIONAL_CONST, "rational constant"));
                case "literal_string":
                    return parseLiteralString();
                case "address": {
                    int mark = pos;
                    skipSpaces();
                    if (isWordStart(peek()) && "payable".equals(word())) {
                        return TypeDescriptor.elementary("address payable");
                    }
                    pos = mark;
                    return TypeDescriptor.elementary("address");
                }
                default:
                    break;
            }
            if (ELEMENTARY.matcher(word).matches()) return TypeDescriptor.elementary(word);
            if (MAGIC.contains(word)) return TypeDescriptor.named(TypeKind.MAGIC, word);
            if (!Character.isLetter(word.charAt(0)) && word.charAt(0) != '_' && word.charAt(0) != '$') {
                pos = start;
                throw error("expected a type name");
            }
            return TypeDescriptor.named(TypeKind.NAMED, word);
        }

        private TypeDescriptor parseMapping() {
            expect('(');
            TypeDescriptor key = parseType(true);
            String keyName = optionalName();
            skipSpaces();
            expectText("=>");
            skipSpaces();
            TypeDescriptor value = parseType(true);
            String valueName = optionalName();
            skipSpaces();
            expect(')');
            return TypeDescriptor.mapping(key, keyName, value, valueName);
        }

        private TypeDescriptor parseFunction() {
            List<TypeDescriptor> params = parseList();
            List<String> modifiers = new ArrayList<>();
            List<TypeDescriptor> returns = List.of();
            while (true) {
                int mark = pos;
                skipSpaces();
                if (!isWordStart(peek())) {
                    pos = mark;
                    break;
                }
                String w = word();
                if ("returns".equals(w)) {
                    returns = parseList();
                    break;
                }
                modifiers.add(w);
            }
            return TypeDescriptor.function(params, modifiers, returns);
        }

        /** Parses {@code (T, , U)}; empty slots become {@link TypeKind#EMPTY}. */
        private List<TypeDescriptor> parseList() {
            skipSpaces();
            expect('(');
            List<TypeDescriptor> out = new ArrayList<>();
            skipSpaces();
            if (peek() == ')') {
                pos++;
                return out;
            }
            while (true) {
                skipSpaces();
                if (peek() == ',' || peek() == ')') {
                    out.add(TypeDescriptor.empty());
                } else {
                    out.add(parseType(false));
                }
                skipSpaces();
                if (peek() == ',') {
                    pos++;
                    continue;
                }
                expect(')');
                return out;
            }
        }

        private TypeDescriptor parseLiteralString() {
            skipSpaces();
            int start = pos;
            if (isWordStart(peek())) {
                String prefix = word();
                if (!"hex".equals(prefix) && !"unicode".equals(prefix)) {
                    pos = start;
                    throw error("unknown string literal prefix");
                }
            }
            quoted();
            return TypeDescriptor.named(TypeKind.LITERAL_STRING, s.substring(start, pos));
        }

        /**
         * A double-quoted literal. The compiler does not always escape embedded quotes, so the
         * literal ends at the first quote followed by the end of input or a list delimiter.
         */
        private String quoted() {
            int start = pos;
            expect('"');
            while (!atEnd()) {
                char ch = s.charAt(pos++);
                if (ch == '\\' && !atEnd()) {
                    pos++;
                    continue;
                }
                if (ch == '"' && (atEnd() || peek() == ',' || peek() == ')' || peek() == ' ')) {
                    return s.substring(start, pos);
                }
            }
            pos = start;
            throw error("unterminated string literal");
        }

        private String optionalName() {
            int mark = pos;
            skipSpaces();
            if (isWordStart(peek())) {
                String w = word();
                if (followedBySlotEnd()) return w;
            }
            pos = mark;
            return null;
        }

        private boolean followedBySlotEnd() {
            int mark = pos;
            skipSpaces();
            boolean end = s.startsWith("=>", pos) || peek() == ')';
            pos = mark;
            return end;
        }

        private String match(Pattern p, String what) {
            skipSpaces();
            Matcher m = p.matcher(s).region(pos, s.length());
            if (!m.lookingAt()) throw error("expected " + what);
            pos = m.end();
            return m.group();
        }

        private String nextWord(String what) {
            skipSpaces();
            if (!isWordStart(peek())) throw error("expected " + what);
            return word();
        }

        private String word() {
            int start = pos;
            while (!atEnd() && isWordChar(s.charAt(pos))) pos++;
            return s.substring(start, pos);
        }

        private void expect(char ch) {
            if (peek() != ch) throw error("expected '" + ch + "'");
            pos++;
        }

        private void expectText(String text) {
            if (!s.startsWith(text, pos)) throw error("expected '" + text + "'");
            pos += text.length();
        }

        private char peekAfterSpaces() {
            int p = pos;
            while (p < s.length() && s.charAt(p) == ' ') p++;
            return p < s.length() ? s.charAt(p) : '\0';
        }

        void skipSpaces() {
            while (!atEnd() && s.charAt(pos) == ' ') pos++;
        }

        char peek() {
            return atEnd() ? '\0' : s.charAt(pos);
        }

        boolean atEnd() {
            return pos >= s.length();
        }

        MalformedTypeStringException error(String reason) {
            return new MalformedTypeStringException(s, pos, reason);
        }

        private static boolean isWordStart(char ch) {
            return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
        }

        private static boolean isWordChar(char ch) {
            return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$' || ch == '.';
        }
    }
}
