package info.isaksson.erland.solcast.read;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Raw compiler output: one AST per source path, the compiler version string and any other
 * top-level sections, which are passed through untouched.
 */
public final class CompilerOutput {

    /** One source entry. {@code sourceId} and {@code content} are optional. */
    public static final class Source {
        public final String path;
        public final JsonNode ast;
        public final Integer sourceId;
        /** JSON-pointer of {@link #ast} within the compiler output, used in error paths. */
        public final String pointer;
        /** Source text, when the caller has it; used to fill {@code SourceUnit.sourceHash}. */
        public final String content;

        public Source(String path, JsonNode ast, Integer sourceId, String pointer, String content) {
            if (path == null) throw new IllegalArgumentException("path must not be null");
            this.path = path;
            this.ast = ast;
            this.sourceId = sourceId;
            this.pointer = pointer == null ? RawNode.pointer(RawNode.pointer("", "sources"), path) + "/ast" : pointer;
            this.content = content;
        }

        public Source withContent(String content) {
            return new Source(path, ast, sourceId, pointer, content);
        }
    }

    private final Map<String, Source> sources = new LinkedHashMap<>();
    private final Map<String, JsonNode> auxiliary = new TreeMap<>();
    private String compilerVersion;

    public CompilerOutput addSource(String path, JsonNode ast) {
        return addSource(new Source(path, ast, null, null, null));
    }

    public CompilerOutput addSource(String path, JsonNode ast, Integer sourceId) {
        return addSource(new Source(path, ast, sourceId, null, null));
    }

    public CompilerOutput addSource(Source source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        sources.put(source.path, source);
        return this;
    }

    /** Sources in insertion order. */
    public Map<String, Source> getSources() {
        return Collections.unmodifiableMap(sources);
    }

    /** Sources ordered by source id; sources without an id follow in insertion order. */
    public List<Source> orderedSources() {
        List<Source> out = new ArrayList<>(sources.values());
        out.sort(Comparator.comparing((Source s) -> s.sourceId == null ? Integer.MAX_VALUE : s.sourceId));
        return out;
    }

    public String getCompilerVersion() {
        return compilerVersion;
    }

    public CompilerOutput setCompilerVersion(String compilerVersion) {
        this.compilerVersion = compilerVersion;
        return this;
    }

    /** Top-level sections other than the ASTs ({@code contracts}, {@code errors}, ...), by key. */
    public Map<String, JsonNode> getAuxiliary() {
        return Collections.unmodifiableMap(auxiliary);
    }

    public CompilerOutput putAuxiliary(String key, JsonNode value) {
        auxiliary.put(key, value);
        return this;
    }
}
