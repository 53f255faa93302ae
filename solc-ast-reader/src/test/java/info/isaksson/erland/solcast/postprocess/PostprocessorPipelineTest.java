package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.decl.Declaration;
import info.isaksson.erland.solcast.node.decl.FunctionDefinition;
import info.isaksson.erland.solcast.node.expr.Identifier;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.read.AstReader;
import info.isaksson.erland.solcast.read.CompilerOutput;
import info.isaksson.erland.solcast.read.CompilerOutputJson;
import info.isaksson.erland.solcast.read.ReadOptions;
import info.isaksson.erland.solcast.read.ReadResult;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PostprocessorPipelineTest {

    @Test
    void standardPipelineRunsPassesInFixedOrder() {
        List<String> names = PostprocessorPipeline.standard().passes().stream()
                .map(Postprocessor::name)
                .collect(Collectors.toList());
        assertEquals(List.of("reference-link", "scope-repair", "function-kind", "mutability",
                "type-name-harmonization", "documentation", "usage-index"), names);
    }

    @Test
    void runningTheStandardPipelineTwiceChangesNothing() throws Exception {
        for (String fixture : List.of("fixtures/legacy-counter.json", "fixtures/legacy-tuple.json", "fixtures/compact-vault.json")) {
            ReadResult result = new AstReader().read(load(fixture));
            String before = snapshot(result.units, result.context);
            int references = result.context.references().size();

            PostprocessorPipeline.standard().run(result.units, result.context, result.compilerVersion);

            assertEquals(before, snapshot(result.units, result.context), fixture);
            assertEquals(references, result.context.references().size(), fixture);
        }
    }

    @Test
    void emptyPipelineLeavesRawShapeUntouched() throws Exception {
        ReadOptions options = ReadOptions.defaults();
        options.pipeline = PostprocessorPipeline.none();

        ReadResult result = new AstReader(options).read(load("fixtures/legacy-counter.json"));

        assertNull(result.context.resolve(14, FunctionDefinition.class).getFunctionKind());
        assertFalse(result.context.resolve(35, Identifier.class).getReferencedDeclaration().isExternal());
        assertTrue(result.context.usagesOf(result.context.resolve(7)).isEmpty());
    }

    @Test
    void extraPassRunsAfterTheStandardOnes() throws Exception {
        List<String> seen = new ArrayList<>();
        Postprocessor recorder = new Postprocessor() {
            @Override
            public String name() {
                return "recorder";
            }

            @Override
            public void apply(List<SourceUnit> units, AstContext context, SolcVersion version) {
                FunctionDefinition ctor = context.resolve(14, FunctionDefinition.class);
                seen.add(ctor.getFunctionKind().raw());
            }
        };
        ReadOptions options = ReadOptions.defaults();
        options.pipeline = PostprocessorPipeline.standard().then(recorder);

        new AstReader(options).read(load("fixtures/legacy-counter.json"));

        assertEquals(List.of("constructor"), seen);
    }

    private static String snapshot(List<SourceUnit> units, AstContext context) {
        StringBuilder sb = new StringBuilder();
        for (SourceUnit unit : units) {
            for (AstNode n : unit.descendants(x -> true)) {
                sb.append(n).append(' ');
                if (n instanceof Declaration) {
                    Declaration d = (Declaration) n;
                    sb.append("scope=").append(d.getScope()).append(" doc=").append(d.getDocumentation()).append(' ');
                }
                if (n instanceof FunctionDefinition) {
                    FunctionDefinition f = (FunctionDefinition) n;
                    sb.append(f.getFunctionKind()).append(' ').append(f.getStateMutability()).append(' ');
                }
                sb.append("usages=").append(context.usagesOf(n)).append('\n');
            }
        }
        return sb.toString();
    }

    private static CompilerOutput load(String resource) throws Exception {
        Path path = Path.of(PostprocessorPipelineTest.class.getClassLoader().getResource(resource).toURI());
        return CompilerOutputJson.read(path);
    }
}
