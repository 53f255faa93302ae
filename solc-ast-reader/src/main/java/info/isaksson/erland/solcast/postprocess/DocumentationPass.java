package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.node.decl.Declaration;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.version.SolcVersion;

import java.util.List;

/** Copies the text of {@code StructuredDocumentation} nodes (0.6.3+) into the plain documentation field. */
public final class DocumentationPass implements Postprocessor {

    @Override
    public String name() {
        return "documentation";
    }

    @Override
    public void apply(List<SourceUnit> units, AstContext context, SolcVersion version) {
        for (SourceUnit unit : units) {
            for (Declaration d : unit.descendants(Declaration.class)) {
                if (d.getDocumentation() == null && d.getDocumentationNode() != null) {
                    d.setDocumentation(d.getDocumentationNode().getText());
                }
            }
        }
    }
}
