package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.stmt.Block;

/** The success clause ({@code returns (...)}) or a {@code catch} clause of a try statement. */
public final class TryCatchClause extends AstNode {

    private String errorName;
    private final Slot<ParameterList> parameters = slot(ParameterList.class);
    private final Slot<Block> block = requiredSlot(Block.class);

    public TryCatchClause(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRY_CATCH_CLAUSE;
    }

    /** {@code ""} for the success clause and plain catch, {@code Error} or {@code Panic} otherwise. */
    public String getErrorName() {
        return errorName;
    }

    public void setErrorName(String errorName) {
        this.errorName = errorName;
    }

    public ParameterList getParameters() {
        return parameters.get();
    }

    public void setParameters(ParameterList parameters) {
        this.parameters.set(parameters);
    }

    public Block getBlock() {
        return block.get();
    }

    public void setBlock(Block block) {
        this.block.set(block);
    }
}
