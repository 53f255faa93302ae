package info.isaksson.erland.solcast.node.type;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.StateMutability;

public final class ElementaryTypeName extends TypeName {

    private String name;
    private StateMutability stateMutability;

    public ElementaryTypeName(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ELEMENTARY_TYPE_NAME;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /** {@code payable} for {@code address payable} (0.5.0+), otherwise {@code null} or {@code nonpayable}. */
    public StateMutability getStateMutability() {
        return stateMutability;
    }

    public void setStateMutability(StateMutability stateMutability) {
        this.stateMutability = stateMutability;
    }
}
