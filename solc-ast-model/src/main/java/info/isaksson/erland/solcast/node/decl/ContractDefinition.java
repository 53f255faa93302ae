package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.ContractKind;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.meta.InheritanceSpecifier;

import java.util.List;

public final class ContractDefinition extends Declaration {

    private ContractKind contractKind;
    private Boolean abstractContract;
    private Boolean fullyImplemented;
    private List<NodeRef> linearizedBaseContracts = List.of();
    private final NodeList<InheritanceSpecifier> baseContracts = list(InheritanceSpecifier.class);
    private final NodeList<AstNode> nodes = list(AstNode.class);

    public ContractDefinition(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONTRACT_DEFINITION;
    }

    public ContractKind getContractKind() {
        return contractKind;
    }

    public void setContractKind(ContractKind contractKind) {
        this.contractKind = contractKind;
    }

    /** {@code abstract} keyword (0.6.0+); {@code null} until postprocessing for older output. */
    public Boolean getAbstractContract() {
        return abstractContract;
    }

    public void setAbstractContract(Boolean abstractContract) {
        this.abstractContract = abstractContract;
    }

    public Boolean getFullyImplemented() {
        return fullyImplemented;
    }

    public void setFullyImplemented(Boolean fullyImplemented) {
        this.fullyImplemented = fullyImplemented;
    }

    public List<NodeRef> getLinearizedBaseContracts() {
        return linearizedBaseContracts;
    }

    public void setLinearizedBaseContracts(List<NodeRef> linearizedBaseContracts) {
        this.linearizedBaseContracts = linearizedBaseContracts == null ? List.of() : List.copyOf(linearizedBaseContracts);
    }

    public NodeList<InheritanceSpecifier> getBaseContracts() {
        return baseContracts;
    }

    public NodeList<AstNode> getNodes() {
        return nodes;
    }
}
