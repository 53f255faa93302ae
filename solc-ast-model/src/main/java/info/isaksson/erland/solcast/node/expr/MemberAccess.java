package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;

public final class MemberAccess extends Expression {

    private final Slot<Expression> expression = requiredSlot(Expression.class);
    private String memberName;
    private NodeRef referencedDeclaration;

    public MemberAccess(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MEMBER_ACCESS;
    }

    public Expression getExpression() {
        return expression.get();
    }

    public void setExpression(Expression expression) {
        this.expression.set(expression);
    }

    public String getMemberName() {
        return memberName;
    }

    public void setMemberName(String memberName) {
        this.memberName = memberName;
    }

    /** Declaration the member resolves to, or {@code null} when the compiler did not report one. */
    public NodeRef getReferencedDeclaration() {
        return referencedDeclaration;
    }

    public void setReferencedDeclaration(NodeRef referencedDeclaration) {
        this.referencedDeclaration = referencedDeclaration;
    }
}
