package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.meta.ParameterList;

/** Shared shape of functions, modifiers, events and errors. */
public abstract class CallableDeclaration extends Declaration {

    private final Slot<ParameterList> parameters = slot(ParameterList.class);
    private boolean virtual;
    private Visibility visibility;

    protected CallableDeclaration(long id, SourceRange source) {
        super(id, source);
    }

    public ParameterList getParameters() {
        return parameters.get();
    }

    public void setParameters(ParameterList parameters) {
        this.parameters.set(parameters);
    }

    public boolean isVirtual() {
        return virtual;
    }

    public void setVirtual(boolean virtual) {
        this.virtual = virtual;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public void setVisibility(Visibility visibility) {
        this.visibility = visibility;
    }
}
