package info.isaksson.erland.solcast.node;

import java.util.List;

/**
 * A single-valued child field. Assigning through {@link #set(AstNode)} releases the previous
 * child and adopts the new one in one step.
 */
public final class Slot<T extends AstNode> implements ChildHolder {

    private final AstNode owner;
    private final Class<T> type;
    private final boolean required;
    private T value;

    Slot(AstNode owner, Class<T> type, boolean required) {
        this.owner = owner;
        this.type = type;
        this.required = required;
    }

    public T get() {
        return value;
    }

    public void set(T child) {
        if (child == null && required && value != null) {
            throw new IllegalArgumentException(owner.getKind().rawName() + " requires a "
                    + type.getSimpleName() + "; replace it instead of clearing it");
        }
        if (child == value) return;
        if (child != null) {
            if (!type.isInstance(child)) {
                throw new IllegalArgumentException("Expected " + type.getSimpleName() + " but got "
                        + child.getKind().rawName());
            }
            owner.checkAdoptable(child, value);
        }
        T previous = value;
        value = child;
        if (previous != null) owner.release(previous);
        if (child != null) owner.adopt(child);
    }

    public boolean isRequired() {
        return required;
    }

    @Override
    public void collect(List<AstNode> out) {
        if (value != null) out.add(value);
    }

    @Override
    public boolean remove(AstNode child) {
        if (value != child || child == null) return false;
        if (required) {
            throw new IllegalStateException("Cannot remove required " + type.getSimpleName() + " #"
                    + child.getId() + " from " + owner.getKind().rawName() + " #" + owner.getId()
                    + "; replace it instead");
        }
        value = null;
        owner.release(child);
        return true;
    }
}
