package info.isaksson.erland.solcast.node;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * An ordered list-valued child field. Every mutation validates first, then updates the
 * element order and the parent pointers together.
 *
 * <p>Lists created with {@code allowEmptySlots} accept {@code null} elements; these model
 * syntactic holes such as {@code (a, , b)} and are skipped by {@link AstNode#getChildren()}.</p>
 */
public final class NodeList<T extends AstNode> extends AbstractList<T> implements ChildHolder, RandomAccess {

    private final AstNode owner;
    private final Class<T> type;
    private final boolean allowEmptySlots;
    private final List<T> elements = new ArrayList<>();

    NodeList(AstNode owner, Class<T> type, boolean allowEmptySlots) {
        this.owner = owner;
        this.type = type;
        this.allowEmptySlots = allowEmptySlots;
    }

    @Override
    public T get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public void add(int index, T element) {
        validate(element, null);
        if (index < 0 || index > elements.size()) throw new IndexOutOfBoundsException("index " + index);
        elements.add(index, element);
        if (element != null) owner.adopt(element);
        modCount++;
    }

    @Override
    public T set(int index, T element) {
        T previous = elements.get(index);
        if (previous == element) return previous;
        validate(element, previous);
        elements.set(index, element);
        if (previous != null) owner.release(previous);
        if (element != null) owner.adopt(element);
        return previous;
    }

    @Override
    public T remove(int index) {
        T previous = elements.remove(index);
        if (previous != null) owner.release(previous);
        modCount++;
        return previous;
    }

    public boolean allowsEmptySlots() {
        return allowEmptySlots;
    }

    @Override
    public void collect(List<AstNode> out) {
        for (T e : elements) {
            if (e != null) out.add(e);
        }
    }

    @Override
    public boolean remove(AstNode child) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == child) {
                remove(i);
                return true;
            }
        }
        return false;
    }

    private void validate(T element, T replaced) {
        if (element == null) {
            if (!allowEmptySlots) {
                throw new IllegalArgumentException(owner.getKind().rawName() + " does not accept empty list entries");
            }
            return;
        }
        if (!type.isInstance(element)) {
            throw new IllegalArgumentException("Expected " + type.getSimpleName() + " but got "
                    + element.getKind().rawName());
        }
        owner.checkAdoptable(element, replaced);
    }
}
