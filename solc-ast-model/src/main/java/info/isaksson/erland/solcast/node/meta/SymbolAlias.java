package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.SourceRange;

import java.util.Objects;

/**
 * One entry of {@code import {X as Y} from "a.sol";}. The foreign symbol is a reference, not a
 * child; {@code local} is {@code null} when no alias is given. Output before 0.6 only carries the
 * identity of the foreign declaration, in which case {@code foreignName} is {@code null} and the
 * name is taken from the referenced declaration.
 */
public final class SymbolAlias {

    public final String foreignName;
    public final NodeRef foreign;
    public final String local;
    public final SourceRange nameLocation;

    private SymbolAlias(String foreignName, NodeRef foreign, String local, SourceRange nameLocation) {
        if ((foreignName == null || foreignName.isBlank()) && foreign == null) {
            throw new IllegalArgumentException("foreignName or foreign must be given");
        }
        this.foreignName = foreignName;
        this.foreign = foreign;
        this.local = local;
        this.nameLocation = nameLocation;
    }

    public static SymbolAlias of(String foreignName, NodeRef foreign, String local, SourceRange nameLocation) {
        return new SymbolAlias(foreignName, foreign, local, nameLocation);
    }

    public static SymbolAlias of(String foreignName, NodeRef foreign, String local) {
        return new SymbolAlias(foreignName, foreign, local, null);
    }

    public boolean hasLocal() {
        return local != null && !local.isEmpty() && !local.equals(foreignName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolAlias)) return false;
        SymbolAlias that = (SymbolAlias) o;
        return Objects.equals(foreignName, that.foreignName)
                && Objects.equals(foreign == null ? null : foreign.getId(), that.foreign == null ? null : that.foreign.getId())
                && Objects.equals(local, that.local);
    }

    @Override
    public int hashCode() {
        return Objects.hash(foreignName, foreign == null ? null : foreign.getId(), local);
    }

    @Override
    public String toString() {
        String name = foreignName != null ? foreignName : String.valueOf(foreign);
        return hasLocal() ? name + " as " + local : name;
    }
}
