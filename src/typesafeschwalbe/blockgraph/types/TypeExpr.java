package typesafeschwalbe.blockgraph.types;

/**
 * Handle of a node in a {@link TypeContext}. Two handles are equal when they
 * name the same node, not when the nodes are unified.
 */
public class TypeExpr {
 
    public final int id;

    TypeExpr(int id) {
        this.id = id;
    }

    @Override
    public String toString() {
        return "#" + this.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(this.id);
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof TypeExpr)) {
            return false; 
        }
        TypeExpr other = (TypeExpr) otherRaw;
        return this.id == other.id;
    }

}
