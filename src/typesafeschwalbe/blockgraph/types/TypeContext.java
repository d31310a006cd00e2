package typesafeschwalbe.blockgraph.types;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import typesafeschwalbe.blockgraph.Error;
import typesafeschwalbe.blockgraph.ErrorException;
import typesafeschwalbe.blockgraph.UnionFind;

/**
 * Arena of every type node created for one workspace.
 *
 * <p>Constructor nodes are always the root of their class. Unbound variables
 * are linked below another variable (the newer one below the older one) or
 * below a constructor node. Linking only ever adds equivalences, so a node
 * that has to be inferred again must be {@link #clear cleared} first.
 */
public class TypeContext {

    private static final DataType<TypeExpr> UNBOUND
        = new DataType<>(DataType.Type.ANY, null);

    private static Error makeIncompatibleTypesError(
        String aStr, String bStr, String pathDescription
    ) {
        return new Error(
            "Incompatible types: " + aStr + " and " + bStr
                + (pathDescription.length() > 0
                    ? " (" + pathDescription + ")"
                    : "")
        );
    }

    private static Error makeInfiniteTypeError(String varStr, String tStr) {
        return new Error(
            "Infinite type: " + varStr + " occurs in " + tStr
        );
    }

    private final UnionFind<DataType<TypeExpr>> substitutes;

    public TypeContext() {
        this.substitutes = new UnionFind<>();
    }

    public int nodeCount() {
        return this.substitutes.size();
    }

    public TypeExpr makeVar() {
        return this.make(UNBOUND);
    }

    public TypeExpr make(DataType<TypeExpr> value) {
        return new TypeExpr(this.substitutes.add(value));
    }

    public TypeExpr makeBool() {
        return this.make(new DataType<>(DataType.Type.BOOLEAN, null));
    }

    public TypeExpr makeInt() {
        return this.make(new DataType<>(DataType.Type.INTEGER, null));
    }

    public TypeExpr makeFloat() {
        return this.make(new DataType<>(DataType.Type.FLOAT, null));
    }

    public TypeExpr makeList(TypeExpr elementType) {
        return this.make(new DataType<>(
            DataType.Type.LIST, new DataType.ListType<>(elementType)
        ));
    }

    public TypeExpr makePair(TypeExpr firstType, TypeExpr secondType) {
        return this.make(new DataType<>(
            DataType.Type.PAIR, new DataType.Pair<>(firstType, secondType)
        ));
    }

    public TypeExpr makeClosure(TypeExpr argumentType, TypeExpr returnType) {
        return this.make(new DataType<>(
            DataType.Type.CLOSURE,
            new DataType.Closure<>(argumentType, returnType)
        ));
    }

    public TypeExpr resolve(TypeExpr expr) {
        return new TypeExpr(this.substitutes.find(expr.id));
    }

    public DataType<TypeExpr> get(TypeExpr expr) {
        return this.substitutes.get(expr.id);
    }

    public boolean isUnbound(TypeExpr expr) {
        return this.get(expr).isUnbound();
    }

    /**
     * The shape the node was created with, regardless of what it is bound to.
     */
    public DataType<TypeExpr> declared(TypeExpr expr) {
        return this.substitutes.peek(expr.id);
    }

    public void clear(TypeExpr expr) {
        Deque<TypeExpr> pending = new ArrayDeque<>();
        pending.push(expr);
        while(!pending.isEmpty()) {
            TypeExpr current = pending.pop();
            DataType<TypeExpr> own = this.substitutes.peek(current.id);
            if(own.isUnbound()) {
                this.substitutes.detach(current.id, UNBOUND);
                continue;
            }
            for(TypeExpr child: own.children()) {
                pending.push(child);
            }
        }
    }

    private interface Bindings {
        int find(int idx);
        void link(int root, int child);
    }

    private final Bindings direct = new Bindings() {
        @Override
        public int find(int idx) {
            return TypeContext.this.substitutes.find(idx);
        }
        @Override
        public void link(int root, int child) {
            TypeContext.this.substitutes.link(root, child);
        }
    };

    private static record Unification(int a, int b, String path) {}

    public void unify(TypeExpr a, TypeExpr b) throws ErrorException {
        this.unify(a, b, this.direct);
    }

    /**
     * Checks whether {@link #unify} would succeed, without adding any
     * equivalence.
     */
    public boolean canUnify(TypeExpr a, TypeExpr b) {
        Map<Integer, Integer> scratch = new HashMap<>();
        Bindings tentative = new Bindings() {
            @Override
            public int find(int idx) {
                int root = TypeContext.this.substitutes.find(idx);
                Integer linked = scratch.get(root);
                while(linked != null) {
                    root = TypeContext.this.substitutes.find(linked);
                    linked = scratch.get(root);
                }
                return root;
            }
            @Override
            public void link(int root, int child) {
                int rootA = this.find(root);
                int rootB = this.find(child);
                if(rootA != rootB) {
                    scratch.put(rootB, rootA);
                }
            }
        };
        try {
            this.unify(a, b, tentative);
            return true;
        } catch(ErrorException e) {
            return false;
        }
    }

    private void unify(
        TypeExpr a, TypeExpr b, Bindings bindings
    ) throws ErrorException {
        Deque<Unification> pending = new ArrayDeque<>();
        pending.push(new Unification(a.id, b.id, ""));
        while(!pending.isEmpty()) {
            Unification current = pending.pop();
            int rootA = bindings.find(current.a);
            int rootB = bindings.find(current.b);
            if(rootA == rootB) {
                continue;
            }
            DataType<TypeExpr> valA = this.substitutes.peek(rootA);
            DataType<TypeExpr> valB = this.substitutes.peek(rootB);
            if(valA.isUnbound() && valB.isUnbound()) {
                bindings.link(Math.min(rootA, rootB), Math.max(rootA, rootB));
                continue;
            }
            if(valA.isUnbound() || valB.isUnbound()) {
                int var = valA.isUnbound()? rootA : rootB;
                int concrete = valA.isUnbound()? rootB : rootA;
                if(this.occurs(var, concrete, bindings)) {
                    throw new ErrorException(
                        TypeContext.makeInfiniteTypeError(
                            this.display(new TypeExpr(var)),
                            this.display(new TypeExpr(concrete))
                        )
                    );
                }
                bindings.link(concrete, var);
                continue;
            }
            if(valA.type != valB.type) {
                throw new ErrorException(
                    TypeContext.makeIncompatibleTypesError(
                        this.display(new TypeExpr(rootA)),
                        this.display(new TypeExpr(rootB)),
                        current.path
                    )
                );
            }
            List<TypeExpr> childrenA = valA.children();
            List<TypeExpr> childrenB = valB.children();
            for(int childI = childrenA.size() - 1; childI >= 0; childI -= 1) {
                pending.push(new Unification(
                    childrenA.get(childI).id, childrenB.get(childI).id,
                    TypeContext.describeChild(valA.type, childI)
                        + (current.path.length() > 0
                            ? " of " + current.path
                            : "")
                ));
            }
        }
    }

    private static String describeChild(DataType.Type type, int childI) {
        switch(type) {
            case LIST: return "the list element types";
            case PAIR: return childI == 0
                ? "the first pair elements" : "the second pair elements";
            case CLOSURE: return childI == 0
                ? "the function arguments" : "the function return values";
            default:
                throw new RuntimeException("unhandled type!");
        }
    }

    private boolean occurs(int var, int concrete, Bindings bindings) {
        Deque<Integer> pending = new ArrayDeque<>();
        Set<Integer> visited = new HashSet<>();
        pending.push(concrete);
        while(!pending.isEmpty()) {
            int root = bindings.find(pending.pop());
            if(root == var) {
                return true;
            }
            if(!visited.add(root)) {
                continue;
            }
            for(TypeExpr child: this.substitutes.peek(root).children()) {
                pending.push(child.id);
            }
        }
        return false;
    }

    private static record EqualityEncounter(int rootA, int rootB) {}

    public boolean deepEquals(TypeExpr a, TypeExpr b) {
        Deque<EqualityEncounter> pending = new ArrayDeque<>();
        Set<EqualityEncounter> encountered = new HashSet<>();
        pending.push(new EqualityEncounter(
            this.substitutes.find(a.id), this.substitutes.find(b.id)
        ));
        while(!pending.isEmpty()) {
            EqualityEncounter encounter = pending.pop();
            if(!encountered.add(encounter)) {
                continue;
            }
            DataType<TypeExpr> valA = this.substitutes.get(encounter.rootA);
            DataType<TypeExpr> valB = this.substitutes.get(encounter.rootB);
            if(valA.type != valB.type) {
                return false;
            }
            List<TypeExpr> childrenA = valA.children();
            List<TypeExpr> childrenB = valB.children();
            for(int childI = 0; childI < childrenA.size(); childI += 1) {
                pending.push(new EqualityEncounter(
                    this.substitutes.find(childrenA.get(childI).id),
                    this.substitutes.find(childrenB.get(childI).id)
                ));
            }
        }
        return true;
    }

    public String display(TypeExpr expr) {
        int root = this.substitutes.find(expr.id);
        DataType<TypeExpr> value = this.substitutes.get(root);
        switch(value.type) {
            case ANY: {
                return "'t" + root;
            }
            case BOOLEAN:
            case INTEGER:
            case FLOAT: {
                return value.type.label();
            }
            case LIST:
            case PAIR:
            case CLOSURE: {
                StringBuilder output = new StringBuilder(value.type.label());
                output.append("(");
                List<TypeExpr> children = value.children();
                for(int childI = 0; childI < children.size(); childI += 1) {
                    if(childI > 0) {
                        output.append(", ");
                    }
                    output.append(this.display(children.get(childI)));
                }
                output.append(")");
                return output.toString();
            }
            default: {
                throw new RuntimeException("unhandled type!");
            }
        }
    }

}
