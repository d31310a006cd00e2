package typesafeschwalbe.blockgraph.variables;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.types.TypeExpr;

/**
 * A named variable attached to a field of a block. A {@link Value} declares
 * the variable, a {@link Reference} uses it.
 */
public abstract class BoundVariable {

    public enum Kind {
        VALUE,
        REFERENCE
    }

    private String name;
    private TypeExpr typeExpr;
    private Block sourceBlock;
    private String fieldName;

    protected BoundVariable(String name, TypeExpr typeExpr) {
        this.name = Preconditions.checkNotNull(name);
        this.typeExpr = typeExpr;
    }

    public abstract Kind kind();

    public boolean isValue() {
        return this.kind() == Kind.VALUE;
    }

    public boolean isReference() {
        return this.kind() == Kind.REFERENCE;
    }

    public String getVariableName() {
        return this.name;
    }

    public void setVariableName(String name) {
        this.name = Preconditions.checkNotNull(name);
    }

    /**
     * Empty on untyped workspaces.
     */
    public Optional<TypeExpr> getTypeExpr() {
        return Optional.ofNullable(this.typeExpr);
    }

    public void setTypeExpr(TypeExpr typeExpr) {
        this.typeExpr = typeExpr;
    }

    public Optional<Block> getSourceBlock() {
        return Optional.ofNullable(this.sourceBlock);
    }

    public Optional<String> getFieldName() {
        return Optional.ofNullable(this.fieldName);
    }

    public void setSource(Block block, String fieldName) {
        Preconditions.checkState(
            this.sourceBlock == null || this.sourceBlock == block,
            "Variable '%s' is already attached to block %s",
            this.name, this.sourceBlock
        );
        this.sourceBlock = block;
        this.fieldName = fieldName;
    }

    public abstract void dispose();

    @Override
    public String toString() {
        return this.kind().toString().toLowerCase() + " '" + this.name + "'";
    }

    public static class Value extends BoundVariable {

        private final String scopeInputName;
        private final Set<Reference> references;
        private boolean disposed;

        public Value(String name, TypeExpr typeExpr, String scopeInputName) {
            super(name, typeExpr);
            this.scopeInputName = Preconditions.checkNotNull(scopeInputName);
            this.references = new LinkedHashSet<>();
            this.disposed = false;
        }

        @Override
        public Kind kind() {
            return Kind.VALUE;
        }

        /**
         * Name of the input of the owning block this value is visible in.
         */
        public String getScopeInputName() {
            return this.scopeInputName;
        }

        public ImmutableList<Reference> getReferences() {
            return ImmutableList.copyOf(this.references);
        }

        public boolean isDisposed() {
            return this.disposed;
        }

        @Override
        public void setVariableName(String name) {
            super.setVariableName(name);
            for(Reference reference: this.references) {
                reference.setVariableName(name);
            }
        }

        @Override
        public void dispose() {
            if(this.disposed) {
                return;
            }
            for(Reference reference: ImmutableList.copyOf(this.references)) {
                reference.removeBoundValue();
            }
            this.disposed = true;
        }

    }

    public static class Reference extends BoundVariable {

        private Value boundValue;

        public Reference(String name, TypeExpr typeExpr) {
            super(name, typeExpr);
            this.boundValue = null;
        }

        @Override
        public Kind kind() {
            return Kind.REFERENCE;
        }

        public Optional<Value> getBoundValue() {
            return Optional.ofNullable(this.boundValue);
        }

        public boolean isResolved() {
            return this.boundValue != null;
        }

        public void setBoundValue(Value value) {
            Preconditions.checkState(
                !value.disposed, "Cannot bind %s to disposed %s", this, value
            );
            if(this.boundValue == value) {
                return;
            }
            this.removeBoundValue();
            value.references.add(this);
            this.boundValue = value;
            super.setVariableName(value.getVariableName());
        }

        public void removeBoundValue() {
            if(this.boundValue == null) {
                return;
            }
            this.boundValue.references.remove(this);
            this.boundValue = null;
        }

        @Override
        public void dispose() {
            this.removeBoundValue();
        }

    }

}
