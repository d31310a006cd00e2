package typesafeschwalbe.blockgraph.graph;

import java.util.Optional;

import typesafeschwalbe.blockgraph.types.TypeExpr;
import typesafeschwalbe.blockgraph.variables.BoundVariable;

/**
 * Field holding the name of a variable declared or used by its block.
 */
public class BoundVariableField extends Field {

    private final BoundVariable variable;

    public BoundVariableField(BoundVariable variable) {
        this.variable = variable;
    }

    public static BoundVariableField newValue(
        String name, TypeExpr type, String scopeInputName
    ) {
        return new BoundVariableField(
            new BoundVariable.Value(name, type, scopeInputName)
        );
    }

    public static BoundVariableField newReference(String name, TypeExpr type) {
        return new BoundVariableField(new BoundVariable.Reference(name, type));
    }

    @Override
    protected void attached(Block block) {
        this.variable.setSource(block, this.getName().orElse(null));
    }

    public BoundVariable getVariable() {
        return this.variable;
    }

    public Optional<BoundVariable.Value> getValueVariable() {
        if(!(this.variable instanceof BoundVariable.Value)) {
            return Optional.empty();
        }
        return Optional.of((BoundVariable.Value) this.variable);
    }

    public Optional<BoundVariable.Reference> getReferenceVariable() {
        if(!(this.variable instanceof BoundVariable.Reference)) {
            return Optional.empty();
        }
        return Optional.of((BoundVariable.Reference) this.variable);
    }

    @Override
    public String getValue() {
        return this.variable.getVariableName();
    }

    @Override
    public String setValue(String value) {
        if(value == null || value.isBlank()) {
            throw new IllegalArgumentException(
                "Variable names must not be blank"
            );
        }
        String old = this.variable.getVariableName();
        this.variable.setVariableName(value.trim());
        this.getSourceBlock().ifPresent(
            block -> block.variableRenamed(this.variable)
        );
        return old;
    }

}
