package typesafeschwalbe.blockgraph.blocks;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.Connection;
import typesafeschwalbe.blockgraph.graph.Input;
import typesafeschwalbe.blockgraph.scope.Environment;
import typesafeschwalbe.blockgraph.types.InferencePass;
import typesafeschwalbe.blockgraph.types.TypeExpr;
import typesafeschwalbe.blockgraph.variables.BoundVariable;

/**
 * What a block of one type does. Behaviors are shared by every block of
 * their type and keep no per-block state.
 */
public interface BlockBehavior {

    /**
     * Builds the inputs, fields and connections of a freshly created block.
     */
    void init(Block block);

    /**
     * Infers the types of the value tree below {@code block}, reporting
     * mismatches to {@code pass}. By default every plugged in value must
     * fit the type of its socket.
     *
     * @param env types of the variables in scope, by name
     * @return the type of the value produced by the block, if it has one
     */
    default Optional<TypeExpr> infer(
        Block block, Environment<TypeExpr> env, InferencePass pass
    ) {
        for(Input input: block.getInputList()) {
            if(input.getConnection().isEmpty()) {
                continue;
            }
            Connection socket = input.requireConnection();
            Optional<TypeExpr> actual = block.callInfer(
                input.getName(), env, pass
            );
            if(actual.isPresent() && socket.getTypeExpr().isPresent()) {
                pass.unify(actual.get(), socket.getTypeExpr().get(), socket);
            }
        }
        return block.getOutputConnection().flatMap(Connection::getTypeExpr);
    }

    /**
     * Forgets every type inferred for the tree below {@code block}. Must
     * clear each type expression the block owns, before the inputs feeding
     * them are cleared.
     */
    default void clearTypes(Block block) {
        block.clearOwnTypeExprs();
        for(Input input: block.getInputList()) {
            if(input.getConnection().isPresent()) {
                block.callClearTypes(input.getName());
            }
        }
    }

    /**
     * The variables declared by {@code block} that a block plugged into
     * {@code connection} can refer to.
     */
    default Map<String, BoundVariable.Value> getVisibleVariables(
        Block block, Connection connection
    ) {
        Map<String, BoundVariable.Value> visible = new LinkedHashMap<>();
        Optional<String> inputName = connection.getInputName();
        if(inputName.isEmpty()) {
            return visible;
        }
        for(BoundVariable.Value value: block.getBoundValues()) {
            if(value.getScopeInputName().equals(inputName.get())) {
                visible.put(value.getVariableName(), value);
            }
        }
        return visible;
    }

    /**
     * Called after the type expressions of the block's sockets have been
     * replaced, so bound variables can follow them.
     */
    default void typeExprReplaced(Block block) {}

}
