package typesafeschwalbe.blockgraph.scope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.Connection;
import typesafeschwalbe.blockgraph.variables.BoundVariable;

/**
 * Finds the variable declarations visible at a connection and matches
 * references against them by name.
 */
public final class ScopeResolver {

    private static final Logger LOG = LogManager.getLogger(
        ScopeResolver.class
    );

    private ScopeResolver() {}

    /**
     * The variables visible to a block plugged into {@code connection}.
     *
     * @param bubble whether to include the variables of the enclosing blocks
     */
    public static Environment<BoundVariable.Value> allVisibleVariables(
        Connection connection, boolean bubble
    ) {
        List<Map<String, BoundVariable.Value>> frames = new ArrayList<>();
        Connection current = connection;
        while(current != null) {
            Block owner = current.getSourceBlock();
            frames.add(owner.getBehavior().getVisibleVariables(owner, current));
            if(!bubble) {
                break;
            }
            current = ScopeResolver.parentConnectionOf(owner).orElse(null);
        }
        Environment<BoundVariable.Value> env = Environment.empty();
        for(Map<String, BoundVariable.Value> frame: Lists.reverse(frames)) {
            env = env.extendAll(frame);
        }
        return env;
    }

    /**
     * The connection of the parent block this block is plugged into.
     */
    public static Optional<Connection> parentConnectionOf(Block block) {
        Optional<Connection> superior = block.getOutputConnection();
        if(superior.isEmpty()) {
            superior = block.getPreviousConnection();
        }
        return superior.flatMap(Connection::getTargetConnection);
    }

    private static record Pending(
        Block block, Environment<BoundVariable.Value> env
    ) {}

    /**
     * Matches every reference below {@code root} against the variables
     * visible at {@code parentConnection}. Without {@code bind} this stops at
     * the first unresolved reference and changes nothing.
     */
    public static boolean resolveReference(
        Block root, Connection parentConnection, boolean bind
    ) {
        Environment<BoundVariable.Value> rootEnv = parentConnection == null
            ? Environment.empty()
            : ScopeResolver.allVisibleVariables(parentConnection, true);
        Deque<Pending> pending = new ArrayDeque<>();
        pending.add(new Pending(root, rootEnv));
        boolean resolved = true;
        while(!pending.isEmpty()) {
            Pending current = pending.poll();
            Block block = current.block();
            List<String> unresolved = new ArrayList<>();
            for(BoundVariable.Reference reference: block.getBoundReferences()) {
                Optional<BoundVariable.Value> value = current.env()
                    .lookup(reference.getVariableName());
                if(value.isPresent()) {
                    if(bind) {
                        reference.setBoundValue(value.get());
                    }
                    continue;
                }
                resolved = false;
                if(!bind) {
                    LOG.trace(
                        "Reference '{}' of block {} is not in scope",
                        reference.getVariableName(), block.id
                    );
                    return false;
                }
                reference.removeBoundValue();
                unresolved.add(reference.getVariableName());
            }
            if(bind) {
                block.setWarningText(unresolved.isEmpty()
                    ? null
                    : "Unresolved variable(s): "
                        + Joiner.on(", ").join(unresolved));
            }
            LOG.trace(
                "Resolved block {} with {} variable(s) in scope",
                block.id, current.env().names().size()
            );
            for(Block child: block.getChildren(true)) {
                Optional<Connection> childParent = ScopeResolver
                    .parentConnectionOf(child);
                Environment<BoundVariable.Value> childEnv = current.env();
                if(childParent.isPresent()) {
                    childEnv = childEnv.extendAll(
                        block.getBehavior().getVisibleVariables(
                            block, childParent.get()
                        )
                    );
                }
                pending.add(new Pending(child, childEnv));
            }
        }
        return resolved;
    }

}
