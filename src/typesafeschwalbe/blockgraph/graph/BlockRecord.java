package typesafeschwalbe.blockgraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import typesafeschwalbe.blockgraph.Error;
import typesafeschwalbe.blockgraph.Result;
import typesafeschwalbe.blockgraph.blocks.BlockBehavior;
import typesafeschwalbe.blockgraph.blocks.Reconfigurable;
import typesafeschwalbe.blockgraph.events.EventBus;

/**
 * Detached description of a block tree, enough to build it again.
 *
 * @param inputs records of the blocks plugged into each input, by input name
 */
public record BlockRecord(
    String type, String id,
    Map<String, String> fields,
    Map<String, String> mutation,
    Map<String, BlockRecord> inputs,
    Optional<BlockRecord> next
) {

    private static final Logger LOG = LogManager.getLogger(BlockRecord.class);

    public static BlockRecord capture(Block root) {
        Map<String, BlockRecord> captured = new HashMap<>();
        for(Block block: Lists.reverse(root.getDescendants(true))) {
            Map<String, String> fields = new LinkedHashMap<>();
            for(Field field: block.getFields()) {
                if(field.isSerializable()) {
                    fields.put(field.getName().get(), field.getValue());
                }
            }
            Map<String, String> mutation = Map.of();
            if(block.getBehavior() instanceof Reconfigurable) {
                mutation = ((Reconfigurable) block.getBehavior())
                    .saveMutation(block);
            }
            Map<String, BlockRecord> inputs = new LinkedHashMap<>();
            for(Input input: block.getInputList()) {
                input.targetBlock().ifPresent(
                    child -> inputs.put(input.getName(), captured.get(child.id))
                );
            }
            Optional<BlockRecord> next = block.getNextBlock()
                .map(child -> captured.get(child.id));
            captured.put(block.id, new BlockRecord(
                block.type, block.id, ImmutableMap.copyOf(fields),
                ImmutableMap.copyOf(mutation), ImmutableMap.copyOf(inputs),
                next
            ));
        }
        return captured.get(root.id);
    }

    private static record Pending(BlockRecord record, Connection parent) {}

    /**
     * Builds the described tree as a new top block. Nothing is created if
     * the record names a block type the workspace does not know.
     */
    public static Result<Block> restore(Workspace workspace, BlockRecord record) {
        List<Error> errors = BlockRecord.checkTypes(workspace, record);
        if(!errors.isEmpty()) {
            return Result.ofError(errors);
        }
        Block root = null;
        try(EventBus.Scope batch = workspace.getEventBus().batch()) {
            Deque<Pending> pending = new ArrayDeque<>();
            pending.add(new Pending(record, null));
            while(!pending.isEmpty()) {
                Pending current = pending.poll();
                Block block = BlockRecord.create(workspace, current.record);
                if(root == null) {
                    root = block;
                }
                if(current.parent != null) {
                    Connection superior = block.getOutputConnection()
                        .or(block::getPreviousConnection)
                        .orElseThrow(() -> new IllegalStateException(
                            "Block " + block.id + " cannot be plugged in"
                        ));
                    if(current.parent.canConnect(superior)) {
                        current.parent.connect(superior);
                    } else {
                        LOG.warn(
                            "Block {} no longer fits {}, leaving it unattached",
                            block.id, current.parent
                        );
                    }
                }
                for(Map.Entry<String, BlockRecord> input
                        : current.record.inputs.entrySet()) {
                    Optional<Input> target = block.getInput(input.getKey());
                    if(target.isEmpty() || target.get().getConnection().isEmpty()) {
                        LOG.warn(
                            "Dropping child of unknown input '{}' of block {}",
                            input.getKey(), block.id
                        );
                        continue;
                    }
                    pending.add(new Pending(
                        input.getValue(), target.get().requireConnection()
                    ));
                }
                if(current.record.next.isPresent()) {
                    Optional<Connection> next = block.getNextConnection();
                    if(next.isEmpty()) {
                        LOG.warn(
                            "Dropping next block of {} which has no next"
                                + " connection", block.id
                        );
                    } else {
                        pending.add(new Pending(
                            current.record.next.get(), next.get()
                        ));
                    }
                }
            }
        }
        if(workspace.isTyped()) {
            root.updateTypeInference(true);
            root.resolveReference(null, true);
        }
        return Result.ofValue(root);
    }

    private static List<Error> checkTypes(
        Workspace workspace, BlockRecord record
    ) {
        List<Error> errors = new ArrayList<>();
        Deque<BlockRecord> pending = new ArrayDeque<>();
        pending.push(record);
        while(!pending.isEmpty()) {
            BlockRecord current = pending.pop();
            if(!workspace.getBlockTypes().contains(current.type)) {
                LOG.warn("Unknown block type '{}' in record", current.type);
                errors.add(new Error(
                    "Unknown block type '" + current.type + "'",
                    Error.Marking.error(
                        current.id, "this block cannot be restored"
                    )
                ));
            }
            current.inputs.values().forEach(pending::push);
            current.next.ifPresent(pending::push);
        }
        return errors;
    }

    private static Block create(Workspace workspace, BlockRecord record) {
        String id = record.id;
        if(id != null && workspace.getBlockById(id).isPresent()) {
            id = null;
        }
        Block block = workspace.newBlock(record.type, id);
        BlockBehavior behavior = block.getBehavior();
        if(!record.mutation.isEmpty() && behavior instanceof Reconfigurable) {
            ((Reconfigurable) behavior).loadMutation(block, record.mutation);
        }
        for(Map.Entry<String, String> field: record.fields.entrySet()) {
            if(block.getField(field.getKey()).isEmpty()) {
                LOG.warn(
                    "Ignoring unknown field '{}' of block {}",
                    field.getKey(), block.id
                );
                continue;
            }
            try {
                block.setFieldValue(field.getKey(), field.getValue());
            } catch(IllegalArgumentException e) {
                LOG.warn(
                    "Ignoring invalid value of field '{}' of block {}: {}",
                    field.getKey(), block.id, e.getMessage()
                );
            }
        }
        return block;
    }

}
