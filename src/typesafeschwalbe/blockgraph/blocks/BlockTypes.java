package typesafeschwalbe.blockgraph.blocks;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Registry of block behaviors by type tag.
 */
public class BlockTypes {

    private final Map<String, BlockBehavior> behaviors;

    public BlockTypes() {
        this.behaviors = new LinkedHashMap<>();
    }

    /**
     * The built in typed blocks.
     */
    public static BlockTypes standard() {
        BlockTypes types = new BlockTypes();
        LogicBlocks.registerAll(types);
        MathBlocks.registerAll(types);
        ListBlocks.registerAll(types);
        PairBlocks.registerAll(types);
        FunctionBlocks.registerAll(types);
        VariableBlocks.registerAll(types);
        StatementBlocks.registerAll(types);
        return types;
    }

    public BlockTypes register(String type, BlockBehavior behavior) {
        Preconditions.checkArgument(
            !this.behaviors.containsKey(type),
            "Block type '%s' is already registered", type
        );
        this.behaviors.put(type, Preconditions.checkNotNull(behavior));
        return this;
    }

    public BlockTypes register(BlockTemplate template) {
        return this.register(template.type(), template);
    }

    public Optional<BlockBehavior> get(String type) {
        return Optional.ofNullable(this.behaviors.get(type));
    }

    public boolean contains(String type) {
        return this.behaviors.containsKey(type);
    }

    public Set<String> types() {
        return ImmutableSet.copyOf(this.behaviors.keySet());
    }

}
