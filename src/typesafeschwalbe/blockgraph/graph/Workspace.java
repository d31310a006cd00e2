package typesafeschwalbe.blockgraph.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import typesafeschwalbe.blockgraph.blocks.BlockBehavior;
import typesafeschwalbe.blockgraph.blocks.BlockTypes;
import typesafeschwalbe.blockgraph.events.BlockEvent;
import typesafeschwalbe.blockgraph.events.EventBus;
import typesafeschwalbe.blockgraph.types.TypeContext;

/**
 * Owns every block of one graph along with the state shared between them.
 */
public class Workspace {

    private static final Logger LOG = LogManager.getLogger(Workspace.class);

    private final WorkspaceOptions options;
    private final BlockTypes blockTypes;
    private final TypeContext typeContext;
    private final ConnectionRegistry connectionRegistry;
    private final EventBus eventBus;
    private final Map<String, Block> blockDB;
    private final List<Block> topBlocks;

    public Workspace(WorkspaceOptions options) {
        this(options, BlockTypes.standard());
    }

    public Workspace(WorkspaceOptions options, BlockTypes blockTypes) {
        this.options = options;
        this.blockTypes = blockTypes;
        this.typeContext = new TypeContext();
        this.connectionRegistry = new ConnectionRegistry();
        this.eventBus = new EventBus(options.eventsEnabled());
        this.blockDB = new LinkedHashMap<>();
        this.topBlocks = new ArrayList<>();
    }

    public WorkspaceOptions getOptions() {
        return this.options;
    }

    public boolean isTyped() {
        return this.options.typed();
    }

    public TypeContext getTypeContext() {
        return this.typeContext;
    }

    public ConnectionRegistry getConnectionRegistry() {
        return this.connectionRegistry;
    }

    public EventBus getEventBus() {
        return this.eventBus;
    }

    public BlockTypes getBlockTypes() {
        return this.blockTypes;
    }

    public Block newBlock(String type) {
        return this.newBlock(type, null);
    }

    /**
     * Creates a top block of the given type.
     *
     * @param id identity of the new block, generated if null
     * @throws IllegalArgumentException if the type is unknown or the id is
     *     taken
     */
    public Block newBlock(String type, String id) {
        BlockBehavior behavior = this.blockTypes.get(type).orElseThrow(
            () -> new IllegalArgumentException(
                "Unknown block type '" + type + "'"
            )
        );
        String blockId = id;
        if(blockId == null) {
            do {
                blockId = UUID.randomUUID().toString();
            } while(this.blockDB.containsKey(blockId));
        }
        Preconditions.checkArgument(
            !this.blockDB.containsKey(blockId),
            "Block id '%s' is already in use", blockId
        );
        Block block = new Block(this, blockId, type, behavior);
        this.blockDB.put(blockId, block);
        this.topBlocks.add(block);
        try(EventBus.Scope muted = this.eventBus.mute()) {
            behavior.init(block);
        }
        LOG.debug("Created block {} of type {}", blockId, type);
        this.eventBus.fire(BlockEvent.create(blockId, List.of(blockId)));
        return block;
    }

    public Optional<Block> getBlockById(String id) {
        return Optional.ofNullable(this.blockDB.get(id));
    }

    public ImmutableList<Block> getAllBlocks() {
        return ImmutableList.copyOf(this.blockDB.values());
    }

    public ImmutableList<Block> getTopBlocks() {
        return ImmutableList.copyOf(this.topBlocks);
    }

    public void addTopBlock(Block block) {
        if(!this.topBlocks.contains(block)) {
            this.topBlocks.add(block);
        }
    }

    public void removeTopBlock(Block block) {
        this.topBlocks.remove(block);
    }

    void unregisterBlock(Block block) {
        this.blockDB.remove(block.id);
    }

    /**
     * Disposes every block.
     */
    public void clear() {
        for(Block block: this.getTopBlocks()) {
            block.dispose(false);
        }
    }

}
