package typesafeschwalbe.blockgraph.events;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import typesafeschwalbe.blockgraph.graph.Coordinate;

public class BlockEvent {

    public interface EventValue {}

    public static record Create(
        List<String> blockIds
    ) implements EventValue {}

    public static record Delete(
        List<String> blockIds
    ) implements EventValue {}

    public static record Move(
        Optional<String> oldParentId, Optional<String> oldInputName,
        Coordinate oldCoordinate,
        Optional<String> newParentId, Optional<String> newInputName,
        Coordinate newCoordinate
    ) implements EventValue {}

    public static record Change(
        String element, Optional<String> name,
        Object oldValue, Object newValue
    ) implements EventValue {

        public boolean isNoOp() {
            return Objects.equals(this.oldValue, this.newValue);
        }

    }

    public enum Type {
        CREATE, // Create
        DELETE, // Delete
        MOVE,   // Move
        CHANGE  // Change
    }

    public final Type type;
    public final String blockId;
    private final EventValue value;

    public BlockEvent(Type type, String blockId, EventValue value) {
        this.type = type;
        this.blockId = blockId;
        this.value = value;
    }

    public static BlockEvent create(String blockId, List<String> blockIds) {
        return new BlockEvent(Type.CREATE, blockId, new Create(blockIds));
    }

    public static BlockEvent delete(String blockId, List<String> blockIds) {
        return new BlockEvent(Type.DELETE, blockId, new Delete(blockIds));
    }

    public static BlockEvent change(
        String blockId, String element, Optional<String> name,
        Object oldValue, Object newValue
    ) {
        return new BlockEvent(
            Type.CHANGE, blockId,
            new Change(element, name, oldValue, newValue)
        );
    }

    @SuppressWarnings("unchecked")
    public <T extends EventValue> T getValue() {
        return (T) this.value;
    }

    @Override
    public String toString() {
        return "<" + this.type + " " + this.blockId + ">" + this.value;
    }

}
