package typesafeschwalbe.blockgraph.blocks;

import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.Connection;
import typesafeschwalbe.blockgraph.graph.Input;
import typesafeschwalbe.blockgraph.types.DataType;
import typesafeschwalbe.blockgraph.types.TypeExpr;

public final class ListBlocks {

    private ListBlocks() {}

    static void registerAll(BlockTypes types) {
        types.register("lists_create_with_typed", new ListCreate());
    }

    /**
     * List literal with a variable number of items, all of the same type.
     */
    public static class ListCreate implements BlockBehavior, Reconfigurable {

        public static final String ITEMS = "items";
        public static final int DEFAULT_ITEM_COUNT = 3;

        @Override
        public void init(Block block) {
            TypeExpr elementType = block.types().makeVar();
            block.setOutput(true, "Array");
            block.setOutputTypeExpr(block.types().makeList(elementType));
            this.buildItems(block, elementType, DEFAULT_ITEM_COUNT);
            block.setInputsInline(true);
        }

        private void buildItems(Block block, TypeExpr elementType, int count) {
            block.appendDummyInput("LPAREN").appendField("[");
            for(int itemI = 0; itemI < count; itemI += 1) {
                Input input = block.appendValueInput("ADD" + itemI)
                    .setTypeExpr(elementType);
                if(itemI != 0) {
                    input.appendField(";");
                }
            }
            block.appendDummyInput("RPAREN").appendField("]");
        }

        private void removeItems(Block block) {
            int count = this.itemCount(block);
            block.removeInput("LPAREN");
            for(int itemI = 0; itemI < count; itemI += 1) {
                block.removeInput("ADD" + itemI);
            }
            block.removeInput("RPAREN");
        }

        private TypeExpr elementType(Block block) {
            if(!block.getWorkspace().isTyped()) {
                return null;
            }
            DataType<TypeExpr> list = block.types()
                .declared(block.outputTypeExpr());
            return list.<DataType.ListType<TypeExpr>>getValue().elementType();
        }

        public int itemCount(Block block) {
            int count = 0;
            while(block.getInput("ADD" + count).isPresent()) {
                count += 1;
            }
            return count;
        }

        @Override
        public Map<String, String> saveMutation(Block block) {
            return Map.of(ITEMS, String.valueOf(this.itemCount(block)));
        }

        @Override
        public void loadMutation(Block block, Map<String, String> mutation) {
            String raw = mutation.get(ITEMS);
            Integer count = raw == null ? null : Ints.tryParse(raw);
            Preconditions.checkArgument(
                count != null && count >= 0,
                "Invalid item count '%s' for block %s", raw, block.id
            );
            this.removeItems(block);
            this.buildItems(block, this.elementType(block), count);
        }

        /**
         * Rebuilds the item inputs to hold exactly the given child outputs,
         * in order. A null entry leaves its item empty.
         */
        public void compose(Block block, List<Connection> itemConnections) {
            this.removeItems(block);
            this.buildItems(
                block, this.elementType(block), itemConnections.size()
            );
            for(int itemI = 0; itemI < itemConnections.size(); itemI += 1) {
                Connection child = itemConnections.get(itemI);
                if(child != null) {
                    block.inputConnection("ADD" + itemI).connect(child);
                }
            }
        }

    }

}
