package typesafeschwalbe.blockgraph.blocks;

import typesafeschwalbe.blockgraph.graph.Block;

public final class StatementBlocks {

    private StatementBlocks() {}

    static void registerAll(BlockTypes types) {
        types.register("print_typed", new Print());
    }

    public static class Print implements BlockBehavior {

        @Override
        public void init(Block block) {
            block.appendValueInput("TEXT")
                .setTypeExpr(block.types().makeVar())
                .appendField("print");
            block.setPreviousStatement(true, "Statement");
            block.setNextStatement(true, "Statement");
        }

    }

}
