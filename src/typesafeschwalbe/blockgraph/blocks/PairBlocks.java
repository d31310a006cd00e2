package typesafeschwalbe.blockgraph.blocks;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.types.TypeContext;
import typesafeschwalbe.blockgraph.types.TypeExpr;

public final class PairBlocks {

    private PairBlocks() {}

    static void registerAll(BlockTypes types) {
        types.register("pair_create_typed", new PairCreate());
        types.register("pair_first_typed", new PairProjection("FIRST", true));
        types.register(
            "pair_second_typed", new PairProjection("SECOND", false)
        );
    }

    public static class PairCreate implements BlockBehavior {

        @Override
        public void init(Block block) {
            TypeContext ctx = block.types();
            TypeExpr a = ctx.makeVar();
            TypeExpr b = ctx.makeVar();
            block.appendValueInput("FIRST").setTypeExpr(a).appendField("(");
            block.appendValueInput("SECOND").setTypeExpr(b).appendField(",");
            block.appendDummyInput().appendField(")");
            block.setOutput(true);
            block.setOutputTypeExpr(ctx.makePair(a, b));
            block.setInputsInline(true);
        }

    }

    /**
     * Takes one element out of a pair. The whole pair type of the input is
     * owned by the block, so clearing it clears both element types.
     */
    public static class PairProjection implements BlockBehavior {

        private final String inputName;
        private final boolean first;

        public PairProjection(String inputName, boolean first) {
            this.inputName = inputName;
            this.first = first;
        }

        @Override
        public void init(Block block) {
            TypeContext ctx = block.types();
            TypeExpr a = ctx.makeVar();
            TypeExpr b = ctx.makeVar();
            block.appendValueInput(this.inputName)
                .setTypeExpr(ctx.makePair(a, b))
                .appendField(this.first? "first (" : "second (");
            block.appendDummyInput().appendField(")");
            block.setOutput(true);
            block.setOutputTypeExpr(this.first? a : b);
            block.setInputsInline(true);
        }

    }

}
