package typesafeschwalbe.blockgraph.blocks;

import java.util.List;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.DropdownField;
import typesafeschwalbe.blockgraph.graph.DropdownField.Option;
import typesafeschwalbe.blockgraph.types.TypeContext;
import typesafeschwalbe.blockgraph.types.TypeExpr;

public final class LogicBlocks {

    private LogicBlocks() {}

    static void registerAll(BlockTypes types) {
        types.register("logic_boolean_typed", new BooleanLiteral());
        types.register("logic_compare_typed", new Compare());
        types.register("logic_ternary_typed", new Ternary());
    }

    public static class BooleanLiteral implements BlockBehavior {
        @Override
        public void init(Block block) {
            block.setOutput(true, "Boolean");
            block.setOutputTypeExpr(block.types().makeBool());
            block.appendDummyInput().appendField(new DropdownField(List.of(
                new Option("true", "TRUE"), new Option("false", "FALSE")
            )), "BOOL");
        }
    }

    public static class Compare implements BlockBehavior {

        @Override
        public void init(Block block) {
            TypeContext ctx = block.types();
            TypeExpr a = ctx.makeVar();
            block.setOutput(true, "Boolean");
            block.setOutputTypeExpr(ctx.makeBool());
            block.appendValueInput("A").setTypeExpr(a);
            block.appendValueInput("B").setTypeExpr(a)
                .appendField(new DropdownField(List.of(
                    new Option("=", "EQ"), new Option("≠", "NEQ"),
                    new Option("<", "LT"), new Option("≤", "LTE"),
                    new Option(">", "GT"), new Option("≥", "GTE")
                )), "OP");
            block.setInputsInline(true);
        }

    }

    public static class Ternary implements BlockBehavior {

        @Override
        public void init(Block block) {
            TypeContext ctx = block.types();
            TypeExpr a = ctx.makeVar();
            block.appendValueInput("IF")
                .setCheck("Boolean")
                .setTypeExpr(ctx.makeBool())
                .appendField("if");
            block.appendValueInput("THEN").setTypeExpr(a).appendField("then");
            block.appendValueInput("ELSE").setTypeExpr(a).appendField("else");
            block.setInputsInline(true);
            block.setOutput(true);
            block.setOutputTypeExpr(a);
        }

    }

}
