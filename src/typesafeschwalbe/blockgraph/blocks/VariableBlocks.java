package typesafeschwalbe.blockgraph.blocks;

import java.util.Optional;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.BoundVariableField;
import typesafeschwalbe.blockgraph.scope.Environment;
import typesafeschwalbe.blockgraph.types.InferencePass;
import typesafeschwalbe.blockgraph.types.TypeContext;
import typesafeschwalbe.blockgraph.types.TypeExpr;

public final class VariableBlocks {

    private VariableBlocks() {}

    static void registerAll(BlockTypes types) {
        types.register("variables_get_typed", new Getter());
        types.register("let_typed", new Let());
    }

    public static class Getter implements BlockBehavior {

        @Override
        public void init(Block block) {
            TypeExpr a = block.types().makeVar();
            block.appendDummyInput()
                .appendField(BoundVariableField.newReference("x", a), "VAR");
            block.setOutput(true);
            block.setOutputTypeExpr(a);
        }

        @Override
        public void typeExprReplaced(Block block) {
            block.getBoundReferences().get(0)
                .setTypeExpr(block.outputTypeExpr());
        }

        @Override
        public Optional<TypeExpr> infer(
            Block block, Environment<TypeExpr> env, InferencePass pass
        ) {
            TypeExpr expected = block.outputTypeExpr();
            env.lookup(block.getFieldValue("VAR")).ifPresent(
                t -> pass.unify(
                    t, expected, block.getOutputConnection().get()
                )
            );
            return Optional.of(expected);
        }

    }

    public static class Let implements BlockBehavior {

        @Override
        public void init(Block block) {
            TypeContext ctx = block.types();
            TypeExpr a = ctx.makeVar();
            TypeExpr b = ctx.makeVar();
            block.appendDummyInput("VARIABLE")
                .appendField("let")
                .appendField(BoundVariableField.newValue("x", a, "EXP2"), "VAR");
            block.appendValueInput("EXP1").setTypeExpr(a).appendField("=");
            block.appendValueInput("EXP2").setTypeExpr(b).appendField("in");
            block.setOutput(true);
            block.setOutputTypeExpr(b);
            block.setInputsInline(true);
        }

        @Override
        public void typeExprReplaced(Block block) {
            block.getBoundValues().get(0)
                .setTypeExpr(block.inputTypeExpr("EXP1"));
        }

        @Override
        public Optional<TypeExpr> infer(
            Block block, Environment<TypeExpr> env, InferencePass pass
        ) {
            TypeExpr bound = block.inputTypeExpr("EXP1");
            TypeExpr expected = block.outputTypeExpr();
            block.callInfer("EXP1", env, pass).ifPresent(
                t -> pass.unify(t, bound, block.inputConnection("EXP1"))
            );
            Environment<TypeExpr> inner = env.extend(
                block.getFieldValue("VAR"), bound
            );
            block.callInfer("EXP2", inner, pass).ifPresent(
                t -> pass.unify(t, expected, block.inputConnection("EXP2"))
            );
            return Optional.of(expected);
        }

    }

}
