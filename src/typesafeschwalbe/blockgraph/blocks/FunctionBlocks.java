package typesafeschwalbe.blockgraph.blocks;

import java.util.Optional;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.BoundVariableField;
import typesafeschwalbe.blockgraph.scope.Environment;
import typesafeschwalbe.blockgraph.types.DataType;
import typesafeschwalbe.blockgraph.types.InferencePass;
import typesafeschwalbe.blockgraph.types.TypeContext;
import typesafeschwalbe.blockgraph.types.TypeExpr;

public final class FunctionBlocks {

    private FunctionBlocks() {}

    static void registerAll(BlockTypes types) {
        types.register("lambda_typed", new Lambda());
        types.register("lambda_app_typed", new Application());
        types.register("match_typed", new Match());
    }

    private static DataType.Closure<TypeExpr> closure(
        Block block, TypeExpr expr
    ) {
        return block.types().declared(expr).getValue();
    }

    public static class Lambda implements BlockBehavior {

        @Override
        public void init(Block block) {
            TypeContext ctx = block.types();
            TypeExpr a = ctx.makeVar();
            TypeExpr b = ctx.makeVar();
            block.appendDummyInput()
                .appendField("λ")
                .appendField(
                    BoundVariableField.newValue("x", a, "RETURN"), "VAR"
                );
            block.appendValueInput("RETURN").setTypeExpr(b).appendField("->");
            block.setInputsInline(true);
            block.setOutput(true);
            block.setOutputTypeExpr(ctx.makeClosure(a, b));
        }

        @Override
        public void typeExprReplaced(Block block) {
            TypeExpr argument = FunctionBlocks
                .closure(block, block.outputTypeExpr()).argumentType();
            block.getBoundValues().get(0).setTypeExpr(argument);
        }

        @Override
        public Optional<TypeExpr> infer(
            Block block, Environment<TypeExpr> env, InferencePass pass
        ) {
            TypeExpr expected = block.outputTypeExpr();
            DataType.Closure<TypeExpr> closure = FunctionBlocks
                .closure(block, expected);
            Environment<TypeExpr> inner = env.extend(
                block.getFieldValue("VAR"), closure.argumentType()
            );
            block.callInfer("RETURN", inner, pass).ifPresent(
                t -> pass.unify(
                    t, closure.returnType(), block.inputConnection("RETURN")
                )
            );
            return Optional.of(expected);
        }

    }

    public static class Application implements BlockBehavior {

        @Override
        public void init(Block block) {
            TypeContext ctx = block.types();
            TypeExpr a = ctx.makeVar();
            TypeExpr b = ctx.makeVar();
            block.appendValueInput("FUN").setTypeExpr(ctx.makeClosure(a, b));
            block.appendValueInput("ARG").setTypeExpr(a).appendField(" ");
            block.setInputsInline(true);
            block.setOutput(true);
            block.setOutputTypeExpr(b);
        }

    }

    public static class Match implements BlockBehavior {

        private static final String[] PATTERNS = { "PATTERN1", "PATTERN2" };
        private static final String[] OUTPUTS = { "OUTPUT1", "OUTPUT2" };

        @Override
        public void init(Block block) {
            TypeContext ctx = block.types();
            TypeExpr a = ctx.makeVar();
            TypeExpr b = ctx.makeVar();
            block.appendDummyInput().appendField("match");
            block.appendValueInput("INPUT").setTypeExpr(a);
            block.appendDummyInput().appendField("with");
            for(int caseI = 0; caseI < PATTERNS.length; caseI += 1) {
                block.appendValueInput(PATTERNS[caseI]).setTypeExpr(a);
                block.appendValueInput(OUTPUTS[caseI]).setTypeExpr(b)
                    .appendField("->");
            }
            block.setOutput(true);
            block.setOutputTypeExpr(b);
            block.setInputsInline(false);
        }

    }

}
