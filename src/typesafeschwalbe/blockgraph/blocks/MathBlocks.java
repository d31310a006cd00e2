package typesafeschwalbe.blockgraph.blocks;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.DropdownField;
import typesafeschwalbe.blockgraph.graph.TextInputField;
import typesafeschwalbe.blockgraph.types.TypeContext;
import typesafeschwalbe.blockgraph.types.TypeExpr;

public final class MathBlocks {

    private MathBlocks() {}

    static void registerAll(BlockTypes types) {
        types.register("int_typed", new NumberLiteral(
            "Int", "0", TextInputField.INTEGER, TypeContext::makeInt
        ));
        types.register("float_typed", new NumberLiteral(
            "Float", "0.0", TextInputField.FLOAT, TypeContext::makeFloat
        ));
        types.register("int_arithmetic_typed", new Arithmetic(
            "Int", "OP_INT", TypeContext::makeInt,
            "+", "-", "*", "/"
        ));
        types.register("float_arithmetic_typed", new Arithmetic(
            "Float", "OP_FLOAT", TypeContext::makeFloat,
            "+.", "-.", "*.", "/."
        ));
    }

    public static class NumberLiteral implements BlockBehavior {

        private final String check;
        private final String initial;
        private final Function<String, Optional<String>> validator;
        private final Function<TypeContext, TypeExpr> type;

        public NumberLiteral(
            String check, String initial,
            Function<String, Optional<String>> validator,
            Function<TypeContext, TypeExpr> type
        ) {
            this.check = check;
            this.initial = initial;
            this.validator = validator;
            this.type = type;
        }

        @Override
        public void init(Block block) {
            block.appendDummyInput().appendField(
                new TextInputField(this.initial, this.validator), "NUM"
            );
            block.setOutput(true, this.check);
            block.setOutputTypeExpr(this.type.apply(block.types()));
        }

    }

    public static class Arithmetic implements BlockBehavior {

        private final String check;
        private final String operatorField;
        private final Function<TypeContext, TypeExpr> type;
        private final String[] operators;

        public Arithmetic(
            String check, String operatorField,
            Function<TypeContext, TypeExpr> type, String... operators
        ) {
            this.check = check;
            this.operatorField = operatorField;
            this.type = type;
            this.operators = operators;
        }

        @Override
        public void init(Block block) {
            Supplier<TypeExpr> make = () -> this.type.apply(block.types());
            block.setOutput(true, this.check);
            block.setOutputTypeExpr(make.get());
            block.appendValueInput("A")
                .setCheck(this.check)
                .setTypeExpr(make.get());
            block.appendValueInput("B")
                .setCheck(this.check)
                .setTypeExpr(make.get())
                .appendField(
                    DropdownField.of(this.operators), this.operatorField
                );
            block.setInputsInline(true);
        }

    }

}
