package typesafeschwalbe.blockgraph.blocks;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.DropdownField;
import typesafeschwalbe.blockgraph.graph.Field;
import typesafeschwalbe.blockgraph.graph.Input;
import typesafeschwalbe.blockgraph.graph.LabelField;
import typesafeschwalbe.blockgraph.graph.TextInputField;

/**
 * A block type described by data instead of code. Fields are collected until
 * the next input element and placed on its row; trailing fields end up on a
 * dummy input of their own.
 *
 * <p>Elements of an unknown kind, or missing something they need, are
 * skipped with a warning and the rest of the block is still built.
 */
public class BlockTemplate implements BlockBehavior {

    private static final Logger LOG = LogManager.getLogger(BlockTemplate.class);

    public static final String INPUT_VALUE = "input_value";
    public static final String INPUT_STATEMENT = "input_statement";
    public static final String INPUT_DUMMY = "input_dummy";
    public static final String FIELD_LABEL = "field_label";
    public static final String FIELD_INPUT = "field_input";
    public static final String FIELD_DROPDOWN = "field_dropdown";

    /**
     * @param arguments checks of an input, text of a label or input field,
     *     or the option values of a dropdown
     */
    public static record Element(
        String kind, Optional<String> name, List<String> arguments
    ) {

        public static Element of(String kind, String name, String... arguments) {
            return new Element(
                kind, Optional.ofNullable(name), List.of(arguments)
            );
        }

        public static Element valueInput(String name, String... check) {
            return Element.of(INPUT_VALUE, name, check);
        }

        public static Element statementInput(String name, String... check) {
            return Element.of(INPUT_STATEMENT, name, check);
        }

        public static Element dummyInput() {
            return Element.of(INPUT_DUMMY, null);
        }

        public static Element label(String text) {
            return Element.of(FIELD_LABEL, null, text);
        }

        public static Element textInput(String name, String text) {
            return Element.of(FIELD_INPUT, name, text);
        }

        public static Element dropdown(String name, String... values) {
            return Element.of(FIELD_DROPDOWN, name, values);
        }

    }

    private static record PendingField(Field field, String name) {}

    private final String type;
    private final List<Element> elements;
    private final Optional<List<String>> output;
    private final Optional<List<String>> previous;
    private final Optional<List<String>> next;

    /**
     * @param output checks of the output connection, empty for blocks
     *     without one; an empty check list accepts anything
     */
    public BlockTemplate(
        String type, List<Element> elements, Optional<List<String>> output,
        Optional<List<String>> previous, Optional<List<String>> next
    ) {
        Preconditions.checkArgument(
            output.isEmpty() || previous.isEmpty(),
            "Block type '%s' cannot have both an output and a previous"
                + " statement", type
        );
        this.type = type;
        this.elements = List.copyOf(elements);
        this.output = output;
        this.previous = previous;
        this.next = next;
    }

    public static BlockTemplate value(
        String type, List<String> outputCheck, Element... elements
    ) {
        return new BlockTemplate(
            type, List.of(elements), Optional.of(outputCheck),
            Optional.empty(), Optional.empty()
        );
    }

    public static BlockTemplate statement(
        String type, List<String> check, Element... elements
    ) {
        return new BlockTemplate(
            type, List.of(elements), Optional.empty(),
            Optional.of(check), Optional.of(check)
        );
    }

    public String type() {
        return this.type;
    }

    public List<Element> elements() {
        return this.elements;
    }

    @Override
    public void init(Block block) {
        List<PendingField> fields = new ArrayList<>();
        for(Element element: this.elements) {
            switch(element.kind()) {
                case FIELD_LABEL:
                case FIELD_INPUT:
                case FIELD_DROPDOWN: {
                    this.makeField(element).ifPresent(fields::add);
                    break;
                }
                case INPUT_VALUE:
                case INPUT_STATEMENT:
                case INPUT_DUMMY: {
                    this.makeInput(block, element).ifPresent(
                        input -> this.placeFields(input, fields)
                    );
                    break;
                }
                default: {
                    LOG.warn(
                        "Skipping element of unknown kind '{}' in block"
                            + " type '{}'",
                        element.kind(), this.type
                    );
                }
            }
        }
        if(!fields.isEmpty()) {
            this.placeFields(block.appendDummyInput(), fields);
        }
        this.output.ifPresent(check -> block.setOutput(
            true, check.toArray(new String[0])
        ));
        this.previous.ifPresent(check -> block.setPreviousStatement(
            true, check.toArray(new String[0])
        ));
        this.next.ifPresent(check -> block.setNextStatement(
            true, check.toArray(new String[0])
        ));
        if(block.getWorkspace().isTyped()) {
            block.getOutputConnection().ifPresent(
                c -> c.setTypeExpr(block.types().makeVar(), false)
            );
            for(Input input: block.getInputList()) {
                if(input.getKind() == Input.Kind.VALUE) {
                    input.setTypeExpr(block.types().makeVar());
                }
            }
        }
    }

    private void placeFields(Input input, List<PendingField> fields) {
        for(PendingField pending: fields) {
            boolean taken = pending.name() != null && input.getSourceBlock()
                .getField(pending.name()).isPresent();
            if(taken) {
                LOG.warn(
                    "Skipping field '{}' in block type '{}': the name is"
                        + " already taken",
                    pending.name(), this.type
                );
                continue;
            }
            input.appendField(pending.field(), pending.name());
        }
        fields.clear();
    }

    private Optional<PendingField> makeField(Element element) {
        String name = element.name().orElse(null);
        switch(element.kind()) {
            case FIELD_LABEL: {
                if(element.arguments().isEmpty()) {
                    return this.skip(element, "a label needs its text");
                }
                return Optional.of(new PendingField(
                    new LabelField(element.arguments().get(0)), name
                ));
            }
            case FIELD_INPUT: {
                if(name == null) {
                    return this.skip(element, "a text input needs a name");
                }
                String text = element.arguments().isEmpty()
                    ? "" : element.arguments().get(0);
                return Optional.of(
                    new PendingField(new TextInputField(text), name)
                );
            }
            case FIELD_DROPDOWN: {
                if(name == null || element.arguments().isEmpty()) {
                    return this.skip(
                        element, "a dropdown needs a name and options"
                    );
                }
                return Optional.of(new PendingField(
                    DropdownField.of(
                        element.arguments().toArray(new String[0])
                    ),
                    name
                ));
            }
            default: {
                throw new RuntimeException("unhandled field kind!");
            }
        }
    }

    private Optional<Input> makeInput(Block block, Element element) {
        Optional<String> name = element.name();
        if(name.isPresent() && block.getInput(name.get()).isPresent()) {
            return this.skip(element, "the input name is already taken");
        }
        if(element.kind().equals(INPUT_DUMMY)) {
            return Optional.of(block.appendDummyInput(name.orElse(null)));
        }
        if(name.isEmpty()) {
            return this.skip(element, "an input needs a name");
        }
        Input input = element.kind().equals(INPUT_VALUE)
            ? block.appendValueInput(name.get())
            : block.appendStatementInput(name.get());
        if(!element.arguments().isEmpty()) {
            input.setCheck(element.arguments().toArray(new String[0]));
        }
        return Optional.of(input);
    }

    private <T> Optional<T> skip(Element element, String reason) {
        LOG.warn(
            "Skipping element {} in block type '{}': {}",
            element, this.type, reason
        );
        return Optional.empty();
    }

}
