package typesafeschwalbe.blockgraph.graph;

import java.util.Optional;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;

public class TextInputField extends Field {

    public static final Function<String, Optional<String>> ANY_TEXT
        = Optional::of;

    public static final Function<String, Optional<String>> INTEGER
        = text -> Optional.ofNullable(Ints.tryParse(text.trim()))
            .map(String::valueOf);

    public static final Function<String, Optional<String>> FLOAT
        = text -> Optional.ofNullable(Doubles.tryParse(text.trim()))
            .map(String::valueOf);

    private final Function<String, Optional<String>> validator;
    private String value;

    public TextInputField(String initial) {
        this(initial, ANY_TEXT);
    }

    /**
     * @param validator maps user input to the stored value, or to nothing
     *     if the input is rejected
     */
    public TextInputField(
        String initial, Function<String, Optional<String>> validator
    ) {
        this.validator = validator;
        this.value = validator.apply(initial).orElseThrow(
            () -> new IllegalArgumentException(
                "Invalid initial value '" + initial + "'"
            )
        );
    }

    public boolean accepts(String value) {
        return this.validator.apply(value).isPresent();
    }

    @Override
    public String getValue() {
        return this.value;
    }

    @Override
    public String setValue(String value) {
        Optional<String> validated = this.validator.apply(value);
        Preconditions.checkArgument(
            validated.isPresent(),
            "Field '%s' rejects value '%s'", this.getName().orElse("?"), value
        );
        String old = this.value;
        this.value = validated.get();
        return old;
    }

}
