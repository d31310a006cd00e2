package typesafeschwalbe.blockgraph.graph;

import java.util.List;

import com.google.common.base.Preconditions;

public class DropdownField extends Field {

    public static record Option(String text, String value) {}

    private final List<Option> options;
    private Option selected;

    public DropdownField(List<Option> options) {
        Preconditions.checkArgument(
            !options.isEmpty(), "Dropdown needs at least one option"
        );
        this.options = List.copyOf(options);
        this.selected = this.options.get(0);
    }

    public static DropdownField of(String... values) {
        return new DropdownField(
            List.of(values).stream().map(v -> new Option(v, v)).toList()
        );
    }

    public List<Option> getOptions() {
        return this.options;
    }

    @Override
    public String getValue() {
        return this.selected.value();
    }

    @Override
    public String getText() {
        return this.selected.text();
    }

    @Override
    public String setValue(String value) {
        Option option = this.options.stream()
            .filter(o -> o.value().equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Dropdown '" + this.getName().orElse("?")
                    + "' has no option '" + value + "'"
            ));
        String old = this.selected.value();
        this.selected = option;
        return old;
    }

}
