package typesafeschwalbe.blockgraph.graph;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * A named, user editable element on a row of an {@link Input}.
 */
public abstract class Field {

    private String name;
    private Block sourceBlock;

    protected Field() {
        this.name = null;
        this.sourceBlock = null;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(this.name);
    }

    public Optional<Block> getSourceBlock() {
        return Optional.ofNullable(this.sourceBlock);
    }

    void attach(Block block, String name) {
        Preconditions.checkState(
            this.sourceBlock == null, "Field is already attached to a block"
        );
        this.sourceBlock = block;
        this.name = name;
        this.attached(block);
    }

    protected void attached(Block block) {}

    /**
     * Whether the value of this field is part of a captured block record.
     */
    public boolean isSerializable() {
        return this.name != null;
    }

    public abstract String getValue();

    /**
     * Text shown to the user.
     */
    public String getText() {
        return this.getValue();
    }

    /**
     * Stores a new value, returning the previous one.
     *
     * @throws IllegalArgumentException if the value is rejected
     */
    public abstract String setValue(String value);

    public void dispose() {}

    @Override
    public String toString() {
        return this.getText();
    }

}
