package typesafeschwalbe.blockgraph.graph;

public enum ConnectionKind {
    OUTPUT,
    VALUE_INPUT,
    PREVIOUS_STATEMENT,
    NEXT_STATEMENT;

    /**
     * Whether a block owning a connection of this kind becomes the child of
     * the block it is plugged into.
     */
    public boolean isSuperior() {
        return this == OUTPUT || this == PREVIOUS_STATEMENT;
    }

    public ConnectionKind opposite() {
        switch(this) {
            case OUTPUT: return VALUE_INPUT;
            case VALUE_INPUT: return OUTPUT;
            case PREVIOUS_STATEMENT: return NEXT_STATEMENT;
            case NEXT_STATEMENT: return PREVIOUS_STATEMENT;
            default:
                throw new RuntimeException("unhandled connection kind!");
        }
    }

    @Override
    public String toString() {
        switch(this) {
            case OUTPUT: return "an output";
            case VALUE_INPUT: return "a value input";
            case PREVIOUS_STATEMENT: return "a previous statement";
            case NEXT_STATEMENT: return "a next statement";
            default:
                throw new RuntimeException("unhandled connection kind!");
        }
    }
}
