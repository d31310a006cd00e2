package typesafeschwalbe.blockgraph.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import typesafeschwalbe.blockgraph.types.TypeExpr;

/**
 * A named row of a block: a list of fields, optionally followed by a socket
 * other blocks can be plugged into.
 */
public class Input {

    public enum Kind {
        VALUE,
        STATEMENT,
        DUMMY
    }

    private final Kind kind;
    private final String name;
    private final Block sourceBlock;
    private final Connection connection;
    private final List<Field> fieldRow;

    Input(Kind kind, String name, Block sourceBlock, Connection connection) {
        this.kind = kind;
        this.name = name;
        this.sourceBlock = sourceBlock;
        this.connection = connection;
        this.fieldRow = new ArrayList<>();
        if(connection != null) {
            connection.setInputName(name);
        }
    }

    public Kind getKind() {
        return this.kind;
    }

    public String getName() {
        return this.name;
    }

    public Block getSourceBlock() {
        return this.sourceBlock;
    }

    /**
     * Empty for dummy inputs.
     */
    public Optional<Connection> getConnection() {
        return Optional.ofNullable(this.connection);
    }

    public Connection requireConnection() {
        Preconditions.checkState(
            this.connection != null, "Input '%s' has no connection", this.name
        );
        return this.connection;
    }

    public Optional<Block> targetBlock() {
        return this.getConnection().flatMap(Connection::targetBlock);
    }

    public ImmutableList<Field> getFieldRow() {
        return ImmutableList.copyOf(this.fieldRow);
    }

    public Input appendField(String label) {
        return this.appendField(new LabelField(label), null);
    }

    public Input appendField(Field field) {
        return this.appendField(field, null);
    }

    public Input appendField(Field field, String fieldName) {
        Preconditions.checkArgument(
            fieldName == null || this.sourceBlock.getField(fieldName).isEmpty(),
            "Block %s already has a field named '%s'",
            this.sourceBlock.id, fieldName
        );
        field.attach(this.sourceBlock, fieldName);
        this.fieldRow.add(field);
        return this;
    }

    public Input setCheck(String... check) {
        this.requireConnection().setCheck(List.of(check));
        return this;
    }

    public Input setTypeExpr(TypeExpr typeExpr) {
        this.requireConnection().setTypeExpr(typeExpr, false);
        return this;
    }

    void dispose() {
        for(Field field: this.fieldRow) {
            field.dispose();
        }
        if(this.connection != null) {
            this.connection.dispose();
        }
    }

}
