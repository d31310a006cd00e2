package typesafeschwalbe.blockgraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import typesafeschwalbe.blockgraph.Error;
import typesafeschwalbe.blockgraph.blocks.BlockBehavior;
import typesafeschwalbe.blockgraph.events.BlockEvent;
import typesafeschwalbe.blockgraph.events.EventBus;
import typesafeschwalbe.blockgraph.scope.Environment;
import typesafeschwalbe.blockgraph.scope.ScopeResolver;
import typesafeschwalbe.blockgraph.types.InferencePass;
import typesafeschwalbe.blockgraph.types.TypeContext;
import typesafeschwalbe.blockgraph.types.TypeExpr;
import typesafeschwalbe.blockgraph.variables.BoundVariable;

/**
 * A node of the block graph. Parent and child links are stored as block ids
 * and resolved through the owning {@link Workspace}.
 */
public class Block {

    private static final Logger LOG = LogManager.getLogger(Block.class);

    /**
     * Position of a block in the graph before an edit, turned into a move
     * event once the edit is done.
     */
    static class Move {

        private final Block block;
        private final Optional<String> oldParentId;
        private final Optional<String> oldInputName;
        private final Coordinate oldCoordinate;

        private Move(Block block) {
            this.block = block;
            this.oldParentId = Optional.ofNullable(block.parentId);
            this.oldInputName = block.superiorInputName();
            this.oldCoordinate = block.xy;
        }

        BlockEvent finish() {
            return new BlockEvent(
                BlockEvent.Type.MOVE, this.block.id,
                new BlockEvent.Move(
                    this.oldParentId, this.oldInputName, this.oldCoordinate,
                    Optional.ofNullable(this.block.parentId),
                    this.block.superiorInputName(), this.block.xy
                )
            );
        }

    }

    public final String id;
    public final String type;
    private final Workspace workspace;
    private final BlockBehavior behavior;
    private Connection outputConnection;
    private Connection previousConnection;
    private Connection nextConnection;
    private final List<Input> inputList;
    private String parentId;
    private final List<String> childIds;
    private boolean disabled;
    private boolean collapsed;
    private Boolean inputsInline;
    private String commentText;
    private String warningText;
    private Coordinate xy;
    private boolean disposed;

    Block(
        Workspace workspace, String id, String type, BlockBehavior behavior
    ) {
        this.id = id;
        this.type = type;
        this.workspace = workspace;
        this.behavior = behavior;
        this.outputConnection = null;
        this.previousConnection = null;
        this.nextConnection = null;
        this.inputList = new ArrayList<>();
        this.parentId = null;
        this.childIds = new ArrayList<>();
        this.disabled = false;
        this.collapsed = false;
        this.inputsInline = null;
        this.commentText = null;
        this.warningText = null;
        this.xy = Coordinate.ORIGIN;
        this.disposed = false;
    }

    public Workspace getWorkspace() {
        return this.workspace;
    }

    public BlockBehavior getBehavior() {
        return this.behavior;
    }

    public TypeContext types() {
        return this.workspace.getTypeContext();
    }

    public boolean isDisposed() {
        return this.disposed;
    }

    private void checkAlive() {
        Preconditions.checkState(
            !this.disposed, "Block %s (%s) is disposed", this.id, this.type
        );
    }

    /* connections */

    public Block setOutput(boolean hasOutput, String... check) {
        this.checkAlive();
        if(hasOutput) {
            Preconditions.checkState(
                this.previousConnection == null,
                "Block %s cannot have both an output and a previous statement",
                this.id
            );
            if(this.outputConnection == null) {
                this.outputConnection = new Connection(
                    this, ConnectionKind.OUTPUT
                );
            }
            this.outputConnection.setCheck(List.of(check));
        } else if(this.outputConnection != null) {
            this.outputConnection.dispose();
            this.outputConnection = null;
        }
        return this;
    }

    public Block setPreviousStatement(boolean hasPrevious, String... check) {
        this.checkAlive();
        if(hasPrevious) {
            Preconditions.checkState(
                this.outputConnection == null,
                "Block %s cannot have both an output and a previous statement",
                this.id
            );
            if(this.previousConnection == null) {
                this.previousConnection = new Connection(
                    this, ConnectionKind.PREVIOUS_STATEMENT
                );
            }
            this.previousConnection.setCheck(List.of(check));
        } else if(this.previousConnection != null) {
            this.previousConnection.dispose();
            this.previousConnection = null;
        }
        return this;
    }

    public Block setNextStatement(boolean hasNext, String... check) {
        this.checkAlive();
        if(hasNext) {
            if(this.nextConnection == null) {
                this.nextConnection = new Connection(
                    this, ConnectionKind.NEXT_STATEMENT
                );
            }
            this.nextConnection.setCheck(List.of(check));
        } else if(this.nextConnection != null) {
            this.nextConnection.dispose();
            this.nextConnection = null;
        }
        return this;
    }

    public Block setOutputTypeExpr(TypeExpr typeExpr) {
        Preconditions.checkState(
            this.outputConnection != null, "Block %s has no output", this.id
        );
        this.outputConnection.setTypeExpr(typeExpr, false);
        return this;
    }

    public Optional<Connection> getOutputConnection() {
        return Optional.ofNullable(this.outputConnection);
    }

    public Optional<Connection> getPreviousConnection() {
        return Optional.ofNullable(this.previousConnection);
    }

    public Optional<Connection> getNextConnection() {
        return Optional.ofNullable(this.nextConnection);
    }

    public TypeExpr outputTypeExpr() {
        return this.getOutputConnection()
            .flatMap(Connection::getTypeExpr)
            .orElseThrow(() -> new IllegalStateException(
                "Block " + this.id + " has no typed output"
            ));
    }

    public Connection inputConnection(String name) {
        return this.requireInput(name).requireConnection();
    }

    public TypeExpr inputTypeExpr(String name) {
        return this.requireInput(name).requireConnection().getTypeExpr()
            .orElseThrow(() -> new IllegalStateException(
                "Input '" + name + "' of block " + this.id + " is not typed"
            ));
    }

    /**
     * Every connection owned by this block, superior ones first.
     */
    public ImmutableList<Connection> getConnections() {
        ImmutableList.Builder<Connection> connections = ImmutableList.builder();
        this.getOutputConnection().ifPresent(connections::add);
        this.getPreviousConnection().ifPresent(connections::add);
        this.getNextConnection().ifPresent(connections::add);
        for(Input input: this.inputList) {
            input.getConnection().ifPresent(connections::add);
        }
        return connections.build();
    }

    private Optional<Connection> superiorConnection() {
        if(this.outputConnection != null) {
            return Optional.of(this.outputConnection);
        }
        return this.getPreviousConnection();
    }

    private Optional<String> superiorInputName() {
        return this.superiorConnection()
            .flatMap(Connection::getTargetConnection)
            .flatMap(Connection::getInputName);
    }

    /* inputs and fields */

    public Input appendValueInput(String name) {
        return this.appendInput(Input.Kind.VALUE, name);
    }

    public Input appendStatementInput(String name) {
        return this.appendInput(Input.Kind.STATEMENT, name);
    }

    public Input appendDummyInput() {
        return this.appendInput(Input.Kind.DUMMY, null);
    }

    public Input appendDummyInput(String name) {
        return this.appendInput(Input.Kind.DUMMY, name);
    }

    private Input appendInput(Input.Kind kind, String name) {
        this.checkAlive();
        Preconditions.checkArgument(
            kind == Input.Kind.DUMMY || name != null,
            "Only dummy inputs can be unnamed"
        );
        Preconditions.checkArgument(
            name == null || this.getInput(name).isEmpty(),
            "Block %s already has an input named '%s'", this.id, name
        );
        Connection connection = null;
        switch(kind) {
            case VALUE: {
                connection = new Connection(this, ConnectionKind.VALUE_INPUT);
                break;
            }
            case STATEMENT: {
                connection = new Connection(
                    this, ConnectionKind.NEXT_STATEMENT
                );
                break;
            }
            case DUMMY: {
                break;
            }
            default: {
                throw new RuntimeException("unhandled input kind!");
            }
        }
        Input input = new Input(kind, name, this, connection);
        this.inputList.add(input);
        return input;
    }

    /**
     * Removes an input. A block plugged into it becomes a top block.
     */
    public void removeInput(String name) {
        this.checkAlive();
        Input input = this.requireInput(name);
        Optional<Connection> connection = input.getConnection();
        if(connection.isPresent() && connection.get().isConnected()) {
            connection.get().disconnect();
        }
        input.dispose();
        this.inputList.remove(input);
    }

    public Optional<Input> getInput(String name) {
        for(Input input: this.inputList) {
            if(name.equals(input.getName())) {
                return Optional.of(input);
            }
        }
        return Optional.empty();
    }

    Input requireInput(String name) {
        return this.getInput(name).orElseThrow(
            () -> new IllegalArgumentException(
                "Block " + this.id + " (" + this.type
                    + ") has no input named '" + name + "'"
            )
        );
    }

    public ImmutableList<Input> getInputList() {
        return ImmutableList.copyOf(this.inputList);
    }

    public Optional<Block> getInputTargetBlock(String name) {
        return this.getInput(name).flatMap(Input::targetBlock);
    }

    public Optional<Input> getInputWithBlock(Block block) {
        for(Input input: this.inputList) {
            Optional<Block> target = input.targetBlock();
            if(target.isPresent() && target.get() == block) {
                return Optional.of(input);
            }
        }
        return Optional.empty();
    }

    public Optional<Field> getField(String name) {
        for(Input input: this.inputList) {
            for(Field field: input.getFieldRow()) {
                if(name.equals(field.getName().orElse(null))) {
                    return Optional.of(field);
                }
            }
        }
        return Optional.empty();
    }

    public ImmutableList<Field> getFields() {
        ImmutableList.Builder<Field> fields = ImmutableList.builder();
        for(Input input: this.inputList) {
            fields.addAll(input.getFieldRow());
        }
        return fields.build();
    }

    public String getFieldValue(String name) {
        return this.requireField(name).getValue();
    }

    public void setFieldValue(String name, String value) {
        this.checkAlive();
        String old = this.requireField(name).setValue(value);
        this.workspace.getEventBus().fire(BlockEvent.change(
            this.id, "field", Optional.of(name), old, value
        ));
    }

    private Field requireField(String name) {
        return this.getField(name).orElseThrow(
            () -> new IllegalArgumentException(
                "Block " + this.id + " (" + this.type
                    + ") has no field named '" + name + "'"
            )
        );
    }

    public ImmutableList<BoundVariable> getBoundVariables() {
        ImmutableList.Builder<BoundVariable> variables
            = ImmutableList.builder();
        for(Field field: this.getFields()) {
            if(field instanceof BoundVariableField) {
                variables.add(((BoundVariableField) field).getVariable());
            }
        }
        return variables.build();
    }

    public ImmutableList<BoundVariable.Value> getBoundValues() {
        ImmutableList.Builder<BoundVariable.Value> values
            = ImmutableList.builder();
        for(BoundVariable variable: this.getBoundVariables()) {
            if(variable.isValue()) {
                values.add((BoundVariable.Value) variable);
            }
        }
        return values.build();
    }

    public ImmutableList<BoundVariable.Reference> getBoundReferences() {
        ImmutableList.Builder<BoundVariable.Reference> references
            = ImmutableList.builder();
        for(BoundVariable variable: this.getBoundVariables()) {
            if(variable.isReference()) {
                references.add((BoundVariable.Reference) variable);
            }
        }
        return references.build();
    }

    /**
     * Moves the input {@code name} in front of the input {@code refName},
     * or to the end if {@code refName} is null.
     */
    public void moveInputBefore(String name, String refName) {
        int inputIndex = this.inputList.indexOf(this.requireInput(name));
        int refIndex = refName == null
            ? this.inputList.size()
            : this.inputList.indexOf(this.requireInput(refName));
        if(inputIndex == refIndex) {
            return;
        }
        this.moveNumberedInputBefore(inputIndex, refIndex);
    }

    public void moveNumberedInputBefore(int inputIndex, int refIndex) {
        this.checkAlive();
        int size = this.inputList.size();
        Preconditions.checkElementIndex(inputIndex, size, "input index");
        Preconditions.checkPositionIndex(refIndex, size, "reference index");
        Preconditions.checkArgument(
            inputIndex != refIndex, "Cannot move input %s before itself",
            inputIndex
        );
        Input input = this.inputList.remove(inputIndex);
        if(inputIndex < refIndex) {
            refIndex -= 1;
        }
        this.inputList.add(refIndex, input);
    }

    /* tree structure */

    public Optional<Block> getParent() {
        if(this.parentId == null) {
            return Optional.empty();
        }
        return this.workspace.getBlockById(this.parentId);
    }

    public Block getRootBlock() {
        Block root = this;
        Optional<Block> parent = root.getParent();
        while(parent.isPresent()) {
            root = parent.get();
            parent = root.getParent();
        }
        return root;
    }

    /**
     * The nearest ancestor this block is nested in, skipping the blocks it
     * merely follows in a statement stack.
     */
    public Optional<Block> getSurroundParent() {
        Block current = this;
        Optional<Block> parent = this.getParent();
        while(parent.isPresent()) {
            Optional<Block> next = parent.get().getNextBlock();
            if(next.isEmpty() || next.get() != current) {
                return parent;
            }
            current = parent.get();
            parent = current.getParent();
        }
        return Optional.empty();
    }

    public Optional<Block> getNextBlock() {
        return this.getNextConnection().flatMap(Connection::targetBlock);
    }

    /**
     * The free next connection at the bottom of the stack starting at this
     * block, if the last block of the stack has one.
     */
    public Optional<Connection> lastConnectionInStack() {
        Block current = this;
        while(true) {
            if(current.nextConnection == null) {
                return Optional.empty();
            }
            Optional<Block> next = current.getNextBlock();
            if(next.isEmpty()) {
                return Optional.of(current.nextConnection);
            }
            current = next.get();
        }
    }

    public boolean isAncestorOf(Block block) {
        Optional<Block> current = Optional.of(block);
        while(current.isPresent()) {
            if(current.get() == this) {
                return true;
            }
            current = current.get().getParent();
        }
        return false;
    }

    /**
     * @param ordered whether to list the children in input order followed by
     *     the next block, instead of in the order they were attached
     */
    public ImmutableList<Block> getChildren(boolean ordered) {
        if(!ordered) {
            ImmutableList.Builder<Block> children = ImmutableList.builder();
            for(String childId: this.childIds) {
                this.workspace.getBlockById(childId).ifPresent(children::add);
            }
            return children.build();
        }
        ImmutableList.Builder<Block> children = ImmutableList.builder();
        for(Input input: this.inputList) {
            input.targetBlock().ifPresent(children::add);
        }
        this.getNextBlock().ifPresent(children::add);
        return children.build();
    }

    /**
     * This block followed by every block below it, in pre-order.
     */
    public ImmutableList<Block> getDescendants(boolean ordered) {
        ImmutableList.Builder<Block> descendants = ImmutableList.builder();
        Deque<Block> pending = new ArrayDeque<>();
        pending.push(this);
        while(!pending.isEmpty()) {
            Block current = pending.pop();
            descendants.add(current);
            for(Block child: current.getChildren(ordered).reverse()) {
                pending.push(child);
            }
        }
        return descendants.build();
    }

    public boolean allInputsFilled() {
        for(Block block: this.getDescendants(false)) {
            for(Input input: block.inputList) {
                if(input.getKind() == Input.Kind.VALUE
                    && input.targetBlock().isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    public void setParent(Block newParent) {
        this.checkAlive();
        Optional<Block> oldParent = this.getParent();
        if(oldParent.isPresent() && oldParent.get() == newParent) {
            return;
        }
        if(oldParent.isPresent()) {
            Preconditions.checkState(
                this.superiorConnection().map(c -> !c.isConnected())
                    .orElse(true),
                "Block %s is still connected to its parent %s",
                this.id, this.parentId
            );
            oldParent.get().childIds.remove(this.id);
            this.parentId = null;
        } else {
            this.workspace.removeTopBlock(this);
        }
        if(newParent == null) {
            this.workspace.addTopBlock(this);
            return;
        }
        Optional<Block> attachedTo = this.superiorConnection()
            .flatMap(Connection::targetBlock);
        Preconditions.checkState(
            attachedTo.isPresent() && attachedTo.get() == newParent,
            "Block %s must be connected to %s before becoming its child",
            this.id, newParent.id
        );
        this.parentId = newParent.id;
        newParent.childIds.add(this.id);
    }

    /**
     * Rebinds and re-infers the tree of this block after one of its
     * variables was renamed.
     */
    void variableRenamed(BoundVariable variable) {
        if(!this.workspace.isTyped()) {
            return;
        }
        if(variable.isReference()) {
            ((BoundVariable.Reference) variable).removeBoundValue();
        }
        Block root = this.getRootBlock();
        root.resolveReference(null, true);
        root.updateTypeInference(true);
    }

    Move beginMove() {
        return new Move(this);
    }

    /**
     * Detaches this block from the block it is plugged into. A block
     * following this one in a statement stack is reattached to the block
     * above this one if {@code healStack} is set and the connections still
     * fit, and becomes a stack of its own otherwise.
     */
    public void unplug(boolean healStack) {
        this.checkAlive();
        if(this.outputConnection != null
            && this.outputConnection.isConnected()) {
            this.outputConnection.disconnect();
            return;
        }
        Connection previousTarget = null;
        if(this.previousConnection != null
            && this.previousConnection.isConnected()) {
            previousTarget = this.previousConnection.getTargetConnection()
                .get();
            this.previousConnection.disconnect();
        }
        Optional<Block> next = this.getNextBlock();
        if(next.isEmpty()) {
            return;
        }
        Connection nextTarget = this.nextConnection.getTargetConnection()
            .get();
        this.nextConnection.disconnect();
        // canConnect also requires the types and the scope to fit on typed
        // workspaces, not only the nominal checks
        if(healStack && previousTarget != null
            && previousTarget.canConnect(nextTarget)) {
            previousTarget.connect(nextTarget);
            LOG.debug("Healed stack around block {}", this.id);
        }
    }

    public void dispose(boolean healStack) {
        if(this.disposed) {
            return;
        }
        this.unplug(healStack);
        List<Block> tree = this.getDescendants(false);
        List<String> treeIds = Lists.transform(tree, block -> block.id);
        EventBus eventBus = this.workspace.getEventBus();
        eventBus.fire(BlockEvent.delete(this.id, List.copyOf(treeIds)));
        try(EventBus.Scope muted = eventBus.mute()) {
            for(Block block: Lists.reverse(tree)) {
                block.disposeOwn();
            }
        }
        LOG.debug("Disposed {} block(s) below {}", tree.size(), this.id);
    }

    private void disposeOwn() {
        Optional<Connection> superior = this.superiorConnection();
        if(superior.isPresent() && superior.get().isConnected()) {
            superior.get().disconnect(false);
        }
        List<BoundVariable> variables = this.getBoundVariables();
        for(Input input: this.inputList) {
            input.dispose();
        }
        this.inputList.clear();
        for(Connection connection: this.getConnections()) {
            connection.dispose();
        }
        for(BoundVariable variable: variables) {
            variable.dispose();
        }
        this.workspace.removeTopBlock(this);
        this.workspace.unregisterBlock(this);
        this.disposed = true;
    }

    /* state */

    public boolean isDisabled() {
        return this.disabled;
    }

    public void setDisabled(boolean disabled) {
        boolean old = this.disabled;
        this.disabled = disabled;
        this.workspace.getEventBus().fire(BlockEvent.change(
            this.id, "disabled", Optional.empty(), old, disabled
        ));
    }

    /**
     * Whether this block or any block it is nested in is disabled.
     */
    public boolean getInheritedDisabled() {
        Optional<Block> current = Optional.of(this);
        while(current.isPresent()) {
            if(current.get().disabled) {
                return true;
            }
            current = current.get().getSurroundParent();
        }
        return false;
    }

    public boolean isCollapsed() {
        return this.collapsed;
    }

    public void setCollapsed(boolean collapsed) {
        boolean old = this.collapsed;
        this.collapsed = collapsed;
        this.workspace.getEventBus().fire(BlockEvent.change(
            this.id, "collapsed", Optional.empty(), old, collapsed
        ));
    }

    public boolean getInputsInline() {
        if(this.inputsInline != null) {
            return this.inputsInline;
        }
        for(int inputI = 1; inputI < this.inputList.size(); inputI += 1) {
            if(this.inputList.get(inputI - 1).getKind() == Input.Kind.DUMMY
                && this.inputList.get(inputI).getKind() == Input.Kind.DUMMY) {
                return false;
            }
        }
        for(int inputI = 1; inputI < this.inputList.size(); inputI += 1) {
            if(this.inputList.get(inputI - 1).getKind() == Input.Kind.VALUE
                && this.inputList.get(inputI).getKind() == Input.Kind.DUMMY) {
                return true;
            }
        }
        return false;
    }

    public void setInputsInline(boolean inputsInline) {
        Boolean old = this.inputsInline;
        this.inputsInline = inputsInline;
        this.workspace.getEventBus().fire(BlockEvent.change(
            this.id, "inline", Optional.empty(), old, inputsInline
        ));
    }

    public Optional<String> getCommentText() {
        return Optional.ofNullable(this.commentText);
    }

    public void setCommentText(String text) {
        String old = this.commentText;
        this.commentText = text;
        this.workspace.getEventBus().fire(BlockEvent.change(
            this.id, "comment", Optional.empty(), old, text
        ));
    }

    public Optional<String> getWarningText() {
        return Optional.ofNullable(this.warningText);
    }

    public void setWarningText(String text) {
        this.warningText = text;
    }

    public Coordinate getRelativeToSurfaceXY() {
        return this.xy;
    }

    public void moveBy(double dx, double dy) {
        this.checkAlive();
        Preconditions.checkState(
            this.parentId == null, "Block %s has a parent", this.id
        );
        Move move = this.beginMove();
        this.xy = this.xy.translate(dx, dy);
        this.workspace.getEventBus().fire(move.finish());
    }

    /* types and scope */

    /**
     * Transplants the type expressions of a structurally identical tree onto
     * this tree, so that equivalences established on {@code other} survive.
     */
    public void replaceTypeExprWith(Block other) {
        Preconditions.checkState(
            this.workspace.isTyped(),
            "Type expressions only exist on typed workspaces"
        );
        List<Block[]> visited = new ArrayList<>();
        Deque<Block[]> pending = new ArrayDeque<>();
        pending.push(new Block[] { this, other });
        while(!pending.isEmpty()) {
            Block[] pair = pending.pop();
            Block own = pair[0];
            Block theirs = pair[1];
            if(!own.type.equals(theirs.type)) {
                continue;
            }
            visited.add(pair);
            if(own.outputConnection != null
                && theirs.outputConnection != null) {
                own.outputConnection.replaceTypeExprWith(
                    theirs.outputConnection
                );
            }
            int inputCount = Math.min(
                own.inputList.size(), theirs.inputList.size()
            );
            for(int inputI = 0; inputI < inputCount; inputI += 1) {
                Input ownInput = own.inputList.get(inputI);
                Input theirInput = theirs.inputList.get(inputI);
                Preconditions.checkState(
                    Objects.equals(
                        ownInput.getName(), theirInput.getName()
                    ),
                    "Input %s of block %s does not match input %s of %s",
                    ownInput.getName(), own.id, theirInput.getName(), theirs.id
                );
                if(ownInput.getConnection().isEmpty()
                    || theirInput.getConnection().isEmpty()) {
                    continue;
                }
                ownInput.requireConnection().replaceTypeExprWith(
                    theirInput.requireConnection()
                );
                Optional<Block> ownChild = ownInput.targetBlock();
                Optional<Block> theirChild = theirInput.targetBlock();
                if(ownChild.isPresent() && theirChild.isPresent()) {
                    pending.push(new Block[] {
                        ownChild.get(), theirChild.get()
                    });
                }
            }
            Optional<Block> ownNext = own.getNextBlock();
            Optional<Block> theirNext = theirs.getNextBlock();
            if(ownNext.isPresent() && theirNext.isPresent()) {
                pending.push(new Block[] { ownNext.get(), theirNext.get() });
            }
        }
        for(Block[] pair: visited) {
            pair[0].behavior.typeExprReplaced(pair[0]);
            pair[1].behavior.typeExprReplaced(pair[1]);
        }
        other.getRootBlock().updateTypeInference(true);
        if(this.getRootBlock() != other.getRootBlock()) {
            this.getRootBlock().updateTypeInference(true);
        }
    }

    /**
     * Infers the types of the stack starting at this block.
     *
     * @param reset whether to forget the previously inferred types first
     * @return every type mismatch found, empty on untyped workspaces
     */
    public List<Error> updateTypeInference(boolean reset) {
        this.checkAlive();
        if(!this.workspace.isTyped()) {
            return List.of();
        }
        if(reset) {
            for(Block block: this.getDescendants(false)) {
                for(Connection connection: block.getConnections()) {
                    connection.clearTypeError();
                }
            }
            Block.clearTypesStack(this);
        }
        InferencePass pass = new InferencePass(this.types());
        Block.inferStack(this, Environment.empty(), pass);
        List<Error> errors = pass.errors();
        LOG.debug(
            "Inferred types below block {} with {} mismatch(es)",
            this.id, errors.size()
        );
        return errors;
    }

    public Optional<TypeExpr> infer(
        Environment<TypeExpr> env, InferencePass pass
    ) {
        return this.behavior.infer(this, env, pass);
    }

    public void clearTypes() {
        this.behavior.clearTypes(this);
    }

    /**
     * Clears every type expression attached to the connections of this
     * block.
     */
    public void clearOwnTypeExprs() {
        for(Connection connection: this.getConnections()) {
            connection.getTypeExpr().ifPresent(this.types()::clear);
        }
    }

    /**
     * Infers the block plugged into the input {@code name}, or the whole
     * stack for statement inputs.
     *
     * @return the type of the plugged in value, empty if there is none
     */
    public Optional<TypeExpr> callInfer(
        String name, Environment<TypeExpr> env, InferencePass pass
    ) {
        Input input = this.requireInput(name);
        Optional<Block> target = input.targetBlock();
        if(target.isEmpty()) {
            return Optional.empty();
        }
        if(input.getKind() == Input.Kind.STATEMENT) {
            Block.inferStack(target.get(), env, pass);
            return Optional.empty();
        }
        return target.get().infer(env, pass);
    }

    public void callClearTypes(String name) {
        Input input = this.requireInput(name);
        Optional<Block> target = input.targetBlock();
        if(target.isEmpty()) {
            return;
        }
        if(input.getKind() == Input.Kind.STATEMENT) {
            Block.clearTypesStack(target.get());
            return;
        }
        target.get().clearTypes();
    }

    private static void inferStack(
        Block first, Environment<TypeExpr> env, InferencePass pass
    ) {
        Optional<Block> current = Optional.of(first);
        while(current.isPresent()) {
            current.get().infer(env, pass);
            current = current.get().getNextBlock();
        }
    }

    private static void clearTypesStack(Block first) {
        Optional<Block> current = Optional.of(first);
        while(current.isPresent()) {
            current.get().clearTypes();
            current = current.get().getNextBlock();
        }
    }

    /**
     * Checks or binds the references of the tree below this block against
     * the variables visible at {@code parentConnection}.
     *
     * @param parentConnection the connection this block is or would be
     *     plugged into, null for a top block
     * @param bind whether to bind references, or only to check them
     * @return whether every reference resolved
     */
    public boolean resolveReference(Connection parentConnection, boolean bind) {
        return ScopeResolver.resolveReference(this, parentConnection, bind);
    }

    public Environment<BoundVariable.Value> allVisibleVariables(
        Connection connection, boolean bubble
    ) {
        Preconditions.checkArgument(
            connection.getSourceBlock() == this,
            "%s does not belong to block %s", connection, this.id
        );
        return ScopeResolver.allVisibleVariables(connection, bubble);
    }

    /* text */

    @Override
    public String toString() {
        return this.toString(Integer.MAX_VALUE);
    }

    /**
     * Single line summary of the tree below this block.
     */
    public String toString(int maxLength) {
        List<String> text = new ArrayList<>();
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(this);
        while(!pending.isEmpty()) {
            Object item = pending.pop();
            if(item instanceof String) {
                text.add((String) item);
                continue;
            }
            Block block = (Block) item;
            List<Object> parts = new ArrayList<>();
            for(Input input: block.inputList) {
                for(Field field: input.getFieldRow()) {
                    parts.add(field.getText());
                }
                if(input.getConnection().isEmpty()) {
                    continue;
                }
                Optional<Block> child = input.targetBlock();
                if(child.isEmpty()) {
                    parts.add("?");
                } else if(input.getKind() == Input.Kind.STATEMENT) {
                    parts.add("{");
                    parts.add(child.get());
                    parts.add("}");
                } else {
                    parts.add("(");
                    parts.add(child.get());
                    parts.add(")");
                }
            }
            Optional<Block> next = block.getNextBlock();
            if(next.isPresent()) {
                parts.add(";");
                parts.add(next.get());
            }
            for(Object part: Lists.reverse(parts)) {
                pending.push(part);
            }
        }
        String summary = Joiner.on(' ').join(text)
            .replace("( ", "(").replace(" )", ")")
            .replace(" ;", ";");
        if(summary.length() > maxLength) {
            return summary.substring(0, Math.max(0, maxLength - 3)) + "...";
        }
        return summary;
    }

    /**
     * Multi line dump of the tree below this block, listing each block with
     * its sockets, their types and the variables it binds.
     */
    public String toDevString() {
        StringBuilder out = new StringBuilder();
        Map<String, Integer> depths = new HashMap<>();
        depths.put(this.id, 0);
        for(Block block: this.getDescendants(true)) {
            int depth = depths.get(block.id);
            for(Block child: block.getChildren(true)) {
                depths.put(child.id, depth + 1);
            }
            String indent = "  ".repeat(depth);
            out.append(indent).append(block.type).append(" #")
                .append(block.id).append("\n");
            for(Connection connection: block.getConnections()) {
                out.append(indent).append("  ").append(connection.siteName());
                connection.getTypeExpr().ifPresent(t -> out.append(": ")
                    .append(block.types().display(t)));
                connection.getTypeError().ifPresent(e -> out.append(" !! ")
                    .append(e.message()));
                out.append("\n");
            }
            for(BoundVariable variable: block.getBoundVariables()) {
                out.append(indent).append("  ").append(variable);
                if(variable.isReference()) {
                    out.append(
                        ((BoundVariable.Reference) variable).isResolved()
                            ? " (bound)" : " (unresolved)"
                    );
                }
                out.append("\n");
            }
        }
        return out.toString();
    }

}
