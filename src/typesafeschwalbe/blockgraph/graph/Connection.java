package typesafeschwalbe.blockgraph.graph;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import typesafeschwalbe.blockgraph.Error;
import typesafeschwalbe.blockgraph.types.InferencePass;
import typesafeschwalbe.blockgraph.types.TypeExpr;

/**
 * One socket of a block. Two complementary connections that target each
 * other form an edge of the block graph.
 */
public class Connection implements InferencePass.Site {

    private static final Logger LOG = LogManager.getLogger(Connection.class);

    private final Block sourceBlock;
    private final ConnectionKind kind;
    private String inputName;
    private Set<String> check;
    private TypeExpr typeExpr;
    private Connection target;
    private Error typeError;
    private boolean disposed;

    Connection(Block sourceBlock, ConnectionKind kind) {
        this.sourceBlock = sourceBlock;
        this.kind = kind;
        this.inputName = null;
        this.check = null;
        this.typeExpr = null;
        this.target = null;
        this.typeError = null;
        this.disposed = false;
        sourceBlock.getWorkspace().getConnectionRegistry().register(this);
    }

    public Block getSourceBlock() {
        return this.sourceBlock;
    }

    public ConnectionKind getKind() {
        return this.kind;
    }

    public boolean isSuperior() {
        return this.kind.isSuperior();
    }

    /**
     * Name of the input this connection belongs to, if any.
     */
    public Optional<String> getInputName() {
        return Optional.ofNullable(this.inputName);
    }

    void setInputName(String inputName) {
        this.inputName = inputName;
    }

    public Optional<Input> getParentInput() {
        return this.getInputName().flatMap(this.sourceBlock::getInput);
    }

    /**
     * Empty if the connection accepts any nominal type.
     */
    public Optional<Set<String>> getCheck() {
        return Optional.ofNullable(this.check);
    }

    public Connection setCheck(Collection<String> check) {
        this.checkAlive();
        if(check == null || check.isEmpty()) {
            this.check = null;
        } else {
            this.check = ImmutableSet.copyOf(check);
        }
        return this;
    }

    public Optional<TypeExpr> getTypeExpr() {
        return Optional.ofNullable(this.typeExpr);
    }

    /**
     * Attaches a type expression to this socket. Untyped workspaces ignore
     * type expressions altogether.
     */
    public Connection setTypeExpr(TypeExpr typeExpr, boolean overwrite) {
        this.checkAlive();
        if(!this.sourceBlock.getWorkspace().isTyped()) {
            return this;
        }
        Preconditions.checkState(
            overwrite || this.typeExpr == null,
            "%s already has a type expression", this
        );
        this.typeExpr = typeExpr;
        return this;
    }

    public Optional<Connection> getTargetConnection() {
        return Optional.ofNullable(this.target);
    }

    public Optional<Block> targetBlock() {
        return this.getTargetConnection().map(Connection::getSourceBlock);
    }

    public boolean isConnected() {
        return this.target != null;
    }

    public boolean isDisposed() {
        return this.disposed;
    }

    public Optional<Error> getTypeError() {
        return Optional.ofNullable(this.typeError);
    }

    void clearTypeError() {
        this.typeError = null;
    }

    @Override
    public String blockId() {
        return this.sourceBlock.id;
    }

    @Override
    public String siteName() {
        if(this.inputName != null) {
            return this.inputName;
        }
        return this.kind.name().toLowerCase();
    }

    @Override
    public void reportTypeError(Error error) {
        if(this.typeError == null) {
            this.typeError = error;
        }
    }

    /**
     * Whether the nominal checks of both connections share a type, treating
     * an unconstrained connection as compatible with anything.
     */
    public boolean checkType(Connection other) {
        if(this.check == null || other.check == null) {
            return true;
        }
        for(String type: this.check) {
            if(other.check.contains(type)) {
                return true;
            }
        }
        return false;
    }

    public boolean canConnect(Connection other) {
        if(other == null || other == this) {
            return false;
        }
        if(other.kind != this.kind.opposite()) {
            return false;
        }
        if(this.disposed || other.disposed
            || this.sourceBlock.isDisposed()
            || other.sourceBlock.isDisposed()) {
            return false;
        }
        if(this.sourceBlock == other.sourceBlock) {
            return false;
        }
        if(this.target != null && this.target != other) {
            return false;
        }
        if(other.target != null && other.target != this) {
            return false;
        }
        Connection parentConn = this.isSuperior()? other : this;
        Connection childConn = this.isSuperior()? this : other;
        Block child = childConn.sourceBlock;
        if(this.target != other && child.isAncestorOf(parentConn.sourceBlock)) {
            return false;
        }
        if(!this.checkType(other)) {
            return false;
        }
        if(!this.sourceBlock.getWorkspace().isTyped()) {
            return true;
        }
        if(this.typeExpr != null && other.typeExpr != null) {
            boolean unifiable = this.sourceBlock.getWorkspace()
                .getTypeContext().canUnify(this.typeExpr, other.typeExpr);
            if(!unifiable) {
                return false;
            }
        }
        return child.resolveReference(parentConn, false);
    }

    public void connect(Connection other) {
        Preconditions.checkState(
            this.canConnect(other), "Cannot connect %s to %s", this, other
        );
        if(this.target == other) {
            return;
        }
        Connection parentConn = this.isSuperior()? other : this;
        Connection childConn = this.isSuperior()? this : other;
        Block parent = parentConn.sourceBlock;
        Block child = childConn.sourceBlock;
        Workspace workspace = parent.getWorkspace();
        Block.Move move = child.beginMove();
        parentConn.target = childConn;
        childConn.target = parentConn;
        workspace.getConnectionRegistry().unregister(parentConn);
        workspace.getConnectionRegistry().unregister(childConn);
        child.setParent(parent);
        LOG.debug("Connected {} to {}", childConn, parentConn);
        if(workspace.isTyped()) {
            child.getRootBlock().updateTypeInference(true);
            child.resolveReference(parentConn, true);
        }
        workspace.getEventBus().fire(move.finish());
    }

    public void disconnect() {
        this.disconnect(true);
    }

    void disconnect(boolean reinfer) {
        this.checkAlive();
        Preconditions.checkState(
            this.target != null, "%s is not connected", this
        );
        Connection parentConn = this.isSuperior()? this.target : this;
        Connection childConn = this.isSuperior()? this : this.target;
        Block parent = parentConn.sourceBlock;
        Block child = childConn.sourceBlock;
        Workspace workspace = parent.getWorkspace();
        Block.Move move = child.beginMove();
        parentConn.target = null;
        childConn.target = null;
        child.setParent(null);
        workspace.getConnectionRegistry().register(parentConn);
        workspace.getConnectionRegistry().register(childConn);
        LOG.debug("Disconnected {} from {}", childConn, parentConn);
        if(reinfer && workspace.isTyped()) {
            parent.getRootBlock().updateTypeInference(true);
            child.updateTypeInference(true);
            child.resolveReference(null, true);
        }
        workspace.getEventBus().fire(move.finish());
    }

    /**
     * Swaps the type expressions of two sockets.
     */
    public void replaceTypeExprWith(Connection other) {
        TypeExpr own = this.typeExpr;
        this.typeExpr = other.typeExpr;
        other.typeExpr = own;
    }

    public void dispose() {
        if(this.disposed) {
            return;
        }
        Preconditions.checkState(
            this.target == null, "Cannot dispose connected %s", this
        );
        this.sourceBlock.getWorkspace().getConnectionRegistry()
            .unregister(this);
        this.disposed = true;
    }

    private void checkAlive() {
        Preconditions.checkState(!this.disposed, "%s is disposed", this);
    }

    @Override
    public String toString() {
        return "<" + this.sourceBlock.type + " " + this.sourceBlock.id
            + " " + this.siteName() + ">";
    }

}
