package typesafeschwalbe.blockgraph.graph;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Free connections of one workspace, grouped by kind. A connection is
 * registered while it has no target.
 */
public class ConnectionRegistry {

    private final Map<ConnectionKind, Set<Connection>> free;

    public ConnectionRegistry() {
        this.free = new EnumMap<>(ConnectionKind.class);
        for(ConnectionKind kind: ConnectionKind.values()) {
            this.free.put(kind, new LinkedHashSet<>());
        }
    }

    public void register(Connection connection) {
        Preconditions.checkState(
            !connection.isDisposed(),
            "Cannot register disposed %s", connection
        );
        this.free.get(connection.getKind()).add(connection);
    }

    public void unregister(Connection connection) {
        this.free.get(connection.getKind()).remove(connection);
    }

    public boolean isRegistered(Connection connection) {
        return this.free.get(connection.getKind()).contains(connection);
    }

    public ImmutableList<Connection> registered(ConnectionKind kind) {
        return ImmutableList.copyOf(this.free.get(kind));
    }

    public int size() {
        int size = 0;
        for(Set<Connection> connections: this.free.values()) {
            size += connections.size();
        }
        return size;
    }

    /**
     * Free connections the given connection could be connected to.
     */
    public ImmutableList<Connection> candidatesFor(Connection connection) {
        ImmutableList.Builder<Connection> candidates = ImmutableList.builder();
        for(Connection other: this.free.get(connection.getKind().opposite())) {
            if(connection.canConnect(other)) {
                candidates.add(other);
            }
        }
        return candidates.build();
    }

}
