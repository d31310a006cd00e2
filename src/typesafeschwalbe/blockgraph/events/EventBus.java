package typesafeschwalbe.blockgraph.events;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Synchronous, ordered delivery of {@link BlockEvent}s to the observers of a
 * workspace. An event fired outside of a batch has been delivered to every
 * listener when {@link #fire} returns.
 */
public class EventBus {

    private static final Logger LOG = LogManager.getLogger(EventBus.class);

    /**
     * Token returned by {@link #batch()} and {@link #mute()}. Closing it ends
     * the scope it opened.
     */
    public static class Scope implements AutoCloseable {

        private final Runnable onClose;
        private boolean closed;

        private Scope(Runnable onClose) {
            this.onClose = onClose;
            this.closed = false;
        }

        @Override
        public void close() {
            if(this.closed) {
                return;
            }
            this.closed = true;
            this.onClose.run();
        }

    }

    private final List<Consumer<BlockEvent>> listeners;
    private final List<BlockEvent> deferred;
    private boolean enabled;
    private int batchDepth;
    private int muteDepth;

    public EventBus(boolean enabled) {
        this.listeners = new ArrayList<>();
        this.deferred = new ArrayList<>();
        this.enabled = enabled;
        this.batchDepth = 0;
        this.muteDepth = 0;
    }

    public void addListener(Consumer<BlockEvent> listener) {
        this.listeners.add(listener);
    }

    public void removeListener(Consumer<BlockEvent> listener) {
        this.listeners.remove(listener);
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isFiring() {
        return this.enabled && this.muteDepth == 0;
    }

    public void fire(BlockEvent event) {
        if(!this.isFiring()) {
            return;
        }
        if(this.batchDepth > 0) {
            this.deferred.add(event);
            return;
        }
        this.deliver(event);
    }

    /**
     * Defers delivery until the returned scope is closed. Consecutive changes
     * to the same element of the same block are coalesced into one.
     */
    public Scope batch() {
        this.batchDepth += 1;
        return new Scope(() -> {
            this.batchDepth -= 1;
            if(this.batchDepth == 0) {
                this.flush();
            }
        });
    }

    /**
     * Drops every event fired while the returned scope is open.
     */
    public Scope mute() {
        this.muteDepth += 1;
        return new Scope(() -> this.muteDepth -= 1);
    }

    private void flush() {
        List<BlockEvent> pending = EventBus.coalesce(this.deferred);
        this.deferred.clear();
        LOG.trace("Flushing {} batched events", pending.size());
        for(BlockEvent event: pending) {
            this.deliver(event);
        }
    }

    private static List<BlockEvent> coalesce(List<BlockEvent> events) {
        List<BlockEvent> result = new ArrayList<>();
        for(BlockEvent event: events) {
            BlockEvent last = result.isEmpty()
                ? null : result.get(result.size() - 1);
            boolean merge = last != null
                && last.type == BlockEvent.Type.CHANGE
                && event.type == BlockEvent.Type.CHANGE
                && last.blockId.equals(event.blockId)
                && last.<BlockEvent.Change>getValue().element()
                    .equals(event.<BlockEvent.Change>getValue().element())
                && last.<BlockEvent.Change>getValue().name()
                    .equals(event.<BlockEvent.Change>getValue().name());
            if(!merge) {
                result.add(event);
                continue;
            }
            BlockEvent.Change first = last.getValue();
            BlockEvent.Change latest = event.getValue();
            result.set(result.size() - 1, BlockEvent.change(
                event.blockId, latest.element(), latest.name(),
                first.oldValue(), latest.newValue()
            ));
        }
        result.removeIf(e -> e.type == BlockEvent.Type.CHANGE
            && e.<BlockEvent.Change>getValue().isNoOp());
        return result;
    }

    private void deliver(BlockEvent event) {
        for(Consumer<BlockEvent> listener: List.copyOf(this.listeners)) {
            listener.accept(event);
        }
    }

}
