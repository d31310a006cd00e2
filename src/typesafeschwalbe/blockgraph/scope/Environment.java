package typesafeschwalbe.blockgraph.scope;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

/**
 * Immutable chain of name bindings. Extending an environment never changes
 * it, so sibling branches of a traversal can share their parent's frame.
 */
public final class Environment<T> {

    private static final Environment<?> EMPTY = new Environment<>(
        null, null, null
    );

    private final Environment<T> parent;
    private final String name;
    private final T value;

    private Environment(Environment<T> parent, String name, T value) {
        this.parent = parent;
        this.name = name;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> Environment<T> empty() {
        return (Environment<T>) EMPTY;
    }

    public boolean isEmpty() {
        return this.parent == null;
    }

    public Environment<T> extend(String name, T value) {
        return new Environment<>(this, name, value);
    }

    public Environment<T> extendAll(Map<String, T> bindings) {
        Environment<T> result = this;
        for(Map.Entry<String, T> binding: bindings.entrySet()) {
            result = result.extend(binding.getKey(), binding.getValue());
        }
        return result;
    }

    public Optional<T> lookup(String name) {
        Environment<T> frame = this;
        while(frame.parent != null) {
            if(frame.name.equals(name)) {
                return Optional.of(frame.value);
            }
            frame = frame.parent;
        }
        return Optional.empty();
    }

    public Set<String> names() {
        return this.toMap().keySet();
    }

    /**
     * Visible bindings, innermost binding winning for shadowed names.
     */
    public ImmutableMap<String, T> toMap() {
        Map<String, T> visible = new LinkedHashMap<>();
        Environment<T> frame = this;
        while(frame.parent != null) {
            visible.putIfAbsent(frame.name, frame.value);
            frame = frame.parent;
        }
        return ImmutableMap.copyOf(visible);
    }

    @Override
    public String toString() {
        return this.toMap().toString();
    }

}
