package typesafeschwalbe.blockgraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Index based union-find with path compression. Unlike a textbook
 * disjoint set, the direction of every link is chosen by the caller and an
 * element can be detached again, becoming the root of its own class.
 * Elements that were linked below a detached element keep following it.
 */
public class UnionFind<T> {

    private static class Entry<T> {
        private T value;
        private int parent;

        private Entry(T value) {
            this.value = value;
            this.parent = -1;
        }
    }

    private final List<Entry<T>> values;

    public UnionFind() {
        this.values = new ArrayList<>();
    }

    private void compressPath(int start, int root) {
        int currentIdx = start;
        while(currentIdx != root) {
            Entry<T> current = this.values.get(currentIdx);
            if(current.parent == -1) {
                break;
            }
            currentIdx = current.parent;
            current.parent = root;
        }
    }

    public int find(int idx) {
        int currentIdx = idx;
        while(true) {
            Entry<T> current = this.values.get(currentIdx);
            if(current.parent == -1) {
                break;
            }
            currentIdx = current.parent;
        }
        this.compressPath(idx, currentIdx);
        return currentIdx;
    }

    public int add(T value) {
        int idx = this.values.size();
        this.values.add(new Entry<T>(value));
        return idx;
    }

    public int size() {
        return this.values.size();
    }

    public boolean isRoot(int idx) {
        return this.values.get(idx).parent == -1;
    }

    public T get(int idx) {
        Entry<T> entry = this.values.get(this.find(idx));
        return entry.value;
    }

    /**
     * The value stored on {@code idx} itself, ignoring its class.
     */
    public T peek(int idx) {
        return this.values.get(idx).value;
    }

    public void set(int idx, T value) {
        Entry<T> entry = this.values.get(this.find(idx));
        entry.value = value;
    }

    /**
     * Places the class of {@code child} below the root of {@code root}.
     */
    public void link(int root, int child) {
        int rootA = this.find(root);
        int rootB = this.find(child);
        if(rootA != rootB) {
            this.values.get(rootB).parent = rootA;
        }
    }

    public void detach(int idx, T value) {
        Entry<T> entry = this.values.get(idx);
        entry.parent = -1;
        entry.value = value;
    }

}
