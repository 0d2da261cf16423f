package oscilla.fieldc.compiler;

import java.util.ArrayList;
import java.util.List;

/**
 * Union-find over dense indices, with a value attached to every class.
 * Union is by rank; on equal ranks the smaller root index becomes the
 * representative, so the same sequence of operations always picks the
 * same representatives.
 */
public class UnionFind<T> {

    private static class Entry<T> {
        private T value;
        private int parent;
        private int rank;

        private Entry(T value) {
            this.value = value;
            this.parent = -1;
            this.rank = 0;
        }
    }

    private final List<Entry<T>> values;

    public UnionFind() {
        this.values = new ArrayList<>();
    }

    public int size() {
        return this.values.size();
    }

    private void compressPath(int start, int root) {
        int currentIdx = start;
        while(true) {
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

    public T get(int idx) {
        Entry<T> entry = this.values.get(this.find(idx));
        return entry.value;
    }

    public void set(int idx, T value) {
        Entry<T> entry = this.values.get(this.find(idx));
        entry.value = value;
    }

    public boolean connected(int idxA, int idxB) {
        return this.find(idxA) == this.find(idxB);
    }

    /**
     * Merges the classes of both indices and returns the new root. The
     * value of the surviving root is kept, the other one is dropped.
     */
    public int union(int idxA, int idxB) {
        int rootA = this.find(idxA);
        int rootB = this.find(idxB);
        if(rootA == rootB) {
            return rootA;
        }
        Entry<T> entryA = this.values.get(rootA);
        Entry<T> entryB = this.values.get(rootB);
        int winner;
        int loser;
        if(entryA.rank > entryB.rank) {
            winner = rootA;
            loser = rootB;
        } else if(entryB.rank > entryA.rank) {
            winner = rootB;
            loser = rootA;
        } else {
            winner = Math.min(rootA, rootB);
            loser = Math.max(rootA, rootB);
            this.values.get(winner).rank += 1;
        }
        this.values.get(loser).parent = winner;
        return winner;
    }

}
