package oscilla.fieldc.compiler;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class UnionFindTest {

    private static UnionFind<String> withValues(String... values) {
        UnionFind<String> uf = new UnionFind<>();
        for(String value: values) {
            uf.add(value);
        }
        return uf;
    }

    @Test
    void testAddAssignsDenseIndices() {
        UnionFind<String> uf = new UnionFind<>();
        Assertions.assertEquals(0, uf.add("a"));
        Assertions.assertEquals(1, uf.add("b"));
        Assertions.assertEquals(2, uf.size());
        Assertions.assertEquals("b", uf.get(1));
    }

    @Test
    void testTieBreakPrefersSmallerIndex() {
        UnionFind<String> uf = withValues("a", "b", "c", "d");
        Assertions.assertEquals(2, uf.union(3, 2));
        Assertions.assertEquals(0, uf.union(1, 0));
        // both roots have rank 1 now
        Assertions.assertEquals(0, uf.union(2, 1));
        for(int i = 0; i < 4; i += 1) {
            Assertions.assertEquals(0, uf.find(i));
        }
    }

    @Test
    void testHigherRankWins() {
        UnionFind<String> uf = withValues("a", "b", "c", "d");
        uf.union(2, 3);
        // 2 has rank 1, 0 has rank 0
        Assertions.assertEquals(2, uf.union(0, 2));
        Assertions.assertTrue(uf.connected(0, 3));
        Assertions.assertFalse(uf.connected(0, 1));
    }

    @Test
    void testValueBelongsToClass() {
        UnionFind<String> uf = withValues("a", "b", "c");
        int root = uf.union(1, 2);
        Assertions.assertEquals("b", uf.get(2));
        uf.set(2, "merged");
        Assertions.assertEquals("merged", uf.get(root));
        Assertions.assertEquals("merged", uf.get(1));
        Assertions.assertEquals("a", uf.get(0));
    }

    @Test
    void testUnionOfSameClassIsNoop() {
        UnionFind<String> uf = withValues("a", "b");
        uf.union(0, 1);
        Assertions.assertEquals(0, uf.union(1, 0));
        Assertions.assertEquals(0, uf.union(1, 1));
    }

    @Test
    void testCyclesAreHarmless() {
        UnionFind<String> uf = withValues("a", "b", "c", "d", "e");
        for(int i = 0; i < 5; i += 1) {
            uf.union(i, (i + 1) % 5);
        }
        for(int i = 0; i < 5; i += 1) {
            Assertions.assertEquals(0, uf.find(i));
        }
    }

}
