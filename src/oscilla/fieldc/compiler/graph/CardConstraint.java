package oscilla.fieldc.compiler.graph;

import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

import oscilla.fieldc.compiler.types.InstanceTerm;

public sealed interface CardConstraint {

    public enum Kind {
        CLAMP_ONE,      // ClampOne
        FORCE_MANY,     // ForceMany
        EQUAL,          // Equal
        ZIP_BROADCAST   // ZipBroadcast
    }

    Kind kind();

    List<Integer> nodes();

    ConstraintOrigin origin();

    public static record ClampOne(
        int node, ConstraintOrigin origin
    ) implements CardConstraint {
        @Override public Kind kind() { return Kind.CLAMP_ONE; }
        @Override public List<Integer> nodes() { return List.of(this.node); }
    }

    public static record ForceMany(
        int node, InstanceTerm term, ConstraintOrigin origin
    ) implements CardConstraint {
        @Override public Kind kind() { return Kind.FORCE_MANY; }
        @Override public List<Integer> nodes() { return List.of(this.node); }
    }

    public static record Equal(
        int a, int b, ConstraintOrigin origin
    ) implements CardConstraint {
        public Equal {
            if(a >= b) {
                throw new IllegalArgumentException(
                    "Equality constraints need to be normalized so that"
                        + " a < b (got " + a + ", " + b + ")!"
                );
            }
        }
        @Override public Kind kind() { return Kind.EQUAL; }
        @Override public List<Integer> nodes() { return List.of(this.a, this.b); }
    }

    public static record ZipBroadcast(
        List<Integer> nodes, ConstraintOrigin origin
    ) implements CardConstraint {
        public ZipBroadcast {
            nodes = List.copyOf(new TreeSet<>(nodes));
            if(nodes.isEmpty()) {
                throw new IllegalArgumentException(
                    "A broadcast constraint needs at least one node!"
                );
            }
        }
        @Override public Kind kind() { return Kind.ZIP_BROADCAST; }
    }

    public static CardConstraint equal(
        int a, int b, ConstraintOrigin origin
    ) {
        return a < b
            ? new Equal(a, b, origin)
            : new Equal(b, a, origin);
    }

    private static int compareNodes(List<Integer> a, List<Integer> b) {
        int shared = Math.min(a.size(), b.size());
        for(int i = 0; i < shared; i += 1) {
            int c = Integer.compare(a.get(i), b.get(i));
            if(c != 0) { return c; }
        }
        return Integer.compare(a.size(), b.size());
    }

    private static String termKey(CardConstraint c) {
        if(c instanceof ForceMany forceMany) {
            return forceMany.term().toString();
        }
        return "";
    }

    /**
     * Kind first, then the normalized node ids, then the instance term.
     * Origins do not take part in the ordering.
     */
    public static final Comparator<CardConstraint> ORDER = Comparator
        .comparing(CardConstraint::kind)
        .thenComparing(CardConstraint::nodes, CardConstraint::compareNodes)
        .thenComparing(CardConstraint::termKey);

}
