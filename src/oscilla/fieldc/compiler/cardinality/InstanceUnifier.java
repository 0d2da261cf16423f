package oscilla.fieldc.compiler.cardinality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import oscilla.fieldc.compiler.UnionFind;
import oscilla.fieldc.compiler.types.InstanceRef;
import oscilla.fieldc.compiler.types.InstanceTerm;
import oscilla.fieldc.compiler.types.InstanceVarId;

/**
 * Unification of instance terms. Variables are grouped with a union-find
 * whose classes may be bound to a concrete {@link InstanceRef} at most once.
 * Conflicts are returned, not thrown, so that callers can keep collecting
 * diagnostics.
 */
public class InstanceUnifier {

    public static record Conflict(InstanceRef a, InstanceRef b) {
        @Override
        public String toString() {
            return this.a + " vs " + this.b;
        }
    }

    /**
     * The outcome of a unification. {@code changed} is set when a new
     * union or a new binding was made.
     */
    public static record Unification(
        boolean changed, Optional<Conflict> conflict
    ) {

        private static final Unification UNCHANGED
            = new Unification(false, Optional.empty());
        private static final Unification CHANGED
            = new Unification(true, Optional.empty());

        private static Unification conflict(InstanceRef a, InstanceRef b) {
            return new Unification(false, Optional.of(new Conflict(a, b)));
        }

        public boolean isConflict() {
            return this.conflict.isPresent();
        }

    }

    private final UnionFind<Optional<InstanceRef>> vars;
    private final Map<InstanceVarId, Integer> indices;
    private final List<InstanceVarId> ids;

    public InstanceUnifier() {
        this.vars = new UnionFind<>();
        this.indices = new HashMap<>();
        this.ids = new ArrayList<>();
    }

    public void register(InstanceTerm term) {
        if(term instanceof InstanceTerm.Var var) {
            this.index(var.id());
        }
    }

    private int index(InstanceVarId id) {
        Integer existing = this.indices.get(id);
        if(existing != null) {
            return existing;
        }
        int idx = this.vars.add(Optional.empty());
        this.indices.put(id, idx);
        this.ids.add(id);
        return idx;
    }

    public Unification union(InstanceVarId a, InstanceVarId b) {
        int rootA = this.vars.find(this.index(a));
        int rootB = this.vars.find(this.index(b));
        if(rootA == rootB) {
            return Unification.UNCHANGED;
        }
        Optional<InstanceRef> boundA = this.vars.get(rootA);
        Optional<InstanceRef> boundB = this.vars.get(rootB);
        if(boundA.isPresent() && boundB.isPresent()
                && !boundA.get().equals(boundB.get())) {
            return Unification.conflict(boundA.get(), boundB.get());
        }
        int root = this.vars.union(rootA, rootB);
        this.vars.set(root, boundA.isPresent()? boundA : boundB);
        return Unification.CHANGED;
    }

    public Unification resolveToRef(InstanceVarId var, InstanceRef ref) {
        int idx = this.index(var);
        Optional<InstanceRef> bound = this.vars.get(idx);
        if(bound.isPresent()) {
            return bound.get().equals(ref)
                ? Unification.UNCHANGED
                : Unification.conflict(bound.get(), ref);
        }
        this.vars.set(idx, Optional.of(ref));
        return Unification.CHANGED;
    }

    public Unification unifyTerms(InstanceTerm a, InstanceTerm b) {
        if(a instanceof InstanceTerm.Inst instA) {
            if(b instanceof InstanceTerm.Inst instB) {
                return instA.ref().equals(instB.ref())
                    ? Unification.UNCHANGED
                    : Unification.conflict(instA.ref(), instB.ref());
            }
            return this.resolveToRef(
                ((InstanceTerm.Var) b).id(), instA.ref()
            );
        }
        InstanceVarId varA = ((InstanceTerm.Var) a).id();
        if(b instanceof InstanceTerm.Inst instB) {
            return this.resolveToRef(varA, instB.ref());
        }
        return this.union(varA, ((InstanceTerm.Var) b).id());
    }

    /**
     * Returns the concrete reference of a term if there is one, otherwise
     * the variable representing its class.
     */
    public InstanceTerm resolve(InstanceTerm term) {
        if(term instanceof InstanceTerm.Var var) {
            int root = this.vars.find(this.index(var.id()));
            Optional<InstanceRef> bound = this.vars.get(root);
            if(bound.isPresent()) {
                return InstanceTerm.of(bound.get());
            }
            return InstanceTerm.of(this.ids.get(root));
        }
        return term;
    }

    public Optional<InstanceRef> binding(InstanceVarId var) {
        Integer idx = this.indices.get(var);
        if(idx == null) {
            return Optional.empty();
        }
        return this.vars.get(idx);
    }

    public SortedMap<InstanceVarId, InstanceRef> resolvedVars() {
        SortedMap<InstanceVarId, InstanceRef> resolved = new TreeMap<>();
        for(InstanceVarId id: this.ids) {
            this.binding(id).ifPresent(ref -> resolved.put(id, ref));
        }
        return Collections.unmodifiableSortedMap(resolved);
    }

}
